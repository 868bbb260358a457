package com.minicrm.support.stats.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Counting queries over the requests table.
 */
@Repository
public class StatsRepository {

    public record OperatorCountRow(String operatorId, String operatorName, long requestCount) {
    }

    public record SourceCountRow(String sourceId, String sourceName, long requestCount) {
    }

    public record RequestTotalsRow(long total, long assigned) {
        public long unassigned() {
            return total - assigned;
        }
    }

    private final JdbcTemplate jdbcTemplate;

    public StatsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<OperatorCountRow> countAssignedByOperator() {
        var sql = """
                select r.operator_id, o.name as operator_name, count(r.id) as request_count
                from requests r
                join operators o on o.id = r.operator_id
                group by r.operator_id, o.name
                order by request_count desc, r.operator_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new OperatorCountRow(
                rs.getString("operator_id"),
                rs.getString("operator_name"),
                rs.getLong("request_count")
        ));
    }

    public List<SourceCountRow> countBySource() {
        var sql = """
                select r.source_id, s.name as source_name, count(r.id) as request_count
                from requests r
                join sources s on s.id = r.source_id
                group by r.source_id, s.name
                order by request_count desc, r.source_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new SourceCountRow(
                rs.getString("source_id"),
                rs.getString("source_name"),
                rs.getLong("request_count")
        ));
    }

    /**
     * Total and assigned counts from a single statement, so they describe the same snapshot.
     */
    public RequestTotalsRow countTotals() {
        var sql = "select count(id) as total, count(operator_id) as assigned from requests";
        var row = jdbcTemplate.queryForObject(sql, (rs, rowNum) -> new RequestTotalsRow(
                rs.getLong("total"),
                rs.getLong("assigned")
        ));
        return row == null ? new RequestTotalsRow(0L, 0L) : row;
    }
}
