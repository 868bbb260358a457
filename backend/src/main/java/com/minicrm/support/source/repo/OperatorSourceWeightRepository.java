package com.minicrm.support.source.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * One weight per (operator, source) pair, enforced by {@code uq_operator_source_weights_pair}.
 */
@Repository
public class OperatorSourceWeightRepository {

    public record WeightRow(String operatorId, String operatorName, int weight) {
    }

    private final JdbcTemplate jdbcTemplate;

    public OperatorSourceWeightRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Sets the weight for the pair in one statement, inserting the row when there is none. A concurrent
     * insert of the same pair ends up as an update instead of a unique violation.
     */
    public void upsert(String operatorId, String sourceId, int weight) {
        var id = "w_" + UUID.randomUUID();
        var pg = """
                insert into operator_source_weights(id, operator_id, source_id, weight, created_at)
                values (?, ?, ?, ?, now())
                on conflict (operator_id, source_id)
                do update set weight = excluded.weight
                """;
        try {
            jdbcTemplate.update(pg, id, operatorId, sourceId, weight);
        } catch (BadSqlGrammarException ex) {
            upsertH2(id, operatorId, sourceId, weight);
        }
    }

    private void upsertH2(String id, String operatorId, String sourceId, int weight) {
        var h2 = """
                merge into operator_source_weights(id, operator_id, source_id, weight) key(operator_id, source_id)
                values (?, ?, ?, ?)
                """;
        try {
            jdbcTemplate.update(h2, id, operatorId, sourceId, weight);
        } catch (DuplicateKeyException dup) {
            // the pair was inserted between merge's lookup and insert; the row now exists, so merge updates it
            jdbcTemplate.update(h2, id, operatorId, sourceId, weight);
        }
    }

    public List<WeightRow> listForSource(String sourceId) {
        var sql = """
                select w.operator_id, o.name as operator_name, w.weight
                from operator_source_weights w
                join operators o on o.id = w.operator_id
                where w.source_id = ?
                order by w.created_at asc, w.operator_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new WeightRow(
                rs.getString("operator_id"),
                rs.getString("operator_name"),
                rs.getInt("weight")
        ), sourceId);
    }

    public int countForPair(String operatorId, String sourceId) {
        var sql = "select count(1) from operator_source_weights where operator_id = ? and source_id = ?";
        Integer n = jdbcTemplate.queryForObject(sql, Integer.class, operatorId, sourceId);
        return n == null ? 0 : n;
    }
}
