package com.minicrm.support.request.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class RequestRepository {

    public record RequestRow(
            String id,
            String userId,
            String sourceId,
            String operatorId,
            String message,
            RequestStatus status,
            Instant createdAt
    ) {
    }

    public record RequestDetailRow(
            String id,
            String userId,
            String userIdentifier,
            String sourceId,
            String sourceName,
            String operatorId,
            String operatorName,
            String message,
            RequestStatus status,
            Instant createdAt
    ) {
    }

    private static final RowMapper<RequestRow> REQUEST_MAPPER = (rs, rowNum) -> new RequestRow(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("source_id"),
            rs.getString("operator_id"),
            rs.getString("message"),
            RequestStatus.fromValue(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public RequestRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String createPending(String userId, String sourceId, String message) {
        var id = "req_" + UUID.randomUUID();
        var sql = """
                insert into requests(id, user_id, source_id, operator_id, message, status, created_at)
                values (?, ?, ?, null, ?, 'pending', current_timestamp)
                """;
        jdbcTemplate.update(sql, id, userId, sourceId, message);
        return id;
    }

    public Optional<RequestRow> findById(String requestId) {
        var sql = """
                select id, user_id, source_id, operator_id, message, status, created_at
                from requests
                where id = ?
                """;
        var list = jdbcTemplate.query(sql, REQUEST_MAPPER, requestId);
        return list.stream().findFirst();
    }

    public List<RequestRow> listAll() {
        var sql = """
                select id, user_id, source_id, operator_id, message, status, created_at
                from requests
                order by created_at asc, id asc
                """;
        return jdbcTemplate.query(sql, REQUEST_MAPPER);
    }

    public Optional<RequestDetailRow> findDetail(String requestId) {
        var sql = """
                select r.id, r.user_id, u.identifier as user_identifier,
                       r.source_id, s.name as source_name,
                       r.operator_id, o.name as operator_name,
                       r.message, r.status, r.created_at
                from requests r
                join users u on u.id = r.user_id
                join sources s on s.id = r.source_id
                left join operators o on o.id = r.operator_id
                where r.id = ?
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new RequestDetailRow(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("user_identifier"),
                rs.getString("source_id"),
                rs.getString("source_name"),
                rs.getString("operator_id"),
                rs.getString("operator_name"),
                rs.getString("message"),
                RequestStatus.fromValue(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant()
        ), requestId);
        return list.stream().findFirst();
    }

    public int assignOperator(String requestId, String operatorId) {
        var sql = """
                update requests
                set operator_id = ?, status = 'assigned'
                where id = ?
                """;
        return jdbcTemplate.update(sql, operatorId, requestId);
    }

    public int markWaiting(String requestId) {
        var sql = """
                update requests
                set operator_id = null, status = 'waiting'
                where id = ?
                """;
        return jdbcTemplate.update(sql, requestId);
    }

    public int countByOperator(String operatorId) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from requests where operator_id = ?", Integer.class, operatorId);
        return n == null ? 0 : n;
    }

    public int countBySource(String sourceId) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from requests where source_id = ?", Integer.class, sourceId);
        return n == null ? 0 : n;
    }
}
