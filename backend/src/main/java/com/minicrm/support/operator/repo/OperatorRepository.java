package com.minicrm.support.operator.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Operators table, including the load counters.
 * <p>
 * {@code current_load} is only moved through {@link #incrementLoad}, {@link #tryIncrementLoad}
 * and {@link #decrementLoad}; it is never derived by counting requests.
 */
@Repository
public class OperatorRepository {

    public record OperatorRow(
            String id,
            String name,
            boolean active,
            int maxLoadLimit,
            int currentLoad,
            Instant createdAt
    ) {
    }

    public record AvailableOperatorRow(OperatorRow operator, int weight) {
    }

    private static final RowMapper<OperatorRow> OPERATOR_MAPPER = (rs, rowNum) -> new OperatorRow(
            rs.getString("id"),
            rs.getString("name"),
            rs.getBoolean("is_active"),
            rs.getInt("max_load_limit"),
            rs.getInt("current_load"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public OperatorRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String create(String name, int maxLoadLimit) {
        var id = "op_" + UUID.randomUUID();
        var sql = """
                insert into operators(id, name, is_active, max_load_limit, current_load, created_at)
                values (?, ?, true, ?, 0, current_timestamp)
                """;
        jdbcTemplate.update(sql, id, name, maxLoadLimit);
        return id;
    }

    public Optional<OperatorRow> findById(String operatorId) {
        var sql = """
                select id, name, is_active, max_load_limit, current_load, created_at
                from operators
                where id = ?
                """;
        var list = jdbcTemplate.query(sql, OPERATOR_MAPPER, operatorId);
        return list.stream().findFirst();
    }

    public boolean exists(String operatorId) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from operators where id = ?", Integer.class, operatorId);
        return n != null && n > 0;
    }

    public List<OperatorRow> listAll() {
        var sql = """
                select id, name, is_active, max_load_limit, current_load, created_at
                from operators
                order by created_at asc, id asc
                """;
        return jdbcTemplate.query(sql, OPERATOR_MAPPER);
    }

    /**
     * Operators that may take a new request from the source: active, under capacity and weighted for it.
     * An unknown source yields an empty list.
     */
    public List<AvailableOperatorRow> listAvailableForSource(String sourceId) {
        var sql = """
                select o.id, o.name, o.is_active, o.max_load_limit, o.current_load, o.created_at, w.weight
                from operators o
                join operator_source_weights w on w.operator_id = o.id
                where w.source_id = ?
                  and o.is_active = true
                  and o.current_load < o.max_load_limit
                order by o.created_at asc, o.id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new AvailableOperatorRow(
                OPERATOR_MAPPER.mapRow(rs, rowNum),
                rs.getInt("weight")
        ), sourceId);
    }

    public int updateMaxLoadLimit(String operatorId, int maxLoadLimit) {
        var sql = "update operators set max_load_limit = ? where id = ?";
        return jdbcTemplate.update(sql, maxLoadLimit, operatorId);
    }

    public int toggleActive(String operatorId) {
        var sql = "update operators set is_active = not is_active where id = ?";
        return jdbcTemplate.update(sql, operatorId);
    }

    /**
     * Unconditional {@code current_load + 1}. Capacity is checked by the caller beforehand.
     *
     * @return rows updated, 0 when the operator does not exist
     */
    public int incrementLoad(String operatorId) {
        var sql = "update operators set current_load = current_load + 1 where id = ?";
        return jdbcTemplate.update(sql, operatorId);
    }

    /**
     * {@code current_load + 1} only while the operator is still active and under capacity.
     *
     * @return 1 when the slot was taken, 0 when the operator is missing, inactive or full
     */
    public int tryIncrementLoad(String operatorId) {
        var sql = """
                update operators
                set current_load = current_load + 1
                where id = ?
                  and is_active = true
                  and current_load < max_load_limit
                """;
        return jdbcTemplate.update(sql, operatorId);
    }

    /**
     * {@code current_load - 1}, floored at zero.
     *
     * @return rows updated, 0 when the operator does not exist
     */
    public int decrementLoad(String operatorId) {
        var sql = """
                update operators
                set current_load = case when current_load > 0 then current_load - 1 else 0 end
                where id = ?
                """;
        return jdbcTemplate.update(sql, operatorId);
    }

    public int delete(String operatorId) {
        return jdbcTemplate.update("delete from operators where id = ?", operatorId);
    }
}
