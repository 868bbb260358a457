package com.minicrm.support.source.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class SourceRepository {

    public record SourceRow(String id, String name, String identifier, Instant createdAt) {
    }

    private static final RowMapper<SourceRow> SOURCE_MAPPER = (rs, rowNum) -> new SourceRow(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("identifier"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public SourceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String create(String name, String identifier) {
        var id = "src_" + UUID.randomUUID();
        var sql = "insert into sources(id, name, identifier, created_at) values (?, ?, ?, current_timestamp)";
        jdbcTemplate.update(sql, id, name, identifier);
        return id;
    }

    public Optional<SourceRow> findById(String sourceId) {
        var sql = "select id, name, identifier, created_at from sources where id = ?";
        return jdbcTemplate.query(sql, SOURCE_MAPPER, sourceId).stream().findFirst();
    }

    public Optional<SourceRow> findByIdentifier(String identifier) {
        var sql = "select id, name, identifier, created_at from sources where identifier = ?";
        return jdbcTemplate.query(sql, SOURCE_MAPPER, identifier).stream().findFirst();
    }

    public List<SourceRow> listAll() {
        var sql = "select id, name, identifier, created_at from sources order by created_at asc, id asc";
        return jdbcTemplate.query(sql, SOURCE_MAPPER);
    }

    public int delete(String sourceId) {
        return jdbcTemplate.update("delete from sources where id = ?", sourceId);
    }
}
