package com.minicrm.support.user.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public class UserRepository {

    public record UserRow(String id, String identifier, Instant createdAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public UserRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UserRow> findByIdentifier(String identifier) {
        var sql = "select id, identifier, created_at from users where identifier = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new UserRow(
                rs.getString("id"),
                rs.getString("identifier"),
                rs.getTimestamp("created_at").toInstant()
        ), identifier);
        return list.stream().findFirst();
    }

    /**
     * Inserts the identifier unless a row for it already exists, on the caller's connection. A row
     * committed concurrently by another transaction is left untouched.
     *
     * @return 1 when this call created the row, 0 otherwise
     */
    public int createIfAbsent(String identifier) {
        var id = "u_" + UUID.randomUUID();
        var pgInsert = """
                insert into users(id, identifier, created_at)
                values (?, ?, now())
                on conflict (identifier) do nothing
                """;
        try {
            return jdbcTemplate.update(pgInsert, id, identifier);
        } catch (BadSqlGrammarException ex) {
            return createIfAbsentH2(id, identifier);
        }
    }

    private int createIfAbsentH2(String id, String identifier) {
        var h2Insert = """
                insert into users(id, identifier, created_at)
                select ?, ?, current_timestamp
                where not exists (select 1 from users where identifier = ?)
                """;
        try {
            return jdbcTemplate.update(h2Insert, id, identifier, identifier);
        } catch (DuplicateKeyException dup) {
            // lost to a concurrent insert; H2 only rolls back the statement
            return 0;
        }
    }

    public int countByIdentifier(String identifier) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from users where identifier = ?", Integer.class, identifier);
        return n == null ? 0 : n;
    }
}
