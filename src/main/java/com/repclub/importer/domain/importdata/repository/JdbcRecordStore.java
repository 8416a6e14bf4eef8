package com.repclub.importer.domain.importdata.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link RecordStore} over plain SQL. Table and column names come from module
 * configs and are restricted to lower-case identifiers before being inlined.
 */
@Repository
@RequiredArgsConstructor
public class JdbcRecordStore implements RecordStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final Pattern UUID_SHAPE =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final String ID_COLUMN = "id";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public Optional<Map<String, Object>> findOne(String tableName,
                                                 String tenantColumn,
                                                 String tenantId,
                                                 Map<String, Object> keys) {
        MapSqlParameterSource params = new MapSqlParameterSource("tenant", tenantParameter(tenantId));
        StringBuilder sql = new StringBuilder("SELECT * FROM ")
                .append(identifier(tableName))
                .append(" WHERE ").append(identifier(tenantColumn)).append(" = :tenant");

        int index = 0;
        for (Map.Entry<String, Object> key : keys.entrySet()) {
            String param = "k" + index++;
            sql.append(" AND ").append(identifier(key.getKey())).append(" = :").append(param);
            params.addValue(param, key.getValue());
        }
        sql.append(" LIMIT 2");

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql.toString(), params);
        if (rows.size() > 1) {
            throw new IncorrectResultSizeDataAccessException(
                    "More than one " + tableName + " record matches " + keys.keySet(), 1, rows.size());
        }
        return rows.stream().findFirst();
    }

    @Override
    public void insert(String tableName, Map<String, Object> values) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");

        int index = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String param = "v" + index++;
            columns.add(identifier(entry.getKey()));
            placeholders.add(":" + param);
            params.addValue(param, entry.getValue());
        }

        String sql = "INSERT INTO " + identifier(tableName) + " (" + columns + ") VALUES (" + placeholders + ")";
        jdbcTemplate.update(sql, params);
    }

    @Override
    public void update(String tableName, Object id, Map<String, Object> values) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", id);
        StringJoiner assignments = new StringJoiner(", ");

        int index = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (ID_COLUMN.equals(entry.getKey())) {
                continue;
            }
            String param = "v" + index++;
            assignments.add(identifier(entry.getKey()) + " = :" + param);
            params.addValue(param, entry.getValue());
        }

        String sql = "UPDATE " + identifier(tableName) + " SET " + assignments + " WHERE " + ID_COLUMN + " = :id";
        int updated = jdbcTemplate.update(sql, params);
        if (updated != 1) {
            throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(sql, 1, updated);
        }
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal table or column name: " + name);
        }
        return name;
    }

    private static Object tenantParameter(String tenantId) {
        if (tenantId != null && UUID_SHAPE.matcher(tenantId).matches()) {
            return UUID.fromString(tenantId);
        }
        return tenantId;
    }
}
