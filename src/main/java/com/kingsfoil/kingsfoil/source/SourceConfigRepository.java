package com.kingsfoil.kingsfoil.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persists source configurations as JSON documents in the configuration table.
 */
@Repository
public class SourceConfigRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SourceConfigRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    public List<DataSourceConfig> findAll() {
        List<String> documents = jdbcTemplate.queryForList(
                "SELECT config_json FROM " + SourceConstants.SOURCE_CONFIG_TABLE + " ORDER BY source_code",
                String.class
        );
        List<DataSourceConfig> configs = new ArrayList<>(documents.size());
        for (String document : documents) {
            configs.add(fromJson(document));
        }
        return configs;
    }

    public Optional<DataSourceConfig> find(String sourceCode) {
        List<String> documents = jdbcTemplate.queryForList(
                "SELECT config_json FROM " + SourceConstants.SOURCE_CONFIG_TABLE + " WHERE source_code = ?",
                String.class,
                sourceCode
        );
        return documents.isEmpty() ? Optional.empty() : Optional.of(fromJson(documents.get(0)));
    }

    public void save(DataSourceConfig config) {
        String json = toJson(config);
        long now = System.currentTimeMillis();
        int updated = jdbcTemplate.update(
                "UPDATE " + SourceConstants.SOURCE_CONFIG_TABLE
                        + " SET source_name = ?, config_json = ?, updated_at = ? WHERE source_code = ?",
                config.sourceName(),
                json,
                now,
                config.sourceCode()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO " + SourceConstants.SOURCE_CONFIG_TABLE
                            + " (source_code, source_name, config_json, updated_at) VALUES (?, ?, ?, ?)",
                    config.sourceCode(),
                    config.sourceName(),
                    json,
                    now
            );
        }
    }

    private void ensureTable() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + SourceConstants.SOURCE_CONFIG_TABLE + " ("
                + "source_code VARCHAR(50) PRIMARY KEY, "
                + "source_name VARCHAR(200), "
                + "config_json VARCHAR NOT NULL, "
                + "updated_at BIGINT NOT NULL"
                + ")");
    }

    private String toJson(DataSourceConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(SourceConstants.MSG_CONFIG_WRITE_FAILED.formatted(config.sourceCode()), ex);
        }
    }

    private DataSourceConfig fromJson(String document) {
        try {
            return objectMapper.readValue(document, DataSourceConfig.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(SourceConstants.MSG_CONFIG_READ_FAILED.formatted("stored document"), ex);
        }
    }
}
