package com.kingsfoil.kingsfoil.source;

import com.kingsfoil.kingsfoil.version.VersionConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Creates and evolves the versioned data table of a source and the view that exposes its current version.
 */
@Component
public class SourceSchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SourceSchemaManager.class);

    private final JdbcTemplate jdbcTemplate;

    public SourceSchemaManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Ensures the data table exists with every canonical column of the config, then rebuilds the
     * current view so it picks up added columns. Several sources may share one table.
     */
    public void ensureDataTable(DataSourceConfig config) {
        String tableName = sanitizeIdentifier(config.tableName(), "table");
        StringBuilder ddl = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(tableName).append(" (")
                .append(SourceConstants.COLUMN_ROW_ID).append(" BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, ")
                .append(SourceConstants.COLUMN_DATA_VERSION_ID).append(" BIGINT NOT NULL, ")
                .append(SourceConstants.COLUMN_PART_INDEX).append(" INT NOT NULL, ")
                .append(SourceConstants.COLUMN_LINE_NUMBER).append(" INT NOT NULL");
        for (CanonicalColumn column : config.columns()) {
            ddl.append(", ").append(sanitizeIdentifier(column.name(), "column"))
                    .append(' ').append(column.type().sqlDefinition());
        }
        if (!config.uniqueKey().isEmpty()) {
            ddl.append(", CONSTRAINT uq_").append(tableName).append(" UNIQUE (")
                    .append(SourceConstants.COLUMN_DATA_VERSION_ID);
            for (String keyColumn : config.uniqueKey()) {
                ddl.append(", ").append(sanitizeIdentifier(keyColumn, "column"));
            }
            ddl.append(')');
        }
        ddl.append(')');
        jdbcTemplate.execute(ddl.toString());

        List<String> existing = getTableColumns(tableName);
        for (CanonicalColumn column : config.columns()) {
            if (!existing.contains(column.name())) {
                log.info("Adding column {} {} to {}", column.name(), column.type(), tableName);
                jdbcTemplate.execute("ALTER TABLE " + tableName + " ADD COLUMN " + column.name()
                        + " " + column.type().sqlDefinition());
            }
        }

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_" + tableName + "_version ON "
                + tableName + " (" + SourceConstants.COLUMN_DATA_VERSION_ID + ")");
        ensureCurrentView(tableName);
    }

    public static String currentViewName(String tableName) {
        return tableName + SourceConstants.CURRENT_VIEW_SUFFIX;
    }

    /**
     * Columns of the data table in database order, lower-cased.
     */
    public List<String> getTableColumns(String tableName) {
        return jdbcTemplate.query(
                "SELECT * FROM " + sanitizeIdentifier(tableName, "table") + " WHERE 1 = 0",
                rs -> {
                    ResultSetMetaData meta = rs.getMetaData();
                    List<String> columns = new ArrayList<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        columns.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
                    }
                    return columns;
                }
        );
    }

    private void ensureCurrentView(String tableName) {
        jdbcTemplate.execute("CREATE OR REPLACE VIEW " + currentViewName(tableName) + " AS "
                + "SELECT v.source_code, v.variant, v.version_label, d.* FROM " + tableName + " d "
                + "JOIN " + VersionConstants.VERSION_TABLE + " v ON v.version_id = d." + SourceConstants.COLUMN_DATA_VERSION_ID
                + " WHERE v.is_current = TRUE");
    }

    static String sanitizeIdentifier(String identifier, String kind) {
        if (identifier == null
                || identifier.length() > SourceConstants.MAX_IDENTIFIER_LENGTH
                || !identifier.matches(SourceConstants.VALID_IDENTIFIER_REGEX)) {
            throw new IllegalArgumentException(SourceConstants.MSG_INVALID_IDENTIFIER.formatted(kind, identifier));
        }
        return identifier;
    }
}
