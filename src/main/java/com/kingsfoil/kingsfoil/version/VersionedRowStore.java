package com.kingsfoil.kingsfoil.version;

import com.kingsfoil.kingsfoil.ingest.IngestProperties;
import com.kingsfoil.kingsfoil.ingest.Row;
import com.kingsfoil.kingsfoil.source.CanonicalColumn;
import com.kingsfoil.kingsfoil.source.DataSourceConfig;
import com.kingsfoil.kingsfoil.source.SourceConstants;
import com.kingsfoil.kingsfoil.source.SourceSchemaManager;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes version-tagged rows into a source's data table and reads the current version through its view.
 */
@Repository
public class VersionedRowStore {

    private final JdbcTemplate jdbcTemplate;
    private final IngestProperties ingestProperties;

    public VersionedRowStore(JdbcTemplate jdbcTemplate, IngestProperties ingestProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.ingestProperties = ingestProperties;
    }

    /**
     * Batch-inserts rows tagged with the version id. Callers run this inside the transaction that
     * completes the version.
     */
    public int insertRows(DataSourceConfig config, long versionId, List<Row> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        List<CanonicalColumn> columns = config.columns();
        List<String> columnNames = new ArrayList<>();
        columnNames.add(SourceConstants.COLUMN_DATA_VERSION_ID);
        columnNames.add(SourceConstants.COLUMN_PART_INDEX);
        columnNames.add(SourceConstants.COLUMN_LINE_NUMBER);
        for (CanonicalColumn column : columns) {
            columnNames.add(column.name());
        }
        String placeholders = String.join(", ", Collections.nCopies(columnNames.size(), "?"));
        String sql = "INSERT INTO " + config.tableName() + " (" + String.join(", ", columnNames)
                + ") VALUES (" + placeholders + ")";

        jdbcTemplate.batchUpdate(sql, rows, ingestProperties.getInsertBatchSize(), (ps, row) -> {
            ps.setLong(1, versionId);
            ps.setInt(2, row.reference().partIndex());
            ps.setInt(3, row.reference().lineNumber());
            int index = 4;
            for (CanonicalColumn column : columns) {
                Object value = row.get(column.name());
                if (value == null) {
                    ps.setNull(index, column.type().jdbcType());
                } else if (value instanceof LocalDate date) {
                    ps.setDate(index, Date.valueOf(date));
                } else {
                    ps.setObject(index, value, column.type().jdbcType());
                }
                index++;
            }
        });
        return rows.size();
    }

    public int countRows(DataSourceConfig config, long versionId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + config.tableName() + " WHERE " + SourceConstants.COLUMN_DATA_VERSION_ID + " = ?",
                Integer.class,
                versionId
        );
        return count == null ? 0 : count;
    }

    /**
     * Reads the current version of a source/variant in one statement against the current view, so a
     * concurrent promotion is observed entirely or not at all.
     */
    public List<Map<String, Object>> readCurrentRows(DataSourceConfig config, String variant) {
        return jdbcTemplate.queryForList(
                "SELECT * FROM " + SourceSchemaManager.currentViewName(config.tableName())
                        + " WHERE " + SourceConstants.COLUMN_SOURCE_CODE + " = ? AND "
                        + SourceConstants.COLUMN_VARIANT + " = ? ORDER BY "
                        + SourceConstants.COLUMN_PART_INDEX + ", " + SourceConstants.COLUMN_LINE_NUMBER,
                config.sourceCode(),
                variant
        );
    }
}
