package com.kingsfoil.kingsfoil.version;

import com.kingsfoil.kingsfoil.ingest.IngestConstants;
import com.kingsfoil.kingsfoil.ingest.IssueKind;
import com.kingsfoil.kingsfoil.ingest.IssueSeverity;
import com.kingsfoil.kingsfoil.ingest.RowReference;
import com.kingsfoil.kingsfoil.ingest.ValidationIssue;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to version metadata, part bookkeeping and the per-version issue log.
 */
@Repository
public class VersionRepository {

    private static final String VERSION_COLUMNS = "version_id, source_code, variant, version_label, status, "
            + "record_count, part_count_expected, is_current, created_at, last_part_at, imported_at, error_message";

    private final JdbcTemplate jdbcTemplate;

    public VersionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        ensureVersionTable();
        ensureVersionPartTable();
        ensureIssueTable();
    }

    public Optional<DataVersion> find(VersionKey key) {
        return findOne("SELECT " + VERSION_COLUMNS + " FROM " + VersionConstants.VERSION_TABLE
                + " WHERE source_code = ? AND variant = ? AND version_label = ?", key);
    }

    /**
     * Reads the version row with a row lock held until the surrounding transaction ends.
     */
    public Optional<DataVersion> findForUpdate(VersionKey key) {
        return findOne("SELECT " + VERSION_COLUMNS + " FROM " + VersionConstants.VERSION_TABLE
                + " WHERE source_code = ? AND variant = ? AND version_label = ? FOR UPDATE", key);
    }

    public DataVersion create(VersionKey key, int partCountExpected, long now) {
        jdbcTemplate.update(
                "INSERT INTO " + VersionConstants.VERSION_TABLE
                        + " (source_code, variant, version_label, status, record_count, part_count_expected,"
                        + " is_current, created_at) VALUES (?, ?, ?, ?, 0, ?, FALSE, ?)",
                key.sourceCode(),
                key.variant(),
                key.versionLabel(),
                VersionStatus.PENDING.name(),
                partCountExpected,
                now
        );
        return find(key).orElseThrow(() -> new IllegalStateException("Version row not visible after insert: " + key));
    }

    public void updateStatus(long versionId, VersionStatus status) {
        jdbcTemplate.update(
                "UPDATE " + VersionConstants.VERSION_TABLE + " SET status = ? WHERE version_id = ?",
                status.name(),
                versionId
        );
    }

    /**
     * Stores or replaces the bookkeeping row of one received part and stamps the version's last activity.
     */
    public void recordPart(long versionId, int partIndex, PartFile file, int rowCount, int rejectedCount, long now) {
        jdbcTemplate.update(
                "DELETE FROM " + VersionConstants.VERSION_PART_TABLE + " WHERE version_id = ? AND part_index = ?",
                versionId,
                partIndex
        );
        jdbcTemplate.update(
                "INSERT INTO " + VersionConstants.VERSION_PART_TABLE
                        + " (version_id, part_index, file_name, file_hash, file_size_bytes, row_count,"
                        + " rejected_count, received_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                versionId,
                partIndex,
                truncate(file.fileName(), VersionConstants.MAX_FILE_NAME_LENGTH),
                file.fileHash(),
                file.sizeBytes(),
                rowCount,
                rejectedCount,
                now
        );
        jdbcTemplate.update(
                "UPDATE " + VersionConstants.VERSION_TABLE + " SET last_part_at = ? WHERE version_id = ?",
                now,
                versionId
        );
    }

    /**
     * Finds a completed version of the source holding a part with the given content hash.
     */
    public Optional<DataVersion> findCompletedByFileHash(String sourceCode, String fileHash) {
        List<DataVersion> versions = jdbcTemplate.query(
                "SELECT " + VERSION_COLUMNS + " FROM " + VersionConstants.VERSION_TABLE
                        + " WHERE source_code = ? AND status = ? AND version_id IN (SELECT version_id FROM "
                        + VersionConstants.VERSION_PART_TABLE + " WHERE file_hash = ?) ORDER BY version_id",
                versionRowMapper(),
                sourceCode,
                VersionStatus.COMPLETED.name(),
                fileHash
        );
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(0));
    }

    public List<Integer> findPartIndexes(long versionId) {
        return jdbcTemplate.queryForList(
                "SELECT part_index FROM " + VersionConstants.VERSION_PART_TABLE
                        + " WHERE version_id = ? ORDER BY part_index",
                Integer.class,
                versionId
        );
    }

    public void markCompleted(long versionId, int recordCount, long now) {
        jdbcTemplate.update(
                "UPDATE " + VersionConstants.VERSION_TABLE
                        + " SET status = ?, record_count = ?, imported_at = ?, error_message = NULL WHERE version_id = ?",
                VersionStatus.COMPLETED.name(),
                recordCount,
                now,
                versionId
        );
    }

    public void markFailed(long versionId, String errorMessage) {
        jdbcTemplate.update(
                "UPDATE " + VersionConstants.VERSION_TABLE + " SET status = ?, error_message = ? WHERE version_id = ?",
                VersionStatus.FAILED.name(),
                truncate(errorMessage, VersionConstants.MAX_ERROR_MESSAGE_LENGTH),
                versionId
        );
    }

    public boolean hasVersions(String sourceCode) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + VersionConstants.VERSION_TABLE + " WHERE source_code = ?",
                Integer.class,
                sourceCode
        );
        return count != null && count > 0;
    }

    public List<DataVersion> list(String sourceCode, String variant) {
        return withParts(jdbcTemplate.query(
                "SELECT " + VERSION_COLUMNS + " FROM " + VersionConstants.VERSION_TABLE
                        + " WHERE source_code = ? AND variant = ? ORDER BY created_at DESC, version_id DESC",
                versionRowMapper(),
                sourceCode,
                variant
        ));
    }

    /**
     * Returns pending or processing versions whose last activity is older than the cutoff.
     */
    public List<DataVersion> findOpenOlderThan(long cutoff) {
        return withParts(jdbcTemplate.query(
                "SELECT " + VERSION_COLUMNS + " FROM " + VersionConstants.VERSION_TABLE
                        + " WHERE status IN (?, ?) AND COALESCE(last_part_at, created_at) < ?"
                        + " ORDER BY version_id",
                versionRowMapper(),
                VersionStatus.PENDING.name(),
                VersionStatus.PROCESSING.name(),
                cutoff
        ));
    }

    /**
     * Locks every version row of a source/variant pair for the rest of the surrounding transaction.
     */
    public void lockVariant(String sourceCode, String variant) {
        jdbcTemplate.queryForList(
                "SELECT version_id FROM " + VersionConstants.VERSION_TABLE
                        + " WHERE source_code = ? AND variant = ? FOR UPDATE",
                Long.class,
                sourceCode,
                variant
        );
    }

    public void clearCurrent(String sourceCode, String variant) {
        jdbcTemplate.update(
                "UPDATE " + VersionConstants.VERSION_TABLE
                        + " SET is_current = FALSE WHERE source_code = ? AND variant = ? AND is_current = TRUE",
                sourceCode,
                variant
        );
    }

    public void markCurrent(long versionId) {
        jdbcTemplate.update(
                "UPDATE " + VersionConstants.VERSION_TABLE + " SET is_current = TRUE WHERE version_id = ?",
                versionId
        );
    }

    public int countCurrent(String sourceCode, String variant) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + VersionConstants.VERSION_TABLE
                        + " WHERE source_code = ? AND variant = ? AND is_current = TRUE",
                Integer.class,
                sourceCode,
                variant
        );
        return count == null ? 0 : count;
    }

    public void recordIssues(long versionId, List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        long now = System.currentTimeMillis();
        jdbcTemplate.batchUpdate(
                "INSERT INTO " + VersionConstants.INGEST_ISSUE_TABLE
                        + " (version_id, file_name, part_index, line_number, column_name, issue_kind, severity,"
                        + " message, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                issues,
                IngestConstants.DEFAULT_INSERT_BATCH_SIZE,
                (ps, issue) -> {
                    RowReference reference = issue.rowReference();
                    ps.setLong(1, versionId);
                    if (reference == null) {
                        ps.setNull(2, Types.VARCHAR);
                        ps.setNull(3, Types.INTEGER);
                        ps.setNull(4, Types.INTEGER);
                    } else {
                        ps.setString(2, truncate(reference.fileName(), VersionConstants.MAX_FILE_NAME_LENGTH));
                        ps.setInt(3, reference.partIndex());
                        ps.setInt(4, reference.lineNumber());
                    }
                    ps.setString(5, truncate(issue.column(), VersionConstants.MAX_ISSUE_COLUMN_LENGTH));
                    ps.setString(6, issue.kind().name());
                    ps.setString(7, issue.severity().name());
                    ps.setString(8, truncate(issue.message(), IngestConstants.MAX_MESSAGE_LENGTH));
                    ps.setLong(9, now);
                }
        );
    }

    /**
     * Drops the row-level issues of one part so a resubmitted part does not leave stale entries behind.
     */
    public void deletePartIssues(long versionId, int partIndex) {
        jdbcTemplate.update(
                "DELETE FROM " + VersionConstants.INGEST_ISSUE_TABLE + " WHERE version_id = ? AND part_index = ?",
                versionId,
                partIndex
        );
    }

    public List<ValidationIssue> findIssues(long versionId) {
        return jdbcTemplate.query(
                "SELECT file_name, part_index, line_number, column_name, issue_kind, severity, message FROM "
                        + VersionConstants.INGEST_ISSUE_TABLE + " WHERE version_id = ? ORDER BY issue_id",
                (rs, rowNum) -> {
                    String fileName = rs.getString("file_name");
                    int partIndex = rs.getInt("part_index");
                    RowReference reference = rs.wasNull()
                            ? null
                            : new RowReference(fileName, partIndex, rs.getInt("line_number"));
                    return new ValidationIssue(
                            reference,
                            rs.getString("column_name"),
                            IssueKind.valueOf(rs.getString("issue_kind")),
                            IssueSeverity.valueOf(rs.getString("severity")),
                            rs.getString("message")
                    );
                },
                versionId
        );
    }

    private Optional<DataVersion> findOne(String sql, VersionKey key) {
        List<DataVersion> versions = jdbcTemplate.query(
                sql,
                versionRowMapper(),
                key.sourceCode(),
                key.variant(),
                key.versionLabel()
        );
        return versions.isEmpty() ? Optional.empty() : Optional.of(withParts(versions).get(0));
    }

    private List<DataVersion> withParts(List<DataVersion> versions) {
        List<DataVersion> result = new ArrayList<>(versions.size());
        for (DataVersion version : versions) {
            result.add(new DataVersion(
                    version.versionId(),
                    version.sourceCode(),
                    version.variant(),
                    version.versionLabel(),
                    version.status(),
                    version.recordCount(),
                    version.partCountExpected(),
                    findPartIndexes(version.versionId()),
                    version.current(),
                    version.createdAt(),
                    version.lastPartAt(),
                    version.importedAt(),
                    version.errorMessage()
            ));
        }
        return result;
    }

    private RowMapper<DataVersion> versionRowMapper() {
        return (rs, rowNum) -> new DataVersion(
                rs.getLong("version_id"),
                rs.getString("source_code"),
                rs.getString("variant"),
                rs.getString("version_label"),
                VersionStatus.valueOf(rs.getString("status")),
                rs.getInt("record_count"),
                rs.getInt("part_count_expected"),
                List.of(),
                rs.getBoolean("is_current"),
                rs.getLong("created_at"),
                nullableLong(rs, "last_part_at"),
                nullableLong(rs, "imported_at"),
                rs.getString("error_message")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private void ensureVersionTable() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + VersionConstants.VERSION_TABLE + " ("
                + "version_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "source_code VARCHAR(50) NOT NULL, "
                + "variant VARCHAR(50) NOT NULL, "
                + "version_label VARCHAR(50) NOT NULL, "
                + "status VARCHAR(20) NOT NULL, "
                + "record_count INT NOT NULL, "
                + "part_count_expected INT NOT NULL, "
                + "is_current BOOLEAN NOT NULL, "
                + "created_at BIGINT NOT NULL, "
                + "last_part_at BIGINT, "
                + "imported_at BIGINT, "
                + "error_message VARCHAR(2000), "
                + "CONSTRAINT uq_meta_data_version UNIQUE (source_code, variant, version_label)"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_meta_data_version_current ON "
                + VersionConstants.VERSION_TABLE + " (source_code, variant, is_current)");
    }

    private void ensureVersionPartTable() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + VersionConstants.VERSION_PART_TABLE + " ("
                + "version_id BIGINT NOT NULL, "
                + "part_index INT NOT NULL, "
                + "file_name VARCHAR(" + VersionConstants.MAX_FILE_NAME_LENGTH + "), "
                + "file_hash VARCHAR(64), "
                + "file_size_bytes BIGINT, "
                + "row_count INT NOT NULL, "
                + "rejected_count INT NOT NULL, "
                + "received_at BIGINT NOT NULL, "
                + "PRIMARY KEY (version_id, part_index)"
                + ")");
        jdbcTemplate.execute("ALTER TABLE " + VersionConstants.VERSION_PART_TABLE
                + " ADD COLUMN IF NOT EXISTS file_hash VARCHAR(64)");
        jdbcTemplate.execute("ALTER TABLE " + VersionConstants.VERSION_PART_TABLE
                + " ADD COLUMN IF NOT EXISTS file_size_bytes BIGINT");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_meta_data_version_part_hash ON "
                + VersionConstants.VERSION_PART_TABLE + " (file_hash)");
    }

    private void ensureIssueTable() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + VersionConstants.INGEST_ISSUE_TABLE + " ("
                + "issue_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "version_id BIGINT NOT NULL, "
                + "file_name VARCHAR(" + VersionConstants.MAX_FILE_NAME_LENGTH + "), "
                + "part_index INT, "
                + "line_number INT, "
                + "column_name VARCHAR(" + VersionConstants.MAX_ISSUE_COLUMN_LENGTH + "), "
                + "issue_kind VARCHAR(40) NOT NULL, "
                + "severity VARCHAR(20) NOT NULL, "
                + "message VARCHAR(1000), "
                + "created_at BIGINT NOT NULL"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_meta_ingest_issue_version ON "
                + VersionConstants.INGEST_ISSUE_TABLE + " (version_id)");
    }
}
