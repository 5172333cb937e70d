package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.source.DataSourceConfig;
import com.kingsfoil.kingsfoil.source.SourceRegistry;
import com.kingsfoil.kingsfoil.version.DataVersion;
import com.kingsfoil.kingsfoil.version.PartFile;
import com.kingsfoil.kingsfoil.version.PartSubmission;
import com.kingsfoil.kingsfoil.version.VersionConstants;
import com.kingsfoil.kingsfoil.version.VersionKey;
import com.kingsfoil.kingsfoil.version.VersionManager;
import com.kingsfoil.kingsfoil.version.VersionedRowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for ingesting reference-table files and managing their versions.
 *
 * <p>A file runs through content decoding, header location and resolution, and row transformation.
 * Its accepted rows are then handed to the {@link VersionManager} as one part of the target version.
 */
@Service
public class IngestService {

    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final SourceRegistry sourceRegistry;
    private final TabularContentReader tabularContentReader;
    private final HeaderResolver headerResolver;
    private final RowTransformer rowTransformer;
    private final VersionManager versionManager;
    private final VersionedRowStore versionedRowStore;
    private final IngestProperties ingestProperties;

    public IngestService(
            SourceRegistry sourceRegistry,
            TabularContentReader tabularContentReader,
            HeaderResolver headerResolver,
            RowTransformer rowTransformer,
            VersionManager versionManager,
            VersionedRowStore versionedRowStore,
            IngestProperties ingestProperties
    ) {
        this.sourceRegistry = sourceRegistry;
        this.tabularContentReader = tabularContentReader;
        this.headerResolver = headerResolver;
        this.rowTransformer = rowTransformer;
        this.versionManager = versionManager;
        this.versionedRowStore = versionedRowStore;
        this.ingestProperties = ingestProperties;
    }

    /**
     * Ingests one file as part {@code partIndex} (default 1) of a version.
     *
     * @throws com.kingsfoil.kingsfoil.source.UnknownSourceException         when the source code is not registered
     * @throws StructuralException                                          when nothing in the file can be accepted
     * @throws com.kingsfoil.kingsfoil.version.PartCountMismatchException    when the declared part count disagrees
     * @throws com.kingsfoil.kingsfoil.version.VersionClosedException        when the version is completed or failed
     * @throws com.kingsfoil.kingsfoil.version.DuplicateFileException        when a single-part source gets a file it already stored
     */
    public IngestResult ingestFile(
            String sourceCode,
            String variant,
            String versionLabel,
            Integer partIndex,
            Integer declaredPartCount,
            String fileName,
            byte[] content
    ) {
        DataSourceConfig config = sourceRegistry.resolve(sourceCode);
        VersionKey key = versionKey(config, variant, versionLabel);
        int part = partIndex == null ? 1 : partIndex;
        versionManager.checkOpen(key);
        PartFile file = PartFile.of(fileName, content);
        versionManager.checkDuplicateFile(config, key, file);

        ValidationReporter reporter = new ValidationReporter(fileName);
        List<Row> accepted;
        try {
            accepted = readPart(config, part, fileName, content, reporter);
        } catch (StructuralException ex) {
            List<ValidationIssue> issues = ex.getIssues().isEmpty()
                    ? List.of(ValidationIssue.fatal(null, null, IssueKind.UNREADABLE_FILE, ex.getMessage()))
                    : ex.getIssues();
            log.warn("Rejected file {} for {}: {}", fileName, key, ex.getMessage());
            versionManager.failOnStructuralError(key, ex.getMessage(), issues);
            throw ex;
        }

        PartSubmission submission = versionManager.submitPart(
                config, key, part, declaredPartCount, file, accepted, reporter.issues(), reporter.rejectedRows());
        reporter.addIssues(submission.versionIssues());
        ValidationReport report = reporter.build(submission.failed());
        log.info("Ingested {} into {}: status={}, accepted={}, rejected={}, skipped={}, warnings={}",
                fileName, key, submission.version().status(), report.acceptedRows(), report.rejectedRows(),
                report.skippedRows(), report.warningCount());
        return new IngestResult(
                submission.version().status(),
                accepted.size(),
                report.issues(),
                submission.assembly(),
                report,
                submission.version()
        );
    }

    public DataVersion promoteVersion(String sourceCode, String variant, String versionLabel) {
        DataSourceConfig config = sourceRegistry.resolve(sourceCode);
        return versionManager.promote(versionKey(config, variant, versionLabel));
    }

    /**
     * Versions of a source/variant, newest first.
     */
    public List<DataVersion> listVersions(String sourceCode, String variant) {
        DataSourceConfig config = sourceRegistry.resolve(sourceCode);
        return versionManager.list(config.sourceCode(), normalizeVariant(config, variant));
    }

    public List<ValidationIssue> getVersionIssues(String sourceCode, String variant, String versionLabel) {
        DataSourceConfig config = sourceRegistry.resolve(sourceCode);
        return versionManager.issues(versionKey(config, variant, versionLabel));
    }

    public List<Map<String, Object>> readCurrentRows(String sourceCode, String variant) {
        DataSourceConfig config = sourceRegistry.resolve(sourceCode);
        return versionedRowStore.readCurrentRows(config, normalizeVariant(config, variant));
    }

    public List<DataVersion> expireStaleVersions() {
        return versionManager.expireStaleVersions();
    }

    private List<Row> readPart(
            DataSourceConfig config,
            int part,
            String fileName,
            byte[] content,
            ValidationReporter reporter
    ) {
        TabularContent tabular = tabularContentReader.read(fileName, content);
        LocatedHeader header = headerResolver.locateHeaderRow(
                tabular.rows(), config, ingestProperties.getMaxHeaderScanRows());
        HeaderResolution resolution = header.resolution();
        if (!resolution.isComplete()) {
            throw missingHeaders(config, fileName, resolution);
        }

        RowReference headerReference = new RowReference(fileName, part, header.headerRow().lineNumber());
        for (String unmatched : resolution.unmatchedHeaders()) {
            reporter.addIssue(ValidationIssue.warning(headerReference, unmatched, IssueKind.UNMATCHED_HEADER,
                    "Header '" + unmatched + "' matches no column of " + config.sourceCode()));
        }

        int width = header.headerRow().cells().size();
        List<TabularRow> dataRows = new ArrayList<>();
        for (TabularRow row : tabular.rows().subList(header.rowPosition() + 1, tabular.rows().size())) {
            if (row.blankRatio(width) >= ingestProperties.getEmptyRowThreshold()) {
                reporter.recordSkipped();
            } else {
                dataRows.add(row);
            }
        }
        if (dataRows.isEmpty()) {
            String message = IngestConstants.MSG_NO_DATA_ROWS.formatted(fileName);
            throw new StructuralException(message,
                    List.of(ValidationIssue.fatal(null, null, IssueKind.NO_DATA_ROWS, message)));
        }

        List<TransformedRow> transformed = (dataRows.size() >= ingestProperties.getParallelTransformMinRows()
                ? dataRows.parallelStream()
                : dataRows.stream())
                .map(row -> rowTransformer.transform(
                        row.cells(), resolution, config, new RowReference(fileName, part, row.lineNumber())))
                .collect(Collectors.toList());

        Map<List<Object>, RowReference> seenKeys = new HashMap<>();
        List<Row> accepted = new ArrayList<>(transformed.size());
        for (TransformedRow result : transformed) {
            reporter.recordTransformed(result);
            if (!result.accepted()) {
                continue;
            }
            Row row = result.row();
            if (!config.uniqueKey().isEmpty()) {
                List<Object> tuple = row.keyOf(config.uniqueKey());
                RowReference first = seenKeys.putIfAbsent(tuple, row.reference());
                if (first != null) {
                    reporter.reject(ValidationIssue.rejected(row.reference(), String.join(",", config.uniqueKey()),
                            IssueKind.DUPLICATE_KEY,
                            "Unique key " + tuple + " already appeared on line " + first.lineNumber()));
                    continue;
                }
            }
            accepted.add(row);
        }
        return accepted;
    }

    private StructuralException missingHeaders(DataSourceConfig config, String fileName, HeaderResolution resolution) {
        List<String> missing = resolution.missingRequiredColumns();
        String message = IngestConstants.MSG_MISSING_REQUIRED_HEADERS.formatted(
                ingestProperties.getMaxHeaderScanRows(), fileName,
                missing.isEmpty() ? "none recognized for " + config.sourceCode() : String.join(", ", missing));
        List<ValidationIssue> issues = new ArrayList<>();
        for (String column : missing) {
            issues.add(ValidationIssue.fatal(null, column, IssueKind.MISSING_REQUIRED_HEADER,
                    "No header resolves to required column " + column));
        }
        if (issues.isEmpty()) {
            issues.add(ValidationIssue.fatal(null, null, IssueKind.MISSING_REQUIRED_HEADER, message));
        }
        return new StructuralException(message, issues);
    }

    private static VersionKey versionKey(DataSourceConfig config, String variant, String versionLabel) {
        if (versionLabel == null
                || versionLabel.isBlank()
                || versionLabel.strip().length() > IngestConstants.MAX_VERSION_LABEL_LENGTH) {
            throw new IllegalArgumentException(IngestConstants.MSG_INVALID_VERSION_LABEL);
        }
        return new VersionKey(config.sourceCode(), normalizeVariant(config, variant), versionLabel.strip());
    }

    private static String normalizeVariant(DataSourceConfig config, String variant) {
        String normalized = variant == null ? "" : variant.strip().toUpperCase(Locale.ROOT);
        if (config.hasVariants()) {
            if (!config.variants().contains(normalized)) {
                throw new IllegalArgumentException(IngestConstants.MSG_INVALID_VARIANT.formatted(
                        variant, config.sourceCode(), config.variants()));
            }
            return normalized;
        }
        if (!normalized.isEmpty()) {
            throw new IllegalArgumentException(
                    IngestConstants.MSG_VARIANT_NOT_SUPPORTED.formatted(config.sourceCode(), variant));
        }
        return VersionConstants.SINGLE_VARIANT;
    }
}
