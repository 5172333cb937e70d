package com.kingsfoil.kingsfoil.ingest;

import java.util.List;
import java.util.Set;

/**
 * Shared constants for file ingestion flow.
 */
public final class IngestConstants {

    private IngestConstants() {
    }

    public static final String DEFAULT_SOURCE_CONFIG_PATTERN = "sources/*.json";
    public static final int DEFAULT_MAX_HEADER_SCAN_ROWS = 15;
    public static final double DEFAULT_EMPTY_ROW_THRESHOLD = 0.8;
    public static final int DEFAULT_INSERT_BATCH_SIZE = 1000;
    public static final int DEFAULT_PARALLEL_TRANSFORM_MIN_ROWS = 5000;
    public static final String DEFAULT_PART_WAIT_TIMEOUT = "PT24H";
    public static final String DEFAULT_EXPIRY_CRON = "0 */15 * * * *";
    public static final List<String> DEFAULT_ALLOWED_EXTENSIONS = List.of("csv", "txt", "dat", "xlsx", "xls", "zip");

    public static final String FILE_EXT_ZIP = "zip";
    public static final String FILE_EXT_CSV = "csv";
    public static final String FILE_EXT_XLSX = "xlsx";
    public static final String FILE_EXT_XLS = "xls";
    public static final Set<String> DELIMITED_EXTENSIONS = Set.of("csv", "txt", "dat");

    public static final int DELIMITER_SAMPLE_CHARS = 4096;
    public static final Set<String> NULL_TOKENS = Set.of("NULL", "N/A", "NAN");
    public static final String STAR = "*";
    public static final int MAX_MESSAGE_LENGTH = 1000;
    public static final int MAX_VERSION_LABEL_LENGTH = 50;

    public static final String MSG_FILE_EMPTY = "Uploaded file %s is empty";
    public static final String MSG_UNSUPPORTED_EXTENSION = "File type '.%s' not supported. Allowed: %s";
    public static final String MSG_NO_EXTENSION = "File %s has no extension";
    public static final String MSG_ZIP_READ_FAILED = "Unable to read ZIP content of %s";
    public static final String MSG_ZIP_NO_DATA_FILE = "No readable data file found inside ZIP %s";
    public static final String MSG_WORKBOOK_READ_FAILED = "Unable to read workbook %s";
    public static final String MSG_CSV_PARSE_FAILED = "Unable to parse delimited content of %s";
    public static final String MSG_NO_ROWS = "File %s contains no rows";
    public static final String MSG_NO_DATA_ROWS = "No data rows found after header row in %s";
    public static final String MSG_MISSING_REQUIRED_HEADERS =
            "Could not find a header row in the first %d rows of %s. Missing required columns: %s";
    public static final String MSG_INVALID_VARIANT = "Variant %s is not valid for source %s. Allowed: %s";
    public static final String MSG_VARIANT_NOT_SUPPORTED = "Source %s has no variants but %s was given";
    public static final String MSG_INVALID_VERSION_LABEL = "Version label must be 1-50 characters";
}
