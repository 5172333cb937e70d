package com.kingsfoil.kingsfoil.source;

import java.util.Set;

/**
 * Shared constants for source configuration and the versioned data tables built from it.
 */
public final class SourceConstants {

    private SourceConstants() {
    }

    public static final String SOURCE_CONFIG_TABLE = "meta_data_source";
    public static final String DEFAULT_TABLE_PREFIX = "cms_";
    public static final String CURRENT_VIEW_SUFFIX = "_current";
    public static final String VALID_IDENTIFIER_REGEX = "[a-z_][a-z0-9_]*";
    public static final String VALID_SOURCE_CODE_REGEX = "[A-Z][A-Z0-9_]*";
    public static final int MAX_IDENTIFIER_LENGTH = 60;
    public static final int NUMERIC_PRECISION = 18;
    public static final int NUMERIC_SCALE = 6;

    public static final String COLUMN_ROW_ID = "row_id";
    public static final String COLUMN_DATA_VERSION_ID = "data_version_id";
    public static final String COLUMN_PART_INDEX = "part_index";
    public static final String COLUMN_LINE_NUMBER = "line_number";
    public static final String COLUMN_SOURCE_CODE = "source_code";
    public static final String COLUMN_VARIANT = "variant";
    public static final String COLUMN_VERSION_LABEL = "version_label";

    public static final Set<String> SYSTEM_COLUMNS = Set.of(
            COLUMN_ROW_ID, COLUMN_DATA_VERSION_ID, COLUMN_PART_INDEX, COLUMN_LINE_NUMBER,
            COLUMN_SOURCE_CODE, COLUMN_VARIANT, COLUMN_VERSION_LABEL
    );

    public static final String MSG_UNKNOWN_SOURCE = "Unknown data source: %s";
    public static final String MSG_INVALID_IDENTIFIER = "Invalid %s name: %s";
    public static final String MSG_UNKNOWN_COLUMN = "%s references unknown column %s in source %s";
    public static final String MSG_ALIAS_CONFLICT = "Header alias '%s' maps to both %s and %s in source %s";
    public static final String MSG_RESERVED_COLUMN = "Column %s in source %s collides with a system column";
    public static final String MSG_SOURCE_IMMUTABLE =
            "Source %s is referenced by existing versions; only additional aliases may be registered";
    public static final String MSG_CONFIG_READ_FAILED = "Unable to read source configuration: %s";
    public static final String MSG_CONFIG_WRITE_FAILED = "Unable to serialize source configuration: %s";
}
