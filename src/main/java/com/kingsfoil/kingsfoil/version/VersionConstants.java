package com.kingsfoil.kingsfoil.version;

/**
 * Shared constants for version lifecycle bookkeeping.
 */
public final class VersionConstants {

    private VersionConstants() {
    }

    public static final String VERSION_TABLE = "meta_data_version";
    public static final String VERSION_PART_TABLE = "meta_data_version_part";
    public static final String INGEST_ISSUE_TABLE = "meta_ingest_issue";

    public static final String SINGLE_VARIANT = "";
    public static final int LOCK_STRIPES = 64;
    public static final int MAX_ERROR_MESSAGE_LENGTH = 2000;
    public static final int MAX_FILE_NAME_LENGTH = 500;
    public static final int MAX_ISSUE_COLUMN_LENGTH = 100;

    public static final String MSG_VERSION_CLOSED = "Version %s is %s and accepts no further parts";
    public static final String MSG_VERSION_NOT_FOUND = "Version %s not found";
    public static final String MSG_VERSION_NOT_COMPLETED = "Version %s is %s; only completed versions can be promoted";
    public static final String MSG_PART_COUNT_MISMATCH = "Version %s expects %d parts but part %d declared %d";
    public static final String MSG_PART_INDEX_OUT_OF_RANGE = "Part index %d is outside 1..%d for version %s";
    public static final String MSG_CROSS_PART_DUPLICATE = "Unique key %s appears in part %d line %d and part %d line %d";
    public static final String MSG_ASSEMBLY_LOST =
            "Parts %s of version %s were received before a restart and are no longer held; re-ingest under a new label";
    public static final String MSG_ASSEMBLY_TIMEOUT = "No part received for version %s since %s; expected %d parts, got %s";
    public static final String MSG_DUPLICATE_FILE =
            "File %s for version %s is identical to a file already stored in completed version %s";
    public static final String MSG_CURRENT_INVARIANT = "Promotion of %s left %d current versions for %s/%s";
}
