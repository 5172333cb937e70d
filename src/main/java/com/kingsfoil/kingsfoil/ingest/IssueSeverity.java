package com.kingsfoil.kingsfoil.ingest;

public enum IssueSeverity {
    /** Recorded only; the row or file is kept. */
    WARNING,
    /** The row is dropped and counted as rejected; ingestion continues. */
    REJECTED,
    /** The file or the whole version is aborted. */
    FATAL
}
