package com.kingsfoil.kingsfoil.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized ingestion configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "kingsfoil.ingest")
public class IngestProperties {

    private String sourceConfigPattern = IngestConstants.DEFAULT_SOURCE_CONFIG_PATTERN;
    private int maxHeaderScanRows = IngestConstants.DEFAULT_MAX_HEADER_SCAN_ROWS;
    private double emptyRowThreshold = IngestConstants.DEFAULT_EMPTY_ROW_THRESHOLD;
    private int insertBatchSize = IngestConstants.DEFAULT_INSERT_BATCH_SIZE;
    private int parallelTransformMinRows = IngestConstants.DEFAULT_PARALLEL_TRANSFORM_MIN_ROWS;
    private Duration partWaitTimeout = Duration.parse(IngestConstants.DEFAULT_PART_WAIT_TIMEOUT);
    private String expiryCron = IngestConstants.DEFAULT_EXPIRY_CRON;
    private List<String> allowedExtensions = new ArrayList<>(IngestConstants.DEFAULT_ALLOWED_EXTENSIONS);

    public String getSourceConfigPattern() {
        return sourceConfigPattern;
    }

    public void setSourceConfigPattern(String sourceConfigPattern) {
        this.sourceConfigPattern = sourceConfigPattern;
    }

    public int getMaxHeaderScanRows() {
        return maxHeaderScanRows;
    }

    public void setMaxHeaderScanRows(int maxHeaderScanRows) {
        this.maxHeaderScanRows = maxHeaderScanRows;
    }

    public double getEmptyRowThreshold() {
        return emptyRowThreshold;
    }

    public void setEmptyRowThreshold(double emptyRowThreshold) {
        this.emptyRowThreshold = emptyRowThreshold;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public void setInsertBatchSize(int insertBatchSize) {
        this.insertBatchSize = insertBatchSize;
    }

    public int getParallelTransformMinRows() {
        return parallelTransformMinRows;
    }

    public void setParallelTransformMinRows(int parallelTransformMinRows) {
        this.parallelTransformMinRows = parallelTransformMinRows;
    }

    public Duration getPartWaitTimeout() {
        return partWaitTimeout;
    }

    public void setPartWaitTimeout(Duration partWaitTimeout) {
        this.partWaitTimeout = partWaitTimeout;
    }

    public String getExpiryCron() {
        return expiryCron;
    }

    public void setExpiryCron(String expiryCron) {
        this.expiryCron = expiryCron;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }
}
