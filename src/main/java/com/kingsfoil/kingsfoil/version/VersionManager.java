package com.kingsfoil.kingsfoil.version;

import com.kingsfoil.kingsfoil.ingest.IngestProperties;
import com.kingsfoil.kingsfoil.ingest.IssueKind;
import com.kingsfoil.kingsfoil.ingest.Row;
import com.kingsfoil.kingsfoil.ingest.ValidationIssue;
import com.kingsfoil.kingsfoil.source.DataSourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the version lifecycle: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}, with the current
 * flag orthogonal to status.
 *
 * <p>Rows of an assembling version stay in the {@link PartAssembler} until every part is present.
 * Completion inserts them and flips the status in one transaction, so a version's rows are either
 * all stored or not at all. Promotion swaps the current flag in one transaction under row locks.
 */
@Service
public class VersionManager {

    private static final Logger log = LoggerFactory.getLogger(VersionManager.class);

    private final VersionRepository versionRepository;
    private final VersionedRowStore versionedRowStore;
    private final PartAssembler partAssembler;
    private final VersionLocks versionLocks;
    private final TransactionTemplate transactionTemplate;
    private final IngestProperties ingestProperties;
    private final Clock clock;

    public VersionManager(
            VersionRepository versionRepository,
            VersionedRowStore versionedRowStore,
            PartAssembler partAssembler,
            VersionLocks versionLocks,
            TransactionTemplate transactionTemplate,
            IngestProperties ingestProperties,
            Clock clock
    ) {
        this.versionRepository = versionRepository;
        this.versionedRowStore = versionedRowStore;
        this.partAssembler = partAssembler;
        this.versionLocks = versionLocks;
        this.transactionTemplate = transactionTemplate;
        this.ingestProperties = ingestProperties;
        this.clock = clock;
    }

    /**
     * Fails fast when the version already reached a terminal status.
     */
    public void checkOpen(VersionKey key) {
        Optional<DataVersion> existing = versionRepository.find(key);
        if (existing.isPresent() && existing.get().status().isTerminal()) {
            throw new VersionClosedException(key, existing.get().status());
        }
    }

    /**
     * Refuses a byte-identical copy of a file already stored in a completed version of a single-part
     * source. Multi-part sources may resend a part, so they are not checked.
     */
    public void checkDuplicateFile(DataSourceConfig config, VersionKey key, PartFile file) {
        if (config.multiPart()) {
            return;
        }
        Optional<DataVersion> existing = versionRepository.findCompletedByFileHash(key.sourceCode(), file.fileHash());
        if (existing.isPresent()) {
            log.warn("Rejected {} for {}: same content as completed version {}",
                    file.fileName(), key, existing.get().key());
            throw new DuplicateFileException(file, key, existing.get());
        }
    }

    /**
     * Adds one part's accepted rows to its version, creating the version on its first part. When the
     * last missing part arrives the version is checked for cross-part duplicates and then completed
     * or failed.
     */
    public PartSubmission submitPart(
            DataSourceConfig config,
            VersionKey key,
            int partIndex,
            Integer declaredPartCount,
            PartFile file,
            List<Row> rows,
            List<ValidationIssue> partIssues,
            int rejectedCount
    ) {
        return versionLocks.withVersionLock(key, () -> {
            long now = clock.millis();
            Optional<DataVersion> existing = versionRepository.find(key);
            DataVersion version;
            int expectedParts;

            if (existing.isPresent()) {
                version = existing.get();
                if (version.status().isTerminal()) {
                    throw new VersionClosedException(key, version.status());
                }
                expectedParts = version.partCountExpected();
                if (declaredPartCount != null && declaredPartCount != expectedParts) {
                    String message = VersionConstants.MSG_PART_COUNT_MISMATCH.formatted(
                            key, expectedParts, partIndex, declaredPartCount);
                    failVersion(version, List.of(ValidationIssue.fatal(
                            null, null, IssueKind.PART_COUNT_MISMATCH, message)), message);
                    throw new PartCountMismatchException(key, expectedParts, partIndex, declaredPartCount);
                }
                if (!partAssembler.isTracking(key) && !version.partsReceived().isEmpty()) {
                    String message = VersionConstants.MSG_ASSEMBLY_LOST.formatted(version.partsReceived(), key);
                    ValidationIssue lost = ValidationIssue.fatal(null, null, IssueKind.ASSEMBLY_LOST, message);
                    log.warn(message);
                    DataVersion failed = failVersion(version, List.of(lost), message);
                    return new PartSubmission(
                            failed,
                            new AssemblyStatus(0, expectedParts, List.of(), false),
                            List.of(lost)
                    );
                }
                requirePartIndexInRange(key, partIndex, expectedParts);
            } else {
                expectedParts = initialPartCount(config, key, partIndex, declaredPartCount);
                requirePartIndexInRange(key, partIndex, expectedParts);
                version = versionRepository.create(key, expectedParts, now);
                versionRepository.updateStatus(version.versionId(), VersionStatus.PROCESSING);
                log.info("Created version {} expecting {} part(s)", key, expectedParts);
            }

            AssemblyStatus assembly = partAssembler.submitPart(key, partIndex, rows, expectedParts);
            versionRepository.recordPart(version.versionId(), partIndex, file, rows.size(), rejectedCount, now);
            versionRepository.deletePartIssues(version.versionId(), partIndex);
            versionRepository.recordIssues(version.versionId(), partIssues);
            log.info("Received part {}/{} of {} from {}: accepted={}, rejected={}",
                    partIndex, expectedParts, key, file.fileName(), rows.size(), rejectedCount);

            if (!assembly.complete()) {
                return new PartSubmission(refresh(key), assembly, List.of());
            }
            return complete(config, key, version, assembly);
        });
    }

    /**
     * Fails an open version after a structural error in one of its parts. A first part that never
     * created a version leaves nothing behind.
     */
    public Optional<DataVersion> failOnStructuralError(VersionKey key, String message, List<ValidationIssue> issues) {
        return versionLocks.withVersionLock(key, () -> {
            Optional<DataVersion> existing = versionRepository.find(key);
            if (existing.isEmpty() || existing.get().status().isTerminal()) {
                return Optional.empty();
            }
            log.warn("Failing version {} after structural error: {}", key, message);
            return Optional.of(failVersion(existing.get(), issues, message));
        });
    }

    /**
     * Makes a completed version the single current version of its source/variant. Promoting the
     * version that is already current changes nothing.
     */
    public DataVersion promote(VersionKey key) {
        return versionLocks.withVariantLock(key.sourceCode(), key.variant(), () ->
                transactionTemplate.execute(status -> {
                    DataVersion version = versionRepository.findForUpdate(key)
                            .orElseThrow(() -> new VersionNotFoundException(key));
                    if (version.status() != VersionStatus.COMPLETED) {
                        throw new VersionNotCompletedException(key, version.status());
                    }
                    if (version.current()) {
                        return version;
                    }

                    versionRepository.lockVariant(key.sourceCode(), key.variant());
                    versionRepository.clearCurrent(key.sourceCode(), key.variant());
                    versionRepository.markCurrent(version.versionId());
                    int current = versionRepository.countCurrent(key.sourceCode(), key.variant());
                    if (current != 1) {
                        throw new IllegalStateException(VersionConstants.MSG_CURRENT_INVARIANT.formatted(
                                key, current, key.sourceCode(), key.variant()));
                    }
                    log.info("Promoted version {} to current", key);
                    return refresh(key);
                }));
    }

    public List<DataVersion> list(String sourceCode, String variant) {
        return versionRepository.list(sourceCode, variant);
    }

    public DataVersion get(VersionKey key) {
        return versionRepository.find(key).orElseThrow(() -> new VersionNotFoundException(key));
    }

    public List<ValidationIssue> issues(VersionKey key) {
        return versionRepository.findIssues(get(key).versionId());
    }

    /**
     * Fails every open version that has not received a part within the configured wait timeout.
     */
    public List<DataVersion> expireStaleVersions() {
        long now = clock.millis();
        long cutoff = now - ingestProperties.getPartWaitTimeout().toMillis();
        List<DataVersion> expired = new ArrayList<>();
        for (DataVersion candidate : versionRepository.findOpenOlderThan(cutoff)) {
            DataVersion result = versionLocks.withVersionLock(candidate.key(), () -> {
                Optional<DataVersion> current = versionRepository.find(candidate.key());
                if (current.isEmpty() || current.get().status().isTerminal()) {
                    return null;
                }
                DataVersion version = current.get();
                long lastActivity = version.lastPartAt() != null ? version.lastPartAt() : version.createdAt();
                if (lastActivity >= cutoff) {
                    return null;
                }
                String message = VersionConstants.MSG_ASSEMBLY_TIMEOUT.formatted(
                        version.key(),
                        Instant.ofEpochMilli(lastActivity),
                        version.partCountExpected(),
                        version.partsReceived()
                );
                log.warn(message);
                return failVersion(version, List.of(ValidationIssue.fatal(
                        null, null, IssueKind.ASSEMBLY_TIMEOUT, message)), message);
            });
            if (result != null) {
                expired.add(result);
            }
        }
        return expired;
    }

    private PartSubmission complete(DataSourceConfig config, VersionKey key, DataVersion version, AssemblyStatus assembly) {
        List<ValidationIssue> duplicates = partAssembler.findCrossPartDuplicates(key, config.uniqueKey());
        if (!duplicates.isEmpty()) {
            String message = "%d unique-key tuple(s) of %s repeat across parts".formatted(duplicates.size(), key);
            log.warn(message);
            return new PartSubmission(failVersion(version, duplicates, message), assembly, duplicates);
        }

        List<Row> rows = partAssembler.assembledRows(key);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                versionedRowStore.insertRows(config, version.versionId(), rows);
                versionRepository.markCompleted(version.versionId(), rows.size(), clock.millis());
            });
        } catch (RuntimeException ex) {
            log.error("Storing rows of version {} failed", key, ex);
            failVersion(version, List.of(), ex.getMessage());
            throw ex;
        }
        partAssembler.discard(key);
        log.info("Completed version {} with {} rows", key, rows.size());
        return new PartSubmission(refresh(key), assembly, List.of());
    }

    private DataVersion failVersion(DataVersion version, List<ValidationIssue> issues, String message) {
        versionRepository.markFailed(version.versionId(), message);
        versionRepository.recordIssues(version.versionId(), issues);
        partAssembler.discard(version.key());
        return refresh(version.key());
    }

    private DataVersion refresh(VersionKey key) {
        return versionRepository.find(key).orElseThrow(() -> new VersionNotFoundException(key));
    }

    private static int initialPartCount(DataSourceConfig config, VersionKey key, int partIndex, Integer declaredPartCount) {
        if (!config.multiPart()) {
            if (declaredPartCount != null && declaredPartCount != 1) {
                throw new PartCountMismatchException(key, 1, partIndex, declaredPartCount);
            }
            return 1;
        }
        if (declaredPartCount != null) {
            if (declaredPartCount < 1) {
                throw new IllegalArgumentException("Declared part count must be at least 1 for " + key);
            }
            return declaredPartCount;
        }
        if (config.defaultPartCount() != null) {
            return config.defaultPartCount();
        }
        throw new IllegalArgumentException(
                "Source " + config.sourceCode() + " is multi-part; declare the part count of version " + key);
    }

    private static void requirePartIndexInRange(VersionKey key, int partIndex, int expectedParts) {
        if (partIndex < 1 || partIndex > expectedParts) {
            throw new IllegalArgumentException(
                    VersionConstants.MSG_PART_INDEX_OUT_OF_RANGE.formatted(partIndex, expectedParts, key));
        }
    }
}
