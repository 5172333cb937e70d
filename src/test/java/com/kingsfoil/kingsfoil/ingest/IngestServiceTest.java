package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.source.UnknownSourceException;
import com.kingsfoil.kingsfoil.version.DataVersion;
import com.kingsfoil.kingsfoil.version.DuplicateFileException;
import com.kingsfoil.kingsfoil.version.PartAssembler;
import com.kingsfoil.kingsfoil.version.PartCountMismatchException;
import com.kingsfoil.kingsfoil.version.VersionClosedException;
import com.kingsfoil.kingsfoil.version.VersionKey;
import com.kingsfoil.kingsfoil.version.VersionLocks;
import com.kingsfoil.kingsfoil.version.VersionManager;
import com.kingsfoil.kingsfoil.version.VersionNotCompletedException;
import com.kingsfoil.kingsfoil.version.VersionNotFoundException;
import com.kingsfoil.kingsfoil.version.VersionRepository;
import com.kingsfoil.kingsfoil.version.VersionStatus;
import com.kingsfoil.kingsfoil.version.VersionedRowStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class IngestServiceTest {

    private static final String PTP_HEADER = String.join("\t",
            "Column 1", "Column 2", "*=in existence prior to 1996", "Effective Date", "Deletion Date",
            "Modifier", "PTP Edit Rationale");

    @Autowired
    private IngestService ingestService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PartAssembler partAssembler;

    @Autowired
    private VersionedRowStore versionedRowStore;

    @Autowired
    private VersionRepository versionRepository;

    @Autowired
    private VersionLocks versionLocks;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private IngestProperties ingestProperties;

    @Autowired
    private Clock clock;

    @Test
    void shouldIngestSinglePartSourceAndServeItAfterPromotion() {
        String label = label("rvu");
        IngestResult result = ingestRvu(label,
                "HCPCS,MOD,DESCRIPTION,WORK RVU",
                "99213,,Office visit est,1.5",
                "99214,26,Office visit est,1.92",
                "99215,,Office visit est,abc");

        assertEquals(VersionStatus.COMPLETED, result.status());
        assertEquals(2, result.acceptedRows());
        assertEquals(1, result.report().rejectedRows());
        assertEquals(Map.of("work_rvu", 1), result.report().rejectionsByKindAndColumn().get(IssueKind.TYPE_ERROR));
        assertEquals(2, result.version().recordCount());
        assertFalse(result.version().current());

        DataVersion promoted = ingestService.promoteVersion("PFS_RVU", null, label);
        assertTrue(promoted.current());

        List<Map<String, Object>> current = ingestService.readCurrentRows("pfs_rvu", null);
        assertEquals(2, current.size());
        Map<String, Object> first = current.get(0);
        assertEquals(label, first.get("version_label"));
        assertEquals("99213", first.get("hcpcs_code"));
        assertNull(first.get("modifier"));
        assertEquals(0, new BigDecimal("1.5").compareTo((BigDecimal) first.get("work_rvu")));
    }

    @Test
    void shouldKeepFirstRowOfDuplicateKeyWithinFile() {
        String label = label("rvu-dup");
        IngestResult result = ingestRvu(label,
                "HCPCS,MOD,WORK RVU",
                "99213,,1.5",
                "99213,,1.6");

        assertEquals(1, result.acceptedRows());
        assertEquals(1, result.version().recordCount());
        assertTrue(result.issues().stream().anyMatch(issue -> issue.kind() == IssueKind.DUPLICATE_KEY
                && issue.rowReference().lineNumber() == 3));
    }

    @Test
    void shouldRejectDecimalsOutsideColumnBoundsAsRowErrors() {
        IngestResult result = ingestRvu(label("rvu-bounds"),
                "HCPCS,MOD,WORK RVU",
                "99213,,1.5",
                "99214,,1234567890123.5",
                "99215,,0.1234567");

        assertEquals(VersionStatus.COMPLETED, result.status());
        assertEquals(1, result.acceptedRows());
        assertEquals(2, result.report().rejectedRows());
        assertEquals(Map.of("work_rvu", 2), result.report().rejectionsByKindAndColumn().get(IssueKind.TYPE_ERROR));
        assertEquals(1, countRows("cms_pfs_rvu", result.version().versionId()));
    }

    @Test
    void shouldCompareCodesCaseInsensitively() {
        IngestResult result = ingestRvu(label("rvu-case"),
                "HCPCS,MOD,WORK RVU",
                "g0439,,1.5",
                "G0439,,1.6");

        assertEquals(1, result.acceptedRows());
        assertTrue(result.issues().stream().anyMatch(issue -> issue.kind() == IssueKind.DUPLICATE_KEY
                && issue.rowReference().lineNumber() == 3));
        assertEquals("G0439", jdbcTemplate.queryForObject(
                "SELECT hcpcs_code FROM cms_pfs_rvu WHERE data_version_id = ?", String.class,
                result.version().versionId()));
    }

    @Test
    void shouldRefuseFileAlreadyStoredInCompletedVersion() {
        String original = label("rvu-orig");
        String copy = label("rvu-copy");
        String[] lines = {"HCPCS,DESCRIPTION", "99381," + original};
        IngestResult stored = ingestRvu(original, lines);

        DuplicateFileException ex = assertThrows(DuplicateFileException.class, () -> ingestRvu(copy, lines));

        assertEquals(original, ex.getExistingVersion().versionLabel());
        assertTrue(ingestService.listVersions("PFS_RVU", null).stream()
                .noneMatch(version -> version.versionLabel().equals(copy)));
        Map<String, Object> part = jdbcTemplate.queryForMap(
                "SELECT file_hash, file_size_bytes FROM meta_data_version_part WHERE version_id = ?",
                stored.version().versionId());
        assertEquals(64, ((String) part.get("file_hash")).length());
        assertEquals(String.join("\n", lines).getBytes(StandardCharsets.UTF_8).length,
                ((Number) part.get("file_size_bytes")).intValue());
    }

    @Test
    void shouldAllowIdenticalPartResubmissionForMultiPartSource() {
        String label = label("ptp-same");
        ingestPtp("HOSPITAL", label, 1, 2, ptpRows("S", 2));
        IngestResult again = ingestPtp("HOSPITAL", label, 1, 2, ptpRows("S", 2));

        assertEquals(VersionStatus.PROCESSING, again.status());
        assertEquals(List.of(1), again.version().partsReceived());
    }

    @Test
    void shouldTruncateLongFileNamesAndIssueColumns() {
        String fileName = "x".repeat(600) + ".csv";
        IngestResult result = ingestService.ingestFile("PFS_RVU", null, label("rvu-long"), null, null, fileName,
                "HCPCS,UNKNOWN EXTRA\n99385,x".getBytes(StandardCharsets.UTF_8));
        long versionId = result.version().versionId();

        assertEquals(VersionStatus.COMPLETED, result.status());
        String storedName = jdbcTemplate.queryForObject(
                "SELECT file_name FROM meta_data_version_part WHERE version_id = ?", String.class, versionId);
        assertEquals(500, storedName.length());

        versionRepository.recordIssues(versionId, List.of(ValidationIssue.fatal(
                null, "c".repeat(300), IssueKind.CROSS_PART_DUPLICATE, "wide key")));
        List<ValidationIssue> issues = versionRepository.findIssues(versionId);
        assertEquals(500, issues.get(0).rowReference().fileName().length());
        assertEquals(100, issues.get(issues.size() - 1).column().length());
    }

    @Test
    void shouldCompleteVersionExactlyOnceWhenPartsArriveConcurrently() throws Exception {
        String label = label("ptp-race");
        int parts = 4;
        ExecutorService executor = Executors.newFixedThreadPool(parts);
        CountDownLatch start = new CountDownLatch(1);
        int completions = 0;
        try {
            List<Future<IngestResult>> futures = new ArrayList<>();
            for (int i = 1; i <= parts; i++) {
                int part = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return ingestPtp("HOSPITAL", label, part, parts, ptpRows("R" + part, 3));
                }));
            }
            start.countDown();
            for (Future<IngestResult> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).status() == VersionStatus.COMPLETED) {
                    completions++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, completions);
        List<DataVersion> matching = ingestService.listVersions("NCCI_PTP", "HOSPITAL").stream()
                .filter(version -> version.versionLabel().equals(label))
                .toList();
        assertEquals(1, matching.size());
        assertEquals(VersionStatus.COMPLETED, matching.get(0).status());
        assertEquals(12, matching.get(0).recordCount());
        assertEquals(12, countRows("cms_ncci_ptp", matching.get(0).versionId()));
    }

    @Test
    void shouldLeaveOneCurrentVersionWhenPromotionsRace() throws Exception {
        String first = label("ptp-promote-a");
        String second = label("ptp-promote-b");
        ingestPtp("PRACTITIONER", first, 1, 1, ptpRows("P", 2));
        ingestPtp("PRACTITIONER", second, 1, 1, ptpRows("Q", 2));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DataVersion>> futures = new ArrayList<>();
            for (String label : List.of(first, second)) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return ingestService.promoteVersion("NCCI_PTP", "PRACTITIONER", label);
                }));
            }
            start.countDown();
            for (Future<DataVersion> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, versionRepository.countCurrent("NCCI_PTP", "PRACTITIONER"));
        assertTrue(version("NCCI_PTP", "PRACTITIONER", first).current()
                ^ version("NCCI_PTP", "PRACTITIONER", second).current());
    }

    @Test
    void shouldReportUnmatchedHeadersAsWarnings() {
        IngestResult result = ingestRvu(label("rvu-extra"),
                "HCPCS,SURPRISE COLUMN",
                "99213,x");

        assertEquals(VersionStatus.COMPLETED, result.status());
        assertEquals(1, result.report().warningCount());
        assertEquals(IssueKind.UNMATCHED_HEADER, result.issues().get(0).kind());
    }

    @Test
    void shouldCompleteMultiPartVersionOnlyWhenLastPartArrives() {
        String label = label("ptp");
        IngestResult first = ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 5));

        assertEquals(VersionStatus.PROCESSING, first.status());
        assertEquals(1, first.assembly().partsReceived());
        assertEquals(0, countRows("cms_ncci_ptp", first.version().versionId()));

        IngestResult second = ingestPtp("HOSPITAL", label, 2, 2, ptpRows("B", 5));

        assertEquals(VersionStatus.COMPLETED, second.status());
        assertEquals(10, second.version().recordCount());
        assertEquals(List.of(1, 2), second.version().partsReceived());
        assertEquals(10, countRows("cms_ncci_ptp", second.version().versionId()));
    }

    @Test
    void shouldAcceptPartsOutOfOrderWithDefaultPartCount() {
        String label = label("ptp-default");
        assertEquals(VersionStatus.PROCESSING, ingestPtp("HOSPITAL", label, 4, null, ptpRows("D", 1)).status());
        assertEquals(VersionStatus.PROCESSING, ingestPtp("HOSPITAL", label, 2, null, ptpRows("B", 1)).status());
        assertEquals(VersionStatus.PROCESSING, ingestPtp("HOSPITAL", label, 1, null, ptpRows("A", 1)).status());
        IngestResult last = ingestPtp("HOSPITAL", label, 3, null, ptpRows("C", 1));

        assertEquals(VersionStatus.COMPLETED, last.status());
        assertEquals(4, last.version().partCountExpected());
        assertEquals(4, last.version().recordCount());
    }

    @Test
    void shouldReplaceRowsOfResubmittedPart() {
        String label = label("ptp-resubmit");
        ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 5));
        IngestResult again = ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 3));
        assertEquals(1, again.assembly().partsReceived());

        IngestResult done = ingestPtp("HOSPITAL", label, 2, 2, ptpRows("B", 5));

        assertEquals(VersionStatus.COMPLETED, done.status());
        assertEquals(8, done.version().recordCount());
    }

    @Test
    void shouldFailWholeVersionOnDuplicateKeyAcrossParts() {
        String label = label("ptp-dup");
        ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 2));
        IngestResult result = ingestPtp("HOSPITAL", label, 2, 2, ptpRows("A", 1));

        assertEquals(VersionStatus.FAILED, result.status());
        assertTrue(result.report().fatal());
        assertEquals(0, countRows("cms_ncci_ptp", result.version().versionId()));

        List<ValidationIssue> issues = ingestService.getVersionIssues("NCCI_PTP", "hospital", label);
        assertTrue(issues.stream().anyMatch(issue -> issue.kind() == IssueKind.CROSS_PART_DUPLICATE));

        assertThrows(VersionClosedException.class,
                () -> ingestPtp("HOSPITAL", label, 2, 2, ptpRows("B", 1)));
    }

    @Test
    void shouldFailVersionWhenPartCountChanges() {
        String label = label("ptp-count");
        ingestPtp("PRACTITIONER", label, 1, 2, ptpRows("A", 1));

        assertThrows(PartCountMismatchException.class,
                () -> ingestPtp("PRACTITIONER", label, 2, 3, ptpRows("B", 1)));
        assertEquals(VersionStatus.FAILED, version("NCCI_PTP", "PRACTITIONER", label).status());
    }

    @Test
    void shouldRejectPartIndexOutsideDeclaredRange() {
        assertThrows(IllegalArgumentException.class,
                () -> ingestPtp("HOSPITAL", label("ptp-range"), 3, 2, ptpRows("A", 1)));
    }

    @Test
    void shouldRefuseToPromoteIncompleteOrUnknownVersion() {
        String label = label("ptp-open");
        ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 1));

        assertThrows(VersionNotCompletedException.class,
                () -> ingestService.promoteVersion("NCCI_PTP", "HOSPITAL", label));
        assertThrows(VersionNotFoundException.class,
                () -> ingestService.promoteVersion("NCCI_PTP", "HOSPITAL", label("never")));
    }

    @Test
    void shouldRejectFurtherPartsForCompletedVersion() {
        String label = label("rvu-closed");
        ingestRvu(label, "HCPCS", "99213");

        assertThrows(VersionClosedException.class, () -> ingestRvu(label, "HCPCS", "99214"));
        assertEquals(1, version("PFS_RVU", "", label).recordCount());
    }

    @Test
    void shouldApplySourceSpecificSpecialValues() {
        String label = label("ptp-special");
        IngestResult result = ingestPtp("PRACTITIONER", label, 1, 1, List.of(
                "0001U\t0002U\t*\t20200101\t*\t1\tMisuse of column two code",
                "0001U\t0003U\t\t1/1/2020\t20231231\t0 = not allowed\tMutually exclusive"));

        assertEquals(VersionStatus.COMPLETED, result.status());
        long versionId = result.version().versionId();
        String sql = "SELECT %s FROM cms_ncci_ptp WHERE data_version_id = ? AND component_code = ?";

        assertNull(jdbcTemplate.queryForObject(sql.formatted("deletion_date"), LocalDate.class, versionId, "0002U"));
        assertEquals(Boolean.TRUE, jdbcTemplate.queryForObject(sql.formatted("prior_1996_flag"), Boolean.class, versionId, "0002U"));
        assertEquals(1L, jdbcTemplate.queryForObject(sql.formatted("modifier_indicator"), Long.class, versionId, "0002U"));
        assertEquals(LocalDate.of(2023, 12, 31),
                jdbcTemplate.queryForObject(sql.formatted("deletion_date"), LocalDate.class, versionId, "0003U"));
        assertEquals(Boolean.FALSE, jdbcTemplate.queryForObject(sql.formatted("prior_1996_flag"), Boolean.class, versionId, "0003U"));
        assertEquals(0L, jdbcTemplate.queryForObject(sql.formatted("modifier_indicator"), Long.class, versionId, "0003U"));
    }

    @Test
    void shouldStoreZeroUnitsAndDeriveAdjudicationIndicator() {
        String csv = String.join("\n",
                "HCPCS/CPT Code,Practitioner Services MUE Values,MUE Adjudication Indicator,MUE Rationale",
                "A0021,0,2 Date of Service Edit: Policy,Nature of Service/Procedure",
                "A0080,600,1 Line Edit,Clinical: Data");

        IngestResult result = ingestService.ingestFile("NCCI_MUE_PRAC", null, label("mue"), null, null,
                "mue.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertEquals(VersionStatus.COMPLETED, result.status());
        long versionId = result.version().versionId();
        Map<String, Object> zero = jdbcTemplate.queryForMap(
                "SELECT mue_value, mai_id FROM cms_ncci_mue WHERE data_version_id = ? AND hcpcs_code = ?",
                versionId, "A0021");
        assertEquals(0L, ((Number) zero.get("mue_value")).longValue());
        assertEquals(2L, ((Number) zero.get("mai_id")).longValue());
    }

    @Test
    void shouldRejectFileWithoutRequiredHeadersAndCreateNoVersion() {
        String label = label("rvu-noheader");

        StructuralException ex = assertThrows(StructuralException.class,
                () -> ingestRvu(label, "FOO,BAR", "1,2"));

        assertTrue(ex.getIssues().stream().anyMatch(issue -> issue.kind() == IssueKind.MISSING_REQUIRED_HEADER
                && "hcpcs_code".equals(issue.column())));
        assertTrue(ingestService.listVersions("PFS_RVU", null).stream()
                .noneMatch(version -> version.versionLabel().equals(label)));
    }

    @Test
    void shouldFailOpenVersionWhenLaterPartIsUnreadable() {
        String label = label("ptp-broken");
        ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 2));

        assertThrows(StructuralException.class, () -> ingestService.ingestFile("NCCI_PTP", "HOSPITAL", label, 2, 2,
                "part2.txt", "Column 1\tSomething else\n0001U\tx\n".getBytes(StandardCharsets.UTF_8)));

        DataVersion failed = version("NCCI_PTP", "HOSPITAL", label);
        assertEquals(VersionStatus.FAILED, failed.status());
        assertFalse(partAssembler.isTracking(failed.key()));
    }

    @Test
    void shouldRejectFileWithHeaderButNoData() {
        assertThrows(StructuralException.class, () -> ingestRvu(label("rvu-empty"), "HCPCS,MOD", ",", ""));
    }

    @Test
    void shouldKeepPreviousCurrentVersionWhenPromotionFails() {
        String oldLabel = label("rvu-old");
        String newLabel = label("rvu-new");
        ingestRvu(oldLabel, "HCPCS,WORK RVU", "99213,1.0");
        ingestRvu(newLabel, "HCPCS,WORK RVU", "99213,2.0");
        ingestService.promoteVersion("PFS_RVU", null, oldLabel);

        VersionRepository failingRepository = new VersionRepository(jdbcTemplate) {
            @Override
            public void markCurrent(long versionId) {
                throw new IllegalStateException("simulated failure while flagging version " + versionId);
            }
        };
        VersionManager failingManager = new VersionManager(failingRepository, versionedRowStore, partAssembler,
                versionLocks, transactionTemplate, ingestProperties, clock);

        assertThrows(IllegalStateException.class,
                () -> failingManager.promote(new VersionKey("PFS_RVU", "", newLabel)));

        assertTrue(version("PFS_RVU", "", oldLabel).current());
        assertFalse(version("PFS_RVU", "", newLabel).current());
        List<Map<String, Object>> current = ingestService.readCurrentRows("PFS_RVU", null);
        assertTrue(current.stream().allMatch(row -> oldLabel.equals(row.get("version_label"))));
    }

    @Test
    void shouldSwapCurrentVersionOnPromotionAndTolerateRepeats() {
        String oldLabel = label("rvu-a");
        String newLabel = label("rvu-b");
        ingestRvu(oldLabel, "HCPCS", "99203");
        ingestRvu(newLabel, "HCPCS", "99204");

        ingestService.promoteVersion("PFS_RVU", null, oldLabel);
        ingestService.promoteVersion("PFS_RVU", null, newLabel);
        DataVersion repeated = ingestService.promoteVersion("PFS_RVU", null, newLabel);

        assertTrue(repeated.current());
        assertFalse(version("PFS_RVU", "", oldLabel).current());
        long currentCount = ingestService.listVersions("PFS_RVU", null).stream().filter(DataVersion::current).count();
        assertEquals(1, currentCount);
    }

    @Test
    void shouldExpireVersionsThatStopReceivingParts() {
        String label = label("ptp-stale");
        IngestResult first = ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 1));
        jdbcTemplate.update("UPDATE meta_data_version SET created_at = 0, last_part_at = 0 WHERE version_id = ?",
                first.version().versionId());

        List<DataVersion> expired = ingestService.expireStaleVersions();

        assertTrue(expired.stream().anyMatch(version -> version.versionLabel().equals(label)));
        assertEquals(VersionStatus.FAILED, version("NCCI_PTP", "HOSPITAL", label).status());
        assertTrue(ingestService.getVersionIssues("NCCI_PTP", "HOSPITAL", label).stream()
                .anyMatch(issue -> issue.kind() == IssueKind.ASSEMBLY_TIMEOUT));
    }

    @Test
    void shouldFailVersionWhoseHeldPartsWereLost() {
        String label = label("ptp-lost");
        IngestResult first = ingestPtp("HOSPITAL", label, 1, 2, ptpRows("A", 1));
        partAssembler.discard(first.version().key());

        IngestResult second = ingestPtp("HOSPITAL", label, 2, 2, ptpRows("B", 1));

        assertEquals(VersionStatus.FAILED, second.status());
        assertTrue(second.issues().stream().anyMatch(issue -> issue.kind() == IssueKind.ASSEMBLY_LOST));
    }

    @Test
    void shouldValidateSourceAndVariant() {
        assertThrows(UnknownSourceException.class, () -> ingestService.listVersions("NOT_A_SOURCE", null));
        assertThrows(IllegalArgumentException.class, () -> ingestService.listVersions("NCCI_PTP", null));
        assertThrows(IllegalArgumentException.class, () -> ingestService.listVersions("NCCI_PTP", "DME"));
        assertThrows(IllegalArgumentException.class, () -> ingestService.listVersions("PFS_RVU", "HOSPITAL"));
        assertThrows(IllegalArgumentException.class, () -> ingestRvu("", "HCPCS", "99213"));
    }

    private IngestResult ingestRvu(String label, String... lines) {
        return ingestService.ingestFile("PFS_RVU", null, label, null, null, "rvu.csv",
                String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    private IngestResult ingestPtp(String variant, String label, int part, Integer partCount, List<String> rows) {
        List<String> lines = new ArrayList<>();
        lines.add("CPT codes and descriptions only are copyright American Medical Association");
        lines.add(PTP_HEADER);
        lines.addAll(rows);
        return ingestService.ingestFile("NCCI_PTP", variant, label, part, partCount, "ptp_part" + part + ".txt",
                String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> ptpRows(String prefix, int count) {
        List<String> rows = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            rows.add("0001" + prefix + "\t" + String.format("%04d", i) + prefix
                    + "\t\t20200101\t*\t1\tMisuse of column two code");
        }
        return rows;
    }

    private DataVersion version(String sourceCode, String variant, String label) {
        return ingestService.listVersions(sourceCode, variant).stream()
                .filter(version -> version.versionLabel().equals(label))
                .findFirst()
                .orElseThrow();
    }

    private int countRows(String table, long versionId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE data_version_id = ?", Integer.class, versionId);
        return count == null ? 0 : count;
    }

    private static String label(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
