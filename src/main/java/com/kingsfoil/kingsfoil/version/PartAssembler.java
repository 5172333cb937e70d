package com.kingsfoil.kingsfoil.version;

import com.kingsfoil.kingsfoil.ingest.IssueKind;
import com.kingsfoil.kingsfoil.ingest.Row;
import com.kingsfoil.kingsfoil.ingest.RowReference;
import com.kingsfoil.kingsfoil.ingest.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the accepted rows of every part received so far for versions that are still assembling.
 *
 * <p>Received parts form a set keyed by part index: resubmitting an index replaces its rows and
 * completeness is set equality against {@code 1..expected}, so out-of-order and repeated arrivals
 * need no counter.
 */
@Component
public class PartAssembler {

    private final Map<VersionKey, Assembly> assemblies = new ConcurrentHashMap<>();

    public AssemblyStatus submitPart(VersionKey key, int partIndex, List<Row> rows, int expectedPartCount) {
        if (expectedPartCount < 1) {
            throw new IllegalArgumentException("Expected part count must be at least 1 for " + key);
        }
        Assembly assembly = assemblies.computeIfAbsent(key, ignored -> new Assembly(expectedPartCount));
        synchronized (assembly) {
            if (assembly.expectedParts != expectedPartCount) {
                throw new PartCountMismatchException(key, assembly.expectedParts, partIndex, expectedPartCount);
            }
            if (partIndex < 1 || partIndex > assembly.expectedParts) {
                throw new IllegalArgumentException(
                        VersionConstants.MSG_PART_INDEX_OUT_OF_RANGE.formatted(partIndex, assembly.expectedParts, key));
            }
            assembly.parts.put(partIndex, List.copyOf(rows));
            return assembly.status();
        }
    }

    public Optional<AssemblyStatus> status(VersionKey key) {
        Assembly assembly = assemblies.get(key);
        if (assembly == null) {
            return Optional.empty();
        }
        synchronized (assembly) {
            return Optional.of(assembly.status());
        }
    }

    public boolean isTracking(VersionKey key) {
        return assemblies.containsKey(key);
    }

    /**
     * All rows of the version in part order, then file order.
     */
    public List<Row> assembledRows(VersionKey key) {
        Assembly assembly = assemblies.get(key);
        if (assembly == null) {
            return List.of();
        }
        synchronized (assembly) {
            List<Row> rows = new ArrayList<>();
            for (List<Row> partRows : assembly.parts.values()) {
                rows.addAll(partRows);
            }
            return rows;
        }
    }

    /**
     * Reports every row whose unique-key tuple was already seen earlier in the version. The first
     * occurrence wins, so the result does not depend on the order parts arrived in.
     */
    public List<ValidationIssue> findCrossPartDuplicates(VersionKey key, List<String> uniqueKey) {
        if (uniqueKey.isEmpty()) {
            return List.of();
        }
        Map<List<Object>, RowReference> seen = new HashMap<>();
        List<ValidationIssue> duplicates = new ArrayList<>();
        for (Row row : assembledRows(key)) {
            List<Object> tuple = row.keyOf(uniqueKey);
            RowReference first = seen.putIfAbsent(tuple, row.reference());
            if (first != null) {
                RowReference second = row.reference();
                duplicates.add(ValidationIssue.fatal(
                        second,
                        String.join(",", uniqueKey),
                        IssueKind.CROSS_PART_DUPLICATE,
                        VersionConstants.MSG_CROSS_PART_DUPLICATE.formatted(
                                tuple, first.partIndex(), first.lineNumber(), second.partIndex(), second.lineNumber())
                ));
            }
        }
        return duplicates;
    }

    public void discard(VersionKey key) {
        assemblies.remove(key);
    }

    private static final class Assembly {

        private final int expectedParts;
        private final TreeMap<Integer, List<Row>> parts = new TreeMap<>();

        private Assembly(int expectedParts) {
            this.expectedParts = expectedParts;
        }

        private AssemblyStatus status() {
            List<Integer> received = new ArrayList<>(parts.keySet());
            boolean complete = received.size() == expectedParts
                    && received.get(0) == 1
                    && received.get(received.size() - 1) == expectedParts;
            return new AssemblyStatus(received.size(), expectedParts, received, complete);
        }
    }
}
