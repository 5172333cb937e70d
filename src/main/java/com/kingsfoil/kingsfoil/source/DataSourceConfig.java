package com.kingsfoil.kingsfoil.source;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative description of one published reference table: its canonical columns, the raw header
 * aliases that resolve to them, uniqueness, special-value and derived-column rules, and the
 * multi-part and variant policy. Shared header resolution and row transformation are driven
 * entirely by this record, so adding a source needs no new code path.
 */
public record DataSourceConfig(
        String sourceCode,
        String sourceName,
        String tableName,
        List<CanonicalColumn> columns,
        List<String> uniqueKey,
        List<SpecialValueRule> specialValueRules,
        List<DerivedColumnRule> derivedColumns,
        boolean multiPart,
        Integer defaultPartCount,
        List<String> variants
) {

    public DataSourceConfig {
        sourceCode = sourceCode == null ? null : sourceCode.trim().toUpperCase(Locale.ROOT);
        if ((tableName == null || tableName.isBlank()) && sourceCode != null) {
            tableName = SourceConstants.DEFAULT_TABLE_PREFIX + sourceCode.toLowerCase(Locale.ROOT);
        }
        columns = columns == null ? List.of() : List.copyOf(columns);
        uniqueKey = uniqueKey == null ? List.of() : List.copyOf(uniqueKey);
        specialValueRules = specialValueRules == null ? List.of() : List.copyOf(specialValueRules);
        derivedColumns = derivedColumns == null ? List.of() : List.copyOf(derivedColumns);
        List<String> normalizedVariants = new ArrayList<>();
        if (variants != null) {
            for (String variant : variants) {
                if (variant != null && !variant.isBlank()) {
                    normalizedVariants.add(variant.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        variants = List.copyOf(normalizedVariants);
    }

    public Optional<CanonicalColumn> column(String name) {
        for (CanonicalColumn column : columns) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public Optional<SpecialValueRule> specialValueRule(String columnName) {
        for (SpecialValueRule rule : specialValueRules) {
            if (rule.column().equals(columnName)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public Set<String> derivedColumnNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DerivedColumnRule rule : derivedColumns) {
            names.add(rule.column());
        }
        return names;
    }

    public boolean uniqueKeyContains(String columnName) {
        return uniqueKey.contains(columnName);
    }

    public boolean hasVariants() {
        return !variants.isEmpty();
    }

    /**
     * Returns normalized header text to canonical column name. A column's own name acts as an alias
     * unless another column already claims that text.
     */
    public Map<String, String> aliasIndex() {
        Map<String, String> index = new LinkedHashMap<>();
        for (CanonicalColumn column : columns) {
            for (String alias : column.aliases()) {
                index.putIfAbsent(HeaderNormalizer.normalize(alias), column.name());
            }
        }
        for (CanonicalColumn column : columns) {
            index.putIfAbsent(HeaderNormalizer.normalize(column.name()), column.name());
        }
        return index;
    }

    /**
     * Returns a copy of this config with extra aliases appended to one column.
     */
    public DataSourceConfig withAdditionalAliases(String columnName, List<String> additionalAliases) {
        List<CanonicalColumn> updated = new ArrayList<>(columns.size());
        boolean found = false;
        for (CanonicalColumn column : columns) {
            if (column.name().equals(columnName)) {
                Set<String> merged = new LinkedHashSet<>(column.aliases());
                for (String alias : additionalAliases) {
                    if (alias != null && !alias.isBlank()) {
                        merged.add(alias.strip());
                    }
                }
                updated.add(column.withAliases(List.copyOf(merged)));
                found = true;
            } else {
                updated.add(column);
            }
        }
        if (!found) {
            throw new IllegalArgumentException(
                    SourceConstants.MSG_UNKNOWN_COLUMN.formatted("Alias update", columnName, sourceCode));
        }
        return new DataSourceConfig(sourceCode, sourceName, tableName, updated, uniqueKey,
                specialValueRules, derivedColumns, multiPart, defaultPartCount, variants);
    }

    /**
     * Returns a copy with every alias list emptied, used to compare the non-additive part of two configs.
     */
    DataSourceConfig withoutAliases() {
        List<CanonicalColumn> stripped = new ArrayList<>(columns.size());
        for (CanonicalColumn column : columns) {
            stripped.add(column.withAliases(List.of()));
        }
        return new DataSourceConfig(sourceCode, sourceName, tableName, stripped, uniqueKey,
                specialValueRules, derivedColumns, multiPart, defaultPartCount, variants);
    }
}
