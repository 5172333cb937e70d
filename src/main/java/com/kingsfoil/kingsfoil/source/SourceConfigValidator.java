package com.kingsfoil.kingsfoil.source;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks a source configuration must pass before it is registered.
 */
final class SourceConfigValidator {

    private SourceConfigValidator() {
    }

    static void validate(DataSourceConfig config) {
        if (config.sourceCode() == null || !config.sourceCode().matches(SourceConstants.VALID_SOURCE_CODE_REGEX)) {
            throw new IllegalArgumentException(
                    SourceConstants.MSG_INVALID_IDENTIFIER.formatted("source code", config.sourceCode()));
        }
        requireIdentifier("table", config.tableName());
        if (config.columns().isEmpty()) {
            throw new IllegalArgumentException("Source " + config.sourceCode() + " declares no columns");
        }

        Set<String> columnNames = new HashSet<>();
        Map<String, String> aliasOwners = new HashMap<>();
        for (CanonicalColumn column : config.columns()) {
            requireIdentifier("column", column.name());
            if (SourceConstants.SYSTEM_COLUMNS.contains(column.name())) {
                throw new IllegalArgumentException(
                        SourceConstants.MSG_RESERVED_COLUMN.formatted(column.name(), config.sourceCode()));
            }
            if (!columnNames.add(column.name())) {
                throw new IllegalArgumentException(
                        "Duplicate column " + column.name() + " in source " + config.sourceCode());
            }
            for (String alias : column.aliases()) {
                String normalized = HeaderNormalizer.normalize(alias);
                if (normalized.isEmpty()) {
                    continue;
                }
                String owner = aliasOwners.putIfAbsent(normalized, column.name());
                if (owner != null && !owner.equals(column.name())) {
                    throw new IllegalArgumentException(SourceConstants.MSG_ALIAS_CONFLICT.formatted(
                            alias, owner, column.name(), config.sourceCode()));
                }
            }
        }

        for (String keyColumn : config.uniqueKey()) {
            requireKnownColumn(config, columnNames, "Unique key", keyColumn);
        }
        Set<String> ruleColumns = new HashSet<>();
        for (SpecialValueRule rule : config.specialValueRules()) {
            requireKnownColumn(config, columnNames, "Special-value rule", rule.column());
            if (!ruleColumns.add(rule.column())) {
                throw new IllegalArgumentException("Column " + rule.column() + " has more than one special-value rule");
            }
            if (rule.kind() == null) {
                throw new IllegalArgumentException("Special-value rule on " + rule.column() + " has no kind");
            }
            if (rule.kind() == SpecialValueKind.PATTERN_EXTRACT) {
                requirePattern(rule.pattern(), rule.column());
            }
            if (rule.kind() == SpecialValueKind.UPPERCASE_CODE
                    && config.column(rule.column()).map(CanonicalColumn::type).orElse(null) != SemanticType.TEXT) {
                throw new IllegalArgumentException("Upper-case rule on " + rule.column() + " needs a TEXT column");
            }
        }
        for (DerivedColumnRule rule : config.derivedColumns()) {
            requireKnownColumn(config, columnNames, "Derived-column rule", rule.column());
            if (rule.kind() == null || rule.sources().isEmpty()) {
                throw new IllegalArgumentException("Derived-column rule on " + rule.column() + " is incomplete");
            }
            for (String sourceColumn : rule.sources()) {
                requireKnownColumn(config, columnNames, "Derived-column rule", sourceColumn);
            }
            if (rule.kind() == DerivationKind.PATTERN_EXTRACT) {
                requirePattern(rule.pattern(), rule.column());
            }
        }
        if (config.defaultPartCount() != null && config.defaultPartCount() < 1) {
            throw new IllegalArgumentException("Default part count must be at least 1 for " + config.sourceCode());
        }
    }

    private static void requireIdentifier(String kind, String name) {
        SourceSchemaManager.sanitizeIdentifier(name, kind);
    }

    private static void requireKnownColumn(DataSourceConfig config, Set<String> columnNames, String owner, String column) {
        if (!columnNames.contains(column)) {
            throw new IllegalArgumentException(
                    SourceConstants.MSG_UNKNOWN_COLUMN.formatted(owner, column, config.sourceCode()));
        }
    }

    private static void requirePattern(String pattern, String column) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern rule on " + column + " has no pattern");
        }
        Pattern compiled = Pattern.compile(pattern);
        if (compiled.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("Pattern rule on " + column + " needs a capturing group");
        }
    }
}
