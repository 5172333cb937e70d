package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.source.CanonicalColumn;
import com.kingsfoil.kingsfoil.source.DataSourceConfig;
import com.kingsfoil.kingsfoil.source.DerivationKind;
import com.kingsfoil.kingsfoil.source.DerivedColumnRule;
import com.kingsfoil.kingsfoil.source.SemanticType;
import com.kingsfoil.kingsfoil.source.SpecialValueKind;
import com.kingsfoil.kingsfoil.source.SpecialValueRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw record into a typed {@link Row}. Per column, in config order: extract the cell, apply
 * the column's special-value rule, coerce to the declared type. Derived columns are then filled and
 * required columns checked.
 *
 * <p>Stateless apart from a compiled-pattern cache, so rows may be transformed in parallel.
 */
@Component
public class RowTransformer {

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public TransformedRow transform(
            List<String> rawRecord,
            HeaderResolution resolution,
            DataSourceConfig config,
            RowReference reference
    ) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> failedColumns = new HashSet<>();

        for (CanonicalColumn column : config.columns()) {
            Integer index = resolution.indexOf(column.name());
            String raw = index == null || index >= rawRecord.size() ? null : rawRecord.get(index);
            try {
                values.put(column.name(), readCell(raw, column, config.specialValueRule(column.name())));
            } catch (SpecialValueException ex) {
                failedColumns.add(column.name());
                values.put(column.name(), null);
                issues.add(ValidationIssue.rejected(reference, column.name(), IssueKind.SPECIAL_VALUE_ERROR, ex.getMessage()));
            } catch (CoercionException ex) {
                failedColumns.add(column.name());
                values.put(column.name(), null);
                IssueKind kind = config.uniqueKeyContains(column.name()) ? IssueKind.KEY_TYPE_ERROR : IssueKind.TYPE_ERROR;
                issues.add(ValidationIssue.rejected(reference, column.name(), kind, ex.getMessage()));
            }
        }

        for (DerivedColumnRule rule : config.derivedColumns()) {
            if (values.get(rule.column()) != null || failedColumns.contains(rule.column())) {
                continue;
            }
            List<String> failedSources = new ArrayList<>();
            for (String source : rule.sources()) {
                if (failedColumns.contains(source)) {
                    failedSources.add(source);
                }
            }
            if (!failedSources.isEmpty()) {
                issues.add(ValidationIssue.warning(reference, rule.column(), IssueKind.DERIVATION_SKIPPED,
                        "Not derived because source column(s) " + failedSources + " failed validation"));
                continue;
            }
            Optional<String> derived = derive(rule, values);
            if (derived.isEmpty()) {
                Object source = values.get(rule.sources().get(0));
                if (rule.kind() == DerivationKind.PATTERN_EXTRACT && source != null) {
                    issues.add(ValidationIssue.warning(reference, rule.column(), IssueKind.SPECIAL_VALUE_ERROR,
                            "Could not derive " + rule.column() + " from '" + ValueCoercer.asText(source) + "'"));
                }
                continue;
            }
            SemanticType targetType = config.column(rule.column()).map(CanonicalColumn::type).orElse(SemanticType.TEXT);
            try {
                values.put(rule.column(), ValueCoercer.coerce(derived.get(), targetType));
            } catch (CoercionException ex) {
                issues.add(ValidationIssue.warning(reference, rule.column(), IssueKind.TYPE_ERROR,
                        "Derived value " + ex.getMessage()));
            }
        }

        for (CanonicalColumn column : config.columns()) {
            if (column.required() && values.get(column.name()) == null && !failedColumns.contains(column.name())) {
                issues.add(ValidationIssue.rejected(reference, column.name(), IssueKind.MISSING_REQUIRED_VALUE,
                        "Required column " + column.name() + " has no value"));
            }
        }

        for (ValidationIssue issue : issues) {
            if (issue.rejectsRow()) {
                return new TransformedRow(null, issues);
            }
        }
        return new TransformedRow(new Row(values, reference), issues);
    }

    /**
     * True for absent cells, blank cells and the null tokens CMS files use ({@code NULL}, {@code N/A}, {@code NaN}).
     */
    static boolean isNullToken(String raw) {
        if (raw == null || raw.isBlank()) {
            return true;
        }
        return IngestConstants.NULL_TOKENS.contains(raw.strip().toUpperCase(Locale.ROOT));
    }

    private Object readCell(String raw, CanonicalColumn column, Optional<SpecialValueRule> rule) {
        String text = raw == null ? null : raw.strip();
        SpecialValueKind kind = rule.map(SpecialValueRule::kind).orElse(null);
        if (kind == SpecialValueKind.STAR_AS_TRUE) {
            if (text == null || text.isEmpty()) {
                return Boolean.FALSE;
            }
            if (IngestConstants.STAR.equals(text)) {
                return Boolean.TRUE;
            }
        } else if (kind == SpecialValueKind.STAR_AS_NULL && IngestConstants.STAR.equals(text)) {
            return null;
        } else if (kind == SpecialValueKind.UPPERCASE_CODE && text != null) {
            text = text.toUpperCase(Locale.ROOT);
        } else if (kind == SpecialValueKind.PATTERN_EXTRACT && !isNullToken(text)) {
            String original = text;
            text = extract(rule.get().pattern(), rule.get().allowedValues(), text)
                    .orElseThrow(() -> new SpecialValueException(
                            "'" + original + "' does not match the expected format of " + column.name()));
        }
        // PRESERVE_ZERO: zero coerces like any other number and is never treated as absent.
        if (isNullToken(text)) {
            return null;
        }
        return ValueCoercer.coerce(text, column.type());
    }

    private Optional<String> derive(DerivedColumnRule rule, Map<String, Object> values) {
        return switch (rule.kind()) {
            case CONCAT -> concat(rule, values);
            case PATTERN_EXTRACT -> {
                String text = ValueCoercer.asText(values.get(rule.sources().get(0)));
                yield text == null ? Optional.empty() : extract(rule.pattern(), rule.allowedValues(), text);
            }
        };
    }

    /**
     * Joins the text of every source column; empty when any source is null.
     */
    private static Optional<String> concat(DerivedColumnRule rule, Map<String, Object> values) {
        List<String> parts = new ArrayList<>(rule.sources().size());
        for (String source : rule.sources()) {
            String text = ValueCoercer.asText(values.get(source));
            if (text == null) {
                return Optional.empty();
            }
            parts.add(text);
        }
        return Optional.of(String.join(rule.separator(), parts));
    }

    private Optional<String> extract(String pattern, List<String> allowedValues, String text) {
        Matcher matcher = patterns.computeIfAbsent(pattern, Pattern::compile).matcher(text);
        if (!matcher.find() || matcher.group(1) == null) {
            return Optional.empty();
        }
        String extracted = matcher.group(1).strip();
        if (!allowedValues.isEmpty() && !allowedValues.contains(extracted)) {
            return Optional.empty();
        }
        return Optional.of(extracted);
    }

    private static final class SpecialValueException extends RuntimeException {

        private SpecialValueException(String message) {
            super(message);
        }
    }
}
