package com.kingsfoil.kingsfoil.source;

import java.util.List;

/**
 * Computes a canonical column from other, already resolved columns of the same row.
 * The target is only filled when the file did not supply a value for it.
 */
public record DerivedColumnRule(
        String column,
        DerivationKind kind,
        List<String> sources,
        String separator,
        String pattern,
        List<String> allowedValues
) {

    public DerivedColumnRule {
        sources = sources == null ? List.of() : List.copyOf(sources);
        separator = separator == null ? "" : separator;
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }
}
