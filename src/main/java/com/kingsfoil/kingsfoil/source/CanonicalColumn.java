package com.kingsfoil.kingsfoil.source;

import java.util.List;

/**
 * One standardized column of a data source together with the raw header texts that map to it.
 */
public record CanonicalColumn(String name, SemanticType type, boolean required, List<String> aliases) {

    public CanonicalColumn {
        type = type == null ? SemanticType.TEXT : type;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    CanonicalColumn withAliases(List<String> newAliases) {
        return new CanonicalColumn(name, type, required, newAliases);
    }
}
