package com.kingsfoil.kingsfoil.version;

/**
 * Identity of a data version: source, variant (empty for sources without variants) and label.
 */
public record VersionKey(String sourceCode, String variant, String versionLabel) {

    public VersionKey {
        variant = variant == null ? VersionConstants.SINGLE_VARIANT : variant;
    }

    @Override
    public String toString() {
        return variant.isEmpty()
                ? sourceCode + "/" + versionLabel
                : sourceCode + "/" + variant + "/" + versionLabel;
    }
}
