package com.kingsfoil.kingsfoil.version;

/**
 * Raised when a part declares a different total part count than the one fixed by the version's first part.
 */
public class PartCountMismatchException extends IllegalStateException {

    private final int expectedParts;
    private final int declaredParts;

    public PartCountMismatchException(VersionKey key, int expectedParts, int partIndex, int declaredParts) {
        super(VersionConstants.MSG_PART_COUNT_MISMATCH.formatted(key, expectedParts, partIndex, declaredParts));
        this.expectedParts = expectedParts;
        this.declaredParts = declaredParts;
    }

    public int getExpectedParts() {
        return expectedParts;
    }

    public int getDeclaredParts() {
        return declaredParts;
    }
}
