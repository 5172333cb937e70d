package com.kingsfoil.kingsfoil.ingest;

/**
 * Header row chosen within the leading rows of a file, by position in the row list.
 */
public record LocatedHeader(int rowPosition, TabularRow headerRow, HeaderResolution resolution) {
}
