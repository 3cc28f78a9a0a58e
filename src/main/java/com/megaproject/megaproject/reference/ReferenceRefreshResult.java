package com.megaproject.megaproject.reference;

/**
 * Outcome of replacing one reference series.
 */
public record ReferenceRefreshResult(String series, String table, int loadedRecords) {
}
