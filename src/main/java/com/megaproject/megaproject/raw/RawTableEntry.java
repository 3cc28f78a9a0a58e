package com.megaproject.megaproject.raw;

import java.time.Instant;

/**
 * Registry row: one raw table and the asset class it belongs to.
 */
public record RawTableEntry(String tableName, String assetClass, int columnCount, long rowCount, Instant registeredAt) {
}
