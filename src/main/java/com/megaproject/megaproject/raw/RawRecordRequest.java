package com.megaproject.megaproject.raw;

import java.util.Map;

/**
 * One raw record keyed by {@code (projectId, sample)}. {@code data} maps column names to cell text.
 */
public record RawRecordRequest(String projectId, String sample, Map<String, String> data) {
}
