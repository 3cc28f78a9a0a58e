package com.megaproject.megaproject.raw;

import com.megaproject.megaproject.common.SchemaValidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns an uploaded CSV file into column names and row mappings. The first line is the header row.
 */
@Component
public class RawCsvReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public RawTableData read(byte[] content) {
        if (content == null || content.length == 0) {
            throw new SchemaValidationException("CSV file is empty");
        }

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .setIgnoreEmptyLines(true)
                .build();

        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {
            List<String> headerNames = parser.getHeaderNames();
            if (headerNames.isEmpty()) {
                throw new SchemaValidationException("CSV header row not found");
            }
            List<String> columns = sanitizeHeaders(headerNames);

            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), record.isSet(i) ? record.get(i) : null);
                }
                rows.add(row);
            }
            return new RawTableData(columns, rows);
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new SchemaValidationException("Failed to parse CSV file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Normalizes headers to snake_case column names. Two headers that normalize to the same name are rejected.
     */
    List<String> sanitizeHeaders(List<String> headers) {
        List<String> sanitized = new ArrayList<>(headers.size());
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i) == null ? "" : headers.get(i);
            if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
                header = header.substring(1);
            }
            String value = header.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
            value = value.replaceAll("_+", "_");
            value = value.replaceAll("^_+|_+$", "");
            if (value.isEmpty()) {
                throw new SchemaValidationException("CSV column %d has an empty header".formatted(i + 1));
            }
            if (!seen.add(value)) {
                throw new SchemaValidationException("Duplicate column name: " + value);
            }
            sanitized.add(value);
        }
        return sanitized;
    }
}
