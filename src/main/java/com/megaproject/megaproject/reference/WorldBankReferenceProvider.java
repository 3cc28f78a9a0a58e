package com.megaproject.megaproject.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.megaproject.megaproject.staging.StagingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls indicators from the World Bank v2 API, all countries, one page at a time.
 *
 * <p>Every response is a two-element array: paging metadata first, observations second.
 */
@Component
public class WorldBankReferenceProvider implements ReferenceDataProvider {

    private static final Logger log = LoggerFactory.getLogger(WorldBankReferenceProvider.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final StagingProperties stagingProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public WorldBankReferenceProvider(StagingProperties stagingProperties, ObjectMapper objectMapper) {
        this.stagingProperties = stagingProperties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<ReferenceRecord> fetch(ReferenceSeries series) {
        List<ReferenceRecord> records = new ArrayList<>();
        int page = 1;
        int pages;
        do {
            WorldBankPage result = parsePage(request(series, page));
            records.addAll(result.records());
            pages = result.pages();
            page++;
        } while (page <= pages);
        log.info("Fetched {} observations of {} from World Bank", records.size(), series.indicatorCode());
        return records;
    }

    private String request(ReferenceSeries series, int page) {
        String url = "%scountry/all/indicator/%s?format=json&per_page=%d&page=%d".formatted(
                stagingProperties.getWorldBankBaseUrl(),
                series.indicatorCode(),
                stagingProperties.getWorldBankPageSize(),
                page);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IllegalStateException("World Bank request %s failed with status %d"
                        .formatted(url, response.statusCode()));
            }
            return response.body();
        } catch (IOException ex) {
            throw new IllegalStateException("World Bank request failed: " + url, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling World Bank: " + url, ex);
        }
    }

    WorldBankPage parsePage(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new IllegalStateException("Unreadable World Bank response", ex);
        }
        if (root == null || !root.isArray() || root.size() < 2) {
            // an error payload has only the metadata element
            throw new IllegalStateException("Unexpected World Bank response: " + abbreviate(body));
        }

        int pages = root.get(0).path("pages").asInt(1);
        List<ReferenceRecord> records = new ArrayList<>();
        int skipped = 0;
        JsonNode data = root.get(1);
        if (data != null && data.isArray()) {
            for (JsonNode entry : data) {
                JsonNode value = entry.path("value");
                String country = entry.path("countryiso3code").asText("");
                String year = entry.path("date").asText("");
                if (value.isMissingNode() || value.isNull() || country.length() != 3 || !year.matches("\\d{4}")) {
                    skipped++;
                    continue;
                }
                records.add(new ReferenceRecord(country, Integer.parseInt(year), value.asDouble()));
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} World Bank entries without a value, ISO3 country or year", skipped);
        }
        return new WorldBankPage(records, pages);
    }

    private static String abbreviate(String body) {
        return body == null || body.length() <= 200 ? String.valueOf(body) : body.substring(0, 200) + "...";
    }

    record WorldBankPage(List<ReferenceRecord> records, int pages) {
    }
}
