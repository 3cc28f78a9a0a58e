package com.megaproject.megaproject.reference;

import com.megaproject.megaproject.common.SchemaValidationException;
import com.megaproject.megaproject.table.TableResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
class ReferenceSeriesServiceTest {

    @Autowired
    private ReferenceSeriesService referenceSeriesService;

    @Autowired
    private TestReferenceDataProvider referenceDataProvider;

    @BeforeEach
    void resetSeries() {
        referenceDataProvider.clear();
        for (ReferenceSeries series : ReferenceSeries.values()) {
            referenceSeriesService.replace(series, List.of());
        }
    }

    @Test
    void shouldReplaceSeriesWholesale() {
        referenceSeriesService.replace(ReferenceSeries.EXCHANGE_RATE, List.of(
                new ReferenceRecord("usa", 2020, 1.0),
                new ReferenceRecord("GBR", 2020, 0.78),
                new ReferenceRecord("GBR", 2019, 0.78)));
        ReferenceRefreshResult result = referenceSeriesService.replace(ReferenceSeries.EXCHANGE_RATE, List.of(
                new ReferenceRecord("GBR", 2021, 0.73)));

        assertEquals(1, result.loadedRecords());
        assertEquals("exchange_rates", result.table());
        TableResponse table = referenceSeriesService.select(ReferenceSeries.EXCHANGE_RATE);
        assertEquals(List.of("country_iso3", "year", "exchange_rate"), table.columns());
        assertEquals(1, table.rows().size());
        assertEquals("GBR", table.rows().get(0).get("country_iso3"));
        assertEquals("2021", table.rows().get(0).get("year"));
    }

    @Test
    void shouldOrderRowsByCountryAndYear() {
        referenceSeriesService.replace(ReferenceSeries.GDP_DEFLATOR, List.of(
                new ReferenceRecord("usa", 2020, 100.0),
                new ReferenceRecord("GBR", 2021, 104.0),
                new ReferenceRecord("GBR", 2019, 98.0)));

        List<Map<String, String>> rows = referenceSeriesService.select(ReferenceSeries.GDP_DEFLATOR).rows();

        assertEquals(List.of("GBR", "GBR", "USA"), rows.stream().map(row -> row.get("country_iso3")).toList());
        assertEquals(List.of("2019", "2021", "2020"), rows.stream().map(row -> row.get("year")).toList());
    }

    @Test
    void shouldRejectDuplicateKeysWithoutTouchingStoredSeries() {
        referenceSeriesService.replace(ReferenceSeries.PPP_RATE, List.of(new ReferenceRecord("GBR", 2020, 0.69)));

        assertThrows(SchemaValidationException.class, () -> referenceSeriesService.replace(ReferenceSeries.PPP_RATE,
                List.of(new ReferenceRecord("GBR", 2021, 0.7), new ReferenceRecord("gbr", 2021, 0.71))));
        assertThrows(SchemaValidationException.class, () -> referenceSeriesService.replace(ReferenceSeries.PPP_RATE,
                List.of(new ReferenceRecord("GB", 2021, 0.7))));

        assertEquals(1, referenceSeriesService.select(ReferenceSeries.PPP_RATE).rows().size());
    }

    @Test
    void shouldRefreshFromProvider() {
        referenceDataProvider.enqueue(ReferenceSeries.EXCHANGE_RATE, List.of(new ReferenceRecord("USA", 2022, 1.0)));
        referenceDataProvider.enqueue(ReferenceSeries.GDP_DEFLATOR, List.of(
                new ReferenceRecord("USA", 2021, 100.0), new ReferenceRecord("USA", 2022, 107.0)));
        referenceDataProvider.enqueue(ReferenceSeries.PPP_RATE, List.of());

        List<ReferenceRefreshResult> results = referenceSeriesService.refreshAll();

        assertEquals(List.of(1, 2, 0), results.stream().map(ReferenceRefreshResult::loadedRecords).toList());
        assertEquals(2, referenceSeriesService.select(ReferenceSeries.GDP_DEFLATOR).rows().size());
        assertThrows(IllegalStateException.class, () -> referenceSeriesService.refresh(ReferenceSeries.PPP_RATE));
    }

    @Test
    void shouldResolveSeriesFromPathSegments() {
        assertEquals(ReferenceSeries.EXCHANGE_RATE, ReferenceSeries.fromPath("exchange-rates"));
        assertEquals(ReferenceSeries.GDP_DEFLATOR, ReferenceSeries.fromPath("gdp_deflators"));
        assertEquals(ReferenceSeries.PPP_RATE, ReferenceSeries.fromPath("PPP_RATE"));
        assertThrows(SchemaValidationException.class, () -> ReferenceSeries.fromPath("interest-rates"));
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        @Primary
        TestReferenceDataProvider testReferenceDataProvider() {
            return new TestReferenceDataProvider();
        }
    }

    static class TestReferenceDataProvider implements ReferenceDataProvider {
        private final Map<ReferenceSeries, Queue<List<ReferenceRecord>>> queues = new EnumMap<>(ReferenceSeries.class);

        void enqueue(ReferenceSeries series, List<ReferenceRecord> records) {
            queues.computeIfAbsent(series, key -> new ArrayDeque<>()).add(records);
        }

        void clear() {
            queues.clear();
        }

        @Override
        public List<ReferenceRecord> fetch(ReferenceSeries series) {
            Queue<List<ReferenceRecord>> queue = queues.get(series);
            List<ReferenceRecord> next = queue == null ? null : queue.poll();
            if (next == null) {
                throw new IllegalStateException("No test payload enqueued for " + series);
            }
            return next;
        }
    }
}
