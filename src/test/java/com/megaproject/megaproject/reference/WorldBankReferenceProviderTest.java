package com.megaproject.megaproject.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.megaproject.megaproject.staging.StagingProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WorldBankReferenceProviderTest {

    private final WorldBankReferenceProvider provider =
            new WorldBankReferenceProvider(new StagingProperties(), new ObjectMapper());

    @Test
    void shouldParseObservationsAndSkipEmptyValues() {
        String body = """
                [
                  {"page": 1, "pages": 3, "per_page": 2, "total": 6},
                  [
                    {"indicator": {"id": "PA.NUS.FCRF"}, "country": {"id": "GB", "value": "United Kingdom"},
                     "countryiso3code": "GBR", "date": "2020", "value": 0.7798, "unit": "", "decimal": 0},
                    {"indicator": {"id": "PA.NUS.FCRF"}, "country": {"id": "GB", "value": "United Kingdom"},
                     "countryiso3code": "GBR", "date": "2021", "value": null, "unit": "", "decimal": 0},
                    {"indicator": {"id": "PA.NUS.FCRF"}, "country": {"id": "1W", "value": "World"},
                     "countryiso3code": "", "date": "2020", "value": 1.0, "unit": "", "decimal": 0}
                  ]
                ]
                """;

        WorldBankReferenceProvider.WorldBankPage page = provider.parsePage(body);

        assertEquals(3, page.pages());
        assertEquals(List.of(new ReferenceRecord("GBR", 2020, 0.7798)), page.records());
    }

    @Test
    void shouldTreatMissingDataArrayAsEmptyPage() {
        WorldBankReferenceProvider.WorldBankPage page =
                provider.parsePage("[{\"page\": 1, \"pages\": 0, \"per_page\": 50, \"total\": 0}, null]");

        assertEquals(0, page.pages());
        assertEquals(List.of(), page.records());
    }

    @Test
    void shouldRejectErrorPayload() {
        assertThrows(IllegalStateException.class, () -> provider.parsePage(
                "[{\"message\": [{\"id\": \"120\", \"key\": \"Invalid value\", \"value\": \"The provided parameter value is not valid\"}]}]"));
    }
}
