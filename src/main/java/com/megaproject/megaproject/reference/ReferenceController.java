package com.megaproject.megaproject.reference;

import com.megaproject.megaproject.common.ApiExceptions;
import com.megaproject.megaproject.table.TableResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Loads, refreshes and reads reference series ({@code exchange-rates}, {@code gdp-deflators},
 * {@code ppp-rates}).
 */
@RestController
@RequestMapping("/api/reference")
public class ReferenceController {

    private final ReferenceSeriesService referenceSeriesService;

    public ReferenceController(ReferenceSeriesService referenceSeriesService) {
        this.referenceSeriesService = referenceSeriesService;
    }

    /**
     * Replaces a series with the posted records.
     */
    @PostMapping("/{series}")
    public ResponseEntity<ReferenceRefreshResult> replaceSeries(@PathVariable String series,
                                                                @RequestBody List<ReferenceRecord> records) {
        try {
            return ResponseEntity.ok(referenceSeriesService.replace(ReferenceSeries.fromPath(series), records));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to load reference series " + series);
        }
    }

    @PostMapping("/{series}/refresh")
    public ResponseEntity<ReferenceRefreshResult> refreshSeries(@PathVariable String series) {
        try {
            return ResponseEntity.ok(referenceSeriesService.refresh(ReferenceSeries.fromPath(series)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to refresh reference series " + series);
        }
    }

    @GetMapping("/{series}")
    public ResponseEntity<TableResponse> getSeries(@PathVariable String series) {
        try {
            return ResponseEntity.ok(referenceSeriesService.select(ReferenceSeries.fromPath(series)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read reference series " + series);
        }
    }
}
