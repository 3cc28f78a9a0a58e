package com.megaproject.megaproject.reference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Refreshes every reference series on {@code staging.reference-cron}. The default {@code -} disables it.
 */
@Component
public class ReferenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReferenceScheduler.class);

    private final ReferenceSeriesService referenceSeriesService;

    public ReferenceScheduler(ReferenceSeriesService referenceSeriesService) {
        this.referenceSeriesService = referenceSeriesService;
    }

    @Scheduled(cron = "${staging.reference-cron:-}")
    public void scheduledRefresh() {
        List<ReferenceRefreshResult> results = referenceSeriesService.refreshAll();
        for (ReferenceRefreshResult result : results) {
            log.info("Reference refresh complete. series={}, records={}", result.series(), result.loadedRecords());
        }
    }
}
