package com.redzone.overweight.infrastructure.cron;

import com.redzone.overweight.application.RefreshOverweights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Refreshes the cache at startup and then once per interval, whether or not anyone is reading it.
 * The next run is timed from the end of the previous one; the scheduler cancels it on shutdown.
 */
@Service
@ConditionalOnProperty(prefix = "overweight.cache", name = "refresh-enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledCacheRefresher {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCacheRefresher.class);
    private final RefreshOverweights refreshService;

    public ScheduledCacheRefresher(RefreshOverweights refreshService) {
        this.refreshService = refreshService;
    }

    @Scheduled(initialDelayString = "${overweight.cache.initial-delay:PT0S}",
            fixedDelayString = "${overweight.cache.refresh-interval:PT6H}")
    public void refreshOnSchedule() {
        logger.info("Running scheduled overweight cache refresh");
        refreshService.refresh();
    }
}
