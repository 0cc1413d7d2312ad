package com.redzone.overweight.infrastructure.web;

import com.redzone.overweight.application.FindOverweights;
import com.redzone.overweight.application.RefreshOverweights;
import com.redzone.overweight.domain.model.CacheSnapshot;
import com.redzone.overweight.domain.model.CacheStatus;
import com.redzone.overweight.infrastructure.web.dto.HealthResponse;
import com.redzone.overweight.infrastructure.web.dto.OverweightsResponse;
import com.redzone.overweight.infrastructure.web.dto.RefreshResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OverweightController {

    private static final Logger logger = LoggerFactory.getLogger(OverweightController.class);

    static final String RETRY_AFTER_SECONDS = "60";

    private final FindOverweights findOverweights;
    private final RefreshOverweights refreshOverweights;

    public OverweightController(FindOverweights findOverweights, RefreshOverweights refreshOverweights) {
        this.findOverweights = findOverweights;
        this.refreshOverweights = refreshOverweights;
    }

    @GetMapping("/api/overweights")
    public ResponseEntity<OverweightsResponse> overweights() {
        try {
            CacheSnapshot snapshot = findOverweights.getMetrics();

            if (snapshot.status() == CacheStatus.INITIALIZING) {
                return ResponseEntity.status(HttpStatus.ACCEPTED)
                        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                        .body(OverweightsResponse.initializing());
            }

            if (snapshot.status() == CacheStatus.ERROR && snapshot.series().isEmpty()) {
                logger.warn("Serving error response, cache has no data: {}", snapshot.error());
                return ResponseEntity.internalServerError()
                        .body(OverweightsResponse.error(snapshot.error()));
            }

            logger.debug("Serving {} products ({})", snapshot.productCount(), snapshot.status());
            return ResponseEntity.ok(OverweightsResponse.fromSnapshot(snapshot));

        } catch (Exception e) {
            logger.error("Error reading overweight cache", e);
            return ResponseEntity.internalServerError()
                    .body(OverweightsResponse.error("Unable to read cached metrics"));
        }
    }

    @PostMapping("/api/refresh")
    public ResponseEntity<RefreshResponse> forceRefresh() {
        try {
            refreshOverweights.forceRefresh();
            return ResponseEntity.ok(RefreshResponse.started());
        } catch (Exception e) {
            logger.error("Could not start forced refresh", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(RefreshResponse.failed("Refresh could not be started, try again later."));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.fromHealth(findOverweights.getHealth()));
    }
}
