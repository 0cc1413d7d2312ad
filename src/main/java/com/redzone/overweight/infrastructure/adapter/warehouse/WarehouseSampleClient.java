package com.redzone.overweight.infrastructure.adapter.warehouse;

import com.redzone.overweight.domain.model.MetricSample;
import com.redzone.overweight.domain.port.out.MetricSampleSource;
import com.redzone.overweight.infrastructure.persistence.WarehouseSampleRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
public class WarehouseSampleClient implements MetricSampleSource {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseSampleClient.class);

    private final WarehouseSampleRepository repository;
    private final Executor warehouseExecutor;

    public WarehouseSampleClient(WarehouseSampleRepository repository,
                                 @Qualifier("warehouseExecutor") Executor warehouseExecutor) {
        this.repository = repository;
        this.warehouseExecutor = warehouseExecutor;
    }

    /**
     * No fallback method: a failed fetch must reach the cache so it can serve the persisted snapshot
     */
    @Override
    @CircuitBreaker(name = "warehouse")
    @Retry(name = "warehouse")
    @TimeLimiter(name = "warehouse")
    public CompletableFuture<List<MetricSample>> fetchWeeklySamples() {
        return CompletableFuture.supplyAsync(() -> {
            logger.debug("Querying warehouse for weekly overweights");
            List<MetricSample> samples = repository.findWeeklySamples();
            logger.info("Warehouse returned {} weekly rows", samples.size());
            return samples;
        }, warehouseExecutor);
    }
}
