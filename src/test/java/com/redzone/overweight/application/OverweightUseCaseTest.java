package com.redzone.overweight.application;

import com.redzone.overweight.domain.model.CacheHealth;
import com.redzone.overweight.domain.model.CacheSnapshot;
import com.redzone.overweight.domain.model.CacheStatus;
import com.redzone.overweight.domain.model.PersistedSnapshot;
import com.redzone.overweight.domain.model.ProductSeries;
import com.redzone.overweight.domain.model.WeeklyMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OverweightUseCaseTest {

    @Mock
    private OverweightCacheService cacheService;

    private OverweightUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new OverweightUseCase(cacheService);
    }

    @Test
    void shouldReturnCurrentSnapshotAsIs() {
        // Given
        CacheSnapshot snapshot = CacheSnapshot.ok(sampleSeries(), Instant.parse("2024-03-04T06:00:00Z"));
        when(cacheService.currentSnapshot()).thenReturn(snapshot);

        // When
        CacheSnapshot result = useCase.getMetrics();

        // Then
        assertThat(result).isSameAs(snapshot);
    }

    @Test
    void shouldProjectHealthFromSnapshot() {
        // Given
        Instant persistedAt = Instant.parse("2024-01-01T00:00:00Z");
        CacheSnapshot stale = CacheSnapshot.stale(new PersistedSnapshot(sampleSeries(), persistedAt, 1), "timeout");
        when(cacheService.currentSnapshot()).thenReturn(stale);

        // When
        CacheHealth health = useCase.getHealth();

        // Then
        assertThat(health.status()).isEqualTo(CacheStatus.STALE);
        assertThat(health.refreshedAt()).isEqualTo(persistedAt);
    }

    @Test
    void shouldReportInitializingHealthWithoutTimestamp() {
        // Given
        when(cacheService.currentSnapshot()).thenReturn(CacheSnapshot.initializing());

        // When
        CacheHealth health = useCase.getHealth();

        // Then
        assertThat(health.status()).isEqualTo(CacheStatus.INITIALIZING);
        assertThat(health.refreshedAt()).isNull();
    }

    @Test
    void shouldNeverTriggerRefreshWhenReading() {
        // Given
        when(cacheService.currentSnapshot()).thenReturn(CacheSnapshot.error("boom"));

        // When
        useCase.getMetrics();
        useCase.getHealth();

        // Then
        verify(cacheService, times(2)).currentSnapshot();
        verify(cacheService, never()).refresh();
        verify(cacheService, never()).forceRefresh();
    }

    private ProductSeries sampleSeries() {
        return new ProductSeries(Map.of("Bacon", List.of(
                new WeeklyMetric(LocalDate.of(2024, 1, 1), 1.2, 50.2, 49.0, 10))));
    }
}
