package com.redzone.overweight.infrastructure.web;

import com.redzone.overweight.application.FindOverweights;
import com.redzone.overweight.application.RefreshOverweights;
import com.redzone.overweight.domain.model.CacheHealth;
import com.redzone.overweight.domain.model.CacheSnapshot;
import com.redzone.overweight.domain.model.CacheStatus;
import com.redzone.overweight.domain.model.PersistedSnapshot;
import com.redzone.overweight.domain.model.ProductSeries;
import com.redzone.overweight.domain.model.WeeklyMetric;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OverweightController.class)
class OverweightControllerContractTest {

    private static final Instant REFRESHED_AT = Instant.parse("2024-03-04T06:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FindOverweights findOverweights;

    @MockBean
    private RefreshOverweights refreshOverweights;

    @Test
    void shouldAskClientToRetryWhileInitializing() throws Exception {
        // Given
        when(findOverweights.getMetrics()).thenReturn(CacheSnapshot.initializing());

        // When & Then
        mockMvc.perform(get("/api/overweights"))
                .andExpect(status().isAccepted())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
                .andExpect(jsonPath("$.status", is("initializing")))
                .andExpect(jsonPath("$.message", is("Data is loading from Snowflake, please check back in 60 seconds.")))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void shouldReturnFreshMetrics() throws Exception {
        // Given
        when(findOverweights.getMetrics()).thenReturn(CacheSnapshot.ok(sampleSeries(), REFRESHED_AT));

        // When & Then
        mockMvc.perform(get("/api/overweights"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.cache_status", is("ok")))
                .andExpect(jsonPath("$.refreshed_at", is("2024-03-04T06:00:00Z")))
                .andExpect(jsonPath("$.product_count", is(2)))
                .andExpect(jsonPath("$.message").doesNotExist())
                .andExpect(jsonPath("$.data.Bacon", hasSize(2)))
                .andExpect(jsonPath("$.data.Bacon[0].week_start", is("2024-01-01")))
                .andExpect(jsonPath("$.data.Bacon[0].avg_overweight", is(1.2)))
                .andExpect(jsonPath("$.data.Bacon[0].avg_value", is(50.2)))
                .andExpect(jsonPath("$.data.Bacon[0].avg_target", is(49.0)))
                .andExpect(jsonPath("$.data.Bacon[0].count", is(10)))
                .andExpect(jsonPath("$.data.Bacon[1].week_start", is("2024-01-08")))
                .andExpect(jsonPath("$.data.Ham[0].avg_overweight", is(0.0)));
    }

    @Test
    void shouldServeStaleMetricsWithSuccessStatus() throws Exception {
        // Given
        Instant persistedAt = Instant.parse("2024-01-01T00:00:00Z");
        CacheSnapshot stale = CacheSnapshot.stale(
                new PersistedSnapshot(sampleSeries(), persistedAt, 2), "Warehouse query failed: timeout");
        when(findOverweights.getMetrics()).thenReturn(stale);

        // When & Then
        mockMvc.perform(get("/api/overweights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.cache_status", is("stale")))
                .andExpect(jsonPath("$.refreshed_at", is("2024-01-01T00:00:00Z")))
                .andExpect(jsonPath("$.product_count", is(2)))
                .andExpect(jsonPath("$.data.Bacon", hasSize(2)));
    }

    @Test
    void shouldReturnServerErrorWhenNoDataIsAvailable() throws Exception {
        // Given
        when(findOverweights.getMetrics()).thenReturn(CacheSnapshot.error("Warehouse query failed: timeout"));

        // When & Then
        mockMvc.perform(get("/api/overweights"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status", is("error")))
                .andExpect(jsonPath("$.message", is("Warehouse query failed: timeout")))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void shouldReturnServerErrorWhenCacheCannotBeRead() throws Exception {
        // Given
        when(findOverweights.getMetrics()).thenThrow(new IllegalStateException("boom"));

        // When & Then
        mockMvc.perform(get("/api/overweights"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status", is("error")))
                .andExpect(jsonPath("$.message", is("Unable to read cached metrics")));
    }

    @Test
    void shouldStartRefreshInBackground() throws Exception {
        // Given
        when(refreshOverweights.forceRefresh()).thenReturn(new CompletableFuture<>());

        // When & Then
        mockMvc.perform(post("/api/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.message", is("Refresh started, check back in ~60 seconds.")));

        verify(refreshOverweights).forceRefresh();
        verify(refreshOverweights, never()).refresh();
    }

    @Test
    void shouldReportUnavailableWhenRefreshIsRejected() throws Exception {
        // Given
        when(refreshOverweights.forceRefresh()).thenThrow(new TaskRejectedException("queue full"));

        // When & Then
        mockMvc.perform(post("/api/refresh"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status", is("error")))
                .andExpect(jsonPath("$.message", is("Refresh could not be started, try again later.")));
    }

    @Test
    void shouldRejectGetOnRefresh() throws Exception {
        // When & Then
        mockMvc.perform(get("/api/refresh"))
                .andExpect(status().isMethodNotAllowed());

        verifyNoInteractions(refreshOverweights);
    }

    @Test
    void shouldReportHealth() throws Exception {
        // Given
        when(findOverweights.getHealth()).thenReturn(new CacheHealth(CacheStatus.STALE, REFRESHED_AT));

        // When & Then
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.cache", is("stale")))
                .andExpect(jsonPath("$.refreshed_at", is("2024-03-04T06:00:00Z")));
    }

    @Test
    void shouldReportHealthWhileInitializing() throws Exception {
        // Given
        when(findOverweights.getHealth()).thenReturn(new CacheHealth(CacheStatus.INITIALIZING, null));

        // When & Then
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cache", is("initializing")))
                .andExpect(jsonPath("$.refreshed_at", nullValue()));
    }

    @Test
    void shouldAllowCrossOriginRequests() throws Exception {
        // When & Then
        mockMvc.perform(options("/api/overweights")
                        .header(HttpHeaders.ORIGIN, "https://dashboard.example.com")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
    }

    private ProductSeries sampleSeries() {
        Map<String, List<WeeklyMetric>> products = new LinkedHashMap<>();
        products.put("Bacon", List.of(
                new WeeklyMetric(LocalDate.of(2024, 1, 1), 1.2, 50.2, 49.0, 10),
                new WeeklyMetric(LocalDate.of(2024, 1, 8), 0.8, 49.8, 49.0, 12)));
        products.put("Ham", List.of(
                new WeeklyMetric(LocalDate.of(2024, 1, 1), 0.0, 0.0, 0.0, 3)));
        return new ProductSeries(products);
    }
}
