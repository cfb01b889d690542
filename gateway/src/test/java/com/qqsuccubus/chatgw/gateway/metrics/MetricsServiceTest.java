package com.qqsuccubus.chatgw.gateway.metrics;

import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.testsupport.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsServiceTest {

    private final GatewayConfig config = TestConfigs.gatewayConfig(Path.of("sessions"));

    @Test
    @DisplayName("Should expose gateway counters in Prometheus format")
    void testScrapeIncludesGatewayCounters() {
        // Given
        MetricsService metricsService = MetricsService.withPrometheus(config);

        // When
        metricsService.recordQrIssued();
        String scrape = metricsService.scrape();

        // Then
        assertTrue(scrape.contains("chatgw_session_qr_issued_total"));
        assertTrue(scrape.contains("nodeId=\"" + config.getNodeId() + "\""));
    }

    @Test
    @DisplayName("Should refuse to scrape when built without Prometheus")
    void testScrapeWithoutPrometheus() {
        // Given
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);

        // When
        metricsService.recordBuffered();

        // Then
        assertEquals(1.0, metricsService.getBufferedCount());
        assertThrows(IllegalStateException.class, metricsService::scrape);
    }
}
