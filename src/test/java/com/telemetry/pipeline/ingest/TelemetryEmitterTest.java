package com.telemetry.pipeline.ingest;

import com.telemetry.pipeline.context.CorrelationContext;
import com.telemetry.pipeline.context.CorrelationContextHolder;
import com.telemetry.pipeline.core.model.LogEntry;
import com.telemetry.pipeline.core.model.LogLevel;
import com.telemetry.pipeline.core.model.Metric;
import com.telemetry.pipeline.core.model.MetricType;
import com.telemetry.pipeline.tracing.TracingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelemetryEmitterTest {

    @Mock
    private IngestionQueueManager queueManager;

    private TelemetryEmitter emitter;

    @BeforeEach
    void setUp() {
        emitter = new TelemetryEmitter(queueManager, new TracingConfig("shop", "fallback"));
    }

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("Metric should carry the current tenant")
    void testMetricTenant() {
        when(queueManager.submitMetric(any())).thenReturn(true);
        CorrelationContextHolder.setTenantId("acme");

        assertTrue(emitter.counter("orders.created", 1, Map.of("channel", "web")));

        ArgumentCaptor<Metric> captor = ArgumentCaptor.forClass(Metric.class);
        verify(queueManager).submitMetric(captor.capture());
        Metric metric = captor.getValue();
        assertEquals("acme", metric.tenantId());
        assertEquals(MetricType.COUNTER, metric.type());
        assertEquals("web", metric.labels().get("channel"));
    }

    @Test
    @DisplayName("Metric without tenant context should use the default tenant")
    void testDefaultTenant() {
        when(queueManager.submitMetric(any())).thenReturn(true);

        emitter.gauge("queue.depth", 7, null);

        ArgumentCaptor<Metric> captor = ArgumentCaptor.forClass(Metric.class);
        verify(queueManager).submitMetric(captor.capture());
        assertEquals("fallback", captor.getValue().tenantId());
    }

    @Test
    @DisplayName("Log entry should carry correlation identifiers")
    void testLogCorrelation() {
        when(queueManager.submitLog(any())).thenReturn(true);
        CorrelationContextHolder.set(new CorrelationContext("trace-1", "span-1", null, "acme", "alice", "corr-1"));

        emitter.error("payments", "card declined", Map.of("amount", 42));

        ArgumentCaptor<LogEntry> captor = ArgumentCaptor.forClass(LogEntry.class);
        verify(queueManager).submitLog(captor.capture());
        LogEntry entry = captor.getValue();
        assertEquals(LogLevel.ERROR, entry.level());
        assertEquals("shop", entry.service());
        assertEquals("payments", entry.component());
        assertEquals("acme", entry.tenantId());
        assertEquals("trace-1", entry.traceId());
        assertEquals("span-1", entry.spanId());
        assertEquals("corr-1", entry.correlationId());
        assertEquals(42, entry.fields().get("amount"));
    }

    @Test
    @DisplayName("Rejected submission should be reported to the caller")
    void testRejected() {
        when(queueManager.submitLog(any())).thenReturn(false);

        assertFalse(emitter.info("shop", "hello", null));
    }

    @Test
    @DisplayName("Invalid metric should fail before reaching the queue")
    void testInvalidMetric() {
        assertThrows(IllegalArgumentException.class, () -> emitter.histogram("latency", Double.NaN, null));
        verifyNoInteractions(queueManager);
    }
}
