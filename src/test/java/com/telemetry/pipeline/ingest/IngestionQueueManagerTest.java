package com.telemetry.pipeline.ingest;

import com.telemetry.pipeline.core.model.LogEntry;
import com.telemetry.pipeline.core.model.LogLevel;
import com.telemetry.pipeline.core.model.Metric;
import com.telemetry.pipeline.storage.InMemoryLogStorage;
import com.telemetry.pipeline.storage.InMemoryMetricStorage;
import com.telemetry.pipeline.storage.LogQuery;
import com.telemetry.pipeline.storage.LogStorage;
import com.telemetry.pipeline.storage.MetricQuery;
import com.telemetry.pipeline.storage.MetricStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class IngestionQueueManagerTest {

    private InMemoryMetricStorage metricStorage;
    private InMemoryLogStorage logStorage;
    private IngestionQueueManager manager;

    @BeforeEach
    void setUp() {
        metricStorage = new InMemoryMetricStorage();
        logStorage = new InMemoryLogStorage();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stop();
        }
    }

    private static IngestionConfig config(int capacity, int batchSize) {
        return IngestionConfig.builder()
                .queueCapacity(capacity)
                .batchSize(batchSize)
                .batchTimeout(Duration.ofMillis(50))
                .idleBackoff(Duration.ofMillis(10))
                .shutdownTimeout(Duration.ofSeconds(2))
                .build();
    }

    private static LogEntry logEntry(String message) {
        return LogEntry.builder()
                .tenantId("acme")
                .service("shop")
                .level(LogLevel.INFO)
                .message(message)
                .build();
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class Backpressure {

        @Test
        @DisplayName("Full queue should reject without blocking")
        void testCapacity() {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(2, 10));

            assertTrue(manager.submitMetric(Metric.counter("acme", "requests", 1)));
            assertTrue(manager.submitMetric(Metric.counter("acme", "requests", 2)));
            assertFalse(manager.submitMetric(Metric.counter("acme", "requests", 3)));

            IngestionStats stats = manager.getStats();
            assertEquals(2, stats.metricsQueueDepth());
            assertEquals(2, stats.metricsAccepted());
            assertEquals(1, stats.metricsDropped());
            assertEquals(1.0, stats.maxQueueUtilization());
            assertEquals(1, stats.totalDropped());
        }

        @Test
        @DisplayName("Metrics and logs should use separate queues")
        void testSeparateQueues() {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(1, 10));

            assertTrue(manager.submitMetric(Metric.counter("acme", "requests", 1)));
            assertTrue(manager.submitLog(logEntry("hello")));
            assertFalse(manager.submitLog(logEntry("again")));
        }

        @Test
        @DisplayName("Null items should be rejected")
        void testNulls() {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(2, 10));

            assertThrows(NullPointerException.class, () -> manager.submitMetric(null));
            assertThrows(NullPointerException.class, () -> manager.submitLog(null));
        }
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("A full batch should be written with a single bulk call")
        void testSingleBulkCall() throws Exception {
            MetricStorage storage = mock(MetricStorage.class);
            CountDownLatch flushed = new CountDownLatch(1);
            when(storage.storeMetrics(anyList())).thenAnswer(invocation -> {
                flushed.countDown();
                return ((List<?>) invocation.getArgument(0)).size();
            });
            manager = new IngestionQueueManager(storage, logStorage, config(2_000, 1_000));

            for (int i = 0; i < 1_000; i++) {
                assertTrue(manager.submitMetric(Metric.gauge("acme", "cpu", i)));
            }
            manager.start();

            assertTrue(flushed.await(5, TimeUnit.SECONDS));
            manager.stop();
            verify(storage, times(1)).storeMetrics(argThat(batch -> batch.size() == 1_000));
            verify(storage, never()).storeMetric(any());
            assertEquals(1_000, manager.getStats().metricsFlushed());
            assertEquals(1, manager.getStats().batchesFlushed());
        }

        @Test
        @DisplayName("A partial batch should be flushed after the batch timeout")
        void testTimeoutFlush() throws Exception {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(100, 50));
            manager.start();

            manager.submitMetric(Metric.gauge("acme", "cpu", 1));
            manager.submitLog(logEntry("started"));

            awaitUntil(() -> metricStorage.count("acme") == 1 && logStorage.count("acme") == 1);
            assertEquals("started", logStorage.queryLogs(LogQuery.forTenant("acme")).get(0).message());
            assertEquals(1, metricStorage.queryMetrics(MetricQuery.forTenant("acme")).size());
        }

        @Test
        @DisplayName("Flush failure should be counted and the consumer should keep running")
        void testFlushFailure() throws Exception {
            LogStorage storage = mock(LogStorage.class);
            AtomicInteger calls = new AtomicInteger();
            when(storage.storeLogs(anyList())).thenAnswer(invocation -> {
                if (calls.getAndIncrement() == 0) {
                    throw new IllegalStateException("storage down");
                }
                return ((List<?>) invocation.getArgument(0)).size();
            });
            manager = new IngestionQueueManager(metricStorage, storage, config(100, 1));
            manager.start();

            manager.submitLog(logEntry("lost"));
            awaitUntil(() -> manager.getStats().flushFailures() == 1);
            manager.submitLog(logEntry("kept"));
            awaitUntil(() -> manager.getStats().logsFlushed() == 1);

            assertTrue(manager.isRunning());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Start should be idempotent")
        void testStartIdempotent() {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(10, 5));
            manager.start();
            manager.start();

            assertTrue(manager.isRunning());
            assertTrue(manager.getStats().running());
        }

        @Test
        @DisplayName("Stopped manager should reject submissions and never flush again")
        void testStop() {
            MetricStorage storage = mock(MetricStorage.class);
            manager = new IngestionQueueManager(storage, logStorage, config(10, 5));
            manager.start();
            manager.stop();

            assertFalse(manager.isRunning());
            assertFalse(manager.submitMetric(Metric.counter("acme", "requests", 1)));
            assertFalse(manager.submitLog(logEntry("late")));
            verify(storage, never()).storeMetrics(anyList());
        }

        @Test
        @DisplayName("Stop should be idempotent and restart should be refused")
        void testStopIdempotent() {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(10, 5));
            manager.start();
            manager.stop();
            manager.stop();

            assertThrows(IllegalStateException.class, manager::start);
        }

        @Test
        @DisplayName("Items still queued at stop should be discarded and counted")
        void testDiscardOnStop() {
            manager = new IngestionQueueManager(metricStorage, logStorage, config(10, 5));
            manager.submitMetric(Metric.counter("acme", "requests", 1));
            manager.submitLog(logEntry("queued"));

            manager.stop();

            IngestionStats stats = manager.getStats();
            assertEquals(2, stats.discardedOnStop());
            assertEquals(0, stats.metricsQueueDepth());
            assertEquals(0, metricStorage.count("acme"));
        }

        @Test
        @DisplayName("Batch taken off the queue should be flushed by stop without waiting for its timeout")
        void testFlushOnStop() throws Exception {
            manager = new IngestionQueueManager(metricStorage, logStorage, IngestionConfig.builder()
                    .queueCapacity(10)
                    .batchSize(100)
                    .batchTimeout(Duration.ofSeconds(3))
                    .idleBackoff(Duration.ofMillis(10))
                    .shutdownTimeout(Duration.ofSeconds(2))
                    .build());
            manager.start();
            for (int i = 0; i < 3; i++) {
                assertTrue(manager.submitMetric(Metric.counter("acme", "requests", i)));
            }
            awaitUntil(() -> manager.getStats().metricsQueueDepth() == 0);
            Thread.sleep(300);
            assertEquals(0, metricStorage.count("acme"));

            long startNanos = System.nanoTime();
            manager.stop();
            long stopMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            IngestionStats stats = manager.getStats();
            assertEquals(3, metricStorage.count("acme"));
            assertEquals(3, stats.metricsFlushed());
            assertEquals(0, stats.discardedOnStop());
            assertTrue(stopMillis < 2_000, "stop took " + stopMillis + "ms");
        }

        @Test
        @DisplayName("Stop racing start should always leave the manager stopped")
        void testStopRacingStart() throws Exception {
            for (int i = 0; i < 200; i++) {
                IngestionQueueManager racing = new IngestionQueueManager(metricStorage, logStorage, config(10, 5));
                CountDownLatch go = new CountDownLatch(1);
                Thread starter = new Thread(() -> {
                    try {
                        go.await();
                        racing.start();
                    } catch (IllegalStateException e) {
                        // stop won the race
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
                starter.start();
                go.countDown();
                racing.stop();
                starter.join(5_000);

                assertFalse(racing.isRunning(), "still running after iteration " + i);
                assertFalse(racing.getStats().running());
            }
        }

        @Test
        @DisplayName("Close should stop the manager")
        void testClose() {
            try (IngestionQueueManager closing = new IngestionQueueManager(metricStorage, logStorage, config(10, 5))) {
                closing.start();
                assertTrue(closing.isRunning());
                manager = closing;
            }
            assertFalse(manager.isRunning());
        }
    }
}
