package com.telemetry.pipeline.api;

import com.telemetry.pipeline.aggregation.PerformanceAggregator;
import com.telemetry.pipeline.health.HealthCheckRegistry;
import com.telemetry.pipeline.health.HealthStatus;
import com.telemetry.pipeline.health.IngestionHealthCheck;
import com.telemetry.pipeline.health.TraceStorageHealthCheck;
import com.telemetry.pipeline.ingest.IngestionConfig;
import com.telemetry.pipeline.ingest.IngestionQueueManager;
import com.telemetry.pipeline.ingest.TelemetryEmitter;
import com.telemetry.pipeline.metrics.NoOpTelemetryMetrics;
import com.telemetry.pipeline.metrics.TelemetryMetrics;
import com.telemetry.pipeline.query.TelemetryQueryFacade;
import com.telemetry.pipeline.storage.CaffeineTraceStorage;
import com.telemetry.pipeline.storage.InMemoryLogStorage;
import com.telemetry.pipeline.storage.InMemoryMetricStorage;
import com.telemetry.pipeline.storage.LogStorage;
import com.telemetry.pipeline.storage.MetricStorage;
import com.telemetry.pipeline.storage.StorageConfig;
import com.telemetry.pipeline.storage.TraceStorage;
import com.telemetry.pipeline.tracing.AlwaysSampleStrategy;
import com.telemetry.pipeline.tracing.NoOpSpanExporter;
import com.telemetry.pipeline.tracing.SamplingStrategy;
import com.telemetry.pipeline.tracing.SpanExporter;
import com.telemetry.pipeline.tracing.SpanRecorder;
import com.telemetry.pipeline.tracing.TracingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point: builds and owns every telemetry service of the process.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (TelemetryPipeline telemetry = TelemetryPipeline.builder()
 *         .tracingConfig(TracingConfig.forService("checkout-service"))
 *         .ingestionConfig(IngestionConfig.builder().batchSize(500).build())
 *         .build()) {
 *     telemetry.start();
 *
 *     telemetry.spanRecorder().withSpan("checkout", () -&gt; orders.checkout(cart));
 *     telemetry.emitter().counter("orders.created", 1, Map.of("channel", "web"));
 *
 *     List&lt;Span&gt; slow = telemetry.queryFacade().getSlowTraces(500, 10);
 * }
 * </pre>
 *
 * <p>Storage adapters default to the in-memory metric and log stores and the Caffeine trace
 * store; production deployments supply their own adapters through the builder.</p>
 */
public class TelemetryPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);

    private final TracingConfig tracingConfig;
    private final MetricStorage metricStorage;
    private final LogStorage logStorage;
    private final TraceStorage traceStorage;
    private final PerformanceAggregator aggregator;
    private final SpanExporter spanExporter;
    private final SpanRecorder spanRecorder;
    private final IngestionQueueManager queueManager;
    private final TelemetryEmitter emitter;
    private final TelemetryQueryFacade queryFacade;
    private final HealthCheckRegistry healthCheckRegistry;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TelemetryPipeline(Builder builder) {
        this.tracingConfig = builder.tracingConfig;
        TelemetryMetrics metrics = builder.telemetryMetrics != null
                ? builder.telemetryMetrics : new NoOpTelemetryMetrics();

        this.metricStorage = builder.metricStorage != null
                ? builder.metricStorage : new InMemoryMetricStorage(builder.storageConfig.maxEntriesPerTenant());
        this.logStorage = builder.logStorage != null
                ? builder.logStorage : new InMemoryLogStorage(builder.storageConfig.maxEntriesPerTenant());
        this.traceStorage = builder.traceStorage != null
                ? builder.traceStorage : new CaffeineTraceStorage(builder.storageConfig);

        this.aggregator = new PerformanceAggregator(builder.performanceTtl, builder.clock);
        this.spanExporter = builder.spanExporter != null ? builder.spanExporter : new NoOpSpanExporter();
        this.spanRecorder = new SpanRecorder(traceStorage, aggregator, spanExporter, metrics,
                tracingConfig, builder.clock, builder.samplingStrategy);

        this.queueManager = new IngestionQueueManager(metricStorage, logStorage, builder.ingestionConfig, metrics);
        this.emitter = new TelemetryEmitter(queueManager, tracingConfig);
        this.queryFacade = new TelemetryQueryFacade(traceStorage, aggregator, metricStorage, logStorage, queueManager);

        this.healthCheckRegistry = new HealthCheckRegistry()
                .register(new IngestionHealthCheck(queueManager))
                .register(new TraceStorageHealthCheck(traceStorage));
    }

    /**
     * Starts the ingestion consumers.
     */
    public void start() {
        queueManager.start();
        log.info("pipeline.started service={}", tracingConfig.serviceName());
    }

    /**
     * Stops ingestion and closes the span exporter. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queueManager.stop();
        try {
            spanExporter.close();
        } catch (RuntimeException e) {
            log.warn("pipeline.exporter.close.failed", e);
        }
        log.info("pipeline.closed service={}", tracingConfig.serviceName());
    }

    public SpanRecorder spanRecorder() {
        return spanRecorder;
    }

    public TelemetryEmitter emitter() {
        return emitter;
    }

    public IngestionQueueManager queueManager() {
        return queueManager;
    }

    public TelemetryQueryFacade queryFacade() {
        return queryFacade;
    }

    public PerformanceAggregator aggregator() {
        return aggregator;
    }

    public TraceStorage traceStorage() {
        return traceStorage;
    }

    public MetricStorage metricStorage() {
        return metricStorage;
    }

    public LogStorage logStorage() {
        return logStorage;
    }

    public TracingConfig tracingConfig() {
        return tracingConfig;
    }

    public HealthCheckRegistry healthCheckRegistry() {
        return healthCheckRegistry;
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TracingConfig tracingConfig = TracingConfig.defaults();
        private IngestionConfig ingestionConfig = IngestionConfig.defaults();
        private StorageConfig storageConfig = StorageConfig.defaults();
        private Duration performanceTtl = PerformanceAggregator.DEFAULT_TTL;
        private MetricStorage metricStorage;
        private LogStorage logStorage;
        private TraceStorage traceStorage;
        private SpanExporter spanExporter;
        private TelemetryMetrics telemetryMetrics;
        private SamplingStrategy samplingStrategy = new AlwaysSampleStrategy();
        private Clock clock = Clock.systemUTC();

        public Builder tracingConfig(TracingConfig tracingConfig) {
            this.tracingConfig = tracingConfig;
            return this;
        }

        public Builder ingestionConfig(IngestionConfig ingestionConfig) {
            this.ingestionConfig = ingestionConfig;
            return this;
        }

        /**
         * Configures the default storage adapters. Ignored for adapters supplied explicitly.
         */
        public Builder storageConfig(StorageConfig storageConfig) {
            this.storageConfig = storageConfig;
            return this;
        }

        /**
         * Sets how long a performance record survives without updates. Defaults to one hour.
         */
        public Builder performanceTtl(Duration performanceTtl) {
            this.performanceTtl = performanceTtl;
            return this;
        }

        public Builder metricStorage(MetricStorage metricStorage) {
            this.metricStorage = metricStorage;
            return this;
        }

        public Builder logStorage(LogStorage logStorage) {
            this.logStorage = logStorage;
            return this;
        }

        public Builder traceStorage(TraceStorage traceStorage) {
            this.traceStorage = traceStorage;
            return this;
        }

        /**
         * Sets the exporter for finished spans.
         * Defaults to {@link NoOpSpanExporter} if not set.
         */
        public Builder spanExporter(SpanExporter spanExporter) {
            this.spanExporter = spanExporter;
            return this;
        }

        /**
         * Sets the pipeline's own metrics sink.
         * Defaults to {@link NoOpTelemetryMetrics} if not set.
         */
        public Builder telemetryMetrics(TelemetryMetrics telemetryMetrics) {
            this.telemetryMetrics = telemetryMetrics;
            return this;
        }

        /**
         * Sets which traces are recorded and exported.
         * Defaults to {@link AlwaysSampleStrategy} if not set.
         */
        public Builder samplingStrategy(SamplingStrategy samplingStrategy) {
            this.samplingStrategy = samplingStrategy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TelemetryPipeline build() {
            if (tracingConfig == null) {
                throw new IllegalStateException("TracingConfig is required");
            }
            if (ingestionConfig == null) {
                throw new IllegalStateException("IngestionConfig is required");
            }
            if (storageConfig == null) {
                throw new IllegalStateException("StorageConfig is required");
            }
            if (samplingStrategy == null) {
                throw new IllegalStateException("SamplingStrategy is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new TelemetryPipeline(this);
        }
    }
}
