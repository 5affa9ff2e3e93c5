package com.telemetry.pipeline.cdi;

import com.telemetry.pipeline.api.TelemetryPipeline;
import com.telemetry.pipeline.health.HealthCheckRegistry;
import com.telemetry.pipeline.ingest.IngestionConfig;
import com.telemetry.pipeline.ingest.TelemetryEmitter;
import com.telemetry.pipeline.metrics.MicrometerTelemetryMetrics;
import com.telemetry.pipeline.query.TelemetryQueryFacade;
import com.telemetry.pipeline.rest.CorrelationFilter;
import com.telemetry.pipeline.storage.StorageConfig;
import com.telemetry.pipeline.tracing.AlwaysSampleStrategy;
import com.telemetry.pipeline.tracing.JsonLinesSpanExporter;
import com.telemetry.pipeline.tracing.NeverSampleStrategy;
import com.telemetry.pipeline.tracing.NoOpSpanExporter;
import com.telemetry.pipeline.tracing.OpenTelemetrySpanExporter;
import com.telemetry.pipeline.tracing.ProbabilitySampleStrategy;
import com.telemetry.pipeline.tracing.RateLimitingSampleStrategy;
import com.telemetry.pipeline.tracing.SamplingStrategy;
import com.telemetry.pipeline.tracing.SpanExporter;
import com.telemetry.pipeline.tracing.SpanRecorder;
import com.telemetry.pipeline.tracing.TracingConfig;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * CDI producer that wires the telemetry pipeline from MicroProfile Config properties.
 *
 * <p>Every property has a default, so an empty configuration yields a working pipeline
 * with in-memory storage and no span export:</p>
 * <pre>
 * telemetry.tracing.service-name=checkout-service
 * telemetry.ingest.batch-size=500
 * telemetry.tracing.exporter=jsonl
 * telemetry.tracing.jsonl-path=/var/log/spans.jsonl
 * </pre>
 *
 * <p>The pipeline is started when produced and closed by the disposer.</p>
 */
@ApplicationScoped
public class TelemetryProducer {

    private static final Logger log = LoggerFactory.getLogger(TelemetryProducer.class);

    // ── Tracing ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "telemetry.tracing.service-name", defaultValue = "telemetry-pipeline")
    String serviceName;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.default-tenant", defaultValue = "default")
    String defaultTenant;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.exporter", defaultValue = "none")
    String exporterType;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.jsonl-path", defaultValue = "spans.jsonl")
    String jsonlPath;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.sampler", defaultValue = "always")
    String samplerType;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.sample-rate", defaultValue = "1.0")
    double sampleRate;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.max-traces-per-second", defaultValue = "100")
    int maxTracesPerSecond;

    @Inject
    @ConfigProperty(name = "telemetry.tracing.performance-ttl-seconds", defaultValue = "3600")
    long performanceTtlSeconds;

    // ── Ingestion ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "telemetry.ingest.queue-capacity", defaultValue = "50000")
    int queueCapacity;

    @Inject
    @ConfigProperty(name = "telemetry.ingest.batch-size", defaultValue = "1000")
    int batchSize;

    @Inject
    @ConfigProperty(name = "telemetry.ingest.batch-timeout-millis", defaultValue = "1000")
    long batchTimeoutMillis;

    @Inject
    @ConfigProperty(name = "telemetry.ingest.idle-backoff-millis", defaultValue = "100")
    long idleBackoffMillis;

    @Inject
    @ConfigProperty(name = "telemetry.ingest.shutdown-timeout-millis", defaultValue = "5000")
    long shutdownTimeoutMillis;

    // ── Storage ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "telemetry.storage.trace-ttl-seconds", defaultValue = "86400")
    long traceTtlSeconds;

    @Inject
    @ConfigProperty(name = "telemetry.storage.max-spans", defaultValue = "1000000")
    long maxSpans;

    @Inject
    @ConfigProperty(name = "telemetry.storage.max-entries-per-tenant", defaultValue = "100000")
    int maxEntriesPerTenant;

    // ── Self-metrics ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "telemetry.metrics.micrometer.enabled", defaultValue = "false")
    boolean micrometerEnabled;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public TelemetryPipeline telemetryPipeline() {
        log.info("Producing TelemetryPipeline: service={} exporter={} queueCapacity={} batchSize={}",
                serviceName, exporterType, queueCapacity, batchSize);

        IngestionConfig ingestionConfig = IngestionConfig.builder()
                .queueCapacity(queueCapacity)
                .batchSize(batchSize)
                .batchTimeout(Duration.ofMillis(batchTimeoutMillis))
                .idleBackoff(Duration.ofMillis(idleBackoffMillis))
                .shutdownTimeout(Duration.ofMillis(shutdownTimeoutMillis))
                .build();

        TelemetryPipeline.Builder builder = TelemetryPipeline.builder()
                .tracingConfig(new TracingConfig(serviceName, defaultTenant))
                .ingestionConfig(ingestionConfig)
                .storageConfig(new StorageConfig(traceTtlSeconds, maxSpans, maxEntriesPerTenant))
                .performanceTtl(Duration.ofSeconds(performanceTtlSeconds))
                .spanExporter(createSpanExporter())
                .samplingStrategy(createSamplingStrategy());

        if (micrometerEnabled) {
            builder.telemetryMetrics(new MicrometerTelemetryMetrics(Metrics.globalRegistry));
            log.info("Micrometer self-metrics enabled");
        }

        TelemetryPipeline pipeline = builder.build();
        pipeline.start();
        return pipeline;
    }

    public void closePipeline(@Disposes TelemetryPipeline pipeline) {
        log.info("Closing TelemetryPipeline");
        pipeline.close();
    }

    @Produces
    @ApplicationScoped
    public SpanRecorder spanRecorder(TelemetryPipeline pipeline) {
        return pipeline.spanRecorder();
    }

    @Produces
    @ApplicationScoped
    public TelemetryEmitter telemetryEmitter(TelemetryPipeline pipeline) {
        return pipeline.emitter();
    }

    @Produces
    @ApplicationScoped
    public TelemetryQueryFacade telemetryQueryFacade(TelemetryPipeline pipeline) {
        return pipeline.queryFacade();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(TelemetryPipeline pipeline) {
        return pipeline.healthCheckRegistry();
    }

    @Produces
    @ApplicationScoped
    public CorrelationFilter correlationFilter(SpanRecorder spanRecorder) {
        return new CorrelationFilter(spanRecorder);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private SamplingStrategy createSamplingStrategy() {
        switch (samplerType.trim().toLowerCase()) {
            case "always":
                return new AlwaysSampleStrategy();
            case "never":
                return new NeverSampleStrategy();
            case "probability":
                return new ProbabilitySampleStrategy(sampleRate);
            case "rate-limit":
                return new RateLimitingSampleStrategy(maxTracesPerSecond);
            default:
                log.warn("Unknown sampler '{}', sampling every trace", samplerType);
                return new AlwaysSampleStrategy();
        }
    }

    private SpanExporter createSpanExporter() {
        switch (exporterType.trim().toLowerCase()) {
            case "none":
                return new NoOpSpanExporter();
            case "jsonl":
                try {
                    return JsonLinesSpanExporter.toFile(Path.of(jsonlPath));
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot open span export file " + jsonlPath, e);
                }
            case "opentelemetry":
                return new OpenTelemetrySpanExporter(GlobalOpenTelemetry.getTracer(serviceName));
            default:
                log.warn("Unknown span exporter '{}', falling back to NoOp", exporterType);
                return new NoOpSpanExporter();
        }
    }
}
