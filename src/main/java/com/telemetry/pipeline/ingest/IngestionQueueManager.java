package com.telemetry.pipeline.ingest;

import com.telemetry.pipeline.core.model.LogEntry;
import com.telemetry.pipeline.core.model.Metric;
import com.telemetry.pipeline.logging.LogContext;
import com.telemetry.pipeline.metrics.NoOpTelemetryMetrics;
import com.telemetry.pipeline.metrics.TelemetryMetrics;
import com.telemetry.pipeline.storage.LogStorage;
import com.telemetry.pipeline.storage.MetricStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.ToIntFunction;

/**
 * Bounded, batched, asynchronous ingestion of metrics and log entries.
 *
 * <p>Producers call {@link #submitMetric(Metric)} and {@link #submitLog(LogEntry)}, which never
 * block: when a queue is full the item is dropped and {@code false} is returned. One consumer
 * thread per queue collects items into batches and writes each batch to storage with a single
 * bulk call.</p>
 *
 * <p>Delivery is best effort. {@link #stop()} flushes the batch a consumer has already taken off
 * its queue and discards whatever is still queued.</p>
 *
 * <pre>
 * try (IngestionQueueManager ingest = new IngestionQueueManager(metricStorage, logStorage, config)) {
 *     ingest.start();
 *     ingest.submitMetric(Metric.counter("tenant-1", "orders.created", 1));
 * }
 * </pre>
 */
public class IngestionQueueManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionQueueManager.class);

    /** A WARN is logged on the first drop of a queue and on every multiple of this count. */
    static final long DROP_LOG_INTERVAL = 1_000;

    private final MetricStorage metricStorage;
    private final LogStorage logStorage;
    private final IngestionConfig config;
    private final TelemetryMetrics metrics;

    private final BlockingQueue<Metric> metricQueue;
    private final BlockingQueue<LogEntry> logQueue;

    private final QueueCounters metricCounters = new QueueCounters();
    private final QueueCounters logCounters = new QueueCounters();
    private final LongAdder batchesFlushed = new LongAdder();
    private final LongAdder flushFailures = new LongAdder();
    private final AtomicLong discardedOnStop = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean running;
    private volatile ExecutorService executor;

    public IngestionQueueManager(MetricStorage metricStorage, LogStorage logStorage, IngestionConfig config) {
        this(metricStorage, logStorage, config, new NoOpTelemetryMetrics());
    }

    public IngestionQueueManager(MetricStorage metricStorage, LogStorage logStorage,
                                 IngestionConfig config, TelemetryMetrics metrics) {
        this.metricStorage = Objects.requireNonNull(metricStorage, "metricStorage is required");
        this.logStorage = Objects.requireNonNull(logStorage, "logStorage is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.metricQueue = new ArrayBlockingQueue<>(config.queueCapacity());
        this.logQueue = new ArrayBlockingQueue<>(config.queueCapacity());
        metrics.registerQueueDepth(QueueKind.METRICS, metricQueue::size);
        metrics.registerQueueDepth(QueueKind.LOGS, logQueue::size);
    }

    /**
     * Starts one consumer thread per queue. Items submitted earlier are flushed once started.
     * Calling start again is a no-op.
     *
     * @throws IllegalStateException if the manager has been stopped
     */
    public synchronized void start() {
        if (stopped.get()) {
            throw new IllegalStateException("IngestionQueueManager has been stopped and cannot be restarted");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger index = new AtomicInteger();
        QueueKind[] kinds = QueueKind.values();
        executor = Executors.newFixedThreadPool(kinds.length, r -> {
            Thread t = new Thread(r, "telemetry-ingest-" + kinds[index.getAndIncrement() % kinds.length].tag());
            t.setDaemon(true);
            return t;
        });
        running = true;
        executor.submit(() -> consume(QueueKind.METRICS, metricQueue, metricStorage::storeMetrics, metricCounters));
        executor.submit(() -> consume(QueueKind.LOGS, logQueue, logStorage::storeLogs, logCounters));
        log.info("ingest.started queueCapacity={} batchSize={} batchTimeout={}",
                config.queueCapacity(), config.batchSize(), config.batchTimeout());
    }

    /**
     * Offers a metric to the metrics queue without blocking.
     *
     * @return true if the metric was queued, false if the queue is full or the manager is stopped
     */
    public boolean submitMetric(Metric metric) {
        Objects.requireNonNull(metric, "metric is required");
        return offer(QueueKind.METRICS, metricQueue, metric, metricCounters);
    }

    /**
     * Offers a log entry to the logs queue without blocking.
     *
     * @return true if the entry was queued, false if the queue is full or the manager is stopped
     */
    public boolean submitLog(LogEntry entry) {
        Objects.requireNonNull(entry, "entry is required");
        return offer(QueueKind.LOGS, logQueue, entry, logCounters);
    }

    /**
     * Stops the consumers. Batches already taken off a queue are flushed; items still queued
     * are discarded. Calling stop more than once is a no-op.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ExecutorService current;
        synchronized (this) {
            running = false;
            current = executor;
        }
        if (current != null) {
            current.shutdownNow();
            try {
                if (!current.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("ingest.stop.timeout timeout={}", config.shutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("ingest.stop.interrupted");
            }
        }
        int discarded = drainAndCount(metricQueue) + drainAndCount(logQueue);
        discardedOnStop.addAndGet(discarded);
        log.info("ingest.stopped discarded={} metricsFlushed={} logsFlushed={}",
                discarded, metricCounters.flushed.sum(), logCounters.flushed.sum());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public IngestionConfig getConfig() {
        return config;
    }

    public IngestionStats getStats() {
        return new IngestionStats(
                metricQueue.size(),
                logQueue.size(),
                config.queueCapacity(),
                metricCounters.accepted.sum(),
                metricCounters.dropped.get(),
                logCounters.accepted.sum(),
                logCounters.dropped.get(),
                metricCounters.flushed.sum(),
                logCounters.flushed.sum(),
                batchesFlushed.sum(),
                flushFailures.sum(),
                discardedOnStop.get(),
                running);
    }

    private <T> boolean offer(QueueKind kind, BlockingQueue<T> queue, T item, QueueCounters counters) {
        if (stopped.get()) {
            log.debug("ingest.rejected.stopped queue={}", kind.tag());
            return false;
        }
        boolean accepted = queue.offer(item);
        metrics.recordSubmitted(kind, accepted);
        if (accepted) {
            counters.accepted.increment();
        } else {
            long drops = counters.dropped.incrementAndGet();
            if (drops == 1 || drops % DROP_LOG_INTERVAL == 0) {
                log.warn("ingest.queue.full queue={} capacity={} droppedTotal={}",
                        kind.tag(), config.queueCapacity(), drops);
            }
        }
        return accepted;
    }

    private <T> void consume(QueueKind kind, BlockingQueue<T> queue, ToIntFunction<List<T>> flusher,
                             QueueCounters counters) {
        try (LogContext ignored = LogContext.forTask("ingest-" + kind.tag())) {
            runConsumerLoop(kind, queue, flusher, counters);
        }
    }

    private <T> void runConsumerLoop(QueueKind kind, BlockingQueue<T> queue, ToIntFunction<List<T>> flusher,
                                     QueueCounters counters) {
        log.debug("ingest.consumer.started queue={}", kind.tag());
        long batchTimeoutNanos = config.batchTimeout().toNanos();
        long idleBackoffMillis = config.idleBackoff().toMillis();
        int batchSize = config.batchSize();

        while (running) {
            List<T> batch = new ArrayList<>();
            boolean interrupted = false;
            try {
                T first = queue.poll(batchTimeoutNanos, TimeUnit.NANOSECONDS);
                if (first == null) {
                    Thread.sleep(idleBackoffMillis);
                    continue;
                }
                batch.add(first);
                long deadline = System.nanoTime() + batchTimeoutNanos;
                queue.drainTo(batch, batchSize - batch.size());
                while (batch.size() < batchSize) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        break;
                    }
                    T next = queue.poll(Math.min(remaining, batchTimeoutNanos), TimeUnit.NANOSECONDS);
                    if (next == null) {
                        break;
                    }
                    batch.add(next);
                    queue.drainTo(batch, batchSize - batch.size());
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
            if (!batch.isEmpty()) {
                flush(kind, batch, flusher, counters);
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("ingest.consumer.stopped queue={}", kind.tag());
    }

    private <T> void flush(QueueKind kind, List<T> batch, ToIntFunction<List<T>> flusher, QueueCounters counters) {
        long startNanos = System.nanoTime();
        try {
            int stored = flusher.applyAsInt(List.copyOf(batch));
            counters.flushed.add(stored);
            batchesFlushed.increment();
            metrics.recordFlush(kind, stored, Duration.ofNanos(System.nanoTime() - startNanos));
            if (stored < batch.size()) {
                log.warn("ingest.flush.partial queue={} batchSize={} stored={}", kind.tag(), batch.size(), stored);
            } else {
                log.debug("ingest.flush queue={} batchSize={}", kind.tag(), batch.size());
            }
        } catch (RuntimeException e) {
            flushFailures.increment();
            metrics.recordFlushFailure(kind);
            log.error("ingest.flush.failed queue={} batchSize={}", kind.tag(), batch.size(), e);
        }
    }

    private static int drainAndCount(BlockingQueue<?> queue) {
        List<Object> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        return leftovers.size();
    }

    private static final class QueueCounters {
        final LongAdder accepted = new LongAdder();
        final AtomicLong dropped = new AtomicLong();
        final LongAdder flushed = new LongAdder();
    }
}
