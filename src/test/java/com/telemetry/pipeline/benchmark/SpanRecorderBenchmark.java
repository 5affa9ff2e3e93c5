package com.telemetry.pipeline.benchmark;

import com.telemetry.pipeline.aggregation.PerformanceAggregator;
import com.telemetry.pipeline.context.CorrelationContextHolder;
import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.storage.CaffeineTraceStorage;
import com.telemetry.pipeline.storage.StorageConfig;
import com.telemetry.pipeline.tracing.SpanHandle;
import com.telemetry.pipeline.tracing.SpanRecorder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for span recording: start, finish, persist and aggregate.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SpanRecorderBenchmark {

    private SpanRecorder recorder;

    @Setup(Level.Trial)
    public void setUp() {
        recorder = new SpanRecorder(
                new CaffeineTraceStorage(new StorageConfig(60, 100_000, 0)),
                new PerformanceAggregator());
    }

    @TearDown(Level.Iteration)
    public void clearContext() {
        CorrelationContextHolder.clear();
    }

    @Benchmark
    public void rootSpan(Blackhole bh) {
        SpanHandle handle = recorder.startSpan("bench.root");
        bh.consume(recorder.finishSpan(handle, SpanStatus.OK, null));
    }

    /**
     * Parent with three children, all in one trace.
     */
    @Benchmark
    public void nestedSpans(Blackhole bh) {
        SpanHandle parent = recorder.startSpan("bench.parent");
        for (int i = 0; i < 3; i++) {
            SpanHandle child = recorder.startSpan("bench.child");
            bh.consume(recorder.finishSpan(child, SpanStatus.OK, null));
        }
        bh.consume(recorder.finishSpan(parent, SpanStatus.OK, null));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(SpanRecorderBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
