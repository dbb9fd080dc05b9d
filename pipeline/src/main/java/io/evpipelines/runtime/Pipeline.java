package io.evpipelines.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.evpipelines.core.BatchSink;
import io.evpipelines.core.Record;
import io.evpipelines.core.Sink;
import io.evpipelines.core.Source;
import io.evpipelines.core.Transform;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.transform.IdentityTransform;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-source -> single-transform -> single-sink pipeline, run synchronously on the calling thread.
 * Records reach the sink in source order, flushed in batches when the sink supports it.
 * A pipeline runs once; source and sink are closed when the run ends.
 */
public class Pipeline<I, O> {
    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final Metrics metrics;
    private final int sinkBatchSize;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    public Pipeline(Source<I> source, Transform<I, O> transform, Sink<O> sink, Metrics metrics, int sinkBatchSize) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.metrics = Objects.requireNonNull(metrics);
        this.sinkBatchSize = Math.max(1, sinkBatchSize);
        this.sourceTimer = metrics.timer("pipeline.source.time");
        this.transformTimer = metrics.timer("pipeline.transform.time");
        this.sinkTimer = metrics.timer("pipeline.sink.time");
        this.inMeter = metrics.meter("pipeline.input.rate");
        this.outMeter = metrics.meter("pipeline.output.rate");
        this.errorMeter = metrics.meter("pipeline.error.rate");
    }

    /**
     * Drains the source through the transform into the sink. Any failure stops the run and is rethrown after the
     * source and sink are closed.
     */
    public PipelineResult run() throws Exception {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline has already run");
        }
        long t0 = System.nanoTime();
        long in = 0;
        long out = 0;
        try (Source<I> src = source; Sink<O> snk = sink) {
            List<Record<O>> emitBuffer = new ArrayList<>(sinkBatchSize);
            while (true) {
                Optional<Record<I>> opt;
                try (Timer.Context ignored = sourceTimer.time()) {
                    opt = src.poll();
                }
                if (opt.isEmpty()) {
                    if (src.isFinished()) break;
                    continue;
                }
                in++;
                inMeter.mark();
                List<Record<O>> outputs;
                try (Timer.Context ignored = transformTimer.time()) {
                    outputs = transform.apply(opt.get());
                }
                if (outputs == null) continue;
                for (Record<O> r : outputs) {
                    emitBuffer.add(r);
                    if (emitBuffer.size() >= sinkBatchSize) {
                        out += flushToSink(snk, emitBuffer);
                    }
                }
            }
            out += flushToSink(snk, emitBuffer);
        } catch (Exception e) {
            errorMeter.mark();
            throw e;
        }
        return new PipelineResult(in, out, Duration.ofNanos(System.nanoTime() - t0));
    }

    private int flushToSink(Sink<O> snk, List<Record<O>> records) throws Exception {
        if (records.isEmpty()) return 0;
        int n = records.size();
        try (Timer.Context ignored = sinkTimer.time()) {
            if (snk instanceof BatchSink<O> bs) {
                bs.acceptBatch(records);
            } else {
                for (Record<O> r : records) {
                    snk.accept(r);
                }
            }
        }
        outMeter.mark(n);
        metrics.counter("pipeline.sink.batch.flushes").inc();
        metrics.histogram("pipeline.sink.batch.size").update(n);
        records.clear();
        return n;
    }

    /** Convenience for callers that only need the sink to see every record. */
    public static <T> PipelineResult drain(Source<T> source, Sink<T> sink, Metrics metrics) throws Exception {
        return new PipelineBuilder<T, T>()
                .source(source)
                .transform(new IdentityTransform<>())
                .sink(sink)
                .metrics(metrics)
                .build()
                .run();
    }
}
