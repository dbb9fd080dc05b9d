package io.evpipelines.runtime;

import com.codahale.metrics.MetricRegistry;
import io.evpipelines.core.Sink;
import io.evpipelines.core.Source;
import io.evpipelines.core.Transform;
import io.evpipelines.metrics.Metrics;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private Metrics metrics;
    private String name = "";
    private int sinkBatchSize = 256;

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metrics = new Metrics(r); return this; }
    public PipelineBuilder<I, O> metrics(Metrics m) { this.metrics = m; return this; }
    /** Prefix for this pipeline's metric names. */
    public PipelineBuilder<I, O> name(String n) { this.name = n == null ? "" : n; return this; }
    public PipelineBuilder<I, O> sinkBatchSize(int n) { this.sinkBatchSize = Math.max(1, n); return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Metrics m = metrics == null ? new Metrics(new MetricRegistry()) : metrics;
        if (!name.isEmpty()) m = m.scoped(name);
        return new Pipeline<>(source, transform, sink, m, sinkBatchSize);
    }
}
