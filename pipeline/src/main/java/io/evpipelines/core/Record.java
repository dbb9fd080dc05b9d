package io.evpipelines.core;

import java.util.Objects;

/**
 * Carries a payload together with its position in the source.
 * For tabular sources the seq is the zero-based row index of the loaded table.
 */
public final class Record<T> {
    private final long seq;
    private final T payload;

    public Record(long seq, T payload) {
        this.seq = seq;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public T payload() { return payload; }

    /** Same position, new payload. */
    public <R> Record<R> withPayload(R newPayload) {
        return new Record<>(seq, newPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", payload=" + payload +
                '}';
    }
}
