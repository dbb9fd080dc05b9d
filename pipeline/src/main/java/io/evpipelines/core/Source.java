package io.evpipelines.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces records in ascending seq order.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record. Returns empty once the source is exhausted; {@link #isFinished()}
     * then reports true.
     */
    Optional<Record<T>> poll() throws IOException;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
