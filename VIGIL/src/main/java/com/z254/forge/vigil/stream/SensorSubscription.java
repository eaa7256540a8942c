package com.z254.forge.vigil.stream;

import java.time.Duration;
import java.util.List;

/**
 * An open subscription. Used by the ingestion thread only, except for {@link #wakeup()}.
 */
public interface SensorSubscription extends AutoCloseable {

    /**
     * Block up to {@code timeout} for the next payloads, in bus order. Returns an empty
     * list on timeout or after {@link #wakeup()}.
     *
     * @throws FeedConnectionException if the subscription broke
     */
    List<String> poll(Duration timeout) throws FeedConnectionException;

    /**
     * Abort a blocking {@link #poll(Duration)} from another thread.
     */
    void wakeup();

    @Override
    void close();
}
