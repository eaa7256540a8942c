package com.z254.forge.vigil.stream;

/**
 * Source of raw sensor messages.
 */
public interface SensorFeed {

    /**
     * Open a subscription to the sensor channel.
     *
     * @throws FeedConnectionException if the bus cannot be reached
     */
    SensorSubscription subscribe() throws FeedConnectionException;

    /**
     * Channel name, for logging.
     */
    String channel();
}
