package com.questrail.uprotocol.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery settings for the in-process transport.
 *
 * @param deliveryMode  whether listeners run on the sending thread or on a
 *                      dedicated dispatcher thread
 * @param queueCapacity bound of the dispatch queue (queued mode only)
 * @param offerTimeout  how long {@code send} waits for queue space before
 *                      reporting the queue as full
 */
public record LocalTransportConfig(
    DeliveryMode deliveryMode,
    int queueCapacity,
    Duration offerTimeout
) {
    public enum DeliveryMode {
        SYNCHRONOUS,
        QUEUED
    }

    public LocalTransportConfig {
        Objects.requireNonNull(deliveryMode, "deliveryMode");
        Objects.requireNonNull(offerTimeout, "offerTimeout");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must be >= 0");
        }
    }

    public static LocalTransportConfig synchronous() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DeliveryMode deliveryMode = DeliveryMode.SYNCHRONOUS;
        private int queueCapacity = 1024;
        private Duration offerTimeout = Duration.ofMillis(5);

        public Builder withDeliveryMode(DeliveryMode deliveryMode) {
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder withQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder withOfferTimeout(Duration offerTimeout) {
            this.offerTimeout = offerTimeout;
            return this;
        }

        public LocalTransportConfig build() {
            return new LocalTransportConfig(deliveryMode, queueCapacity, offerTimeout);
        }
    }
}
