package com.questrail.uprotocol.config;

import com.questrail.uprotocol.api.UUri;
import com.questrail.uprotocol.observability.Slf4jTransportObservabilitySink;
import com.questrail.uprotocol.observability.TransportObservabilitySink;
import com.questrail.uprotocol.time.SystemWallClock;
import com.questrail.uprotocol.time.WallClock;

import java.util.Objects;

/**
 * Configuration shared by every transport.
 *
 * @param defaultSource the transport's own identity, returned by
 *                      {@code UTransport.getDefaultSource()}
 * @param observability receiver of lifecycle, send and error events
 * @param clock         clock used to timestamp observability events
 */
public record TransportConfig(
    UUri defaultSource,
    TransportObservabilitySink observability,
    WallClock clock
) {
    public TransportConfig {
        Objects.requireNonNull(defaultSource, "defaultSource");
        Objects.requireNonNull(observability, "observability");
        Objects.requireNonNull(clock, "clock");
    }

    public static TransportConfig of(UUri defaultSource) {
        return builder().withDefaultSource(defaultSource).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUri defaultSource;
        private TransportObservabilitySink observability = new Slf4jTransportObservabilitySink();
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withDefaultSource(UUri defaultSource) {
            this.defaultSource = defaultSource;
            return this;
        }

        public Builder withObservability(TransportObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(defaultSource, observability, clock);
        }
    }
}
