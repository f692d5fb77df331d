package com.questrail.uprotocol.config;

import com.questrail.uprotocol.api.UUri;
import com.questrail.uprotocol.observability.NullObservabilitySink;
import com.questrail.uprotocol.observability.Slf4jTransportObservabilitySink;
import com.questrail.uprotocol.time.ManualWallClock;
import com.questrail.uprotocol.time.SystemWallClock;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class TransportConfigTest {

    private static final UUri SELF = UUri.of("vehicle", 0x0001, 1, 0);

    @Test
    void defaultsLogThroughSlf4jWithSystemClock() {
        TransportConfig config = TransportConfig.of(SELF);

        assertEquals(SELF, config.defaultSource());
        assertInstanceOf(Slf4jTransportObservabilitySink.class, config.observability());
        assertSame(SystemWallClock.INSTANCE, config.clock());
    }

    @Test
    void builderOverrides() {
        ManualWallClock clock = new ManualWallClock(0);
        TransportConfig config = TransportConfig.builder()
                .withDefaultSource(SELF)
                .withObservability(NullObservabilitySink.INSTANCE)
                .withClock(clock)
                .build();

        assertSame(NullObservabilitySink.INSTANCE, config.observability());
        assertSame(clock, config.clock());
    }

    @Test
    void defaultSourceIsRequired() {
        assertThrows(NullPointerException.class, () -> TransportConfig.builder().build());
    }

    @Test
    void localDefaultsAreSynchronous() {
        LocalTransportConfig config = LocalTransportConfig.synchronous();

        assertEquals(LocalTransportConfig.DeliveryMode.SYNCHRONOUS, config.deliveryMode());
        assertEquals(1024, config.queueCapacity());
        assertEquals(Duration.ofMillis(5), config.offerTimeout());
    }

    @Test
    void localConfigValidation() {
        LocalTransportConfig.Builder builder = LocalTransportConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.withQueueCapacity(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> LocalTransportConfig.builder().withOfferTimeout(Duration.ofMillis(-1)).build());
        assertThrows(NullPointerException.class,
                () -> LocalTransportConfig.builder().withDeliveryMode(null).build());
        assertDoesNotThrow(() -> LocalTransportConfig.builder().withOfferTimeout(Duration.ZERO).build());
    }
}
