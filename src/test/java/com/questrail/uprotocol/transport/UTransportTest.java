package com.questrail.uprotocol.transport;

import com.questrail.uprotocol.api.Result;
import com.questrail.uprotocol.api.UCode;
import com.questrail.uprotocol.api.UMessage;
import com.questrail.uprotocol.api.UPayload;
import com.questrail.uprotocol.api.UPayloadFormat;
import com.questrail.uprotocol.api.UStatus;
import com.questrail.uprotocol.api.UUri;
import com.questrail.uprotocol.builder.UMessageBuilder;
import com.questrail.uprotocol.config.TransportConfig;
import com.questrail.uprotocol.observability.ListenerLifecycleEvent;
import com.questrail.uprotocol.observability.ListenerLifecycleEvent.Phase;
import com.questrail.uprotocol.observability.RecordingObservabilitySink;
import com.questrail.uprotocol.observability.SendOutcomeEvent;
import com.questrail.uprotocol.observability.TransportErrorEvent;
import com.questrail.uprotocol.observability.TransportObservabilitySink;
import com.questrail.uprotocol.uuid.UuidBuilder;
import com.questrail.uprotocol.uuid.UuidGenerator;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class UTransportTest {

    private static final UUri SOURCE = UUri.of("vehicle", 0x18000, 1, 0);
    private static final UUri SINK = UUri.of("vehicle", 0x1234, 1, 0);
    private static final UUri TOPIC = UUri.of("vehicle", 0x18000, 1, 0x8001);

    private final UuidGenerator ids = UuidBuilder.getTestBuilder();

    private UMessage notification(int i) {
        return UMessageBuilder.notification(SOURCE, SINK)
                .withPayload(UPayload.of(new byte[] { (byte) i, (byte) (i >> 8) }, UPayloadFormat.RAW))
                .withIdGenerator(ids)
                .build();
    }

    @Test
    void cleanupGetsCalledWithListener() {
        UTransportMock transport = new UTransportMock(SOURCE);

        Result<ListenerHandle> maybeHandle = transport.registerListener(transport.getDefaultSource(), m -> {});
        assertTrue(maybeHandle.isOk());
        ListenerHandle handle = maybeHandle.value();

        assertTrue(handle.isActive());
        assertTrue(transport.lastListener.isValid());
        assertNull(transport.lastCleanupListener);
        assertEquals(0, transport.cleanupCount.get());

        handle.release();

        assertFalse(handle.isActive());
        assertFalse(transport.lastListener.isValid());
        assertFalse(transport.lastCleanupListener.isValid());
        assertEquals(1, transport.cleanupCount.get());
        assertEquals(transport.lastListener, transport.lastCleanupListener);
    }

    @Test
    void handleExposesRegisteredConnectionUntilReleased() {
        UTransportMock transport = new UTransportMock(SOURCE);
        ListenerHandle handle = transport.registerListener(SINK, m -> {}).value();

        assertEquals(Optional.of(transport.lastListener), handle.connection());

        handle.release();

        assertTrue(handle.connection().isEmpty());
    }

    @Test
    void releasingTwiceCleansUpOnce() {
        UTransportMock transport = new UTransportMock(SOURCE);
        ListenerHandle handle = transport.registerListener(SINK, m -> {}).value();

        handle.release();
        handle.release();
        handle.close();

        assertEquals(1, transport.cleanupCount.get());
    }

    @Test
    void tryWithResourcesReleasesHandle() {
        UTransportMock transport = new UTransportMock(SOURCE);

        try (ListenerHandle handle = transport.registerListener(SINK, m -> {}).value()) {
            assertTrue(handle.isActive());
            assertEquals(0, transport.cleanupCount.get());
        }

        assertEquals(1, transport.cleanupCount.get());
    }

    @Test
    void transferredHandleOwnsTheCleanup() {
        UTransportMock transport = new UTransportMock(SOURCE);
        ListenerHandle original = transport.registerListener(SINK, m -> {}).value();

        ListenerHandle moved = original.transfer();
        original.release();

        assertEquals(0, transport.cleanupCount.get());
        assertFalse(original.isActive());
        assertTrue(moved.isActive());
        assertTrue(transport.lastListener.isValid());

        moved.release();
        original.release();

        assertEquals(1, transport.cleanupCount.get());
        assertSame(transport.lastListener, transport.lastCleanupListener);
    }

    @Test
    void failedRegistrationReturnsHookStatusAndNeverCleansUp() {
        UTransportMock transport = new UTransportMock(SOURCE);
        UStatus refused = UStatus.of(UCode.PERMISSION_DENIED, "not allowed");
        transport.nextListenStatus = refused;

        Result<ListenerHandle> result = transport.registerListener(SINK, m -> fail("must not be called"));

        assertFalse(result.isOk());
        assertEquals(refused, result.status());
        assertThrows(IllegalStateException.class, result::value);
        assertEquals(1, transport.registerCount.get());
        assertFalse(transport.lastListener.isValid());
        assertFalse(transport.mockMessage(notification(0)));
        assertEquals(0, transport.cleanupCount.get());
    }

    @Test
    void nextListenStatusOnlyAffectsOneRegistration() {
        UTransportMock transport = new UTransportMock(SOURCE);
        transport.nextListenStatus = UStatus.of(UCode.UNAVAILABLE, "down");

        assertFalse(transport.registerListener(SINK, m -> {}).isOk());
        assertTrue(transport.registerListener(SINK, m -> {}).isOk());
    }

    @Test
    void registrationForwardsFilters() {
        UTransportMock transport = new UTransportMock(SOURCE);

        transport.registerListener(SINK, m -> {});
        assertEquals(SINK, transport.lastSinkFilter);
        assertEquals(Optional.empty(), transport.lastSourceFilter);

        transport.registerListener(UUri.ANY, m -> {}, TOPIC);
        assertEquals(UUri.ANY, transport.lastSinkFilter);
        assertEquals(Optional.of(TOPIC), transport.lastSourceFilter);
    }

    @Test
    void eachRegistrationGetsItsOwnConnection() {
        UTransportMock transport = new UTransportMock(SOURCE);
        UListener shared = m -> {};

        transport.registerListener(SINK, shared);
        CallableConn first = transport.lastListener;
        transport.registerListener(SINK, shared);
        CallableConn second = transport.lastListener;

        assertNotEquals(first, second);
    }

    @Test
    void injectedMessagesAreDeliveredInOrder() {
        UTransportMock transport = new UTransportMock(SOURCE);
        List<UMessage> received = new ArrayList<>();
        ListenerHandle handle = transport.registerListener(SINK, received::add).value();

        List<UMessage> injected = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            UMessage message = notification(i);
            injected.add(message);
            assertTrue(transport.mockMessage(message));
        }

        assertEquals(1000, received.size());
        for (int i = 0; i < 1000; i++) {
            assertSame(injected.get(i), received.get(i));
        }
        handle.release();
    }

    @Test
    void releasedListenerIsNotInvoked() {
        UTransportMock transport = new UTransportMock(SOURCE);
        List<UMessage> received = new ArrayList<>();
        ListenerHandle handle = transport.registerListener(SINK, received::add).value();
        CallableConn registered = transport.lastListener;

        handle.release();

        assertFalse(transport.mockMessage(notification(1)));
        assertTrue(received.isEmpty());
        assertEquals(1, transport.cleanupCount.get());
        assertSame(registered, transport.lastCleanupListener);
    }

    @Test
    void sendReturnsHookStatusVerbatim() {
        UTransportMock transport = new UTransportMock(SOURCE);
        UStatus failure = UStatus.of(UCode.DATA_LOSS, "medium dropped the frame");
        transport.nextSendStatus = failure;
        byte[] body = { 0x01, 0x02, 0x03, (byte) 0xFF };
        UMessage message = UMessageBuilder.notification(SOURCE, SINK)
                .withPayload(UPayload.of(body, UPayloadFormat.RAW))
                .withIdGenerator(ids)
                .build();

        UStatus status = transport.send(message);

        assertEquals(UCode.DATA_LOSS, status.code());
        assertEquals("medium dropped the frame", status.message());
        assertSame(message, transport.lastSentMessage);
        assertArrayEquals(body, transport.lastSentMessage.payload().toByteArray());
    }

    @Test
    void sendCountsEveryAttempt() {
        UTransportMock transport = new UTransportMock(SOURCE);

        transport.send(notification(1));
        transport.nextSendStatus = UStatus.of(UCode.UNAVAILABLE, "");
        transport.send(notification(2));
        UStatus third = transport.send(notification(3));

        assertEquals(3, transport.sendCount.get());
        assertTrue(third.isOk());
    }

    @Test
    void sendRejectsNullMessage() {
        UTransportMock transport = new UTransportMock(SOURCE);
        assertThrows(NullPointerException.class, () -> transport.send(null));
        assertEquals(0, transport.sendCount.get());
    }

    @Test
    void throwingSendHookBecomesInternalStatus() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        UTransport transport = new ThrowingTransport(TransportConfig.builder()
                .withDefaultSource(SOURCE)
                .withObservability(sink)
                .build());

        UStatus status = transport.send(notification(1));

        assertEquals(UCode.INTERNAL, status.code());
        assertEquals(1, sink.getErrors().size());
        assertTrue(sink.getErrors().get(0).cause() instanceof IllegalStateException);
    }

    @Test
    void throwingRegisterHookYieldsErrorAndNoHandle() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ThrowingTransport transport = new ThrowingTransport(TransportConfig.builder()
                .withDefaultSource(SOURCE)
                .withObservability(sink)
                .build());

        Result<ListenerHandle> result = transport.registerListener(SINK, m -> {});

        assertEquals(UCode.INTERNAL, result.status().code());
        assertEquals(List.of(Phase.REJECTED), sink.getListenerPhases());
        assertEquals(0, transport.cleanups);
    }

    @Test
    void lifecycleAndSendOutcomesAreObserved() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        UTransportMock transport = new UTransportMock(TransportConfig.builder()
                .withDefaultSource(SOURCE)
                .withObservability(sink)
                .build());

        transport.nextListenStatus = UStatus.of(UCode.INVALID_ARGUMENT, "bad filter");
        transport.registerListener(SINK, m -> {});
        transport.registerListener(SINK, m -> {}).value().release();

        UMessage message = notification(7);
        transport.send(message);

        assertEquals(List.of(Phase.REJECTED, Phase.REGISTERED, Phase.CLEANED_UP), sink.getListenerPhases());
        assertEquals(1, sink.getSendEvents().size());
        assertEquals(message.attributes().id(), sink.getSendEvents().get(0).messageId());
        assertTrue(sink.getSendEvents().get(0).status().isOk());
    }

    @Test
    void defaultSourceIsFixedAtConstruction() {
        UTransportMock transport = new UTransportMock(SOURCE);
        assertEquals(SOURCE, transport.getDefaultSource());
    }

    @Test
    void failingObservabilitySinkDoesNotChangeOutcomes() {
        UTransportMock transport = new UTransportMock(TransportConfig.builder()
                .withDefaultSource(SOURCE)
                .withObservability(new ThrowingSink())
                .build());

        transport.nextSendStatus = UStatus.of(UCode.UNAVAILABLE, "link down");
        assertEquals(UCode.UNAVAILABLE, assertDoesNotThrow(() -> transport.send(notification(1))).code());
        assertTrue(assertDoesNotThrow(() -> transport.send(notification(2))).isOk());

        Result<ListenerHandle> registered = assertDoesNotThrow(() -> transport.registerListener(SINK, m -> {}));
        assertTrue(registered.isOk());
        assertDoesNotThrow(registered.value()::release);
        assertEquals(1, transport.cleanupCount.get());

        transport.nextListenStatus = UStatus.of(UCode.INVALID_ARGUMENT, "bad filter");
        Result<ListenerHandle> rejected = assertDoesNotThrow(() -> transport.registerListener(SINK, m -> {}));
        assertEquals(UCode.INVALID_ARGUMENT, rejected.status().code());
    }

    private static final class ThrowingSink implements TransportObservabilitySink {
        @Override
        public void onListenerEvent(ListenerLifecycleEvent event) {
            throw new IllegalStateException("listener events unavailable");
        }

        @Override
        public void onSendEvent(SendOutcomeEvent event) {
            throw new IllegalStateException("send events unavailable");
        }

        @Override
        public void onError(TransportErrorEvent event) {
            throw new IllegalStateException("error events unavailable");
        }
    }

    private static final class ThrowingTransport extends UTransport {
        int cleanups;

        ThrowingTransport(TransportConfig config) {
            super(config);
        }

        @Override
        protected UStatus sendImpl(UMessage message) {
            throw new IllegalStateException("medium exploded");
        }

        @Override
        protected UStatus registerListenerImpl(UUri sinkFilter, CallableConn listener, Optional<UUri> sourceFilter) {
            throw new IllegalStateException("no slots");
        }

        @Override
        protected void cleanupListener(CallableConn listener) {
            cleanups++;
        }
    }
}
