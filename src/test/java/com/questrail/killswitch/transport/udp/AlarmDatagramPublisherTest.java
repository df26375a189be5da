package com.questrail.killswitch.transport.udp;

import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.codec.AlarmRecordCodec;
import com.questrail.killswitch.codec.impl.BinaryAlarmRecordCodec;
import com.questrail.killswitch.core.AlarmBroadcaster;
import com.questrail.killswitch.core.AlarmNames;
import com.questrail.killswitch.core.DefaultAlarmBus;
import com.questrail.killswitch.observability.RecordingObservabilitySink;
import com.questrail.killswitch.time.SystemWallClock;
import com.questrail.killswitch.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AlarmDatagramPublisherTest
 * -----------------------------------------------------------------------------
 * Egress delivery runs on listener threads, so assertions poll the fake
 * endpoint.
 */
class AlarmDatagramPublisherTest {

    private static final InetSocketAddress CUTOFF = new InetSocketAddress("127.0.0.1", 41000);
    private static final InetSocketAddress SUPERVISOR = new InetSocketAddress("127.0.0.1", 41001);
    private static final InetSocketAddress QUERIER = new InetSocketAddress("127.0.0.1", 41002);

    private final BinaryAlarmRecordCodec codec = new BinaryAlarmRecordCodec();

    private DefaultAlarmBus bus;
    private FakeDatagramEndpoint endpoint;
    private RecordingObservabilitySink sink;
    private AlarmDatagramPublisher publisher;

    @BeforeEach
    void setUp() {
        bus = new DefaultAlarmBus();
        endpoint = new FakeDatagramEndpoint();
        sink = new RecordingObservabilitySink();
        publisher = newPublisher(codec);
        publisher.start();
    }

    @AfterEach
    void tearDown() {
        publisher.close();
        bus.close();
    }

    @Test
    void currentRecordsAreSentOnStart() {
        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();

        assertFalse(sent.isEmpty());
        assertTrue(sent.stream().anyMatch(s -> s.remote().equals(CUTOFF)
                && codec.decode(s.payload()).name().equals(AlarmNames.KILL)));
        assertTrue(sent.stream().anyMatch(s -> s.remote().equals(SUPERVISOR)
                && codec.decode(s.payload()).name().equals(AlarmNames.HW_KILL)));
    }

    @Test
    void everyBroadcastReachesEveryTarget() throws InterruptedException {
        endpoint.clear();

        new AlarmBroadcaster(bus, AlarmNames.KILL, "kill-aggregator").raiseAlarm();

        waitUntil(() -> endpoint.sent().size() >= 2);
        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();
        assertEquals(Set.of(CUTOFF, SUPERVISOR), Set.of(sent.get(0).remote(), sent.get(1).remote()));

        AlarmRecord decoded = codec.decode(sent.get(0).payload());
        assertTrue(decoded.raised());
        assertEquals(1L, decoded.sequence());
        assertEquals("kill-aggregator", decoded.raisedBy());
    }

    @Test
    void unpublishedAlarmsStayLocal() throws InterruptedException {
        endpoint.clear();

        new AlarmBroadcaster(bus, "bilge-pump", "sensor").raiseAlarm();
        new AlarmBroadcaster(bus, AlarmNames.HW_KILL, "estop").raiseAlarm();

        waitUntil(() -> endpoint.sent().size() >= 2);
        for (FakeDatagramEndpoint.Sent s : endpoint.sent()) {
            assertEquals(AlarmNames.HW_KILL, codec.decode(s.payload()).name());
        }
    }

    @Test
    void queryIsAnsweredToSenderOnly() {
        bus.broadcast(AlarmNames.HW_KILL, true, "estop", java.util.Map.of(), "estop", 4);
        publisher.stop();
        endpoint.clear();
        publisher.start();
        endpoint.clear();

        endpoint.injectDatagram(QUERIER, AlarmNames.HW_KILL.getBytes(StandardCharsets.UTF_8));

        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();
        assertEquals(1, sent.size());
        assertEquals(QUERIER, sent.get(0).remote());
        AlarmRecord answer = codec.decode(sent.get(0).payload());
        assertTrue(answer.raised());
        assertEquals(4, answer.severity());
    }

    @Test
    void queryForUnpublishedAlarmIsIgnored() {
        endpoint.clear();

        endpoint.injectDatagram(QUERIER, "bilge-pump".getBytes(StandardCharsets.UTF_8));
        endpoint.injectDatagram(QUERIER, new byte[] { (byte) 0xC3 });

        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void encodeFailureIsReportedNotThrown() throws InterruptedException {
        publisher.close();
        endpoint = new FakeDatagramEndpoint();
        AlarmRecordCodec failing = new AlarmRecordCodec() {
            @Override
            public byte[] encode(AlarmRecord record) {
                throw new IllegalArgumentException("cannot encode");
            }

            @Override
            public AlarmRecord decode(byte[] payload) {
                throw new UnsupportedOperationException();
            }
        };
        publisher = newPublisher(failing);
        publisher.start();

        assertTrue(endpoint.sent().isEmpty());
        waitUntil(() -> !sink.getErrors().isEmpty());
        assertTrue(sink.getErrors().get(0).message().contains("Cannot encode"));
    }

    @Test
    void unexpectedCodecExceptionDoesNotEndEgress() throws InterruptedException {
        publisher.close();
        endpoint = new FakeDatagramEndpoint();
        AlarmRecordCodec overflowing = new AlarmRecordCodec() {
            @Override
            public byte[] encode(AlarmRecord record) {
                if (record.severity() == 3) {
                    throw new ArithmeticException("long overflow");
                }
                return codec.encode(record);
            }

            @Override
            public AlarmRecord decode(byte[] payload) {
                return codec.decode(payload);
            }
        };
        publisher = newPublisher(overflowing);
        publisher.start();
        endpoint.clear();

        bus.broadcast(AlarmNames.KILL, true, "bad clock", java.util.Map.of(), "test", 3);
        AlarmRecord good = bus.broadcast(AlarmNames.KILL, true, "estop", java.util.Map.of(), "test", 5);

        waitUntil(() -> endpoint.sent().size() >= 2);
        for (FakeDatagramEndpoint.Sent s : endpoint.sent()) {
            assertEquals(good.sequence(), codec.decode(s.payload()).sequence());
        }
        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(ArithmeticException.class, sink.getErrors().get(0).cause());
    }

    @Test
    void frameOverUdpPayloadLimitIsReportedNotSent() throws InterruptedException {
        endpoint.clear();
        String big = "x".repeat(40_000);

        bus.broadcast(AlarmNames.KILL, true, big, java.util.Map.of("detail", big), "test", 5);
        AlarmRecord small = new AlarmBroadcaster(bus, AlarmNames.KILL, "test").clearAlarm();

        waitUntil(() -> endpoint.sent().size() >= 2);
        for (FakeDatagramEndpoint.Sent s : endpoint.sent()) {
            assertTrue(s.payload().length <= AlarmDatagramPublisher.MAX_DATAGRAM_BYTES);
            assertEquals(small.sequence(), codec.decode(s.payload()).sequence());
        }
        waitUntil(() -> !sink.getErrors().isEmpty());
        assertTrue(sink.getErrors().get(0).message().contains("exceeds UDP payload limit"));
    }

    @Test
    void stopTakesTransportDown() {
        publisher.stop();
        assertFalse(endpoint.isUp());
    }

    private AlarmDatagramPublisher newPublisher(AlarmRecordCodec c) {
        return new AlarmDatagramPublisher(
                bus,
                endpoint,
                c,
                List.<SocketAddress>of(CUTOFF, SUPERVISOR),
                Set.of(AlarmNames.KILL, AlarmNames.HW_KILL),
                SystemWallClock.INSTANCE,
                sink);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 2s");
            }
            Thread.sleep(5);
        }
    }
}
