package com.questrail.killswitch.transport.udp;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.api.AlarmSubscription;
import com.questrail.killswitch.codec.AlarmRecordCodec;
import com.questrail.killswitch.observability.AlarmErrorEvent;
import com.questrail.killswitch.observability.AlarmObservabilitySink;
import com.questrail.killswitch.observability.NullObservabilitySink;
import com.questrail.killswitch.time.WallClock;
import com.questrail.killswitch.transport.DatagramEndpoint;
import com.questrail.killswitch.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * AlarmDatagramPublisher
 * =============================================================================
 * Alarm egress: forwards every record of a set of alarms to remote consumers
 * (hardware cutoff driver, mission supervisor, test harness).
 *
 * <h2>Outbound Data Flow</h2>
 * <pre>
 *   AlarmBus delivery
 *        → AlarmRecordCodec.encode
 *            → DatagramEndpoint.send (one datagram per target)
 * </pre>
 *
 * <h2>Query</h2>
 * A datagram received on the egress endpoint whose payload is a UTF-8 alarm
 * name is answered, to its sender only, with that alarm's current record.
 * Names outside the published set are ignored.
 *
 * <h2>Transport up</h2>
 * Snapshots delivered while the socket is still binding are lost by the
 * transport, so every published alarm's current record is re-sent when the
 * transport comes up. Remote consumers order records by sequence and discard
 * duplicates.
 *
 * <h2>Errors</h2>
 * A record the codec rejects, or one whose frame exceeds
 * {@link #MAX_DATAGRAM_BYTES}, is reported to the observability sink and not
 * sent. The subscription stays active for later records.
 */
public final class AlarmDatagramPublisher implements DatagramEndpointListener, AutoCloseable
{
    /** Largest UDP payload over IPv4: 65,535 minus the IP and UDP headers. */
    public static final int MAX_DATAGRAM_BYTES = 65_507;

    private final AlarmBus bus;
    private final DatagramEndpoint endpoint;
    private final AlarmRecordCodec codec;
    private final List<SocketAddress> targets;
    private final Set<String> alarmNames;
    private final WallClock wallClock;
    private final AlarmObservabilitySink observabilitySink;

    private final List<AlarmSubscription> subscriptions = new ArrayList<>();

    public AlarmDatagramPublisher(AlarmBus bus,
                                  DatagramEndpoint endpoint,
                                  AlarmRecordCodec codec,
                                  List<? extends SocketAddress> targets,
                                  Set<String> alarmNames,
                                  WallClock wallClock,
                                  AlarmObservabilitySink observabilitySink)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        this.alarmNames = Set.copyOf(Objects.requireNonNull(alarmNames, "alarmNames"));
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    /**
     * Starts the transport and subscribes to every published alarm.
     */
    public synchronized void start() {
        if (!subscriptions.isEmpty()) {
            return;
        }
        endpoint.start();
        for (String name : alarmNames) {
            subscriptions.add(bus.subscribe(name, this::publish));
        }
    }

    public synchronized void stop() {
        subscriptions.forEach(AlarmSubscription::close);
        subscriptions.clear();
        endpoint.stop();
    }

    @Override
    public void close() {
        stop();
    }

    public Set<String> alarmNames() {
        return alarmNames;
    }

    @Override
    public void onTransportUp() {
        for (String name : alarmNames) {
            publish(bus.getOrCreate(name));
        }
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            observabilitySink.onError(new AlarmErrorEvent(wallClock.now(), "Alarm egress transport down", cause));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        String name = new String(payload, StandardCharsets.UTF_8).trim();
        if (!alarmNames.contains(name)) {
            return;
        }
        byte[] encoded = encode(bus.getOrCreate(name));
        if (encoded != null) {
            endpoint.send(remote, encoded);
        }
    }

    private void publish(AlarmRecord record) {
        byte[] encoded = encode(record);
        if (encoded == null) {
            return;
        }
        for (SocketAddress target : targets) {
            endpoint.send(target, encoded);
        }
    }

    private byte[] encode(AlarmRecord record) {
        final byte[] encoded;
        try {
            encoded = codec.encode(record);
        } catch (RuntimeException e) {
            observabilitySink.onError(new AlarmErrorEvent(
                    wallClock.now(),
                    "Cannot encode " + record.name() + " seq " + record.sequence(),
                    e
            ));
            return null;
        }

        if (encoded.length > MAX_DATAGRAM_BYTES) {
            observabilitySink.onError(new AlarmErrorEvent(
                    wallClock.now(),
                    "Encoded " + record.name() + " seq " + record.sequence() + " is " + encoded.length
                            + " bytes, exceeds UDP payload limit of " + MAX_DATAGRAM_BYTES,
                    null
            ));
            return null;
        }
        return encoded;
    }
}
