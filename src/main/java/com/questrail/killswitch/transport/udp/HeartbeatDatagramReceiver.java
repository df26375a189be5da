package com.questrail.killswitch.transport.udp;

import com.questrail.killswitch.transport.DatagramEndpoint;
import com.questrail.killswitch.transport.DatagramEndpointListener;
import com.questrail.killswitch.watchdog.NetworkLossWatchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * HeartbeatDatagramReceiver
 * =============================================================================
 * Liveness ingress: every datagram received on the heartbeat endpoint is a
 * message for a {@link NetworkLossWatchdog}.
 *
 * <h2>Inbound Data Flow</h2>
 * <pre>
 *   DatagramEndpoint
 *        → HeartbeatDatagramReceiver.onDatagram
 *            → NetworkLossWatchdog.onMessage
 * </pre>
 *
 * <p>The payload is never decoded; its arrival is the signal. Transport down is
 * logged and otherwise ignored: the resulting silence is what the watchdog
 * detects, and there is no separate transport-failure alarm.</p>
 */
public final class HeartbeatDatagramReceiver implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(HeartbeatDatagramReceiver.class);

    private final DatagramEndpoint endpoint;
    private final NetworkLossWatchdog watchdog;

    public HeartbeatDatagramReceiver(DatagramEndpoint endpoint, NetworkLossWatchdog watchdog) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    @Override
    public void onTransportUp() {
        log.info("Heartbeat ingress for {} is up", watchdog.alarmName());
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            log.warn("Heartbeat ingress for {} went down", watchdog.alarmName(), cause);
        } else {
            log.info("Heartbeat ingress for {} stopped", watchdog.alarmName());
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        watchdog.onMessage(payload);
    }
}
