package com.questrail.killswitch.runtime;

import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.codec.AlarmDecodeException;
import com.questrail.killswitch.codec.impl.BinaryAlarmRecordCodec;
import com.questrail.killswitch.config.KillSwitchRuntimeConfig;
import com.questrail.killswitch.core.AlarmNames;
import com.questrail.killswitch.watchdog.WatchdogTimingPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real Netty sockets on loopback, real scheduler.
 */
class KillSwitchRuntimeSmokeTest {

    @Test
    void fullStackLifecycle() throws Exception {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        int heartbeatPort = freePort();

        try (DatagramSocket shore = new DatagramSocket(0, loopback);
             DatagramSocket cutoff = new DatagramSocket(0, loopback)) {
            cutoff.setSoTimeout(200);

            KillSwitchRuntimeConfig config = KillSwitchRuntimeConfig.builder()
                    .withNodeId("smoke")
                    .withNetworkTimingPolicy(WatchdogTimingPolicy.of(Duration.ofMillis(600), Duration.ofMillis(100)))
                    .withHeartbeatBindAddress(new InetSocketAddress(loopback, heartbeatPort))
                    .withAlarmBindAddress(new InetSocketAddress(loopback, 0))
                    .addAlarmTarget(new InetSocketAddress(loopback, cutoff.getLocalPort()))
                    .build();

            KillSwitchRuntime runtime = KillSwitchRuntime.builder(config).build();
            assertNotNull(runtime);
            runtime.start();
            try {
                // No shore link at boot: silent start raises.
                Optional<AlarmRecord> raised = runtime.bus().awaitRecord(
                        AlarmNames.KILL, AlarmRecord::raised, Duration.ofSeconds(3));
                assertTrue(raised.isPresent());
                assertTrue(receiveUntil(cutoff, r -> r.name().equals(AlarmNames.KILL) && r.raised()));

                InetSocketAddress heartbeatTarget = new InetSocketAddress(loopback, heartbeatPort);
                Optional<AlarmRecord> cleared = Optional.empty();
                for (int i = 0; i < 60 && cleared.isEmpty(); i++) {
                    byte[] hb = { 0x01 };
                    shore.send(new DatagramPacket(hb, hb.length, heartbeatTarget));
                    cleared = runtime.bus().awaitRecord(
                            AlarmNames.NETWORK_LOSS, r -> !r.raised(), Duration.ofMillis(50));
                }
                assertTrue(cleared.isPresent(), "heartbeats over UDP must clear network-loss");
                assertTrue(runtime.bus().awaitRecord(
                        AlarmNames.KILL, r -> !r.raised(), Duration.ofSeconds(1)).isPresent());
            } finally {
                runtime.stop();
            }
        }
    }

    private static boolean receiveUntil(DatagramSocket socket, java.util.function.Predicate<AlarmRecord> match)
            throws IOException
    {
        BinaryAlarmRecordCodec codec = new BinaryAlarmRecordCodec();
        byte[] buf = new byte[2048];
        long deadline = System.nanoTime() + Duration.ofSeconds(3).toNanos();

        while (System.nanoTime() < deadline) {
            DatagramPacket packet = new DatagramPacket(buf, buf.length);
            try {
                socket.receive(packet);
            } catch (SocketTimeoutException e) {
                continue;
            }
            try {
                AlarmRecord record = codec.decode(Arrays.copyOf(packet.getData(), packet.getLength()));
                if (match.test(record)) {
                    return true;
                }
            } catch (AlarmDecodeException e) {
                fail("egress sent an undecodable datagram: " + e.getMessage());
            }
        }
        return false;
    }

    private static int freePort() throws IOException {
        try (DatagramSocket socket = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }
}
