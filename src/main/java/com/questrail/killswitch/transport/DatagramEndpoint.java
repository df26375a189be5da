package com.questrail.killswitch.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once
     * per transition.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Sends before the
     * transport is up are dropped.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
