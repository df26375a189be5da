package com.questrail.killswitch.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by the implementation (Netty endpoints
 * deliver them on the channel's event loop).</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received. The payload is a full datagram,
     * copied out of any framework buffer.
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
