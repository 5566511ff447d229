package com.questrail.kernel.bridge;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The transport became usable.
     */
    void onTransportUp();

    /**
     * The transport became unusable.
     *
     * @param cause the failure, or {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * A full datagram arrived. The payload is a private copy.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
