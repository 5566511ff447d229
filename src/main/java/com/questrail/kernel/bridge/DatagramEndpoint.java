package com.questrail.kernel.bridge;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for the datagram transport under the bridge.
 *
 * <p>The bridge layers sequencing, drop accounting and decoding on top; the
 * endpoint only moves bytes. Implementations may be backed by Netty or a test
 * harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()} once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener hears {@link DatagramEndpointListener#onTransportDown(Throwable)}
     * at most once per transition.</p>
     */
    void stop();

    /**
     * Send one datagram. A send before the transport is up is discarded.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
