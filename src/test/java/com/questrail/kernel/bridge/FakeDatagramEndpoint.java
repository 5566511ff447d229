package com.questrail.kernel.bridge;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint} implementation.
 *
 * <p>Stores outbound datagrams, lets tests inject inbound ones and flip the
 * link up and down without a socket.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {}

    private DatagramEndpointListener listener;
    private final List<Sent> sent = new ArrayList<>();

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        sent.add(new Sent(remote, payload));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        requireListener().onDatagram(remote, payload);
    }

    public void simulateDown(Throwable cause) {
        requireListener().onTransportDown(cause);
    }

    public void simulateUp() {
        requireListener().onTransportUp();
    }

    /**
     * Every sent payload decoded back into its envelope.
     */
    public List<TransportEnvelope> sentEnvelopes() {
        List<TransportEnvelope> out = new ArrayList<>();
        for (Sent s : sent) {
            try {
                out.add(EnvelopeCodec.decode(s.payload()));
            } catch (EnvelopeDecodeException e) {
                throw new AssertionError("sent an undecodable datagram", e);
            }
        }
        return out;
    }

    public List<Sent> sent() {
        return Collections.unmodifiableList(sent);
    }

    public void clear() {
        sent.clear();
    }

    private DatagramEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
