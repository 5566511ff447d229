package com.questrail.kernel.bridge;

/**
 * A datagram could not be decoded into a {@link TransportEnvelope}.
 */
public final class EnvelopeDecodeException extends Exception {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
