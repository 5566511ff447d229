package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One event on the wire.
 *
 * <p>The event is carried as its raw JSON record; it is normalized only when it
 * reaches the ledger on the far side.</p>
 *
 * @param bridgeSeq per-sender sequence, starting at 1 and increasing by one per
 *                  envelope built
 * @param bridgeTs  sender wall clock, epoch milliseconds
 */
public record TransportEnvelope(int version, long bridgeSeq, long bridgeTs, Direction direction, JsonNode event) {

    public static final int VERSION = 1;

    public TransportEnvelope {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(event, "event");
        if (bridgeSeq < 1) {
            throw new IllegalArgumentException("bridgeSeq must be >= 1");
        }
    }

    public static TransportEnvelope of(long bridgeSeq, long bridgeTs, Direction direction, JsonNode event) {
        return new TransportEnvelope(VERSION, bridgeSeq, bridgeTs, direction, event);
    }
}
