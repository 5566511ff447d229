package com.questrail.kernel.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Identifier minting for events, traces and spans.
 */
public final class EventIds {

    private EventIds() {}

    public static String newEventId() {
        return "evt_" + compactUuid();
    }

    /**
     * Mint a trace id. Only origin points may call this; downstream hops
     * propagate the id they were given.
     */
    public static String newTraceId() {
        return "trc_" + compactUuid();
    }

    public static String newSpanId() {
        return "spn_" + compactUuid().substring(0, 16);
    }

    /**
     * Deterministic span id for events that arrive without one. The same hop
     * always maps to the same span.
     */
    public static String derivedSpanId(String traceId, Stage stage, String source, String workerId) {
        String material = traceId + "|" + stage.wireName() + "|" + source + "|" + workerId;
        return "spn_" + sha256Hex(material).substring(0, 16);
    }

    public static String sha256Hex(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String compactUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
