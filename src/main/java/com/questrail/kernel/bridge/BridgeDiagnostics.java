package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.EventJson;

/**
 * Point-in-time counters of one bridge link.
 *
 * @param lastForwardedAt wall-clock millis of the last transmitted envelope, 0 if none
 * @param lastDroppedAt   wall-clock millis of the last outbound drop, 0 if none
 * @param missingCount    inbound envelopes never received, summed over all gaps
 * @param lateCount       inbound envelopes behind the expected sequence
 */
public record BridgeDiagnostics(
        boolean linkUp,
        long forwardedCount,
        long droppedCount,
        int queueDepth,
        long lastBridgeSeq,
        long lastForwardedAt,
        long lastDroppedAt,
        int pendingDropGroups,
        long receivedCount,
        long gapCount,
        long missingCount,
        long decodeErrors,
        long sequenceResets,
        long lateCount
) {
    public ObjectNode toPayload() {
        ObjectNode p = EventJson.objectNode();
        p.put("bridgeVersion", TransportEnvelope.VERSION);
        p.put("linkUp", linkUp);
        p.put("forwardedCount", forwardedCount);
        p.put("droppedCount", droppedCount);
        p.put("queueDepth", queueDepth);
        p.put("lastBridgeSeq", lastBridgeSeq);
        p.put("lastForwardedAt", lastForwardedAt);
        p.put("lastDroppedAt", lastDroppedAt);
        p.put("pendingDropGroups", pendingDropGroups);
        p.put("receivedCount", receivedCount);
        p.put("gapCount", gapCount);
        p.put("missingCount", missingCount);
        p.put("decodeErrors", decodeErrors);
        p.put("sequenceResets", sequenceResets);
        p.put("lateCount", lateCount);
        return p;
    }
}
