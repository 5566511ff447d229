package com.questrail.kernel.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FailureClassifierTest {

    private static Event event(String id, String type, Stage stage, EventStatus status, ObjectNode payload) {
        return Event.builder()
                .eventId(id)
                .traceId("t1")
                .spanId("s-" + id)
                .type(type)
                .stage(stage)
                .source("test")
                .status(status)
                .payload(payload)
                .build();
    }

    @Test
    void explicitViolationKindWins() {
        ObjectNode p = EventJson.objectNode();
        p.put("kind", "focus_lock");
        Event v = event("v", EventTypes.CONTRACT_VIOLATION, Stage.INJECT, EventStatus.FAILED, p);

        FailureClassifier.Classification c = FailureClassifier.classify(v, List.of(v));

        assertEquals(FailureClass.FOCUS_LOCK, c.failureClass());
        assertEquals(FailureClassifier.EXPLICIT, c.confidence());
    }

    @Test
    void ackTimeoutIsAnAckGap() {
        Event t = event("t", EventTypes.COMMAND_ACK_TIMEOUT, Stage.ACK, EventStatus.TIMEOUT, null);

        FailureClassifier.Classification c = FailureClassifier.classify(t, List.of(t));

        assertEquals(FailureClass.ACK_GAP, c.failureClass());
        assertEquals(FailureClassifier.EXPLICIT, c.confidence());
    }

    @Test
    void recordedReasonsClassifyDroppedRequests() {
        ObjectNode p = EventJson.objectNode();
        p.putArray("reasons").add("compaction_gate").add("focus_lock");
        Event d = event("d", EventTypes.INJECT_DROPPED, Stage.INJECT, EventStatus.DROPPED, p);

        FailureClassifier.Classification c = FailureClassifier.classify(d, List.of(d));

        assertEquals(FailureClass.COMPACTION_GATE, c.failureClass());
        assertEquals(FailureClassifier.FROM_REASONS, c.confidence());
    }

    @Test
    void unacknowledgedTransportIsInferredAckGap() {
        Event sent = event("sent", "command.requested", Stage.TRANSPORT, EventStatus.OK, null);
        Event failed = event("failed", "inject.failed", Stage.TERMINAL, EventStatus.FAILED, null);

        FailureClassifier.Classification c = FailureClassifier.classify(failed, List.of(sent, failed));

        assertEquals(FailureClass.ACK_GAP, c.failureClass());
        assertEquals(FailureClassifier.INFERRED, c.confidence());
    }

    @Test
    void noEvidenceIsUnknown() {
        Event failed = event("failed", "inject.failed", Stage.INJECT, EventStatus.FAILED, null);

        FailureClassifier.Classification c = FailureClassifier.classify(failed, List.of(failed));

        assertEquals(FailureClass.UNKNOWN, c.failureClass());
        assertEquals(FailureClassifier.NONE, c.confidence());
    }
}
