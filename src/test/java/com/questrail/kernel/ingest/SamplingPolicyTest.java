package com.questrail.kernel.ingest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SamplingPolicyTest {

    private final EventFactory events = new EventFactory("test", new ManualWallClock(0), new SourceSequencer());

    private Event event(String type, ObjectNode payload) {
        return events.builder(type, Stage.TERMINAL, TraceContext.origin("w1")).payload(payload).build();
    }

    @Test
    void terminalOutputKeepsOnlyMetadata() {
        ObjectNode p = EventJson.objectNode();
        p.put("chunk", "\u001B[32mhello\u001B[0m");

        ObjectNode out = SamplingPolicy.defaults().apply(event(EventTypes.TERMINAL_OUTPUT, p)).payload();

        assertFalse(out.has("chunk"));
        assertEquals(14, out.get("byteLength").asInt());
        assertTrue(out.get("meaningful").asBoolean());
        assertFalse(out.get("sampled").asBoolean());
    }

    @Test
    void escapeOnlyOutputIsNotMeaningful() {
        assertFalse(SamplingPolicy.isMeaningful("\u001B[2J\u001B[H\r\n"));
        assertTrue(SamplingPolicy.isMeaningful("  ok\n"));
    }

    @Test
    void bodyAndMessageAreRedactedOnAnyType() {
        ObjectNode p = EventJson.objectNode();
        p.put("body", "secret prompt");
        p.put("message", "abc");
        p.put("other", "kept");

        ObjectNode out = SamplingPolicy.defaults().apply(event("inject.requested", p)).payload();

        assertTrue(out.get("body").get("redacted").asBoolean());
        assertEquals(13, out.get("body").get("length").asInt());
        assertEquals(3, out.get("message").get("length").asInt());
        assertEquals("kept", out.get("other").asText());
    }

    @Test
    void devModeStoresPayloadsUnchanged() {
        ObjectNode p = EventJson.objectNode();
        p.put("chunk", "raw");
        Event e = event(EventTypes.TERMINAL_OUTPUT, p);

        assertSame(e, SamplingPolicy.defaults().withDevMode(true).apply(e));
    }
}
