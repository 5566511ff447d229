package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;

import java.util.Objects;

/**
 * Builders for the command path.
 *
 * <p>A command travels in the trace it was issued from. Its acknowledgment is a
 * child of the command and names it in {@code ackOfEventId}, whatever the
 * outcome.</p>
 */
public final class CommandAcks {

    private CommandAcks() {}

    public static Event command(EventFactory events, TraceContext ctx, String command, ObjectNode args) {
        Objects.requireNonNull(command, "command");
        ObjectNode p = EventJson.objectNode();
        p.put("command", command);
        p.set("args", args != null ? args.deepCopy() : EventJson.objectNode());
        return events.builder(EventTypes.COMMAND_REQUESTED, Stage.TRANSPORT, ctx)
                .payload(p)
                .build();
    }

    /**
     * @param detail free text for rejections and errors; may be {@code null}
     */
    public static Event ack(EventFactory events, Event command, AckStatus status, String detail) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(status, "status");
        ObjectNode p = EventJson.objectNode();
        p.put("status", status.wireName());
        String name = EventJson.text(command.payload(), "command");
        if (name != null) {
            p.put("command", name);
        }
        if (detail != null) {
            p.put("detail", detail);
        }
        return events.builder(EventTypes.COMMAND_ACK, Stage.ACK, TraceContext.after(command))
                .status(status.eventStatus())
                .ackOfEventId(command.eventId())
                .payload(p)
                .build();
    }
}
