package com.questrail.kernel.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * FailureClassifier
 * =============================================================================
 * Assigns a {@link FailureClass} to the failing event of a trace.
 *
 * <h2>Evidence, strongest first</h2>
 * <ol>
 *   <li>{@code contract.violation} with a known {@code kind}: 0.9</li>
 *   <li>an acknowledgment timeout ({@code command.ack.timeout}, or an ack-stage
 *       event with status {@code timeout}): {@link FailureClass#ACK_GAP}, 0.9</li>
 *   <li>blocking reasons recorded by the contract engine ({@code reasons} or a
 *       known {@code reason}): 0.75</li>
 *   <li>a transport hop with no acknowledgment or verification after it:
 *       {@link FailureClass#ACK_GAP}, 0.6</li>
 *   <li>otherwise {@link FailureClass#UNKNOWN}, 0.2</li>
 * </ol>
 */
public final class FailureClassifier {

    public static final double EXPLICIT = 0.9;
    public static final double FROM_REASONS = 0.75;
    public static final double INFERRED = 0.6;
    public static final double NONE = 0.2;

    public record Classification(FailureClass failureClass, double confidence, List<String> inputs) {
        public Classification {
            inputs = List.copyOf(inputs);
        }
    }

    private FailureClassifier() {}

    /**
     * @param failing the causally earliest failing event
     * @param trace   every event of the trace
     */
    public static Classification classify(Event failing, List<Event> trace) {
        ObjectNode payload = failing.payload();

        if (EventTypes.CONTRACT_VIOLATION.equals(failing.type())) {
            String kind = EventJson.text(payload, "kind");
            Optional<FailureClass> cls = FailureClass.fromWire(kind);
            if (cls.isPresent()) {
                return new Classification(cls.get(), EXPLICIT,
                        List.of(failing.type() + " kind=" + kind));
            }
        }

        if (EventTypes.COMMAND_ACK_TIMEOUT.equals(failing.type())
                || (failing.stage() == Stage.ACK && failing.status() == EventStatus.TIMEOUT)) {
            return new Classification(FailureClass.ACK_GAP, EXPLICIT,
                    List.of(failing.type() + " status=" + failing.status().wireName()));
        }

        List<String> reasons = reasonsOf(payload);
        for (String reason : reasons) {
            Optional<FailureClass> cls = FailureClass.fromWire(reason);
            if (cls.isPresent()) {
                return new Classification(cls.get(), FROM_REASONS,
                        List.of(failing.type() + " reasons=" + reasons));
            }
        }

        List<String> ackGap = inferAckGap(trace);
        if (!ackGap.isEmpty()) {
            return new Classification(FailureClass.ACK_GAP, INFERRED, ackGap);
        }

        return new Classification(FailureClass.UNKNOWN, NONE,
                List.of("no classifying evidence on " + failing.type()));
    }

    private static List<String> reasonsOf(ObjectNode payload) {
        List<String> reasons = new ArrayList<>();
        JsonNode list = payload.get("reasons");
        if (list != null && list.isArray()) {
            for (JsonNode r : list) {
                if (r.isTextual()) {
                    reasons.add(r.textValue());
                }
            }
        }
        String single = EventJson.text(payload, "reason");
        if (single != null) {
            reasons.add(single);
        }
        return reasons;
    }

    private static List<String> inferAckGap(List<Event> trace) {
        Event transport = null;
        boolean acknowledged = false;
        for (Event e : trace) {
            if (e.stage() == Stage.TRANSPORT && transport == null) {
                transport = e;
            }
            if ((e.stage() == Stage.ACK || e.stage() == Stage.VERIFY) && !e.status().isFailure()) {
                acknowledged = true;
            }
        }
        if (transport == null || acknowledged) {
            return List.of();
        }
        List<String> inputs = new ArrayList<>(2);
        inputs.add("transport seen: " + transport.type());
        inputs.add("no ack or verify after transport");
        return inputs;
    }
}
