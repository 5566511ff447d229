package com.questrail.kernel.query;

import com.questrail.kernel.api.Stage;

import java.util.List;
import java.util.Objects;

/**
 * Stage-by-stage view of one trace from ingress to verification.
 */
public record JourneyView(String traceId, List<JourneyStep> steps) {

    public static final List<Stage> STAGES = List.of(
            Stage.INGRESS, Stage.ROUTE, Stage.INJECT, Stage.TRANSPORT,
            Stage.TERMINAL, Stage.ACK, Stage.VERIFY);

    public JourneyView {
        Objects.requireNonNull(traceId, "traceId");
        steps = List.copyOf(steps);
    }

    public JourneyStep step(Stage stage) {
        return steps.stream()
                .filter(s -> s.stage() == stage)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Not a journey stage: " + stage));
    }

    public boolean complete() {
        return step(Stage.VERIFY).state() == JourneyState.SEEN;
    }
}
