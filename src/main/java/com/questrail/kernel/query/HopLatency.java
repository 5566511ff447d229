package com.questrail.kernel.query;

import com.questrail.kernel.api.Stage;

import java.util.List;
import java.util.Objects;

/**
 * Latency between the first event of one stage and the first event of the next.
 *
 * @param deltaMs {@code null} when either stage was not observed
 * @param skewed  the delta is negative, which only clock skew between producers
 *                can cause
 */
public record HopLatency(Stage from, Stage to, Long deltaMs, boolean skewed) {

    public record Hop(Stage from, Stage to) {}

    /**
     * The hops reported for every trace, in pipeline order.
     */
    public static final List<Hop> HOPS = List.of(
            new Hop(Stage.INGRESS, Stage.ROUTE),
            new Hop(Stage.ROUTE, Stage.INJECT),
            new Hop(Stage.INJECT, Stage.TRANSPORT),
            new Hop(Stage.TRANSPORT, Stage.TERMINAL),
            new Hop(Stage.TERMINAL, Stage.ACK),
            new Hop(Stage.ACK, Stage.VERIFY));

    public HopLatency {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public boolean observed() {
        return deltaMs != null;
    }
}
