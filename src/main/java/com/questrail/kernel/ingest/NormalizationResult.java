package com.questrail.kernel.ingest;

import com.questrail.kernel.api.Event;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of normalizing one raw record.
 */
public sealed interface NormalizationResult
        permits NormalizationResult.Accepted, NormalizationResult.Rejected {

    /**
     * Events to append, in order: the accepted event first, then diagnostics.
     */
    List<Event> toAppend();

    /**
     * @param diagnostics causal-break diagnostics raised while admitting the event
     */
    record Accepted(Event event, List<Event> diagnostics) implements NormalizationResult {
        public Accepted {
            Objects.requireNonNull(event, "event");
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public List<Event> toAppend() {
            if (diagnostics.isEmpty()) {
                return List.of(event);
            }
            Event[] all = new Event[diagnostics.size() + 1];
            all[0] = event;
            for (int i = 0; i < diagnostics.size(); i++) {
                all[i + 1] = diagnostics.get(i);
            }
            return List.of(all);
        }
    }

    /**
     * @param diagnostic the {@code event.invalid} event describing the rejection
     */
    record Rejected(Event diagnostic, List<String> errors) implements NormalizationResult {
        public Rejected {
            Objects.requireNonNull(diagnostic, "diagnostic");
            errors = List.copyOf(errors);
        }

        @Override
        public List<Event> toAppend() {
            return List.of(diagnostic);
        }
    }
}
