package com.questrail.kernel.store;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.Stage;

/**
 * EventFilter
 * -----------------------------------------------------------------------------
 * Bounded filter query over the ledger. Every field except {@code limit} is
 * optional; {@code null} means "any".
 *
 * <p>{@code type} matches exactly, or as a family when it ends in {@code .*}
 * ({@code inject.*} matches {@code inject.requested}). Results are ordered by
 * timestamp, then arrival. The limit defaults to {@value #DEFAULT_LIMIT} and is
 * clamped to {@value #MAX_LIMIT}.</p>
 */
public record EventFilter(
        String traceId,
        Stage stage,
        String type,
        String workerId,
        Long fromTimestamp,
        Long toTimestamp,
        int limit,
        boolean newestFirst
) {
    public static final int DEFAULT_LIMIT = 500;
    public static final int MAX_LIMIT = 10_000;

    public EventFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(Event e) {
        if (traceId != null && !traceId.equals(e.traceId())) {
            return false;
        }
        if (stage != null && stage != e.stage()) {
            return false;
        }
        if (type != null && !typeMatches(e.type())) {
            return false;
        }
        if (workerId != null && !workerId.equals(e.workerId())) {
            return false;
        }
        if (fromTimestamp != null && e.timestamp() < fromTimestamp) {
            return false;
        }
        return toTimestamp == null || e.timestamp() <= toTimestamp;
    }

    public boolean isTypePrefix() {
        return type != null && type.endsWith(".*");
    }

    /**
     * The family prefix including its trailing dot, e.g. {@code inject.}.
     */
    public String typePrefix() {
        return type.substring(0, type.length() - 1);
    }

    private boolean typeMatches(String candidate) {
        return isTypePrefix() ? candidate.startsWith(typePrefix()) : type.equals(candidate);
    }

    public static final class Builder {
        private String traceId;
        private Stage stage;
        private String type;
        private String workerId;
        private Long fromTimestamp;
        private Long toTimestamp;
        private int limit = DEFAULT_LIMIT;
        private boolean newestFirst;

        public Builder withTraceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder withStage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder withType(String type) {
            this.type = type;
            return this;
        }

        public Builder withWorkerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder withTimeRange(Long fromTimestamp, Long toTimestamp) {
            this.fromTimestamp = fromTimestamp;
            this.toTimestamp = toTimestamp;
            return this;
        }

        public Builder withLimit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder newestFirst() {
            this.newestFirst = true;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(traceId, stage, type, workerId, fromTimestamp, toTimestamp, limit, newestFirst);
        }
    }
}
