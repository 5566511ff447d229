package com.questrail.kernel.query;

/**
 * Selects the traces a failure-path query looks at.
 *
 * <p>Every criterion is optional. {@code failureClass} filters on the class
 * assigned to each path, after classification.</p>
 */
public record FailureQuery(
        String traceId,
        String workerId,
        Long fromTimestamp,
        Long toTimestamp,
        FailureClass failureClass,
        int limit
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public FailureQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        if (fromTimestamp != null && toTimestamp != null && fromTimestamp > toTimestamp) {
            throw new IllegalArgumentException("fromTimestamp must not be after toTimestamp");
        }
    }

    public static FailureQuery forTrace(String traceId) {
        return builder().withTraceId(traceId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String traceId;
        private String workerId;
        private Long fromTimestamp;
        private Long toTimestamp;
        private FailureClass failureClass;
        private int limit = DEFAULT_LIMIT;

        private Builder() {}

        public Builder withTraceId(String traceId) {
            this.traceId = traceId;
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

        public Builder withFailureClass(FailureClass failureClass) {
            this.failureClass = failureClass;
            return this;
        }

        public Builder withLimit(int limit) {
            this.limit = limit;
            return this;
        }

        public FailureQuery build() {
            return new FailureQuery(traceId, workerId, fromTimestamp, toTimestamp, failureClass, limit);
        }
    }
}
