package com.questrail.kernel.config;

import com.questrail.kernel.compaction.CompactionThresholds;
import com.questrail.kernel.contract.ContractTimingPolicy;
import com.questrail.kernel.store.RetentionPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the event kernel runtime.
 *
 * @param storeDurable     use the H2 ledger at {@code storeUrl}; {@code false}
 *                         runs in memory
 * @param spanSweepInterval how often open spans are checked against {@code spanTimeout}
 * @param samplingDevMode  store terminal output and message bodies unredacted
 */
public record KernelConfig(
    boolean storeDurable,
    String storeUrl,
    RetentionPolicy retention,
    Duration busyTimeout,
    int writerQueueCapacity,
    ContractTimingPolicy contractTiming,
    Duration spanTimeout,
    Duration spanSweepInterval,
    boolean samplingDevMode,
    CompactionThresholds compaction,
    Duration compactionTickInterval,
    int bridgeQueueCapacity,
    Duration ackTimeout
) {
    public static final String DEFAULT_STORE_URL = "jdbc:h2:file:./.event-kernel/ledger";

    public KernelConfig {
        Objects.requireNonNull(storeUrl, "storeUrl");
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(contractTiming, "contractTiming");
        Objects.requireNonNull(compaction, "compaction");
        requirePositive(busyTimeout, "busyTimeout");
        requirePositive(spanTimeout, "spanTimeout");
        requirePositive(spanSweepInterval, "spanSweepInterval");
        requirePositive(compactionTickInterval, "compactionTickInterval");
        requirePositive(ackTimeout, "ackTimeout");
        if (writerQueueCapacity < 1) {
            throw new IllegalArgumentException("writerQueueCapacity must be >= 1");
        }
        if (bridgeQueueCapacity < 1) {
            throw new IllegalArgumentException("bridgeQueueCapacity must be >= 1");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static KernelConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withStoreDurable(storeDurable)
                .withStoreUrl(storeUrl)
                .withRetention(retention)
                .withBusyTimeout(busyTimeout)
                .withWriterQueueCapacity(writerQueueCapacity)
                .withContractTiming(contractTiming)
                .withSpanTimeout(spanTimeout)
                .withSpanSweepInterval(spanSweepInterval)
                .withSamplingDevMode(samplingDevMode)
                .withCompaction(compaction)
                .withCompactionTickInterval(compactionTickInterval)
                .withBridgeQueueCapacity(bridgeQueueCapacity)
                .withAckTimeout(ackTimeout);
    }

    public static final class Builder {
        private boolean storeDurable = true;
        private String storeUrl = DEFAULT_STORE_URL;
        private RetentionPolicy retention = RetentionPolicy.defaults();
        private Duration busyTimeout = Duration.ofSeconds(5);
        private int writerQueueCapacity = 10_000;
        private ContractTimingPolicy contractTiming = ContractTimingPolicy.defaults();
        private Duration spanTimeout = Duration.ofSeconds(60);
        private Duration spanSweepInterval = Duration.ofSeconds(10);
        private boolean samplingDevMode = false;
        private CompactionThresholds compaction = CompactionThresholds.defaults();
        private Duration compactionTickInterval = Duration.ofMillis(250);
        private int bridgeQueueCapacity = 1_000;
        private Duration ackTimeout = Duration.ofSeconds(5);

        public Builder withStoreDurable(boolean storeDurable) {
            this.storeDurable = storeDurable;
            return this;
        }

        public Builder withStoreUrl(String storeUrl) {
            this.storeUrl = storeUrl;
            return this;
        }

        public Builder withRetention(RetentionPolicy retention) {
            this.retention = retention;
            return this;
        }

        public Builder withBusyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
            return this;
        }

        public Builder withWriterQueueCapacity(int writerQueueCapacity) {
            this.writerQueueCapacity = writerQueueCapacity;
            return this;
        }

        public Builder withContractTiming(ContractTimingPolicy contractTiming) {
            this.contractTiming = contractTiming;
            return this;
        }

        public Builder withSpanTimeout(Duration spanTimeout) {
            this.spanTimeout = spanTimeout;
            return this;
        }

        public Builder withSpanSweepInterval(Duration spanSweepInterval) {
            this.spanSweepInterval = spanSweepInterval;
            return this;
        }

        public Builder withSamplingDevMode(boolean samplingDevMode) {
            this.samplingDevMode = samplingDevMode;
            return this;
        }

        public Builder withCompaction(CompactionThresholds compaction) {
            this.compaction = compaction;
            return this;
        }

        public Builder withCompactionTickInterval(Duration compactionTickInterval) {
            this.compactionTickInterval = compactionTickInterval;
            return this;
        }

        public Builder withBridgeQueueCapacity(int bridgeQueueCapacity) {
            this.bridgeQueueCapacity = bridgeQueueCapacity;
            return this;
        }

        public Builder withAckTimeout(Duration ackTimeout) {
            this.ackTimeout = ackTimeout;
            return this;
        }

        public KernelConfig build() {
            return new KernelConfig(storeDurable, storeUrl, retention, busyTimeout, writerQueueCapacity,
                    contractTiming, spanTimeout, spanSweepInterval, samplingDevMode, compaction,
                    compactionTickInterval, bridgeQueueCapacity, ackTimeout);
        }
    }
}
