package com.questrail.kernel.config;

import com.questrail.kernel.compaction.CompactionThresholds;
import com.questrail.kernel.contract.ContractTimingPolicy;
import com.questrail.kernel.store.RetentionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * KernelConfigLoader
 * -----------------------------------------------------------------------------
 * Builds a {@link KernelConfig} from layered properties, later layers winning:
 *
 * <ol>
 *   <li>{@code /event-kernel-default.properties} on the classpath</li>
 *   <li>{@code /event-kernel-<profile>.properties}, if a profile other than
 *       {@code default} is active and the file exists</li>
 *   <li>system properties starting with {@code kernel.}</li>
 * </ol>
 *
 * The profile comes from the {@code kernel.profile} system property. Keys that
 * are absent everywhere keep the {@link KernelConfig.Builder} defaults; a value
 * that does not parse is an {@link IllegalArgumentException} naming the key.
 */
public final class KernelConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(KernelConfigLoader.class);

    public static final String PREFIX = "kernel.";
    public static final String PROFILE = "kernel.profile";
    public static final String DEFAULT_RESOURCE = "/event-kernel-default.properties";

    public static final String STORE_DURABLE = "kernel.store.durable";
    public static final String STORE_URL = "kernel.store.url";
    public static final String STORE_BUSY_TIMEOUT_MS = "kernel.store.busy-timeout-ms";
    public static final String RETENTION_TTL_MS = "kernel.retention.ttl-ms";
    public static final String RETENTION_MAX_ROWS = "kernel.retention.max-rows";
    public static final String RETENTION_PRUNE_INTERVAL_MS = "kernel.retention.prune-interval-ms";
    public static final String WRITER_QUEUE_CAPACITY = "kernel.writer.queue-capacity";
    public static final String CONTRACT_DEFER_TTL_MS = "kernel.contract.defer-ttl-ms";
    public static final String SAFEMODE_VIOLATIONS = "kernel.contract.safemode-violations";
    public static final String SAFEMODE_WINDOW_MS = "kernel.contract.safemode-window-ms";
    public static final String SAFEMODE_DURATION_MS = "kernel.contract.safemode-duration-ms";
    public static final String OWNER_LEASE_MS = "kernel.contract.owner-lease-ms";
    public static final String SPAN_TIMEOUT_MS = "kernel.span.timeout-ms";
    public static final String SPAN_SWEEP_INTERVAL_MS = "kernel.span.sweep-interval-ms";
    public static final String SAMPLING_DEV_MODE = "kernel.sampling.dev-mode";
    public static final String COMPACTION_TICK_MS = "kernel.compaction.tick-interval-ms";
    public static final String BRIDGE_QUEUE_CAPACITY = "kernel.bridge.queue-capacity";
    public static final String BRIDGE_ACK_TIMEOUT_MS = "kernel.bridge.ack-timeout-ms";

    private KernelConfigLoader() {}

    /**
     * Load using the active profile.
     */
    public static KernelConfig load() {
        return load(System.getProperty(PROFILE, "default"));
    }

    public static KernelConfig load(String profile) {
        Objects.requireNonNull(profile, "profile");
        Properties props = new Properties();
        loadResource(props, DEFAULT_RESOURCE);
        if (!"default".equals(profile)) {
            loadResource(props, "/event-kernel-" + profile + ".properties");
        }
        System.getProperties().forEach((key, value) -> {
            String k = key.toString();
            if (k.startsWith(PREFIX)) {
                props.setProperty(k, value.toString());
            }
        });
        KernelConfig config = fromProperties(props);
        log.info("Loaded event kernel configuration for profile {}", profile);
        return config;
    }

    /**
     * Build from an explicit property set; nothing else is consulted.
     */
    public static KernelConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        KernelConfig.Builder defaults = KernelConfig.builder();
        KernelConfig base = defaults.build();

        RetentionPolicy retention = new RetentionPolicy(
                millis(props, RETENTION_TTL_MS, base.retention().ttl()),
                longValue(props, RETENTION_MAX_ROWS, base.retention().maxRows()),
                millis(props, RETENTION_PRUNE_INTERVAL_MS, base.retention().pruneInterval()));

        ContractTimingPolicy timing = new ContractTimingPolicy(
                millis(props, CONTRACT_DEFER_TTL_MS, base.contractTiming().deferTtl()),
                (int) longValue(props, SAFEMODE_VIOLATIONS, base.contractTiming().safeModeViolations()),
                millis(props, SAFEMODE_WINDOW_MS, base.contractTiming().safeModeWindow()),
                millis(props, SAFEMODE_DURATION_MS, base.contractTiming().safeModeDuration()),
                millis(props, OWNER_LEASE_MS, base.contractTiming().ownerLease()));

        return defaults
                .withStoreDurable(bool(props, STORE_DURABLE, base.storeDurable()))
                .withStoreUrl(props.getProperty(STORE_URL, base.storeUrl()).trim())
                .withRetention(retention)
                .withBusyTimeout(millis(props, STORE_BUSY_TIMEOUT_MS, base.busyTimeout()))
                .withWriterQueueCapacity((int) longValue(props, WRITER_QUEUE_CAPACITY, base.writerQueueCapacity()))
                .withContractTiming(timing)
                .withSpanTimeout(millis(props, SPAN_TIMEOUT_MS, base.spanTimeout()))
                .withSpanSweepInterval(millis(props, SPAN_SWEEP_INTERVAL_MS, base.spanSweepInterval()))
                .withSamplingDevMode(bool(props, SAMPLING_DEV_MODE, base.samplingDevMode()))
                .withCompaction(CompactionThresholds.defaults())
                .withCompactionTickInterval(millis(props, COMPACTION_TICK_MS, base.compactionTickInterval()))
                .withBridgeQueueCapacity((int) longValue(props, BRIDGE_QUEUE_CAPACITY, base.bridgeQueueCapacity()))
                .withAckTimeout(millis(props, BRIDGE_ACK_TIMEOUT_MS, base.ackTimeout()))
                .build();
    }

    private static void loadResource(Properties props, String resource) {
        try (InputStream in = KernelConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("Properties resource not found: {}", resource);
                return;
            }
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load properties from {}", resource, e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
        }
    }

    private static Duration millis(Properties props, String key, Duration fallback) {
        return Duration.ofMillis(longValue(props, key, fallback.toMillis()));
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            return fallback;
        }
        String t = v.trim();
        if ("true".equalsIgnoreCase(t)) {
            return true;
        }
        if ("false".equalsIgnoreCase(t)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + v);
    }
}
