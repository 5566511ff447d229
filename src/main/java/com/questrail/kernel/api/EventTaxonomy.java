package com.questrail.kernel.api;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps the open, dotted {@code type} vocabulary onto the closed {@link EventClass}.
 *
 * <p>Classification is by exact type first, then by type family (the first
 * dotted segment). Anything unrecognised is {@link EventClass#LIFECYCLE}, which
 * is protected from capacity drops.</p>
 */
public final class EventTaxonomy {

    private static final Pattern TYPE_PATTERN = Pattern.compile("[a-z0-9_-]+(\\.[a-z0-9_-]+)*");

    private static final Set<String> TELEMETRY_TYPES = Set.of(
            EventTypes.TERMINAL_OUTPUT,
            EventTypes.BRIDGE_STATS,
            "terminal.input.echo",
            "ui.render"
    );

    private static final Set<String> CONTRACT_TYPES = Set.of(
            EventTypes.INJECT_DEFERRED,
            EventTypes.INJECT_RESUMED,
            EventTypes.INJECT_DROPPED,
            EventTypes.RESIZE_COALESCED
    );

    private static final Set<String> SYSTEM_FAMILIES = Set.of("event", "bridge", "trace", "span", "safemode");

    private EventTaxonomy() {}

    public static EventClass classify(String type) {
        Objects.requireNonNull(type, "type");
        if (TELEMETRY_TYPES.contains(type) || type.endsWith(".telemetry")) {
            return EventClass.TELEMETRY;
        }
        if (CONTRACT_TYPES.contains(type) || type.startsWith("contract.")) {
            return EventClass.CONTRACT;
        }
        int dot = type.indexOf('.');
        String family = dot < 0 ? type : type.substring(0, dot);
        if (SYSTEM_FAMILIES.contains(family)) {
            return EventClass.SYSTEM;
        }
        return EventClass.LIFECYCLE;
    }

    /**
     * Whether {@code type} is a well-formed dotted name (lower case segments).
     */
    public static boolean isWellFormed(String type) {
        return type != null && TYPE_PATTERN.matcher(type).matches();
    }
}
