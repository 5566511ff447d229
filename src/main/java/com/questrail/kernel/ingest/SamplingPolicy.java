package com.questrail.kernel.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventTypes;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SamplingPolicy
 * -----------------------------------------------------------------------------
 * Controls how much of a payload reaches the ledger.
 *
 * <ul>
 *   <li>Types listed in {@code metadataOnlyTypes} (raw output chunks by default)
 *       keep only the byte length of their content and a "meaningful" flag.</li>
 *   <li>Top-level {@code body} and {@code message} strings on any event are
 *       replaced by {@code {"redacted": true, "length": n}}.</li>
 * </ul>
 *
 * With {@code devMode} set, payloads are stored unchanged.
 */
public record SamplingPolicy(boolean devMode, Set<String> metadataOnlyTypes) {

    private static final List<String> CONTENT_FIELDS = List.of("data", "chunk", "text", "body");
    private static final List<String> REDACTED_FIELDS = List.of("body", "message");
    private static final Pattern ANSI = Pattern.compile("\u001B\\[[0-9;?]*[ -/]*[@-~]|\u001B\\][^\u0007]*\u0007");
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");

    public SamplingPolicy {
        metadataOnlyTypes = Set.copyOf(Objects.requireNonNull(metadataOnlyTypes, "metadataOnlyTypes"));
    }

    public static SamplingPolicy defaults() {
        return new SamplingPolicy(false, Set.of(EventTypes.TERMINAL_OUTPUT));
    }

    public SamplingPolicy withDevMode(boolean devMode) {
        return new SamplingPolicy(devMode, metadataOnlyTypes);
    }

    public Event apply(Event event) {
        if (devMode) {
            return event;
        }
        ObjectNode payload = event.payload();
        boolean changed = false;

        if (metadataOnlyTypes.contains(event.type())) {
            changed = reduceToMetadata(payload);
        }
        for (String field : REDACTED_FIELDS) {
            JsonNode v = payload.get(field);
            if (v != null && v.isTextual()) {
                ObjectNode redacted = payload.objectNode();
                redacted.put("redacted", true);
                redacted.put("length", v.textValue().length());
                payload.set(field, redacted);
                changed = true;
            }
        }
        return changed ? event.withPayload(payload) : event;
    }

    private static boolean reduceToMetadata(ObjectNode payload) {
        String content = null;
        for (String field : CONTENT_FIELDS) {
            JsonNode v = payload.get(field);
            if (v != null && v.isTextual()) {
                content = v.textValue();
                break;
            }
        }
        if (content == null) {
            return false;
        }
        payload.remove(CONTENT_FIELDS);
        payload.put("byteLength", content.getBytes(StandardCharsets.UTF_8).length);
        payload.put("meaningful", isMeaningful(content));
        payload.put("sampled", false);
        return true;
    }

    /**
     * Whether output carries visible text once escape sequences and control
     * characters are stripped.
     */
    static boolean isMeaningful(String chunk) {
        String visible = CONTROL.matcher(ANSI.matcher(chunk).replaceAll("")).replaceAll("");
        return !visible.isBlank();
    }
}
