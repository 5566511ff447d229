package com.questrail.kernel.api;

import java.util.Objects;

/**
 * Pointer from an event to supporting evidence: a code location, a log window
 * or a content hash. Only {@code kind} is mandatory.
 */
public record EvidenceRef(String kind, String path, Integer line, String hash, String note) {
    public EvidenceRef {
        Objects.requireNonNull(kind, "kind");
    }

    public static EvidenceRef of(String kind, String path) {
        return new EvidenceRef(kind, path, null, null, null);
    }
}
