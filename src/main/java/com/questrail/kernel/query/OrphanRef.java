package com.questrail.kernel.query;

import java.util.Objects;

/**
 * An event whose {@code parentEventId} does not resolve inside its trace.
 */
public record OrphanRef(String eventId, String missingParentId) {
    public OrphanRef {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(missingParentId, "missingParentId");
    }
}
