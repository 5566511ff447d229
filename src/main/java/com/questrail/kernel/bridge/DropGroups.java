package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.EventJson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pending drop accounting, grouped by {@code (stage, reason)}.
 *
 * <p>Each group remembers the bridge sequence range it covers so that the far
 * side can match a summary against the gap it observed.</p>
 */
public final class DropGroups {

    public record Group(String stage, String reason, long droppedCount, long oldestSeq, long newestSeq) {

        public ObjectNode toPayload() {
            ObjectNode p = EventJson.objectNode();
            p.put("stage", stage);
            p.put("reason", reason);
            p.put("droppedCount", droppedCount);
            p.put("oldestSeq", oldestSeq);
            p.put("newestSeq", newestSeq);
            return p;
        }
    }

    private final Map<String, Group> groups = new LinkedHashMap<>();
    private long totalDropped;

    public void record(String stage, String reason, long bridgeSeq) {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(reason, "reason");
        groups.merge(stage + ":" + reason,
                new Group(stage, reason, 1, bridgeSeq, bridgeSeq),
                (g, one) -> new Group(g.stage(), g.reason(), g.droppedCount() + 1,
                        Math.min(g.oldestSeq(), bridgeSeq), Math.max(g.newestSeq(), bridgeSeq)));
        totalDropped++;
    }

    /**
     * Remove and return every pending group, oldest group first.
     */
    public List<Group> drain() {
        List<Group> out = new ArrayList<>(groups.values());
        groups.clear();
        return out;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public int pendingGroups() {
        return groups.size();
    }

    public long totalDropped() {
        return totalDropped;
    }
}
