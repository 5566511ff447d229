package com.questrail.kernel.compaction;

/**
 * Receives a worker's compaction phase whenever its detector changes phase.
 */
@FunctionalInterface
public interface CompactionGateListener {
    void onCompactionPhase(String workerId, CompactionPhase phase);
}
