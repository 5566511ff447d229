package com.questrail.kernel.contract;

import java.util.Objects;

/**
 * Why a contract stopped a request.
 *
 * @param code       machine-stable reason code written into event payloads
 * @param contractId the contract that raised it
 */
public record BlockReason(String code, String contractId) {

    public static final BlockReason FOCUS_LOCK = new BlockReason("focus_lock", FocusLockGuard.ID);
    public static final BlockReason COMPACTION = new BlockReason("compaction_gate", CompactionGate.ID);
    public static final BlockReason SAFE_MODE = new BlockReason("safe_mode", SafeModeGuard.ID);
    public static final BlockReason OWNERSHIP = new BlockReason("ownership_conflict", OwnershipExclusive.ID);

    public BlockReason {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(contractId, "contractId");
    }
}
