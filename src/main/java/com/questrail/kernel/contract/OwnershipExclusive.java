package com.questrail.kernel.contract;

import java.util.Optional;

/**
 * At most one request per worker and operation class may be in flight.
 */
public final class OwnershipExclusive implements PaneContract {
    public static final String ID = "ownership-exclusive";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(RequestKind kind) {
        return kind.holdsOwnership();
    }

    @Override
    public Optional<BlockReason> check(WorkerContext context, InjectionRequest request) {
        return context.holderOf(request.kind().operationClass())
                .filter(holder -> !holder.equals(request.requestId()))
                .map(holder -> BlockReason.OWNERSHIP);
    }
}
