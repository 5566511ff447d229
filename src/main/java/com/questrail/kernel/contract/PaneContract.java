package com.questrail.kernel.contract;

import java.util.Optional;

/**
 * A named policy rule evaluated against a worker's context.
 *
 * <p>Implementations are pure: they read the context and the request and never
 * change either.</p>
 */
public interface PaneContract {

    String id();

    boolean appliesTo(RequestKind kind);

    /**
     * @return the reason this contract blocks {@code request}, or empty if it
     *         does not
     */
    Optional<BlockReason> check(WorkerContext context, InjectionRequest request);
}
