package com.questrail.kernel.query;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.store.EventFilter;

import java.util.List;

/**
 * Read-only query surface over the evidence ledger. Every call is bounded by
 * the limits of its argument and never mutates the store.
 */
public interface KernelQueryApi {

    TraceView queryTrace(String traceId);

    List<Event> queryEvents(EventFilter filter);

    List<FailurePath> queryFailurePath(FailureQuery query);

    JourneyView queryJourney(String traceId);
}
