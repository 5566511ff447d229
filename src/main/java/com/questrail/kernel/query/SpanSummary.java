package com.questrail.kernel.query;

import com.questrail.kernel.api.Span;

/**
 * A span as stored, plus whether it has stayed open past the span timeout.
 * A leaked span is only flagged here; queries never close it.
 */
public record SpanSummary(Span span, boolean leaked) {
}
