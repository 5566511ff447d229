package com.questrail.kernel.api;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that keeps every emitted event in order.
 */
public final class RecordingEventSink implements EventSink {
    private final List<Event> events = new ArrayList<>();

    @Override
    public synchronized void emit(Event event) {
        events.add(event);
    }

    public synchronized List<Event> all() {
        return new ArrayList<>(events);
    }

    public synchronized List<Event> ofType(String type) {
        return events.stream().filter(e -> e.type().equals(type)).collect(Collectors.toList());
    }

    public synchronized List<String> types() {
        return events.stream().map(Event::type).collect(Collectors.toList());
    }

    public synchronized Event last() {
        if (events.isEmpty()) {
            throw new AssertionError("no events emitted");
        }
        return events.get(events.size() - 1);
    }

    public synchronized void clear() {
        events.clear();
    }
}
