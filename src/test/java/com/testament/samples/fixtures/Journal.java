package com.testament.samples.fixtures;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Records fixture and test calls so the engine tests can check their order. */
public final class Journal {

    private static final ConcurrentLinkedQueue<String> EVENTS = new ConcurrentLinkedQueue<>();

    private Journal() {}

    public static void add(String event) {
        EVENTS.add(event);
    }

    public static List<String> events() {
        return List.copyOf(EVENTS);
    }

    public static long count(String event) {
        return EVENTS.stream().filter(event::equals).count();
    }

    public static void reset() {
        EVENTS.clear();
    }
}
