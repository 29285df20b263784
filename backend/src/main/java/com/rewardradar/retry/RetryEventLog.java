package com.rewardradar.retry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe record of the most recent retry events. Oldest entries drop first.
 */
public class RetryEventLog {

    private final int capacity;
    private final Deque<RetryEvent> events;

    public RetryEventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    public synchronized void record(RetryEvent event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    /**
     * Events oldest first.
     */
    public synchronized List<RetryEvent> recent() {
        return new ArrayList<>(events);
    }
}
