package com.herzen.dropout.event;

import java.time.Instant;

public class OrderingViolationException extends RuntimeException {
    private final Instant timestamp;
    private final Instant previous;

    public OrderingViolationException(Instant timestamp, Instant previous, OrderingScope scope) {
        super("Event timestamp " + timestamp + " is before last event " + previous + " (scope " + scope + ")");
        this.timestamp = timestamp;
        this.previous = previous;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Instant getPrevious() {
        return previous;
    }
}
