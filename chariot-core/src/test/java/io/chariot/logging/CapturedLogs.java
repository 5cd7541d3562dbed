package io.chariot.logging;

import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;

/**
 * Events recorded by {@link CapturingSlf4jServiceProvider}, in logging order.
 */
public final class CapturedLogs {

    public record Event(String logger, Level level, String message) {
    }

    private static final List<Event> EVENTS = new ArrayList<>();

    private CapturedLogs() {
    }

    static synchronized void record(String logger, Level level, String message) {
        EVENTS.add(new Event(logger, level, message));
    }

    public static synchronized void clear() {
        EVENTS.clear();
    }

    /**
     * Messages logged on one logger.
     */
    public static synchronized List<String> messages(String logger) {
        List<String> messages = new ArrayList<>();
        for (Event event : EVENTS) {
            if (event.logger().equals(logger)) {
                messages.add(event.message());
            }
        }
        return messages;
    }

    public static synchronized List<Event> events() {
        return List.copyOf(EVENTS);
    }
}
