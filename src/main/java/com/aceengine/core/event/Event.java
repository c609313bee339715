package com.aceengine.core.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Something the committing path did, published for downstream reporting.
 *
 * {@code subject} is the plan id or file the event is about; {@code attributes}
 * carries event-specific detail (file, receipt id, reason, ...).
 */
public class Event {

    private final String              eventId;
    private final EventType           type;
    private final String              source;
    private final String              subject;
    private final Map<String, Object> attributes;
    private final Instant             timestamp;

    public Event(EventType type, String source, String subject, Map<String, Object> attributes, Instant timestamp) {
        this.eventId    = UUID.randomUUID().toString();
        this.type       = type;
        this.source     = source;
        this.subject    = subject;
        this.attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        this.timestamp  = timestamp;
    }

    public String getEventId() {
        return eventId;
    }

    public EventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getSubject() {
        return subject;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Event{" + type + " " + subject + " from " + source + " " + attributes + "}";
    }
}
