package com.aceengine.communication;

import com.aceengine.core.event.Event;
import com.aceengine.core.event.EventType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Logs every engine event and keeps per-type counts for the lifetime of the process.
 * Integrity failures are logged at error level.
 */
@Component
public class EventAuditLog implements AceEventListener {

    private static final Logger log = LoggerFactory.getLogger(EventAuditLog.class);

    private final Map<EventType, Integer> counts = new EnumMap<>(EventType.class);

    @Override
    public void onEvent(Event event) {
        synchronized (counts) {
            counts.merge(event.getType(), 1, Integer::sum);
        }
        if (event.getType() == EventType.INTEGRITY_FAILURE) {
            log.error("[Audit] {} {} {}", event.getType(), event.getSubject(), event.getAttributes());
        } else {
            log.info("[Audit] {} {} {}", event.getType(), event.getSubject(), event.getAttributes());
        }
    }

    public Map<EventType, Integer> getCounts() {
        synchronized (counts) {
            return new EnumMap<>(counts);
        }
    }
}
