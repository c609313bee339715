package com.aceengine.communication;

import com.aceengine.core.event.Event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process bus. Listeners run on the publishing thread; a failing
 * listener is logged and does not stop delivery to the others or the commit.
 */
@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<AceEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        for (AceEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[EventBus] Listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.getType(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void subscribe(AceEventListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }
}
