package com.aceengine.communication;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class EventListenerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistrar.class);

    private final EventBus eventBus;
    private final List<AceEventListener> listeners;

    public EventListenerRegistrar(
            EventBus eventBus,
            List<AceEventListener> listeners) {
        this.eventBus = eventBus;
        this.listeners = listeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerListeners() {
        for (AceEventListener listener : listeners) {
            eventBus.subscribe(listener);
        }
        log.info("[EventListenerRegistrar] Registered {} listener(s)", listeners.size());
    }
}
