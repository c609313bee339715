package com.aceengine.communication;

import com.aceengine.core.event.Event;

public interface EventBus {

    void publish(Event event);

    void subscribe(AceEventListener listener);
}
