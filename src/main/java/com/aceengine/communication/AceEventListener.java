package com.aceengine.communication;

import com.aceengine.core.event.Event;

public interface AceEventListener {

    void onEvent(Event event);
}
