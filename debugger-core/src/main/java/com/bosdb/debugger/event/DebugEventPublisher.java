package com.bosdb.debugger.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener list shared by the debugger components.
 * A failing listener is logged and skipped; the remaining listeners still run.
 */
public class DebugEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DebugEventPublisher.class);

    private final List<DebugEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(DebugEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DebugEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(DebugEvent event) {
        for (DebugEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[Events] Listener failed on {} for session {}",
                    event.getClass().getSimpleName(), event.sessionId(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
