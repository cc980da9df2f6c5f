package com.bosdb.debugger.event;

/**
 * Receives debugger events. Called synchronously on the thread that raised the event,
 * so implementations must not block.
 */
@FunctionalInterface
public interface DebugEventListener {

    void onEvent(DebugEvent event);
}
