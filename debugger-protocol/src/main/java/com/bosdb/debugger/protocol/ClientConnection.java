package com.bosdb.debugger.protocol;

/**
 * A connected debugger client as seen by {@link ProtocolServer}. Implemented per transport.
 */
public interface ClientConnection {

    /**
     * Send one text frame. Called from engine and executor threads.
     */
    void send(String text);

    boolean isOpen();
}
