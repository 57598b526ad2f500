package com.lineage.dispatch.api;

import java.io.IOException;

/**
 * A live client channel that accepts text frames.
 */
public interface Connection {

    String id();

    boolean isOpen();

    void send(String payload) throws IOException;

    void close() throws IOException;
}
