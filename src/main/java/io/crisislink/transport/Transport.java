package io.crisislink.transport;

import io.crisislink.model.CrisisMessage;

/**
 * One established bidirectional link. {@link #send} returns once the far end has
 * acknowledged the message.
 */
public interface Transport extends AutoCloseable {
    String name();

    void send(CrisisMessage message) throws TransportException;

    boolean ping();

    boolean isOpen();

    @Override
    void close();
}
