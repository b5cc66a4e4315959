package io.crisislink.transport;

import io.crisislink.model.ConnectionInfo;

public interface TransportFactory {
    String name();

    Transport open(ConnectionInfo info) throws TransportException;
}
