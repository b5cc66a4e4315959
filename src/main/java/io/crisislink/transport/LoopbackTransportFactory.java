package io.crisislink.transport;

import io.crisislink.model.ConnectionInfo;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

public final class LoopbackTransportFactory implements TransportFactory {
    private final String name;
    private final List<LoopbackTransport> opened = new CopyOnWriteArrayList<>();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private volatile boolean available = true;
    private volatile long handshakeDelayMs;

    public LoopbackTransportFactory(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Transport open(ConnectionInfo info) throws TransportException {
        openAttempts.incrementAndGet();
        long delay = handshakeDelayMs;
        if (delay > 0L) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("handshake interrupted on " + name, e);
            }
        }
        if (!available) {
            throw new TransportException("transport unavailable: " + name);
        }
        LoopbackTransport transport = new LoopbackTransport(name, info);
        opened.add(transport);
        return transport;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setHandshakeDelayMs(long handshakeDelayMs) {
        this.handshakeDelayMs = Math.max(0L, handshakeDelayMs);
    }

    public int openAttempts() {
        return openAttempts.get();
    }

    public List<LoopbackTransport> opened() {
        return List.copyOf(opened);
    }

    /** Most recent transport opened for the participant, if any. */
    public LoopbackTransport lastFor(String participantId) {
        for (int i = opened.size() - 1; i >= 0; i--) {
            LoopbackTransport transport = opened.get(i);
            if (transport.info().participantId().equals(participantId)) {
                return transport;
            }
        }
        return null;
    }
}
