package io.crisislink.transport;

import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.CrisisMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process link. The far end acknowledges every message immediately and keeps the
 * delivered messages in arrival order. Faults can be injected to simulate a flaky
 * or dropped network.
 */
public final class LoopbackTransport implements Transport {
    private final String name;
    private final ConnectionInfo info;
    private final List<CrisisMessage> delivered = new ArrayList<>();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final AtomicInteger sendAttempts = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean linkUp = true;
    private volatile long ackDelayMs;

    public LoopbackTransport(String name, ConnectionInfo info) {
        this.name = name;
        this.info = info;
    }

    @Override
    public String name() {
        return name;
    }

    public ConnectionInfo info() {
        return info;
    }

    @Override
    public void send(CrisisMessage message) throws TransportException {
        sendAttempts.incrementAndGet();
        if (!open || !linkUp) {
            throw new TransportException("link down: " + name);
        }
        if (failuresToInject.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransportException("transient send failure on " + name);
        }
        long delay = ackDelayMs;
        if (delay > 0L) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted waiting for ack", e);
            }
        }
        synchronized (delivered) {
            delivered.add(message);
        }
    }

    @Override
    public boolean ping() {
        return open && linkUp;
    }

    @Override
    public boolean isOpen() {
        return open && linkUp;
    }

    @Override
    public void close() {
        open = false;
    }

    public void dropLink() {
        linkUp = false;
    }

    public void failNextSends(int count) {
        failuresToInject.set(Math.max(0, count));
    }

    public void setAckDelayMs(long ackDelayMs) {
        this.ackDelayMs = Math.max(0L, ackDelayMs);
    }

    public int sendAttempts() {
        return sendAttempts.get();
    }

    public List<CrisisMessage> delivered() {
        synchronized (delivered) {
            return List.copyOf(delivered);
        }
    }
}
