package io.crisislink.registry;

import io.crisislink.error.CrisisLinkException;
import io.crisislink.error.ErrorKind;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.Role;
import io.crisislink.transport.LoopbackTransport;
import io.crisislink.transport.Transport;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

final class ConnectionRegistryTest {

    @Test
    void admitsAndRejectsDuplicateParticipants() {
        ConnectionRegistry registry = new ConnectionRegistry(10, () -> 1_000L);
        ConnectionInfo info = ConnectionInfo.anonymousPerson("anon-1");
        Connection connection = registry.admit(info, new LoopbackTransport("primary", info));

        Assertions.assertEquals(1, registry.count());
        Assertions.assertEquals(Role.PERSON_IN_CRISIS, connection.role());
        Assertions.assertEquals("primary", connection.transportName());

        CrisisLinkException duplicate = Assertions.assertThrows(
                CrisisLinkException.class,
                () -> registry.admit(info, new LoopbackTransport("primary", info))
        );
        Assertions.assertEquals(ErrorKind.ALREADY_CONNECTED, duplicate.kind());
        Assertions.assertEquals(1L, registry.rejectedTotal());

        Assertions.assertTrue(registry.remove(connection.id()).isPresent());
        Assertions.assertTrue(registry.remove(connection.id()).isEmpty());
        registry.admit(info, new LoopbackTransport("primary", info));
        Assertions.assertEquals(2L, registry.admittedTotal());
    }

    @Test
    void volunteersMustBeAuthenticated() {
        ConnectionRegistry registry = new ConnectionRegistry(10, () -> 0L);
        ConnectionInfo unauthenticated = new ConnectionInfo("vol-1", Role.VOLUNTEER, false, "en");

        CrisisLinkException rejected = Assertions.assertThrows(
                CrisisLinkException.class,
                () -> registry.admit(unauthenticated, null)
        );
        Assertions.assertEquals(ErrorKind.AUTHENTICATION_REJECTED, rejected.kind());
        Assertions.assertEquals(0, registry.count());
    }

    @Test
    void capacityHoldsUnderConcurrentAdmission() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(50, () -> 0L);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                ConnectionInfo info = ConnectionInfo.anonymousPerson("anon-" + i);
                attempts.add(pool.submit(() -> {
                    try {
                        registry.admit(info, null);
                        return true;
                    } catch (CrisisLinkException e) {
                        Assertions.assertEquals(ErrorKind.CAPACITY_EXCEEDED, e.kind());
                        return false;
                    }
                }));
            }
            int admitted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            Assertions.assertEquals(50, admitted);
            Assertions.assertEquals(50, registry.count());
            Assertions.assertEquals(150L, registry.rejectedTotal());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rebindSwapsTransportAndReturnsThePreviousOne() {
        AtomicLong clock = new AtomicLong(100L);
        ConnectionRegistry registry = new ConnectionRegistry(10, clock::get);
        ConnectionInfo info = ConnectionInfo.volunteer("vol-2", "en");
        LoopbackTransport first = new LoopbackTransport("primary", info);
        Connection connection = registry.admit(info, first);

        clock.set(500L);
        LoopbackTransport second = new LoopbackTransport("secondary", info);
        Transport previous = registry.rebind(connection.id(), second).orElseThrow();

        Assertions.assertSame(first, previous);
        Assertions.assertSame(second, registry.transportOf(connection.id()).orElseThrow());
        Assertions.assertEquals(500L, registry.lookup(connection.id()).orElseThrow().lastActivityMs());
        Assertions.assertEquals(1, registry.countByRole().get(Role.VOLUNTEER));
        Assertions.assertEquals(0, registry.countByRole().get(Role.PERSON_IN_CRISIS));
    }
}
