package io.crisislink.observability;

import io.crisislink.model.SessionId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {
    @Test
    void chainSurvivesReopeningTheLog() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-audit");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret-1");
            logger.log(AuditLogger.AuditEvent.system("runtime.start", "ok", Map.of()));
            logger.log(AuditLogger.AuditEvent.forSession("session.start", "system", SessionId.random(), "ok", "trace-1", Map.of("severity", 4)));
            String head = logger.currentHash();

            AuditLogger reopened = new AuditLogger(file, "secret-1");
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.forConnection("connection.close", "conn-1", "ok", Map.of("reason", "client_closed")));

            AuditLogger.Integrity integrity = reopened.verify(0);
            Assertions.assertTrue(integrity.ok(), integrity.reason());
            Assertions.assertEquals(3, integrity.checkedRows());
            Assertions.assertEquals(1, reopened.verify(1).checkedRows());
            Assertions.assertEquals(2, reopened.tail(2).size());
            Assertions.assertTrue(reopened.tail(1).get(0).contains("\"connection.close\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheHash() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-audit");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = writeThree(file, "secret-1");
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"result\":\"ok\"", "\"result\":\"denied\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.Integrity integrity = logger.verify(0);
            Assertions.assertFalse(integrity.ok());
            Assertions.assertEquals(2, integrity.brokenLine());
            Assertions.assertEquals("hash_mismatch", integrity.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removedRowBreaksTheLink() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-audit");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = writeThree(file, "secret-1");
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.Integrity integrity = logger.verify(0);
            Assertions.assertEquals("prev_hash_mismatch", integrity.reason());
            Assertions.assertEquals(2, integrity.brokenLine());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wrongSigningSecretIsDetected() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-audit");
        try {
            Path file = root.resolve("audit.log");
            writeThree(file, "secret-1");

            AuditLogger.Integrity integrity = new AuditLogger(file, "secret-2").verify(0);
            Assertions.assertEquals("signature_mismatch", integrity.reason());
            Assertions.assertEquals(1, integrity.brokenLine());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void contentAndContactDetailsNeverReachTheFile() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-audit");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = AuditLogger.open(file, root.resolve("audit-signing.key"));
            logger.log(AuditLogger.AuditEvent.forSession("session.note", "volunteer", SessionId.random(), "ok", null, Map.of(
                    "content", "I want to end it",
                    "reason", "caller gave 555-123-4567",
                    "comment", "kind volunteer"
            )));

            String written = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(written.contains("end it"));
            Assertions.assertFalse(written.contains("555-123-4567"));
            Assertions.assertFalse(written.contains("kind volunteer"));
            Assertions.assertTrue(written.contains("\"content\":\"***\""));
            Assertions.assertTrue(written.contains("caller gave ***"));
            Assertions.assertTrue(Files.exists(root.resolve("audit-signing.key")));
            Assertions.assertTrue(logger.verify(0).ok());
        } finally {
            deleteRecursively(root);
        }
    }

    private static AuditLogger writeThree(Path file, String secret) {
        AuditLogger logger = new AuditLogger(file, secret);
        for (int i = 0; i < 3; i++) {
            logger.log(AuditLogger.AuditEvent.system("runtime.tick", "ok", Map.of("n", i)));
        }
        return logger;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
