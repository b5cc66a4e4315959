package io.crisislink.config;

import io.crisislink.model.ChannelKind;
import io.crisislink.model.EmergencyChannel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class CrisisLinkSettingsTest {

    @Test
    void defaultsMatchTheDocumentedBudgets() {
        CrisisLinkSettings settings = CrisisLinkSettings.defaults();

        Assertions.assertEquals(2_000L, settings.reconnectIntervalMs());
        Assertions.assertEquals(10, settings.maxReconnectAttempts());
        Assertions.assertEquals(30_000L, settings.heartbeatIntervalMs());
        Assertions.assertEquals(100, settings.messageQueueSize());
        Assertions.assertEquals(3, settings.maxAttempts());
        Assertions.assertEquals(50L, settings.handshakeBudgetMs());
        Assertions.assertEquals(100L, settings.deliveryBudgetMs());
        Assertions.assertEquals(200L, settings.escalationBudgetMs());
        Assertions.assertEquals(150L, settings.notifyDeadlineMs());
        Assertions.assertEquals(8, settings.escalationSeverityThreshold());
        Assertions.assertEquals(10, settings.rateLimit().maxMessagesPerSecond());
        Assertions.assertEquals(4, settings.channels().size());
    }

    @Test
    void partialFileKeepsDefaultsForMissingFields() {
        CrisisLinkSettings settings = CrisisLinkSettings.parse("""
                {
                  "maxAttempts": 5,
                  "encryptionEnabled": true,
                  "rateLimit": { "maxMessagesPerSecond": 50 },
                  "unknownField": "ignored"
                }
                """);

        Assertions.assertEquals(5, settings.maxAttempts());
        Assertions.assertTrue(settings.encryptionEnabled());
        Assertions.assertFalse(settings.compressionEnabled());
        Assertions.assertEquals(50, settings.rateLimit().maxMessagesPerSecond());
        Assertions.assertEquals(120, settings.rateLimit().maxMessagesPerMinute());
        Assertions.assertEquals(CrisisLinkConfig.DEFAULT_CONNECTION_TIMEOUT_MS, settings.connectionTimeoutMs());
    }

    @Test
    void outOfRangeValuesAreClamped() {
        CrisisLinkSettings settings = CrisisLinkSettings.parse("""
                {
                  "maxAttempts": 0,
                  "messageQueueSize": -4,
                  "baseBackoffMs": 40,
                  "maxBackoffMs": 10,
                  "escalationSeverityThreshold": 42,
                  "escalationBudgetMs": 1,
                  "rateLimit": { "warningThreshold": 3.5 }
                }
                """);

        Assertions.assertEquals(1, settings.maxAttempts());
        Assertions.assertEquals(1, settings.messageQueueSize());
        Assertions.assertEquals(40L, settings.baseBackoffMs());
        Assertions.assertEquals(40L, settings.maxBackoffMs());
        Assertions.assertEquals(10, settings.escalationSeverityThreshold());
        Assertions.assertEquals(10L, settings.escalationBudgetMs());
        Assertions.assertEquals(1.0d, settings.rateLimit().warningThreshold());
    }

    @Test
    void channelsAreReadFromFile() {
        CrisisLinkSettings settings = CrisisLinkSettings.parse("""
                {
                  "channels": [
                    { "id": "regional-hotline", "kind": "hotline", "reference": "555-0100", "minSeverity": 7 },
                    { "id": "", "kind": "SUPERVISOR" },
                    { "id": "on-call", "kind": "SUPERVISOR" }
                  ]
                }
                """);

        List<EmergencyChannel> channels = settings.channels();
        Assertions.assertEquals(2, channels.size());
        Assertions.assertEquals(ChannelKind.HOTLINE, channels.get(0).kind());
        Assertions.assertEquals(7, channels.get(0).minSeverity());
        Assertions.assertEquals(1, channels.get(1).minSeverity());
    }

    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-settings-");
        try {
            CrisisLinkConfig config = CrisisLinkConfig.fromRoot(root.toString());
            Assertions.assertEquals(CrisisLinkSettings.defaults(), CrisisLinkSettings.load(config.settingsFile()));

            Files.writeString(config.settingsFile(), """
                    { "maxConnections": 25, "volunteerCapacity": 2 }
                    """);
            CrisisLinkSettings loaded = CrisisLinkSettings.load(config.settingsFile());
            Assertions.assertEquals(25, loaded.maxConnections());
            Assertions.assertEquals(2, loaded.volunteerCapacity());
        } finally {
            deleteRecursively(root);
        }
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
