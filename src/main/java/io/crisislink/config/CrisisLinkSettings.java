package io.crisislink.config;

import io.crisislink.model.ChannelKind;
import io.crisislink.model.EmergencyChannel;
import io.crisislink.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record CrisisLinkSettings(
        long reconnectIntervalMs,
        int maxReconnectAttempts,
        long heartbeatIntervalMs,
        long connectionTimeoutMs,
        int messageQueueSize,
        boolean compressionEnabled,
        boolean encryptionEnabled,
        RateLimitSettings rateLimit,
        int maxConnections,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        int breakerFailureThreshold,
        long breakerCooldownMs,
        int breakerHalfOpenSuccesses,
        long handshakeBudgetMs,
        long deliveryBudgetMs,
        long escalationBudgetMs,
        long failoverWindowMs,
        long maxSessionDurationMs,
        long inactivityTimeoutMs,
        int escalationSeverityThreshold,
        int volunteerCapacity,
        List<EmergencyChannel> channels
) {
    public static CrisisLinkSettings defaults() {
        return new CrisisLinkSettings(
                CrisisLinkConfig.DEFAULT_RECONNECT_INTERVAL_MS,
                CrisisLinkConfig.DEFAULT_MAX_RECONNECT_ATTEMPTS,
                CrisisLinkConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                CrisisLinkConfig.DEFAULT_CONNECTION_TIMEOUT_MS,
                CrisisLinkConfig.DEFAULT_MESSAGE_QUEUE_SIZE,
                false,
                false,
                RateLimitSettings.defaults(),
                CrisisLinkConfig.DEFAULT_MAX_CONNECTIONS,
                CrisisLinkConfig.DEFAULT_MAX_ATTEMPTS,
                CrisisLinkConfig.DEFAULT_BASE_BACKOFF_MS,
                CrisisLinkConfig.DEFAULT_MAX_BACKOFF_MS,
                CrisisLinkConfig.DEFAULT_BREAKER_FAILURE_THRESHOLD,
                CrisisLinkConfig.DEFAULT_BREAKER_COOLDOWN_MS,
                CrisisLinkConfig.DEFAULT_BREAKER_HALF_OPEN_SUCCESSES,
                CrisisLinkConfig.DEFAULT_HANDSHAKE_BUDGET_MS,
                CrisisLinkConfig.DEFAULT_DELIVERY_BUDGET_MS,
                CrisisLinkConfig.DEFAULT_ESCALATION_BUDGET_MS,
                CrisisLinkConfig.DEFAULT_FAILOVER_WINDOW_MS,
                CrisisLinkConfig.DEFAULT_MAX_SESSION_DURATION_MS,
                CrisisLinkConfig.DEFAULT_INACTIVITY_TIMEOUT_MS,
                CrisisLinkConfig.DEFAULT_ESCALATION_SEVERITY_THRESHOLD,
                CrisisLinkConfig.DEFAULT_VOLUNTEER_CAPACITY,
                EmergencyChannel.defaults()
        );
    }

    /**
     * Loads settings from a JSON file, falling back to defaults for the file itself
     * when it is missing and for every field the file leaves out.
     */
    public static CrisisLinkSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public static CrisisLinkSettings parse(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(json, SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse settings JSON", e);
        }
    }

    static CrisisLinkSettings fromFile(SettingsFile file, CrisisLinkSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long reconnectInterval = sanitizeLong(file.reconnectIntervalMs(), defaults.reconnectIntervalMs(), 1L);
        int maxReconnectAttempts = sanitizeInt(file.maxReconnectAttempts(), defaults.maxReconnectAttempts(), 0);
        long heartbeatInterval = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 10L);
        long connectionTimeout = sanitizeLong(file.connectionTimeoutMs(), defaults.connectionTimeoutMs(), 1L);
        int messageQueueSize = sanitizeInt(file.messageQueueSize(), defaults.messageQueueSize(), 1);
        boolean compression = sanitizeBoolean(file.compressionEnabled(), defaults.compressionEnabled());
        boolean encryption = sanitizeBoolean(file.encryptionEnabled(), defaults.encryptionEnabled());
        RateLimitSettings rateLimit = RateLimitSettings.fromFile(file.rateLimit(), defaults.rateLimit());
        int maxConnections = sanitizeInt(file.maxConnections(), defaults.maxConnections(), 1);
        int maxAttempts = sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        int breakerThreshold = sanitizeInt(file.breakerFailureThreshold(), defaults.breakerFailureThreshold(), 1);
        long breakerCooldown = sanitizeLong(file.breakerCooldownMs(), defaults.breakerCooldownMs(), 1L);
        int halfOpenSuccesses = sanitizeInt(file.breakerHalfOpenSuccesses(), defaults.breakerHalfOpenSuccesses(), 1);
        long handshakeBudget = sanitizeLong(file.handshakeBudgetMs(), defaults.handshakeBudgetMs(), 1L);
        long deliveryBudget = sanitizeLong(file.deliveryBudgetMs(), defaults.deliveryBudgetMs(), 1L);
        long escalationBudget = sanitizeLong(file.escalationBudgetMs(), defaults.escalationBudgetMs(), 10L);
        long failoverWindow = sanitizeLong(file.failoverWindowMs(), defaults.failoverWindowMs(), connectionTimeout);
        long maxSessionDuration = sanitizeLong(file.maxSessionDurationMs(), defaults.maxSessionDurationMs(), 1_000L);
        long inactivityTimeout = sanitizeLong(file.inactivityTimeoutMs(), defaults.inactivityTimeoutMs(), 1_000L);
        int severityThreshold = Math.min(10, sanitizeInt(
                file.escalationSeverityThreshold(),
                defaults.escalationSeverityThreshold(),
                1
        ));
        int volunteerCapacity = sanitizeInt(file.volunteerCapacity(), defaults.volunteerCapacity(), 1);
        List<EmergencyChannel> channels = sanitizeChannels(file.channels(), defaults.channels());
        return new CrisisLinkSettings(
                reconnectInterval,
                maxReconnectAttempts,
                heartbeatInterval,
                connectionTimeout,
                messageQueueSize,
                compression,
                encryption,
                rateLimit,
                maxConnections,
                maxAttempts,
                baseBackoff,
                maxBackoff,
                breakerThreshold,
                breakerCooldown,
                halfOpenSuccesses,
                handshakeBudget,
                deliveryBudget,
                escalationBudget,
                failoverWindow,
                maxSessionDuration,
                inactivityTimeout,
                severityThreshold,
                volunteerCapacity,
                channels
        );
    }

    /**
     * Portion of the escalation budget spent waiting on channel fan-out; the rest covers
     * state transition, audit and event publication.
     */
    public long notifyDeadlineMs() {
        return Math.max(5L, escalationBudgetMs * 3L / 4L);
    }

    private static List<EmergencyChannel> sanitizeChannels(List<ChannelFile> raw, List<EmergencyChannel> fallback) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        List<EmergencyChannel> out = new ArrayList<>();
        for (ChannelFile channel : raw) {
            if (channel == null || channel.id() == null || channel.id().isBlank() || channel.kind() == null) {
                continue;
            }
            ChannelKind kind = ChannelKind.valueOf(channel.kind().trim().toUpperCase(Locale.ROOT));
            int minSeverity = channel.minSeverity() == null ? 1 : channel.minSeverity();
            out.add(new EmergencyChannel(channel.id().trim(), kind, channel.reference(), minSeverity));
        }
        return out.isEmpty() ? fallback : List.copyOf(out);
    }

    static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    static double sanitizeRatio(Double raw, double fallback) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(0.0d, Math.min(1.0d, raw));
    }

    record SettingsFile(
            Long reconnectIntervalMs,
            Integer maxReconnectAttempts,
            Long heartbeatIntervalMs,
            Long connectionTimeoutMs,
            Integer messageQueueSize,
            Boolean compressionEnabled,
            Boolean encryptionEnabled,
            RateLimitFile rateLimit,
            Integer maxConnections,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Integer breakerFailureThreshold,
            Long breakerCooldownMs,
            Integer breakerHalfOpenSuccesses,
            Long handshakeBudgetMs,
            Long deliveryBudgetMs,
            Long escalationBudgetMs,
            Long failoverWindowMs,
            Long maxSessionDurationMs,
            Long inactivityTimeoutMs,
            Integer escalationSeverityThreshold,
            Integer volunteerCapacity,
            List<ChannelFile> channels
    ) {
    }

    record RateLimitFile(
            Integer maxMessagesPerSecond,
            Integer maxMessagesPerMinute,
            Long maxBytesPerSecond,
            Long banDurationMs,
            Double warningThreshold
    ) {
    }

    record ChannelFile(String id, String kind, String reference, Integer minSeverity) {
    }

    public record RateLimitSettings(
            int maxMessagesPerSecond,
            int maxMessagesPerMinute,
            long maxBytesPerSecond,
            long banDurationMs,
            double warningThreshold
    ) {
        public static RateLimitSettings defaults() {
            return new RateLimitSettings(10, 120, 64L * 1024L, 60_000L, 0.8d);
        }

        static RateLimitSettings fromFile(RateLimitFile file, RateLimitSettings defaults) {
            if (file == null) {
                return defaults;
            }
            return new RateLimitSettings(
                    sanitizeInt(file.maxMessagesPerSecond(), defaults.maxMessagesPerSecond(), 1),
                    sanitizeInt(file.maxMessagesPerMinute(), defaults.maxMessagesPerMinute(), 1),
                    sanitizeLong(file.maxBytesPerSecond(), defaults.maxBytesPerSecond(), 1L),
                    sanitizeLong(file.banDurationMs(), defaults.banDurationMs(), 0L),
                    sanitizeRatio(file.warningThreshold(), defaults.warningThreshold())
            );
        }
    }
}
