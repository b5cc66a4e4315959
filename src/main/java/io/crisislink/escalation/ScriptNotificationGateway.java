package io.crisislink.escalation;

import io.crisislink.model.EmergencyChannel;
import io.crisislink.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Hands each notification to an external command. The notice is written to the
 * command's stdin as JSON and the channel is passed in {@code CRISISLINK_CHANNEL_*}
 * environment variables. Exit code 0 means the channel was reached.
 */
public final class ScriptNotificationGateway implements NotificationGateway {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptNotificationGateway(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("notification command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(10L, timeoutMs);
    }

    @Override
    public NotificationResult notify(EmergencyChannel channel, EscalationNotice notice) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("CRISISLINK_CHANNEL_ID", channel.id());
        pb.environment().put("CRISISLINK_CHANNEL_KIND", channel.kind().name());
        pb.environment().put("CRISISLINK_CHANNEL_REFERENCE", channel.reference());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return NotificationResult.failed("notify spawn failed: " + e.getMessage());
        }

        try {
            process.getOutputStream().write(payload(channel, notice).getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return NotificationResult.failed("notify timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return NotificationResult.ok(combined.strip());
            }
            return NotificationResult.failed("notify exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return NotificationResult.failed("notify interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return NotificationResult.failed("notify execution failed: " + e.getMessage());
        }
    }

    private static String payload(EmergencyChannel channel, EscalationNotice notice) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", channel.id());
        body.put("kind", channel.kind().name());
        body.put("reference", channel.reference());
        body.put("alertId", notice.alertId().toString());
        body.put("sessionId", notice.sessionId().toString());
        body.put("severity", notice.severity());
        body.put("level", notice.level().name());
        body.put("reason", notice.reason());
        body.put("anonymous", notice.anonymous());
        body.put("traceId", notice.traceId());
        body.put("raisedAt", notice.raisedAt().toString());
        return Jsons.toCompactJson(body);
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
