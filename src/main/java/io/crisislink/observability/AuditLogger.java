package io.crisislink.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crisislink.security.SensitiveDataMasker;
import io.crisislink.util.Hashing;
import io.crisislink.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row and
 * an HMAC of its own hash, so edits and truncation in the middle of the file are
 * detectable with {@link #verify(int)}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently by another process.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public static AuditLogger open(Path auditFile, Path signingKeyFile) {
        return new AuditLogger(auditFile, loadOrCreateSigningSecret(signingKeyFile));
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("session_id", event.sessionId());
        row.put("connection_id", event.connectionId());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        try {
            Files.writeString(auditFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    public List<String> tail(int lines) {
        try {
            List<String> all = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int n = Math.max(1, lines);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - n), all.size()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit tail", e);
        }
    }

    /**
     * Recomputes the chain over the last {@code limit} rows (all rows when 0) and stops
     * at the first row whose link, hash or signature does not match.
     */
    public synchronized Integrity verify(int limit) {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit integrity", e);
        }
        int start = limit > 0 && limit < lines.size() ? lines.size() - limit : 0;
        int checked = 0;
        String expectedPrev = "";
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new Integrity(false, checked, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            String prevHash = parsed.path("prev_hash").asText("");
            if (i > start && !prevHash.equals(expectedPrev)) {
                return new Integrity(false, checked, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            canonical.remove("signature");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new Integrity(false, checked, i + 1, "hash_mismatch");
            }
            String signature = parsed.path("signature").asText("");
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                return new Integrity(false, checked, i + 1, "signature_mismatch");
            }
            checked++;
            expectedPrev = hash;
        }
        return new Integrity(true, checked, 0, "");
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(input));
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    private static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String sessionId,
            String connectionId,
            String result,
            String traceId,
            Map<String, Object> details
    ) {
        public static AuditEvent system(String action, String result, Map<String, Object> details) {
            return new AuditEvent(action, "system", null, null, result, null, details == null ? Map.of() : details);
        }

        public static AuditEvent forSession(
                String action,
                String actor,
                Object sessionId,
                String result,
                String traceId,
                Map<String, Object> details
        ) {
            return new AuditEvent(
                    action,
                    actor,
                    sessionId == null ? null : sessionId.toString(),
                    null,
                    result,
                    traceId,
                    details == null ? Map.of() : details
            );
        }

        public static AuditEvent forConnection(String action, Object connectionId, String result, Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    "system",
                    null,
                    connectionId == null ? null : connectionId.toString(),
                    result,
                    null,
                    details == null ? Map.of() : details
            );
        }
    }

    public record Integrity(boolean ok, int checkedRows, int brokenLine, String reason) {
    }
}
