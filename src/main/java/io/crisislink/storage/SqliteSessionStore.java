package io.crisislink.storage;

import io.crisislink.config.CrisisLinkConfig;
import io.crisislink.model.CrisisMessage;
import io.crisislink.model.DeliveryStatus;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionStatus;
import io.crisislink.model.SessionSummary;
import io.crisislink.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteSessionStore implements SessionStore {
    static final String SCHEMA_VERSION = "crisislink.schema.v1";

    private final CrisisLinkConfig config;
    private final String jdbcUrl;

    public SqliteSessionStore(CrisisLinkConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sessions (
                        session_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        severity INTEGER NOT NULL,
                        emergency INTEGER NOT NULL DEFAULT 0,
                        anonymous INTEGER NOT NULL DEFAULT 1,
                        message_count INTEGER NOT NULL DEFAULT 0,
                        escalation_count INTEGER NOT NULL DEFAULT 0,
                        end_reason TEXT,
                        rating INTEGER,
                        feedback_comment TEXT,
                        started_at_ms INTEGER NOT NULL,
                        ended_at_ms INTEGER,
                        duration_ms INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        message_id TEXT PRIMARY KEY,
                        session_id TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        sender_role TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        priority TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        encrypted INTEGER NOT NULL DEFAULT 0,
                        compressed INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        sent_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS escalations (
                        alert_id TEXT PRIMARY KEY,
                        session_id TEXT NOT NULL,
                        severity INTEGER NOT NULL,
                        level TEXT NOT NULL,
                        reason TEXT NOT NULL,
                        contacted_services TEXT NOT NULL,
                        outcomes_json TEXT NOT NULL,
                        elapsed_ms INTEGER NOT NULL,
                        trace_id TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        applied_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_session_seq ON messages(session_id, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_escalations_session_created ON escalations(session_id, created_at_ms)");
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR IGNORE INTO schema_migrations(version, applied_at_ms) VALUES(?,?)")) {
                ps.setString(1, SCHEMA_VERSION);
                ps.setLong(2, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<String> appliedMigrations() {
        List<String> out = new ArrayList<>();
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT version FROM schema_migrations ORDER BY applied_at_ms");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    @Override
    public void saveMessage(CrisisMessage message) {
        String sql = """
                INSERT INTO messages(message_id,session_id,seq,sender_role,kind,priority,payload,encrypted,compressed,status,retry_count,sent_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(message_id) DO UPDATE SET
                    status=excluded.status,
                    retry_count=excluded.retry_count,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, message.id().value());
            ps.setString(2, message.sessionId().value());
            ps.setLong(3, message.sequence());
            ps.setString(4, message.senderRole().name());
            ps.setString(5, message.kind().name());
            ps.setString(6, message.priority().name());
            ps.setString(7, message.payload());
            ps.setInt(8, message.encrypted() ? 1 : 0);
            ps.setInt(9, message.compressed() ? 1 : 0);
            ps.setString(10, message.status().name());
            ps.setInt(11, message.retryCount());
            ps.setLong(12, message.sentAt().toEpochMilli());
            ps.setLong(13, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save message " + message.id(), e);
        }
    }

    @Override
    public List<StoredMessage> loadSessionHistory(SessionId sessionId) {
        String sql = """
                SELECT message_id,session_id,seq,sender_role,kind,priority,payload,encrypted,compressed,status,retry_count,sent_at_ms
                FROM messages WHERE session_id=? ORDER BY seq ASC
                """;
        List<StoredMessage> out = new ArrayList<>();
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId.value());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredMessage(
                            rs.getString("message_id"),
                            rs.getString("session_id"),
                            rs.getLong("seq"),
                            Role.valueOf(rs.getString("sender_role")),
                            MessageKind.valueOf(rs.getString("kind")),
                            MessagePriority.valueOf(rs.getString("priority")),
                            rs.getString("payload"),
                            rs.getInt("encrypted") == 1,
                            rs.getInt("compressed") == 1,
                            DeliveryStatus.valueOf(rs.getString("status")),
                            rs.getInt("retry_count"),
                            rs.getLong("sent_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load history for session " + sessionId, e);
        }
    }

    @Override
    public void saveEscalation(EscalationEvent event) {
        String sql = """
                INSERT OR IGNORE INTO escalations(alert_id,session_id,severity,level,reason,contacted_services,outcomes_json,elapsed_ms,trace_id,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, event.alertId().value());
            ps.setString(2, event.sessionId().value());
            ps.setInt(3, event.severity());
            ps.setString(4, event.level().name());
            ps.setString(5, event.reason() == null ? "" : event.reason());
            ps.setString(6, String.join(",", event.contactedServices()));
            ps.setString(7, Jsons.toCompactJson(event.outcomes()));
            ps.setLong(8, event.elapsedMs());
            ps.setString(9, event.traceId());
            ps.setLong(10, event.createdAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save escalation " + event.alertId(), e);
        }
    }

    @Override
    public List<StoredEscalation> loadEscalations(SessionId sessionId) {
        String sql = """
                SELECT alert_id,session_id,severity,level,reason,contacted_services,elapsed_ms,created_at_ms
                FROM escalations WHERE session_id=? ORDER BY created_at_ms ASC
                """;
        List<StoredEscalation> out = new ArrayList<>();
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId.value());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredEscalation(
                            rs.getString("alert_id"),
                            rs.getString("session_id"),
                            rs.getInt("severity"),
                            rs.getString("level"),
                            rs.getString("reason"),
                            rs.getString("contacted_services"),
                            rs.getLong("elapsed_ms"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load escalations for session " + sessionId, e);
        }
    }

    @Override
    public void saveSessionSummary(SessionSummary summary) {
        String sql = """
                INSERT INTO sessions(session_id,status,severity,emergency,anonymous,message_count,escalation_count,end_reason,rating,feedback_comment,started_at_ms,ended_at_ms,duration_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(session_id) DO UPDATE SET
                    status=excluded.status,
                    severity=excluded.severity,
                    emergency=excluded.emergency,
                    message_count=excluded.message_count,
                    escalation_count=excluded.escalation_count,
                    end_reason=excluded.end_reason,
                    rating=excluded.rating,
                    feedback_comment=excluded.feedback_comment,
                    ended_at_ms=excluded.ended_at_ms,
                    duration_ms=excluded.duration_ms
                """;
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, summary.sessionId().value());
            ps.setString(2, summary.status().name());
            ps.setInt(3, summary.severity());
            ps.setInt(4, summary.emergency() ? 1 : 0);
            ps.setInt(5, summary.anonymous() ? 1 : 0);
            ps.setInt(6, summary.messageCount());
            ps.setInt(7, summary.escalationCount());
            ps.setString(8, summary.endReason());
            if (summary.rating() == null) {
                ps.setNull(9, Types.INTEGER);
            } else {
                ps.setInt(9, summary.rating());
            }
            ps.setString(10, summary.comment());
            ps.setLong(11, summary.startedAt().toEpochMilli());
            if (summary.endedAt() == null) {
                ps.setNull(12, Types.INTEGER);
            } else {
                ps.setLong(12, summary.endedAt().toEpochMilli());
            }
            ps.setLong(13, summary.durationMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save session summary " + summary.sessionId(), e);
        }
    }

    @Override
    public Optional<SessionSummary> loadSessionSummary(SessionId sessionId) {
        String sql = """
                SELECT session_id,status,severity,emergency,anonymous,message_count,escalation_count,end_reason,rating,feedback_comment,started_at_ms,ended_at_ms,duration_ms
                FROM sessions WHERE session_id=?
                """;
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId.value());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                int rating = rs.getInt("rating");
                Integer boxedRating = rs.wasNull() ? null : rating;
                long endedAt = rs.getLong("ended_at_ms");
                Instant ended = rs.wasNull() ? null : Instant.ofEpochMilli(endedAt);
                return Optional.of(new SessionSummary(
                        SessionId.of(rs.getString("session_id")),
                        SessionStatus.valueOf(rs.getString("status")),
                        rs.getInt("severity"),
                        rs.getInt("emergency") == 1,
                        rs.getInt("anonymous") == 1,
                        rs.getInt("message_count"),
                        rs.getInt("escalation_count"),
                        rs.getString("end_reason"),
                        boxedRating,
                        rs.getString("feedback_comment"),
                        Instant.ofEpochMilli(rs.getLong("started_at_ms")),
                        ended,
                        rs.getLong("duration_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load session summary " + sessionId, e);
        }
    }
}
