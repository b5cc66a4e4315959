package io.crisislink.cli;

import io.crisislink.config.CrisisLinkConfig;
import io.crisislink.failover.ConnectionMetrics;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.DeliveryOptions;
import io.crisislink.model.DeliveryReceipt;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.Feedback;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionRequest;
import io.crisislink.model.SessionSummary;
import io.crisislink.model.VolunteerProfile;
import io.crisislink.observability.AuditLogger;
import io.crisislink.runtime.CrisisLinkRuntime;
import io.crisislink.runtime.HistoryEntry;
import io.crisislink.runtime.LoadProbe;
import io.crisislink.session.CrisisSession;
import io.crisislink.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "crisislink",
        mixinStandardHelpOptions = true,
        description = "Crisis session and message delivery manager",
        subcommands = {
                CrisisLinkCommand.InitCommand.class,
                CrisisLinkCommand.SimulateCommand.class,
                CrisisLinkCommand.LoadTestCommand.class,
                CrisisLinkCommand.HistoryCommand.class,
                CrisisLinkCommand.StatsCommand.class,
                CrisisLinkCommand.MetricsCommand.class,
                CrisisLinkCommand.AuditTailCommand.class,
                CrisisLinkCommand.AuditVerifyCommand.class,
                CrisisLinkCommand.PayloadKeyStatusCommand.class,
                CrisisLinkCommand.PayloadKeyRotateCommand.class
        }
)
public final class CrisisLinkCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | simulate | load-test | history | stats | metrics | audit-tail | audit-verify | payload-key-status | payload-key-rotate");
    }

    CrisisLinkConfig config() {
        return CrisisLinkConfig.fromRoot(root);
    }

    CrisisLinkRuntime runtime() {
        return CrisisLinkRuntime.open(config());
    }

    @Command(name = "init", description = "Create the data directories, SQLite schema, keyrings and audit log")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Override
        public Integer call() {
            CrisisLinkConfig config = parent.config();
            try (CrisisLinkRuntime runtime = CrisisLinkRuntime.open(config)) {
                System.out.println(Jsons.toJson(runtime.payloadKeyStatus()));
            }
            System.out.println("Initialized CrisisLink at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "simulate", description = "Run an end-to-end session: connect, match, chat, escalate, end")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Option(names = {"--severity"}, defaultValue = "10", description = "Intake severity 1-10")
        int severity;

        @Option(names = {"--emergency"}, arity = "0..1", defaultValue = "true", description = "Flag the intake as an emergency")
        boolean emergency;

        @Option(names = {"--reason"}, defaultValue = "immediate danger", description = "Emergency trigger reason")
        String reason;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                String suffix = Long.toHexString(System.nanoTime());
                ConnectionMetrics volunteer = runtime.connect(ConnectionInfo.volunteer("volunteer-" + suffix, "en"));
                runtime.registerVolunteer(volunteer.connectionId(), VolunteerProfile.general());
                ConnectionMetrics person = runtime.connect(ConnectionInfo.anonymousPerson("person-" + suffix));

                CrisisSession session = runtime.startSession(
                        person.connectionId(),
                        new SessionRequest(severity, emergency, true)
                );
                SessionId sessionId = session.id();
                DeliveryReceipt first = runtime.sendMessage(sessionId, Role.PERSON_IN_CRISIS, "I need to talk to someone", DeliveryOptions.standard());
                DeliveryReceipt reply = runtime.sendMessage(sessionId, Role.VOLUNTEER, "I'm here with you. You're not alone.", DeliveryOptions.standard());
                EscalationEvent escalation = runtime.triggerEmergency(sessionId, reason);
                SessionSummary summary = runtime.endSession(sessionId, new Feedback(5, "thank you"));
                runtime.flushPersistence(5_000L);

                Map<String, Object> out = new LinkedHashMap<>();
                out.put("sessionId", sessionId.toString());
                out.put("handshakeMs", person.handshakeMs());
                out.put("statusAfterStart", session.status().name());
                out.put("firstMessage", first);
                out.put("reply", reply);
                out.put("escalation", escalation);
                out.put("summary", summary);
                System.out.println(Jsons.toJson(out));
                return escalation.contactedServices().isEmpty() ? 1 : 0;
            }
        }
    }

    @Command(name = "load-test", description = "Open concurrent sessions, send sampled messages and report stability")
    static final class LoadTestCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Option(names = {"--sessions"}, defaultValue = "1000", description = "Concurrent sessions to open")
        int sessions;

        @Option(names = {"--sample"}, defaultValue = "100", description = "Sessions that send one message")
        int sample;

        @Option(names = {"--concurrency"}, defaultValue = "64", description = "Client threads")
        int concurrency;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                LoadProbe.Result result = new LoadProbe(runtime, concurrency).run(sessions, sample);
                System.out.println(Jsons.toJson(result));
                return result.connectionRate() >= 95.0d && result.deliveryRate() >= 98.0d ? 0 : 1;
            }
        }
    }

    @Command(name = "history", description = "Print the stored message history of a session")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Option(names = {"--session-id"}, required = true, description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                List<HistoryEntry> entries = runtime.history(SessionId.of(sessionId));
                System.out.println(Jsons.toJson(entries));
                return 0;
            }
        }
    }

    @Command(name = "stats", description = "Show runtime counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                for (String row : runtime.auditTail(lines)) {
                    System.out.println(row);
                }
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Optional tail row limit; 0 verifies the full log")
        int limit;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                AuditLogger.Integrity out = runtime.verifyAudit(limit);
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "payload-key-status", description = "Show payload encryption keyring status")
    static final class PayloadKeyStatusCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.payloadKeyStatus()));
                return 0;
            }
        }
    }

    @Command(name = "payload-key-rotate", description = "Rotate the payload encryption key")
    static final class PayloadKeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        CrisisLinkCommand parent;

        @Override
        public Integer call() {
            try (CrisisLinkRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.rotatePayloadKey()));
                return 0;
            }
        }
    }
}
