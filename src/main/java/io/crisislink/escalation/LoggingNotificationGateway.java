package io.crisislink.escalation;

import io.crisislink.model.EmergencyChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Records the notification in the log and reports the channel reached. */
public final class LoggingNotificationGateway implements NotificationGateway {
    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationGateway.class);

    @Override
    public NotificationResult notify(EmergencyChannel channel, EscalationNotice notice) {
        logger.info("Notify {} ({} {}) alert={} session={} level={} severity={}",
                channel.id(), channel.kind(), channel.reference(), notice.alertId(), notice.sessionId(),
                notice.level(), notice.severity());
        return NotificationResult.ok("logged to " + channel.id());
    }
}
