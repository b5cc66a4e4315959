package io.crisislink.escalation;

import io.crisislink.model.EmergencyChannel;

/**
 * Reaches one external emergency channel. Implementations are called concurrently,
 * one call per channel per escalation, and should return promptly; the caller stops
 * waiting once the escalation deadline passes.
 */
public interface NotificationGateway {
    NotificationResult notify(EmergencyChannel channel, EscalationNotice notice) throws Exception;
}
