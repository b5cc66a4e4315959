package io.crisislink.runtime;

import java.util.Map;

public record StatsSnapshot(
        int connections,
        int maxConnections,
        Map<String, Integer> connectionsByRole,
        long connectionsAdmittedTotal,
        long connectionsRejectedTotal,
        Map<String, Integer> sessionsByStatus,
        int waitingForVolunteer,
        int availableVolunteers,
        long messagesDelivered,
        long messagesFailed,
        long messagesQueuedOffline,
        long bestEffortDropped,
        long outboxPending,
        long deliveryP50Ms,
        long deliveryP95Ms,
        long deliveryP99Ms,
        double deliveryWithinBudgetRatio,
        long escalationsTotal,
        Map<String, Long> escalationsByLevel,
        double escalationAvgMs,
        long escalationMaxMs,
        long escalationChannelFailures,
        Map<String, String> circuitStates,
        long circuitsOpen,
        long rateLimitedTotal,
        long rateLimitWarningsTotal,
        double connectionSuccessRate,
        double deliveryRate,
        double averageHandshakeMs,
        String stability,
        long eventsPublished,
        long eventListenerFailures,
        long persistenceWrittenTotal,
        long persistenceFailedTotal
) {
}
