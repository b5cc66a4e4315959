package io.crisislink.escalation;

import io.crisislink.model.EscalationLevel;

import java.util.Map;

public record EscalationStats(
        long total,
        Map<EscalationLevel, Long> byLevel,
        double averageElapsedMs,
        long maxElapsedMs,
        long channelFailures,
        double withinBudgetRatio
) {
}
