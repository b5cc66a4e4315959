package io.crisislink.failover;

public record LoadReport(
        long connectionSamples,
        double connectionSuccessRate,
        double averageHandshakeMs,
        long maxHandshakeMs,
        long deliverySamples,
        double deliveryRate,
        Stability stability
) {
}
