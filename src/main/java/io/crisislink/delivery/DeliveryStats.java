package io.crisislink.delivery;

import io.crisislink.observability.LatencyRecorder;

public record DeliveryStats(
        long delivered,
        long failed,
        long queuedOffline,
        long droppedBestEffort,
        long pending,
        int activeOutboxes,
        LatencyRecorder.Snapshot latency
) {
}
