package io.crisislink.model;

public record ChannelOutcome(
        String channelId,
        ChannelKind kind,
        boolean reached,
        long latencyMs,
        String error
) {
    public static ChannelOutcome reached(EmergencyChannel channel, long latencyMs) {
        return new ChannelOutcome(channel.id(), channel.kind(), true, latencyMs, null);
    }

    public static ChannelOutcome unreached(EmergencyChannel channel, long latencyMs, String error) {
        return new ChannelOutcome(channel.id(), channel.kind(), false, latencyMs, error);
    }
}
