package io.crisislink.observability;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class TraceIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceIds() {
    }

    public static String newTraceId() {
        byte[] value = new byte[16];
        RANDOM.nextBytes(value);
        return HexFormat.of().formatHex(value);
    }
}
