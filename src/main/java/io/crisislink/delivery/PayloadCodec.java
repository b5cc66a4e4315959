package io.crisislink.delivery;

import io.crisislink.model.CrisisMessage;
import io.crisislink.security.PayloadCrypto;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Turns message content into its wire payload and back. Large payloads are gzipped
 * when compression is enabled; encryption is applied last.
 */
public final class PayloadCodec {
    static final int COMPRESSION_THRESHOLD_BYTES = 1024;

    private final PayloadCrypto crypto;
    private final boolean compressionEnabled;

    public PayloadCodec(PayloadCrypto crypto, boolean compressionEnabled) {
        this.crypto = crypto;
        this.compressionEnabled = compressionEnabled;
    }

    public Encoded encode(String content, boolean encrypt) {
        String payload = content == null ? "" : content;
        boolean compressed = false;
        if (compressionEnabled && payload.length() >= COMPRESSION_THRESHOLD_BYTES) {
            payload = gzip(payload);
            compressed = true;
        }
        boolean encrypted = false;
        if (encrypt) {
            if (crypto == null) {
                throw new IllegalStateException("encryption requested but no payload keyring is configured");
            }
            payload = crypto.seal(payload);
            encrypted = true;
        }
        return new Encoded(payload, encrypted, compressed);
    }

    public String decode(CrisisMessage message) {
        return decode(message.payload(), message.encrypted(), message.compressed());
    }

    public String decode(String payload, boolean encrypted, boolean compressed) {
        String out = payload;
        if (encrypted && crypto != null) {
            out = crypto.open(out);
        }
        if (compressed) {
            out = gunzip(out);
        }
        return out;
    }

    private static String gzip(String text) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(bytes)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException("Failed to compress payload", e);
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    private static String gunzip(String encoded) {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(Base64.getDecoder().decode(encoded)))) {
            return new String(gz.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to decompress payload", e);
        }
    }

    public record Encoded(String payload, boolean encrypted, boolean compressed) {
    }
}
