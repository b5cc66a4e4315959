package io.crisislink.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crisislink.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-GCM sealing of message payloads with a rotating keyring kept on disk.
 * Sealed payloads look like {@code clk1:<kid>:<iv>:<ciphertext>} so older keys stay
 * usable for reading after a rotation.
 */
public final class PayloadCrypto {
    private static final String PREFIX = "clk1:";
    private static final String KEYRING_SCHEMA = "crisislink.payload.keys.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom = new SecureRandom();
    private volatile Keyring keyring;

    public PayloadCrypto(Path keyFile) {
        this.keyFile = keyFile;
        this.keyring = loadOrCreateKeyring();
    }

    public static boolean isSealed(String payload) {
        return payload != null && payload.startsWith(PREFIX);
    }

    public String seal(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys().get(ring.activeKid());
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(ring.activeKid().getBytes(StandardCharsets.UTF_8));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder b64 = Base64.getUrlEncoder().withoutPadding();
            return PREFIX + ring.activeKid() + ":" + b64.encodeToString(iv) + ":" + b64.encodeToString(cipherText);
        } catch (Exception e) {
            throw new RuntimeException("Failed to encrypt payload", e);
        }
    }

    /** Returns the plaintext of a sealed payload; anything else is returned unchanged. */
    public String open(String payload) {
        if (!isSealed(payload)) {
            return payload;
        }
        String[] parts = payload.substring(PREFIX.length()).split(":", 3);
        if (parts.length != 3) {
            throw new RuntimeException("Invalid sealed payload format");
        }
        String kid = parts[0];
        SecretKeySpec key = keyring.keys().get(kid);
        if (key == null) {
            throw new RuntimeException("Unknown payload key id: " + kid);
        }
        try {
            Base64.Decoder b64 = Base64.getUrlDecoder();
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, b64.decode(parts[1])));
            cipher.updateAAD(kid.getBytes(StandardCharsets.UTF_8));
            return new String(cipher.doFinal(b64.decode(parts[2])), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new RuntimeException("Failed to decrypt payload", e);
        }
    }

    public synchronized KeyringStatus rotate() {
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(keyring.keys());
        String kid = newKid(next);
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        persistKeyring(rotated);
        keyring = rotated;
        return status();
    }

    public KeyringStatus status() {
        Keyring ring = keyring;
        return new KeyringStatus(ring.activeKid(), ring.keys().size(), keyFile.toString());
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            return bootstrap();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            keysNode.fieldNames().forEachRemaining(kid -> {
                String raw = keysNode.path(kid).asText("");
                if (!kid.isBlank() && !raw.isBlank()) {
                    keys.put(kid, new SecretKeySpec(Base64.getDecoder().decode(raw), "AES"));
                }
            });
            if (keys.isEmpty()) {
                return bootstrap();
            }
            if (!keys.containsKey(active)) {
                active = keys.keySet().iterator().next();
            }
            return new Keyring(active, keys);
        } catch (IOException | RuntimeException e) {
            throw new RuntimeException("Failed to load payload keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrap() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = newKid(keys);
        keys.put(kid, newKey());
        Keyring created = new Keyring(kid, keys);
        persistKeyring(created);
        return created;
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private static String newKid(Map<String, SecretKeySpec> existing) {
        String kid = "k" + Instant.now().toEpochMilli();
        int suffix = 1;
        while (existing.containsKey(kid)) {
            kid = "k" + Instant.now().toEpochMilli() + "-" + suffix++;
        }
        return kid;
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            ring.keys().forEach((kid, key) -> keys.put(kid, Base64.getEncoder().encodeToString(key.getEncoded())));
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", KEYRING_SCHEMA);
            root.put("active_kid", ring.activeKid());
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist payload keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }

    public record KeyringStatus(String activeKid, int totalKeys, String keyFile) {
    }
}
