package io.crisislink.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class PayloadCryptoTest {
    @Test
    void sealedPayloadsOpenWithTheSameKeyring() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-crypto");
        try {
            Path keyFile = root.resolve("security").resolve("payload-keys.json");
            PayloadCrypto crypto = new PayloadCrypto(keyFile);
            String sealed = crypto.seal("my address is 12 Elm St");

            Assertions.assertTrue(Files.exists(keyFile));
            Assertions.assertTrue(PayloadCrypto.isSealed(sealed));
            Assertions.assertFalse(sealed.contains("Elm"));
            Assertions.assertNotEquals(sealed, crypto.seal("my address is 12 Elm St"));
            Assertions.assertEquals("my address is 12 Elm St", crypto.open(sealed));

            PayloadCrypto reopened = new PayloadCrypto(keyFile);
            Assertions.assertEquals("my address is 12 Elm St", reopened.open(sealed));
            Assertions.assertEquals("plain text", reopened.open("plain text"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rotationKeepsOlderKeysReadable() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-crypto");
        try {
            Path keyFile = root.resolve("payload-keys.json");
            PayloadCrypto crypto = new PayloadCrypto(keyFile);
            PayloadCrypto.KeyringStatus before = crypto.status();
            String old = crypto.seal("before rotation");

            PayloadCrypto.KeyringStatus after = crypto.rotate();

            Assertions.assertEquals(1, before.totalKeys());
            Assertions.assertEquals(2, after.totalKeys());
            Assertions.assertNotEquals(before.activeKid(), after.activeKid());
            Assertions.assertTrue(crypto.seal("after rotation").startsWith("clk1:" + after.activeKid() + ":"));
            Assertions.assertEquals("before rotation", new PayloadCrypto(keyFile).open(old));
            Assertions.assertEquals(after.activeKid(), new PayloadCrypto(keyFile).status().activeKid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedCiphertextIsRejected() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-crypto");
        try {
            PayloadCrypto crypto = new PayloadCrypto(root.resolve("payload-keys.json"));
            String sealed = crypto.seal("do not change me");
            int at = sealed.length() - 10;
            char flipped = sealed.charAt(at) == 'A' ? 'B' : 'A';
            String tampered = sealed.substring(0, at) + flipped + sealed.substring(at + 1);

            Assertions.assertThrows(RuntimeException.class, () -> crypto.open(tampered));
            Assertions.assertThrows(RuntimeException.class, () -> crypto.open("clk1:unknown:AAAA:AAAA"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
