package io.crisislink.delivery;

import io.crisislink.security.PayloadCrypto;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class PayloadCodecTest {
    @Test
    void shortPayloadsPassThroughUnchanged() {
        PayloadCodec codec = new PayloadCodec(null, true);
        PayloadCodec.Encoded encoded = codec.encode("I need someone to talk to", false);

        Assertions.assertEquals("I need someone to talk to", encoded.payload());
        Assertions.assertFalse(encoded.compressed());
        Assertions.assertFalse(encoded.encrypted());
    }

    @Test
    void largePayloadsAreCompressedWhenEnabled() {
        String content = "a long night. ".repeat(200);
        PayloadCodec codec = new PayloadCodec(null, true);
        PayloadCodec.Encoded encoded = codec.encode(content, false);

        Assertions.assertTrue(encoded.compressed());
        Assertions.assertTrue(encoded.payload().length() < content.length());
        Assertions.assertEquals(content, codec.decode(encoded.payload(), false, true));

        PayloadCodec plain = new PayloadCodec(null, false);
        Assertions.assertFalse(plain.encode(content, false).compressed());
    }

    @Test
    void encryptionRequiresAKeyring() {
        PayloadCodec codec = new PayloadCodec(null, false);
        Assertions.assertThrows(IllegalStateException.class, () -> codec.encode("hello", true));
    }

    @Test
    void compressedPayloadIsSealedLast() throws Exception {
        Path root = Files.createTempDirectory("crisislink-test-codec");
        try {
            PayloadCodec codec = new PayloadCodec(new PayloadCrypto(root.resolve("payload-keys.json")), true);
            String content = "I keep thinking about it. ".repeat(100);
            PayloadCodec.Encoded encoded = codec.encode(content, true);

            Assertions.assertTrue(encoded.encrypted());
            Assertions.assertTrue(encoded.compressed());
            Assertions.assertTrue(PayloadCrypto.isSealed(encoded.payload()));
            Assertions.assertEquals(content, codec.decode(encoded.payload(), true, true));
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
