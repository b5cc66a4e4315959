package io.crisislink.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.crisislink.model.SessionId;
import io.crisislink.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {
    @Test
    void contactDetailsAreMaskedInFreeText() {
        Assertions.assertEquals(
                "call me at *** or write to ***",
                SensitiveDataMasker.maskText("call me at 555-123-4567 or write to sam@example.org")
        );
        Assertions.assertEquals("severity raised to 9", SensitiveDataMasker.maskText("severity raised to 9"));
    }

    @Test
    void opaqueTokensAreMaskedButIdentifiersAreKept() {
        String id = SessionId.random().value();
        Assertions.assertEquals(id, SensitiveDataMasker.maskText(id));
        Assertions.assertEquals("***", SensitiveDataMasker.maskText("eyJhbGciOiJIUzI1NiJ9abcdefghijkl"));
    }

    @Test
    void sensitiveKeysAreMaskedAtAnyDepth() throws Exception {
        JsonNode input = Jsons.mapper().readTree("""
                {
                  "session_id": "sess-1",
                  "content": "I can't do this anymore",
                  "caller": { "phone_number": "555 123 4567", "language": "en" },
                  "notes": ["reach me at pat@example.com"],
                  "severity": 9
                }
                """);

        JsonNode masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("sess-1", masked.path("session_id").asText());
        Assertions.assertEquals("***", masked.path("content").asText());
        Assertions.assertEquals("***", masked.path("caller").path("phone_number").asText());
        Assertions.assertEquals("en", masked.path("caller").path("language").asText());
        Assertions.assertEquals("reach me at ***", masked.path("notes").get(0).asText());
        Assertions.assertEquals(9, masked.path("severity").asInt());
        Assertions.assertTrue(SensitiveDataMasker.masked(null).isNull());
    }
}
