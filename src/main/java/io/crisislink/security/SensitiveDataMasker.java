package io.crisislink.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crisislink.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts conversation content and contact details before they reach the audit trail
 * or the logs. Keys are matched by substring, values by shape.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "content", "payload", "message_text", "comment", "phone", "email", "address",
            "password", "secret", "token", "key", "credential"
    );
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern IDENTIFIER = Pattern.compile("^(sess|conn|msg|alert)-[0-9a-f-]{36}$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\w-])\\+?(?:1[\\s.-]?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}(?![\\w-])"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            return Jsons.mapper().valueToTree(maskText(input.asText("")));
        }
        return input;
    }

    /** Replaces email addresses, phone numbers and opaque tokens inside free text. */
    public static String maskText(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        String v = value.trim();
        if (!IDENTIFIER.matcher(v).matches() && OPAQUE_TOKEN.matcher(v).matches()) {
            return MASK;
        }
        String out = EMAIL.matcher(value).replaceAll(MASK);
        return PHONE.matcher(out).replaceAll(MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
