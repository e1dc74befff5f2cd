package org.carball.querymon.instrument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Replaces the values of sensitive argument keys before arguments leave the process.
 * Keys are matched case-insensitively at every nesting level.
 */
public final class ArgumentSanitizer {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_KEYS = Set.of("password", "token", "secret", "apikey", "privatekey");

    private ArgumentSanitizer() {
        // Utility class - prevent instantiation
    }

    public static Map<String, Object> sanitize(Map<String, ?> args) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (args == null) {
            return sanitized;
        }
        args.forEach((key, value) -> sanitized.put(key, isSensitive(key) ? REDACTED : sanitizeValue(value)));
        return sanitized;
    }

    @SuppressWarnings("unchecked")
    private static Object sanitizeValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((key, nestedValue) -> {
                String name = String.valueOf(key);
                nested.put(name, isSensitive(name) ? REDACTED : sanitizeValue(nestedValue));
            });
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<Object>) value) {
                items.add(sanitizeValue(item));
            }
            return items;
        }
        return value;
    }

    public static boolean isSensitive(String key) {
        return key != null && SENSITIVE_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }
}
