package org.carball.querymon.instrument;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ArgumentSanitizerTest {

    @Test
    void shouldRedactSensitiveKeysAtEveryLevel() {
        // Given
        Map<String, Object> args = Map.of(
                "where", Map.of("email", "a@example.com", "apiKey", "k-123"),
                "data", List.of(Map.of("TOKEN", "abc", "name", "Ann")),
                "secret", "s3cr3t");

        // When
        Map<String, Object> sanitized = ArgumentSanitizer.sanitize(args);

        // Then
        assertThat(sanitized.get("secret")).isEqualTo(ArgumentSanitizer.REDACTED);
        assertThat(sanitized.get("where")).isEqualTo(Map.of("email", "a@example.com", "apiKey", "[REDACTED]"));
        assertThat(sanitized.get("data")).isEqualTo(List.of(Map.of("TOKEN", "[REDACTED]", "name", "Ann")));
    }

    @Test
    void shouldLeaveInputUntouched() {
        // Given
        Map<String, Object> args = new HashMap<>();
        args.put("password", "pw");

        // When
        ArgumentSanitizer.sanitize(args);

        // Then
        assertThat(args.get("password")).isEqualTo("pw");
    }

    @Test
    void shouldMatchKeysIgnoringCase() {
        assertThat(ArgumentSanitizer.isSensitive("PrivateKey")).isTrue();
        assertThat(ArgumentSanitizer.isSensitive("passwordHint")).isFalse();
        assertThat(ArgumentSanitizer.isSensitive(null)).isFalse();
        assertThat(ArgumentSanitizer.sanitize(null)).isEmpty();
    }
}
