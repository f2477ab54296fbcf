package com.warden.audit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive entries from audit event context before it leaves the process.
 * <p>
 * Keys are matched case-insensitively against a set of substrings (password, token, secret,
 * authorization, apikey, credential, ssn by default). Nested maps are redacted recursively.
 */
public final class AuditContextRedactor {

    /** The replacement for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_KEYS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential", "ssn"
    );

    private final Set<String> sensitiveKeys;
    private final Pattern pattern;

    public AuditContextRedactor() {
        this(DEFAULT_SENSITIVE_KEYS);
    }

    /**
     * @param sensitiveKeys key substrings treated as sensitive; an empty set disables redaction
     */
    public AuditContextRedactor(Set<String> sensitiveKeys) {
        this.sensitiveKeys = Set.copyOf(sensitiveKeys);
        this.pattern = this.sensitiveKeys.isEmpty()
                ? null
                : Pattern.compile(String.join("|", this.sensitiveKeys.stream().map(Pattern::quote).toList()),
                        Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code context} with sensitive values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(context.size());
        context.forEach((key, value) -> result.put(key, redactValue(key, value)));
        return result;
    }

    public boolean isSensitive(String key) {
        return key != null && pattern != null && pattern.matcher(key).find();
    }

    public Set<String> sensitiveKeys() {
        return sensitiveKeys;
    }

    private Object redactValue(String key, Object value) {
        if (isSensitive(key)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> copy = new LinkedHashMap<>();
            nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return redact(copy);
        }
        return value;
    }
}
