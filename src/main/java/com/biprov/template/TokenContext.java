package com.biprov.template;

import com.biprov.domain.ProvisionRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value context against which placeholders are resolved.
 *
 * Built from a request as {@code PROJECT_ID}, {@code ANCESTRY_PATH} (empty when absent) and
 * then the caller's tokens, so a caller token with the same key overrides the built-in value.
 */
public final class TokenContext {

    public static final String PROJECT_ID = "PROJECT_ID";
    public static final String ANCESTRY_PATH = "ANCESTRY_PATH";

    private final Map<String, String> values;

    private TokenContext(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TokenContext of(ProvisionRequest request) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(PROJECT_ID, request.getProjectId());
        values.put(ANCESTRY_PATH, request.getAncestryPath() != null ? request.getAncestryPath() : "");
        values.putAll(request.getTokens());
        return new TokenContext(values);
    }

    public static TokenContext of(Map<String, String> values) {
        return new TokenContext(new LinkedHashMap<>(values));
    }

    public Optional<String> lookup(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "TokenContext" + values.keySet();
    }
}
