package com.biprov.template;

import com.biprov.validation.ValidationError;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{KEY}}} placeholders in dashboard text.
 *
 * Pure function of its inputs. Substitution is a single pass: a replacement value that itself
 * contains a placeholder is not expanded again.
 */
public class TokenSubstitutionEngine {

    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Za-z0-9_]+)}}");

    /**
     * Dashboard fields that carry substitutable text.
     */
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_DESCRIPTION = "description";

    private final UnresolvedTokenPolicy policy;

    public TokenSubstitutionEngine() {
        this(UnresolvedTokenPolicy.LEAVE);
    }

    public TokenSubstitutionEngine(UnresolvedTokenPolicy policy) {
        this.policy = policy;
    }

    public UnresolvedTokenPolicy getPolicy() {
        return policy;
    }

    /**
     * @param text    text that may contain placeholders; null yields null
     * @param context resolution context
     * @return the text with every known placeholder replaced
     * @throws ValidationError under {@link UnresolvedTokenPolicy#FAIL} when a key is unknown
     */
    public String substitute(String text, TokenContext context) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        Set<String> unresolved = new TreeSet<>();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = context.lookup(key).orElse(null);
            if (replacement == null) {
                unresolved.add(key);
                replacement = matcher.group(0);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);

        if (!unresolved.isEmpty() && policy == UnresolvedTokenPolicy.FAIL) {
            throw new ValidationError("unresolved template tokens: " + String.join(", ", unresolved));
        }
        return out.toString();
    }

    /**
     * Applies substitution to the text-bearing fields of a dashboard. Fields absent from the
     * input are absent from the output; other entries are copied unchanged.
     */
    public Map<String, String> applyToDashboard(Map<String, String> fields, TokenContext context) {
        Map<String, String> updated = new LinkedHashMap<>(fields);
        for (String field : new String[] {FIELD_TITLE, FIELD_DESCRIPTION}) {
            if (updated.get(field) != null) {
                updated.put(field, substitute(updated.get(field), context));
            }
        }
        return updated;
    }

    /**
     * Keys referenced by placeholders in {@code text}, in order of first appearance.
     */
    public static Set<String> placeholders(String text) {
        Set<String> keys = new LinkedHashSet<>();
        if (text == null) {
            return keys;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            keys.add(matcher.group(1));
        }
        return keys;
    }
}
