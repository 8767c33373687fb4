package com.eci.notification.template;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{name}}} and {@code {{name|fallback}}} placeholders.
 */
final class PlaceholderRenderer {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*(?:\\|([^}]*))?}}");

    private PlaceholderRenderer() {}

    /**
     * Renders {@code text}. Names with no payload value and no fallback are
     * added to {@code missing} and rendered as an empty string.
     */
    static String render(final String text,
                         final Map<String, String> values,
                         final Collection<String> missing) {
        if (text == null) return null;
        final Matcher m = PLACEHOLDER.matcher(text);
        final StringBuilder out = new StringBuilder(text.length() + 64);
        while (m.find()) {
            final String name     = m.group(1);
            final String fallback = m.group(2);
            final String value    = values.get(name);
            final String replacement;
            if (value != null && !value.isBlank()) {
                replacement = value;
            } else if (fallback != null) {
                replacement = fallback.trim();
            } else {
                if (!missing.contains(name)) missing.add(name);
                replacement = "";
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
