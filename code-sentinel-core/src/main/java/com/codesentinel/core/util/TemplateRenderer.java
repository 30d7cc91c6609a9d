package com.codesentinel.core.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders rule description and fix templates.
 *
 * <p>Supported placeholders:
 * <ul>
 *   <li>{@code {0}}: the whole match</li>
 *   <li>{@code {n}}: capture group {@code n}, empty when absent, unmatched or out of range</li>
 *   <li>{@code {n:upper}} / {@code {n:lower}}: the group in upper or lower case</li>
 *   <li>{@code {snippet}}: the trimmed source line</li>
 * </ul>
 * Any other brace text (for example {@code f"{name}"} inside a fix) is left untouched.
 *
 * @since 1.0.0
 */
public final class TemplateRenderer {

    // Longest index that always fits in an int
    private static final int MAX_INDEX_DIGITS = 9;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+|snippet)(?::(upper|lower))?\\}");

    private TemplateRenderer() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Renders a template.
     *
     * @param template template text, may be null
     * @param groups capture groups, index 0 is the whole match (may be empty)
     * @param snippet trimmed source line
     * @return rendered text, or null when {@code template} is null
     */
    public static String render(String template, List<String> groups, String snippet) {
        if (template == null) {
            return null;
        }
        if (template.indexOf('{') < 0) {
            return template;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder(template.length() + 32);
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = "snippet".equals(key) ? snippet : group(groups, key);
            value = applyCase(value == null ? "" : value, matcher.group(2));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String group(List<String> groups, String key) {
        if (key.length() > MAX_INDEX_DIGITS) {
            return "";
        }
        int index = Integer.parseInt(key);
        return index < groups.size() ? groups.get(index) : "";
    }

    private static String applyCase(String value, String modifier) {
        if (modifier == null) {
            return value;
        }
        return switch (modifier) {
            case "upper" -> value.toUpperCase(Locale.ROOT);
            case "lower" -> value.toLowerCase(Locale.ROOT);
            default -> value;
        };
    }
}
