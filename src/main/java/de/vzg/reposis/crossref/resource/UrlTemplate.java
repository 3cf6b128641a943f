package de.vzg.reposis.crossref.resource;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL pattern with named {@code {placeholder}}s, e.g.
 * {@code https://example.org/articles/{manuscript}/figures#{id}}.
 */
public final class UrlTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final String pattern;

    private UrlTemplate(String pattern) {
        this.pattern = pattern;
    }

    /**
     * @return the template, or empty if {@code pattern} is null or blank
     */
    public static Optional<UrlTemplate> of(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new UrlTemplate(pattern));
    }

    /**
     * Replaces every placeholder. Null values are substituted as empty strings.
     *
     * @throws IllegalArgumentException if the pattern uses a placeholder not in {@code values}
     */
    public String format(Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("Unknown placeholder {" + name + "} in URL pattern " + pattern
                    + ", expected one of " + values.keySet());
            }
            String value = values.get(name);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
