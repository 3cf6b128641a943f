package de.vzg.reposis.crossref.markup;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String level operations on JATS markup fragments. All methods expect fragments, not documents,
 * and never parse them.
 */
public final class MarkupSanitizer {

    /**
     * Tags that survive {@link #escapeUnmatchedAngleBrackets(String, Collection)} by default. Names
     * ending with a colon match every tag with that prefix.
     */
    public static final Set<String> ALLOWED_TAGS = Set.of("p", "sec", "title", "italic", "bold", "underline",
        "sub", "sup", "sc", "inline-formula", "ext-link", "i", "b", "u", "scp", "mml:", "jats:");

    private static final Pattern AMPERSAND = Pattern.compile("&(?!(?:amp|lt|gt|quot|apos|#\\d+|#x[0-9a-fA-F]+);)");

    // start, end or empty tag with optional attributes
    private static final Pattern TAG = Pattern.compile("</?([A-Za-z][A-Za-z0-9:._-]*)(?:\\s+[^<>]*?)?\\s*/?>");

    private MarkupSanitizer() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Escapes every ampersand that does not already start a predefined or numeric entity.
     */
    public static String escapeAmpersand(String markup) {
        if (markup == null) {
            return null;
        }
        return AMPERSAND.matcher(markup).replaceAll("&amp;");
    }

    /**
     * Escapes each {@code <} and {@code >} that is not part of a tag named in {@code allowedTags}.
     */
    public static String escapeUnmatchedAngleBrackets(String markup, Collection<String> allowedTags) {
        if (markup == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(markup.length() + 16);
        Matcher matcher = TAG.matcher(markup);
        int pos = 0;
        while (pos < markup.length()) {
            char c = markup.charAt(pos);
            if (c == '<') {
                matcher.region(pos, markup.length());
                if (matcher.lookingAt() && isAllowed(matcher.group(1), allowedTags)) {
                    sb.append(matcher.group());
                    pos = matcher.end();
                    continue;
                }
                sb.append("&lt;");
            } else if (c == '>') {
                sb.append("&gt;");
            } else {
                sb.append(c);
            }
            pos++;
        }
        return sb.toString();
    }

    /**
     * Applies {@link #escapeAmpersand(String)} and {@link #escapeUnmatchedAngleBrackets(String, Collection)}
     * with {@link #ALLOWED_TAGS}.
     */
    public static String sanitize(String markup) {
        return escapeUnmatchedAngleBrackets(escapeAmpersand(markup), ALLOWED_TAGS);
    }

    /**
     * Renames start, end and empty tags called {@code from} to {@code to}, keeping their attributes.
     */
    public static String replaceTags(String markup, String from, String to) {
        if (markup == null) {
            return null;
        }
        Pattern pattern = Pattern.compile("<(/?)" + Pattern.quote(from) + "(?=[\\s/>])");
        return pattern.matcher(markup).replaceAll("<$1" + Matcher.quoteReplacement(to));
    }

    /**
     * Removes all start, end and empty tags called {@code tagName}; their content is kept.
     */
    public static String removeTag(String markup, String tagName) {
        if (markup == null) {
            return null;
        }
        Pattern pattern = Pattern.compile("</?" + Pattern.quote(tagName) + "(?:\\s+[^<>]*?)?\\s*/?>");
        return pattern.matcher(markup).replaceAll("");
    }

    /**
     * Removes every tag except those whose name is listed in {@code keep} (prefix match for names
     * ending with a colon).
     */
    public static String cleanTags(String markup, Collection<String> keep) {
        if (markup == null) {
            return null;
        }
        Matcher matcher = TAG.matcher(markup);
        StringBuilder sb = new StringBuilder(markup.length());
        while (matcher.find()) {
            String replacement = isAllowed(matcher.group(1), keep) ? matcher.group() : "";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static String cleanTags(String markup) {
        return cleanTags(markup, List.of());
    }

    private static boolean isAllowed(String tagName, Collection<String> allowedTags) {
        for (String allowed : allowedTags) {
            if (allowed.endsWith(":") ? tagName.startsWith(allowed) : tagName.equals(allowed)) {
                return true;
            }
        }
        return false;
    }
}
