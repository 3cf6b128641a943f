package de.vzg.reposis.crossref.resource;

import java.util.HashMap;
import java.util.Map;

/**
 * Placeholder values of component resource patterns: the parent article's {@code {doi}},
 * {@code {manuscript}} and {@code {volume}} plus the component {@code {id}} and {@code {prefix}}.
 */
public record ComponentSubstitution(String doi, String manuscript, String volume, String prefix, String id) {

    public Map<String, String> toMap() {
        Map<String, String> values = new HashMap<>();
        values.put("doi", doi);
        values.put("manuscript", manuscript);
        values.put("volume", volume);
        values.put("prefix", prefix);
        // older patterns name the prefix prefix1
        values.put("prefix1", prefix);
        values.put("id", id);
        return values;
    }
}
