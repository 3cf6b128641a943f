package de.vzg.reposis.crossref.resource;

import java.util.HashMap;
import java.util.Map;

import de.vzg.reposis.crossref.model.Article;

/**
 * Placeholder values of article resource patterns: {@code {doi}}, {@code {manuscript}},
 * {@code {volume}} and {@code {version}}.
 */
public record ArticleSubstitution(String doi, String manuscript, String volume, String version) {

    public static ArticleSubstitution of(Article article) {
        return new ArticleSubstitution(article.getDoi(), article.getManuscript(), article.getVolume(),
            versionLabel(article));
    }

    /**
     * The article version as used in resource URLs, empty when the article is unversioned.
     */
    public static String versionLabel(Article article) {
        return article.getVersion() == null ? "" : String.valueOf(article.getVersion());
    }

    public Map<String, String> toMap() {
        Map<String, String> values = new HashMap<>();
        values.put("doi", doi);
        values.put("manuscript", manuscript);
        values.put("volume", volume);
        values.put("version", version);
        return values;
    }
}
