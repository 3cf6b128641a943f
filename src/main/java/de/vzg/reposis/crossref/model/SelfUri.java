package de.vzg.reposis.crossref.model;

/**
 * Alternate location of the article itself, e.g. a PDF rendition. A {@code null} content type
 * marks the generic landing page.
 */
public record SelfUri(String href, String contentType) {
}
