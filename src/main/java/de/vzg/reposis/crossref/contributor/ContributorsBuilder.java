package de.vzg.reposis.crossref.contributor;

import java.util.Optional;

import org.jdom2.Element;
import org.jdom2.Namespace;

import de.vzg.reposis.crossref.model.Article;

/**
 * Builds the {@code contributors} block of a journal article.
 */
public interface ContributorsBuilder {

    /**
     * @return the block, or empty if no contributor qualifies
     */
    Optional<Element> contributors(Article article, Namespace namespace);
}
