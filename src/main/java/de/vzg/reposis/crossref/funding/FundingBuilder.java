package de.vzg.reposis.crossref.funding;

import java.util.Optional;

import org.jdom2.Element;

import de.vzg.reposis.crossref.model.Article;

/**
 * Builds the funding block of a journal article.
 */
public interface FundingBuilder {

    Optional<Element> funding(Article article);
}
