package de.vzg.reposis.crossref.contributor;

import java.util.List;
import java.util.Optional;

import org.jdom2.Element;
import org.jdom2.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.vzg.reposis.crossref.config.CrossrefProperties;
import de.vzg.reposis.crossref.model.Article;
import de.vzg.reposis.crossref.model.Contributor;

/**
 * Writes one {@code person_name} or {@code organization} per contributor whose type is listed in
 * {@code crossref.contrib-types}. The contributor type is used as {@code contributor_role}.
 */
@Service
public class CrossrefContributorsBuilder implements ContributorsBuilder {

    private static final Logger log = LoggerFactory.getLogger(CrossrefContributorsBuilder.class);

    private final CrossrefProperties properties;

    @Autowired
    public CrossrefContributorsBuilder(CrossrefProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<Element> contributors(Article article, Namespace namespace) {
        List<String> contribTypes = properties.getContribTypes();
        Element contributors = new Element("contributors", namespace);
        for (Contributor contributor : article.getContributors()) {
            if (!contribTypes.contains(contributor.getContribType())) {
                log.trace("Skipping contributor of type {} in {}", contributor.getContribType(), article.getDoi());
                continue;
            }
            String sequence = contributors.getContentSize() == 0 ? "first" : "additional";
            Element element = isPresent(contributor.getSurname())
                ? personName(contributor, namespace)
                : organization(contributor, namespace);
            if (element == null) {
                continue;
            }
            element.setAttribute("contributor_role", contributor.getContribType());
            element.setAttribute("sequence", sequence);
            contributors.addContent(element);
        }
        return contributors.getContentSize() == 0 ? Optional.empty() : Optional.of(contributors);
    }

    private Element personName(Contributor contributor, Namespace namespace) {
        Element personName = new Element("person_name", namespace);
        if (isPresent(contributor.getGivenNames())) {
            personName.addContent(new Element("given_name", namespace).setText(contributor.getGivenNames()));
        }
        personName.addContent(new Element("surname", namespace).setText(contributor.getSurname()));
        if (isPresent(contributor.getSuffix())) {
            personName.addContent(new Element("suffix", namespace).setText(contributor.getSuffix()));
        }
        for (String affiliation : contributor.getAffiliations()) {
            personName.addContent(new Element("affiliation", namespace).setText(affiliation));
        }
        if (isPresent(contributor.getOrcid())) {
            personName.addContent(new Element("ORCID", namespace)
                .setAttribute("authenticated", String.valueOf(contributor.isOrcidAuthenticated()))
                .setText(contributor.getOrcid()));
        }
        return personName;
    }

    private Element organization(Contributor contributor, Namespace namespace) {
        if (!isPresent(contributor.getCollab())) {
            return null;
        }
        return new Element("organization", namespace).setText(contributor.getCollab());
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
