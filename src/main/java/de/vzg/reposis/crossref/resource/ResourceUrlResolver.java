package de.vzg.reposis.crossref.resource;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.vzg.reposis.crossref.config.CrossrefProperties;
import de.vzg.reposis.crossref.model.Article;
import de.vzg.reposis.crossref.model.Component;
import de.vzg.reposis.crossref.model.SelfUri;

/**
 * Builds the {@code resource} URLs of articles, components and text-mining renditions from the
 * configured patterns.
 */
@Service
public class ResourceUrlResolver {

    private static final Logger log = LoggerFactory.getLogger(ResourceUrlResolver.class);

    public static final String PDF_CONTENT_TYPE = "pdf";

    private final CrossrefProperties properties;

    private final ComponentNamingConvention namingConvention;

    @Autowired
    public ResourceUrlResolver(CrossrefProperties properties, ComponentNamingConvention namingConvention) {
        this.properties = properties;
        this.namingConvention = namingConvention;
    }

    /**
     * Formats the article pattern. Without a pattern the first self uri without content type is
     * used.
     */
    public Optional<String> articleResource(Article article) {
        Optional<UrlTemplate> template = UrlTemplate.of(properties.getDoiPattern());
        if (template.isPresent()) {
            return Optional.of(template.get().format(ArticleSubstitution.of(article).toMap()));
        }
        return article.getSelfUris().stream()
            .filter(selfUri -> selfUri.contentType() == null)
            .map(SelfUri::href)
            .filter(href -> href != null && !href.isEmpty())
            .findFirst();
    }

    /**
     * The PDF text-mining resource, for licensed articles that list a PDF rendition.
     */
    public Optional<String> textMiningPdfResource(Article article) {
        if (!article.hasLicense() || article.getSelfUri(PDF_CONTENT_TYPE) == null) {
            return Optional.empty();
        }
        return UrlTemplate.of(properties.getTextMiningPdfPattern())
            .map(template -> template.format(ArticleSubstitution.of(article).toMap()));
    }

    /**
     * The XML text-mining resource, for licensed articles.
     */
    public Optional<String> textMiningXmlResource(Article article) {
        if (!article.hasLicense()) {
            return Optional.empty();
        }
        return UrlTemplate.of(properties.getTextMiningXmlPattern())
            .map(template -> template.format(ArticleSubstitution.of(article).toMap()));
    }

    public Optional<String> componentResource(Component component, Article article) {
        Optional<UrlTemplate> template = UrlTemplate.of(properties.getComponentDoiPattern());
        if (template.isEmpty()) {
            log.debug("No component pattern configured, no resource for component {}", component.getId());
            return Optional.empty();
        }
        String id = component.getId();
        String prefix = "";
        if (properties.isElifeStyleComponentDoi()) {
            ComponentNamingConvention.ComponentName name = namingConvention.name(component);
            id = name.id();
            prefix = name.prefix();
        }
        ComponentSubstitution substitution
            = new ComponentSubstitution(article.getDoi(), article.getManuscript(), article.getVolume(), prefix, id);
        return Optional.of(template.get().format(substitution.toMap()))
            .filter(url -> !url.isEmpty());
    }
}
