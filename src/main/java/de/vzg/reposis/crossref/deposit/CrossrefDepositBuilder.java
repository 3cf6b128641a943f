package de.vzg.reposis.crossref.deposit;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.jdom2.Comment;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.vzg.reposis.crossref.citation.CitationBuilder;
import de.vzg.reposis.crossref.config.CrossrefProperties;
import de.vzg.reposis.crossref.contributor.ContributorsBuilder;
import de.vzg.reposis.crossref.funding.FundingBuilder;
import de.vzg.reposis.crossref.markup.CrossrefNamespaces;
import de.vzg.reposis.crossref.markup.MarkupFragmentException;
import de.vzg.reposis.crossref.markup.MarkupSanitizer;
import de.vzg.reposis.crossref.markup.RichTextReparser;
import de.vzg.reposis.crossref.model.Article;
import de.vzg.reposis.crossref.model.Component;
import de.vzg.reposis.crossref.model.Reference;
import de.vzg.reposis.crossref.relation.RelatedItemLinker;
import de.vzg.reposis.crossref.relation.RelationsProgram;
import de.vzg.reposis.crossref.resource.CrossrefMimeTypes;
import de.vzg.reposis.crossref.resource.ResourceUrlResolver;

/**
 * Assembles the Crossref {@code doi_batch} document for a list of articles.
 * <p>
 * Each article becomes one {@code journal} record. The children of {@code journal_article} are
 * written in schema order; the relations program is placed before the datasets when any dataset or
 * cited data needs a related item, and related items of the citations are appended to it while
 * the citation list is built.
 */
@Service
public class CrossrefDepositBuilder {

    private static final Logger log = LoggerFactory.getLogger(CrossrefDepositBuilder.class);

    private static final DateTimeFormatter BATCH_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private static final DateTimeFormatter COMMENT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String ACCESS_INDICATORS = "AccessIndicators";

    private final CrossrefProperties properties;

    private final Clock clock;

    private final ResourceUrlResolver resourceUrlResolver;

    private final RelatedItemLinker relatedItemLinker;

    private final ContributorsBuilder contributorsBuilder;

    private final FundingBuilder fundingBuilder;

    private final CrossrefMimeTypes mimeTypes;

    @Autowired
    public CrossrefDepositBuilder(CrossrefProperties properties, Clock clock, ResourceUrlResolver resourceUrlResolver,
        RelatedItemLinker relatedItemLinker, ContributorsBuilder contributorsBuilder, FundingBuilder fundingBuilder,
        CrossrefMimeTypes mimeTypes) {
        this.properties = properties;
        this.clock = clock;
        this.resourceUrlResolver = resourceUrlResolver;
        this.relatedItemLinker = relatedItemLinker;
        this.contributorsBuilder = contributorsBuilder;
        this.fundingBuilder = fundingBuilder;
        this.mimeTypes = mimeTypes;
    }

    /**
     * Builds the deposit, using the current time of the configured clock as run time.
     *
     * @throws DepositGenerationException if markup of an article cannot be converted
     */
    public CrossrefDeposit build(List<Article> articles) {
        return build(articles, clock.instant());
    }

    /**
     * Builds the deposit for a fixed run time. The run time is used for the batch id, the
     * timestamp and as publication date of articles without one of the configured date types.
     */
    public CrossrefDeposit build(List<Article> articles, Instant runInstant) {
        DepositRun run = new DepositRun(runInstant.atZone(ZoneOffset.UTC));
        String batchId = batchId(articles, run.runTime);
        log.info("Building Crossref deposit {} for {} article(s), schema {}", batchId, articles.size(),
            run.schemaVersion);

        Element root = root(run);
        if (properties.isAddComment()) {
            root.addContent(new Comment("generated by " + properties.getGenerator() + " at "
                + COMMENT_TIMESTAMP.format(run.runTime)));
        }
        root.addContent(head(run, batchId));

        Element body = new Element("body", run.namespace);
        for (Article article : articles) {
            log.debug("Adding journal record for {}", article.getDoi());
            body.addContent(journal(run, article));
        }
        root.addContent(body);
        return new CrossrefDeposit(batchId, new Document(root));
    }

    String batchId(List<Article> articles, ZonedDateTime runTime) {
        StringBuilder batchId = new StringBuilder(nullToEmpty(properties.getBatchFilePrefix()));
        if (!articles.isEmpty() && articles.get(0).getManuscript() != null) {
            batchId.append(cleanBatchSegment(articles.get(0).getManuscript())).append('-');
        }
        return batchId.append(BATCH_TIMESTAMP.format(runTime)).toString();
    }

    private Element root(DepositRun run) {
        String version = run.schemaVersion;
        Element root = new Element("doi_batch", run.namespace);
        root.setAttribute("version", version);
        root.addNamespaceDeclaration(CrossrefNamespaces.XSI);
        root.addNamespaceDeclaration(CrossrefNamespaces.FUNDREF);
        root.addNamespaceDeclaration(CrossrefNamespaces.ACCESS_INDICATORS);
        if (CrossrefNamespaces.supportsRelations(version)) {
            root.addNamespaceDeclaration(CrossrefNamespaces.CLINICAL_TRIALS);
            root.addNamespaceDeclaration(CrossrefNamespaces.RELATIONS);
        }
        root.setAttribute("schemaLocation", CrossrefNamespaces.schemaLocation(version), CrossrefNamespaces.XSI);
        root.addNamespaceDeclaration(CrossrefNamespaces.MATHML);
        root.addNamespaceDeclaration(CrossrefNamespaces.JATS);
        return root;
    }

    private Element head(DepositRun run, String batchId) {
        Namespace ns = run.namespace;
        Element head = new Element("head", ns);
        head.addContent(new Element("doi_batch_id", ns).setText(batchId));
        head.addContent(new Element("timestamp", ns).setText(BATCH_TIMESTAMP.format(run.runTime)));
        Element depositor = new Element("depositor", ns);
        depositor.addContent(new Element("depositor_name", ns).setText(nullToEmpty(properties.getDepositorName())));
        depositor.addContent(new Element("email_address", ns).setText(nullToEmpty(properties.getEmailAddress())));
        head.addContent(depositor);
        head.addContent(new Element("registrant", ns).setText(nullToEmpty(properties.getRegistrant())));
        return head;
    }

    private Element journal(DepositRun run, Article article) {
        Namespace ns = run.namespace;
        LocalDate pubDate = publicationDate(article, run);

        Element journal = new Element("journal", ns);
        Element metadata = new Element("journal_metadata", ns).setAttribute("language", "en");
        metadata.addContent(new Element("full_title", ns).setText(nullToEmpty(article.getJournalTitle())));
        metadata.addContent(new Element("issn", ns).setAttribute("media_type", "electronic")
            .setText(nullToEmpty(article.getJournalIssn())));
        journal.addContent(metadata);

        Element issue = new Element("journal_issue", ns);
        issue.addContent(publicationDate(ns, pubDate));
        String volume = isPresent(article.getVolume()) ? article.getVolume()
            : JournalVolumes.calculate(pubDate, properties.getYearOfFirstVolume());
        if (volume != null) {
            issue.addContent(new Element("journal_volume", ns).addContent(new Element("volume", ns).setText(volume)));
        }
        journal.addContent(issue);

        journal.addContent(journalArticle(run, article, pubDate));
        return journal;
    }

    /**
     * The first configured date type the article has, or the run date.
     */
    LocalDate publicationDate(Article article, DepositRun run) {
        for (String dateType : properties.getPubDateTypes()) {
            LocalDate date = article.getDate(dateType);
            if (date != null) {
                return date;
            }
        }
        return run.runTime.toLocalDate();
    }

    private Element journalArticle(DepositRun run, Article article, LocalDate pubDate) {
        Namespace ns = run.namespace;
        Element journalArticle = new Element("journal_article", ns).setAttribute("publication_type", "full_text");
        if (isPresent(properties.getReferenceDistributionOpts())) {
            journalArticle.setAttribute("reference_distribution_opts", properties.getReferenceDistributionOpts());
        }

        journalArticle.addContent(titles(run, article));
        contributorsBuilder.contributors(article, ns).ifPresent(journalArticle::addContent);
        if (isPresent(article.getAbstractText())) {
            journalArticle.addContent(reparsed(article, "abstract",
                () -> run.reparser.jatsAbstract(article.getAbstractText(), properties.isJatsAbstract(), null)));
        }
        if (isPresent(article.getDigest())) {
            journalArticle.addContent(reparsed(article, "digest",
                () -> run.reparser.jatsAbstract(article.getDigest(), properties.isJatsAbstract(),
                    RichTextReparser.EXECUTIVE_SUMMARY)));
        }
        journalArticle.addContent(publicationDate(ns, pubDate));
        journalArticle.addContent(publisherItem(ns, article));
        fundingBuilder.funding(article).ifPresent(journalArticle::addContent);
        accessIndicators(article).ifPresent(journalArticle::addContent);

        RelationsProgram relations = new RelationsProgram(journalArticle);
        if (relatedItemLinker.needsRelationsProgram(article)) {
            relations.getOrCreate();
        }
        relatedItemLinker.addDatasets(relations, article);

        archiveLocations(ns).ifPresent(journalArticle::addContent);
        journalArticle.addContent(doiData(ns, article));
        citationList(run, article, relations).ifPresent(journalArticle::addContent);
        componentList(run, article).ifPresent(journalArticle::addContent);
        return journalArticle;
    }

    private Element titles(DepositRun run, Article article) {
        Element titles = new Element("titles", run.namespace);
        String title = MarkupSanitizer.removeTag(nullToEmpty(article.getTitle()), "ext-link");
        titles.addContent(reparsed(article, "title",
            () -> run.reparser.text("title", title, properties.isFaceMarkup())));
        return titles;
    }

    private Element publicationDate(Namespace ns, LocalDate date) {
        Element publicationDate = new Element("publication_date", ns).setAttribute("media_type", "online");
        publicationDate.addContent(new Element("month", ns).setText(String.format("%02d", date.getMonthValue())));
        publicationDate.addContent(new Element("day", ns).setText(String.format("%02d", date.getDayOfMonth())));
        publicationDate.addContent(new Element("year", ns).setText(String.valueOf(date.getYear())));
        return publicationDate;
    }

    private Element publisherItem(Namespace ns, Article article) {
        Element publisherItem = new Element("publisher_item", ns);
        if (properties.isElocationId() && isPresent(article.getElocationId())) {
            publisherItem.addContent(new Element("item_number", ns)
                .setAttribute("item_number_type", "article_number")
                .setText(article.getElocationId()));
        }
        publisherItem.addContent(new Element("identifier", ns).setAttribute("id_type", "doi")
            .setText(nullToEmpty(article.getDoi())));
        return publisherItem;
    }

    /**
     * One license reference per configured scope, all pointing to the article license.
     */
    Optional<Element> accessIndicators(Article article) {
        List<String> appliesTo = properties.getAccessIndicatorsAppliesTo();
        if (appliesTo.isEmpty() || !article.hasLicense()) {
            return Optional.empty();
        }
        Element program = new Element("program", CrossrefNamespaces.ACCESS_INDICATORS)
            .setAttribute("name", ACCESS_INDICATORS);
        for (String scope : appliesTo) {
            program.addContent(new Element("license_ref", CrossrefNamespaces.ACCESS_INDICATORS)
                .setAttribute("applies_to", scope)
                .setText(article.getLicense().href()));
        }
        return Optional.of(program);
    }

    private Optional<Element> archiveLocations(Namespace ns) {
        if (properties.getArchiveLocations().isEmpty()) {
            return Optional.empty();
        }
        Element archiveLocations = new Element("archive_locations", ns);
        for (String name : properties.getArchiveLocations()) {
            archiveLocations.addContent(new Element("archive", ns).setAttribute("name", name));
        }
        return Optional.of(archiveLocations);
    }

    private Element doiData(Namespace ns, Article article) {
        Element doiData = new Element("doi_data", ns);
        doiData.addContent(new Element("doi", ns).setText(nullToEmpty(article.getDoi())));
        Optional<String> resource = resourceUrlResolver.articleResource(article);
        if (resource.isPresent()) {
            doiData.addContent(new Element("resource", ns).setText(resource.get()));
        } else {
            log.warn("No resource URL for {}, configure crossref.doi-pattern or supply a self uri", article.getDoi());
        }

        Optional<String> pdf = resourceUrlResolver.textMiningPdfResource(article);
        Optional<String> xml = resourceUrlResolver.textMiningXmlResource(article);
        if (pdf.isPresent() || xml.isPresent()) {
            Element collection = new Element("collection", ns).setAttribute("property", "text-mining");
            pdf.ifPresent(url -> collection.addContent(collectionItem(ns, "application/pdf", url)));
            xml.ifPresent(url -> collection.addContent(collectionItem(ns, "application/xml", url)));
            doiData.addContent(collection);
        }
        return doiData;
    }

    private Element collectionItem(Namespace ns, String mimeType, String url) {
        Element resource = new Element("resource", ns).setAttribute("mime_type", mimeType).setText(url);
        return new Element("item", ns).addContent(resource);
    }

    private Optional<Element> citationList(DepositRun run, Article article, RelationsProgram relations) {
        if (article.getReferences().isEmpty()) {
            return Optional.empty();
        }
        Element citationList = new Element("citation_list", run.namespace);
        int ordinal = 0;
        for (Reference reference : article.getReferences()) {
            ordinal++;
            if (RelatedItemLinker.hasRelatedItem(reference)) {
                relatedItemLinker.addReference(relations, reference);
            }
            int key = ordinal;
            citationList.addContent(reparsed(article, "reference " + ordinal,
                () -> run.citationBuilder.citation(reference, key)));
        }
        return Optional.of(citationList);
    }

    private Optional<Element> componentList(DepositRun run, Article article) {
        if (article.getComponents().isEmpty()) {
            return Optional.empty();
        }
        Namespace ns = run.namespace;
        Element componentList = new Element("component_list", ns);
        for (Component component : article.getComponents()) {
            Element element = new Element("component", ns).setAttribute("parent_relation", "isPartOf");

            Element titles = new Element("titles", ns);
            titles.addContent(new Element("title", ns).setText(nullToEmpty(component.getTitle())));
            if (isPresent(component.getSubtitle())) {
                titles.addContent(reparsed(article, "subtitle of " + component.getId(),
                    () -> run.reparser.text("subtitle", component.getSubtitle(), properties.isFaceMarkup())));
            }
            element.addContent(titles);

            if (isPresent(component.getMimeType())) {
                Optional<String> mimeType = mimeTypes.crossrefMimeType(component.getMimeType());
                if (mimeType.isPresent()) {
                    element.addContent(new Element("format", ns).setAttribute("mime_type", mimeType.get()));
                } else {
                    log.warn("Unknown mime type {} of component {}, format omitted", component.getMimeType(),
                        component.getId());
                }
            }

            componentAccessIndicators(component).ifPresent(element::addContent);

            if (isPresent(component.getDoi())) {
                Optional<String> resource = resourceUrlResolver.componentResource(component, article);
                resource.ifPresent(url -> element.addContent(new Element("doi_data", ns)
                    .addContent(new Element("doi", ns).setText(component.getDoi()))
                    .addContent(new Element("resource", ns).setText(url))));
            }
            componentList.addContent(element);
        }
        return Optional.of(componentList);
    }

    private Optional<Element> componentAccessIndicators(Component component) {
        if (!isPresent(properties.getComponentLicenseRef())
            || component.getPermissions().stream().noneMatch(permission -> permission.hasStatementOrLicense())) {
            return Optional.empty();
        }
        Element program = new Element("program", CrossrefNamespaces.ACCESS_INDICATORS)
            .setAttribute("name", ACCESS_INDICATORS);
        program.addContent(new Element("license_ref", CrossrefNamespaces.ACCESS_INDICATORS)
            .setText(properties.getComponentLicenseRef()));
        return Optional.of(program);
    }

    private Element reparsed(Article article, String field, Supplier<Element> builder) {
        try {
            return builder.get();
        } catch (MarkupFragmentException e) {
            throw new DepositGenerationException("Malformed markup in " + field + " of " + article.getDoi() + ": "
                + e.getMessage(), e);
        }
    }

    static String cleanBatchSegment(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * State of one {@link #build(List, Instant)} call.
     */
    class DepositRun {

        final ZonedDateTime runTime;

        final String schemaVersion;

        final Namespace namespace;

        final RichTextReparser reparser;

        final CitationBuilder citationBuilder;

        DepositRun(ZonedDateTime runTime) {
            this.runTime = runTime;
            this.schemaVersion = properties.getSchemaVersion();
            this.namespace = CrossrefNamespaces.crossref(schemaVersion);
            this.reparser = new RichTextReparser(namespace);
            this.citationBuilder = new CitationBuilder(namespace, reparser, schemaVersion, properties.isFaceMarkup());
        }
    }
}
