package de.vzg.reposis.crossref.deposit;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.jdom2.Comment;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.jdom2.filter.Filters;
import org.jdom2.xpath.XPathFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import de.vzg.reposis.crossref.config.CrossrefProperties;
import de.vzg.reposis.crossref.contributor.CrossrefContributorsBuilder;
import de.vzg.reposis.crossref.funding.FundRefBuilder;
import de.vzg.reposis.crossref.markup.CrossrefNamespaces;
import de.vzg.reposis.crossref.model.Article;
import de.vzg.reposis.crossref.model.Component;
import de.vzg.reposis.crossref.model.ComponentPermission;
import de.vzg.reposis.crossref.model.Contributor;
import de.vzg.reposis.crossref.model.Dataset;
import de.vzg.reposis.crossref.model.DatasetType;
import de.vzg.reposis.crossref.model.FundingAward;
import de.vzg.reposis.crossref.model.License;
import de.vzg.reposis.crossref.model.Reference;
import de.vzg.reposis.crossref.model.ReferenceAuthor;
import de.vzg.reposis.crossref.model.SelfUri;
import de.vzg.reposis.crossref.relation.RelatedItemLinker;
import de.vzg.reposis.crossref.resource.CrossrefMimeTypes;
import de.vzg.reposis.crossref.resource.FigurePageNamingConvention;
import de.vzg.reposis.crossref.resource.ResourceUrlResolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrossrefDepositBuilder")
class CrossrefDepositBuilderTest {

    private static final Instant RUN = Instant.parse("2024-03-05T10:15:30Z");

    private static final String LICENSE = "http://creativecommons.org/licenses/by/4.0/";

    private static final Namespace REL = CrossrefNamespaces.RELATIONS;

    private static final Namespace AI = CrossrefNamespaces.ACCESS_INDICATORS;

    private static final Namespace JATS = CrossrefNamespaces.JATS;

    private CrossrefProperties properties;

    private Article article;

    @BeforeEach
    void setUp() {
        properties = new CrossrefProperties();
        properties.setDepositorName("eLife");
        properties.setEmailAddress("production@example.org");
        properties.setRegistrant("eLife Sciences Publications, Ltd");
        article = minimalArticle();
    }

    private static Article minimalArticle() {
        Article article = new Article("10.7554/eLife.12345", "12345");
        article.setJournalTitle("eLife");
        article.setJournalIssn("2050-084X");
        article.setTitle("An example article");
        return article;
    }

    private CrossrefDepositBuilder builder() {
        return new CrossrefDepositBuilder(properties, Clock.fixed(RUN, ZoneOffset.UTC),
            new ResourceUrlResolver(properties, new FigurePageNamingConvention()), new RelatedItemLinker(),
            new CrossrefContributorsBuilder(properties), new FundRefBuilder(), new CrossrefMimeTypes());
    }

    private Document deposit(Article... articles) {
        return builder().build(List.of(articles)).getDocument();
    }

    private List<Element> select(Document document, String expression) {
        Namespace cr = Namespace.getNamespace("cr", CrossrefNamespaces.crossrefUri(properties.getSchemaVersion()));
        return XPathFactory.instance().compile(expression, Filters.element(), null, cr, REL, AI, JATS,
            CrossrefNamespaces.FUNDREF).evaluate(document);
    }

    private Element selectOne(Document document, String expression) {
        List<Element> elements = select(document, expression);
        assertThat(elements).as(expression).hasSize(1);
        return elements.get(0);
    }

    private static Reference dataReference(String id, String doi) {
        Reference reference = new Reference("data");
        reference.setId(id);
        reference.setDoi(doi);
        return reference;
    }

    @Nested
    @DisplayName("envelope")
    class Envelope {

        @Test
        @DisplayName("root carries version, namespaces and schema location")
        void root() {
            Element root = deposit(article).getRootElement();

            assertThat(root.getName()).isEqualTo("doi_batch");
            assertThat(root.getNamespaceURI()).isEqualTo("http://www.crossref.org/schema/4.4.1");
            assertThat(root.getAttributeValue("version")).isEqualTo("4.4.1");
            assertThat(root.getAttributeValue("schemaLocation", CrossrefNamespaces.XSI))
                .isEqualTo("http://www.crossref.org/schema/4.4.1 http://www.crossref.org/schemas/crossref4.4.1.xsd");
            assertThat(root.getAdditionalNamespaces()).extracting(Namespace::getPrefix)
                .contains("xsi", "fr", "ai", "ct", "rel", "mml", "jats");
        }

        @Test
        @DisplayName("the oldest schema has no relations namespaces")
        void legacyRoot() {
            properties.setSchemaVersion("4.3.5");

            Element root = deposit(article).getRootElement();

            assertThat(root.getAdditionalNamespaces()).extracting(Namespace::getPrefix)
                .contains("xsi", "fr", "ai", "mml", "jats")
                .doesNotContain("ct", "rel");
        }

        @Test
        @DisplayName("head holds batch id, timestamp, depositor and registrant")
        void head() {
            article.setManuscript("e12 345");
            Document document = deposit(article);

            assertThat(selectOne(document, "/cr:doi_batch/cr:head/cr:doi_batch_id").getText())
                .isEqualTo("crossref-e12345-20240305101530");
            assertThat(selectOne(document, "/cr:doi_batch/cr:head/cr:timestamp").getText())
                .isEqualTo("20240305101530");
            assertThat(selectOne(document, "//cr:depositor/cr:depositor_name").getText()).isEqualTo("eLife");
            assertThat(selectOne(document, "//cr:depositor/cr:email_address").getText())
                .isEqualTo("production@example.org");
            assertThat(selectOne(document, "/cr:doi_batch/cr:head/cr:registrant").getText())
                .isEqualTo("eLife Sciences Publications, Ltd");
        }

        @Test
        @DisplayName("batch id of an empty batch has no manuscript segment")
        void emptyBatch() {
            CrossrefDeposit deposit = builder().build(List.of());

            assertThat(deposit.getBatchId()).isEqualTo("crossref-20240305101530");
            assertThat(select(deposit.getDocument(), "//cr:journal")).isEmpty();
        }

        @Test
        @DisplayName("generator comment is optional")
        void comment() {
            List<Comment> comments = deposit(article).getRootElement().getContent(Filters.comment());
            assertThat(comments).extracting(Comment::getText)
                .containsExactly("generated by reposis-crossref at 2024-03-05 10:15:30");

            properties.setAddComment(false);
            assertThat(deposit(article).getRootElement().getContent(Filters.comment())).isEmpty();
        }

        @Test
        @DisplayName("one journal per article in input order")
        void journals() {
            Article second = minimalArticle();
            second.setDoi("10.7554/eLife.67890");

            List<Element> identifiers = select(deposit(article, second), "//cr:publisher_item/cr:identifier");

            assertThat(identifiers).extracting(Element::getText)
                .containsExactly("10.7554/eLife.12345", "10.7554/eLife.67890");
        }

        @Test
        @DisplayName("serialization declares UTF-8")
        void serialization() {
            CrossrefDeposit deposit = builder().build(List.of(article));

            assertThat(deposit.toXml()).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
            assertThat(deposit.toXml("    ")).contains("\n    <head>");
        }
    }

    @Nested
    @DisplayName("journal and article")
    class JournalAndArticle {

        @Test
        @DisplayName("minimal article has no citation list, component list or relations")
        void minimal() {
            Document document = deposit(article);

            assertThat(select(document, "//cr:citation_list")).isEmpty();
            assertThat(select(document, "//cr:component_list")).isEmpty();
            assertThat(select(document, "//rel:program")).isEmpty();
            assertThat(select(document, "//ai:program")).isEmpty();
            assertThat(selectOne(document, "//cr:journal_metadata").getAttributeValue("language")).isEqualTo("en");
            assertThat(selectOne(document, "//cr:journal_metadata/cr:full_title").getText()).isEqualTo("eLife");
            assertThat(selectOne(document, "//cr:journal_metadata/cr:issn").getAttributeValue("media_type"))
                .isEqualTo("electronic");
            assertThat(selectOne(document, "//cr:journal_article/cr:titles/cr:title").getText())
                .isEqualTo("An example article");
        }

        @Test
        @DisplayName("publication date is the first configured date type")
        void publicationDate() {
            article.addDate("posted_date", LocalDate.of(2023, 7, 9));
            article.addDate("received", LocalDate.of(2022, 1, 1));

            Document document = deposit(article);

            for (String path : List.of("//cr:journal_issue/cr:publication_date",
                "//cr:journal_article/cr:publication_date")) {
                Element date = selectOne(document, path);
                assertThat(date.getAttributeValue("media_type")).isEqualTo("online");
                assertThat(date.getChildText("month", date.getNamespace())).isEqualTo("07");
                assertThat(date.getChildText("day", date.getNamespace())).isEqualTo("09");
                assertThat(date.getChildText("year", date.getNamespace())).isEqualTo("2023");
            }
        }

        @Test
        @DisplayName("publication date falls back to the run date")
        void runDate() {
            article.addDate("received", LocalDate.of(2022, 1, 1));

            Element date = selectOne(deposit(article), "//cr:journal_article/cr:publication_date");

            assertThat(date.getChildText("year", date.getNamespace())).isEqualTo("2024");
            assertThat(date.getChildText("month", date.getNamespace())).isEqualTo("03");
            assertThat(date.getChildText("day", date.getNamespace())).isEqualTo("05");
        }

        @Test
        @DisplayName("volume from the article, computed, or omitted")
        void volume() {
            article.addDate("pub", LocalDate.of(2023, 7, 9));
            assertThat(select(deposit(article), "//cr:journal_volume")).isEmpty();

            properties.setYearOfFirstVolume(2012);
            assertThat(selectOne(deposit(article), "//cr:journal_volume/cr:volume").getText()).isEqualTo("12");

            article.setVolume("7");
            assertThat(selectOne(deposit(article), "//cr:journal_volume/cr:volume").getText()).isEqualTo("7");
        }

        @Test
        @DisplayName("article number only when configured and present")
        void itemNumber() {
            article.setElocationId("e12345");
            assertThat(select(deposit(article), "//cr:publisher_item/cr:item_number")).isEmpty();

            properties.setElocationId(true);
            Element itemNumber = selectOne(deposit(article), "//cr:publisher_item/cr:item_number");
            assertThat(itemNumber.getAttributeValue("item_number_type")).isEqualTo("article_number");
            assertThat(itemNumber.getText()).isEqualTo("e12345");
            assertThat(selectOne(deposit(article), "//cr:publisher_item/cr:identifier").getAttributeValue("id_type"))
                .isEqualTo("doi");
        }

        @Test
        @DisplayName("reference distribution option is written when configured")
        void referenceDistributionOpts() {
            assertThat(selectOne(deposit(article), "//cr:journal_article")
                .getAttribute("reference_distribution_opts")).isNull();

            properties.setReferenceDistributionOpts("any");
            Element journalArticle = selectOne(deposit(article), "//cr:journal_article");
            assertThat(journalArticle.getAttributeValue("reference_distribution_opts")).isEqualTo("any");
            assertThat(journalArticle.getAttributeValue("publication_type")).isEqualTo("full_text");
        }

        @Test
        @DisplayName("external links are stripped from titles")
        void title() {
            article.setTitle("Data from <ext-link xlink:href=\"http://x\">the archive</ext-link> <italic>in vivo</italic>");

            Element title = selectOne(deposit(article), "//cr:titles/cr:title");
            assertThat(title.getChildren()).isEmpty();
            assertThat(title.getText()).isEqualTo("Data from the archive in vivo");

            properties.setFaceMarkup(true);
            Element withMarkup = selectOne(deposit(article), "//cr:titles/cr:title");
            assertThat(withMarkup.getChildren()).extracting(Element::getName).containsExactly("i");
        }

        @Test
        @DisplayName("abstract and digest become JATS abstracts")
        void abstracts() {
            article.setAbstractText("<p>Abstract <italic>text</italic></p>");
            article.setDigest("<p>Digest</p>");

            List<Element> abstracts = select(deposit(article), "//cr:journal_article/jats:abstract");

            assertThat(abstracts).hasSize(2);
            assertThat(abstracts.get(0).getAttribute("abstract-type")).isNull();
            assertThat(abstracts.get(0).getChild("p", JATS).getChildText("italic", JATS)).isEqualTo("text");
            assertThat(abstracts.get(1).getAttributeValue("abstract-type")).isEqualTo("executive-summary");
        }

        @Test
        @DisplayName("malformed markup fails the whole deposit")
        void malformed() {
            article.setAbstractText("<p>unclosed");

            assertThatThrownBy(() -> deposit(article))
                .isInstanceOf(DepositGenerationException.class)
                .hasMessageContaining("10.7554/eLife.12345")
                .hasMessageContaining("abstract");
        }

        @Test
        @DisplayName("archive locations, one per configured name")
        void archiveLocations() {
            properties.setArchiveLocations(List.of("CLOCKSS", "Internet Archive"));

            List<Element> archives = select(deposit(article), "//cr:archive_locations/cr:archive");

            assertThat(archives).extracting(e -> e.getAttributeValue("name"))
                .containsExactly("CLOCKSS", "Internet Archive");
        }

        @Test
        @DisplayName("elements are written in schema order")
        void order() {
            article.setContributors(List.of(new Contributor("author", "Smith", "J")));
            article.setAbstractText("<p>Abstract</p>");
            article.setDigest("<p>Digest</p>");
            article.setFundingAwards(List.of(new FundingAward("Funder", null, List.of("1"))));
            article.setLicense(new License(LICENSE, null));
            article.setReferences(List.of(dataReference("bib1", "10.5061/dryad.1")));
            article.setComponents(List.of(new Component("fig1", "fig", "Figure 1")));
            properties.setAccessIndicatorsAppliesTo(List.of("vor"));
            properties.setArchiveLocations(List.of("CLOCKSS"));

            Element journalArticle = selectOne(deposit(article), "//cr:journal_article");

            assertThat(journalArticle.getChildren()).extracting(Element::getQualifiedName)
                .containsExactly("titles", "contributors", "jats:abstract", "jats:abstract", "publication_date",
                    "publisher_item", "fr:program", "ai:program", "rel:program", "archive_locations", "doi_data",
                    "citation_list", "component_list");
        }
    }

    @Nested
    @DisplayName("relations")
    class Relations {

        @Test
        @DisplayName("a data reference with a doi gives one container with one doi entry")
        void dataReferenceWithDoi() {
            article.setReferences(List.of(dataReference("bib1", "10.5061/dryad.1")));

            Document document = deposit(article);

            selectOne(document, "//cr:journal_article/rel:program");
            Element relation = selectOne(document, "//rel:program/rel:related_item/rel:inter_work_relation");
            assertThat(relation.getAttributeValue("identifier-type")).isEqualTo("doi");
            assertThat(relation.getAttributeValue("relationship-type")).isEqualTo("references");
            assertThat(relation.getText()).isEqualTo("10.5061/dryad.1");
        }

        @Test
        @DisplayName("two entries share one container")
        void sharedContainer() {
            Reference byAccession = new Reference("data");
            byAccession.setAccession("GSE2");
            article.setReferences(List.of(dataReference("bib1", "10.5061/dryad.1"), byAccession));

            Document document = deposit(article);

            assertThat(select(document, "//rel:program")).hasSize(1);
            assertThat(select(document, "//rel:program/rel:related_item")).hasSize(2);
        }

        @Test
        @DisplayName("datasets come before cited data in the same container")
        void datasetsAndReferences() {
            Dataset dataset = new Dataset("Generated data", DatasetType.CURRENT);
            dataset.setDoi("10.5061/dryad.9");
            article.setDatasets(List.of(dataset));
            article.setReferences(List.of(dataReference("bib1", "10.5061/dryad.1")));

            List<Element> relations = select(deposit(article), "//rel:program/rel:related_item/rel:inter_work_relation");

            assertThat(relations).extracting(Element::getText).containsExactly("10.5061/dryad.9", "10.5061/dryad.1");
            assertThat(relations.get(0).getAttributeValue("relationship-type")).isEqualTo("isSupplementedBy");
        }

        @Test
        @DisplayName("relation-less datasets produce no container")
        void noIdentifiers() {
            article.setDatasets(List.of(new Dataset("Nothing", DatasetType.CURRENT)));
            article.setReferences(List.of(new Reference("data")));

            assertThat(select(deposit(article), "//rel:program")).isEmpty();
        }
    }

    @Nested
    @DisplayName("citations")
    class Citations {

        @Test
        @DisplayName("editor-only reference uses the first editor")
        void editors() {
            Reference reference = new Reference("book");
            reference.setAuthors(List.of(ReferenceAuthor.person("editor", "Doe", "J"),
                ReferenceAuthor.person("editor", "Roe", "K")));
            article.setReferences(List.of(reference));

            assertThat(selectOne(deposit(article), "//cr:citation/cr:author").getText()).isEqualTo("Doe");
        }

        @Test
        @DisplayName("keys are ids or ordinals")
        void keys() {
            Reference second = new Reference("journal");
            second.setSource("Journal");
            article.setReferences(List.of(dataReference("bib1", "10.5061/dryad.1"), second));

            assertThat(select(deposit(article), "//cr:citation")).extracting(e -> e.getAttributeValue("key"))
                .containsExactly("bib1", "2");
        }

        @Test
        @DisplayName("unstructured citation text")
        void unstructured() {
            Reference reference = new Reference("web");
            reference.setAuthors(List.of(ReferenceAuthor.person("author", "Smith", "J")));
            reference.setYear("2020");
            reference.setArticleTitle("Example");
            reference.setUri("http://x");
            article.setReferences(List.of(reference));

            assertThat(selectOne(deposit(article), "//cr:citation/cr:unstructured_citation").getText())
                .isEqualTo("Smith J. 2020. Example. http://x.");
        }

        @Test
        @DisplayName("volume is truncated to 31 characters")
        void volume() {
            Reference reference = new Reference("journal");
            reference.setVolume("1234567890123456789012345678901234567890");
            article.setReferences(List.of(reference));

            assertThat(selectOne(deposit(article), "//cr:citation/cr:volume").getText())
                .isEqualTo("1234567890123456789012345678901");
        }

        @Test
        @DisplayName("elocation id placement depends on the schema version")
        void elocationBySchemaVersion() {
            Reference reference = new Reference("journal");
            reference.setElocationId("e100");
            article.setReferences(List.of(reference));

            properties.setSchemaVersion("4.3.5");
            Document legacy = deposit(article);
            assertThat(selectOne(legacy, "//cr:citation/cr:first_page").getText()).isEqualTo("e100");
            assertThat(select(legacy, "//cr:citation/cr:elocation_id")).isEmpty();

            properties.setSchemaVersion("4.4.1");
            Document current = deposit(article);
            assertThat(selectOne(current, "//cr:citation/cr:elocation_id").getText()).isEqualTo("e100");
            assertThat(select(current, "//cr:citation/cr:first_page")).isEmpty();
        }

        @Test
        @DisplayName("reports get an unstructured citation only without isbn")
        void reports() {
            Reference withIsbn = new Reference("report");
            withIsbn.setIsbn("978-3-16-148410-0");
            withIsbn.setArticleTitle("Annual report");
            Reference withDoi = new Reference("report");
            withDoi.setDoi("10.1234/report");
            withDoi.setArticleTitle("Technical report");
            article.setReferences(List.of(withIsbn, withDoi));

            List<Element> unstructured = select(deposit(article), "//cr:citation/cr:unstructured_citation");

            assertThat(unstructured).extracting(Element::getText).containsExactly("Technical report.");
            assertThat(unstructured.get(0).getParentElement().getAttributeValue("key")).isEqualTo("2");
        }
    }

    @Nested
    @DisplayName("access indicators and resources")
    class AccessAndResources {

        @Test
        @DisplayName("no configured scope, no access indicators")
        void noScopes() {
            article.setLicense(new License(LICENSE, null));

            assertThat(select(deposit(article), "//ai:program")).isEmpty();
        }

        @Test
        @DisplayName("one license reference per configured scope")
        void twoScopes() {
            article.setLicense(new License(LICENSE, null));
            properties.setAccessIndicatorsAppliesTo(List.of("vor", "tdm"));

            Document document = deposit(article);

            assertThat(selectOne(document, "//cr:journal_article/ai:program").getAttributeValue("name"))
                .isEqualTo("AccessIndicators");
            List<Element> refs = select(document, "//ai:program/ai:license_ref");
            assertThat(refs).extracting(e -> e.getAttributeValue("applies_to")).containsExactly("vor", "tdm");
            assertThat(refs).extracting(Element::getText).containsOnly(LICENSE);
        }

        @Test
        @DisplayName("license without href is not usable")
        void unusableLicense() {
            article.setLicense(new License("", "open-access"));
            properties.setAccessIndicatorsAppliesTo(List.of("vor"));

            assertThat(select(deposit(article), "//ai:program")).isEmpty();
        }

        @Test
        @DisplayName("doi data with resource and text-mining collection")
        void doiData() {
            properties.setDoiPattern("https://example.org/articles/{manuscript}");
            properties.setTextMiningPdfPattern("https://cdn.example.org/{manuscript}.pdf");
            properties.setTextMiningXmlPattern("https://cdn.example.org/{manuscript}.xml");
            article.setLicense(new License(LICENSE, null));
            article.setSelfUris(List.of(new SelfUri("https://example.org/12345.pdf", "pdf")));

            Document document = deposit(article);

            assertThat(selectOne(document, "//cr:journal_article/cr:doi_data/cr:doi").getText())
                .isEqualTo("10.7554/eLife.12345");
            assertThat(selectOne(document, "//cr:journal_article/cr:doi_data/cr:resource").getText())
                .isEqualTo("https://example.org/articles/12345");
            Element collection = selectOne(document, "//cr:doi_data/cr:collection");
            assertThat(collection.getAttributeValue("property")).isEqualTo("text-mining");
            assertThat(select(document, "//cr:collection/cr:item/cr:resource"))
                .extracting(e -> e.getAttributeValue("mime_type"))
                .containsExactly("application/pdf", "application/xml");
        }

        @Test
        @DisplayName("no resource and no collection without pattern, self uri or license")
        void noResource() {
            Document document = deposit(article);

            assertThat(selectOne(document, "//cr:journal_article/cr:doi_data").getChildren())
                .extracting(Element::getName).containsExactly("doi");
        }
    }

    @Nested
    @DisplayName("components")
    class Components {

        @Test
        @DisplayName("titles, format, access indicators and doi data")
        void component() {
            properties.setComponentDoiPattern("https://example.org/articles/{manuscript}/{prefix}#{id}");
            properties.setElifeStyleComponentDoi(true);
            properties.setComponentLicenseRef(LICENSE);
            Component figure = new Component("fig1", "fig", "Figure 1");
            figure.setSubtitle("A <italic>subtitle</italic>");
            figure.setMimeType("image/jpg");
            figure.setDoi("10.7554/eLife.12345.003");
            figure.setPermissions(List.of(new ComponentPermission("Copyright 2024", null)));
            article.setComponents(List.of(figure));

            Element component = selectOne(deposit(article), "//cr:component_list/cr:component");

            assertThat(component.getAttributeValue("parent_relation")).isEqualTo("isPartOf");
            assertThat(component.getChildren()).extracting(Element::getQualifiedName)
                .containsExactly("titles", "format", "ai:program", "doi_data");
            Element titles = component.getChild("titles", component.getNamespace());
            assertThat(titles.getChildText("title", component.getNamespace())).isEqualTo("Figure 1");
            assertThat(titles.getChildText("subtitle", component.getNamespace())).isEqualTo("A subtitle");
            assertThat(component.getChild("format", component.getNamespace()).getAttributeValue("mime_type"))
                .isEqualTo("image/jpeg");
            assertThat(component.getChild("program", AI).getChildText("license_ref", AI)).isEqualTo(LICENSE);
            Element doiData = component.getChild("doi_data", component.getNamespace());
            assertThat(doiData.getChildText("doi", component.getNamespace())).isEqualTo("10.7554/eLife.12345.003");
            assertThat(doiData.getChildText("resource", component.getNamespace()))
                .isEqualTo("https://example.org/articles/12345/figures#fig1");
        }

        @Test
        @DisplayName("unknown mime types and missing data are omitted")
        void omitted() {
            Component media = new Component("media1", "media", "Video 1");
            media.setMimeType("application/x-unknown");
            media.setDoi("10.7554/eLife.12345.004");
            article.setComponents(List.of(media));

            Element component = selectOne(deposit(article), "//cr:component_list/cr:component");

            assertThat(component.getChildren()).extracting(Element::getName).containsExactly("titles");
        }
    }
}
