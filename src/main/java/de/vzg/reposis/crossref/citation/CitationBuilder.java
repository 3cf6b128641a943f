package de.vzg.reposis.crossref.citation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jdom2.Element;
import org.jdom2.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.reposis.crossref.markup.RichTextReparser;
import de.vzg.reposis.crossref.model.Reference;
import de.vzg.reposis.crossref.model.ReferenceAuthor;
import de.vzg.reposis.crossref.util.PriorityList;
import de.vzg.reposis.crossref.util.PriorityList.TaggedValue;

/**
 * Builds the {@code citation} element of a reference.
 * <p>
 * Structured fields are written for every value the reference has. Types that the structured
 * fields describe badly (conference papers, patents, software, theses, web pages, and preprints or
 * reports lacking their main identifier) additionally get an {@code unstructured_citation}
 * assembled from all known parts.
 */
public class CitationBuilder {

    private static final Logger log = LoggerFactory.getLogger(CitationBuilder.class);

    public static final int MAX_VOLUME_LENGTH = 31;

    /**
     * Schema versions without an {@code elocation_id} citation field; the elocation id replaces
     * {@code first_page} there.
     */
    public static final Set<String> FIRST_PAGE_ELOCATION_VERSIONS = Set.of("4.3.5", "4.3.7", "4.4.0");

    private static final Set<String> UNSTRUCTURED_TYPES
        = Set.of("confproc", "patent", "software", "thesis", "web", "webpage");

    private static final String AUTHOR = "author";

    private static final String EDITOR = "editor";

    private static final PriorityList<ReferenceAuthor> AUTHOR_NAME = PriorityList
        .<ReferenceAuthor>of("surname", ReferenceAuthor::surname)
        .then("collab", ReferenceAuthor::collab);

    private final Namespace namespace;

    private final RichTextReparser reparser;

    private final String schemaVersion;

    private final boolean faceMarkup;

    public CitationBuilder(Namespace namespace, RichTextReparser reparser, String schemaVersion, boolean faceMarkup) {
        this.namespace = namespace;
        this.reparser = reparser;
        this.schemaVersion = schemaVersion;
        this.faceMarkup = faceMarkup;
    }

    /**
     * @param ordinal 1-based position of the reference, used as key when it has no id
     */
    public Element citation(Reference reference, int ordinal) {
        Element citation = new Element("citation", namespace);
        citation.setAttribute("key", isPresent(reference.getId()) ? reference.getId() : String.valueOf(ordinal));

        if (isPresent(reference.getSource())) {
            String name = "journal".equals(reference.getPublicationType()) ? "journal_title" : "volume_title";
            addText(citation, name, reference.getSource());
        }

        firstAuthorName(reference).ifPresent(name -> {
            if ("surname".equals(name.tag())) {
                addText(citation, "author", name.value());
            } else {
                citation.addContent(reparser.clean("author", name.value()));
            }
        });

        if (isPresent(reference.getVolume())) {
            String volume = reference.getVolume();
            addText(citation, "volume", volume.substring(0, Math.min(MAX_VOLUME_LENGTH, volume.length())));
        }
        addText(citation, "issue", reference.getIssue());

        boolean elocationAsFirstPage = FIRST_PAGE_ELOCATION_VERSIONS.contains(schemaVersion)
            && isPresent(reference.getElocationId());
        addText(citation, "first_page", elocationAsFirstPage ? reference.getElocationId() : reference.getFpage());

        if (reference.getYearNumeric() != null) {
            addText(citation, "cYear", String.valueOf(reference.getYearNumeric()));
        } else {
            addText(citation, "cYear", reference.getYear());
        }

        String title = isPresent(reference.getArticleTitle()) ? reference.getArticleTitle() : reference.getDataTitle();
        if (isPresent(title)) {
            citation.addContent(reparser.clean("article_title", title));
        }

        addText(citation, "doi", reference.getDoi());
        addText(citation, "isbn", reference.getIsbn());

        if (!elocationAsFirstPage) {
            addText(citation, "elocation_id", reference.getElocationId());
        }

        if (hasUnstructuredCitation(reference)) {
            String text = unstructuredCitation(reference);
            if (!text.isEmpty()) {
                log.trace("Unstructured citation for {}: {}", citation.getAttributeValue("key"), text);
                citation.addContent(reparser.text("unstructured_citation", text, faceMarkup));
            }
        }
        return citation;
    }

    /**
     * References of type journal, book etc. rely on their structured fields; a preprint without doi
     * or a report without isbn needs the free text as well.
     */
    public static boolean hasUnstructuredCitation(Reference reference) {
        String type = reference.getPublicationType();
        if (type == null) {
            return false;
        }
        if (UNSTRUCTURED_TYPES.contains(type)) {
            return true;
        }
        if ("preprint".equals(type)) {
            return !isPresent(reference.getDoi());
        }
        if ("report".equals(type)) {
            return !isPresent(reference.getIsbn());
        }
        return false;
    }

    /**
     * Authors used for the {@code author} field: those with the author role, or the editors if
     * there are none.
     */
    public static List<ReferenceAuthor> citationAuthors(Reference reference) {
        List<ReferenceAuthor> authors = authorsWithRole(reference, AUTHOR);
        return authors.isEmpty() ? authorsWithRole(reference, EDITOR) : authors;
    }

    public static Optional<TaggedValue> firstAuthorName(Reference reference) {
        List<ReferenceAuthor> authors = citationAuthors(reference);
        return authors.isEmpty() ? Optional.empty() : AUTHOR_NAME.first(authors.get(0));
    }

    /**
     * Joins the parts of a reference into one sentence-like string, e.g.
     * {@code Smith J. 2020. Example. http://x.}
     */
    public static String unstructuredCitation(Reference reference) {
        String title = isPresent(reference.getArticleTitle()) ? reference.getArticleTitle() : reference.getDataTitle();
        String year = isPresent(reference.getYear()) ? reference.getYear()
            : reference.getYearNumeric() == null ? null : String.valueOf(reference.getYearNumeric());
        String joined = Stream.of(authorLine(reference), year, title, publisher(reference), reference.getSource(),
                reference.getVersion(), reference.getPatent(), reference.getConfName(), uri(reference))
            .filter(CitationBuilder::isPresent)
            .map(CitationBuilder::stripTrailingPeriods)
            .filter(CitationBuilder::isPresent)
            .collect(Collectors.joining(". "));
        return joined.isEmpty() ? "" : joined + ".";
    }

    /**
     * All authors regardless of role, as "surname given-names" or collaboration name, comma
     * separated.
     */
    public static String authorLine(Reference reference) {
        List<String> names = new ArrayList<>();
        for (ReferenceAuthor author : reference.getAuthors()) {
            if (isPresent(author.surname())) {
                names.add(isPresent(author.givenNames()) ? author.surname() + " " + author.givenNames()
                    : author.surname());
            } else if (isPresent(author.collab())) {
                names.add(author.collab());
            }
        }
        return names.isEmpty() ? null : String.join(", ", names);
    }

    static String publisher(Reference reference) {
        String publisher = Stream.of(reference.getPublisherLoc(), reference.getPublisherName())
            .filter(CitationBuilder::isPresent)
            .collect(Collectors.joining(": "));
        return publisher.isEmpty() ? null : publisher;
    }

    static String uri(Reference reference) {
        if (!isPresent(reference.getUri())) {
            return null;
        }
        if (isPresent(reference.getDateInCitation())) {
            return reference.getUri() + " [Accessed " + reference.getDateInCitation() + "]";
        }
        return reference.getUri();
    }

    private static List<ReferenceAuthor> authorsWithRole(Reference reference, String role) {
        return reference.getAuthors().stream()
            .filter(author -> role.equals(author.groupType()))
            .collect(Collectors.toList());
    }

    private static String stripTrailingPeriods(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '.') {
            end--;
        }
        return value.substring(0, end);
    }

    private void addText(Element parent, String name, String value) {
        if (isPresent(value)) {
            parent.addContent(new Element(name, namespace).setText(value));
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
