package de.vzg.reposis.crossref.markup;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jdom2.Attribute;
import org.jdom2.Content;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;
import org.jdom2.input.SAXBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw JATS markup (titles, abstracts, synthesized citation text) into Crossref content.
 * <p>
 * Every fragment goes through the same pipeline: it is sanitized so that it can be parsed as XML,
 * its tags are renamed into the destination vocabulary, and it is parsed on its own inside a
 * temporary root element that declares the Crossref, JATS, MathML and XLink namespaces. The
 * children of that root are then moved into the real element, so markup ends up as nodes and not
 * as escaped text.
 * <p>
 * Instances are not thread-safe; create one per deposit.
 */
public class RichTextReparser {

    private static final Logger log = LoggerFactory.getLogger(RichTextReparser.class);

    public static final String EXECUTIVE_SUMMARY = "executive-summary";

    private static final List<String> FACE_MARKUP_TAGS = List.of("i", "b", "u", "scp", "sub", "sup", "mml:");

    private static final List<String> JATS_TAGS
        = List.of("p", "sec", "title", "italic", "bold", "underline", "sub", "sup", "sc");

    private final Namespace defaultNamespace;

    private final SAXBuilder saxBuilder = new SAXBuilder();

    public RichTextReparser(Namespace defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    /**
     * Creates {@code name} keeping face markup: italic, bold, underline and small caps become
     * {@code i}, {@code b}, {@code u} and {@code scp}; sub, sup and MathML stay; other tags are
     * removed.
     */
    public Element inline(String name, String markup) {
        String converted = MarkupSanitizer.sanitize(markup);
        converted = MarkupSanitizer.replaceTags(converted, "italic", "i");
        converted = MarkupSanitizer.replaceTags(converted, "bold", "b");
        converted = MarkupSanitizer.replaceTags(converted, "underline", "u");
        converted = MarkupSanitizer.replaceTags(converted, "sc", "scp");
        converted = MarkupSanitizer.cleanTags(converted, FACE_MARKUP_TAGS);
        return reparse(new Element(name, defaultNamespace), name, converted, Map.of(), false);
    }

    /**
     * Creates {@code name} holding only the text of {@code markup}.
     */
    public Element clean(String name, String markup) {
        String converted = MarkupSanitizer.cleanTags(MarkupSanitizer.sanitize(markup));
        return reparse(new Element(name, defaultNamespace), name, converted, Map.of(), false);
    }

    public Element text(String name, String markup, boolean faceMarkup) {
        return faceMarkup ? inline(name, markup) : clean(name, markup);
    }

    /**
     * Creates a {@code jats:abstract}.
     *
     * @param markup the abstract body
     * @param jatsConversion true to rename paragraphs, sections and inline tags into JATS, false
     *                       to strip everything but paragraphs
     * @param abstractType the abstract type attribute value, or null for a plain abstract
     */
    public Element jatsAbstract(String markup, boolean jatsConversion, String abstractType) {
        String converted = MarkupSanitizer.sanitize(markup);
        if (jatsConversion) {
            for (String tag : JATS_TAGS) {
                converted = MarkupSanitizer.replaceTags(converted, tag, CrossrefNamespaces.JATS.getPrefix() + ":" + tag);
            }
            // no JATS equivalent for inline-formula and ext-link, their text is kept
            converted = MarkupSanitizer.cleanTags(converted, List.of("jats:", "mml:"));
        } else {
            converted = MarkupSanitizer.cleanTags(converted, List.of("p", "mml:"));
            converted = MarkupSanitizer.replaceTags(converted, "p", "jats:p");
        }
        Map<String, String> attributes = abstractType == null ? Map.of() : Map.of("abstract-type", abstractType);
        return reparse(new Element("abstract", CrossrefNamespaces.JATS), "jats:abstract", converted, attributes,
            true);
    }

    /**
     * Parses {@code markup} inside a temporary root and moves the result into {@code target}.
     *
     * @param copyAttributes whether the temporary root attributes are copied onto {@code target}
     * @throws MarkupFragmentException if the fragment is not well-formed
     */
    public Element reparse(Element target, String rootName, String markup, Map<String, String> rootAttributes,
        boolean copyAttributes) {
        FragmentParseResult result = parse(rootName, markup, rootAttributes);
        if (!result.isSuccess()) {
            throw new MarkupFragmentException("Could not parse <" + rootName + "> fragment: " + result.error(),
                markup);
        }
        target.addContent(result.content());
        if (copyAttributes) {
            result.attributes().forEach(target::setAttribute);
        }
        return target;
    }

    /**
     * Parses an already converted fragment inside a temporary root element.
     */
    public FragmentParseResult parse(String rootName, String markup, Map<String, String> rootAttributes) {
        String wrapped = wrap(rootName, markup == null ? "" : markup, rootAttributes);
        log.trace("Re-parsing fragment: {}", wrapped);
        try (StringReader sr = new StringReader(wrapped)) {
            Document document = saxBuilder.build(sr);
            Element root = document.getRootElement();
            List<Content> content = new ArrayList<>(root.removeContent());
            List<Attribute> attributes = new ArrayList<>();
            for (Attribute attribute : root.getAttributes()) {
                attributes.add(attribute.clone());
            }
            return FragmentParseResult.success(content, attributes);
        } catch (JDOMException | IOException e) {
            log.debug("Fragment is not well-formed: {}", wrapped);
            return FragmentParseResult.failure(e.getMessage());
        }
    }

    private String wrap(String rootName, String markup, Map<String, String> rootAttributes) {
        StringBuilder sb = new StringBuilder();
        sb.append('<').append(rootName);
        sb.append(" xmlns=\"").append(defaultNamespace.getURI()).append('"');
        for (Namespace namespace : CrossrefNamespaces.FRAGMENT_NAMESPACES) {
            sb.append(" xmlns:").append(namespace.getPrefix()).append("=\"").append(namespace.getURI()).append('"');
        }
        rootAttributes.forEach((name, value) -> sb.append(' ').append(name).append("=\"")
            .append(escapeAttribute(value)).append('"'));
        sb.append('>').append(markup).append("</").append(rootName).append('>');
        return sb.toString();
    }

    private static String escapeAttribute(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
    }
}
