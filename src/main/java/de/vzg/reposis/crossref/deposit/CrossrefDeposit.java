package de.vzg.reposis.crossref.deposit;

import java.io.IOException;
import java.io.Writer;

import org.jdom2.Content;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Text;
import org.jdom2.output.Format;
import org.jdom2.output.LineSeparator;
import org.jdom2.output.XMLOutputter;
import org.jdom2.output.support.AbstractXMLOutputProcessor;
import org.jdom2.output.support.FormatStack;
import org.jdom2.util.NamespaceStack;

/**
 * A generated deposit document and its batch id.
 */
public class CrossrefDeposit {

    private final String batchId;

    private final Document document;

    public CrossrefDeposit(String batchId, Document document) {
        this.batchId = batchId;
        this.document = document;
    }

    public String getBatchId() {
        return batchId;
    }

    public Document getDocument() {
        return document;
    }

    /**
     * Serializes the document as UTF-8 without added whitespace.
     */
    public String toXml() {
        Format format = Format.getRawFormat().setEncoding("UTF-8").setLineSeparator(LineSeparator.NL);
        return new XMLOutputter(format).outputString(document);
    }

    /**
     * Serializes the document as UTF-8, indenting elements by {@code indent}. An element that mixes
     * text with child elements, such as a title with face markup, is written on one line exactly as
     * it is in the tree.
     */
    public String toXml(String indent) {
        Format format = Format.getPrettyFormat()
            .setEncoding("UTF-8")
            .setIndent(indent)
            .setTextMode(Format.TextMode.TRIM_FULL_WHITE)
            .setLineSeparator(LineSeparator.NL);
        return new XMLOutputter(format, new MixedContentProcessor()).outputString(document);
    }

    private static final class MixedContentProcessor extends AbstractXMLOutputProcessor {

        @Override
        protected void printElement(Writer out, FormatStack fstack, NamespaceStack nstack, Element element)
            throws IOException {
            if (!hasMixedContent(element)) {
                super.printElement(out, fstack, nstack, element);
                return;
            }
            fstack.push();
            try {
                fstack.setTextMode(Format.TextMode.PRESERVE);
                super.printElement(out, fstack, nstack, element);
            } finally {
                fstack.pop();
            }
        }

        private static boolean hasMixedContent(Element element) {
            boolean text = false;
            boolean child = false;
            for (Content content : element.getContent()) {
                if (content instanceof Text && !((Text) content).getTextTrim().isEmpty()) {
                    text = true;
                } else if (content instanceof Element) {
                    child = true;
                }
            }
            return text && child;
        }
    }
}
