package de.vzg.reposis.crossref.relation;

import org.jdom2.Element;

import de.vzg.reposis.crossref.markup.CrossrefNamespaces;

/**
 * The {@code rel:program} of one journal article. The element is created on first use and then
 * shared by every related item of the article, so an article never gets more than one.
 */
public class RelationsProgram {

    private final Element journalArticle;

    private Element program;

    public RelationsProgram(Element journalArticle) {
        this.journalArticle = journalArticle;
    }

    /**
     * Returns the program element, appending it to the journal article the first time.
     */
    public Element getOrCreate() {
        if (program == null) {
            program = new Element("program", CrossrefNamespaces.RELATIONS);
            journalArticle.addContent(program);
        }
        return program;
    }

    public boolean isCreated() {
        return program != null;
    }
}
