package de.vzg.reposis.crossref.markup;

import java.util.List;

import org.jdom2.Attribute;
import org.jdom2.Content;

/**
 * Outcome of parsing a markup fragment: either the detached child content and root attributes of
 * the wrapper element, or the reason the fragment was not well-formed.
 */
public record FragmentParseResult(List<Content> content, List<Attribute> attributes, String error) {

    public static FragmentParseResult success(List<Content> content, List<Attribute> attributes) {
        return new FragmentParseResult(List.copyOf(content), List.copyOf(attributes), null);
    }

    public static FragmentParseResult failure(String error) {
        return new FragmentParseResult(List.of(), List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
