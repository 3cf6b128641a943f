package de.vzg.reposis.crossref.markup;

/**
 * Thrown when a markup fragment is still not well-formed after sanitizing.
 */
public class MarkupFragmentException extends RuntimeException {

    private final String fragment;

    public MarkupFragmentException(String message, String fragment) {
        super(message);
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
