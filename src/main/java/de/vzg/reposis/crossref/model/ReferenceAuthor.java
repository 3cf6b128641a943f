package de.vzg.reposis.crossref.model;

/**
 * Person or group named in a reference. {@code groupType} is the role, usually "author" or
 * "editor".
 */
public record ReferenceAuthor(String groupType, String surname, String givenNames, String collab) {

    public static ReferenceAuthor person(String groupType, String surname, String givenNames) {
        return new ReferenceAuthor(groupType, surname, givenNames, null);
    }

    public static ReferenceAuthor collaboration(String groupType, String collab) {
        return new ReferenceAuthor(groupType, null, null, collab);
    }
}
