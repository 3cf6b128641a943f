package de.vzg.reposis.crossref.model;

public record ComponentPermission(String copyrightStatement, String license) {

    public boolean hasStatementOrLicense() {
        return (copyrightStatement != null && !copyrightStatement.isEmpty())
            || (license != null && !license.isEmpty());
    }
}
