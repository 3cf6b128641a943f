package de.vzg.reposis.crossref.model;

/**
 * License of an article. Only a license with a non-empty href is usable for access indicators
 * and text-mining resources.
 */
public record License(String href, String licenseType) {

    public boolean isUsable() {
        return href != null && !href.isEmpty();
    }
}
