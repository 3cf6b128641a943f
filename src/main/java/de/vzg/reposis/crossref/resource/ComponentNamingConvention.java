package de.vzg.reposis.crossref.resource;

import de.vzg.reposis.crossref.model.Component;

/**
 * Deployment specific naming of components in resource URLs.
 */
public interface ComponentNamingConvention {

    ComponentName name(Component component);

    record ComponentName(String id, String prefix) {
    }
}
