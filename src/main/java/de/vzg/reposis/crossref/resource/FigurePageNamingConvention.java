package de.vzg.reposis.crossref.resource;

import java.util.Set;

import de.vzg.reposis.crossref.model.Component;

/**
 * Figures, tables, media and supplementary files are addressed below the article's figures page,
 * everything else below the article itself.
 */
@org.springframework.stereotype.Component
public class FigurePageNamingConvention implements ComponentNamingConvention {

    public static final String FIGURES_PREFIX = "figures";

    private static final Set<String> FIGURE_PAGE_TYPES
        = Set.of("fig", "table-wrap", "media", "supplementary-material", "source-data");

    @Override
    public ComponentName name(Component component) {
        String prefix = component.getType() != null && FIGURE_PAGE_TYPES.contains(component.getType())
            ? FIGURES_PREFIX
            : "";
        return new ComponentName(component.getId(), prefix);
    }
}
