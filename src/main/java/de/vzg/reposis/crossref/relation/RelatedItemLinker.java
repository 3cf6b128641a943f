package de.vzg.reposis.crossref.relation;

import java.util.Optional;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.vzg.reposis.crossref.markup.CrossrefNamespaces;
import de.vzg.reposis.crossref.model.Article;
import de.vzg.reposis.crossref.model.Dataset;
import de.vzg.reposis.crossref.model.DatasetType;
import de.vzg.reposis.crossref.model.Reference;
import de.vzg.reposis.crossref.util.PriorityList;
import de.vzg.reposis.crossref.util.PriorityList.TaggedValue;

/**
 * Adds {@code rel:related_item} entries for datasets and cited data to the relations program of an
 * article.
 */
@Component
public class RelatedItemLinker {

    private static final Logger log = LoggerFactory.getLogger(RelatedItemLinker.class);

    public static final String REFERENCES = "references";

    public static final String IS_SUPPLEMENTED_BY = "isSupplementedBy";

    public static final PriorityList<Dataset> DATASET_IDENTIFIERS = PriorityList
        .<Dataset>of("doi", Dataset::getDoi)
        .then("accession", Dataset::getAccessionId)
        .then("uri", Dataset::getUri);

    public static final PriorityList<Reference> REFERENCE_IDENTIFIERS = PriorityList
        .<Reference>of("doi", Reference::getDoi)
        .then("accession", Reference::getAccession)
        .then("pmid", Reference::getPmid)
        .then("uri", Reference::getUri);

    private static final String DATA = "data";

    public static boolean hasRelatedItem(Dataset dataset) {
        return DATASET_IDENTIFIERS.anyPresent(dataset);
    }

    /**
     * Only cited data with at least one identifier is linked.
     */
    public static boolean hasRelatedItem(Reference reference) {
        return DATA.equals(reference.getPublicationType()) && REFERENCE_IDENTIFIERS.anyPresent(reference);
    }

    /**
     * Whether any dataset or reference of the article will produce a related item.
     */
    public boolean needsRelationsProgram(Article article) {
        return article.getDatasets().stream().anyMatch(RelatedItemLinker::hasRelatedItem)
            || article.getReferences().stream().anyMatch(RelatedItemLinker::hasRelatedItem);
    }

    public static String relationshipType(Dataset dataset) {
        return dataset.getDatasetType() == DatasetType.PREVIOUSLY_PUBLISHED ? REFERENCES : IS_SUPPLEMENTED_BY;
    }

    public void addDatasets(RelationsProgram relations, Article article) {
        for (Dataset dataset : article.getDatasets()) {
            Optional<TaggedValue> identifier = DATASET_IDENTIFIERS.first(dataset);
            if (identifier.isEmpty()) {
                log.debug("Dataset '{}' of {} has no identifier, no related item added", dataset.getTitle(),
                    article.getDoi());
                continue;
            }
            relations.getOrCreate().addContent(
                relatedItem(dataset.getTitle(), relationshipType(dataset), identifier.get()));
        }
    }

    public void addReference(RelationsProgram relations, Reference reference) {
        Optional<TaggedValue> identifier = REFERENCE_IDENTIFIERS.first(reference);
        if (!DATA.equals(reference.getPublicationType()) || identifier.isEmpty()) {
            return;
        }
        log.trace("Linking cited data {} by {}", reference.getId(), identifier.get().tag());
        relations.getOrCreate().addContent(relatedItem(reference.getDataTitle(), REFERENCES, identifier.get()));
    }

    private Element relatedItem(String description, String relationshipType, TaggedValue identifier) {
        Element relatedItem = new Element("related_item", CrossrefNamespaces.RELATIONS);
        if (description != null && !description.isEmpty()) {
            relatedItem.addContent(new Element("description", CrossrefNamespaces.RELATIONS).setText(description));
        }
        Element relation = new Element("inter_work_relation", CrossrefNamespaces.RELATIONS)
            .setAttribute("relationship-type", relationshipType)
            .setAttribute("identifier-type", identifier.tag())
            .setText(identifier.value());
        relatedItem.addContent(relation);
        return relatedItem;
    }
}
