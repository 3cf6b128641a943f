package de.vzg.reposis.crossref.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DatasetType {

    @JsonProperty("prev_published_datasets")
    PREVIOUSLY_PUBLISHED,

    @JsonProperty("datasets")
    CURRENT
}
