package de.vzg.reposis.crossref.model;

import java.util.List;

/**
 * One funder with the award numbers it granted. {@code institutionId} is a funder registry id
 * (a DOI URL) when known.
 */
public record FundingAward(String institutionName, String institutionId, List<String> awardIds) {

    public FundingAward {
        awardIds = awardIds == null ? List.of() : List.copyOf(awardIds);
    }
}
