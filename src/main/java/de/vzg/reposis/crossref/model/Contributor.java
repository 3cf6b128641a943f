package de.vzg.reposis.crossref.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Contributor of the article itself, either a person or a collaboration.
 */
public class Contributor {

    private String contribType;

    private String surname;

    private String givenNames;

    private String suffix;

    private String collab;

    private String orcid;

    private boolean orcidAuthenticated;

    private List<String> affiliations = new ArrayList<>();

    public Contributor() {
    }

    public Contributor(String contribType, String surname, String givenNames) {
        this.contribType = contribType;
        this.surname = surname;
        this.givenNames = givenNames;
    }

    public static Contributor collaboration(String contribType, String collab) {
        Contributor contributor = new Contributor();
        contributor.setContribType(contribType);
        contributor.setCollab(collab);
        return contributor;
    }

    public String getContribType() {
        return contribType;
    }

    public void setContribType(String contribType) {
        this.contribType = contribType;
    }

    public String getSurname() {
        return surname;
    }

    public void setSurname(String surname) {
        this.surname = surname;
    }

    public String getGivenNames() {
        return givenNames;
    }

    public void setGivenNames(String givenNames) {
        this.givenNames = givenNames;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public String getCollab() {
        return collab;
    }

    public void setCollab(String collab) {
        this.collab = collab;
    }

    public String getOrcid() {
        return orcid;
    }

    public void setOrcid(String orcid) {
        this.orcid = orcid;
    }

    public boolean isOrcidAuthenticated() {
        return orcidAuthenticated;
    }

    public void setOrcidAuthenticated(boolean orcidAuthenticated) {
        this.orcidAuthenticated = orcidAuthenticated;
    }

    public List<String> getAffiliations() {
        return affiliations;
    }

    public void setAffiliations(List<String> affiliations) {
        this.affiliations = affiliations == null ? new ArrayList<>() : affiliations;
    }
}
