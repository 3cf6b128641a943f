package de.vzg.reposis.crossref.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed article metadata. Instances are built upstream and only read while a deposit is generated.
 * Markup fields ({@link #getTitle()}, {@link #getAbstractText()}, {@link #getDigest()}) hold raw JATS
 * fragments.
 */
public class Article {

    private String doi;

    private String manuscript;

    private Integer version;

    private String journalTitle;

    private String journalIssn;

    private String volume;

    private String elocationId;

    private String title;

    private String abstractText;

    private String digest;

    private License license;

    private List<SelfUri> selfUris = new ArrayList<>();

    private List<Dataset> datasets = new ArrayList<>();

    private List<Reference> references = new ArrayList<>();

    private List<Component> components = new ArrayList<>();

    private List<Contributor> contributors = new ArrayList<>();

    private List<FundingAward> fundingAwards = new ArrayList<>();

    private Map<String, LocalDate> dates = new LinkedHashMap<>();

    public Article() {
    }

    public Article(String doi, String manuscript) {
        this.doi = doi;
        this.manuscript = manuscript;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public String getManuscript() {
        return manuscript;
    }

    public void setManuscript(String manuscript) {
        this.manuscript = manuscript;
    }

    public Integer getVersion() {
        return version;
    }

    public void setVersion(Integer version) {
        this.version = version;
    }

    public String getJournalTitle() {
        return journalTitle;
    }

    public void setJournalTitle(String journalTitle) {
        this.journalTitle = journalTitle;
    }

    public String getJournalIssn() {
        return journalIssn;
    }

    public void setJournalIssn(String journalIssn) {
        this.journalIssn = journalIssn;
    }

    public String getVolume() {
        return volume;
    }

    public void setVolume(String volume) {
        this.volume = volume;
    }

    public String getElocationId() {
        return elocationId;
    }

    public void setElocationId(String elocationId) {
        this.elocationId = elocationId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public void setAbstractText(String abstractText) {
        this.abstractText = abstractText;
    }

    public String getDigest() {
        return digest;
    }

    public void setDigest(String digest) {
        this.digest = digest;
    }

    public License getLicense() {
        return license;
    }

    public void setLicense(License license) {
        this.license = license;
    }

    public List<SelfUri> getSelfUris() {
        return selfUris;
    }

    public void setSelfUris(List<SelfUri> selfUris) {
        this.selfUris = selfUris == null ? new ArrayList<>() : selfUris;
    }

    public List<Dataset> getDatasets() {
        return datasets;
    }

    public void setDatasets(List<Dataset> datasets) {
        this.datasets = datasets == null ? new ArrayList<>() : datasets;
    }

    public List<Reference> getReferences() {
        return references;
    }

    public void setReferences(List<Reference> references) {
        this.references = references == null ? new ArrayList<>() : references;
    }

    public List<Component> getComponents() {
        return components;
    }

    public void setComponents(List<Component> components) {
        this.components = components == null ? new ArrayList<>() : components;
    }

    public List<Contributor> getContributors() {
        return contributors;
    }

    public void setContributors(List<Contributor> contributors) {
        this.contributors = contributors == null ? new ArrayList<>() : contributors;
    }

    public List<FundingAward> getFundingAwards() {
        return fundingAwards;
    }

    public void setFundingAwards(List<FundingAward> fundingAwards) {
        this.fundingAwards = fundingAwards == null ? new ArrayList<>() : fundingAwards;
    }

    public Map<String, LocalDate> getDates() {
        return dates;
    }

    public void setDates(Map<String, LocalDate> dates) {
        this.dates = dates == null ? new LinkedHashMap<>() : dates;
    }

    public LocalDate getDate(String dateType) {
        return dates.get(dateType);
    }

    public void addDate(String dateType, LocalDate date) {
        dates.put(dateType, date);
    }

    /**
     * @param contentType the content type to look for, e.g. "pdf"
     * @return the first self uri with the given content type, or null
     */
    public SelfUri getSelfUri(String contentType) {
        return selfUris.stream()
            .filter(selfUri -> contentType.equals(selfUri.contentType()))
            .findFirst()
            .orElse(null);
    }

    public boolean hasLicense() {
        return license != null && license.isUsable();
    }

    @Override
    public String toString() {
        return "Article{" +
               "doi='" + doi + '\'' +
               ", manuscript='" + manuscript + '\'' +
               '}';
    }
}
