package de.vzg.reposis.crossref.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Bibliographic reference of an article, as parsed from its reference list.
 */
public class Reference {

    private String id;

    private String publicationType;

    private String source;

    private List<ReferenceAuthor> authors = new ArrayList<>();

    private String volume;

    private String issue;

    private String fpage;

    private String elocationId;

    private String year;

    private Integer yearNumeric;

    private String articleTitle;

    private String dataTitle;

    private String doi;

    private String isbn;

    private String accession;

    private String pmid;

    private String uri;

    private String dateInCitation;

    private String publisherLoc;

    private String publisherName;

    private String version;

    private String patent;

    private String confName;

    public Reference() {
    }

    public Reference(String publicationType) {
        this.publicationType = publicationType;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPublicationType() {
        return publicationType;
    }

    public void setPublicationType(String publicationType) {
        this.publicationType = publicationType;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public List<ReferenceAuthor> getAuthors() {
        return authors;
    }

    public void setAuthors(List<ReferenceAuthor> authors) {
        this.authors = authors == null ? new ArrayList<>() : authors;
    }

    public String getVolume() {
        return volume;
    }

    public void setVolume(String volume) {
        this.volume = volume;
    }

    public String getIssue() {
        return issue;
    }

    public void setIssue(String issue) {
        this.issue = issue;
    }

    public String getFpage() {
        return fpage;
    }

    public void setFpage(String fpage) {
        this.fpage = fpage;
    }

    public String getElocationId() {
        return elocationId;
    }

    public void setElocationId(String elocationId) {
        this.elocationId = elocationId;
    }

    public String getYear() {
        return year;
    }

    public void setYear(String year) {
        this.year = year;
    }

    public Integer getYearNumeric() {
        return yearNumeric;
    }

    public void setYearNumeric(Integer yearNumeric) {
        this.yearNumeric = yearNumeric;
    }

    public String getArticleTitle() {
        return articleTitle;
    }

    public void setArticleTitle(String articleTitle) {
        this.articleTitle = articleTitle;
    }

    public String getDataTitle() {
        return dataTitle;
    }

    public void setDataTitle(String dataTitle) {
        this.dataTitle = dataTitle;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public String getIsbn() {
        return isbn;
    }

    public void setIsbn(String isbn) {
        this.isbn = isbn;
    }

    public String getAccession() {
        return accession;
    }

    public void setAccession(String accession) {
        this.accession = accession;
    }

    public String getPmid() {
        return pmid;
    }

    public void setPmid(String pmid) {
        this.pmid = pmid;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public String getDateInCitation() {
        return dateInCitation;
    }

    public void setDateInCitation(String dateInCitation) {
        this.dateInCitation = dateInCitation;
    }

    public String getPublisherLoc() {
        return publisherLoc;
    }

    public void setPublisherLoc(String publisherLoc) {
        this.publisherLoc = publisherLoc;
    }

    public String getPublisherName() {
        return publisherName;
    }

    public void setPublisherName(String publisherName) {
        this.publisherName = publisherName;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getPatent() {
        return patent;
    }

    public void setPatent(String patent) {
        this.patent = patent;
    }

    public String getConfName() {
        return confName;
    }

    public void setConfName(String confName) {
        this.confName = confName;
    }

    @Override
    public String toString() {
        return "Reference{" +
               "id='" + id + '\'' +
               ", publicationType='" + publicationType + '\'' +
               ", doi='" + doi + '\'' +
               '}';
    }
}
