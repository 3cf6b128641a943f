package de.vzg.reposis.crossref.config;

import java.util.ArrayList;
import java.util.List;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deposit options, bound from the {@code crossref} prefix.
 * <ul>
 *   <li>{@code schema-version} - target Crossref schema, e.g. 4.4.1</li>
 *   <li>{@code pub-date-types} - article date types tried in order for the publication date</li>
 *   <li>{@code doi-pattern}, {@code component-doi-pattern}, {@code text-mining-pdf-pattern},
 *   {@code text-mining-xml-pattern} - resource URL templates with {@code {name}} placeholders</li>
 *   <li>{@code jats-abstract} - convert abstract markup to JATS instead of stripping it</li>
 *   <li>{@code face-markup} - keep face markup (i, b, sup, ...) in titles and citations</li>
 *   <li>{@code elocation-id} - emit the article elocation id as article number</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "crossref")
public class CrossrefProperties {

    private static final Logger log = LoggerFactory.getLogger(CrossrefProperties.class);

    public static final String DEFAULT_SCHEMA_VERSION = "4.4.1";

    private String batchFilePrefix = "crossref-";

    private String generator = "reposis-crossref";

    private String depositorName = "";

    private String emailAddress = "";

    private String registrant = "";

    private String schemaVersion = DEFAULT_SCHEMA_VERSION;

    private List<String> pubDateTypes = new ArrayList<>(List.of("pub", "posted_date"));

    private Integer yearOfFirstVolume;

    private String referenceDistributionOpts;

    private String doiPattern = "";

    private String componentDoiPattern = "";

    private String textMiningPdfPattern = "";

    private String textMiningXmlPattern = "";

    private boolean elifeStyleComponentDoi = false;

    private String componentLicenseRef = "";

    private List<String> accessIndicatorsAppliesTo = new ArrayList<>();

    private List<String> archiveLocations = new ArrayList<>();

    private boolean jatsAbstract = true;

    private boolean faceMarkup = false;

    private boolean elocationId = false;

    private List<String> contribTypes = new ArrayList<>(List.of("author"));

    private boolean addComment = true;

    private String outputDir = "tmp";

    @PostConstruct
    void validate() {
        if (schemaVersion == null || schemaVersion.isBlank()) {
            log.warn("schema-version is empty, using {}", DEFAULT_SCHEMA_VERSION);
            schemaVersion = DEFAULT_SCHEMA_VERSION;
        }
        if (yearOfFirstVolume != null && yearOfFirstVolume <= 0) {
            log.warn("year-of-first-volume must be positive (got {}), volumes will not be computed", yearOfFirstVolume);
            yearOfFirstVolume = null;
        }
    }

    public String getBatchFilePrefix() {
        return batchFilePrefix;
    }

    public void setBatchFilePrefix(String batchFilePrefix) {
        this.batchFilePrefix = batchFilePrefix;
    }

    public String getGenerator() {
        return generator;
    }

    public void setGenerator(String generator) {
        this.generator = generator;
    }

    public String getDepositorName() {
        return depositorName;
    }

    public void setDepositorName(String depositorName) {
        this.depositorName = depositorName;
    }

    public String getEmailAddress() {
        return emailAddress;
    }

    public void setEmailAddress(String emailAddress) {
        this.emailAddress = emailAddress;
    }

    public String getRegistrant() {
        return registrant;
    }

    public void setRegistrant(String registrant) {
        this.registrant = registrant;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public List<String> getPubDateTypes() {
        return pubDateTypes;
    }

    public void setPubDateTypes(List<String> pubDateTypes) {
        this.pubDateTypes = pubDateTypes == null ? new ArrayList<>() : pubDateTypes;
    }

    public Integer getYearOfFirstVolume() {
        return yearOfFirstVolume;
    }

    public void setYearOfFirstVolume(Integer yearOfFirstVolume) {
        this.yearOfFirstVolume = yearOfFirstVolume;
    }

    public String getReferenceDistributionOpts() {
        return referenceDistributionOpts;
    }

    public void setReferenceDistributionOpts(String referenceDistributionOpts) {
        this.referenceDistributionOpts = referenceDistributionOpts;
    }

    public String getDoiPattern() {
        return doiPattern;
    }

    public void setDoiPattern(String doiPattern) {
        this.doiPattern = doiPattern;
    }

    public String getComponentDoiPattern() {
        return componentDoiPattern;
    }

    public void setComponentDoiPattern(String componentDoiPattern) {
        this.componentDoiPattern = componentDoiPattern;
    }

    public String getTextMiningPdfPattern() {
        return textMiningPdfPattern;
    }

    public void setTextMiningPdfPattern(String textMiningPdfPattern) {
        this.textMiningPdfPattern = textMiningPdfPattern;
    }

    public String getTextMiningXmlPattern() {
        return textMiningXmlPattern;
    }

    public void setTextMiningXmlPattern(String textMiningXmlPattern) {
        this.textMiningXmlPattern = textMiningXmlPattern;
    }

    public boolean isElifeStyleComponentDoi() {
        return elifeStyleComponentDoi;
    }

    public void setElifeStyleComponentDoi(boolean elifeStyleComponentDoi) {
        this.elifeStyleComponentDoi = elifeStyleComponentDoi;
    }

    public String getComponentLicenseRef() {
        return componentLicenseRef;
    }

    public void setComponentLicenseRef(String componentLicenseRef) {
        this.componentLicenseRef = componentLicenseRef;
    }

    public List<String> getAccessIndicatorsAppliesTo() {
        return accessIndicatorsAppliesTo;
    }

    public void setAccessIndicatorsAppliesTo(List<String> accessIndicatorsAppliesTo) {
        this.accessIndicatorsAppliesTo = accessIndicatorsAppliesTo == null ? new ArrayList<>() : accessIndicatorsAppliesTo;
    }

    public List<String> getArchiveLocations() {
        return archiveLocations;
    }

    public void setArchiveLocations(List<String> archiveLocations) {
        this.archiveLocations = archiveLocations == null ? new ArrayList<>() : archiveLocations;
    }

    public boolean isJatsAbstract() {
        return jatsAbstract;
    }

    public void setJatsAbstract(boolean jatsAbstract) {
        this.jatsAbstract = jatsAbstract;
    }

    public boolean isFaceMarkup() {
        return faceMarkup;
    }

    public void setFaceMarkup(boolean faceMarkup) {
        this.faceMarkup = faceMarkup;
    }

    public boolean isElocationId() {
        return elocationId;
    }

    public void setElocationId(boolean elocationId) {
        this.elocationId = elocationId;
    }

    public List<String> getContribTypes() {
        return contribTypes;
    }

    public void setContribTypes(List<String> contribTypes) {
        this.contribTypes = contribTypes == null ? new ArrayList<>() : contribTypes;
    }

    public boolean isAddComment() {
        return addComment;
    }

    public void setAddComment(boolean addComment) {
        this.addComment = addComment;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }
}
