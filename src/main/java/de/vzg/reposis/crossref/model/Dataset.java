package de.vzg.reposis.crossref.model;

import java.util.Objects;

public class Dataset {

    private String title;

    private DatasetType datasetType;

    private String doi;

    private String accessionId;

    private String uri;

    public Dataset() {
    }

    public Dataset(String title, DatasetType datasetType) {
        this.title = title;
        this.datasetType = datasetType;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public DatasetType getDatasetType() {
        return datasetType;
    }

    public void setDatasetType(DatasetType datasetType) {
        this.datasetType = datasetType;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public String getAccessionId() {
        return accessionId;
    }

    public void setAccessionId(String accessionId) {
        this.accessionId = accessionId;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dataset dataset = (Dataset) o;
        return Objects.equals(title, dataset.title) && datasetType == dataset.datasetType
            && Objects.equals(doi, dataset.doi) && Objects.equals(accessionId, dataset.accessionId)
            && Objects.equals(uri, dataset.uri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, datasetType, doi, accessionId, uri);
    }

    @Override
    public String toString() {
        return "Dataset{" +
               "title='" + title + '\'' +
               ", datasetType=" + datasetType +
               ", doi='" + doi + '\'' +
               ", accessionId='" + accessionId + '\'' +
               ", uri='" + uri + '\'' +
               '}';
    }
}
