package de.vzg.reposis.crossref.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Sub-part of an article (figure, table, supplementary file) that may be registered with its own
 * DOI.
 */
public class Component {

    private String id;

    private String type;

    private String title;

    private String subtitle;

    private String mimeType;

    private String doi;

    private List<ComponentPermission> permissions = new ArrayList<>();

    public Component() {
    }

    public Component(String id, String type, String title) {
        this.id = id;
        this.type = type;
        this.title = title;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public void setSubtitle(String subtitle) {
        this.subtitle = subtitle;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public List<ComponentPermission> getPermissions() {
        return permissions;
    }

    public void setPermissions(List<ComponentPermission> permissions) {
        this.permissions = permissions == null ? new ArrayList<>() : permissions;
    }

    @Override
    public String toString() {
        return "Component{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", doi='" + doi + '\'' +
               '}';
    }
}
