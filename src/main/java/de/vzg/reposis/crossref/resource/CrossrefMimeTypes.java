package de.vzg.reposis.crossref.resource;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Maps component mime types to values allowed by the Crossref {@code format} element. Bare
 * file extensions and subtypes (e.g. {@code jpg}, {@code tif}) are accepted as aliases.
 */
@Component
public class CrossrefMimeTypes {

    private static final Set<String> ALLOWED = Set.of(
        "application/pdf", "application/xml", "application/zip", "application/msword",
        "application/vnd.ms-excel", "application/vnd.ms-powerpoint", "application/postscript",
        "text/plain", "text/html", "text/xml", "text/csv", "text/tab-separated-values", "text/rtf",
        "image/jpeg", "image/png", "image/gif", "image/tiff", "image/svg+xml",
        "video/mp4", "video/mpeg", "video/quicktime", "video/x-msvideo", "video/webm",
        "audio/mpeg", "audio/mp4", "audio/x-wav", "audio/ogg");

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("pdf", "application/pdf"),
        Map.entry("xml", "application/xml"),
        Map.entry("zip", "application/zip"),
        Map.entry("doc", "application/msword"),
        Map.entry("xls", "application/vnd.ms-excel"),
        Map.entry("ppt", "application/vnd.ms-powerpoint"),
        Map.entry("txt", "text/plain"),
        Map.entry("csv", "text/csv"),
        Map.entry("tsv", "text/tab-separated-values"),
        Map.entry("html", "text/html"),
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("png", "image/png"),
        Map.entry("gif", "image/gif"),
        Map.entry("tif", "image/tiff"),
        Map.entry("tiff", "image/tiff"),
        Map.entry("svg", "image/svg+xml"),
        Map.entry("mp4", "video/mp4"),
        Map.entry("mpeg", "video/mpeg"),
        Map.entry("mov", "video/quicktime"),
        Map.entry("quicktime", "video/quicktime"),
        Map.entry("avi", "video/x-msvideo"),
        Map.entry("webm", "video/webm"),
        Map.entry("mp3", "audio/mpeg"),
        Map.entry("wav", "audio/x-wav"));

    /**
     * @return the Crossref mime type, or empty if {@code mimeType} is not recognized
     */
    public Optional<String> crossrefMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return Optional.empty();
        }
        String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        if (ALLOWED.contains(normalized)) {
            return Optional.of(normalized);
        }
        // "image/jpg" and similar: resolve by subtype
        String subtype = normalized.substring(normalized.indexOf('/') + 1);
        return Optional.ofNullable(ALIASES.get(subtype));
    }
}
