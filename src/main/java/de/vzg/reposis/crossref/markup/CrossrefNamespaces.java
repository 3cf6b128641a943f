package de.vzg.reposis.crossref.markup;

import java.util.List;

import org.jdom2.Namespace;

/**
 * Namespaces used in Crossref deposit documents.
 */
public final class CrossrefNamespaces {

    public static final String LEGACY_SCHEMA_VERSION = "4.3.5";

    public static final Namespace XSI = Namespace.getNamespace("xsi", "http://www.w3.org/2001/XMLSchema-instance");
    public static final Namespace FUNDREF = Namespace.getNamespace("fr", "http://www.crossref.org/fundref.xsd");
    public static final Namespace ACCESS_INDICATORS
        = Namespace.getNamespace("ai", "http://www.crossref.org/AccessIndicators.xsd");
    public static final Namespace CLINICAL_TRIALS
        = Namespace.getNamespace("ct", "http://www.crossref.org/clinicaltrials.xsd");
    public static final Namespace RELATIONS = Namespace.getNamespace("rel", "http://www.crossref.org/relations.xsd");
    public static final Namespace MATHML = Namespace.getNamespace("mml", "http://www.w3.org/1998/Math/MathML");
    public static final Namespace JATS = Namespace.getNamespace("jats", "http://www.ncbi.nlm.nih.gov/JATS1");
    public static final Namespace XLINK = Namespace.getNamespace("xlink", "http://www.w3.org/1999/xlink");

    /**
     * Prefixed namespaces a re-parsed markup fragment may use.
     */
    public static final List<Namespace> FRAGMENT_NAMESPACES = List.of(JATS, MATHML, XLINK);

    private CrossrefNamespaces() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static Namespace crossref(String schemaVersion) {
        return Namespace.getNamespace(crossrefUri(schemaVersion));
    }

    public static String crossrefUri(String schemaVersion) {
        return "http://www.crossref.org/schema/" + schemaVersion;
    }

    public static String schemaLocation(String schemaVersion) {
        return crossrefUri(schemaVersion) + " http://www.crossref.org/schemas/crossref" + schemaVersion + ".xsd";
    }

    /**
     * The clinical trials and relations namespaces do not exist in the oldest supported schema.
     */
    public static boolean supportsRelations(String schemaVersion) {
        return !LEGACY_SCHEMA_VERSION.equals(schemaVersion);
    }
}
