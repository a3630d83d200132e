package eu.fbk.slopat.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the slop.at ontology.
 * <p>
 * Documents and concepts are minted under the {@link #DOCUMENT_NAMESPACE} and
 * {@link #CONCEPT_NAMESPACE} sub-namespaces; domain coverage predicates are created on demand via
 * {@link #covers(String)}.
 * </p>
 */
public final class SLOP {

    /** Recommended prefix for the vocabulary namespace: "slop". */
    public static final String PREFIX = "slop";

    /** Vocabulary namespace: "http://slop.at/ontology#". */
    public static final String NAMESPACE = "http://slop.at/ontology#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    /** Namespace of document identifiers. */
    public static final String DOCUMENT_NAMESPACE = NAMESPACE + "document/";

    /** Namespace of concept identifiers. */
    public static final String CONCEPT_NAMESPACE = NAMESPACE + "concept/";

    // CLASSES

    /** Class slop:Document. */
    public static final URI DOCUMENT = createURI("Document");

    /** Class slop:Concept. */
    public static final URI CONCEPT = createURI("Concept");

    // OBJECT PROPERTIES

    /** Property slop:discusses. */
    public static final URI DISCUSSES = createURI("discusses");

    /** Property slop:coOccursWith. */
    public static final URI CO_OCCURS_WITH = createURI("coOccursWith");

    // DATATYPE PROPERTIES

    /** Property slop:typeConfidence. */
    public static final URI TYPE_CONFIDENCE = createURI("typeConfidence");

    /** Property slop:confidence. */
    public static final URI CONFIDENCE = createURI("confidence");

    /** Property slop:glinerLabel. */
    public static final URI GLINER_LABEL = createURI("glinerLabel");

    /** Property slop:context. */
    public static final URI CONTEXT = createURI("context");

    /** Property slop:startPosition. */
    public static final URI START_POSITION = createURI("startPosition");

    /** Property slop:endPosition. */
    public static final URI END_POSITION = createURI("endPosition");

    /** Property slop:primaryDomain. */
    public static final URI PRIMARY_DOMAIN = createURI("primaryDomain");

    /** Property slop:filePath. */
    public static final URI FILE_PATH = createURI("filePath");

    // HELPER METHODS

    /**
     * Returns the slop:covers&lt;Domain&gt; property for the domain specified.
     *
     * @param domain
     *            the domain name, e.g. "cs"
     * @return the coverage property, e.g. slop:coversCs
     */
    public static URI covers(final String domain) {
        return createURI("covers" + titleCase(domain));
    }

    /**
     * Title-cases the supplied string: the first letter of every run of letters is upper-cased
     * and the remaining letters lower-cased.
     *
     * @param string
     *            the string to convert
     * @return the converted string
     */
    public static String titleCase(final String string) {
        final StringBuilder builder = new StringBuilder(string.length());
        boolean previousLetter = false;
        for (int i = 0; i < string.length(); ++i) {
            final char c = string.charAt(i);
            if (Character.isLetter(c)) {
                builder.append(previousLetter ? Character.toLowerCase(c) : Character
                        .toUpperCase(c));
                previousLetter = true;
            } else {
                builder.append(c);
                previousLetter = false;
            }
        }
        return builder.toString();
    }

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private SLOP() {
    }

}
