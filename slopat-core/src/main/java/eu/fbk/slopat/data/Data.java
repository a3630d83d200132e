package eu.fbk.slopat.data;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.DCTERMS;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.slopat.vocabulary.SLOP;

/**
 * Helper services for working with slop.at statement data.
 * <p>
 * The following services are offered:
 * </p>
 * <ul>
 * <li><b>Value factory</b>. Method {@link #getValueFactory()} returns the singleton
 * {@code ValueFactory} used to create {@code URI}s, {@code Literal}s and {@code Statement}s.</li>
 * <li><b>Prefix-to-namespace mappings</b>. Method {@link #getNamespaceMap()} returns the default
 * (ordered) prefix-to-namespace map used by the ontology mapper and by serialization; method
 * {@link #namespaceToPrefix(String, Map)} performs a reverse lookup and
 * {@link #prefixFor(String, Map)} finds the longest namespace matching a URI.</li>
 * <li><b>Short-form expansion</b>. Method {@link #expand(String, Map)} turns a short-form
 * {@code prefix:local} identifier or a full URI string into a {@code URI}, failing with a
 * {@link ParseException} for unknown prefixes.</li>
 * <li><b>String rendering</b>. Method {@link #toString(Object, Map)} generates a compact string
 * representation of values and statements, mainly for logging.</li>
 * </ul>
 */
public final class Data {

    private static final Map<String, String> NAMESPACES = ImmutableMap
            .<String, String>builder() //
            .put(SLOP.PREFIX, SLOP.NAMESPACE) //
            .put("rdf", RDF.NAMESPACE) //
            .put("rdfs", RDFS.NAMESPACE) //
            .put("owl", OWL.NAMESPACE) //
            .put("xsd", XMLSchema.NAMESPACE) //
            .put("foaf", "http://xmlns.com/foaf/0.1/") //
            .put("dct", DCTERMS.NAMESPACE) //
            .put("cso", "http://cso.kmi.open.ac.uk/") //
            .put("msc", "http://msc2010.org/") //
            .put("schema", "http://schema.org/") //
            .build();

    /**
     * Returns the singleton {@code ValueFactory} for creating slop.at values and statements.
     *
     * @return the value factory
     */
    public static ValueFactory getValueFactory() {
        return ValueFactoryImpl.getInstance();
    }

    /**
     * Returns the default, immutable prefix-to-namespace map. Iteration order is the
     * declaration order (slop, rdf, rdfs, owl, xsd, foaf, dct, cso, msc, schema).
     *
     * @return the default namespace map
     */
    public static Map<String, String> getNamespaceMap() {
        return NAMESPACES;
    }

    /**
     * Returns the prefix bound to the namespace specified in the supplied map, if any.
     *
     * @param namespace
     *            the namespace to look up
     * @param namespaces
     *            the prefix-to-namespace map
     * @return the prefix, or null if the namespace is not bound
     */
    @Nullable
    public static String namespaceToPrefix(final String namespace,
            final Map<String, String> namespaces) {
        for (final Map.Entry<String, String> entry : namespaces.entrySet()) {
            if (entry.getValue().equals(namespace)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Returns the prefix whose namespace is the longest prefix of the supplied URI string.
     *
     * @param uri
     *            the URI string
     * @param namespaces
     *            the prefix-to-namespace map
     * @return the matching prefix, or null if no namespace matches
     */
    @Nullable
    public static String prefixFor(final String uri, final Map<String, String> namespaces) {
        String prefix = null;
        int length = -1;
        for (final Map.Entry<String, String> entry : namespaces.entrySet()) {
            final String namespace = entry.getValue();
            if (namespace.length() > length && uri.startsWith(namespace)) {
                prefix = entry.getKey();
                length = namespace.length();
            }
        }
        return prefix;
    }

    /**
     * Expands a short-form ({@code prefix:local}) or full URI string into a {@code URI}. A string
     * whose part before the first colon is a bound prefix is expanded using that prefix; a string
     * containing {@code ://} or enclosed in angle brackets is taken as a full URI; anything else
     * is rejected.
     *
     * @param term
     *            the term to expand
     * @param namespaces
     *            the prefix-to-namespace map
     * @return the expanded URI
     * @throws ParseException
     *             if the term has an unknown prefix or does not denote an absolute URI
     */
    public static URI expand(final String term, final Map<String, String> namespaces)
            throws ParseException {
        Preconditions.checkNotNull(term);
        final String uri;
        if (term.length() > 2 && term.charAt(0) == '<' && term.charAt(term.length() - 1) == '>') {
            uri = term.substring(1, term.length() - 1);
        } else {
            final int index = term.indexOf(':');
            if (index < 0) {
                throw new ParseException(term, "Not a URI or prefixed name");
            }
            final String namespace = namespaces.get(term.substring(0, index));
            if (namespace != null) {
                uri = namespace + term.substring(index + 1);
            } else if (term.startsWith("://", index)) {
                uri = term;
            } else {
                throw new ParseException(term, "Unknown namespace prefix '"
                        + term.substring(0, index) + "'");
            }
        }
        try {
            return getValueFactory().createURI(uri);
        } catch (final IllegalArgumentException ex) {
            throw new ParseException(term, "Not an absolute URI: " + uri, ex);
        }
    }

    /**
     * Returns a compact string representation of a {@code Value} or {@code Statement}, using the
     * supplied prefix-to-namespace mappings where possible.
     *
     * @param object
     *            the value or statement, possibly null
     * @param namespaces
     *            the optional prefix-to-namespace mappings
     * @return the produced string, or null if a null object was passed as input
     */
    @Nullable
    public static String toString(@Nullable final Object object,
            @Nullable final Map<String, String> namespaces) {
        if (object instanceof Statement) {
            final Statement statement = (Statement) object;
            final StringBuilder builder = new StringBuilder();
            builder.append('(');
            toString(statement.getSubject(), namespaces, builder);
            builder.append(',').append(' ');
            toString(statement.getPredicate(), namespaces, builder);
            builder.append(',').append(' ');
            toString(statement.getObject(), namespaces, builder);
            builder.append(')');
            return builder.toString();
        } else if (object instanceof Value) {
            final StringBuilder builder = new StringBuilder();
            toString((Value) object, namespaces, builder);
            return builder.toString();
        }
        return object == null ? null : object.toString();
    }

    private static void toString(final Value value,
            @Nullable final Map<String, String> namespaces, final StringBuilder builder) {

        if (value instanceof URI) {
            final String string = value.stringValue();
            final String prefix = namespaces == null ? null : prefixFor(string, namespaces);
            if (prefix != null) {
                builder.append(prefix).append(':')
                        .append(string.substring(namespaces.get(prefix).length()));
            } else {
                builder.append('<').append(string).append('>');
            }

        } else if (value instanceof BNode) {
            builder.append('_').append(':').append(((BNode) value).getID());

        } else {
            final Literal literal = (Literal) value;
            builder.append('\"').append(literal.getLabel()).append('\"');
            final URI datatype = literal.getDatatype();
            if (datatype != null) {
                builder.append('^').append('^');
                toString(datatype, namespaces, builder);
            } else if (literal.getLanguage() != null) {
                builder.append('@').append(literal.getLanguage());
            }
        }
    }

    private Data() {
    }

}
