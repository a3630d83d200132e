package eu.fbk.slopat.mapping;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.XMLSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.slopat.data.Data;
import eu.fbk.slopat.data.DocumentMetadata;
import eu.fbk.slopat.data.ParseException;
import eu.fbk.slopat.data.ResolvedConcept;
import eu.fbk.slopat.data.StatementSet;
import eu.fbk.slopat.identity.IdentityAssigner;
import eu.fbk.slopat.resolve.SpanResolver;
import eu.fbk.slopat.vocabulary.ConceptLabels;
import eu.fbk.slopat.vocabulary.SLOP;

/**
 * Maps a document and its resolved concepts to a {@link StatementSet}.
 * <p>
 * The produced statements are organized in four consecutive blocks:
 * </p>
 * <ol>
 * <li><b>document block</b>: {@code rdf:type} statements for {@code slop:Document} and the
 * document type class, the type confidence, the optional title, the numeric / boolean features of
 * the document metadata and, if a stable name is supplied, the file path;</li>
 * <li><b>concept blocks</b>, one per concept in resolution order: {@code rdf:type}
 * {@code slop:Concept} and the ontology class mapped to the extraction label (if any), label,
 * extraction label, confidence, offsets, context and the {@code slop:discusses} edge from the
 * document;</li>
 * <li><b>co-occurrence block</b>: one {@code slop:coOccursWith} edge from the first to the second
 * concept of every pair whose start offsets are closer than the proximity window;</li>
 * <li><b>domain block</b>: one {@code slop:covers<Domain>} share per domain and, if some domain
 * covers more than half of the concepts, a {@code slop:primaryDomain} statement.</li>
 * </ol>
 * <p>
 * Terms are written in short {@code prefix:local} form and expanded through the namespace table
 * of the builder. A statement with a term that cannot be expanded (unknown prefix) is dropped and
 * logged, without affecting the rest of the set. Instances are immutable and thread-safe; use
 * {@link #builder()} to configure one.
 * </p>
 */
public final class TripleBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TripleBuilder.class);

    /** Default maximum distance between the start offsets of co-occurring concepts. */
    public static final int DEFAULT_PROXIMITY_WINDOW = 100;

    private static final double PRIMARY_DOMAIN_THRESHOLD = 0.5;

    private static final Pattern FEATURE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-]*");

    private final int proximityWindow;

    private final Map<String, String> classes;

    private final Map<String, String> namespaces;

    private final IdentityAssigner identityAssigner;

    private TripleBuilder(final Builder builder) {
        this.proximityWindow = builder.proximityWindow;
        this.classes = ImmutableMap.copyOf(builder.classes);
        this.namespaces = ImmutableMap.copyOf(builder.namespaces);
        this.identityAssigner = builder.identityAssigner;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    public int getProximityWindow() {
        return this.proximityWindow;
    }

    public IdentityAssigner getIdentityAssigner() {
        return this.identityAssigner;
    }

    /**
     * Builds the statements for a processed document.
     *
     * @param content
     *            the raw document content
     * @param concepts
     *            the resolved concepts, in resolution order
     * @param metadata
     *            the document classification
     * @param stableName
     *            an optional stable name (e.g., file path) for the document
     * @return the resulting statement set
     */
    public StatementSet build(final String content, final List<ResolvedConcept> concepts,
            final DocumentMetadata metadata, @Nullable final String stableName) {

        Preconditions.checkNotNull(content);
        Preconditions.checkNotNull(concepts);
        Preconditions.checkNotNull(metadata);

        final URI document = this.identityAssigner.documentID(content, stableName);
        final Collector collector = new Collector();

        addDocumentBlock(collector, document, metadata, stableName);
        final List<URI> conceptIDs = addConceptBlocks(collector, document, concepts);
        final int edges = addCoOccurrenceBlock(collector, concepts, conceptIDs);
        final int aggregates = addDomainBlock(collector, document, concepts);

        final StatementSet result = new StatementSet(collector.statements, this.namespaces,
                concepts.size(), edges + aggregates, document);
        LOGGER.debug("Built {} for {} concepts ({} statements dropped)", result,
                concepts.size(), collector.dropped);
        return result;
    }

    private void addDocumentBlock(final Collector collector, final URI document,
            final DocumentMetadata metadata, @Nullable final String stableName) {

        collector.add(document, "rdf:type", uri("slop:Document"));
        collector.add(document, "rdf:type", uri("slop:" + metadata.getType().getClassName()));
        collector.add(document, "slop:typeConfidence", typed(metadata.getConfidence()));
        if (metadata.getTitle() != null) {
            collector.add(document, "dct:title", plain(metadata.getTitle()));
        }
        for (final Map.Entry<String, Object> entry : metadata.getFeatures().entrySet()) {
            final Object value = entry.getValue();
            if (!FEATURE_NAME.matcher(entry.getKey()).matches()) {
                LOGGER.warn("Skipping feature with invalid name '{}'", entry.getKey());
            } else if (value instanceof Number || value instanceof Boolean) {
                collector.add(document, "slop:" + entry.getKey(), typed(value));
            }
        }
        if (stableName != null) {
            collector.add(document, "slop:filePath", plain(stableName));
        }
    }

    private List<URI> addConceptBlocks(final Collector collector, final URI document,
            final List<ResolvedConcept> concepts) {

        final List<URI> ids = Lists.newArrayListWithCapacity(concepts.size());
        for (final ResolvedConcept concept : concepts) {
            final URI id = this.identityAssigner.conceptID(concept.getText(), concept.getLabel());
            ids.add(id);
            collector.add(id, "rdf:type", uri("slop:Concept"));
            final String type = this.classes.get(concept.getLabel());
            if (type != null) {
                collector.add(id, "rdf:type", uri(type));
            }
            collector.add(id, "rdfs:label", plain(concept.getText()));
            collector.add(id, "slop:glinerLabel", plain(concept.getLabel()));
            collector.add(id, "slop:confidence", typed(concept.getConfidence()));
            collector.add(id, "slop:startPosition", typed(concept.getStart()));
            collector.add(id, "slop:endPosition", typed(concept.getEnd()));
            collector.add(id, "slop:context", plain(concept.getContext()));
            collector.add(document, "slop:discusses", id);
        }
        return ids;
    }

    private int addCoOccurrenceBlock(final Collector collector,
            final List<ResolvedConcept> concepts, final List<URI> ids) {

        int count = 0;
        for (int i = 0; i < concepts.size(); ++i) {
            for (int j = i + 1; j < concepts.size(); ++j) {
                final int distance = Math.abs(concepts.get(i).getStart()
                        - concepts.get(j).getStart());
                if (distance < this.proximityWindow && !ids.get(i).equals(ids.get(j))) {
                    if (collector.add(ids.get(i), "slop:coOccursWith", ids.get(j))) {
                        ++count;
                    }
                }
            }
        }
        return count;
    }

    private int addDomainBlock(final Collector collector, final URI document,
            final List<ResolvedConcept> concepts) {

        final Map<String, Integer> distribution = SpanResolver.domainDistribution(concepts);
        final int total = concepts.size();

        int count = 0;
        String primaryDomain = null;
        for (final Map.Entry<String, Integer> entry : distribution.entrySet()) {
            final String domain = entry.getKey();
            final double share = total == 0 ? 0.0 : (double) entry.getValue() / total;
            if (collector.add(document, "slop:covers" + SLOP.titleCase(domain), typed(share))) {
                ++count;
            }
            if (share > PRIMARY_DOMAIN_THRESHOLD) {
                primaryDomain = domain;
            }
        }
        if (primaryDomain != null
                && collector.add(document, "slop:primaryDomain", plain(primaryDomain))) {
            ++count;
        }
        return count;
    }

    private static Term uri(final String term) {
        return new Term(term, null, false);
    }

    private static Term plain(final String label) {
        return new Term(label, null, true);
    }

    private static Term typed(final Object value) {
        final String datatype;
        final String label;
        if (value instanceof Boolean) {
            datatype = "xsd:boolean";
            label = value.toString();
        } else if (value instanceof Double || value instanceof Float
                || value instanceof BigDecimal) {
            datatype = "xsd:float";
            label = value.toString();
        } else if (value instanceof Number) {
            datatype = "xsd:integer";
            label = value instanceof BigInteger ? value.toString() : Long
                    .toString(((Number) value).longValue());
        } else {
            throw new IllegalArgumentException("Unsupported typed value: " + value);
        }
        return new Term(label, datatype, true);
    }

    /** A statement object, still in short form. */
    private static final class Term {

        final String string;

        @Nullable
        final String datatype;

        final boolean literal;

        Term(final String string, @Nullable final String datatype, final boolean literal) {
            this.string = string;
            this.datatype = datatype;
            this.literal = literal;
        }

    }

    private final class Collector {

        final List<Statement> statements = Lists.newArrayList();

        int dropped = 0;

        boolean add(final Resource subject, final String predicate, final URI object) {
            return add(subject, predicate, null, object);
        }

        boolean add(final Resource subject, final String predicate, final Term object) {
            return add(subject, predicate, object, null);
        }

        private boolean add(final Resource subject, final String predicate,
                @Nullable final Term term, @Nullable final Value value) {
            final Map<String, String> ns = TripleBuilder.this.namespaces;
            final ValueFactory factory = Data.getValueFactory();
            try {
                final URI pred = Data.expand(predicate, ns);
                final Value obj;
                if (value != null) {
                    obj = value;
                } else if (!term.literal) {
                    obj = Data.expand(term.string, ns);
                } else if (term.datatype == null) {
                    obj = factory.createLiteral(term.string);
                } else {
                    obj = factory.createLiteral(term.string, Data.expand(term.datatype, ns));
                }
                this.statements.add(factory.createStatement(subject, pred, obj));
                return true;
            } catch (final ParseException ex) {
                ++this.dropped;
                LOGGER.warn("Dropping statement about {}: {}", subject, ex.getMessage());
                return false;
            }
        }

    }

    public static final class Builder {

        int proximityWindow = DEFAULT_PROXIMITY_WINDOW;

        Map<String, String> classes = ConceptLabels.CLASSES;

        Map<String, String> namespaces = Data.getNamespaceMap();

        IdentityAssigner identityAssigner = new IdentityAssigner();

        Builder() {
        }

        public Builder proximityWindow(final int proximityWindow) {
            Preconditions.checkArgument(proximityWindow >= 0, "Negative proximity window");
            this.proximityWindow = proximityWindow;
            return this;
        }

        public Builder classes(final Map<String, String> classes) {
            this.classes = Preconditions.checkNotNull(classes);
            return this;
        }

        public Builder namespaces(final Map<String, String> namespaces) {
            this.namespaces = Preconditions.checkNotNull(namespaces);
            return this;
        }

        /**
         * Adds namespace bindings to the ones already configured; existing prefixes are
         * rebound.
         */
        public Builder namespace(final String prefix, final String namespace) {
            final Map<String, String> map = Maps.newLinkedHashMap(this.namespaces);
            map.put(Preconditions.checkNotNull(prefix), Preconditions.checkNotNull(namespace));
            this.namespaces = map;
            return this;
        }

        public Builder identityAssigner(final IdentityAssigner identityAssigner) {
            this.identityAssigner = Preconditions.checkNotNull(identityAssigner);
            return this;
        }

        public TripleBuilder build() {
            return new TripleBuilder(this);
        }

    }

}
