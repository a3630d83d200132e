package eu.fbk.slopat.pipeline;

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.openrdf.model.URI;

import eu.fbk.slopat.data.DocumentMetadata;
import eu.fbk.slopat.data.ResolvedConcept;
import eu.fbk.slopat.data.Span;
import eu.fbk.slopat.data.StatementSet;

/**
 * The outcome of processing a single document, with its intermediate results.
 */
public final class ProcessingResult {

    private final URI documentID;

    private final DocumentMetadata metadata;

    private final List<Span> spans;

    private final List<ResolvedConcept> concepts;

    private final Map<String, Integer> domainDistribution;

    private final double conceptDensity;

    private final double averageConfidence;

    private final StatementSet statements;

    ProcessingResult(final URI documentID, final DocumentMetadata metadata,
            final List<Span> spans, final List<ResolvedConcept> concepts,
            final Map<String, Integer> domainDistribution, final double conceptDensity,
            final double averageConfidence, final StatementSet statements) {
        this.documentID = documentID;
        this.metadata = metadata;
        this.spans = ImmutableList.copyOf(spans);
        this.concepts = ImmutableList.copyOf(concepts);
        this.domainDistribution = ImmutableMap.copyOf(domainDistribution);
        this.conceptDensity = conceptDensity;
        this.averageConfidence = averageConfidence;
        this.statements = statements;
    }

    public URI getDocumentID() {
        return this.documentID;
    }

    public DocumentMetadata getMetadata() {
        return this.metadata;
    }

    /**
     * Returns the well-formed extracted spans, before overlap resolution.
     */
    public List<Span> getSpans() {
        return this.spans;
    }

    public List<ResolvedConcept> getConcepts() {
        return this.concepts;
    }

    public Map<String, Integer> getDomainDistribution() {
        return this.domainDistribution;
    }

    /**
     * Returns the number of concepts per whitespace-separated token of the document, 0 for
     * documents without tokens.
     */
    public double getConceptDensity() {
        return this.conceptDensity;
    }

    /**
     * Returns the mean confidence of the resolved concepts, 0 if there are none.
     */
    public double getAverageConfidence() {
        return this.averageConfidence;
    }

    public StatementSet getStatements() {
        return this.statements;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("document", this.documentID)
                .add("type", this.metadata.getType()).add("spans", this.spans.size())
                .add("concepts", this.concepts.size()).add("statements", this.statements.size())
                .toString();
    }

}
