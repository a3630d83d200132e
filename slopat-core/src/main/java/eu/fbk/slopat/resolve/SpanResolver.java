package eu.fbk.slopat.resolve;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.slopat.data.ResolvedConcept;
import eu.fbk.slopat.data.Span;
import eu.fbk.slopat.vocabulary.ConceptLabels;

/**
 * Resolves overlapping extracted spans into a set of non-overlapping concepts.
 * <p>
 * Resolution sorts spans by start offset (stable, so ties keep the input order) and walks them
 * maintaining a list of accepted spans. Two spans overlap iff their half-open intervals intersect.
 * A candidate that overlaps no accepted span is accepted. A candidate that overlaps one or more
 * accepted spans replaces all of them if its confidence is strictly higher than each of theirs,
 * and is discarded otherwise: on a confidence tie the span accepted first wins. The result never
 * contains two overlapping spans, and each surviving span is tagged with the domain its label
 * maps to in the domain table supplied at construction time ({@link ConceptLabels#OTHER_DOMAIN}
 * for unknown labels).
 * </p>
 * <p>
 * The quadratic walk is adequate for the span counts of a single document (hundreds). Instances
 * are immutable and thread-safe.
 * </p>
 */
public final class SpanResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpanResolver.class);

    private static final Comparator<Span> START_ORDER = new Comparator<Span>() {

        @Override
        public int compare(final Span first, final Span second) {
            return first.getStart() < second.getStart() ? -1
                    : first.getStart() == second.getStart() ? 0 : 1;
        }

    };

    private final Map<String, String> domains;

    private final String defaultDomain;

    /**
     * Creates a resolver with the label to domain table and default domain specified.
     *
     * @param domains
     *            the label to domain table
     * @param defaultDomain
     *            the domain of labels missing from the table
     */
    public SpanResolver(final Map<String, String> domains, final String defaultDomain) {
        this.domains = ImmutableMap.copyOf(domains);
        this.defaultDomain = Preconditions.checkNotNull(defaultDomain);
    }

    /**
     * Creates a resolver using the default {@link ConceptLabels#DOMAINS} table.
     */
    public SpanResolver() {
        this(ConceptLabels.DOMAINS, ConceptLabels.OTHER_DOMAIN);
    }

    /**
     * Drops the spans that do not fit the document they were extracted from: spans with a
     * negative start, an end before their start, an end beyond the document length or a NaN
     * confidence. Every dropped span is logged.
     *
     * @param spans
     *            the spans returned by the extraction model
     * @param documentLength
     *            the length of the document the spans refer to
     * @return the well-formed spans, in input order
     */
    public List<Span> sanitize(final Iterable<? extends Span> spans, final int documentLength) {
        final List<Span> result = Lists.newArrayList();
        for (final Span span : spans) {
            if (span == null) {
                LOGGER.warn("Dropping null span");
            } else if (span.getStart() < 0 || span.getStart() > span.getEnd()
                    || span.getEnd() > documentLength) {
                LOGGER.warn("Dropping span {} with offsets outside document bounds [0,{}]",
                        span, documentLength);
            } else if (Double.isNaN(span.getConfidence())) {
                LOGGER.warn("Dropping span {} with undefined confidence", span);
            } else {
                result.add(span);
            }
        }
        return result;
    }

    /**
     * Resolves overlaps among the supplied spans.
     *
     * @param spans
     *            the spans to resolve, in any order
     * @return the surviving spans, tagged with their domain, in start offset order
     */
    public List<ResolvedConcept> resolve(final Iterable<? extends Span> spans) {

        final List<Span> sorted = Lists.newArrayList(spans);
        Collections.sort(sorted, START_ORDER);

        final List<Span> accepted = Lists.newArrayListWithCapacity(sorted.size());
        for (final Span candidate : sorted) {
            boolean wins = true;
            final List<Span> overlapped = Lists.newArrayList();
            for (final Span span : accepted) {
                if (candidate.overlaps(span)) {
                    overlapped.add(span);
                    if (candidate.getConfidence() <= span.getConfidence()) {
                        wins = false;
                        break;
                    }
                }
            }
            if (wins) {
                accepted.removeAll(overlapped);
                accepted.add(candidate);
            } else {
                LOGGER.trace("Discarding {} overlapping accepted span", candidate);
            }
        }

        // candidates come in start order, hence accepted spans are already sorted
        final ImmutableList.Builder<ResolvedConcept> builder = ImmutableList.builder();
        for (final Span span : accepted) {
            builder.add(new ResolvedConcept(span, getDomain(span.getLabel())));
        }
        return builder.build();
    }

    /**
     * Returns the domain the label specified maps to.
     *
     * @param label
     *            the extraction label
     * @return the domain, never null
     */
    public String getDomain(final String label) {
        final String domain = this.domains.get(label);
        return domain != null ? domain : this.defaultDomain;
    }

    /**
     * Counts concepts per domain.
     *
     * @param concepts
     *            the resolved concepts
     * @return an ordered domain to count table, domains in order of first appearance
     */
    public static Map<String, Integer> domainDistribution(
            final Iterable<? extends ResolvedConcept> concepts) {
        final Map<String, Integer> distribution = Maps.newLinkedHashMap();
        for (final ResolvedConcept concept : concepts) {
            final Integer count = distribution.get(concept.getDomain());
            distribution.put(concept.getDomain(), count == null ? 1 : count + 1);
        }
        return distribution;
    }

}
