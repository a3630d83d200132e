package eu.fbk.slopat.resolve;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.slopat.data.ResolvedConcept;
import eu.fbk.slopat.data.Span;
import eu.fbk.slopat.vocabulary.ConceptLabels;

public class SpanResolverTest {

    private final SpanResolver resolver = new SpanResolver();

    @Test
    public void testEmpty() {
        Assert.assertTrue(this.resolver.resolve(Collections.<Span>emptyList()).isEmpty());
    }

    @Test
    public void testHigherConfidenceWins() {
        final Span graph = new Span("graph", "mathematics_concept", 5, 10, 0.6);
        final Span neural = new Span("neural network", "machine_learning_concept", 0, 14, 0.9);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(graph, neural));
        Assert.assertEquals(1, result.size());
        Assert.assertEquals("neural network", result.get(0).getText());
        Assert.assertEquals("cs", result.get(0).getDomain());
    }

    @Test
    public void testTieKeepsAccepted() {
        final Span first = new Span("alpha", "algorithm", 0, 5, 0.8);
        final Span second = new Span("pha beta", "algorithm", 2, 10, 0.8);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(second, first));
        Assert.assertEquals(1, result.size());
        Assert.assertEquals("alpha", result.get(0).getText());
    }

    @Test
    public void testAdjacentSpansDoNotOverlap() {
        final Span first = new Span("ab", "tool", 0, 2, 0.5);
        final Span second = new Span("cd", "tool", 2, 4, 0.9);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(second, first));
        Assert.assertEquals(2, result.size());
        Assert.assertEquals(0, result.get(0).getStart());
        Assert.assertEquals(2, result.get(1).getStart());
    }

    @Test
    public void testNestedSpans() {
        final Span outer = new Span("deep neural network", "machine_learning_concept", 0, 19,
                0.7);
        final Span inner = new Span("neural", "machine_learning_concept", 5, 11, 0.95);
        final Span innermost = new Span("eur", "other_label", 6, 9, 0.5);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(outer, inner,
                innermost));
        Assert.assertEquals(1, result.size());
        Assert.assertEquals("neural", result.get(0).getText());
    }

    @Test
    public void testChainedReplacement() {
        final Span a = new Span("aa", "tool", 0, 2, 0.6);
        final Span wide = new Span("aa bb", "tool", 1, 4, 0.7);
        final Span b = new Span("bb", "tool", 3, 5, 0.9);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(b, a, wide));
        Assert.assertEquals(1, result.size());
        Assert.assertEquals("bb", result.get(0).getText());
    }

    @Test
    public void testLowerConfidenceCandidateDiscarded() {
        final Span a = new Span("aa", "tool", 0, 2, 0.6);
        final Span wide = new Span("aa bb", "tool", 1, 4, 0.7);
        final Span b = new Span("bb", "tool", 3, 5, 0.5);
        final Span c = new Span("cc", "tool", 6, 8, 0.1);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(a, b, c, wide));
        Assert.assertEquals(2, result.size());
        Assert.assertEquals("aa bb", result.get(0).getText());
        Assert.assertEquals("cc", result.get(1).getText());
        assertNoOverlaps(result);
    }

    @Test
    public void testZeroLengthSpan() {
        final Span empty = new Span("", "tool", 3, 3, 0.4);
        final List<ResolvedConcept> result = this.resolver.resolve(ImmutableList.of(empty));
        Assert.assertEquals(1, result.size());
        Assert.assertEquals(3, result.get(0).getEnd());
    }

    @Test
    public void testUnknownLabelDomain() {
        final List<ResolvedConcept> result = this.resolver.resolve(ImmutableList.of(new Span(
                "thing", "unknown_label", 0, 5, 0.5)));
        Assert.assertEquals(ConceptLabels.OTHER_DOMAIN, result.get(0).getDomain());
    }

    @Test
    public void testCustomDomains() {
        final SpanResolver custom = new SpanResolver(ImmutableMap.of("x", "ex"), "none");
        Assert.assertEquals("ex", custom.getDomain("x"));
        Assert.assertEquals("none", custom.getDomain("algorithm"));
    }

    @Test
    public void testSanitize() {
        final Span valid = new Span("ok", "tool", 0, 2, 0.5);
        final List<Span> result = this.resolver.sanitize(Arrays.asList(valid, //
                new Span("neg", "tool", -1, 2, 0.5), //
                new Span("inverted", "tool", 4, 2, 0.5), //
                new Span("beyond", "tool", 8, 12, 0.5), //
                new Span("nan", "tool", 0, 1, Double.NaN), //
                null), 10);
        Assert.assertEquals(ImmutableList.of(valid), result);
    }

    @Test
    public void testDomainDistribution() {
        final List<ResolvedConcept> concepts = this.resolver.resolve(Arrays.asList(//
                new Span("sort", "algorithm", 0, 4, 0.9), //
                new Span("heap", "data_structure", 10, 14, 0.9), //
                new Span("lemma", "mathematical_theorem", 20, 25, 0.9)));
        final Map<String, Integer> distribution = SpanResolver.domainDistribution(concepts);
        Assert.assertEquals(ImmutableMap.of("cs", 2, "math", 1), distribution);
    }

    private static void assertNoOverlaps(final List<? extends Span> spans) {
        for (int i = 0; i < spans.size(); ++i) {
            for (int j = i + 1; j < spans.size(); ++j) {
                Assert.assertFalse(spans.get(i).overlaps(spans.get(j)));
            }
        }
    }

    @Test
    public void testOverlappingNamesKeepMoreConfident() {
        final Span raft = new Span("Raft", "distributed_system", 10, 14, 0.9);
        final Span paxos = new Span("Paxos", "distributed_system", 10, 15, 0.6);
        final List<ResolvedConcept> result = this.resolver.resolve(Arrays.asList(raft, paxos));
        Assert.assertEquals(1, result.size());
        Assert.assertEquals("Raft", result.get(0).getText());
        Assert.assertEquals(10, result.get(0).getStart());
        Assert.assertEquals(14, result.get(0).getEnd());
        Assert.assertEquals(0.9, result.get(0).getConfidence(), 0.0);
    }

}
