package eu.fbk.slopat.data;

import java.io.StringReader;
import java.util.List;
import java.util.Map;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.slopat.vocabulary.SLOP;

public class SerializerTest {

    private static final ValueFactory FACTORY = Data.getValueFactory();

    private final Serializer serializer = new Serializer();

    @Test
    public void testLayout() {
        final URI doc = FACTORY.createURI(SLOP.DOCUMENT_NAMESPACE + "notes");
        final URI concept = FACTORY.createURI(SLOP.CONCEPT_NAMESPACE + "0123456789abcdef");
        final List<Statement> statements = ImmutableList.of(
                FACTORY.createStatement(doc, RDF.TYPE, SLOP.DOCUMENT),
                FACTORY.createStatement(concept, RDFS.LABEL, FACTORY.createLiteral("graph")),
                FACTORY.createStatement(doc, SLOP.DISCUSSES, concept));
        final Map<String, String> namespaces = ImmutableMap.of("slop", SLOP.NAMESPACE, "rdf",
                RDF.NAMESPACE, "rdfs", RDFS.NAMESPACE);

        final String expected = "" //
                + "@prefix slop: <http://slop.at/ontology#> .\n" //
                + "@prefix rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#> .\n" //
                + "@prefix rdfs: <http://www.w3.org/2000/01/rdf-schema#> .\n" //
                + "\n" //
                + "<http://slop.at/ontology#document/notes>\n" //
                + "    rdf:type slop:Document ;\n" //
                + "    slop:discusses <http://slop.at/ontology#concept/0123456789abcdef> .\n" //
                + "\n" //
                + "<http://slop.at/ontology#concept/0123456789abcdef>\n" //
                + "    rdfs:label \"graph\" .\n" //
                + "\n";
        Assert.assertEquals(expected, this.serializer.serialize(statements, namespaces));
    }

    @Test
    public void testEscapes() {
        final URI subject = FACTORY.createURI("http://example.org/a");
        final Literal literal = FACTORY.createLiteral("say \"hi\"\\\n\r\tbye");
        final String text = this.serializer.serialize(
                ImmutableList.of(FACTORY.createStatement(subject, RDFS.COMMENT, literal)),
                ImmutableMap.of("rdfs", RDFS.NAMESPACE));
        Assert.assertTrue(text.contains("\"say \\\"hi\\\"\\\\\\n\\r\\tbye\""));
        final StatementSet parsed = this.serializer.parse(text);
        Assert.assertEquals(subject, parsed.getStatements().get(0).getSubject());
        Assert.assertEquals(literal, parsed.getStatements().get(0).getObject());
    }

    @Test
    public void testFullURIWhenNoNamespaceMatches() {
        final URI subject = FACTORY.createURI("http://example.org/x");
        final String text = this.serializer.serialize(
                ImmutableList.of(FACTORY.createStatement(subject, RDF.TYPE, SLOP.CONCEPT)),
                ImmutableMap.of("slop", SLOP.NAMESPACE));
        Assert.assertTrue(text.contains("<http://example.org/x>\n"));
        Assert.assertTrue(text.contains("<" + RDF.TYPE + "> slop:Concept .\n"));
    }

    @Test
    public void testLongestNamespaceMatch() {
        final URI concept = FACTORY.createURI(SLOP.CONCEPT_NAMESPACE + "abc");
        final String text = this.serializer.serialize(
                ImmutableList.of(FACTORY.createStatement(concept, RDF.TYPE, SLOP.CONCEPT)),
                ImmutableMap.of("slop", SLOP.NAMESPACE, "c", SLOP.CONCEPT_NAMESPACE, "rdf",
                        RDF.NAMESPACE));
        Assert.assertTrue(text.contains("\nc:abc\n"));
    }

    @Test
    public void testRoundTrip() {
        final URI doc = FACTORY.createURI(SLOP.DOCUMENT_NAMESPACE + "doc-0011223344556677");
        final URI concept = FACTORY.createURI(SLOP.CONCEPT_NAMESPACE + "ffeeddccbbaa9988");
        final BNode node = FACTORY.createBNode("n1");
        final List<Statement> statements = ImmutableList.of(
                FACTORY.createStatement(doc, RDF.TYPE, SLOP.DOCUMENT),
                FACTORY.createStatement(doc, SLOP.TYPE_CONFIDENCE,
                        FACTORY.createLiteral("0.75", XMLSchema.FLOAT)),
                FACTORY.createStatement(doc, SLOP.DISCUSSES, concept),
                FACTORY.createStatement(doc, SLOP.DISCUSSES, concept),
                FACTORY.createStatement(concept, RDFS.LABEL, FACTORY.createLiteral("grafo", "it")),
                FACTORY.createStatement(concept, SLOP.START_POSITION,
                        FACTORY.createLiteral("12", XMLSchema.INTEGER)),
                FACTORY.createStatement(node, RDFS.COMMENT, FACTORY.createLiteral("x.y")),
                FACTORY.createStatement(concept, SLOP.CONTEXT, FACTORY.createLiteral("")));
        final StatementSet set = new StatementSet(statements, Data.getNamespaceMap());
        final StatementSet parsed = this.serializer.parse(this.serializer.serialize(set));
        Assert.assertEquals(HashMultiset.create(statements),
                HashMultiset.create(parsed.getStatements()));
        Assert.assertEquals(Data.getNamespaceMap(), parsed.getNamespaces());
    }

    @Test
    public void testParseTurtle() throws Throwable {
        final String text = "" //
                + "# bootstrap\n" //
                + "@prefix slop: <http://slop.at/ontology#> .\n" //
                + "@prefix rdfs: <http://www.w3.org/2000/01/rdf-schema#> .\n" //
                + "@prefix xsd: <http://www.w3.org/2001/XMLSchema#> .\n" //
                + "\n" //
                + "slop:Concept a rdfs:Class ; # trailing comment\n" //
                + "    rdfs:label \"Concept\"@en, \"Concetto\"@it ;\n" //
                + "    rdfs:comment \"\"\"multi\nline\"\"\" ;\n" //
                + "    slop:weight 1.5, 3, -2e3, true ;\n" //
                + "    slop:range xsd:float .\n";
        final StatementSet set = this.serializer.parse(new StringReader(text));
        Assert.assertEquals(9, set.size());
        Assert.assertEquals(ImmutableList.of("slop", "rdfs", "xsd"),
                ImmutableList.copyOf(set.getNamespaces().keySet()));
        final List<Statement> statements = set.getStatements();
        Assert.assertEquals(RDF.TYPE, statements.get(0).getPredicate());
        Assert.assertEquals(RDFS.CLASS, statements.get(0).getObject());
        Assert.assertEquals(FACTORY.createLiteral("Concetto", "it"), statements.get(2)
                .getObject());
        Assert.assertEquals(FACTORY.createLiteral("multi\nline"), statements.get(3).getObject());
        Assert.assertEquals(FACTORY.createLiteral("1.5", XMLSchema.DECIMAL), statements.get(4)
                .getObject());
        Assert.assertEquals(FACTORY.createLiteral("3", XMLSchema.INTEGER), statements.get(5)
                .getObject());
        Assert.assertEquals(FACTORY.createLiteral("-2e3", XMLSchema.DOUBLE), statements.get(6)
                .getObject());
        Assert.assertEquals(FACTORY.createLiteral("true", XMLSchema.BOOLEAN), statements.get(7)
                .getObject());
        Assert.assertEquals(XMLSchema.FLOAT, statements.get(8).getObject());
    }

    @Test
    public void testParseEmpty() {
        Assert.assertTrue(this.serializer.parse("  # nothing\n").isEmpty());
    }

    @Test
    public void testParseErrorLine() {
        final String text = "@prefix slop: <http://slop.at/ontology#> .\n"
                + "slop:a slop:b slop:c .\n" + "slop:a unknown:b slop:c .\n";
        try {
            this.serializer.parse(text);
            Assert.fail();
        } catch (final ParseException ex) {
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("line 3"));
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("unknown"));
        }
    }

    @Test(expected = ParseException.class)
    public void testUnterminatedLiteral() {
        this.serializer.parse("<http://x.org/a> <http://x.org/b> \"open .\n");
    }

    @Test(expected = ParseException.class)
    public void testMissingDot() {
        this.serializer.parse("<http://x.org/a> <http://x.org/b> <http://x.org/c>");
    }

    @Test(expected = ParseException.class)
    public void testMissingObject() {
        this.serializer.parse("<http://x.org/a> <http://x.org/b> .");
    }

}
