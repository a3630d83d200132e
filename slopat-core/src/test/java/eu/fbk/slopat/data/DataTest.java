package eu.fbk.slopat.data;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.slopat.vocabulary.SLOP;

public class DataTest {

    @Test
    public void testExpand() {
        Assert.assertEquals(SLOP.CONCEPT, Data.expand("slop:Concept", Data.getNamespaceMap()));
        Assert.assertEquals(RDF.TYPE, Data.expand("<" + RDF.TYPE + ">", Data.getNamespaceMap()));
        Assert.assertEquals(SLOP.DOCUMENT,
                Data.expand(SLOP.DOCUMENT.stringValue(), Data.getNamespaceMap()));
    }

    @Test(expected = ParseException.class)
    public void testExpandUnknownPrefix() {
        Data.expand("nope:Thing", Data.getNamespaceMap());
    }

    @Test(expected = ParseException.class)
    public void testExpandNotAURI() {
        Data.expand("Concept", Data.getNamespaceMap());
    }

    @Test
    public void testExpandRelativeURI() {
        try {
            Data.expand("<Thing>", Data.getNamespaceMap());
            Assert.fail("Relative URI accepted");
        } catch (final ParseException ex) {
            Assert.assertTrue(ex.getMessage().contains("Thing"));
        }
    }

    @Test
    public void testPrefixFor() {
        Assert.assertEquals("slop", Data.prefixFor(SLOP.CONCEPT_NAMESPACE + "x",
                Data.getNamespaceMap()));
        Assert.assertNull(Data.prefixFor("http://example.org/x", Data.getNamespaceMap()));
        Assert.assertEquals("xsd", Data.namespaceToPrefix(XMLSchema.NAMESPACE,
                Data.getNamespaceMap()));
    }

    @Test
    public void testToString() {
        final URI concept = Data.getValueFactory().createURI(SLOP.CONCEPT_NAMESPACE + "abc");
        Assert.assertEquals("(slop:concept/abc, rdf:type, slop:Concept)", Data.toString(Data
                .getValueFactory().createStatement(concept, RDF.TYPE, SLOP.CONCEPT), Data
                .getNamespaceMap()));
        Assert.assertEquals("\"3\"^^<" + XMLSchema.INTEGER + ">", Data.toString(Data
                .getValueFactory().createLiteral("3", XMLSchema.INTEGER), null));
        Assert.assertNull(Data.toString(null, null));
    }

    @Test
    public void testTitleCase() {
        Assert.assertEquals("Cs", SLOP.titleCase("cs"));
        Assert.assertEquals("Social_Science", SLOP.titleCase("social_science"));
        Assert.assertEquals(SLOP.NAMESPACE + "coversMath", SLOP.covers("math").stringValue());
    }

}
