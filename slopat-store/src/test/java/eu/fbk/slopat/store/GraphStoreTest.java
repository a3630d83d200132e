package eu.fbk.slopat.store;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.slopat.data.Data;
import eu.fbk.slopat.data.DocumentMetadata;
import eu.fbk.slopat.data.DocumentType;
import eu.fbk.slopat.data.Serializer;
import eu.fbk.slopat.data.Span;
import eu.fbk.slopat.data.StatementSet;
import eu.fbk.slopat.pipeline.Pipeline;
import eu.fbk.slopat.runtime.DataCorruptedException;
import eu.fbk.slopat.runtime.StoreLock;
import eu.fbk.slopat.runtime.StoreLockedException;
import eu.fbk.slopat.vocabulary.SLOP;

public class GraphStoreTest {

    private static final String CONTENT_A = "Graph theory studies graphs. "
            + "Dijkstra algorithm finds shortest paths.";

    private static final String CONTENT_B = "Dijkstra algorithm on Graph theory.";

    private static final long TIMEOUT = 10000L;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final Pipeline pipeline = Pipeline.builder().build();

    private File location;

    private GraphStore store;

    @Before
    public void setUp() throws Throwable {
        this.location = new File(this.folder.getRoot(), "graph");
        this.store = GraphStore.open(StoreConfig.builder(this.location).build());
    }

    @After
    public void tearDown() {
        this.store.close();
    }

    private StatementSet documentA() {
        return this.pipeline.process(CONTENT_A, ImmutableList.of( //
                new Span("Graph theory", "mathematics_concept", 0, 12, 0.9), //
                new Span("Dijkstra algorithm", "algorithm", 29, 47, 0.85)), //
                new DocumentMetadata(DocumentType.PLAIN_TEXT, 0.9, null, "Graphs"), "a.txt")
                .getStatements();
    }

    private StatementSet documentB() {
        return this.pipeline.process(CONTENT_B, ImmutableList.of( //
                new Span("Dijkstra algorithm", "algorithm", 0, 18, 0.8), //
                new Span("Graph theory", "mathematics_concept", 22, 34, 0.7)), //
                new DocumentMetadata(DocumentType.MARKDOWN, 0.6), "b.md").getStatements();
    }

    private StatementSet document(final String name, final DocumentType type) {
        final String content = "About " + name + " and heaps.";
        final int index = content.indexOf("heaps");
        return this.pipeline.process(content,
                ImmutableList.of(new Span("heaps", "data_structure", index, index + 5, 0.9)),
                new DocumentMetadata(type, 0.5), name).getStatements();
    }

    @Test
    public void testBootstrap() {
        Assert.assertTrue(new File(this.location, GraphStore.SNAPSHOT_FILE).isFile());
        Assert.assertTrue(new File(this.location, StoreLock.FILE_NAME).isFile());

        final QueryResult result = this.store.query(Query.countByType("owl:Class"), TIMEOUT);
        Assert.assertTrue(result.getError(), result.isSuccess());
        Assert.assertTrue(Integer.parseInt(result.getBindings().get(0).get("count")) >= 7);

        final String text = this.store.exportSubgraph(SLOP.DOCUMENT);
        Assert.assertNotNull(text);
        Assert.assertTrue(text, text.contains("rdf:type owl:Class"));
    }

    @Test
    public void testInsertAndDocumentsDiscussing() {
        final StatementSet a = documentA();
        final WriteResult first = this.store.insert(a);
        Assert.assertTrue(first.isSuccess());
        Assert.assertEquals(a.size(), first.getInserted());
        Assert.assertEquals(0, first.getSkipped());
        Assert.assertTrue(this.store.insert(a).isSuccess());

        final QueryResult result = this.store.query(Query.documentsDiscussing("Graph theory"),
                TIMEOUT);
        Assert.assertTrue(result.getError(), result.isSuccess());
        Assert.assertEquals(1, result.getCount());
        final Map<String, String> row = result.getBindings().get(0);
        Assert.assertEquals(a.getDocumentID().stringValue(), row.get("doc"));
        Assert.assertEquals("Graphs", row.get("title"));
        Assert.assertEquals(0.9, Double.parseDouble(row.get("confidence")), 1e-6);
        Assert.assertNull(row.get("domain")); // math and cs equally covered
        Assert.assertTrue(result.getElapsedMs() >= 0);

        final QueryResult none = this.store.query(Query.documentsDiscussing("graph theory"),
                TIMEOUT);
        Assert.assertTrue(none.isSuccess());
        Assert.assertEquals(0, none.getCount());
    }

    @Test
    public void testDocumentsDiscussingLimitAndOrder() {
        this.store.insert(documentA());
        this.store.insert(documentB());

        final QueryResult all = this.store.query(Query.documentsDiscussing("Graph theory"),
                TIMEOUT);
        Assert.assertEquals(2, all.getCount());
        Assert.assertEquals(documentA().getDocumentID().stringValue(), all.getBindings().get(0)
                .get("doc"));

        final QueryResult limited = this.store.query(
                Query.documentsDiscussing("Graph theory", 1), TIMEOUT);
        Assert.assertTrue(limited.isSuccess());
        Assert.assertEquals(1, limited.getCount());
    }

    @Test
    public void testCoOccurringConcepts() {
        this.store.insert(documentA());

        QueryResult result = this.store.query(Query.coOccurringConcepts("Graph theory"),
                TIMEOUT);
        Assert.assertTrue(result.getError(), result.isSuccess());
        Assert.assertEquals(1, result.getCount());
        Assert.assertEquals("Dijkstra algorithm", result.getBindings().get(0).get(
                "related_concept"));
        Assert.assertEquals("1", result.getBindings().get(0).get("frequency"));

        // edge in the opposite direction, same neighbour
        this.store.insert(documentB());
        result = this.store.query(Query.coOccurringConcepts("Graph theory"), TIMEOUT);
        Assert.assertEquals(1, result.getCount());
        Assert.assertEquals("2", result.getBindings().get(0).get("frequency"));

        result = this.store.query(Query.coOccurringConcepts("Dijkstra algorithm"), TIMEOUT);
        Assert.assertEquals(1, result.getCount());
        Assert.assertEquals("Graph theory", result.getBindings().get(0).get("related_concept"));
        Assert.assertEquals("2", result.getBindings().get(0).get("frequency"));
    }

    @Test
    public void testCountByTypeAndStatistics() {
        this.store.insert(documentA());
        this.store.insert(documentB());

        final QueryResult result = this.store.query(Query.countByType(SLOP.DOCUMENT), TIMEOUT);
        Assert.assertTrue(result.getError(), result.isSuccess());
        Assert.assertEquals("2", result.getBindings().get(0).get("count"));

        final Map<String, Integer> statistics = this.store.getStatistics(TIMEOUT);
        Assert.assertEquals(ImmutableList.of("total_documents", "total_concepts",
                "conversation_documents", "markdown_documents", "plain_text_documents",
                "structured_documents", "random_documents"),
                ImmutableList.copyOf(statistics.keySet()));
        Assert.assertEquals(Integer.valueOf(2), statistics.get("total_documents"));
        Assert.assertEquals(Integer.valueOf(2), statistics.get("total_concepts"));
        Assert.assertEquals(Integer.valueOf(1), statistics.get("plain_text_documents"));
        Assert.assertEquals(Integer.valueOf(1), statistics.get("markdown_documents"));
        Assert.assertEquals(Integer.valueOf(0), statistics.get("random_documents"));
    }

    @Test
    public void testMalformedQueries() {
        QueryResult result = this.store.query(Query.documentsDiscussing(null), TIMEOUT);
        Assert.assertFalse(result.isSuccess());
        Assert.assertTrue(result.getError().startsWith("Malformed query"));
        Assert.assertEquals(0, result.getCount());

        result = this.store.query(Query.documentsDiscussing("x", 0), TIMEOUT);
        Assert.assertFalse(result.isSuccess());

        result = this.store.query(Query.countByType("nope:Thing"), TIMEOUT);
        Assert.assertFalse(result.isSuccess());

        result = this.store.query(Query.countByType(SLOP.CONCEPT), 0L);
        Assert.assertFalse(result.isSuccess());

        result = this.store.query(null, TIMEOUT);
        Assert.assertFalse(result.isSuccess());
    }

    @Test
    public void testTimeout() {
        final ValueFactory factory = Data.getValueFactory();
        final URI hub = factory.createURI(SLOP.CONCEPT_NAMESPACE + "hub");
        final List<Statement> statements = Lists.newArrayList();
        statements.add(factory.createStatement(hub, RDFS.LABEL, factory.createLiteral("hub")));
        for (int i = 0; i < 3000; ++i) {
            final URI doc = factory.createURI(SLOP.DOCUMENT_NAMESPACE + "d" + i);
            final URI concept = factory.createURI(SLOP.CONCEPT_NAMESPACE + "c" + i);
            statements.add(factory.createStatement(concept, RDFS.LABEL,
                    factory.createLiteral("c" + i)));
            statements.add(factory.createStatement(hub, SLOP.CO_OCCURS_WITH, concept));
            statements.add(factory.createStatement(doc, SLOP.DISCUSSES, hub));
            statements.add(factory.createStatement(doc, SLOP.DISCUSSES, concept));
        }
        Assert.assertTrue(this.store.insert(
                new StatementSet(statements, Data.getNamespaceMap())).isSuccess());

        final QueryResult result = this.store.query(Query.coOccurringConcepts("hub", 100), 1L);
        Assert.assertFalse(result.isSuccess());
        Assert.assertTrue(result.getError(), result.getError().contains("timed out"));
        Assert.assertTrue(result.getBindings().isEmpty());

        // the store is still usable
        Assert.assertTrue(this.store.query(Query.countByType(SLOP.CONCEPT), TIMEOUT).isSuccess());
    }

    @Test
    public void testSecondWriterRejected() throws Throwable {
        try {
            GraphStore.open(StoreConfig.builder(this.location).build());
            Assert.fail();
        } catch (final StoreLockedException ex) {
            Assert.assertEquals(this.location, ex.getLocation());
        }
        // the writer is unaffected
        Assert.assertTrue(this.store.insert(documentA()).isSuccess());
    }

    @Test
    public void testReadOnlyHandle() throws Throwable {
        this.store.insert(documentA());

        final GraphStore reader = GraphStore.open(StoreConfig.builder(this.location).readOnly()
                .build());
        try {
            Assert.assertTrue(reader.isReadOnly());
            Assert.assertEquals(1, reader.query(Query.documentsDiscussing("Graph theory"),
                    TIMEOUT).getCount());

            final WriteResult rejected = reader.insert(documentB());
            Assert.assertFalse(rejected.isSuccess());
            Assert.assertNotNull(rejected.getError());
            Assert.assertFalse(reader.clear().isSuccess());
            Assert.assertFalse(reader.importText("").isSuccess());

            // writer changes become visible once published
            this.store.insert(documentB());
            Assert.assertEquals(2, reader.query(Query.documentsDiscussing("Graph theory"),
                    TIMEOUT).getCount());
            Assert.assertFalse(reader.refresh());
        } finally {
            reader.close();
        }

        // closing a reader leaves the writer lock in place
        try {
            GraphStore.open(StoreConfig.builder(this.location).build());
            Assert.fail();
        } catch (final StoreLockedException ex) {
            // expected
        }
    }

    @Test(expected = FileNotFoundException.class)
    public void testReadOnlyMissingStore() throws Throwable {
        GraphStore.open(StoreConfig.builder(this.folder.newFolder("empty")).readOnly().build());
    }

    @Test
    public void testPersistence() throws Throwable {
        final StatementSet a = documentA();
        this.store.insert(a);
        this.store.close();
        this.store.close(); // idempotent

        this.store = GraphStore.open(StoreConfig.builder(this.location).build());
        Assert.assertEquals(1, this.store.query(Query.documentsDiscussing("Graph theory"),
                TIMEOUT).getCount());
        Assert.assertEquals(Integer.valueOf(1), this.store.getStatistics(TIMEOUT).get(
                "total_documents"));
    }

    @Test
    public void testCorruptedSnapshot() throws Throwable {
        final File dir = this.folder.newFolder("corrupted");
        Files.write("not a snapshot", new File(dir, GraphStore.SNAPSHOT_FILE), Charsets.UTF_8);
        try {
            GraphStore.open(StoreConfig.builder(dir).build());
            Assert.fail();
        } catch (final DataCorruptedException ex) {
            // expected
        }
        // the lock has been released
        StoreLock.acquire(dir).close();
    }

    @Test
    public void testExport() {
        final StatementSet a = documentA();
        this.store.insert(a);

        final String text = this.store.exportDocument("a");
        Assert.assertNotNull(text);
        Assert.assertTrue(text.contains("slop:discusses"));
        final StatementSet parsed = new Serializer().parse(text);
        Assert.assertEquals(ImmutableSet.copyOf(a.getStatements()),
                ImmutableSet.copyOf(parsed.getStatements()));

        Assert.assertEquals(text, this.store.exportDocument(a.getDocumentID().stringValue()));
        Assert.assertEquals(text, this.store.exportSubgraph(a.getDocumentID()));
        Assert.assertNull(this.store.exportDocument("missing"));
    }

    @Test
    public void testClear() {
        this.store.insert(documentA());
        final WriteResult result = this.store.clear();
        Assert.assertTrue(result.isSuccess());
        Assert.assertTrue(result.getInserted() > 0);

        Assert.assertEquals(0, this.store.query(Query.documentsDiscussing("Graph theory"),
                TIMEOUT).getCount());
        Assert.assertNotNull(this.store.exportSubgraph(SLOP.CONCEPT));
    }

    @Test
    public void testImportText() {
        final StatementSet a = documentA();
        final WriteResult result = this.store.importText(new Serializer().serialize(a));
        Assert.assertTrue(result.isSuccess());
        Assert.assertEquals(a.size(), result.getInserted());
        Assert.assertEquals(1, this.store.query(Query.coOccurringConcepts("Graph theory"),
                TIMEOUT).getCount());

        final WriteResult invalid = this.store.importText("slop:a slop:b");
        Assert.assertFalse(invalid.isSuccess());
        Assert.assertEquals(0, invalid.getInserted());
    }

    @Test
    public void testMalformedStatementSkipped() {
        final ValueFactory factory = Data.getValueFactory();
        final URI concept = factory.createURI(SLOP.CONCEPT_NAMESPACE + "broken");
        final List<Statement> statements = ImmutableList.of(
                factory.createStatement(concept, RDFS.LABEL, factory.createLiteral("broken")),
                factory.createStatement(concept, SLOP.START_POSITION,
                        factory.createLiteral("twelve", XMLSchema.INTEGER)));
        final WriteResult result = this.store.insert(new StatementSet(statements, Data
                .getNamespaceMap()));
        Assert.assertTrue(result.isSuccess());
        Assert.assertEquals(1, result.getInserted());
        Assert.assertEquals(1, result.getSkipped());
    }

    @Test
    public void testConcurrentInserts() throws Throwable {
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final List<Future<WriteResult>> futures = Lists.newArrayList();
            for (int i = 0; i < 8; ++i) {
                final StatementSet set = document("doc" + i, DocumentType.STRUCTURED);
                futures.add(executor.submit(new Callable<WriteResult>() {

                    @Override
                    public WriteResult call() {
                        return GraphStoreTest.this.store.insert(set);
                    }

                }));
            }
            for (final Future<WriteResult> future : futures) {
                Assert.assertTrue(future.get().isSuccess());
            }
        } finally {
            executor.shutdownNow();
        }
        final Map<String, Integer> statistics = this.store.getStatistics(TIMEOUT);
        Assert.assertEquals(Integer.valueOf(8), statistics.get("structured_documents"));
        Assert.assertEquals(Integer.valueOf(1), statistics.get("total_concepts"));
        Assert.assertEquals(8, this.store.query(Query.documentsDiscussing("heaps", 20), TIMEOUT)
                .getCount());
    }

    @Test
    public void testClosedStore() {
        this.store.close();
        Assert.assertFalse(this.store.insert(documentA()).isSuccess());
        Assert.assertFalse(this.store.clear().isSuccess());
        Assert.assertFalse(this.store.query(Query.countByType(OWL.CLASS), TIMEOUT).isSuccess());
        Assert.assertNull(this.store.exportDocument("a"));
    }

}
