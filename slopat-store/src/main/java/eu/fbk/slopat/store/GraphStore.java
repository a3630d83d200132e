package eu.fbk.slopat.store;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

import javax.annotation.Nullable;

import com.google.common.base.CaseFormat;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.datatypes.XMLDatatypeUtil;
import org.openrdf.model.vocabulary.DCTERMS;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.query.BindingSet;
import org.openrdf.query.impl.MapBindingSet;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.RDFWriter;
import org.openrdf.rio.Rio;
import org.openrdf.rio.helpers.BasicParserSettings;
import org.openrdf.rio.helpers.StatementCollector;
import org.openrdf.sail.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.slopat.data.Data;
import eu.fbk.slopat.data.DocumentType;
import eu.fbk.slopat.data.ParseException;
import eu.fbk.slopat.data.Serializer;
import eu.fbk.slopat.data.StatementSet;
import eu.fbk.slopat.internal.Util;
import eu.fbk.slopat.runtime.DataCorruptedException;
import eu.fbk.slopat.runtime.StoreLock;
import eu.fbk.slopat.runtime.StoreLockedException;
import eu.fbk.slopat.triplestore.SelectQuery;
import eu.fbk.slopat.triplestore.TripleStore;
import eu.fbk.slopat.triplestore.TripleTransaction;
import eu.fbk.slopat.vocabulary.SLOP;

/**
 * A handle on the concept graph persisted at a storage location.
 * <p>
 * The graph is held in an in-memory Sesame repository and persisted in the storage location as a
 * gzipped N-Triples snapshot ({@value #SNAPSHOT_FILE}). A handle is opened with
 * {@link #open(StoreConfig)} in one of two modes:
 * </p>
 * <ul>
 * <li><b>read-write</b>: the handle takes an exclusive lock on the storage location (a second
 * read-write open, in this or another process, fails with {@link StoreLockedException}), loads
 * the snapshot and, if the graph is empty, the bootstrap ontology. After every successful write,
 * and on close, the whole graph is published as a new snapshot, replacing the previous one
 * atomically;</li>
 * <li><b>read-only</b>: the handle takes no lock and never writes to the storage location. It
 * loads the last published snapshot and reloads it whenever it changes, checking before each
 * query, so it observes the writer contents with some lag. Write operations are rejected.</li>
 * </ul>
 * <p>
 * Queries are restricted to the templates of {@link Query}. They run on a bounded pool of
 * threads and never throw: malformed descriptors, backend failures and timeouts are reported as
 * failed {@link QueryResult}s. Similarly, write operations report failures via
 * {@link WriteResult}s. Only {@code open} throws, on lock contention or initialization failure.
 * Handles are thread-safe; concurrent writes are serialized by the handle.
 * </p>
 */
public final class GraphStore implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphStore.class);

    /** Name of the snapshot file in the storage location. */
    public static final String SNAPSHOT_FILE = "graph.nt.gz";

    private static final String ONTOLOGY_RESOURCE = "ontology.ttl";

    private static final String PREFIXES = "" //
            + "PREFIX slop: <" + SLOP.NAMESPACE + ">\n" //
            + "PREFIX rdf: <" + RDF.NAMESPACE + ">\n" //
            + "PREFIX rdfs: <" + RDFS.NAMESPACE + ">\n" //
            + "PREFIX dct: <" + DCTERMS.NAMESPACE + ">\n";

    private static final String DOCUMENTS_DISCUSSING_QUERY = PREFIXES //
            + "SELECT ?doc (SAMPLE(?t) AS ?title) (MAX(?c) AS ?confidence) "
            + "(SAMPLE(?d) AS ?domain)\n" //
            + "WHERE {\n" //
            + "  ?concept rdfs:label ?label .\n" //
            + "  ?doc slop:discusses ?concept .\n" //
            + "  OPTIONAL { ?doc dct:title ?t }\n" //
            + "  OPTIONAL { ?doc slop:typeConfidence ?c }\n" //
            + "  OPTIONAL { ?doc slop:primaryDomain ?d }\n" //
            + "}\n" //
            + "GROUP BY ?doc\n" //
            + "ORDER BY DESC(?confidence) ?doc\n" //
            + "LIMIT ";

    private static final String CO_OCCURRING_CONCEPTS_QUERY = PREFIXES //
            + "SELECT ?related_concept (COUNT(DISTINCT ?doc) AS ?frequency)\n" //
            + "WHERE {\n" //
            + "  ?concept rdfs:label ?label .\n" //
            + "  { ?concept slop:coOccursWith ?related } UNION "
            + "{ ?related slop:coOccursWith ?concept }\n" //
            + "  ?related rdfs:label ?related_concept .\n" //
            + "  ?doc slop:discusses ?concept .\n" //
            + "  ?doc slop:discusses ?related .\n" //
            + "  FILTER (?related != ?concept)\n" //
            + "}\n" //
            + "GROUP BY ?related_concept\n" //
            + "ORDER BY DESC(?frequency) ?related_concept\n" //
            + "LIMIT ";

    private static final String COUNT_BY_TYPE_QUERY = PREFIXES //
            + "SELECT (COUNT(DISTINCT ?s) AS ?count)\n" //
            + "WHERE { ?s rdf:type ?type }";

    private static final Escaper NAME_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private final StoreConfig config;

    private final File snapshotFile;

    @Nullable
    private final StoreLock lock;

    private final TripleStore tripleStore;

    private final ListeningExecutorService executor;

    private final Serializer serializer;

    private final Object writeMutex;

    private final Object refreshMutex;

    private final AtomicBoolean closed;

    private List<Statement> bootstrap;

    @Nullable
    private List<Object> snapshotStamp;

    private volatile boolean initialized;

    private GraphStore(final StoreConfig config, @Nullable final StoreLock lock) {
        this.config = config;
        this.snapshotFile = new File(config.getLocation(), SNAPSHOT_FILE);
        this.lock = lock;
        this.tripleStore = new TripleStore(new MemoryStore());
        this.executor = Util.newExecutor(config.getMaxConcurrentTransactions(),
                "slopat-query-%d");
        this.serializer = new Serializer();
        this.writeMutex = new Object();
        this.refreshMutex = new Object();
        this.closed = new AtomicBoolean(false);
        this.bootstrap = Collections.emptyList();
        this.snapshotStamp = null;
        this.initialized = false;
    }

    /**
     * Opens a store handle.
     *
     * @param config
     *            the handle configuration
     * @return the opened handle, to be closed after use
     * @throws StoreLockedException
     *             if opening read-write a location already held by another read-write handle
     * @throws FileNotFoundException
     *             if opening read-only a location with no store
     * @throws DataCorruptedException
     *             if the snapshot in the location cannot be read back
     * @throws IOException
     *             on other initialization failures, including an invalid bootstrap ontology
     */
    public static GraphStore open(final StoreConfig config) throws IOException {

        Preconditions.checkNotNull(config);

        final File location = config.getLocation();
        StoreLock lock = null;
        if (config.isReadOnly()) {
            if (!new File(location, SNAPSHOT_FILE).isFile()) {
                throw new FileNotFoundException("No store found at " + location);
            }
        } else {
            Files.createDirectories(location.toPath());
            lock = StoreLock.acquire(location);
        }

        GraphStore store = null;
        try {
            store = new GraphStore(config, lock);
            store.init();
            LOGGER.info("Opened {} store at {}", config.isReadOnly() ? "read-only"
                    : "read-write", location);
            return store;

        } finally {
            if (store == null) {
                Util.closeQuietly(lock);
            } else if (!store.initialized) {
                store.close();
            }
        }
    }

    private void init() throws IOException {

        this.tripleStore.init();

        if (this.config.isReadOnly()) {
            refresh();

        } else {
            final String text = Util.getResource(GraphStore.class, ONTOLOGY_RESOURCE);
            try {
                this.bootstrap = this.serializer.parse(text).getStatements();
            } catch (final ParseException ex) {
                throw new IOException("Invalid bootstrap ontology: " + ex.getMessage(), ex);
            }

            final List<Statement> statements = this.snapshotFile.isFile() ? readSnapshot(
                    this.snapshotFile) : Collections.<Statement>emptyList();
            if (statements.isEmpty()) {
                LOGGER.info("Empty store, loading bootstrap ontology ({} statements)",
                        this.bootstrap.size());
                update(this.bootstrap, false, true);
            } else {
                update(statements, false, true);
                LOGGER.debug("Loaded {} statements from {}", statements.size(),
                        this.snapshotFile);
            }
        }

        this.initialized = true;
    }

    public StoreConfig getConfig() {
        return this.config;
    }

    public boolean isReadOnly() {
        return this.config.isReadOnly();
    }

    /**
     * Inserts the statements of the set specified. Malformed statements (e.g., typed literals
     * whose label is not valid for their datatype) are skipped and logged; statements already in
     * the graph are left untouched.
     *
     * @param statements
     *            the statements to insert
     * @return the operation outcome; a failure if the handle is read-only or closed
     */
    public WriteResult insert(final StatementSet statements) {

        Preconditions.checkNotNull(statements);

        final String unwritable = checkWritable();
        if (unwritable != null) {
            return WriteResult.failure(unwritable, 0);
        }

        final List<Statement> valid = Lists.newArrayListWithCapacity(statements.size());
        int skipped = 0;
        for (final Statement statement : statements) {
            if (isWellFormed(statement)) {
                valid.add(statement);
            } else {
                ++skipped;
                LOGGER.warn("Skipping malformed statement {}", statement);
            }
        }

        try {
            update(valid, false, true);
        } catch (final Throwable ex) {
            LOGGER.error("Insertion of " + statements + " failed", ex);
            return WriteResult.failure("Insertion failed: " + ex.getMessage(), skipped);
        }

        LOGGER.info("Inserted {} statements ({} skipped) for {}", valid.size(), skipped,
                statements.getDocumentID() == null ? "imported text" : statements
                        .getDocumentID());
        return WriteResult.success(valid.size(), skipped);
    }

    /**
     * Parses text in the {@link Serializer} format and inserts the resulting statements.
     *
     * @param text
     *            the text to import
     * @return the operation outcome; a failure if the text cannot be parsed
     */
    public WriteResult importText(final String text) {
        Preconditions.checkNotNull(text);
        final StatementSet statements;
        try {
            statements = this.serializer.parse(text);
        } catch (final ParseException ex) {
            LOGGER.warn("Rejecting import: {}", ex.getMessage());
            return WriteResult.failure("Invalid text: " + ex.getMessage(), 0);
        }
        return insert(statements);
    }

    /**
     * Removes all the statements of the graph and reloads the bootstrap ontology.
     *
     * @return the operation outcome, counting the reloaded ontology statements as inserted
     */
    public WriteResult clear() {

        final String unwritable = checkWritable();
        if (unwritable != null) {
            return WriteResult.failure(unwritable, 0);
        }

        try {
            update(this.bootstrap, true, true);
        } catch (final Throwable ex) {
            LOGGER.error("Clearing of store failed", ex);
            return WriteResult.failure("Clear failed: " + ex.getMessage(), 0);
        }

        LOGGER.info("Store cleared, bootstrap ontology reloaded");
        return WriteResult.success(this.bootstrap.size(), 0);
    }

    /**
     * Evaluates a query with the default timeout of the handle configuration.
     *
     * @param query
     *            the query descriptor
     * @return the query outcome
     */
    public QueryResult query(final Query query) {
        return query(query, this.config.getQueryTimeout());
    }

    /**
     * Evaluates a query, aborting it after the timeout specified.
     *
     * @param query
     *            the query descriptor
     * @param timeoutMs
     *            the timeout in milliseconds, measured from the call
     * @return the query outcome; on timeout, a failure with no partial solution
     */
    public QueryResult query(final Query query, final long timeoutMs) {

        final long ts = System.currentTimeMillis();

        if (this.closed.get()) {
            return QueryResult.failure("Store closed", 0L);
        }

        final Prepared prepared;
        try {
            Preconditions.checkArgument(query != null, "No query descriptor");
            Preconditions.checkArgument(timeoutMs > 0, "Non-positive timeout %s", timeoutMs);
            prepared = prepare(query);
        } catch (final IllegalArgumentException ex) {
            LOGGER.warn("Malformed query {}: {}", query, ex.getMessage());
            return QueryResult.failure("Malformed query: " + ex.getMessage(),
                    System.currentTimeMillis() - ts);
        }

        Future<List<Map<String, String>>> future = null;
        try {
            future = this.executor.submit(new Callable<List<Map<String, String>>>() {

                @Override
                public List<Map<String, String>> call() throws Exception {
                    refreshQuietly();
                    return evaluate(prepared, timeoutMs);
                }

            });
            final long remaining = timeoutMs - (System.currentTimeMillis() - ts);
            final List<Map<String, String>> bindings = future.get(Math.max(remaining, 0L),
                    TimeUnit.MILLISECONDS);
            final QueryResult result = QueryResult.success(bindings,
                    System.currentTimeMillis() - ts);
            LOGGER.debug("Query {} evaluated: {}", query, result);
            return result;

        } catch (final TimeoutException ex) {
            future.cancel(true);
            final long elapsed = System.currentTimeMillis() - ts;
            LOGGER.warn("Query {} timed out after {} ms", query, elapsed);
            return QueryResult.failure("Query timed out after " + timeoutMs + " ms", elapsed);

        } catch (final ExecutionException ex) {
            final Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            LOGGER.error("Query " + query + " failed", cause);
            return QueryResult.failure("Query failed: " + cause.getMessage(),
                    System.currentTimeMillis() - ts);

        } catch (final RejectedExecutionException ex) {
            return QueryResult.failure("Store closed", System.currentTimeMillis() - ts);

        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return QueryResult.failure("Interrupted", System.currentTimeMillis() - ts);
        }
    }

    /**
     * Returns store-wide statistics: the number of documents ({@code total_documents}), of
     * concepts ({@code total_concepts}) and of documents of each {@link DocumentType} (e.g.,
     * {@code plain_text_documents}). Counts that cannot be computed are reported as 0 and logged.
     *
     * @param timeoutMs
     *            the timeout of each count query
     * @return an ordered statistic name to value map
     */
    public Map<String, Integer> getStatistics(final long timeoutMs) {
        final Map<String, Integer> statistics = Maps.newLinkedHashMap();
        statistics.put("total_documents", count(Query.countByType(SLOP.DOCUMENT), timeoutMs));
        statistics.put("total_concepts", count(Query.countByType(SLOP.CONCEPT), timeoutMs));
        for (final DocumentType type : DocumentType.values()) {
            final String name = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_UNDERSCORE,
                    type.name()) + "_documents";
            statistics.put(name, count(Query.countByType(SLOP.NAMESPACE + type.getClassName()),
                    timeoutMs));
        }
        return Collections.unmodifiableMap(statistics);
    }

    /**
     * Exports the statements about a subject and about every concept it discusses.
     *
     * @param subject
     *            the subject, usually a document
     * @return the statements in {@link Serializer} format, or null if the subject is unknown or
     *         the export fails
     */
    @Nullable
    public String exportSubgraph(final Resource subject) {

        Preconditions.checkNotNull(subject);

        if (this.closed.get()) {
            return null;
        }
        refreshQuietly();

        try {
            final TripleTransaction tx = this.tripleStore.begin(true);
            try {
                final List<Statement> statements = tx.match(subject, null, null);
                if (statements.isEmpty()) {
                    return null;
                }
                final Set<Resource> concepts = Sets.newLinkedHashSet();
                for (final Statement statement : statements) {
                    if (statement.getPredicate().equals(SLOP.DISCUSSES)
                            && statement.getObject() instanceof Resource) {
                        concepts.add((Resource) statement.getObject());
                    }
                }
                concepts.remove(subject);
                for (final Resource concept : concepts) {
                    statements.addAll(tx.match(concept, null, null));
                }
                return this.serializer.serialize(statements, Data.getNamespaceMap());

            } finally {
                endQuietly(tx);
            }

        } catch (final Throwable ex) {
            LOGGER.error("Export of " + subject + " failed", ex);
            return null;
        }
    }

    /**
     * Exports a document given its stable name (or the local part of its identifier), as done
     * by {@link #exportSubgraph(Resource)}. A full URI is also accepted.
     *
     * @param name
     *            the document name or URI
     * @return the exported text, or null if there is no such document
     */
    @Nullable
    public String exportDocument(final String name) {
        Preconditions.checkNotNull(name);
        final ValueFactory factory = Data.getValueFactory();
        if (name.contains("://")) {
            return exportSubgraph(factory.createURI(name));
        }
        return exportSubgraph(factory.createURI(SLOP.DOCUMENT_NAMESPACE
                + NAME_ESCAPER.escape(name)));
    }

    /**
     * Reloads the snapshot if it changed since last loaded. Only read-only handles reload; this
     * is done automatically before each query and export.
     *
     * @return true if a new snapshot has been loaded
     * @throws IOException
     *             if the snapshot cannot be read
     */
    public boolean refresh() throws IOException {

        if (!this.config.isReadOnly() || this.closed.get()) {
            return false;
        }

        synchronized (this.refreshMutex) {
            final List<Object> stamp = stamp(this.snapshotFile);
            if (stamp.equals(this.snapshotStamp)) {
                return false;
            }
            final List<Statement> statements = readSnapshot(this.snapshotFile);
            update(statements, true, false);
            this.snapshotStamp = stamp;
            LOGGER.info("Loaded snapshot {} ({} statements)", this.snapshotFile,
                    statements.size());
            return true;
        }
    }

    /**
     * Closes the handle: publishes a last snapshot (read-write handles), stops query threads and
     * releases the lock. Calling it again has no effect.
     */
    @Override
    public void close() {
        if (!this.closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!this.config.isReadOnly() && this.initialized) {
                synchronized (this.writeMutex) {
                    publish();
                }
            }
        } catch (final Throwable ex) {
            LOGGER.error("Could not save snapshot on close", ex);
        } finally {
            this.executor.shutdownNow();
            this.tripleStore.close();
            Util.closeQuietly(this.lock);
            LOGGER.info("Closed store at {}", this.config.getLocation());
        }
    }

    @Override
    public String toString() {
        return "GraphStore(" + this.config.getLocation() + ", " + this.config.getMode()
                + (this.closed.get() ? ", closed)" : ")");
    }

    @Nullable
    private String checkWritable() {
        if (this.closed.get()) {
            return "Store closed";
        } else if (this.config.isReadOnly()) {
            return "Store opened in read-only mode";
        }
        return null;
    }

    private static boolean isWellFormed(@Nullable final Statement statement) {
        if (statement == null || statement.getSubject() == null
                || statement.getPredicate() == null || statement.getObject() == null) {
            return false;
        }
        if (statement.getObject() instanceof Literal) {
            final Literal literal = (Literal) statement.getObject();
            final URI datatype = literal.getDatatype();
            if (datatype != null && !XMLDatatypeUtil.isValidValue(literal.getLabel(), datatype)) {
                return false;
            }
        }
        return true;
    }

    private Prepared prepare(final Query query) {

        final String argument = query.getArgument();
        Preconditions.checkArgument(argument != null && !argument.isEmpty(),
                "Missing argument for %s query", query.getTemplate());
        Preconditions.checkArgument(query.getLimit() > 0, "Non-positive limit %s",
                query.getLimit());

        final ValueFactory factory = Data.getValueFactory();
        final MapBindingSet bindings = new MapBindingSet();
        switch (query.getTemplate()) {
        case DOCUMENTS_DISCUSSING:
            bindings.addBinding("label", factory.createLiteral(argument));
            return new Prepared(SelectQuery.from(DOCUMENTS_DISCUSSING_QUERY + query.getLimit()),
                    bindings, query.getLimit());
        case CO_OCCURRING_CONCEPTS:
            bindings.addBinding("label", factory.createLiteral(argument));
            return new Prepared(SelectQuery.from(CO_OCCURRING_CONCEPTS_QUERY + query.getLimit()),
                    bindings, query.getLimit());
        case COUNT_BY_TYPE:
            bindings.addBinding("type", Data.expand(argument.trim(), Data.getNamespaceMap()));
            return new Prepared(SelectQuery.from(COUNT_BY_TYPE_QUERY), bindings, 1);
        default:
            throw new IllegalArgumentException("Unsupported query template "
                    + query.getTemplate());
        }
    }

    private List<Map<String, String>> evaluate(final Prepared prepared, final long timeoutMs)
            throws IOException {
        final TripleTransaction tx = this.tripleStore.begin(true);
        try {
            final List<Map<String, String>> rows = Lists.newArrayList();
            for (final BindingSet solution : tx.query(prepared.query, prepared.bindings,
                    timeoutMs, prepared.limit)) {
                final Map<String, String> row = Maps.newLinkedHashMap();
                for (final String name : prepared.query.getVariables()) {
                    final Value value = solution.getValue(name);
                    if (value != null) {
                        row.put(name, value.stringValue());
                    }
                }
                rows.add(row);
            }
            return rows;
        } finally {
            endQuietly(tx);
        }
    }

    private int count(final Query query, final long timeoutMs) {
        final QueryResult result = query(query, timeoutMs);
        if (!result.isSuccess() || result.getCount() == 0) {
            LOGGER.warn("Could not compute {}: {}", query, result.getError());
            return 0;
        }
        final String count = result.getBindings().get(0).get("count");
        return count == null ? 0 : Integer.parseInt(count);
    }

    private void update(final List<Statement> statements, final boolean replace,
            final boolean publish) throws IOException {

        synchronized (this.writeMutex) {
            final TripleTransaction tx = this.tripleStore.begin(false);
            boolean committed = false;
            try {
                if (replace) {
                    tx.clear();
                }
                tx.add(statements);
                tx.end(true);
                committed = true;
            } finally {
                if (!committed) {
                    endQuietly(tx);
                }
            }
            if (publish) {
                publish();
            }
        }
    }

    private void publish() throws IOException {

        final TripleTransaction tx = this.tripleStore.begin(true);
        final List<Statement> statements;
        try {
            statements = tx.match(null, null, null);
        } finally {
            endQuietly(tx);
        }

        final File temp = new File(this.snapshotFile.getPath() + ".tmp");
        final OutputStream out = new GZIPOutputStream(new BufferedOutputStream(
                new FileOutputStream(temp)));
        try {
            final RDFWriter writer = Rio.createWriter(RDFFormat.NTRIPLES, out);
            writer.startRDF();
            for (final Statement statement : statements) {
                writer.handleStatement(statement);
            }
            writer.endRDF();
        } catch (final RDFHandlerException ex) {
            throw new IOException("Could not write snapshot " + temp, ex);
        } finally {
            out.close();
        }

        try {
            Files.move(temp.toPath(), this.snapshotFile.toPath(),
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException ex) {
            Files.move(temp.toPath(), this.snapshotFile.toPath(),
                    StandardCopyOption.REPLACE_EXISTING);
        }
        LOGGER.debug("Published {} statements to {}", statements.size(), this.snapshotFile);
    }

    private void refreshQuietly() {
        try {
            refresh();
        } catch (final IOException ex) {
            LOGGER.warn("Could not reload snapshot " + this.snapshotFile
                    + ", serving previous contents", ex);
        }
    }

    private static List<Statement> readSnapshot(final File file) throws IOException {
        final InputStream in = new BufferedInputStream(new FileInputStream(file));
        try {
            final RDFParser parser = Rio.createParser(RDFFormat.NTRIPLES,
                    Data.getValueFactory());
            parser.getParserConfig().set(BasicParserSettings.PRESERVE_BNODE_IDS, true);
            parser.getParserConfig().set(BasicParserSettings.VERIFY_DATATYPE_VALUES, false);
            final List<Statement> statements = Lists.newArrayList();
            parser.setRDFHandler(new StatementCollector(statements));
            parser.parse(new GZIPInputStream(in), "");
            return statements;

        } catch (final RDFParseException ex) {
            throw new DataCorruptedException("Corrupted snapshot " + file + ": "
                    + ex.getMessage(), ex);
        } catch (final ZipException ex) {
            throw new DataCorruptedException("Corrupted snapshot " + file, ex);
        } catch (final EOFException ex) {
            throw new DataCorruptedException("Truncated snapshot " + file, ex);
        } catch (final RDFHandlerException ex) {
            throw new IOException("Could not load snapshot " + file, ex);
        } finally {
            in.close();
        }
    }

    private static List<Object> stamp(final File file) throws IOException {
        final BasicFileAttributes attributes = Files.readAttributes(file.toPath(),
                BasicFileAttributes.class);
        return Arrays.<Object>asList(attributes.fileKey(), attributes.lastModifiedTime()
                .toMillis(), attributes.size());
    }

    private static void endQuietly(final TripleTransaction tx) {
        try {
            tx.end(false);
        } catch (final Throwable ex) {
            LOGGER.error("Could not end transaction " + tx, ex);
        }
    }

    private static final class Prepared {

        final SelectQuery query;

        final BindingSet bindings;

        final int limit;

        Prepared(final SelectQuery query, final BindingSet bindings, final int limit) {
            this.query = query;
            this.bindings = bindings;
            this.limit = limit;
        }

    }

}
