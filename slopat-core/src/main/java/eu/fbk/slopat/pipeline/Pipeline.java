package eu.fbk.slopat.pipeline;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.slopat.data.DocumentMetadata;
import eu.fbk.slopat.data.ResolvedConcept;
import eu.fbk.slopat.data.Span;
import eu.fbk.slopat.data.StatementSet;
import eu.fbk.slopat.internal.Logging;
import eu.fbk.slopat.mapping.TripleBuilder;
import eu.fbk.slopat.resolve.SpanResolver;

/**
 * Turns documents into statement sets: sanitizes and resolves extracted spans, derives missing
 * span contexts and maps the result through a {@link TripleBuilder}.
 * <p>
 * A pipeline holds no mutable state, so documents can be processed concurrently, either by
 * calling {@link #process(String, String)} from several threads or via
 * {@link #processAll(Map, ExecutorService)} and
 * {@link #processDirectory(File, String, ExecutorService)}. While a document is processed, the
 * {@link Logging#MDC_CONTEXT} MDC key holds the local name of its identifier.
 * </p>
 */
public final class Pipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

    /** Default number of characters taken on each side of a span to build its context. */
    public static final int DEFAULT_CONTEXT_WINDOW = 50;

    private static final Splitter TOKEN_SPLITTER = Splitter.on(CharMatcher.WHITESPACE)
            .omitEmptyStrings();

    private final SpanResolver resolver;

    private final TripleBuilder tripleBuilder;

    @Nullable
    private final SpanExtractor extractor;

    @Nullable
    private final DocumentClassifier classifier;

    private final int contextWindow;

    private Pipeline(final Builder builder) {
        this.resolver = builder.resolver;
        this.tripleBuilder = builder.tripleBuilder;
        this.extractor = builder.extractor;
        this.classifier = builder.classifier;
        this.contextWindow = builder.contextWindow;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Processes a document whose spans and classification are already available.
     *
     * @param content
     *            the document content
     * @param spans
     *            the extracted spans, possibly overlapping or malformed
     * @param metadata
     *            the document classification
     * @param stableName
     *            the optional stable name (e.g., file path) of the document
     * @return the processing result
     */
    public ProcessingResult process(final String content, final Iterable<? extends Span> spans,
            final DocumentMetadata metadata, @Nullable final String stableName) {

        Preconditions.checkNotNull(content);
        Preconditions.checkNotNull(spans);
        Preconditions.checkNotNull(metadata);

        final URI documentID = this.tripleBuilder.getIdentityAssigner().documentID(content,
                stableName);
        final Map<String, String> mdc = Logging.setContext(documentID.getLocalName());
        try {
            final long ts = System.currentTimeMillis();

            final List<Span> sanitized = this.resolver.sanitize(spans, content.length());
            final List<Span> contextualized = Lists.newArrayListWithCapacity(sanitized.size());
            for (final Span span : sanitized) {
                contextualized.add(span.getContext().isEmpty() ? span.withContext(deriveContext(
                        content, span)) : span);
            }

            final List<ResolvedConcept> concepts = this.resolver.resolve(contextualized);
            final Map<String, Integer> distribution = SpanResolver.domainDistribution(concepts);
            final StatementSet statements = this.tripleBuilder.build(content, concepts,
                    metadata, stableName);

            final int tokens = Iterables.size(TOKEN_SPLITTER.split(content));
            final double density = tokens == 0 ? 0.0 : (double) concepts.size() / tokens;
            double confidence = 0.0;
            for (final ResolvedConcept concept : concepts) {
                confidence += concept.getConfidence();
            }
            confidence = concepts.isEmpty() ? 0.0 : confidence / concepts.size();

            final ProcessingResult result = new ProcessingResult(documentID, metadata,
                    contextualized, concepts, distribution, density, confidence, statements);
            LOGGER.debug("Processed in {} ms: {}", System.currentTimeMillis() - ts, result);
            return result;

        } finally {
            Logging.setMDC(mdc);
        }
    }

    /**
     * Processes a document, running the configured extractor and classifier on it.
     *
     * @param content
     *            the document content
     * @param stableName
     *            the optional stable name (e.g., file path) of the document
     * @return the processing result
     * @throws IOException
     *             if the extractor or the classifier fail
     */
    public ProcessingResult process(final String content, @Nullable final String stableName)
            throws IOException {
        Preconditions.checkState(this.extractor != null, "No span extractor configured");
        Preconditions.checkState(this.classifier != null, "No document classifier configured");
        final DocumentMetadata metadata = this.classifier.classify(content);
        final List<Span> spans = this.extractor.extract(content);
        return process(content, spans, metadata, stableName);
    }

    /**
     * Processes a UTF-8 text file, using its path as stable name.
     *
     * @param file
     *            the file
     * @return the processing result
     * @throws IOException
     *             if the file cannot be read, or the extractor or the classifier fail
     */
    public ProcessingResult processFile(final File file) throws IOException {
        LOGGER.info("Processing file {}", file);
        return process(Files.toString(file, Charsets.UTF_8), file.getPath());
    }

    /**
     * Processes several independent documents in parallel. A document whose processing fails is
     * logged and left out of the result; the other documents are processed anyway.
     *
     * @param documents
     *            a stable name to content map
     * @param executor
     *            the executor running the processing tasks
     * @return a stable name to result map for the documents processed successfully, in the
     *         iteration order of the input map
     * @throws IOException
     *             if interrupted while waiting for results
     */
    public Map<String, ProcessingResult> processAll(final Map<String, String> documents,
            final ExecutorService executor) throws IOException {
        final Map<String, Callable<ProcessingResult>> tasks = Maps.newLinkedHashMap();
        for (final Map.Entry<String, String> entry : documents.entrySet()) {
            tasks.put(entry.getKey(), new Callable<ProcessingResult>() {

                @Override
                public ProcessingResult call() throws IOException {
                    return process(entry.getValue(), entry.getKey());
                }

            });
        }
        return processBatch(tasks, executor);
    }

    /**
     * Processes in parallel the files of a directory whose names match a glob pattern (e.g.,
     * {@code *.txt}), as done by {@link #processFile(File)}. Files are processed in name order;
     * failures are logged and skipped as in {@link #processAll(Map, ExecutorService)}.
     *
     * @param directory
     *            the directory, not scanned recursively
     * @param glob
     *            the file name pattern
     * @param executor
     *            the executor running the processing tasks
     * @return a file path to result map for the files processed successfully
     * @throws IOException
     *             if the directory cannot be listed, or if interrupted
     */
    public Map<String, ProcessingResult> processDirectory(final File directory,
            final String glob, final ExecutorService executor) throws IOException {

        Preconditions.checkNotNull(glob);

        final List<Path> paths = Lists.newArrayList();
        final DirectoryStream<Path> stream = java.nio.file.Files.newDirectoryStream(
                directory.toPath(), glob);
        try {
            for (final Path path : stream) {
                if (java.nio.file.Files.isRegularFile(path)) {
                    paths.add(path);
                }
            }
        } finally {
            stream.close();
        }
        Collections.sort(paths);
        LOGGER.info("Processing {} files matching {} in {}", paths.size(), glob, directory);

        final Map<String, Callable<ProcessingResult>> tasks = Maps.newLinkedHashMap();
        for (final Path path : paths) {
            final File file = path.toFile();
            tasks.put(file.getPath(), new Callable<ProcessingResult>() {

                @Override
                public ProcessingResult call() throws IOException {
                    return processFile(file);
                }

            });
        }
        return processBatch(tasks, executor);
    }

    private Map<String, ProcessingResult> processBatch(
            final Map<String, Callable<ProcessingResult>> tasks, final ExecutorService executor)
            throws IOException {

        final Map<String, Future<ProcessingResult>> futures = Maps.newLinkedHashMap();
        for (final Map.Entry<String, Callable<ProcessingResult>> entry : tasks.entrySet()) {
            futures.put(entry.getKey(), executor.submit(entry.getValue()));
        }

        final Map<String, ProcessingResult> results = Maps.newLinkedHashMap();
        try {
            for (final Map.Entry<String, Future<ProcessingResult>> entry : futures.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (final ExecutionException ex) {
                    final Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    LOGGER.error("Processing of " + entry.getKey() + " failed: "
                            + cause.getMessage(), cause);
                }
            }
        } catch (final InterruptedException ex) {
            for (final Future<ProcessingResult> future : futures.values()) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while processing documents");
        }

        LOGGER.info("Processed {}/{} documents successfully", results.size(), tasks.size());
        return results;
    }

    private String deriveContext(final String content, final Span span) {
        final int start = Math.max(0, span.getStart() - this.contextWindow);
        final int end = Math.min(content.length(), span.getEnd() + this.contextWindow);
        return content.substring(start, end).trim();
    }

    public static final class Builder {

        SpanResolver resolver = new SpanResolver();

        TripleBuilder tripleBuilder = TripleBuilder.builder().build();

        @Nullable
        SpanExtractor extractor;

        @Nullable
        DocumentClassifier classifier;

        int contextWindow = DEFAULT_CONTEXT_WINDOW;

        Builder() {
        }

        public Builder resolver(final SpanResolver resolver) {
            this.resolver = Preconditions.checkNotNull(resolver);
            return this;
        }

        public Builder tripleBuilder(final TripleBuilder tripleBuilder) {
            this.tripleBuilder = Preconditions.checkNotNull(tripleBuilder);
            return this;
        }

        public Builder extractor(@Nullable final SpanExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder classifier(@Nullable final DocumentClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder contextWindow(final int contextWindow) {
            Preconditions.checkArgument(contextWindow >= 0, "Negative context window");
            this.contextWindow = contextWindow;
            return this;
        }

        public Pipeline build() {
            return new Pipeline(this);
        }

    }

}
