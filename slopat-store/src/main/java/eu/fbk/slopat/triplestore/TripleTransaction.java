package eu.fbk.slopat.triplestore;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.Binding;
import org.openrdf.query.BindingSet;
import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.QueryEvaluationException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.TupleQuery;
import org.openrdf.query.TupleQueryResult;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.RepositoryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.slopat.internal.Util;
import eu.fbk.slopat.runtime.DataCorruptedException;

/**
 * A unit of work on a {@link TripleStore}, bound to one repository connection.
 * <p>
 * Results are fully materialized before being returned, so no iteration outlives the call that
 * produced it. Write methods fail with {@link IllegalStateException} on read-only transactions.
 * Method {@link #end(boolean)} may be called by any thread, also to abort a transaction used by
 * another thread; the other methods are meant for a single thread.
 * </p>
 */
public final class TripleTransaction {

    private static final Logger LOGGER = LoggerFactory.getLogger(TripleTransaction.class);

    private static final AtomicLong COUNTER = new AtomicLong();

    private final TripleStore store;

    private final RepositoryConnection connection;

    private final boolean readOnly;

    private final long id;

    private final long startTime;

    private final AtomicBoolean ended;

    TripleTransaction(final TripleStore store, final RepositoryConnection connection,
            final boolean readOnly) {
        this.store = store;
        this.connection = connection;
        this.readOnly = readOnly;
        this.id = COUNTER.incrementAndGet();
        this.startTime = System.currentTimeMillis();
        this.ended = new AtomicBoolean(false);
        LOGGER.debug("{} started", this);
    }

    public boolean isReadOnly() {
        return this.readOnly;
    }

    /**
     * Returns the statements matching a pattern; null components match anything.
     *
     * @param subject
     *            the subject, null for any
     * @param predicate
     *            the predicate, null for any
     * @param object
     *            the object, null for any
     * @return the matching statements
     * @throws IOException
     *             on repository failure
     */
    public List<Statement> match(@Nullable final Resource subject,
            @Nullable final URI predicate, @Nullable final Value object) throws IOException {
        checkActive();
        RepositoryResult<Statement> result = null;
        try {
            result = this.connection.getStatements(subject, predicate, object, false);
            final List<Statement> statements = Lists.newArrayList();
            while (result.hasNext()) {
                statements.add(result.next());
            }
            return statements;
        } catch (final RepositoryException ex) {
            throw new IOException("Could not match (" + subject + ", " + predicate + ", "
                    + object + ")", ex);
        } finally {
            Util.closeQuietly(result);
        }
    }

    /**
     * Evaluates a SELECT query, returning at most {@code limit} solutions.
     *
     * @param query
     *            the query
     * @param bindings
     *            values for some query variables, null if none
     * @param timeoutMs
     *            the evaluation timeout, enforced by Sesame in whole seconds
     * @param limit
     *            the maximum number of solutions to read
     * @return the solutions read
     * @throws IOException
     *             if evaluation fails or times out
     */
    public List<BindingSet> query(final SelectQuery query, @Nullable final BindingSet bindings,
            final long timeoutMs, final int limit) throws IOException {

        Preconditions.checkArgument(limit >= 0);
        checkActive();

        final long ts = System.currentTimeMillis();
        final TupleQuery tupleQuery;
        try {
            tupleQuery = this.connection.prepareTupleQuery(QueryLanguage.SPARQL,
                    query.getString());
        } catch (final MalformedQueryException ex) {
            throw new IllegalArgumentException("Query rejected by repository: "
                    + ex.getMessage(), ex);
        } catch (final RepositoryException ex) {
            throw new IOException("Could not prepare query", ex);
        }

        if (bindings != null) {
            for (final Binding binding : bindings) {
                tupleQuery.setBinding(binding.getName(), binding.getValue());
            }
        }
        tupleQuery.setMaxQueryTime((int) Math.max(1L, (timeoutMs + 999L) / 1000L));

        TupleQueryResult result = null;
        try {
            result = tupleQuery.evaluate();
            final List<BindingSet> solutions = Lists.newArrayList();
            while (solutions.size() < limit && result.hasNext()) {
                solutions.add(result.next());
            }
            LOGGER.debug("{} read {} solutions in {} ms", this, solutions.size(),
                    System.currentTimeMillis() - ts);
            return solutions;
        } catch (final QueryEvaluationException ex) {
            throw new IOException("Evaluation failed after " + (System.currentTimeMillis() - ts)
                    + " ms: " + ex.getMessage(), ex);
        } finally {
            Util.closeQuietly(result);
        }
    }

    public void add(final Iterable<? extends Statement> statements) throws IOException {
        Preconditions.checkNotNull(statements);
        checkWritable();
        try {
            this.connection.add(statements);
        } catch (final RepositoryException ex) {
            throw new IOException("Could not add statements", ex);
        }
    }

    /**
     * Removes every statement of the store.
     *
     * @throws IOException
     *             on repository failure
     */
    public void clear() throws IOException {
        checkWritable();
        try {
            this.connection.clear();
        } catch (final RepositoryException ex) {
            throw new IOException("Could not clear store", ex);
        }
    }

    /**
     * Ends the transaction, committing or discarding its changes, and releases its connection.
     * Calling it on an ended transaction has no effect.
     *
     * @param commit
     *            true to commit
     * @throws IOException
     *             if the commit fails, in which case changes are discarded
     * @throws DataCorruptedException
     *             if changes cannot be discarded
     */
    public void end(final boolean commit) throws IOException {
        if (!this.ended.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!this.readOnly) {
                if (commit) {
                    commit();
                } else {
                    rollback();
                }
            }
        } finally {
            closeQuietly(this.connection);
            this.store.ended(this);
            LOGGER.debug("{} ended after {} ms", this, System.currentTimeMillis()
                    - this.startTime);
        }
    }

    private void commit() throws IOException {
        try {
            this.connection.commit();
        } catch (final RepositoryException ex) {
            rollback();
            throw new IOException("Commit of " + this + " failed, changes discarded", ex);
        }
    }

    private void rollback() throws DataCorruptedException {
        try {
            this.connection.rollback();
        } catch (final RepositoryException ex) {
            throw new DataCorruptedException("Rollback of " + this + " failed", ex);
        }
    }

    private void checkActive() {
        Preconditions.checkState(!this.ended.get(), "%s already ended", this);
    }

    private void checkWritable() {
        checkActive();
        Preconditions.checkState(!this.readOnly, "%s is read-only", this);
    }

    static void closeQuietly(final RepositoryConnection connection) {
        try {
            connection.close();
        } catch (final RepositoryException ex) {
            LOGGER.error("Could not close repository connection", ex);
        }
    }

    @Override
    public String toString() {
        return (this.readOnly ? "read" : "write") + " transaction " + this.id;
    }

}
