package eu.fbk.slopat.triplestore;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.sail.SailRepository;
import org.openrdf.sail.Sail;
import org.openrdf.sail.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.slopat.runtime.Component;

/**
 * The statement storage behind a graph store, kept in a Sesame {@code SailRepository}.
 * <p>
 * Contents are accessed through {@link TripleTransaction}s obtained with {@link #begin(boolean)}.
 * A write transaction holds a Sesame transaction until it ends; a read-only one runs on an
 * auto-commit connection instead, as a {@link MemoryStore} transaction excludes any other one
 * and reads would otherwise queue behind a pending write. Callers are expected to serialize
 * write transactions themselves. Closing the store discards the changes of the transactions
 * still open and ends them.
 * </p>
 */
public final class TripleStore implements Component {

    private static final Logger LOGGER = LoggerFactory.getLogger(TripleStore.class);

    private static final int NEW = 0;

    private static final int ACTIVE = 1;

    private static final int CLOSED = 2;

    private final Repository repository;

    private final Set<TripleTransaction> pending;

    private final AtomicInteger state;

    public TripleStore() {
        this(new MemoryStore());
    }

    public TripleStore(final Sail sail) {
        this.repository = new SailRepository(Preconditions.checkNotNull(sail));
        this.pending = Sets.newConcurrentHashSet();
        this.state = new AtomicInteger(NEW);
    }

    @Override
    public void init() throws IOException {
        Preconditions.checkState(this.state.compareAndSet(NEW, ACTIVE),
                "Triple store already initialized or closed");
        try {
            this.repository.initialize();
        } catch (final RepositoryException ex) {
            throw new IOException("Could not initialize " + this.repository, ex);
        }
    }

    /**
     * Starts a transaction.
     *
     * @param readOnly
     *            true if the transaction will only read statements
     * @return the transaction, to be ended with {@link TripleTransaction#end(boolean)}
     * @throws IOException
     *             if no repository connection can be obtained
     * @throws IllegalStateException
     *             if the store is not initialized or closed
     */
    public TripleTransaction begin(final boolean readOnly) throws IOException,
            IllegalStateException {

        Preconditions.checkState(this.state.get() == ACTIVE, "Triple store not active");

        final RepositoryConnection connection;
        try {
            connection = this.repository.getConnection();
            if (!readOnly) {
                try {
                    connection.begin();
                } catch (final RepositoryException ex) {
                    TripleTransaction.closeQuietly(connection);
                    throw ex;
                }
            }
        } catch (final RepositoryException ex) {
            throw new IOException("Could not start " + (readOnly ? "read" : "write")
                    + " transaction", ex);
        }

        final TripleTransaction tx = new TripleTransaction(this, connection, readOnly);
        this.pending.add(tx);
        if (this.state.get() != ACTIVE) {
            tx.end(false);
            throw new IllegalStateException("Triple store closed");
        }
        return tx;
    }

    void ended(final TripleTransaction tx) {
        this.pending.remove(tx);
    }

    @Override
    public void close() {
        if (this.state.getAndSet(CLOSED) != ACTIVE) {
            return;
        }
        for (final TripleTransaction tx : ImmutableList.copyOf(this.pending)) {
            LOGGER.warn("Forcing rollback of {} on close", tx);
            try {
                tx.end(false);
            } catch (final IOException ex) {
                LOGGER.error("Could not roll back " + tx, ex);
            }
        }
        try {
            this.repository.shutDown();
        } catch (final RepositoryException ex) {
            LOGGER.error("Could not shut down " + this.repository, ex);
        }
    }

    @Override
    public String toString() {
        return "TripleStore(" + this.pending.size() + " pending transactions)";
    }

}
