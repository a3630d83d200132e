package eu.fbk.slopat.data;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;

/**
 * The statements derived from one processing pass over a document.
 * <p>
 * A {@code StatementSet} bundles an ordered, immutable list of {@link Statement}s with the
 * prefix-to-namespace table used to build (and to render) them, and with two bookkeeping counters:
 * the number of concepts mapped and the number of relationships created. Instances are created
 * once per document (or once per parsed text) and handed as a whole to the graph store.
 * </p>
 */
public final class StatementSet implements Iterable<Statement> {

    private final List<Statement> statements;

    private final Map<String, String> namespaces;

    private final int conceptsMapped;

    private final int relationshipsCreated;

    @Nullable
    private final URI documentID;

    public StatementSet(final Iterable<? extends Statement> statements,
            final Map<String, String> namespaces, final int conceptsMapped,
            final int relationshipsCreated, @Nullable final URI documentID) {
        Preconditions.checkArgument(conceptsMapped >= 0);
        Preconditions.checkArgument(relationshipsCreated >= 0);
        this.statements = ImmutableList.copyOf(statements);
        this.namespaces = ImmutableMap.copyOf(namespaces);
        this.conceptsMapped = conceptsMapped;
        this.relationshipsCreated = relationshipsCreated;
        this.documentID = documentID;
    }

    public StatementSet(final Iterable<? extends Statement> statements,
            final Map<String, String> namespaces) {
        this(statements, namespaces, 0, 0, null);
    }

    public List<Statement> getStatements() {
        return this.statements;
    }

    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    public int getConceptsMapped() {
        return this.conceptsMapped;
    }

    public int getRelationshipsCreated() {
        return this.relationshipsCreated;
    }

    /**
     * Returns the URI of the document this set was built for, if any.
     *
     * @return the document URI, or null for sets not originating from a document
     */
    @Nullable
    public URI getDocumentID() {
        return this.documentID;
    }

    /**
     * Returns the distinct subjects of the set, in order of first appearance.
     *
     * @return the subjects
     */
    public Set<Resource> getSubjects() {
        final Set<Resource> subjects = Sets.newLinkedHashSet();
        for (final Statement statement : this.statements) {
            subjects.add(statement.getSubject());
        }
        return subjects;
    }

    public int size() {
        return this.statements.size();
    }

    public boolean isEmpty() {
        return this.statements.isEmpty();
    }

    @Override
    public Iterator<Statement> iterator() {
        return this.statements.iterator();
    }

    @Override
    public String toString() {
        return this.statements.size() + " statements, " + this.conceptsMapped
                + " concepts mapped, " + this.relationshipsCreated + " relationships created"
                + (this.documentID == null ? "" : " (" + this.documentID + ")");
    }

}
