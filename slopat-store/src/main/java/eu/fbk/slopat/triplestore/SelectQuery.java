package eu.fbk.slopat.triplestore;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;

import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.parser.ParsedQuery;
import org.openrdf.query.parser.ParsedTupleQuery;
import org.openrdf.query.parser.QueryParserUtil;

import eu.fbk.slopat.data.ParseException;

/**
 * A SPARQL SELECT query whose syntax has been checked. Instances are cached by query string, so
 * each query template is parsed once.
 */
public final class SelectQuery {

    private static final Cache<String, SelectQuery> CACHE = CacheBuilder.newBuilder()
            .maximumSize(256).build();

    private final String string;

    private final List<String> variables;

    private SelectQuery(final String string, final Iterable<String> variables) {
        this.string = string;
        this.variables = ImmutableList.copyOf(variables);
    }

    /**
     * Returns the query for the string specified.
     *
     * @param string
     *            the SPARQL string, with absolute URIs only
     * @return the query
     * @throws ParseException
     *             if the string is not a syntactically valid SELECT query
     */
    public static SelectQuery from(final String string) throws ParseException {
        Preconditions.checkNotNull(string);
        final SelectQuery cached = CACHE.getIfPresent(string);
        if (cached != null) {
            return cached;
        }
        final ParsedQuery parsed;
        try {
            parsed = QueryParserUtil.parseQuery(QueryLanguage.SPARQL, string, null);
        } catch (final MalformedQueryException ex) {
            throw new ParseException(string, "Invalid SPARQL: " + ex.getMessage(), ex);
        }
        if (!(parsed instanceof ParsedTupleQuery)) {
            throw new ParseException(string, "Not a SELECT query");
        }
        final SelectQuery query = new SelectQuery(string, parsed.getTupleExpr()
                .getBindingNames());
        CACHE.put(string, query);
        return query;
    }

    public String getString() {
        return this.string;
    }

    /**
     * Returns the projected variables, in projection order.
     *
     * @return the variable names
     */
    public List<String> getVariables() {
        return this.variables;
    }

    @Override
    public boolean equals(final Object object) {
        return object == this || object instanceof SelectQuery
                && this.string.equals(((SelectQuery) object).string);
    }

    @Override
    public int hashCode() {
        return this.string.hashCode();
    }

    @Override
    public String toString() {
        return this.string;
    }

}
