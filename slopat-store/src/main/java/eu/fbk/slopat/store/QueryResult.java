package eu.fbk.slopat.store;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The outcome of a {@link GraphStore} query.
 * <p>
 * A successful result carries the solutions of the query as a list of variable name to value
 * maps, where URIs are rendered as full strings and literals by their label; unbound variables
 * are omitted. A failed result carries no solution and an error message. In both cases the
 * elapsed time is reported.
 * </p>
 */
public final class QueryResult {

    private final List<Map<String, String>> bindings;

    private final long elapsedMs;

    @Nullable
    private final String error;

    private QueryResult(final List<Map<String, String>> bindings, final long elapsedMs,
            @Nullable final String error) {
        this.bindings = bindings;
        this.elapsedMs = elapsedMs;
        this.error = error;
    }

    static QueryResult success(final List<Map<String, String>> bindings, final long elapsedMs) {
        final ImmutableList.Builder<Map<String, String>> builder = ImmutableList.builder();
        for (final Map<String, String> binding : bindings) {
            builder.add(ImmutableMap.copyOf(binding));
        }
        return new QueryResult(builder.build(), elapsedMs, null);
    }

    static QueryResult failure(final String error, final long elapsedMs) {
        return new QueryResult(ImmutableList.<Map<String, String>>of(), elapsedMs, error);
    }

    public boolean isSuccess() {
        return this.error == null;
    }

    public List<Map<String, String>> getBindings() {
        return this.bindings;
    }

    public int getCount() {
        return this.bindings.size();
    }

    public long getElapsedMs() {
        return this.elapsedMs;
    }

    @Nullable
    public String getError() {
        return this.error;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("count", getCount())
                .add("elapsedMs", this.elapsedMs).add("error", this.error).toString();
    }

}
