package eu.fbk.slopat.store;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import org.openrdf.model.URI;

/**
 * A query descriptor: one of the fixed query templates supported by {@link GraphStore}, with its
 * parameters.
 * <p>
 * Descriptors are not validated on creation: a malformed descriptor (e.g., a missing label or a
 * non-positive limit) is reported by {@link GraphStore#query(Query, long)} as a failed result.
 * </p>
 */
public final class Query {

    public static final int DEFAULT_LIMIT = 10;

    /** The query templates. */
    public enum Template {

        /**
         * Documents discussing a concept with a given label: variables {@code doc},
         * {@code title}, {@code confidence}, {@code domain}; by confidence, descending.
         */
        DOCUMENTS_DISCUSSING,

        /**
         * Labels of the concepts co-occurring with a concept with a given label: variables
         * {@code related_concept}, {@code frequency} (number of documents discussing both); by
         * frequency, descending.
         */
        CO_OCCURRING_CONCEPTS,

        /** Number of distinct resources of a given type: variable {@code count}. */
        COUNT_BY_TYPE

    }

    private final Template template;

    @Nullable
    private final String argument;

    private final int limit;

    private Query(final Template template, @Nullable final String argument, final int limit) {
        this.template = template;
        this.argument = argument;
        this.limit = limit;
    }

    public static Query documentsDiscussing(@Nullable final String label, final int limit) {
        return new Query(Template.DOCUMENTS_DISCUSSING, label, limit);
    }

    public static Query documentsDiscussing(@Nullable final String label) {
        return documentsDiscussing(label, DEFAULT_LIMIT);
    }

    public static Query coOccurringConcepts(@Nullable final String label, final int limit) {
        return new Query(Template.CO_OCCURRING_CONCEPTS, label, limit);
    }

    public static Query coOccurringConcepts(@Nullable final String label) {
        return coOccurringConcepts(label, DEFAULT_LIMIT);
    }

    /**
     * Returns a descriptor counting the resources of the type specified.
     *
     * @param type
     *            the type, either as a full URI or in prefixed form (e.g., {@code slop:Concept})
     * @return the created descriptor
     */
    public static Query countByType(@Nullable final String type) {
        return new Query(Template.COUNT_BY_TYPE, type, 1);
    }

    public static Query countByType(final URI type) {
        return countByType(type.stringValue());
    }

    public Template getTemplate() {
        return this.template;
    }

    /**
     * Returns the template argument: either the concept label or the type.
     */
    @Nullable
    public String getArgument() {
        return this.argument;
    }

    public int getLimit() {
        return this.limit;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("template", this.template)
                .add("argument", this.argument).add("limit", this.limit).toString();
    }

}
