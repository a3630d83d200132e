package eu.fbk.slopat.data;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A labeled, positioned text span proposed by an extraction model.
 * <p>
 * Offsets are half-open ({@code [start, end)}) character offsets into the source document. The
 * {@code context} is a short excerpt around the span, kept for display and disambiguation only:
 * it never participates in identifier derivation. Spans are produced by external code and may
 * overlap, be duplicated or be malformed; see {@code SpanResolver#sanitize} for the validation
 * applied before resolution.
 * </p>
 */
public class Span implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String text;

    private final String label;

    private final int start;

    private final int end;

    private final double confidence;

    private final String context;

    /**
     * Creates a new span.
     *
     * @param text
     *            the span text
     * @param label
     *            the extraction label
     * @param start
     *            the start offset (inclusive)
     * @param end
     *            the end offset (exclusive)
     * @param confidence
     *            the extraction confidence
     * @param context
     *            the optional context excerpt, null being stored as an empty string
     */
    public Span(final String text, final String label, final int start, final int end,
            final double confidence, @Nullable final String context) {
        this.text = Preconditions.checkNotNull(text);
        this.label = Preconditions.checkNotNull(label);
        this.start = start;
        this.end = end;
        this.confidence = confidence;
        this.context = context == null ? "" : context;
    }

    /**
     * Creates a new span with no context.
     */
    public Span(final String text, final String label, final int start, final int end,
            final double confidence) {
        this(text, label, start, end, confidence, null);
    }

    public String getText() {
        return this.text;
    }

    public String getLabel() {
        return this.label;
    }

    public int getStart() {
        return this.start;
    }

    public int getEnd() {
        return this.end;
    }

    public double getConfidence() {
        return this.confidence;
    }

    public String getContext() {
        return this.context;
    }

    /**
     * Checks whether this span overlaps the supplied one, using half-open interval semantics.
     *
     * @param other
     *            the other span
     * @return true if the two intervals intersect
     */
    public boolean overlaps(final Span other) {
        return !(this.end <= other.start || other.end <= this.start);
    }

    /**
     * Returns a copy of this span with the context replaced.
     *
     * @param context
     *            the new context
     * @return the resulting span
     */
    public Span withContext(final String context) {
        return new Span(this.text, this.label, this.start, this.end, this.confidence, context);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (object == null || object.getClass() != getClass()) {
            return false;
        }
        final Span other = (Span) object;
        return this.start == other.start && this.end == other.end
                && Double.compare(this.confidence, other.confidence) == 0
                && this.text.equals(other.text) && this.label.equals(other.label)
                && this.context.equals(other.context);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.text, this.label, this.start, this.end, this.confidence);
    }

    @Override
    public String toString() {
        return "\"" + this.text + "\"/" + this.label + "[" + this.start + "," + this.end + ")@"
                + this.confidence;
    }

}
