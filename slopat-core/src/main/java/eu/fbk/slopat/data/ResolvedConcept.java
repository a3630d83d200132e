package eu.fbk.slopat.data;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A {@link Span} that survived overlap resolution, tagged with the coarse domain its label maps
 * to.
 */
public final class ResolvedConcept extends Span {

    private static final long serialVersionUID = 1L;

    private final String domain;

    public ResolvedConcept(final Span span, final String domain) {
        super(span.getText(), span.getLabel(), span.getStart(), span.getEnd(), span
                .getConfidence(), span.getContext());
        this.domain = Preconditions.checkNotNull(domain);
    }

    public String getDomain() {
        return this.domain;
    }

    @Override
    public boolean equals(final Object object) {
        return super.equals(object) && this.domain.equals(((ResolvedConcept) object).domain);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(super.hashCode(), this.domain);
    }

    @Override
    public String toString() {
        return super.toString() + " {" + this.domain + "}";
    }

}
