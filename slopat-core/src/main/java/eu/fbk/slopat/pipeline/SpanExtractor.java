package eu.fbk.slopat.pipeline;

import java.io.IOException;
import java.util.List;

import eu.fbk.slopat.data.Span;

/**
 * An external model extracting labeled spans from document text.
 * <p>
 * Returned spans may overlap and may be malformed; they are sanitized and resolved by the
 * {@link Pipeline} before use.
 * </p>
 */
public interface SpanExtractor {

    List<Span> extract(String content) throws IOException;

}
