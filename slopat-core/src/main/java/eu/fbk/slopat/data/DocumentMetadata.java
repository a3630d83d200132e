package eu.fbk.slopat.data;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Document classification result, as returned by a {@code DocumentClassifier}.
 * <p>
 * Besides the detected {@link DocumentType} and its confidence, a {@code DocumentMetadata}
 * carries an ordered feature table (name to value) and an optional suggested title. Feature
 * values that are numbers or booleans are mapped to typed literals; other values are kept for
 * external consumers only.
 * </p>
 */
public final class DocumentMetadata {

    private final DocumentType type;

    private final double confidence;

    private final Map<String, Object> features;

    @Nullable
    private final String title;

    public DocumentMetadata(final DocumentType type, final double confidence,
            @Nullable final Map<String, ?> features, @Nullable final String title) {
        this.type = Preconditions.checkNotNull(type);
        this.confidence = confidence;
        this.features = features == null ? ImmutableMap.<String, Object>of() : ImmutableMap
                .<String, Object>copyOf(features);
        this.title = title;
    }

    public DocumentMetadata(final DocumentType type, final double confidence) {
        this(type, confidence, null, null);
    }

    public DocumentType getType() {
        return this.type;
    }

    public double getConfidence() {
        return this.confidence;
    }

    public Map<String, Object> getFeatures() {
        return this.features;
    }

    @Nullable
    public String getTitle() {
        return this.title;
    }

    @Override
    public String toString() {
        return this.type + " (" + this.confidence + ")"
                + (this.title == null ? "" : " '" + this.title + "'");
    }

}
