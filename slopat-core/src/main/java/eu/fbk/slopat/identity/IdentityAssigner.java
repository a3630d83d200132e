package eu.fbk.slopat.identity;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import com.google.common.net.UrlEscapers;

import org.openrdf.model.URI;

import eu.fbk.slopat.data.Data;
import eu.fbk.slopat.vocabulary.SLOP;

/**
 * Derives stable, content-addressed identifiers for documents and concepts.
 * <p>
 * Identifiers never depend on span positions, confidences or insertion order:
 * </p>
 * <ul>
 * <li>a concept identifier is derived from a SHA-256 digest of its text and label (case
 * sensitive, no normalization), so the same concept mentioned in different documents becomes
 * the same graph node;</li>
 * <li>a document identifier is derived from the stem of its file name, when one is supplied
 * (re-using a name intentionally aliases documents), or from a SHA-256 digest of its content, so
 * that re-submitting the same content yields the same document node.</li>
 * </ul>
 * <p>
 * Digests are truncated to {@link #DIGEST_LENGTH} hexadecimal characters (64 bits).
 * </p>
 */
public final class IdentityAssigner {

    /** Number of hexadecimal digest characters kept in identifiers. */
    public static final int DIGEST_LENGTH = 16;

    private static final HashFunction HASH_FUNCTION = Hashing.sha256();

    private final String documentNamespace;

    private final String conceptNamespace;

    public IdentityAssigner(final String documentNamespace, final String conceptNamespace) {
        this.documentNamespace = Preconditions.checkNotNull(documentNamespace);
        this.conceptNamespace = Preconditions.checkNotNull(conceptNamespace);
    }

    public IdentityAssigner() {
        this(SLOP.DOCUMENT_NAMESPACE, SLOP.CONCEPT_NAMESPACE);
    }

    /**
     * Returns the identifier of a document.
     *
     * @param content
     *            the raw document text
     * @param stableName
     *            an optional stable name, typically a file name or path; when not empty, its
     *            stem (directory and extension removed) is used instead of the content digest
     * @return the document URI
     */
    public URI documentID(final String content, @Nullable final String stableName) {
        Preconditions.checkNotNull(content);
        final String localName;
        final String stem = stableName == null ? null : stem(stableName);
        if (!Strings.isNullOrEmpty(stem)) {
            localName = UrlEscapers.urlPathSegmentEscaper().escape(stem);
        } else {
            localName = "doc-"
                    + HASH_FUNCTION.hashString(content, Charsets.UTF_8).toString()
                            .substring(0, DIGEST_LENGTH);
        }
        return Data.getValueFactory().createURI(this.documentNamespace + localName);
    }

    /**
     * Returns the identifier of a concept.
     *
     * @param text
     *            the concept text
     * @param label
     *            the extraction label
     * @return the concept URI
     */
    public URI conceptID(final String text, final String label) {
        final String digest = HASH_FUNCTION.newHasher() //
                .putInt(text.length()).putString(text, Charsets.UTF_8) //
                .putString(label, Charsets.UTF_8) //
                .hash().toString();
        return Data.getValueFactory().createURI(
                this.conceptNamespace + digest.substring(0, DIGEST_LENGTH));
    }

    private static String stem(final String name) {
        final String normalized = name.replace('\\', '/');
        return Files.getNameWithoutExtension(normalized.substring(normalized.lastIndexOf('/') + 1));
    }

}
