package eu.fbk.slopat.data;

/**
 * The type of a document, as detected by a document classifier.
 */
public enum DocumentType {

    CONVERSATION,

    MARKDOWN,

    PLAIN_TEXT,

    STRUCTURED,

    RANDOM;

    /**
     * Returns the local name of the ontology class for this document type, e.g.
     * {@code PlainTextDocument} for {@link #PLAIN_TEXT}.
     *
     * @return the class local name
     */
    public String getClassName() {
        final StringBuilder builder = new StringBuilder();
        for (final String token : name().split("_")) {
            builder.append(token.charAt(0)).append(token.substring(1).toLowerCase());
        }
        return builder.append("Document").toString();
    }

}
