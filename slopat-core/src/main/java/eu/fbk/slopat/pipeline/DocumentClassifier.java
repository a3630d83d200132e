package eu.fbk.slopat.pipeline;

import java.io.IOException;

import eu.fbk.slopat.data.DocumentMetadata;

/**
 * An external classifier assigning a {@link eu.fbk.slopat.data.DocumentType} and a feature
 * table to a document.
 */
public interface DocumentClassifier {

    DocumentMetadata classify(String content) throws IOException;

}
