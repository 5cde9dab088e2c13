package com.eainde.bidding.provider;

import com.eainde.bidding.model.Document;

import java.nio.file.Path;

/**
 * Loads a document as plain text.
 *
 * @see com.eainde.bidding.error.EmptyDocumentException
 * @see com.eainde.bidding.error.UnsupportedFormatException
 */
public interface DocumentSource {

    Document loadText(Path file);
}
