package org.livedoc.compiler.expansion;

import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.model.CrateModule;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.Span;
import org.livedoc.compiler.model.TokenId;

import java.util.Optional;

/**
 * The registry as seen by the expansion engine: previously expanded documents and the
 * lookups needed to resolve imports and report errors.
 */
public interface IDocumentStore {

    LiveDocument getExpandedDocument(FileId fileId);

    Optional<FileId> fileIdOf(CrateModule crateModule);

    /**
     * Source span of a token, or {@code null} when the token is unknown.
     */
    Span tokenIdToSpan(TokenId tokenId);
}
