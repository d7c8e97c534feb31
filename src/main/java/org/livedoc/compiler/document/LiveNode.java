package org.livedoc.compiler.document;

import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.TokenId;

/**
 * One entry of a document tree.
 *
 * @param tokenId The token the node originates from, used for diagnostics.
 * @param idPack  The declared id (empty for anonymous array elements).
 * @param value   The node value.
 */
public record LiveNode(TokenId tokenId, IdPack idPack, LiveValue value) {

    public LiveNode withValue(LiveValue newValue) {
        return new LiveNode(tokenId, idPack, newValue);
    }

    public LiveNode withId(IdPack newId) {
        return new LiveNode(tokenId, newId, value);
    }

    public boolean isClass() {
        return value instanceof LiveValue.ClassValue;
    }
}
