package org.livedoc.compiler.document;

import org.livedoc.compiler.model.LiveId;

/**
 * A single name binding, either on the expansion scope stack or captured into a
 * document's scope table by a function or variable body.
 */
public record LiveScopeItem(LiveId id, LiveScopeTarget target) {
}
