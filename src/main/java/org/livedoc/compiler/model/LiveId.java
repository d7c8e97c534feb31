package org.livedoc.compiler.model;

import java.util.Objects;

/**
 * An interned identifier symbol. The empty identifier marks a wildcard
 * (e.g. the {@code *} of a {@code use} path or an anonymous array element).
 *
 * @param name The identifier text.
 */
public record LiveId(String name) {

    public static final LiveId EMPTY = new LiveId("");

    public LiveId {
        Objects.requireNonNull(name, "name");
    }

    public static LiveId of(String name) {
        return name.isEmpty() ? EMPTY : new LiveId(name);
    }

    public boolean isEmpty() {
        return name.isEmpty();
    }

    @Override
    public String toString() {
        return name.isEmpty() ? "*" : name;
    }
}
