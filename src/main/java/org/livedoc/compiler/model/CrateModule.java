package org.livedoc.compiler.model;

/**
 * The two-part namespace key that identifies the declarations of one source file.
 *
 * @param crate  The crate identifier.
 * @param module The module identifier inside the crate.
 */
public record CrateModule(LiveId crate, LiveId module) {

    public static CrateModule of(String crate, String module) {
        return new CrateModule(LiveId.of(crate), LiveId.of(module));
    }

    @Override
    public String toString() {
        return crate + "::" + module;
    }
}
