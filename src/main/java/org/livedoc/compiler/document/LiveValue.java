package org.livedoc.compiler.document;

import org.livedoc.compiler.model.CrateModule;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;

/**
 * The value carried by a {@link LiveNode}.
 *
 * <p>Spans ({@code nodeStart}, {@code nodeCount}) address a contiguous run of sibling
 * nodes one child level below the owning node, see {@link LiveDocument#childLevel}.
 * String, token and scope spans address the owning document's interned tables.</p>
 */
public sealed interface LiveValue permits LiveValue.Container, LiveValue.Body, LiveValue.BoolValue,
        LiveValue.IntValue, LiveValue.FloatValue, LiveValue.ColorValue, LiveValue.Vec2Value, LiveValue.Vec3Value,
        LiveValue.IdValue, LiveValue.StringValue, LiveValue.ResourceRefValue, LiveValue.UseValue {

    /**
     * Values that own a span of child nodes.
     */
    sealed interface Container extends LiveValue permits ClassValue, ObjectValue, ArrayValue, CallValue {
        int nodeStart();

        int nodeCount();

        /**
         * Returns the same kind of container pointing at a different child span.
         */
        Container withSpan(int nodeStart, int nodeCount);
    }

    /**
     * Values that carry a token body plus a captured scope.
     */
    sealed interface Body extends LiveValue permits FnValue, VarDefValue {
        int tokenStart();

        int tokenCount();

        int scopeStart();

        int scopeCount();

        Body withSpans(int tokenStart, int scopeStart, int scopeCount);
    }

    record BoolValue(boolean value) implements LiveValue {
    }

    record IntValue(long value) implements LiveValue {
    }

    record FloatValue(double value) implements LiveValue {
    }

    /**
     * @param rgba Packed {@code 0xRRGGBBAA}.
     */
    record ColorValue(int rgba) implements LiveValue {
    }

    record Vec2Value(float x, float y) implements LiveValue {
    }

    record Vec3Value(float x, float y, float z) implements LiveValue {
    }

    /**
     * A reference to another item, resolved to an {@link IdPack.NodePtr} by expansion.
     */
    record IdValue(IdPack id) implements LiveValue {
    }

    record ClassValue(IdPack base, int nodeStart, int nodeCount) implements Container {
        @Override
        public ClassValue withSpan(int nodeStart, int nodeCount) {
            return new ClassValue(base, nodeStart, nodeCount);
        }

        public ClassValue withBase(IdPack base) {
            return new ClassValue(base, nodeStart, nodeCount);
        }
    }

    record ObjectValue(int nodeStart, int nodeCount) implements Container {
        @Override
        public ObjectValue withSpan(int nodeStart, int nodeCount) {
            return new ObjectValue(nodeStart, nodeCount);
        }
    }

    record ArrayValue(int nodeStart, int nodeCount) implements Container {
        @Override
        public ArrayValue withSpan(int nodeStart, int nodeCount) {
            return new ArrayValue(nodeStart, nodeCount);
        }
    }

    record CallValue(IdPack target, int nodeStart, int nodeCount) implements Container {
        @Override
        public CallValue withSpan(int nodeStart, int nodeCount) {
            return new CallValue(target, nodeStart, nodeCount);
        }

        public CallValue withTarget(IdPack target) {
            return new CallValue(target, nodeStart, nodeCount);
        }
    }

    record StringValue(int stringStart, int stringCount) implements LiveValue {
    }

    record FnValue(int tokenStart, int tokenCount, int scopeStart, int scopeCount) implements Body {
        @Override
        public FnValue withSpans(int tokenStart, int scopeStart, int scopeCount) {
            return new FnValue(tokenStart, tokenCount, scopeStart, scopeCount);
        }
    }

    record VarDefValue(int tokenStart, int tokenCount, int scopeStart, int scopeCount) implements Body {
        @Override
        public VarDefValue withSpans(int tokenStart, int scopeStart, int scopeCount) {
            return new VarDefValue(tokenStart, tokenCount, scopeStart, scopeCount);
        }
    }

    /**
     * @param target The resource path, usually a multi id.
     */
    record ResourceRefValue(IdPack target) implements LiveValue {
    }

    /**
     * An import of another crate-module. The imported item is the node's own id.
     *
     * @param crate  The crate, or {@link #OWN_CRATE} for the importing file's crate.
     * @param module The module.
     */
    record UseValue(LiveId crate, LiveId module) implements LiveValue {

        public static final LiveId OWN_CRATE = LiveId.of("crate");

        public CrateModule crateModule(LiveId ownCrate) {
            return new CrateModule(OWN_CRATE.equals(crate) ? ownCrate : crate, module);
        }
    }
}
