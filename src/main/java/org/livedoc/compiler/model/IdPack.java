package org.livedoc.compiler.model;

import java.util.List;

/**
 * The identifying value of a node or an identifier reference. One of:
 * <ul>
 *   <li>{@link Empty} - the wildcard marker,</li>
 *   <li>{@link Single} - one identifier,</li>
 *   <li>{@link Multi} - a path of two or more segments stored in the owning document's
 *       multi-id table,</li>
 *   <li>{@link NodePtr} - a resolved pointer to a node of some expanded document.</li>
 * </ul>
 * Once expansion resolves a path to a pointer the path is not kept.
 */
public sealed interface IdPack permits IdPack.Empty, IdPack.Single, IdPack.Multi, IdPack.NodePtr {

    Empty EMPTY = new Empty();

    static IdPack empty() {
        return EMPTY;
    }

    static Single single(LiveId id) {
        return new Single(id);
    }

    static Single single(String name) {
        return new Single(LiveId.of(name));
    }

    static Multi multi(int start, int count) {
        return new Multi(start, count);
    }

    static NodePtr nodePtr(FullNodePtr ptr) {
        return new NodePtr(ptr);
    }

    static NodePtr nodePtr(FileId fileId, LocalNodePtr localPtr) {
        return new NodePtr(new FullNodePtr(fileId, localPtr));
    }

    /**
     * Number of nesting levels a declaration with this id spans.
     * Children of such a declaration live {@code segmentCount()} levels below it.
     */
    default int segmentCount() {
        return 1;
    }

    default boolean isEmpty() {
        return false;
    }

    default boolean isMulti() {
        return false;
    }

    default boolean isSingle(LiveId id) {
        return this instanceof Single single && single.id().equals(id);
    }

    /**
     * Renders the id for diagnostics, expanding multi paths against the given table.
     */
    default String format(List<LiveId> multiIds) {
        return toString();
    }

    record Empty() implements IdPack {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public String toString() {
            return "*";
        }
    }

    record Single(LiveId id) implements IdPack {
        @Override
        public String toString() {
            return id.toString();
        }
    }

    record Multi(int start, int count) implements IdPack {

        public Multi {
            if (count < 2) {
                throw new IllegalArgumentException("A multi id needs at least two segments, got " + count);
            }
        }

        @Override
        public int segmentCount() {
            return count;
        }

        @Override
        public boolean isMulti() {
            return true;
        }

        public List<LiveId> segments(List<LiveId> multiIds) {
            return multiIds.subList(start, start + count);
        }

        @Override
        public String format(List<LiveId> multiIds) {
            StringBuilder sb = new StringBuilder();
            for (LiveId id : segments(multiIds)) {
                if (sb.length() > 0) sb.append("::");
                sb.append(id);
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return "multi[" + start + "+" + count + "]";
        }
    }

    record NodePtr(FullNodePtr ptr) implements IdPack {
        @Override
        public String toString() {
            return "->" + ptr;
        }
    }
}
