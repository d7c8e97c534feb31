package org.livedoc.compiler.expansion;

import org.livedoc.compiler.document.LiveScopeItem;
import org.livedoc.compiler.document.LiveScopeTarget;
import org.livedoc.compiler.model.LiveId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Nested lexical frames built while a document is expanded. The first frame is the module
 * scope; each class opens another one.
 */
public final class ScopeStack {

    private final List<List<LiveScopeItem>> frames = new ArrayList<>();

    /**
     * Creates a stack holding the empty module frame.
     */
    public ScopeStack() {
        pushFrame();
    }

    public void pushFrame() {
        frames.add(new ArrayList<>());
    }

    public void popFrame() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("The module frame cannot be popped");
        }
        frames.remove(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Binds a name in the innermost frame.
     */
    public void bind(LiveId id, LiveScopeTarget target) {
        frames.get(frames.size() - 1).add(new LiveScopeItem(id, target));
    }

    /**
     * Finds the binding for a name: innermost frame first, and within a frame the most
     * recent binding first.
     */
    public Optional<LiveScopeTarget> find(LiveId id) {
        for (int f = frames.size() - 1; f >= 0; f--) {
            List<LiveScopeItem> frame = frames.get(f);
            for (int i = frame.size() - 1; i >= 0; i--) {
                if (frame.get(i).id().equals(id)) {
                    return Optional.of(frame.get(i).target());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All bindings, outermost frame first, in insertion order. This is what function and
     * variable bodies capture.
     */
    public List<LiveScopeItem> flatten() {
        List<LiveScopeItem> items = new ArrayList<>();
        for (List<LiveScopeItem> frame : frames) {
            items.addAll(frame);
        }
        return items;
    }
}
