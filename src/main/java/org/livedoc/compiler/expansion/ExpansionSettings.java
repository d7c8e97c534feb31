package org.livedoc.compiler.expansion;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tunables of the expansion engine, read from the {@code livedoc.expansion} config block.
 *
 * @param baseClasses    The reserved root kinds. They are never scope lookup targets and a
 *                       class deriving from one copies nothing.
 * @param componentClass The root kind that {@code findComponentOrigin} accepts.
 */
public record ExpansionSettings(Set<LiveId> baseClasses, LiveId componentClass) {

    /** The keyword addressing the currently open class. */
    public static final LiveId SELF = LiveId.of("Self");

    public ExpansionSettings {
        baseClasses = Set.copyOf(baseClasses);
    }

    public static ExpansionSettings fromConfig(Config config) {
        Config expansion = config.getConfig("livedoc.expansion");
        Set<LiveId> baseClasses = new LinkedHashSet<>();
        for (String name : expansion.getStringList("base-classes")) {
            baseClasses.add(LiveId.of(name));
        }
        return new ExpansionSettings(baseClasses, LiveId.of(expansion.getString("component-class")));
    }

    /**
     * Settings from the classpath configuration ({@code reference.conf} plus overrides).
     */
    public static ExpansionSettings defaults() {
        return fromConfig(ConfigFactory.load());
    }

    public boolean isBaseClass(IdPack id) {
        return id instanceof IdPack.Single single && baseClasses.contains(single.id());
    }

    public boolean isBaseClass(LiveId id) {
        return baseClasses.contains(id);
    }

    public boolean isSelf(IdPack id) {
        return id.isSingle(SELF);
    }

    /**
     * Ids that are kept verbatim instead of being resolved: {@code Self}, reserved roots,
     * the empty id and pointers that are already resolved.
     */
    public boolean isUnresolvable(IdPack id) {
        return isSelf(id) || isBaseClass(id) || id.isEmpty() || id instanceof IdPack.NodePtr;
    }
}
