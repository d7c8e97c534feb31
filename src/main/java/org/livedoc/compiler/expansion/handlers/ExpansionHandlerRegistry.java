package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionSettings;
import org.livedoc.compiler.expansion.IdResolver;
import org.livedoc.compiler.expansion.StructuralCopier;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping value classes to the handlers that expand them.
 */
public final class ExpansionHandlerRegistry {

    private final Map<Class<? extends LiveValue>, IExpansionHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for the given value class.
     *
     * @param valueType The concrete value record.
     * @param handler   The handler instance.
     * @param <T>       Concrete value type parameter.
     */
    public <T extends LiveValue> void register(Class<T> valueType, IExpansionHandler handler) {
        handlers.put(valueType, handler);
    }

    /**
     * Resolves the handler for the given value class.
     *
     * @param valueType The value class to look up.
     * @return Optional handler if registered.
     */
    public Optional<IExpansionHandler> resolveHandler(Class<? extends LiveValue> valueType) {
        return Optional.ofNullable(handlers.get(valueType));
    }

    /**
     * Creates a registry pre-populated with a handler for every value kind.
     *
     * @param settings The expansion settings shared by the handlers.
     * @return A fully initialized registry.
     */
    public static ExpansionHandlerRegistry initializeWithDefaults(ExpansionSettings settings) {
        ExpansionHandlerRegistry registry = new ExpansionHandlerRegistry();
        IdResolver resolver = new IdResolver(settings);
        StructuralCopier copier = new StructuralCopier(settings);

        IExpansionHandler values = new ValueExpansionHandler();
        registry.register(LiveValue.BoolValue.class, values);
        registry.register(LiveValue.IntValue.class, values);
        registry.register(LiveValue.FloatValue.class, values);
        registry.register(LiveValue.ColorValue.class, values);
        registry.register(LiveValue.Vec2Value.class, values);
        registry.register(LiveValue.Vec3Value.class, values);
        registry.register(LiveValue.StringValue.class, values);
        registry.register(LiveValue.ResourceRefValue.class, values);

        IExpansionHandler containers = new ContainerExpansionHandler();
        registry.register(LiveValue.ObjectValue.class, containers);
        registry.register(LiveValue.ArrayValue.class, containers);

        IExpansionHandler bodies = new BodyExpansionHandler();
        registry.register(LiveValue.FnValue.class, bodies);
        registry.register(LiveValue.VarDefValue.class, bodies);

        registry.register(LiveValue.IdValue.class, new IdReferenceExpansionHandler(settings, resolver));
        registry.register(LiveValue.CallValue.class, new CallExpansionHandler(settings, resolver));
        registry.register(LiveValue.ClassValue.class, new ClassExpansionHandler(settings, resolver, copier));
        registry.register(LiveValue.UseValue.class, new UseExpansionHandler());

        return registry;
    }
}
