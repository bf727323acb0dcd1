package com.noodles.opgraph.io;

import com.noodles.opgraph.core.OperatorType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Registry mapping type names to {@link OperatorType}s.
 *
 * <p>
 * Starts populated with {@link BuiltInOperatorType}; hosts register their own
 * types on top. A type name that is not registered here is fatal for any
 * reconciliation pass that references it.
 */
@Log4j2
public final class OperatorTypeRegistry {
    private final Map<String, OperatorType> registry = new LinkedHashMap<>();

    public OperatorTypeRegistry() {
        registerBuiltIns();
    }

    /** Registers a type, replacing any previous type with the same name. */
    public OperatorTypeRegistry register(OperatorType type) {
        OperatorType previous = registry.put(type.name(), type);
        if (previous != null && previous != type)
            log.info("Operator type {} replaced", type.name());
        return this;
    }

    /** @return the type, or {@code null} if the name is unknown. */
    public OperatorType get(String typeName) {
        return typeName == null ? null : registry.get(typeName);
    }

    public boolean contains(String typeName) {
        return typeName != null && registry.containsKey(typeName);
    }

    public Set<String> typeNames() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    private void registerBuiltIns() {
        for (BuiltInOperatorType t : BuiltInOperatorType.values())
            registry.put(t.typeName(), t.definition());
    }
}
