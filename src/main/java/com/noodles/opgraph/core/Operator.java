package com.noodles.opgraph.core;

import com.noodles.opgraph.path.PathResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed node instance in the operator graph.
 *
 * <p>
 * Identity is the operator's path, which also places it in the container tree
 * (every ancestor path is a container). The type is fixed for the operator's
 * lifetime; a path that changes type is replaced by a new instance.
 *
 * <p>
 * Besides its slots an operator carries an open attribute map for runtime
 * state owned by other layers (evaluation caches, UI markers). Attributes live
 * as long as the instance, so they survive every reconciliation pass that
 * reuses it.
 *
 * <p>
 * Operators know nothing about their dependents. {@link #dispose()} only
 * clears this operator's own subscriptions; removing subscriptions that point
 * at it is the reconciler's job.
 */
public final class Operator {
    private final String path;
    private final OperatorType type;
    private final Map<String, InputSlot> inputs;
    private final Map<String, OutputCell> outputs;
    private final Map<String, Object> attributes = new HashMap<>();
    private boolean locked;
    private boolean disposed;

    /**
     * @param path          absolute operator path.
     * @param type          operator type.
     * @param initialValues literal values for parameter fields; missing fields
     *                      take the type default, unknown keys are ignored.
     * @throws OperatorIdentityException if the path is not a valid, normalized
     *                                   path.
     */
    public Operator(String path, OperatorType type, Map<String, ?> initialValues) {
        if (!PathResolver.isValidPath(path) || !path.equals(PathResolver.normalizePath(path)))
            throw new OperatorIdentityException("Invalid operator path", path);
        this.path = path;
        this.type = Objects.requireNonNull(type, "type");

        Map<String, InputSlot> in = new LinkedHashMap<>();
        for (OperatorType.FieldSpec spec : type.parameters().values()) {
            Object literal = initialValues != null && initialValues.containsKey(spec.name())
                    ? initialValues.get(spec.name())
                    : spec.defaultValue();
            in.put(spec.name(), new InputSlot(spec.name(), spec.defaultValue(), spec.fanInPolicy(), literal));
        }
        Map<String, OutputCell> out = new LinkedHashMap<>();
        for (String field : type.outputs())
            out.put(field, new OutputCell(field));

        this.inputs = Collections.unmodifiableMap(in);
        this.outputs = Collections.unmodifiableMap(out);
    }

    public Operator(String path, OperatorType type) {
        this(path, type, Collections.emptyMap());
    }

    public String path() {
        return path;
    }

    public OperatorType type() {
        return type;
    }

    public String typeName() {
        return type.name();
    }

    /** The path of the enclosing container; {@code /} for top-level operators. */
    public String containerPath() {
        return PathResolver.getParentPath(path);
    }

    public Map<String, InputSlot> inputs() {
        return inputs;
    }

    public Map<String, OutputCell> outputs() {
        return outputs;
    }

    /** @return the slot, or {@code null} if the type declares no such parameter. */
    public InputSlot input(String field) {
        return inputs.get(field);
    }

    /** @return the cell, or {@code null} if the type declares no such output. */
    public OutputCell output(String field) {
        return outputs.get(field);
    }

    /**
     * Sets the literal of a parameter. The value is inert while the slot has
     * subscriptions.
     */
    public void setParameter(String field, Object value) {
        InputSlot slot = inputs.get(field);
        if (slot == null)
            throw new IllegalArgumentException("No parameter '" + field + "' on " + type.name() + " " + path);
        slot.setLiteral(value);
    }

    /**
     * Replaces every literal: fields present in {@code values} take that value,
     * the rest return to their defaults. Subscriptions are left alone.
     */
    public void resetParameters(Map<String, ?> values) {
        for (InputSlot slot : inputs.values()) {
            if (values != null && values.containsKey(slot.name()))
                slot.setLiteral(values.get(slot.name()));
            else
                slot.resetLiteral();
        }
    }

    /** Snapshot of literal values, in declaration order. */
    public Map<String, Object> parameterValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (InputSlot slot : inputs.values())
            values.put(slot.name(), slot.literal());
        return values;
    }

    /** Snapshot of output values, in declaration order. */
    public Map<String, Object> outputValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (OutputCell cell : outputs.values())
            values.put(cell.name(), cell.value());
        return values;
    }

    @SuppressWarnings("unchecked")
    public <T> T attribute(String key) {
        return (T) attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public Object removeAttribute(String key) {
        return attributes.remove(key);
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Severs all of this operator's input subscriptions.
     *
     * @return the subscriptions that were removed.
     */
    public List<Subscription> dispose() {
        List<Subscription> removed = new ArrayList<>();
        for (InputSlot slot : inputs.values())
            removed.addAll(slot.clearSubscriptions());
        disposed = true;
        return removed;
    }

    @Override
    public String toString() {
        return type.name() + "[" + path + "]";
    }
}
