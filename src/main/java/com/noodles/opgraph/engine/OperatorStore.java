package com.noodles.opgraph.engine;

import com.noodles.opgraph.core.InputSlot;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OperatorIdentityException;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.path.PathResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The registry of live operators, keyed by path.
 *
 * <p>
 * This is the single source of truth for what currently exists. It is an
 * ordinary object owned by whoever drives reconciliation and passed to the
 * components that need it; nothing reaches it through a static.
 *
 * <p>
 * Thread Safety: none. All access must happen on one thread, and a
 * reconciliation pass must finish before anything else reads the store.
 *
 * <p>
 * "Who depends on me" questions are answered by scanning, since operators
 * keep no back-references to their dependents.
 */
public final class OperatorStore implements Iterable<Operator> {
    private final Map<String, Operator> operators = new LinkedHashMap<>();

    /** @return the operator at {@code path}, or {@code null}. */
    public Operator get(String path) {
        return path == null ? null : operators.get(path);
    }

    /**
     * Registers an operator, replacing any previous occupant of the path.
     *
     * @throws OperatorIdentityException if {@code path} is not a valid path or
     *                                   does not match the operator's own path.
     */
    public void set(String path, Operator operator) {
        if (!PathResolver.isValidPath(path))
            throw new OperatorIdentityException("Refusing to register operator under invalid path", path);
        if (operator == null || !path.equals(operator.path()))
            throw new OperatorIdentityException("Store key does not match operator path", path);
        operators.put(path, operator);
    }

    /** @return the removed operator, or {@code null} if none was registered. */
    public Operator delete(String path) {
        return path == null ? null : operators.remove(path);
    }

    public boolean has(String path) {
        return path != null && operators.containsKey(path);
    }

    public int size() {
        return operators.size();
    }

    public boolean isEmpty() {
        return operators.isEmpty();
    }

    public void clear() {
        operators.clear();
    }

    public Set<String> paths() {
        return Collections.unmodifiableSet(operators.keySet());
    }

    @Override
    public Iterator<Operator> iterator() {
        return Collections.unmodifiableCollection(operators.values()).iterator();
    }

    /** Looks up an absolute reference. */
    public Operator getOp(String reference) {
        return getOp(reference, null);
    }

    /**
     * Resolves {@code reference} (absolute, or relative to the operator at
     * {@code contextPath}) and looks it up.
     *
     * @return the operator, or {@code null} if resolution fails or nothing is
     *         registered at the resolved path.
     */
    public Operator getOp(String reference, String contextPath) {
        if (reference == null || reference.isEmpty())
            return null;
        if (reference.charAt(0) != '/' && contextPath == null)
            return null;
        String resolved = PathResolver.resolvePath(reference, contextPath);
        return resolved == null ? null : operators.get(resolved);
    }

    /** Every subscription, anywhere in the store, whose source is {@code path}. */
    public List<Subscription> dependentsOf(String path) {
        List<Subscription> result = new ArrayList<>();
        for (Operator op : operators.values()) {
            for (InputSlot slot : op.inputs().values()) {
                for (Subscription s : slot.subscriptions()) {
                    if (s.sourcePath().equals(path))
                        result.add(s);
                }
            }
        }
        return result;
    }

    /** Operators whose parent path is {@code container}, in store order. */
    public List<Operator> directChildrenOf(String container) {
        List<Operator> result = new ArrayList<>();
        for (Operator op : operators.values()) {
            if (PathResolver.isDirectChild(op.path(), container))
                result.add(op);
        }
        return result;
    }

    /** Operators anywhere below {@code container}, in store order. */
    public List<Operator> descendantsOf(String container) {
        List<Operator> result = new ArrayList<>();
        for (Operator op : operators.values()) {
            if (PathResolver.isWithinContainer(op.path(), container))
                result.add(op);
        }
        return result;
    }

    /**
     * The path {@code baseName} would get inside {@code containerId}, or the
     * first free {@code baseName-N} variant if that path is taken.
     */
    public String nextAvailablePath(String baseName, String containerId) {
        String candidate = PathResolver.generateQualifiedPath(baseName, containerId);
        for (int i = 1; operators.containsKey(candidate); i++)
            candidate = PathResolver.generateQualifiedPath(baseName + "-" + i, containerId);
        return candidate;
    }

    /**
     * The current value behind a subscription: the source output cell, or for
     * container links the source parameter's effective value.
     *
     * @return {@code null} if the source or its field no longer exists.
     */
    public Object upstreamValue(Subscription subscription) {
        Operator source = operators.get(subscription.sourcePath());
        if (source == null)
            return null;
        if (subscription.readsParameter()) {
            InputSlot slot = source.input(subscription.sourceField());
            return slot == null ? null : slot.effectiveValue(this::upstreamValue);
        }
        var cell = source.output(subscription.sourceField());
        return cell == null ? null : cell.value();
    }

    /** Effective value of one parameter slot of {@code operator}. */
    public Object effectiveValue(Operator operator, String field) {
        InputSlot slot = operator.input(field);
        if (slot == null)
            throw new IllegalArgumentException("No parameter '" + field + "' on " + operator);
        return slot.effectiveValue(this::upstreamValue);
    }

    /** Effective values of every parameter slot of {@code operator}. */
    public Map<String, Object> effectiveValues(Operator operator) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (InputSlot slot : operator.inputs().values())
            values.put(slot.name(), slot.effectiveValue(this::upstreamValue));
        return values;
    }

    @Override
    public String toString() {
        return "OperatorStore" + operators.keySet();
    }
}
