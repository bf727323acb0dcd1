package com.noodles.opgraph.core;

import com.noodles.opgraph.api.FanInPolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * A parameter slot on an operator.
 *
 * <p>
 * A slot holds a literal value and zero or more {@link Subscription}s. While
 * any subscription exists the slot is driven exclusively from upstream and the
 * literal is inert; once the last subscription is removed the literal takes
 * over again. How many subscriptions are admitted, and how their values
 * combine, is decided by the slot's {@link FanInPolicy}.
 */
public final class InputSlot {
    private final String name;
    private final Object defaultValue;
    private final FanInPolicy fanInPolicy;
    private final Set<Subscription> subscriptions = new LinkedHashSet<>();
    private Object literal;

    InputSlot(String name, Object defaultValue, FanInPolicy fanInPolicy, Object literal) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.fanInPolicy = fanInPolicy;
        this.literal = literal;
    }

    public String name() {
        return name;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public FanInPolicy fanInPolicy() {
        return fanInPolicy;
    }

    public Object literal() {
        return literal;
    }

    /** Stores a literal. Has no visible effect while the slot is connected. */
    public void setLiteral(Object value) {
        this.literal = value;
    }

    public void resetLiteral() {
        this.literal = defaultValue;
    }

    public Set<Subscription> subscriptions() {
        return Collections.unmodifiableSet(subscriptions);
    }

    public boolean isConnected() {
        return !subscriptions.isEmpty();
    }

    /** True if the subscription is already present or the policy has room for it. */
    public boolean canAccept(Subscription subscription) {
        return subscriptions.contains(subscription) || subscriptions.size() < fanInPolicy.maxSources();
    }

    /**
     * @return false if the subscription was already present.
     * @throws IllegalStateException if the fan-in policy is already saturated.
     */
    public boolean addSubscription(Subscription subscription) {
        if (subscriptions.contains(subscription))
            return false;
        if (subscriptions.size() >= fanInPolicy.maxSources())
            throw new IllegalStateException("Slot '" + name + "' accepts at most "
                    + fanInPolicy.maxSources() + " source(s)");
        return subscriptions.add(subscription);
    }

    public boolean removeSubscription(Subscription subscription) {
        return subscriptions.remove(subscription);
    }

    /**
     * Puts the current subscriptions in the iteration order of {@code order},
     * which must hold exactly the same subscriptions. Aggregating policies see
     * upstream values in this order.
     */
    public void reorderSubscriptions(Collection<Subscription> order) {
        if (order.size() != subscriptions.size() || !subscriptions.containsAll(order))
            throw new IllegalArgumentException("Reorder of slot '" + name + "' must keep the same subscriptions");
        subscriptions.clear();
        subscriptions.addAll(order);
    }

    /** Removes every subscription and returns what was removed. */
    public List<Subscription> clearSubscriptions() {
        List<Subscription> removed = new ArrayList<>(subscriptions);
        subscriptions.clear();
        return removed;
    }

    /**
     * The value the operator sees: the literal when unconnected, otherwise the
     * policy's aggregate of the upstream values.
     *
     * @param upstream reads the current value behind a subscription.
     */
    public Object effectiveValue(Function<Subscription, Object> upstream) {
        if (subscriptions.isEmpty())
            return literal;
        List<Object> values = new ArrayList<>(subscriptions.size());
        for (Subscription s : subscriptions)
            values.add(upstream.apply(s));
        return fanInPolicy.aggregate(values);
    }

    @Override
    public String toString() {
        return "InputSlot[" + name + ", literal=" + literal + ", subscriptions=" + subscriptions.size() + "]";
    }
}
