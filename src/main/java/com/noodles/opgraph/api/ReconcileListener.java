package com.noodles.opgraph.api;

import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.io.GraphDefinition;

/**
 * Observability hooks for reconciliation passes.
 *
 * <p>
 * Callbacks run synchronously on the reconciling thread, in the middle of a
 * pass. Implementations must not mutate the store.
 */
public interface ReconcileListener {

    default void onPassStart(int nodeCount, int edgeCount) {
    }

    default void onOperatorCreated(Operator operator) {
    }

    default void onOperatorReused(Operator operator) {
    }

    /** Called after the operator has been disposed and removed from the store. */
    default void onOperatorRemoved(Operator operator) {
    }

    /**
     * Called when a subscription is removed, either because its source no
     * longer exists or because no declared edge backs it any more.
     */
    default void onSubscriptionDropped(Subscription subscription) {
    }

    /** A declared edge could not be wired; the rest of the pass continues. */
    default void onEdgeRejected(GraphDefinition.EdgeDef edge, String reason) {
    }

    default void onPassEnd(int operatorCount) {
    }
}
