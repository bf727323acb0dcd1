package com.noodles.opgraph.util;

import com.noodles.opgraph.api.ReconcileListener;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.io.GraphDefinition;

import java.util.Arrays;

/**
 * Fans reconcile callbacks out to multiple {@link ReconcileListener}s, in
 * registration order.
 */
public class CompositeReconcileListener implements ReconcileListener {
    private ReconcileListener[] listeners = new ReconcileListener[0];

    public void addForComposite(ReconcileListener listener) {
        ReconcileListener[] old = listeners;
        ReconcileListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPassStart(int nodeCount, int edgeCount) {
        for (ReconcileListener l : listeners)
            l.onPassStart(nodeCount, edgeCount);
    }

    @Override
    public void onOperatorCreated(Operator operator) {
        for (ReconcileListener l : listeners)
            l.onOperatorCreated(operator);
    }

    @Override
    public void onOperatorReused(Operator operator) {
        for (ReconcileListener l : listeners)
            l.onOperatorReused(operator);
    }

    @Override
    public void onOperatorRemoved(Operator operator) {
        for (ReconcileListener l : listeners)
            l.onOperatorRemoved(operator);
    }

    @Override
    public void onSubscriptionDropped(Subscription subscription) {
        for (ReconcileListener l : listeners)
            l.onSubscriptionDropped(subscription);
    }

    @Override
    public void onEdgeRejected(GraphDefinition.EdgeDef edge, String reason) {
        for (ReconcileListener l : listeners)
            l.onEdgeRejected(edge, reason);
    }

    @Override
    public void onPassEnd(int operatorCount) {
        for (ReconcileListener l : listeners)
            l.onPassEnd(operatorCount);
    }
}
