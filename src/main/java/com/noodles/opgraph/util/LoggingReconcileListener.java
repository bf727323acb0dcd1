package com.noodles.opgraph.util;

import com.noodles.opgraph.api.ReconcileListener;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.io.GraphDefinition;

import lombok.extern.log4j.Log4j2;

/**
 * Writes every reconcile callback to the DEBUG log and keeps per-pass
 * counters, including reuse and dropped-subscription counts the reconciler's
 * own INFO summary leaves out.
 */
@Log4j2
public final class LoggingReconcileListener implements ReconcileListener {
    private int created, reused, removed, dropped, rejected;

    @Override
    public void onPassStart(int nodeCount, int edgeCount) {
        created = reused = removed = dropped = rejected = 0;
        log.debug("Reconciling {} nodes, {} edges", nodeCount, edgeCount);
    }

    @Override
    public void onOperatorCreated(Operator operator) {
        created++;
        log.debug("Created {}", operator);
    }

    @Override
    public void onOperatorReused(Operator operator) {
        reused++;
        log.debug("Reused {}", operator);
    }

    @Override
    public void onOperatorRemoved(Operator operator) {
        removed++;
        log.debug("Removed {}", operator);
    }

    @Override
    public void onSubscriptionDropped(Subscription subscription) {
        dropped++;
        log.debug("Dropped subscription {}", subscription);
    }

    @Override
    public void onEdgeRejected(GraphDefinition.EdgeDef edge, String reason) {
        rejected++;
        log.debug("Edge {} rejected: {}", edge.effectiveId(), reason);
    }

    @Override
    public void onPassEnd(int operatorCount) {
        log.debug("Pass done: {} operators (created={}, reused={}, removed={}, droppedSubs={}, rejectedEdges={})",
                operatorCount, created, reused, removed, dropped, rejected);
    }

    public int created() {
        return created;
    }

    public int reused() {
        return reused;
    }

    public int removed() {
        return removed;
    }

    public int dropped() {
        return dropped;
    }

    public int rejected() {
        return rejected;
    }
}
