package com.noodles.opgraph.api;

import java.util.List;

/**
 * Per-field rule for how many upstream subscriptions a parameter slot admits
 * and how their values combine into the slot's effective value.
 *
 * @see com.noodles.opgraph.util.FanInPolicies
 */
public interface FanInPolicy {

    /**
     * Maximum number of subscriptions the slot accepts. An edge that would
     * exceed it is rejected during reconciliation.
     */
    int maxSources();

    /**
     * Combines upstream values, given in subscription insertion order. Only
     * called with a non-empty list.
     */
    Object aggregate(List<Object> upstreamValues);
}
