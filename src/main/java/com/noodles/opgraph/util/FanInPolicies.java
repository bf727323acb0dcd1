package com.noodles.opgraph.util;

import com.noodles.opgraph.api.FanInPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Standard implementations of FanInPolicy.
 */
public final class FanInPolicies {
    private FanInPolicies() {
        // Utility class
    }

    /** At most one upstream source; the slot takes that source's value. */
    public static final FanInPolicy SINGLE = new FanInPolicy() {
        @Override
        public int maxSources() {
            return 1;
        }

        @Override
        public Object aggregate(List<Object> upstreamValues) {
            return upstreamValues.get(0);
        }

        @Override
        public String toString() {
            return "SINGLE";
        }
    };

    /**
     * Any number of sources, collected into an unmodifiable list in
     * subscription order. Null upstream values are kept.
     */
    public static final FanInPolicy LIST = new FanInPolicy() {
        @Override
        public int maxSources() {
            return Integer.MAX_VALUE;
        }

        @Override
        public Object aggregate(List<Object> upstreamValues) {
            return Collections.unmodifiableList(new ArrayList<>(upstreamValues));
        }

        @Override
        public String toString() {
            return "LIST";
        }
    };
}
