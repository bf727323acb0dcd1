package com.noodles.opgraph.history;

import com.noodles.opgraph.io.GraphDefinition;

import java.util.Objects;
import java.util.UUID;

/**
 * One recorded graph state.
 *
 * @param id          unique entry id.
 * @param timestamp   recording time, epoch millis.
 * @param description what the user did to reach this state; may be null.
 * @param state       deep copy of the declarative graph, never shared.
 */
public record HistoryEntry(String id, long timestamp, String description, GraphDefinition state) {

    public HistoryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
    }

    static HistoryEntry capture(GraphDefinition state, String description) {
        return new HistoryEntry(UUID.randomUUID().toString(), System.currentTimeMillis(), description, state.copy());
    }
}
