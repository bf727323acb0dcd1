package com.noodles.opgraph.disruptor;

import com.noodles.opgraph.io.GraphDefinition;

import java.util.concurrent.CompletableFuture;

/**
 * A mutable command slot in the LMAX Disruptor RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> instances are pre-allocated with the ring buffer
 * and reused for every command. The consumer clears a slot once it has
 * completed the command's future, so the slot never pins a definition or a
 * caller longer than necessary.
 */
public final class GraphCommand {

    public enum Kind {
        RECONCILE,
        UNDO,
        REDO,
        EVALUATE
    }

    private Kind kind;
    private GraphDefinition definition;
    private String description;
    private CompletableFuture<Object> result;
    private long sequenceId;

    /**
     * Configures the slot for a reconciliation pass.
     *
     * @param definition  the graph to reconcile against; already a private copy.
     * @param description history label for the change.
     */
    public void setReconcile(GraphDefinition definition, String description, CompletableFuture<Object> result,
            long seqId) {
        this.kind = Kind.RECONCILE;
        this.definition = definition;
        this.description = description;
        this.result = result;
        this.sequenceId = seqId;
    }

    /** Configures the slot for a command that carries no payload. */
    public void set(Kind kind, CompletableFuture<Object> result, long seqId) {
        this.kind = kind;
        this.definition = null;
        this.description = null;
        this.result = result;
        this.sequenceId = seqId;
    }

    public Kind kind() {
        return kind;
    }

    public GraphDefinition definition() {
        return definition;
    }

    public String description() {
        return description;
    }

    public CompletableFuture<Object> result() {
        return result;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        kind = null;
        definition = null;
        description = null;
        result = null;
        sequenceId = 0;
    }
}
