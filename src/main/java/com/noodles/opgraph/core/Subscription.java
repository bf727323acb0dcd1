package com.noodles.opgraph.core;

import com.noodles.opgraph.path.HandleId;
import com.noodles.opgraph.path.HandleNamespace;

import java.util.Objects;

/**
 * A directed edge from an upstream slot to a parameter slot of the target
 * operator. Owned by the target's {@link InputSlot}; the source operator keeps
 * no reference to it.
 *
 * <p>
 * {@code sourceNamespace} is {@link HandleNamespace#OUT} for ordinary edges.
 * Container links read the container's own {@code par.in} slot and use
 * {@link HandleNamespace#PAR}.
 */
public record Subscription(String edgeId, String sourcePath, HandleNamespace sourceNamespace,
        String sourceField, String targetPath, String targetField) {

    public Subscription {
        Objects.requireNonNull(edgeId, "edgeId");
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(sourceNamespace, "sourceNamespace");
        Objects.requireNonNull(sourceField, "sourceField");
        Objects.requireNonNull(targetPath, "targetPath");
        Objects.requireNonNull(targetField, "targetField");
    }

    /** An ordinary output-to-parameter edge. */
    public static Subscription of(String edgeId, String sourcePath, String sourceField,
            String targetPath, String targetField) {
        return new Subscription(edgeId, sourcePath, HandleNamespace.OUT, sourceField, targetPath, targetField);
    }

    public HandleId sourceHandle() {
        return new HandleId(sourceNamespace, sourceField);
    }

    public HandleId targetHandle() {
        return HandleId.par(targetField);
    }

    public boolean readsParameter() {
        return sourceNamespace == HandleNamespace.PAR;
    }

    @Override
    public String toString() {
        return sourcePath + "." + sourceHandle() + " -> " + targetPath + "." + targetHandle();
    }
}
