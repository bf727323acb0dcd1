package com.noodles.opgraph.path;

import java.util.Objects;

/**
 * A parsed {@code namespace.field} handle. Only meaningful together with the
 * path of the operator that owns the slot.
 */
public record HandleId(HandleNamespace namespace, String fieldName) {

    public HandleId {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(fieldName, "fieldName");
    }

    public static HandleId par(String fieldName) {
        return new HandleId(HandleNamespace.PAR, fieldName);
    }

    public static HandleId out(String fieldName) {
        return new HandleId(HandleNamespace.OUT, fieldName);
    }

    @Override
    public String toString() {
        return namespace.token() + "." + fieldName;
    }
}
