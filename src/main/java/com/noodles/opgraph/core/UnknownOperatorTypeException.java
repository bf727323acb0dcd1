package com.noodles.opgraph.core;

/**
 * A declarative node names a type the registry does not know. Fatal for the
 * reconciliation pass that encounters it.
 */
public class UnknownOperatorTypeException extends IllegalArgumentException {
    private final String typeName;
    private final String nodeId;

    public UnknownOperatorTypeException(String typeName, String nodeId) {
        super("Unknown operator type '" + typeName + "' for node " + nodeId);
        this.typeName = typeName;
        this.nodeId = nodeId;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getNodeId() {
        return nodeId;
    }
}
