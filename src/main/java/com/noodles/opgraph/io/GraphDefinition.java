package com.noodles.opgraph.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a declarative operator graph: the nodes and edges a
 * visual editor holds, as consumed by the reconciler and stored in undo
 * history.
 *
 * <p>
 * Unknown JSON properties (canvas positions, sizes, viewport) are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphDefinition {
    private int version;
    private List<NodeDef> nodes = new ArrayList<>();
    private List<EdgeDef> edges = new ArrayList<>();

    /** Fluent helper: appends a node. */
    public GraphDefinition node(String id, String type, Map<String, Object> inputs) {
        nodes.add(NodeDef.of(id, type, inputs));
        return this;
    }

    /** Fluent helper: appends an edge with the default id. */
    public GraphDefinition edge(String source, String sourceHandle, String target, String targetHandle) {
        edges.add(EdgeDef.of(source, sourceHandle, target, targetHandle));
        return this;
    }

    /** Deep copy; nested input maps and lists are copied too. */
    public GraphDefinition copy() {
        GraphDefinition copy = new GraphDefinition();
        copy.setVersion(version);
        List<NodeDef> nodeCopies = new ArrayList<>();
        if (nodes != null) {
            for (NodeDef nd : nodes)
                nodeCopies.add(nd == null ? null : nd.copy());
        }
        copy.setNodes(nodeCopies);
        List<EdgeDef> edgeCopies = new ArrayList<>();
        if (edges != null) {
            for (EdgeDef ed : edges)
                edgeCopies.add(ed == null ? null : ed.copy());
        }
        copy.setEdges(edgeCopies);
        return copy;
    }

    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet())
                out.put(String.valueOf(e.getKey()), copyValue(e.getValue()));
            return out;
        }
        if (value instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l)
                out.add(copyValue(o));
            return out;
        }
        return value;
    }

    /** Definition of a single node. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private String id, type;
        private NodeData data;

        public static NodeDef of(String id, String type, Map<String, Object> inputs) {
            NodeData data = new NodeData();
            data.setInputs(inputs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(inputs));
            return new NodeDef(id, type, data);
        }

        /** Literal inputs, never null. */
        public Map<String, Object> inputs() {
            return data == null || data.getInputs() == null ? Map.of() : data.getInputs();
        }

        public boolean locked() {
            return data != null && data.isLocked();
        }

        NodeDef copy() {
            NodeData dataCopy = null;
            if (data != null) {
                dataCopy = new NodeData();
                dataCopy.setLocked(data.isLocked());
                if (data.getInputs() != null) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> inputsCopy = (Map<String, Object>) copyValue(data.getInputs());
                    dataCopy.setInputs(inputsCopy);
                }
            }
            return new NodeDef(id, type, dataCopy);
        }
    }

    /** Per-node payload: literal parameter values and the lock flag. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeData {
        private Map<String, Object> inputs = new LinkedHashMap<>();
        private boolean locked;
    }

    /** Definition of an edge between an output handle and a parameter handle. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDef {
        private String id, source, target, sourceHandle, targetHandle;

        public static EdgeDef of(String source, String sourceHandle, String target, String targetHandle) {
            return new EdgeDef(defaultId(source, sourceHandle, target, targetHandle),
                    source, target, sourceHandle, targetHandle);
        }

        /** {@code source.sourceHandle->target.targetHandle} */
        public static String defaultId(String source, String sourceHandle, String target, String targetHandle) {
            return source + "." + sourceHandle + "->" + target + "." + targetHandle;
        }

        /** The declared id, or the default id when none was given. */
        public String effectiveId() {
            return id != null && !id.isEmpty() ? id : defaultId(source, sourceHandle, target, targetHandle);
        }

        EdgeDef copy() {
            return new EdgeDef(id, source, target, sourceHandle, targetHandle);
        }
    }
}
