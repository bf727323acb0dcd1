package com.noodles.opgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes project documents.
 *
 * <p>
 * A project is the JSON form of a {@link GraphDefinition}:
 *
 * <pre>
 * {
 *   "version": 1,
 *   "nodes": [ { "id": "/num1", "type": "NumberOp", "data": { "inputs": { "val": 1 } } } ],
 *   "edges": [ { "source": "/num1", "sourceHandle": "out.val",
 *                "target": "/add", "targetHandle": "par.a" } ]
 * }
 * </pre>
 *
 * Editor-only properties such as node positions are ignored. Structural checks
 * run before a definition is handed out, so a rejected document never reaches
 * the reconciler.
 */
public final class ProjectReader {
    private final ObjectMapper mapper;

    public ProjectReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ProjectReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Reads a project file. */
    public GraphDefinition read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ProjectFormatException("Cannot read project " + file, e);
        }
        return read(json);
    }

    /**
     * Parses a project document.
     *
     * @throws ProjectFormatException if the JSON is malformed, has no
     *                                {@code nodes} array, or contains a node
     *                                without an id or type.
     */
    public GraphDefinition read(String json) {
        if (json == null || json.isBlank())
            throw new ProjectFormatException("Empty project document");

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProjectFormatException("Malformed project JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject())
            throw new ProjectFormatException("Project document must be a JSON object");

        JsonNode nodes = root.get("nodes");
        if (nodes == null || !nodes.isArray())
            throw new ProjectFormatException("Missing 'nodes' array");
        for (int i = 0; i < nodes.size(); i++) {
            JsonNode n = nodes.get(i);
            if (!n.isObject())
                throw new ProjectFormatException("Node #" + i + " is not an object");
            if (!n.hasNonNull("id") || !n.get("id").isTextual())
                throw new ProjectFormatException("Node #" + i + " has no id");
            if (!n.hasNonNull("type") || !n.get("type").isTextual())
                throw new ProjectFormatException("Node " + n.get("id").asText() + " has no type");
        }
        JsonNode edges = root.get("edges");
        if (edges != null && !edges.isNull() && !edges.isArray())
            throw new ProjectFormatException("'edges' must be an array");

        GraphDefinition def;
        try {
            def = mapper.treeToValue(root, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ProjectFormatException("Invalid project structure: " + e.getOriginalMessage(), e);
        }
        if (def.getEdges() == null)
            def.setEdges(new ArrayList<>());
        return def;
    }

    /** Writes a definition as a project document. */
    public String write(GraphDefinition definition) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new ProjectFormatException("Cannot serialize project", e);
        }
    }
}
