package com.noodles.opgraph;

import com.noodles.opgraph.api.ReconcileListener;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OperatorType;
import com.noodles.opgraph.io.GraphDefinition;
import com.noodles.opgraph.io.ProjectFormatException;
import com.noodles.opgraph.util.OperatorProfileListener;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class OperatorGraphTest {

    private static final String PROJECT = "{\"nodes\": ["
            + "{\"id\": \"/num1\", \"type\": \"NumberOp\", \"data\": {\"inputs\": {\"val\": 1}}},"
            + "{\"id\": \"/num2\", \"type\": \"NumberOp\", \"data\": {\"inputs\": {\"val\": 2}}},"
            + "{\"id\": \"/add\", \"type\": \"MathOp\", \"data\": {\"inputs\": {\"operator\": \"add\"}}}"
            + "], \"edges\": ["
            + "{\"source\": \"/num1\", \"sourceHandle\": \"out.val\", \"target\": \"/add\", \"targetHandle\": \"par.a\"},"
            + "{\"source\": \"/num2\", \"sourceHandle\": \"out.val\", \"target\": \"/add\", \"targetHandle\": \"par.b\"}"
            + "]}";

    @Test
    public void testLoadEvaluateAndQuery() {
        OperatorGraph graph = OperatorGraph.create();
        List<Operator> ops = graph.load(PROJECT);

        assertEquals(3, ops.size());
        assertEquals(3, graph.evaluate());
        assertEquals(3.0, (Double) graph.getOp("/add").output("result").value(), 1e-12);
        assertSame(graph.getOp("/num1"), graph.getOp("num1", "/add"));
        assertFalse(graph.canUndo());
    }

    @Test
    public void testUndoRedoThroughReconciler() {
        OperatorGraph graph = OperatorGraph.create();
        graph.load(PROJECT);
        Operator add = graph.getOp("/add");

        GraphDefinition edited = graph.snapshot();
        edited.getNodes().removeIf(n -> n.getId().equals("/num2"));
        graph.apply(edited, "Delete /num2");
        assertNull(graph.getOp("/num2"));
        assertEquals("Delete /num2", graph.historyState().undoDescription());

        assertTrue(graph.undo());
        assertNotNull(graph.getOp("/num2"));
        assertSame(add, graph.getOp("/add"));
        assertTrue(add.input("b").isConnected());
        assertEquals(2, graph.history().getHistory().size());

        assertTrue(graph.redo());
        assertNull(graph.getOp("/num2"));
        assertFalse(add.input("b").isConnected());
        assertFalse(graph.canRedo());
    }

    @Test
    public void testInvalidProjectLeavesGraphAlone() {
        OperatorGraph graph = OperatorGraph.create();
        graph.load(PROJECT);
        try {
            graph.load("{\"nodes\": [{\"id\": \"/x\"}]}");
            fail("expected ProjectFormatException");
        } catch (ProjectFormatException expected) {
            assertEquals(3, graph.store().size());
            assertEquals(1, graph.history().getHistory().size());
        }
    }

    @Test
    public void testBuilderConfiguration() {
        List<String> created = new ArrayList<>();
        OperatorGraph graph = OperatorGraph.builder()
                .maxHistorySize(2)
                .registerType(OperatorType.builder("DoubleOp")
                        .parameter("x", 0)
                        .output("y")
                        .compute((op, in, store) -> Map.of("y", ((Number) in.get("x")).doubleValue() * 2))
                        .build())
                .reconcileListener(new ReconcileListener() {
                    @Override
                    public void onOperatorCreated(Operator operator) {
                        created.add(operator.path());
                    }
                })
                .build();
        OperatorProfileListener profile = graph.enableOperatorProfiling();
        graph.enableReconcileLogging();

        for (int i = 1; i <= 3; i++)
            graph.apply(new GraphDefinition().node("/d", "DoubleOp", Map.of("x", i)), "x=" + i);
        graph.evaluate();

        assertEquals(List.of("/d"), created);
        assertEquals(6.0, (Double) graph.getOp("/d").output("y").value(), 1e-12);
        assertEquals(2, graph.history().getHistory().size());
        assertEquals(1, profile.get("/d").count);
    }

    @Test
    public void testProfilingForgetsRemovedOperators() {
        OperatorGraph graph = OperatorGraph.create();
        OperatorProfileListener profile = graph.enableOperatorProfiling();
        graph.load(PROJECT);
        graph.evaluate();
        assertEquals(3, profile.size());

        graph.apply(new GraphDefinition().node("/num1", "NumberOp", Map.of("val", 1)), "Keep num1");

        assertEquals(1, profile.size());
        assertNotNull(profile.get("/num1"));
        assertNull(profile.get("/add"));
    }

    @Test
    public void testSnapshotJsonReloads() {
        OperatorGraph graph = OperatorGraph.create();
        graph.load(PROJECT);
        String json = graph.toJson();

        OperatorGraph copy = OperatorGraph.create();
        copy.load(json);
        copy.evaluate();

        assertEquals(3, copy.store().size());
        assertEquals(3.0, (Double) copy.getOp("/add").output("result").value(), 1e-12);
        assertTrue(graph.explain().toMermaid().contains("n0 -- \"a\" --> n2;"));
    }
}
