package com.noodles.opgraph.io;

import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.engine.GraphReconciler;
import com.noodles.opgraph.engine.OperatorStore;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphSerializerTest {

    @Test
    public void testOmitsDefaultsConnectedInputsAndContainerLinks() {
        OperatorStore store = new OperatorStore();
        GraphReconciler reconciler = new GraphReconciler(store, new OperatorTypeRegistry());
        GraphDefinition def = new GraphDefinition()
                .node("/num", "NumberOp", Map.of("val", 4))
                .node("/zero", "NumberOp", Map.of("val", 0))
                .node("/add", "MathOp", Map.of("operator", "add", "a", 99, "b", 2))
                .node("/box", "ContainerOp", Map.of())
                .node("/box/in", "GraphInputOp", Map.of())
                .edge("/num", "out.val", "/add", "par.a");
        def.getNodes().get(1).getData().setLocked(true);
        reconciler.transformGraph(def);

        GraphDefinition out = GraphSerializer.toDefinition(store);

        assertEquals(GraphSerializer.FORMAT_VERSION, out.getVersion());
        assertEquals(5, out.getNodes().size());
        assertEquals(Map.of("val", 4), out.getNodes().get(0).inputs());
        assertTrue(out.getNodes().get(1).inputs().isEmpty());
        assertTrue(out.getNodes().get(1).locked());
        // a is connected, operator is the default
        assertEquals(Map.of("b", 2), out.getNodes().get(2).inputs());

        assertEquals(1, out.getEdges().size());
        GraphDefinition.EdgeDef edge = out.getEdges().get(0);
        assertEquals("/num", edge.getSource());
        assertEquals("out.val", edge.getSourceHandle());
        assertEquals("/add", edge.getTarget());
        assertEquals("par.a", edge.getTargetHandle());
    }

    @Test
    public void testSnapshotReappliesAsNoOp() {
        OperatorStore store = new OperatorStore();
        GraphReconciler reconciler = new GraphReconciler(store, new OperatorTypeRegistry());
        reconciler.transformGraph(new GraphDefinition()
                .node("/num", "NumberOp", Map.of("val", 4))
                .node("/add", "MathOp", Map.of("operator", "multiply"))
                .edge("/num", "out.val", "/add", "par.b"));
        Operator add = store.get("/add");
        List<Subscription> subscriptions = new ArrayList<>(add.input("b").subscriptions());

        reconciler.transformGraph(GraphSerializer.toDefinition(store));

        assertSame(add, store.get("/add"));
        assertEquals("multiply", add.input("operator").literal());
        assertEquals(subscriptions, new ArrayList<>(add.input("b").subscriptions()));
    }
}
