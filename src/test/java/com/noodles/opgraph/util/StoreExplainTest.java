package com.noodles.opgraph.util;

import com.noodles.opgraph.engine.GraphEvaluator;
import com.noodles.opgraph.engine.GraphReconciler;
import com.noodles.opgraph.engine.OperatorStore;
import com.noodles.opgraph.io.GraphDefinition;
import com.noodles.opgraph.io.OperatorTypeRegistry;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class StoreExplainTest {

    private OperatorStore store;
    private StoreExplain explain;

    @Before
    public void setUp() {
        store = new OperatorStore();
        new GraphReconciler(store, new OperatorTypeRegistry()).transformGraph(new GraphDefinition()
                .node("/num", "NumberOp", Map.of("val", 2))
                .node("/add", "MathOp", Map.of("operator", "add", "b", 1))
                .node("/box", "ContainerOp", Map.of())
                .node("/box/in", "GraphInputOp", Map.of())
                .edge("/num", "out.val", "/add", "par.a"));
        new GraphEvaluator(store).evaluate();
        explain = new StoreExplain(store);
    }

    @Test
    public void testExplainOperator() {
        String text = explain.explainOperator("/add");
        assertTrue(text, text.contains("Operator: /add"));
        assertTrue(text, text.contains("Type: MathOp"));
        assertTrue(text, text.contains("a = 2 <- /num.out.val"));
        assertTrue(text, text.contains("b = 1 (literal)"));
        assertTrue(text, text.contains("result = 3.0"));

        String num = explain.explainOperator("/num");
        assertTrue(num, num.contains("Dependents (1): /add.par.a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownOperator() {
        explain.explainOperator("/missing");
    }

    @Test
    public void testDumpStore() {
        String dump = explain.dumpStore();
        assertTrue(dump, dump.startsWith("Store (4 operators):"));
        assertTrue(dump, dump.contains("/num.out.val -> /add.par.a"));
    }

    @Test
    public void testToMermaid() {
        String mermaid = explain.toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid, mermaid.contains("n1[\"/add<br/>MathOp\"];"));
        assertTrue(mermaid, mermaid.contains("n0 -- \"a\" --> n1;"));
        assertTrue(mermaid, mermaid.contains("n2 -. \"parentValue\" .-> n3;"));
    }

    @Test
    public void testMermaidKeepsLookalikePathsApart() {
        OperatorStore lookalikes = new OperatorStore();
        new GraphReconciler(lookalikes, new OperatorTypeRegistry()).transformGraph(new GraphDefinition()
                .node("/a-b", "NumberOp", Map.of())
                .node("/a_b", "NumberOp", Map.of())
                .node("/say\"hi\"", "StringOp", Map.of()));

        String mermaid = new StoreExplain(lookalikes).toMermaid();
        assertTrue(mermaid, mermaid.contains("n0[\"/a-b<br/>NumberOp\"];"));
        assertTrue(mermaid, mermaid.contains("n1[\"/a_b<br/>NumberOp\"];"));
        assertTrue(mermaid, mermaid.contains("n2[\"/say#quot;hi#quot;<br/>StringOp\"];"));
    }
}
