package com.noodles.opgraph.engine;

import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OperatorIdentityException;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.io.BuiltInOperatorType;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class OperatorStoreTest {

    private OperatorStore store;

    @Before
    public void setUp() {
        store = new OperatorStore();
        put("/num");
        put("/box");
        put("/box/inner");
        put("/box/inner/deep");
    }

    private Operator put(String path) {
        Operator op = new Operator(path, BuiltInOperatorType.NUMBER.definition());
        store.set(path, op);
        return op;
    }

    @Test
    public void testBasicOperations() {
        assertEquals(4, store.size());
        assertTrue(store.has("/num"));
        assertNotNull(store.get("/num"));
        assertNull(store.get("/missing"));
        assertNull(store.get(null));

        Operator removed = store.delete("/num");
        assertEquals("/num", removed.path());
        assertNull(store.delete("/num"));
        assertFalse(store.has("/num"));

        store.clear();
        assertTrue(store.isEmpty());
    }

    @Test
    public void testIterationKeepsInsertionOrder() {
        List<String> paths = new ArrayList<>();
        for (Operator op : store)
            paths.add(op.path());
        assertEquals(List.of("/num", "/box", "/box/inner", "/box/inner/deep"), paths);
    }

    @Test(expected = OperatorIdentityException.class)
    public void testSetRejectsInvalidPath() {
        store.set("relative", new Operator("/relative", BuiltInOperatorType.NUMBER.definition()));
    }

    @Test(expected = OperatorIdentityException.class)
    public void testSetRejectsMismatchedKey() {
        store.set("/other", new Operator("/num2", BuiltInOperatorType.NUMBER.definition()));
    }

    @Test
    public void testGetOpResolvesReferences() {
        assertEquals("/num", store.getOp("/num").path());
        assertEquals("/box/inner", store.getOp("inner", "/box/other").path());
        assertNull(store.getOp("inner", "/box/inner/deep"));
        assertEquals("/box/inner/deep", store.getOp("./deep", "/box/inner/x").path());
        assertEquals("/num", store.getOp("../../num", "/box/inner/deep").path());
        assertNull(store.getOp("num"));
        assertNull(store.getOp(""));
        assertNull(store.getOp(null, "/box"));
        assertNull(store.getOp("/missing"));
    }

    @Test
    public void testContainerQueries() {
        List<String> children = new ArrayList<>();
        for (Operator op : store.directChildrenOf("/box"))
            children.add(op.path());
        assertEquals(List.of("/box/inner"), children);
        assertEquals(2, store.descendantsOf("/box").size());
        assertTrue(store.directChildrenOf("/").isEmpty());
    }

    @Test
    public void testNextAvailablePath() {
        assertEquals("/box/num", store.nextAvailablePath("num", "/box"));
        assertEquals("/num-1", store.nextAvailablePath("num", "/"));
        put("/num-1");
        assertEquals("/num-2", store.nextAvailablePath("num", "/"));
    }

    @Test
    public void testUpstreamAndEffectiveValues() {
        Operator src = store.get("/num");
        src.output("val").set(7);
        Operator dst = store.get("/box/inner");
        Subscription s = Subscription.of("e", "/num", "val", "/box/inner", "val");
        dst.input("val").addSubscription(s);

        assertEquals(7, store.upstreamValue(s));
        assertEquals(7, store.effectiveValue(dst, "val"));
        assertEquals(Map.of("val", 7), store.effectiveValues(dst));
        assertEquals(1, store.dependentsOf("/num").size());

        store.delete("/num");
        assertNull(store.upstreamValue(s));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEffectiveValueOfUnknownField() {
        store.effectiveValue(store.get("/num"), "nope");
    }
}
