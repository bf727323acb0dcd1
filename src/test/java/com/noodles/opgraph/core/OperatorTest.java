package com.noodles.opgraph.core;

import com.noodles.opgraph.util.FanInPolicies;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class OperatorTest {

    private static final OperatorType ADDER = OperatorType.builder("Adder")
            .parameter("a", 0)
            .parameter("b", 0)
            .parameter("items", List.of(), FanInPolicies.LIST)
            .output("sum")
            .build();

    @Test
    public void testSlotsFollowTypeDeclaration() {
        Operator op = new Operator("/add", ADDER, Map.of("a", 2));
        assertEquals("/add", op.path());
        assertEquals("Adder", op.typeName());
        assertEquals("/", op.containerPath());
        assertEquals(List.of("a", "b", "items"), List.copyOf(op.inputs().keySet()));
        assertEquals(2, op.input("a").literal());
        assertEquals(0, op.input("b").literal());
        assertNotNull(op.output("sum"));
        assertNull(op.output("nope"));
        assertNull(op.input("nope"));
        assertEquals("Adder[/add]", op.toString());
    }

    @Test(expected = OperatorIdentityException.class)
    public void testRejectsRelativePath() {
        new Operator("add", ADDER);
    }

    @Test(expected = OperatorIdentityException.class)
    public void testRejectsUnnormalizedPath() {
        new Operator("/a/../add", ADDER);
    }

    @Test
    public void testIdentityExceptionCarriesPath() {
        try {
            new Operator("/bad/", ADDER);
            fail("expected OperatorIdentityException");
        } catch (OperatorIdentityException e) {
            assertEquals("/bad/", e.getPath());
            assertTrue(e instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testResetParametersRestoresDefaults() {
        Operator op = new Operator("/add", ADDER, Map.of("a", 2, "b", 3));
        Map<String, Object> next = new HashMap<>();
        next.put("b", 7);
        op.resetParameters(next);
        assertEquals(0, op.input("a").literal());
        assertEquals(7, op.input("b").literal());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSetUnknownParameter() {
        new Operator("/add", ADDER).setParameter("c", 1);
    }

    @Test
    public void testAttributesAndLock() {
        Operator op = new Operator("/box/add", ADDER);
        assertEquals("/box", op.containerPath());
        op.setAttribute("marker", "kept");
        assertEquals("kept", op.<String>attribute("marker"));
        assertEquals("kept", op.removeAttribute("marker"));
        assertNull(op.attribute("marker"));

        assertFalse(op.isLocked());
        op.setLocked(true);
        assertTrue(op.isLocked());
    }

    @Test
    public void testDisposeClearsOwnSubscriptions() {
        Operator op = new Operator("/add", ADDER);
        Subscription s = Subscription.of("e1", "/n", "val", "/add", "a");
        op.input("a").addSubscription(s);
        List<Subscription> removed = op.dispose();
        assertEquals(List.of(s), removed);
        assertFalse(op.input("a").isConnected());
        assertTrue(op.isDisposed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateFieldInType() {
        OperatorType.builder("Broken").parameter("x", 0).parameter("x", 1).build();
    }
}
