package com.noodles.opgraph.io;

import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OperatorType;
import com.noodles.opgraph.engine.OperatorStore;
import com.noodles.opgraph.fn.MathFunctions;
import com.noodles.opgraph.util.FanInPolicies;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Operator types every registry starts with.
 */
public enum BuiltInOperatorType {
    NUMBER(OperatorType.builder("NumberOp")
            .description("A number")
            .parameter("val", 0)
            .output("val")
            .compute((op, in, store) -> single("val", in.get("val")))
            .build()),
    STRING(OperatorType.builder("StringOp")
            .description("A string")
            .parameter("val", "")
            .output("val")
            .compute((op, in, store) -> single("val", in.get("val")))
            .build()),
    MATH(OperatorType.builder("MathOp")
            .description("Perform a mathematical operation")
            .parameter("operator", "add")
            .parameter("a", 0)
            .parameter("b", 0)
            .output("result")
            .compute((op, in, store) -> {
                String operator = String.valueOf(in.get("operator"));
                double a = MathFunctions.toDouble(in.get("a"));
                double b = MathFunctions.isUnary(operator) ? 0.0 : MathFunctions.toDouble(in.get("b"));
                return single("result", MathFunctions.apply(operator, a, b));
            })
            .build()),
    SUM(OperatorType.builder("SumOp")
            .description("Sums every connected value")
            .parameter("values", List.of(), FanInPolicies.LIST)
            .output("sum")
            .compute((op, in, store) -> {
                double sum = 0.0;
                if (in.get("values") instanceof List<?> values) {
                    for (Object v : values) {
                        if (v != null)
                            sum += MathFunctions.toDouble(v);
                    }
                }
                return single("sum", sum);
            })
            .build()),
    CONTAINER(OperatorType.builder("ContainerOp")
            .description("Encapsulates a subgraph of operators")
            .parameter("in", null)
            .output("out")
            .compute((op, in, store) -> single("out", containerOutput(op, store)))
            .build()),
    GRAPH_INPUT(OperatorType.builder("GraphInputOp")
            .description("Receives input from the parent container")
            .parameter("parentValue", null)
            .output("value")
            .compute((op, in, store) -> single("value", in.get("parentValue")))
            .build()),
    GRAPH_OUTPUT(OperatorType.builder("GraphOutputOp")
            .description("Provides output to the parent container")
            .parameter("value", null)
            .output("propagatedValue")
            .compute((op, in, store) -> single("propagatedValue", in.get("value")))
            .build());

    private final OperatorType definition;

    BuiltInOperatorType(OperatorType definition) {
        this.definition = definition;
    }

    public OperatorType definition() {
        return definition;
    }

    public String typeName() {
        return definition.name();
    }

    public boolean is(Operator operator) {
        return operator != null && typeName().equals(operator.typeName());
    }

    /** @return the built-in with that type name, or {@code null}. */
    public static BuiltInOperatorType fromTypeName(String name) {
        for (BuiltInOperatorType t : values()) {
            if (t.typeName().equals(name))
                return t;
        }
        return null;
    }

    // out mirrors the first GraphOutputOp directly inside the container
    private static Object containerOutput(Operator container, OperatorStore store) {
        for (Operator child : store.directChildrenOf(container.path())) {
            if (GRAPH_OUTPUT.is(child))
                return child.output("propagatedValue").value();
        }
        return null;
    }

    private static Map<String, Object> single(String key, Object value) {
        return Collections.singletonMap(key, value);
    }
}
