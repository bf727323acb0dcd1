package com.noodles.opgraph.fn;

import java.util.Set;

/**
 * Scalar functions behind the {@code MathOp} operator type.
 *
 * <p>
 * Binary functions take both operands; unary functions only read {@code a}.
 */
public final class MathFunctions {
    private static final Set<String> UNARY = Set.of(
            "sine", "cosine", "tan", "log", "sqrt", "round", "floor", "ceil", "abs", "rad", "deg");

    private static final Set<String> BINARY = Set.of(
            "add", "subtract", "multiply", "divide", "min", "max", "modulo", "power");

    private MathFunctions() {
        // Utility class
    }

    public static boolean isUnary(String operator) {
        return UNARY.contains(operator);
    }

    public static boolean isKnown(String operator) {
        return UNARY.contains(operator) || BINARY.contains(operator);
    }

    /**
     * @throws IllegalArgumentException for an unknown operator name.
     */
    public static double apply(String operator, double a, double b) {
        if (operator == null)
            throw new IllegalArgumentException("Missing math operator");
        return switch (operator) {
            case "add" -> a + b;
            case "subtract" -> a - b;
            case "multiply" -> a * b;
            case "divide" -> a / b;
            case "min" -> Math.min(a, b);
            case "max" -> Math.max(a, b);
            case "modulo" -> a % b;
            case "power" -> Math.pow(a, b);
            case "sine" -> Math.sin(a);
            case "cosine" -> Math.cos(a);
            case "tan" -> Math.tan(a);
            case "log" -> Math.log(a);
            case "sqrt" -> Math.sqrt(a);
            case "round" -> Math.round(a);
            case "floor" -> Math.floor(a);
            case "ceil" -> Math.ceil(a);
            case "abs" -> Math.abs(a);
            case "rad" -> Math.toRadians(a);
            case "deg" -> Math.toDegrees(a);
            default -> throw new IllegalArgumentException("Unknown operator: " + operator);
        };
    }

    /**
     * Coerces a parameter value to a double. {@code null} reads as zero, strings
     * are parsed.
     */
    public static double toDouble(Object v) {
        if (v == null)
            return 0.0;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }
}
