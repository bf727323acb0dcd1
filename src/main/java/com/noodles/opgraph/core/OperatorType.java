package com.noodles.opgraph.core;

import com.noodles.opgraph.api.ComputeFunction;
import com.noodles.opgraph.api.FanInPolicy;
import com.noodles.opgraph.util.FanInPolicies;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one kind of operator: its parameter fields (with defaults and
 * fan-in policies), its output fields, and its compute function.
 *
 * <p>
 * Types are immutable and shared by every operator instance of that type. Use
 * {@link #builder(String)} to define one:
 *
 * <pre>{@code
 * OperatorType number = OperatorType.builder("NumberOp")
 *         .parameter("val", 0)
 *         .output("val")
 *         .compute((op, in, store) -> Map.of("val", in.get("val")))
 *         .build();
 * }</pre>
 */
public final class OperatorType {
    private static final ComputeFunction NO_OP = (op, inputs, store) -> Collections.emptyMap();

    private final String name;
    private final String description;
    private final Map<String, FieldSpec> parameters;
    private final List<String> outputs;
    private final ComputeFunction compute;

    private OperatorType(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.outputs = List.copyOf(b.outputs);
        this.compute = b.compute;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Map<String, FieldSpec> parameters() {
        return parameters;
    }

    public List<String> outputs() {
        return outputs;
    }

    public ComputeFunction compute() {
        return compute;
    }

    public boolean hasParameter(String field) {
        return parameters.containsKey(field);
    }

    public boolean hasOutput(String field) {
        return outputs.contains(field);
    }

    @Override
    public String toString() {
        return "OperatorType[" + name + "]";
    }

    /** Declaration of a single parameter field. */
    public record FieldSpec(String name, Object defaultValue, FanInPolicy fanInPolicy) {
        public FieldSpec {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(fanInPolicy, "fanInPolicy");
        }
    }

    /** Fluent builder for {@link OperatorType}. */
    public static final class Builder {
        private final String name;
        private String description = "";
        private final Map<String, FieldSpec> parameters = new LinkedHashMap<>();
        private final List<String> outputs = new ArrayList<>();
        private ComputeFunction compute = NO_OP;

        private Builder(String name) {
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("Operator type needs a name");
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Declares a single-source parameter. */
        public Builder parameter(String field, Object defaultValue) {
            return parameter(field, defaultValue, FanInPolicies.SINGLE);
        }

        public Builder parameter(String field, Object defaultValue, FanInPolicy policy) {
            if (parameters.containsKey(field))
                throw new IllegalArgumentException("Duplicate parameter '" + field + "' on " + name);
            parameters.put(field, new FieldSpec(field, defaultValue, policy));
            return this;
        }

        public Builder output(String field) {
            if (outputs.contains(field))
                throw new IllegalArgumentException("Duplicate output '" + field + "' on " + name);
            outputs.add(field);
            return this;
        }

        public Builder compute(ComputeFunction compute) {
            this.compute = Objects.requireNonNull(compute, "compute");
            return this;
        }

        public OperatorType build() {
            return new OperatorType(this);
        }
    }
}
