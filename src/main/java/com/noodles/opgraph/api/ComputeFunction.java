package com.noodles.opgraph.api;

import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.engine.OperatorStore;

import java.util.Map;

/**
 * The transform an operator type applies to its effective inputs.
 *
 * <p>
 * Receives the operator being evaluated, its effective parameter values keyed
 * by field name, and the store (for the few types, such as containers, that
 * look at their neighbours). Returns output values keyed by output field name;
 * fields missing from the result keep their previous value.
 */
@FunctionalInterface
public interface ComputeFunction {
    Map<String, Object> compute(Operator operator, Map<String, Object> inputs, OperatorStore store);
}
