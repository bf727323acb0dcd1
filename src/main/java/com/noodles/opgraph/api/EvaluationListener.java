package com.noodles.opgraph.api;

/**
 * Observability interface for evaluation passes.
 *
 * Implementations can be registered with the GraphEvaluator to receive
 * callbacks during a pass: profiling (end time - start time), tracing which
 * operators ran, or surfacing per-operator failures to a UI.
 */
public interface EvaluationListener {

    /**
     * Called immediately before an evaluation pass begins.
     *
     * @param epoch The incrementing pass number.
     */
    default void onEvaluationStart(long epoch) {
    }

    /**
     * Called after an operator's outputs have been written.
     *
     * @param epoch         Current pass number.
     * @param path          Path of the evaluated operator.
     * @param durationNanos Time spent in the compute function.
     */
    default void onOperatorEvaluated(long epoch, String path, long durationNanos) {
    }

    /**
     * Called when an operator's compute function throws. The operator keeps its
     * previous outputs.
     */
    default void onOperatorError(long epoch, String path, Throwable error) {
    }

    /**
     * Called when the pass is complete.
     *
     * @param evaluated Number of operators evaluated in this pass.
     */
    default void onEvaluationEnd(long epoch, int evaluated) {
    }
}
