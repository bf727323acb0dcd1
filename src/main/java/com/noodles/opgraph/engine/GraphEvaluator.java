package com.noodles.opgraph.engine;

import com.noodles.opgraph.api.EvaluationListener;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OutputCell;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pushes values through the operator graph.
 *
 * <p>
 * One pass visits every unlocked operator in {@link EvaluationOrder}, feeds
 * its compute function the effective parameter values and writes the result
 * into its output cells. Upstream operators are always visited first, so a
 * single pass settles the whole graph.
 *
 * <p>
 * There is no circuit breaker. A compute function that throws is logged and
 * reported, the operator keeps its previous outputs and the pass moves on.
 *
 * <p>
 * Locked operators are skipped; their outputs stay frozen until unlocked.
 */
public final class GraphEvaluator {
    private static final Logger log = LogManager.getLogger(GraphEvaluator.class);

    private final OperatorStore store;
    private EvaluationListener listener;
    private long epoch;
    private int lastEvaluatedCount;

    public GraphEvaluator(OperatorStore store) {
        this.store = store;
    }

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /**
     * Runs one evaluation pass.
     *
     * @return the number of operators whose compute function completed.
     * @throws IllegalStateException if the subscriptions form a cycle. Nothing
     *                               is evaluated in that case.
     */
    public int evaluate() {
        EvaluationOrder order = EvaluationOrder.of(store);

        epoch++;
        final EvaluationListener l = this.listener;
        final boolean hasListener = l != null;
        if (hasListener)
            l.onEvaluationStart(epoch);

        int evaluated = 0;
        for (Operator op : order.operators()) {
            if (op.isLocked())
                continue;

            long start = System.nanoTime();
            Map<String, Object> result;
            try {
                result = op.type().compute().compute(op, store.effectiveValues(op), store);
            } catch (RuntimeException e) {
                log.warn("Evaluation of {} failed in epoch {}: {}", op, epoch, e.getMessage());
                if (hasListener)
                    l.onOperatorError(epoch, op.path(), e);
                continue;
            }

            if (result != null) {
                for (Map.Entry<String, Object> e : result.entrySet()) {
                    OutputCell cell = op.output(e.getKey());
                    if (cell != null)
                        cell.set(e.getValue());
                    else
                        log.debug("{} produced undeclared output '{}'", op, e.getKey());
                }
            }
            evaluated++;
            if (hasListener)
                l.onOperatorEvaluated(epoch, op.path(), System.nanoTime() - start);
        }

        lastEvaluatedCount = evaluated;
        if (hasListener)
            l.onEvaluationEnd(epoch, evaluated);
        log.debug("Epoch {} evaluated {} of {} operators", epoch, evaluated, order.size());
        return evaluated;
    }

    public long epoch() {
        return epoch;
    }

    public int lastEvaluatedCount() {
        return lastEvaluatedCount;
    }
}
