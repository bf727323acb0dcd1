package com.noodles.opgraph.util;

import com.noodles.opgraph.api.EvaluationListener;

import java.util.Arrays;

/**
 * Aggregates multiple {@link EvaluationListener} instances, called in
 * registration order.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public void addForComposite(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onEvaluationStart(long epoch) {
        for (EvaluationListener l : listeners)
            l.onEvaluationStart(epoch);
    }

    @Override
    public void onOperatorEvaluated(long epoch, String path, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onOperatorEvaluated(epoch, path, durationNanos);
    }

    @Override
    public void onOperatorError(long epoch, String path, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onOperatorError(epoch, path, error);
    }

    @Override
    public void onEvaluationEnd(long epoch, int evaluated) {
        for (EvaluationListener l : listeners)
            l.onEvaluationEnd(epoch, evaluated);
    }
}
