package com.noodles.opgraph.util;

import com.noodles.opgraph.api.EvaluationListener;
import com.noodles.opgraph.api.ReconcileListener;
import com.noodles.opgraph.core.Operator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates compute timings and failures per operator path.
 * <p>
 * Register it with the reconciler as well as the evaluator so that stats of
 * removed operators are evicted; a replaced operator starts from zero.
 */
public class OperatorProfileListener implements EvaluationListener, ReconcileListener {

    public static class OperatorStats {
        public final String path;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;
        public Throwable lastError;

        public OperatorStats(String path) {
            this.path = path;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Operators come and go between passes, so stats are keyed by path
    private final Map<String, OperatorStats> stats = new LinkedHashMap<>();

    /** @return stats for {@code path}, or {@code null} if it never ran. */
    public OperatorStats get(String path) {
        return stats.get(path);
    }

    @Override
    public void onOperatorEvaluated(long epoch, String path, long durationNanos) {
        stats.computeIfAbsent(path, OperatorStats::new).update(durationNanos);
    }

    @Override
    public void onOperatorError(long epoch, String path, Throwable error) {
        OperatorStats s = stats.computeIfAbsent(path, OperatorStats::new);
        s.errors++;
        s.lastError = error;
    }

    @Override
    public void onOperatorRemoved(Operator operator) {
        stats.remove(operator.path());
    }

    public int size() {
        return stats.size();
    }

    public void reset() {
        stats.clear();
    }

    /** Formatted table, slowest operators first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %8s | %10s | %10s | %10s%n", "Operator", "Count", "Errors",
                "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("--------------------------------------------------------------------------------------------\n");

        List<OperatorStats> sorted = new ArrayList<>(stats.values());
        sorted.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));
        for (OperatorStats s : sorted) {
            sb.append(String.format("%-30s | %10d | %8d | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.path, 30),
                    s.count,
                    s.errors,
                    s.avgMicros(),
                    s.count == 0 ? 0.0 : s.minDurationNanos / 1000.0,
                    s.count == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
