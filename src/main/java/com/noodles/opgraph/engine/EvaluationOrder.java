package com.noodles.opgraph.engine;

import com.noodles.opgraph.core.InputSlot;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.io.BuiltInOperatorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshot of the store in dependency order: every operator comes after the
 * operators it reads from.
 *
 * <p>
 * Dependencies are derived from subscriptions. An ordinary subscription makes
 * the target depend on its source. A container link reads a parameter rather
 * than an output, so the target depends on whatever drives that parameter. A
 * {@code ContainerOp} additionally depends on each {@code GraphOutputOp}
 * directly inside it, since its {@code out} mirrors theirs.
 *
 * <p>
 * The order is computed once with Kahn's algorithm; ties keep store order. It
 * goes stale as soon as the store is reconciled again.
 */
public final class EvaluationOrder {
    private final List<Operator> order;
    private final Map<String, Set<String>> dependencies;

    private EvaluationOrder(List<Operator> order, Map<String, Set<String>> dependencies) {
        this.order = order;
        this.dependencies = dependencies;
    }

    /**
     * @throws IllegalStateException if the subscriptions form a cycle.
     */
    public static EvaluationOrder of(OperatorStore store) {
        List<Operator> nodes = new ArrayList<>(store.size());
        Map<String, Integer> indexOf = new HashMap<>(store.size() * 2);
        for (Operator op : store) {
            indexOf.put(op.path(), nodes.size());
            nodes.add(op);
        }
        int n = nodes.size();

        // 1. Collect dependencies and forward edges
        Map<String, Set<String>> deps = new LinkedHashMap<>(n * 2);
        List<List<Integer>> forward = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            forward.add(new ArrayList<>());
        int[] inDegree = new int[n];

        for (int i = 0; i < n; i++) {
            Operator op = nodes.get(i);
            Set<String> upstream = new LinkedHashSet<>();
            for (InputSlot slot : op.inputs().values()) {
                for (Subscription s : slot.subscriptions())
                    collectSources(store, s, upstream, new HashSet<>());
            }
            if (BuiltInOperatorType.CONTAINER.is(op)) {
                for (Operator child : store.directChildrenOf(op.path())) {
                    if (BuiltInOperatorType.GRAPH_OUTPUT.is(child))
                        upstream.add(child.path());
                }
            }
            upstream.retainAll(indexOf.keySet());
            deps.put(op.path(), Collections.unmodifiableSet(upstream));
            for (String from : upstream) {
                forward.get(indexOf.get(from)).add(i);
                inDegree[i]++;
            }
        }

        // 2. Kahn's algorithm
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        List<Operator> sorted = new ArrayList<>(n);
        while (head < tail) {
            int curr = queue[head++];
            sorted.add(nodes.get(curr));
            for (int child : forward.get(curr))
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
        }
        if (sorted.size() != n) {
            String unresolved = nodes.stream()
                    .filter(op -> !sorted.contains(op))
                    .map(Operator::path)
                    .collect(Collectors.joining(", "));
            throw new IllegalStateException("Cycle detected! Unresolved operators: " + unresolved);
        }
        return new EvaluationOrder(Collections.unmodifiableList(sorted), Collections.unmodifiableMap(deps));
    }

    private static void collectSources(OperatorStore store, Subscription s, Set<String> out, Set<String> visited) {
        if (!s.readsParameter()) {
            out.add(s.sourcePath());
            return;
        }
        // A parameter-sourced link depends on whatever drives that parameter
        if (!visited.add(s.sourcePath() + "." + s.sourceField()))
            return;
        Operator source = store.get(s.sourcePath());
        InputSlot slot = source == null ? null : source.input(s.sourceField());
        if (slot == null)
            return;
        for (Subscription upstream : slot.subscriptions())
            collectSources(store, upstream, out, visited);
    }

    public List<Operator> operators() {
        return order;
    }

    public int size() {
        return order.size();
    }

    public Operator operator(int index) {
        return order.get(index);
    }

    /** Paths the operator at {@code path} reads from; empty if unknown. */
    public Set<String> dependenciesOf(String path) {
        Set<String> d = dependencies.get(path);
        return d == null ? Collections.emptySet() : d;
    }
}
