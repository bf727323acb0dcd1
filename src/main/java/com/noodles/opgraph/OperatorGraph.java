package com.noodles.opgraph;

import com.noodles.opgraph.api.EvaluationListener;
import com.noodles.opgraph.api.ReconcileListener;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OperatorType;
import com.noodles.opgraph.engine.GraphEvaluator;
import com.noodles.opgraph.engine.GraphReconciler;
import com.noodles.opgraph.engine.OperatorStore;
import com.noodles.opgraph.history.UndoRedoController;
import com.noodles.opgraph.history.UndoRedoState;
import com.noodles.opgraph.io.GraphDefinition;
import com.noodles.opgraph.io.GraphSerializer;
import com.noodles.opgraph.io.OperatorTypeRegistry;
import com.noodles.opgraph.io.ProjectReader;
import com.noodles.opgraph.util.CompositeEvaluationListener;
import com.noodles.opgraph.util.LoggingReconcileListener;
import com.noodles.opgraph.util.OperatorProfileListener;
import com.noodles.opgraph.util.StoreExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A high-level wrapper that wires the operator store, reconciler, evaluator
 * and undo history together.
 * <p>
 * This class handles:
 * <ul>
 * <li>Reading project documents with {@link ProjectReader}</li>
 * <li>Reconciling the store against each new declarative graph</li>
 * <li>Recording every applied graph for undo/redo</li>
 * <li>Running evaluation passes on demand</li>
 * </ul>
 * Not thread-safe; wrap it in a
 * {@link com.noodles.opgraph.disruptor.GraphCommandPublisher} when several
 * threads edit the graph.
 */
public final class OperatorGraph {
    private static final Logger log = LogManager.getLogger(OperatorGraph.class);

    private final OperatorStore store = new OperatorStore();
    private final OperatorTypeRegistry registry;
    private final GraphReconciler reconciler;
    private final GraphEvaluator evaluator;
    private final CompositeEvaluationListener evaluationListeners = new CompositeEvaluationListener();
    private final UndoRedoController history;
    private final ProjectReader reader = new ProjectReader();

    private OperatorGraph(Builder builder) {
        this.registry = new OperatorTypeRegistry();
        for (OperatorType type : builder.types)
            registry.register(type);

        this.reconciler = new GraphReconciler(store, registry);
        for (ReconcileListener l : builder.reconcileListeners)
            reconciler.addListener(l);

        this.evaluator = new GraphEvaluator(store);
        for (EvaluationListener l : builder.evaluationListeners)
            evaluationListeners.addForComposite(l);
        this.evaluator.setListener(evaluationListeners);

        this.history = new UndoRedoController(reconciler::transformGraph, this::snapshot, builder.maxHistorySize);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A graph with the built-in types and default history size. */
    public static OperatorGraph create() {
        return builder().build();
    }

    /**
     * Reconciles the store against {@code definition} and records it in the
     * undo history.
     *
     * @return the materialized operators, in declarative node order.
     */
    public List<Operator> apply(GraphDefinition definition, String description) {
        List<Operator> operators = reconciler.transformGraph(definition);
        history.record(definition, description);
        return operators;
    }

    /**
     * Parses and applies a project document. A malformed document is rejected
     * before the store is touched.
     */
    public List<Operator> load(String json) {
        return apply(reader.read(json), "Load project");
    }

    public List<Operator> load(Path file) {
        log.info("Loading project {}", file);
        return apply(reader.read(file), "Load " + file.getFileName());
    }

    public boolean undo() {
        return history.undo();
    }

    public boolean redo() {
        return history.redo();
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public UndoRedoState historyState() {
        return history.getState();
    }

    /** Runs one evaluation pass; see {@link GraphEvaluator#evaluate()}. */
    public int evaluate() {
        return evaluator.evaluate();
    }

    public Operator getOp(String reference) {
        return store.getOp(reference);
    }

    public Operator getOp(String reference, String contextPath) {
        return store.getOp(reference, contextPath);
    }

    /** Declarative form of the live store. */
    public GraphDefinition snapshot() {
        return GraphSerializer.toDefinition(store);
    }

    /** Project document for the live store. */
    public String toJson() {
        return reader.write(snapshot());
    }

    /** Adds DEBUG logging of every reconcile callback. */
    public LoggingReconcileListener enableReconcileLogging() {
        LoggingReconcileListener l = new LoggingReconcileListener();
        reconciler.addListener(l);
        return l;
    }

    /**
     * Enables per-operator compute profiling.
     * Use the returned listener to dump statistics.
     */
    public OperatorProfileListener enableOperatorProfiling() {
        OperatorProfileListener l = new OperatorProfileListener();
        evaluationListeners.addForComposite(l);
        reconciler.addListener(l);
        return l;
    }

    public StoreExplain explain() {
        return new StoreExplain(store);
    }

    public OperatorStore store() {
        return store;
    }

    public OperatorTypeRegistry registry() {
        return registry;
    }

    public GraphReconciler reconciler() {
        return reconciler;
    }

    public GraphEvaluator evaluator() {
        return evaluator;
    }

    public UndoRedoController history() {
        return history;
    }

    /** Code-level configuration for {@link OperatorGraph}. */
    public static final class Builder {
        private int maxHistorySize = UndoRedoController.DEFAULT_MAX_HISTORY_SIZE;
        private final List<OperatorType> types = new ArrayList<>();
        private final List<ReconcileListener> reconcileListeners = new ArrayList<>();
        private final List<EvaluationListener> evaluationListeners = new ArrayList<>();

        private Builder() {
        }

        public Builder maxHistorySize(int size) {
            if (size < 1)
                throw new IllegalArgumentException("maxHistorySize must be positive: " + size);
            this.maxHistorySize = size;
            return this;
        }

        /** Registers an operator type on top of the built-ins. */
        public Builder registerType(OperatorType type) {
            types.add(type);
            return this;
        }

        public Builder reconcileListener(ReconcileListener listener) {
            reconcileListeners.add(listener);
            return this;
        }

        public Builder evaluationListener(EvaluationListener listener) {
            evaluationListeners.add(listener);
            return this;
        }

        public OperatorGraph build() {
            return new OperatorGraph(this);
        }
    }
}
