package com.noodles.opgraph.engine;

import com.noodles.opgraph.api.ReconcileListener;
import com.noodles.opgraph.core.InputSlot;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OperatorIdentityException;
import com.noodles.opgraph.core.OperatorType;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.core.UnknownOperatorTypeException;
import com.noodles.opgraph.io.BuiltInOperatorType;
import com.noodles.opgraph.io.GraphDefinition;
import com.noodles.opgraph.io.OperatorTypeRegistry;
import com.noodles.opgraph.path.HandleId;
import com.noodles.opgraph.path.HandleNamespace;
import com.noodles.opgraph.path.PathResolver;
import com.noodles.opgraph.util.CompositeReconcileListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Brings an {@link OperatorStore} in line with a declarative
 * {@link GraphDefinition}, touching only what differs.
 *
 * <p>
 * A pass runs in fixed phases:
 * <ol>
 * <li>Validate: ids and types are checked before anything is mutated.</li>
 * <li>Materialize: operators whose path and type survive are reused; their
 * literals are reset from the node data. Everything else is created.</li>
 * <li>Prune: operators no longer declared are disposed and removed, along
 * with every subscription that pointed at them.</li>
 * <li>Wire: edges are turned into the desired subscription set per slot,
 * malformed edges are dropped, and container links are added.</li>
 * <li>Apply: each slot's subscriptions are diffed against its desired set.</li>
 * </ol>
 *
 * <p>
 * Re-running a pass with the same definition changes nothing: the same
 * instances, literals and subscription sets survive, and so does any runtime
 * state attached to the operators.
 *
 * <p>
 * Thread Safety: none; see {@link OperatorStore}.
 */
public final class GraphReconciler {
    private static final Logger log = LogManager.getLogger(GraphReconciler.class);

    /** Edge id prefix for the implicit container-to-child links. */
    public static final String CONTAINER_LINK_PREFIX = "container_in_to_child_";

    private final OperatorStore store;
    private final OperatorTypeRegistry registry;
    private final CompositeReconcileListener listener = new CompositeReconcileListener();

    public GraphReconciler(OperatorStore store, OperatorTypeRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    public OperatorStore store() {
        return store;
    }

    public OperatorTypeRegistry registry() {
        return registry;
    }

    public GraphReconciler addListener(ReconcileListener l) {
        listener.addForComposite(l);
        return this;
    }

    /**
     * Reconciles the store against {@code definition}.
     *
     * @return the materialized operators, in declarative node order.
     * @throws OperatorIdentityException    if a node id is invalid or repeated.
     * @throws UnknownOperatorTypeException if a node names an unregistered type.
     *                                      The store is untouched in both cases.
     */
    public List<Operator> transformGraph(GraphDefinition definition) {
        List<GraphDefinition.NodeDef> nodeDefs = definition.getNodes() != null
                ? definition.getNodes()
                : Collections.emptyList();
        List<GraphDefinition.EdgeDef> edgeDefs = definition.getEdges() != null
                ? definition.getEdges()
                : Collections.emptyList();

        // 0. Validate before touching the store
        Map<String, OperatorType> types = validate(nodeDefs);
        listener.onPassStart(nodeDefs.size(), edgeDefs.size());

        // 1. Materialize
        Map<String, Operator> materialized = new LinkedHashMap<>(nodeDefs.size() * 2);
        int created = 0;
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            OperatorType type = types.get(nd.getId());
            Operator existing = store.get(nd.getId());
            Operator op;
            if (existing != null && existing.typeName().equals(type.name())) {
                existing.resetParameters(nd.inputs());
                existing.setLocked(nd.locked());
                op = existing;
                listener.onOperatorReused(op);
            } else {
                if (existing != null) {
                    log.debug("Replacing {} with a new {}", existing, type.name());
                    dropAll(existing.dispose());
                    store.delete(existing.path());
                    listener.onOperatorRemoved(existing);
                }
                op = new Operator(nd.getId(), type, nd.inputs());
                op.setLocked(nd.locked());
                store.set(op.path(), op);
                created++;
                listener.onOperatorCreated(op);
            }
            materialized.put(op.path(), op);
        }

        // 2. Prune
        int removed = prune(materialized);

        // 3. Wire declared edges
        Map<InputSlot, Set<Subscription>> desired = new IdentityHashMap<>();
        int rejected = 0;
        for (GraphDefinition.EdgeDef edge : edgeDefs) {
            if (!wire(edge, materialized, desired))
                rejected++;
        }

        // 4. Implicit container links
        for (Operator op : materialized.values()) {
            if (BuiltInOperatorType.CONTAINER.is(op))
                linkContainer(op, desired);
        }

        // 5. Apply the desired subscription sets
        for (Operator op : materialized.values()) {
            for (InputSlot slot : op.inputs().values())
                applySubscriptions(slot, desired.getOrDefault(slot, Collections.emptySet()));
        }

        List<Operator> result = Collections.unmodifiableList(new ArrayList<>(materialized.values()));
        log.info("Reconciled {} operators ({} created, {} removed, {} edges rejected)",
                result.size(), created, removed, rejected);
        listener.onPassEnd(result.size());
        return result;
    }

    private Map<String, OperatorType> validate(List<GraphDefinition.NodeDef> nodeDefs) {
        Map<String, OperatorType> types = new HashMap<>(nodeDefs.size() * 2);
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd == null)
                throw new IllegalArgumentException("Null node definition");
            String id = nd.getId();
            if (!PathResolver.isValidPath(id) || !id.equals(PathResolver.normalizePath(id)))
                throw new OperatorIdentityException("Invalid node id", id);
            if (types.containsKey(id))
                throw new OperatorIdentityException("Duplicate node id", id);
            OperatorType type = registry.get(nd.getType());
            if (type == null)
                throw new UnknownOperatorTypeException(nd.getType(), id);
            types.put(id, type);
        }
        return types;
    }

    private int prune(Map<String, Operator> keep) {
        List<String> stale = new ArrayList<>();
        for (String path : store.paths()) {
            if (!keep.containsKey(path))
                stale.add(path);
        }
        if (stale.isEmpty())
            return 0;

        for (String path : stale) {
            Operator op = store.delete(path);
            dropAll(op.dispose());
            log.debug("Removed {}", op);
            listener.onOperatorRemoved(op);
        }

        // Dangling-edge cleanup: nothing may keep reading from a removed path
        for (Operator op : store) {
            for (InputSlot slot : op.inputs().values()) {
                for (Subscription s : new ArrayList<>(slot.subscriptions())) {
                    if (!store.has(s.sourcePath())) {
                        slot.removeSubscription(s);
                        log.debug("Dropped dangling subscription {}", s);
                        listener.onSubscriptionDropped(s);
                    }
                }
            }
        }
        return stale.size();
    }

    private boolean wire(GraphDefinition.EdgeDef edge, Map<String, Operator> nodes,
            Map<InputSlot, Set<Subscription>> desired) {
        if (edge == null) {
            log.warn("Dropping null edge");
            return false;
        }
        HandleId from = PathResolver.parseHandleId(edge.getSourceHandle());
        HandleId to = PathResolver.parseHandleId(edge.getTargetHandle());
        if (from == null || from.namespace() != HandleNamespace.OUT)
            return reject(edge, "source handle '" + edge.getSourceHandle() + "' is not an out.<field> handle");
        if (to == null || to.namespace() != HandleNamespace.PAR)
            return reject(edge, "target handle '" + edge.getTargetHandle() + "' is not a par.<field> handle");

        Operator source = nodes.get(edge.getSource());
        if (source == null)
            return reject(edge, "unknown source operator '" + edge.getSource() + "'");
        Operator target = nodes.get(edge.getTarget());
        if (target == null)
            return reject(edge, "unknown target operator '" + edge.getTarget() + "'");
        if (source.output(from.fieldName()) == null)
            return reject(edge, source + " has no output '" + from.fieldName() + "'");
        InputSlot slot = target.input(to.fieldName());
        if (slot == null)
            return reject(edge, target + " has no parameter '" + to.fieldName() + "'");

        Subscription s = Subscription.of(edge.effectiveId(), source.path(), from.fieldName(),
                target.path(), to.fieldName());
        Set<Subscription> wanted = desired.computeIfAbsent(slot, k -> new LinkedHashSet<>());
        if (wanted.contains(s))
            return reject(edge, "duplicate edge");
        if (wanted.size() >= slot.fanInPolicy().maxSources())
            return reject(edge, "parameter '" + slot.name() + "' of " + target + " accepts at most "
                    + slot.fanInPolicy().maxSources() + " source(s)");
        wanted.add(s);
        return true;
    }

    private boolean reject(GraphDefinition.EdgeDef edge, String reason) {
        log.warn("Dropping edge {}: {}", edge.effectiveId(), reason);
        listener.onEdgeRejected(edge, reason);
        return false;
    }

    private void linkContainer(Operator container, Map<InputSlot, Set<Subscription>> desired) {
        for (Operator child : store.directChildrenOf(container.path())) {
            if (!BuiltInOperatorType.GRAPH_INPUT.is(child))
                continue;
            InputSlot slot = child.input("parentValue");
            Set<Subscription> wanted = desired.computeIfAbsent(slot, k -> new LinkedHashSet<>());
            if (wanted.size() >= slot.fanInPolicy().maxSources()) {
                log.debug("{} already driven by an explicit edge; no container link", child);
                continue;
            }
            wanted.add(new Subscription(CONTAINER_LINK_PREFIX + child.path(), container.path(),
                    HandleNamespace.PAR, "in", child.path(), "parentValue"));
        }
    }

    private void applySubscriptions(InputSlot slot, Set<Subscription> wanted) {
        for (Subscription s : new ArrayList<>(slot.subscriptions())) {
            if (!wanted.contains(s)) {
                slot.removeSubscription(s);
                listener.onSubscriptionDropped(s);
            }
        }
        for (Subscription s : wanted)
            slot.addSubscription(s);
        // declared edge order, not the order subscriptions were first added
        slot.reorderSubscriptions(wanted);
    }

    private void dropAll(List<Subscription> subscriptions) {
        for (Subscription s : subscriptions)
            listener.onSubscriptionDropped(s);
    }
}
