package com.noodles.opgraph.io;

import com.noodles.opgraph.core.InputSlot;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.engine.OperatorStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a live {@link OperatorStore} back into a declarative
 * {@link GraphDefinition}.
 *
 * <p>
 * Only what the reconciler needs to rebuild the same store is emitted:
 * literals equal to the type default are left out, and so are literals of
 * connected slots since they are inert. Container links are implied by the
 * container tree and never appear as edges.
 */
public final class GraphSerializer {
    public static final int FORMAT_VERSION = 1;

    private GraphSerializer() {
        // Utility class
    }

    public static GraphDefinition toDefinition(OperatorStore store) {
        GraphDefinition def = new GraphDefinition();
        def.setVersion(FORMAT_VERSION);

        for (Operator op : store) {
            Map<String, Object> inputs = new LinkedHashMap<>();
            for (InputSlot slot : op.inputs().values()) {
                if (slot.isConnected() || Objects.equals(slot.literal(), slot.defaultValue()))
                    continue;
                inputs.put(slot.name(), GraphDefinition.copyValue(slot.literal()));
            }
            GraphDefinition.NodeDef nd = GraphDefinition.NodeDef.of(op.path(), op.typeName(), inputs);
            nd.getData().setLocked(op.isLocked());
            def.getNodes().add(nd);
        }

        for (Operator op : store) {
            for (InputSlot slot : op.inputs().values()) {
                for (Subscription s : slot.subscriptions()) {
                    if (s.readsParameter())
                        continue;
                    def.getEdges().add(new GraphDefinition.EdgeDef(s.edgeId(), s.sourcePath(), s.targetPath(),
                            s.sourceHandle().toString(), s.targetHandle().toString()));
                }
            }
        }
        return def;
    }
}
