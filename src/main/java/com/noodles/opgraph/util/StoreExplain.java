package com.noodles.opgraph.util;

import com.noodles.opgraph.core.InputSlot;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.core.OutputCell;
import com.noodles.opgraph.core.Subscription;
import com.noodles.opgraph.engine.OperatorStore;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting the live operator store.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and error reports. Allocates freely; keep
 * it off any path that runs per evaluation.
 */
public final class StoreExplain {
    private final OperatorStore store;

    public StoreExplain(OperatorStore store) {
        this.store = store;
    }

    /**
     * Dumps the state of one operator: literals, effective values,
     * subscriptions, outputs and dependents.
     *
     * @throws IllegalArgumentException if nothing lives at {@code path}.
     */
    public String explainOperator(String path) {
        Operator op = store.get(path);
        if (op == null)
            throw new IllegalArgumentException("Unknown operator: " + path);

        StringBuilder sb = new StringBuilder(256);
        sb.append("Operator: ").append(op.path()).append('\n')
                .append("  Type: ").append(op.typeName()).append('\n')
                .append("  Container: ").append(op.containerPath()).append('\n')
                .append("  Locked: ").append(op.isLocked()).append('\n');
        sb.append("  Parameters:\n");
        for (InputSlot slot : op.inputs().values()) {
            sb.append("    ").append(slot.name()).append(" = ").append(store.effectiveValue(op, slot.name()));
            if (slot.isConnected()) {
                sb.append(" <- ");
                int i = 0;
                for (Subscription s : slot.subscriptions()) {
                    if (i++ > 0)
                        sb.append(", ");
                    sb.append(s.sourcePath()).append('.').append(s.sourceHandle());
                }
            } else {
                sb.append(" (literal)");
            }
            sb.append('\n');
        }
        sb.append("  Outputs:\n");
        for (OutputCell cell : op.outputs().values())
            sb.append("    ").append(cell.name()).append(" = ").append(cell.value()).append('\n');

        List<Subscription> dependents = store.dependentsOf(op.path());
        sb.append("  Dependents (").append(dependents.size()).append("): ");
        for (int i = 0; i < dependents.size(); i++) {
            Subscription s = dependents.get(i);
            sb.append(s.targetPath()).append('.').append(s.targetHandle());
            if (i < dependents.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /** One line per operator, with its incoming subscriptions. */
    public String dumpStore() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Store (").append(store.size()).append(" operators):\n");
        for (Operator op : store) {
            sb.append("  ").append(op);
            if (op.isLocked())
                sb.append(" (LOCKED)");
            sb.append('\n');
            for (InputSlot slot : op.inputs().values()) {
                for (Subscription s : slot.subscriptions())
                    sb.append("    ").append(s).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram. Node ids are {@code n<index>} in
     * store order; container links are drawn dotted.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in store order
        Map<String, String> ids = new HashMap<>(store.size() * 2);
        for (Operator op : store) {
            String id = "n" + ids.size();
            ids.put(op.path(), id);
            sb.append("  ").append(id)
                    .append("[\"").append(escapeLabel(op.path())).append("<br/>")
                    .append(escapeLabel(op.typeName())).append("\"];\n");
        }

        // 2. Edges afterwards, labelled with the target parameter
        for (Operator op : store) {
            String target = ids.get(op.path());
            for (InputSlot slot : op.inputs().values()) {
                for (Subscription s : slot.subscriptions()) {
                    String source = ids.get(s.sourcePath());
                    if (source == null)
                        continue;
                    String arrow = s.readsParameter() ? " -. \"" : " -- \"";
                    String head = s.readsParameter() ? "\" .-> " : "\" --> ";
                    sb.append("  ").append(source).append(arrow).append(escapeLabel(slot.name()))
                            .append(head).append(target).append(";\n");
                }
            }
        }
        return sb.toString();
    }

    private static String escapeLabel(String text) {
        return text.replace("\"", "#quot;");
    }
}
