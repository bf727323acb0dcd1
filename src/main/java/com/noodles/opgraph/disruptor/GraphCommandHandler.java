package com.noodles.opgraph.disruptor;

import com.lmax.disruptor.EventHandler;
import com.noodles.opgraph.OperatorGraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that executes {@link GraphCommand}s against an
 * {@link OperatorGraph}.
 *
 * <p>
 * Runs on the single consumer thread, so commands are applied strictly one at
 * a time in publication order. Failures complete the command's future
 * exceptionally and never escape into the Disruptor; the consumer thread stays
 * alive for the next command.
 */
public final class GraphCommandHandler implements EventHandler<GraphCommand> {
    private static final Logger log = LogManager.getLogger(GraphCommandHandler.class);

    private final OperatorGraph graph;

    public GraphCommandHandler(OperatorGraph graph) {
        this.graph = graph;
    }

    @Override
    public void onEvent(GraphCommand command, long sequence, boolean endOfBatch) {
        if (command.kind() == null || command.result() == null) {
            log.error("Received empty command slot at sequence {}", sequence);
            return;
        }
        try {
            Object outcome = switch (command.kind()) {
                case RECONCILE -> graph.apply(command.definition(), command.description());
                case UNDO -> graph.undo();
                case REDO -> graph.redo();
                case EVALUATE -> graph.evaluate();
            };
            command.result().complete(outcome);
        } catch (RuntimeException e) {
            log.warn("Command {} (seq {}) failed: {}", command.kind(), command.sequenceId(), e.getMessage());
            command.result().completeExceptionally(e);
        } finally {
            command.clear();
        }
    }
}
