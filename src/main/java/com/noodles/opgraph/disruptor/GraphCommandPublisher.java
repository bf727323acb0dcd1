package com.noodles.opgraph.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.noodles.opgraph.OperatorGraph;
import com.noodles.opgraph.core.Operator;
import com.noodles.opgraph.io.GraphDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes graph commands from any number of threads onto one consumer
 * thread.
 *
 * <p>
 * The operator store is single-threaded. Hosts that edit the graph from
 * several threads (UI, file watchers, network) publish through this class
 * instead of touching the {@link OperatorGraph} directly; every command runs
 * to completion before the next one starts. Each submission returns a future
 * completed on the consumer thread.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * GraphCommandPublisher publisher = new GraphCommandPublisher(graph, 1024);
 * publisher.start();
 * publisher.submitReconcile(definition, "Add node").get();
 * publisher.shutdown();
 * </pre>
 */
public final class GraphCommandPublisher {
    private static final Logger log = LogManager.getLogger(GraphCommandPublisher.class);

    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;

    private final Disruptor<GraphCommand> disruptor;
    private final AtomicLong sequenceIds = new AtomicLong();
    private volatile RingBuffer<GraphCommand> ringBuffer;

    public GraphCommandPublisher(OperatorGraph graph) {
        this(graph, DEFAULT_RING_BUFFER_SIZE);
    }

    /**
     * @param ringBufferSize must be a power of two.
     */
    public GraphCommandPublisher(OperatorGraph graph, int ringBufferSize) {
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("Ring buffer size must be a power of two: " + ringBufferSize);
        this.disruptor = new Disruptor<>(
                GraphCommand::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new GraphCommandHandler(graph));
    }

    public synchronized void start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Publisher already started");
        ringBuffer = disruptor.start();
        log.info("Graph command publisher started (bufferSize={})", ringBuffer.getBufferSize());
    }

    /** Waits for every published command to finish, then stops the consumer. */
    public synchronized void shutdown() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("Graph command publisher stopped");
    }

    /**
     * Publishes a reconciliation. The definition is copied before it is handed
     * to the consumer, so the caller may keep mutating its own instance.
     */
    @SuppressWarnings("unchecked")
    public CompletableFuture<List<Operator>> submitReconcile(GraphDefinition definition, String description) {
        GraphDefinition copy = definition.copy();
        CompletableFuture<Object> result = new CompletableFuture<>();
        RingBuffer<GraphCommand> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setReconcile(copy, description, result, sequenceIds.incrementAndGet());
        } finally {
            rb.publish(seq);
        }
        return result.thenApply(r -> (List<Operator>) r);
    }

    public CompletableFuture<Boolean> submitUndo() {
        return publish(GraphCommand.Kind.UNDO).thenApply(r -> (Boolean) r);
    }

    public CompletableFuture<Boolean> submitRedo() {
        return publish(GraphCommand.Kind.REDO).thenApply(r -> (Boolean) r);
    }

    /** @return future of the number of operators evaluated. */
    public CompletableFuture<Integer> submitEvaluate() {
        return publish(GraphCommand.Kind.EVALUATE).thenApply(r -> (Integer) r);
    }

    private CompletableFuture<Object> publish(GraphCommand.Kind kind) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        RingBuffer<GraphCommand> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).set(kind, result, sequenceIds.incrementAndGet());
        } finally {
            rb.publish(seq);
        }
        return result;
    }

    private RingBuffer<GraphCommand> requireStarted() {
        RingBuffer<GraphCommand> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Publisher not started");
        return rb;
    }
}
