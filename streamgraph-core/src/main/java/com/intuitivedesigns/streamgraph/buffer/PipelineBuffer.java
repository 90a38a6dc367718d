/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.buffer;

import com.intuitivedesigns.streamgraph.core.BackpressureStrategy;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.error.CapacityExceededException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO in front of a pipeline graph.
 *
 * <p>This is the single hard resource bound of the engine: {@link #size()} never exceeds
 * {@link #capacity()}, whatever the backpressure strategy.</p>
 */
public final class PipelineBuffer {

    private final String pipelineId;
    private final int capacity;
    private final BlockingQueue<StreamItem> queue;

    public PipelineBuffer(String pipelineId, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.pipelineId = pipelineId;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Appends an item to the tail, applying the strategy when the buffer is full.
     *
     * @throws CapacityExceededException if the item could not be buffered
     */
    public void enqueue(StreamItem item, BackpressureStrategy strategy, long blockTimeoutMs) {
        if (queue.offer(item)) return;

        if (strategy == BackpressureStrategy.BLOCK && blockTimeoutMs > 0) {
            try {
                if (queue.offer(item, blockTimeoutMs, TimeUnit.MILLISECONDS)) return;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        throw new CapacityExceededException(pipelineId, capacity);
    }

    /**
     * Non-blocking append used for requeues.
     *
     * @return false if the buffer is full
     */
    public boolean offer(StreamItem item) {
        return queue.offer(item);
    }

    /**
     * Removes up to {@code max} items from the head, in FIFO order.
     */
    public List<StreamItem> drain(int max) {
        if (max <= 0 || queue.isEmpty()) return Collections.emptyList();
        final List<StreamItem> batch = new ArrayList<>(Math.min(max, capacity));
        queue.drainTo(batch, max);
        return batch;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public void clear() {
        queue.clear();
    }
}
