package com.metricsentinel.core.window;

import com.metricsentinel.core.model.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Bounded FIFO of the most recent samples for one metric.
 *
 * <p>
 * Backed by a ring buffer so that push-and-evict is O(1). Ordering is by
 * arrival, not by timestamp: callers are expected to feed non-decreasing
 * timestamps per metric, otherwise scoring quality degrades.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The owning detector serializes access.
 * </p>
 *
 * @since 1.0.0
 */
public final class SampleBuffer {

    private final Sample[] slots;
    private int head;
    private int size;

    /**
     * @param capacity maximum number of retained samples; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public SampleBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.slots = new Sample[capacity];
    }

    /**
     * Append a sample, evicting the oldest one when the buffer is full.
     *
     * @param sample the sample to append; must not be {@code null}
     * @return the evicted sample, or {@code null} if nothing was evicted
     */
    public Sample push(Sample sample) {
        Objects.requireNonNull(sample, "Sample must not be null");
        if (size < slots.length) {
            slots[(head + size) % slots.length] = sample;
            size++;
            return null;
        }
        Sample evicted = slots[head];
        slots[head] = sample;
        head = (head + 1) % slots.length;
        return evicted;
    }

    /**
     * @return an unmodifiable snapshot of the retained samples, oldest first
     */
    public List<Sample> asOrderedSequence() {
        List<Sample> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(slots[(head + i) % slots.length]);
        }
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == slots.length;
    }

    @Override
    public String toString() {
        return "SampleBuffer{size=" + size + ", capacity=" + slots.length + '}';
    }
}
