package io.agentmesh.routing;

import io.agentmesh.model.Priority;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blocking queue that drains higher priorities first and keeps FIFO order within a priority.
 * Consumers park on a condition until an item arrives or the queue is closed.
 */
public final class PriorityMessageQueue<T> {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final PriorityQueue<Slot<T>> heap = new PriorityQueue<>(
            Comparator.<Slot<T>>comparingInt(s -> s.priority().rank()).reversed()
                    .thenComparingLong(Slot::sequence)
    );
    private long sequence;
    private boolean closed;

    /**
     * Returns false once the queue has been closed.
     */
    public boolean offer(T item, Priority priority) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            heap.add(new Slot<>(item, priority == null ? Priority.NORMAL : priority, ++sequence));
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available. Returns null when the queue is closed.
     */
    public T take() throws InterruptedException {
        lock.lock();
        try {
            while (heap.isEmpty() && !closed) {
                notEmpty.await();
            }
            if (closed) {
                return null;
            }
            return heap.poll().item();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking variant of {@link #take()}.
     */
    public T poll() {
        lock.lock();
        try {
            Slot<T> slot = heap.poll();
            return slot == null ? null : slot.item();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue, wakes every consumer and returns what was still queued in drain order.
     */
    public List<T> close() {
        lock.lock();
        try {
            closed = true;
            List<T> drained = new ArrayList<>(heap.size());
            while (!heap.isEmpty()) {
                drained.add(heap.poll().item());
            }
            notEmpty.signalAll();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    private record Slot<T>(T item, Priority priority, long sequence) {
    }
}
