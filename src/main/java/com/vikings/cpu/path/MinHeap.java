package com.vikings.cpu.path;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary min-heap keyed by an integer cost.
 * <p>
 * Equal keys come out in no particular order. The path planner uses it with lazy deletion, so
 * there is no decrease-key.
 *
 * @param <T> payload type
 */
public class MinHeap<T> {

    /**
     * A payload together with the key it was inserted under.
     */
    public record Entry<T>(T item, int key) {}

    private final List<Entry<T>> entries;

    public MinHeap() {
        this.entries = new ArrayList<>();
    }

    public MinHeap(int initialCapacity) {
        this.entries = new ArrayList<>(initialCapacity);
    }

    public void insert(T item, int key) {
        entries.add(new Entry<>(item, key));
        siftUp(entries.size() - 1);
    }

    /**
     * Removes and returns the entry with the lowest key.
     *
     * @return the minimum entry, or {@code null} if the heap is empty
     */
    public Entry<T> extractMin() {
        if (entries.isEmpty()) {
            return null;
        }
        Entry<T> min = entries.get(0);
        Entry<T> last = entries.remove(entries.size() - 1);
        if (!entries.isEmpty()) {
            entries.set(0, last);
            siftDown(0);
        }
        return min;
    }

    /**
     * @return the minimum entry without removing it, or {@code null} if the heap is empty
     */
    public Entry<T> peek() {
        return entries.isEmpty() ? null : entries.get(0);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void siftUp(int index) {
        while (index > 0) {
            int parent = (index - 1) / 2;
            if (entries.get(index).key() >= entries.get(parent).key()) {
                return;
            }
            swap(index, parent);
            index = parent;
        }
    }

    private void siftDown(int index) {
        int size = entries.size();
        while (true) {
            int left = 2 * index + 1;
            int right = left + 1;
            int smallest = index;
            if (left < size && entries.get(left).key() < entries.get(smallest).key()) {
                smallest = left;
            }
            if (right < size && entries.get(right).key() < entries.get(smallest).key()) {
                smallest = right;
            }
            if (smallest == index) {
                return;
            }
            swap(index, smallest);
            index = smallest;
        }
    }

    private void swap(int a, int b) {
        Entry<T> tmp = entries.get(a);
        entries.set(a, entries.get(b));
        entries.set(b, tmp);
    }
}
