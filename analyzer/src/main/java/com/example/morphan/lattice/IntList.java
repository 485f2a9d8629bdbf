package com.example.morphan.lattice;

import java.util.Arrays;

/**
 * Growable list of node ids. Clearing keeps the backing array so a lattice can be reused without
 * reallocating its adjacency lists.
 */
public final class IntList {

    private int[] values;
    private int size;

    IntList() {
        this(4);
    }

    IntList(int capacity) {
        this.values = new int[Math.max(1, capacity)];
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + size);
        }
        return values[index];
    }

    public int[] toArray() {
        return Arrays.copyOf(values, size);
    }

    void add(int value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, size * 2);
        }
        values[size++] = value;
    }

    void clear() {
        size = 0;
    }
}
