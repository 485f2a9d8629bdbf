package com.example.morphan.lattice;

import java.util.Arrays;

/**
 * Storage for the nodes of one lattice, kept as parallel primitive arrays addressed by node id.
 * Ids are dense, start at zero and stay valid until the next {@link #clear()}.
 */
final class NodeArena {

    static final long UNSET = Long.MAX_VALUE;
    static final int NO_NODE = -1;

    private static final NodeKind[] KINDS = NodeKind.values();

    private int size;
    private int[] begin;
    private int[] length;
    private int[] leftId;
    private int[] rightId;
    private int[] cost;
    private int[] featureRef;
    private int[] morphemeRef;
    private byte[] kind;
    private long[] forwardCost;
    private long[] backwardCost;
    private int[] bestPredecessor;

    NodeArena(int capacity) {
        allocate(Math.max(capacity, 8));
    }

    int add(int nodeBegin, int nodeLength, int nodeLeftId, int nodeRightId, int nodeCost, int nodeFeatureRef,
            int nodeMorphemeRef, NodeKind nodeKind) {
        if (size == begin.length) {
            grow();
        }
        int id = size++;
        begin[id] = nodeBegin;
        length[id] = nodeLength;
        leftId[id] = nodeLeftId;
        rightId[id] = nodeRightId;
        cost[id] = nodeCost;
        featureRef[id] = nodeFeatureRef;
        morphemeRef[id] = nodeMorphemeRef;
        kind[id] = (byte) nodeKind.ordinal();
        forwardCost[id] = UNSET;
        backwardCost[id] = UNSET;
        bestPredecessor[id] = NO_NODE;
        return id;
    }

    void clear() {
        size = 0;
    }

    int size() {
        return size;
    }

    int capacity() {
        return begin.length;
    }

    int begin(int id) {
        return begin[check(id)];
    }

    int length(int id) {
        return length[check(id)];
    }

    int leftId(int id) {
        return leftId[check(id)];
    }

    int rightId(int id) {
        return rightId[check(id)];
    }

    int cost(int id) {
        return cost[check(id)];
    }

    int featureRef(int id) {
        return featureRef[check(id)];
    }

    int morphemeRef(int id) {
        return morphemeRef[check(id)];
    }

    NodeKind kind(int id) {
        return KINDS[kind[check(id)]];
    }

    long forwardCost(int id) {
        return forwardCost[check(id)];
    }

    long backwardCost(int id) {
        return backwardCost[check(id)];
    }

    int bestPredecessor(int id) {
        return bestPredecessor[check(id)];
    }

    void setForward(int id, long value, int predecessor) {
        forwardCost[check(id)] = value;
        bestPredecessor[id] = predecessor;
    }

    void setBackward(int id, long value) {
        backwardCost[check(id)] = value;
    }

    void resetCosts() {
        Arrays.fill(forwardCost, 0, size, UNSET);
        Arrays.fill(backwardCost, 0, size, UNSET);
        Arrays.fill(bestPredecessor, 0, size, NO_NODE);
    }

    private int check(int id) {
        if (id < 0 || id >= size) {
            throw new IndexOutOfBoundsException("Node id " + id + " out of bounds for " + size + " nodes");
        }
        return id;
    }

    private void grow() {
        int capacity = begin.length * 2;
        begin = Arrays.copyOf(begin, capacity);
        length = Arrays.copyOf(length, capacity);
        leftId = Arrays.copyOf(leftId, capacity);
        rightId = Arrays.copyOf(rightId, capacity);
        cost = Arrays.copyOf(cost, capacity);
        featureRef = Arrays.copyOf(featureRef, capacity);
        morphemeRef = Arrays.copyOf(morphemeRef, capacity);
        kind = Arrays.copyOf(kind, capacity);
        forwardCost = Arrays.copyOf(forwardCost, capacity);
        backwardCost = Arrays.copyOf(backwardCost, capacity);
        bestPredecessor = Arrays.copyOf(bestPredecessor, capacity);
    }

    private void allocate(int capacity) {
        begin = new int[capacity];
        length = new int[capacity];
        leftId = new int[capacity];
        rightId = new int[capacity];
        cost = new int[capacity];
        featureRef = new int[capacity];
        morphemeRef = new int[capacity];
        kind = new byte[capacity];
        forwardCost = new long[capacity];
        backwardCost = new long[capacity];
        bestPredecessor = new int[capacity];
    }
}
