package com.example.morphan.lattice;

import com.example.morphan.dictionary.ConnectionCosts;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Lazily enumerates complete paths of a decoded {@link Lattice} in non-decreasing cost order.
 *
 * <p>The search grows partial paths from BOS towards EOS. A partial path ending at node {@code n}
 * with realised cost {@code g} (emission and connection costs from BOS through {@code n}) is
 * queued under {@code g + backwardCost(n) - cost(n)}, the exact cost of its cheapest completion.
 * Because that key is exact, the first complete path popped is the best remaining one. Every queue
 * entry is a distinct prefix, so every path is produced at most once; equal keys are ordered by
 * insertion, which keeps the enumeration deterministic.</p>
 *
 * <p>Each call to {@link #next()} pops and expands until one more complete path surfaces. The
 * caller stops simply by not asking for more. The enumerator reads the lattice it was created on
 * and fails fast if that lattice is reset in the meantime.</p>
 */
public final class NBestEnumerator implements Iterator<Segmentation> {

    private final Lattice lattice;
    private final ConnectionCosts connections;
    private final int generation;
    private final PriorityQueue<Hypothesis> queue = new PriorityQueue<>();
    private long sequence;
    private Hypothesis pending;
    private int produced;

    public NBestEnumerator(Lattice lattice, ConnectionCosts connections) {
        this.lattice = Objects.requireNonNull(lattice, "lattice");
        this.connections = Objects.requireNonNull(connections, "connections");
        if (!lattice.isBackwardDone()) {
            throw new IllegalStateException("N-best enumeration needs the backward pass");
        }
        this.generation = lattice.generation();
        queue.add(new Hypothesis(Lattice.BOS, null, 0L, lattice.backwardCost(Lattice.BOS), sequence++, 1));
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public Segmentation next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more segmentations");
        }
        Hypothesis complete = pending;
        pending = null;
        produced++;
        int[] path = new int[complete.depth];
        int index = path.length;
        for (Hypothesis h = complete; h != null; h = h.parent) {
            path[--index] = h.node;
        }
        return lattice.segmentation(path, complete.realized);
    }

    /**
     * @return number of segmentations returned so far
     */
    public int produced() {
        return produced;
    }

    private Hypothesis advance() {
        checkGeneration();
        while (!queue.isEmpty()) {
            Hypothesis top = queue.poll();
            if (top.node == Lattice.EOS) {
                return top;
            }
            int rightId = lattice.rightId(top.node);
            IntList successors = lattice.beginNodes(lattice.end(top.node));
            for (int i = 0; i < successors.size(); i++) {
                int successor = successors.get(i);
                long completion = lattice.backwardCost(successor);
                if (completion == NodeArena.UNSET) {
                    continue;
                }
                int emission = lattice.cost(successor);
                long realized = top.realized + connections.cost(rightId, lattice.leftId(successor)) + emission;
                queue.add(new Hypothesis(successor, top, realized, realized + completion - emission, sequence++,
                        top.depth + 1));
            }
        }
        return null;
    }

    private void checkGeneration() {
        if (lattice.generation() != generation) {
            throw new ConcurrentModificationException("Lattice was reset while enumerating");
        }
    }

    private static final class Hypothesis implements Comparable<Hypothesis> {
        private final int node;
        private final Hypothesis parent;
        private final long realized;
        private final long priority;
        private final long sequence;
        private final int depth;

        private Hypothesis(int node, Hypothesis parent, long realized, long priority, long sequence, int depth) {
            this.node = node;
            this.parent = parent;
            this.realized = realized;
            this.priority = priority;
            this.sequence = sequence;
            this.depth = depth;
        }

        @Override
        public int compareTo(Hypothesis other) {
            int byPriority = Long.compare(priority, other.priority);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
