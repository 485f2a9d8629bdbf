package com.example.morphan.lattice;

import com.example.morphan.DisconnectedLatticeException;
import com.example.morphan.dictionary.ConnectionCosts;

import java.util.Objects;

/**
 * Minimum-cost decoding over a built {@link Lattice}.
 *
 * <p>The forward pass visits begin positions {@code 0..N}; a node beginning at {@code p} takes the
 * cheapest of the nodes ending at {@code p}, comparing with a strict {@code <} in end-list order so
 * the first candidate wins a tie. The backward pass is the mirror image from {@code N} down to
 * {@code 0} and gives, for every node, the exact cost of the cheapest completion to EOS including
 * the node's own emission cost.</p>
 *
 * <p>The decoder holds no per-analysis state and may be shared between threads.</p>
 */
public final class ViterbiDecoder {

    private final ConnectionCosts connections;

    public ViterbiDecoder(ConnectionCosts connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /**
     * Runs the forward pass and, when {@code backward} is set, the backward pass.
     */
    public void decode(Lattice lattice, boolean backward) {
        forward(lattice);
        if (backward) {
            backward(lattice);
        }
    }

    public void forward(Lattice lattice) {
        lattice.resetCosts();
        lattice.setForward(Lattice.BOS, 0L, NodeArena.NO_NODE);
        int length = lattice.length();
        for (int position = 0; position <= length; position++) {
            IntList beginning = lattice.beginNodes(position);
            if (beginning.isEmpty()) {
                continue;
            }
            IntList ending = lattice.endNodes(position);
            for (int i = 0; i < beginning.size(); i++) {
                int node = beginning.get(i);
                int leftId = lattice.leftId(node);
                long best = Long.MAX_VALUE;
                int bestPredecessor = NodeArena.NO_NODE;
                for (int j = 0; j < ending.size(); j++) {
                    int predecessor = ending.get(j);
                    long cost = lattice.forwardCost(predecessor);
                    if (cost == NodeArena.UNSET) {
                        continue;
                    }
                    cost += connections.cost(lattice.rightId(predecessor), leftId);
                    if (cost < best) {
                        best = cost;
                        bestPredecessor = predecessor;
                    }
                }
                if (bestPredecessor == NodeArena.NO_NODE) {
                    throw new DisconnectedLatticeException("Node has no reachable predecessor", position);
                }
                lattice.setForward(node, best + lattice.cost(node), bestPredecessor);
            }
        }
        lattice.markForwardDone();
    }

    public void backward(Lattice lattice) {
        if (!lattice.isForwardDone()) {
            throw new IllegalStateException("The forward pass must run before the backward pass");
        }
        int length = lattice.length();
        lattice.setBackward(Lattice.EOS, 0L);
        for (int position = length; position >= 0; position--) {
            IntList ending = lattice.endNodes(position);
            if (ending.isEmpty()) {
                continue;
            }
            IntList beginning = lattice.beginNodes(position);
            for (int i = 0; i < ending.size(); i++) {
                int node = ending.get(i);
                int rightId = lattice.rightId(node);
                long best = Long.MAX_VALUE;
                for (int j = 0; j < beginning.size(); j++) {
                    int successor = beginning.get(j);
                    long cost = lattice.backwardCost(successor);
                    if (cost == NodeArena.UNSET) {
                        continue;
                    }
                    cost += connections.cost(rightId, lattice.leftId(successor));
                    if (cost < best) {
                        best = cost;
                    }
                }
                if (best != Long.MAX_VALUE) {
                    lattice.setBackward(node, best + lattice.cost(node));
                }
            }
        }
        if (lattice.backwardCost(Lattice.BOS) == NodeArena.UNSET) {
            throw new DisconnectedLatticeException("End of sentence is not reachable from its start", 0);
        }
        lattice.markBackwardDone();
    }

    /**
     * @return node ids of the best path from BOS to EOS, both included
     */
    public int[] bestPath(Lattice lattice) {
        if (!lattice.isForwardDone()) {
            throw new IllegalStateException("Lattice has not been decoded");
        }
        int count = 0;
        for (int node = Lattice.EOS; node != NodeArena.NO_NODE; node = lattice.bestPredecessor(node)) {
            count++;
        }
        int[] path = new int[count];
        int index = count;
        for (int node = Lattice.EOS; node != NodeArena.NO_NODE; node = lattice.bestPredecessor(node)) {
            path[--index] = node;
        }
        return path;
    }

    public Segmentation bestSegmentation(Lattice lattice) {
        return lattice.segmentation(bestPath(lattice), lattice.forwardCost(Lattice.EOS));
    }

    /**
     * Cost of the cheapest complete path that passes through {@code node}. Needs both passes.
     */
    public long bestCostThrough(Lattice lattice, int node) {
        if (!lattice.isBackwardDone()) {
            throw new IllegalStateException("The backward pass has not run");
        }
        long forward = lattice.forwardCost(node);
        long backward = lattice.backwardCost(node);
        if (forward == NodeArena.UNSET || backward == NodeArena.UNSET) {
            return Long.MAX_VALUE;
        }
        return forward + backward - lattice.cost(node);
    }
}
