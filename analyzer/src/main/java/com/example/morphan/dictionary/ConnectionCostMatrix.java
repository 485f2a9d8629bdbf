package com.example.morphan.dictionary;

import java.util.Arrays;

/**
 * Dense square {@link ConnectionCosts} table stored row-major by right context id.
 */
public final class ConnectionCostMatrix implements ConnectionCosts {

    private final int size;
    private final int[] costs;

    private ConnectionCostMatrix(int size, int[] costs) {
        this.size = size;
        this.costs = costs;
    }

    public static Builder builder(int size, int defaultCost) {
        return new Builder(size, defaultCost);
    }

    @Override
    public int cost(int rightId, int leftId) {
        if (rightId < 0 || rightId >= size || leftId < 0 || leftId >= size) {
            throw new IllegalArgumentException("Context id out of range [0, " + size + "): right="
                    + rightId + ", left=" + leftId);
        }
        return costs[rightId * size + leftId];
    }

    @Override
    public int size() {
        return size;
    }

    public static final class Builder {
        private final int size;
        private final int[] costs;

        private Builder(int size, int defaultCost) {
            if (size <= 0) {
                throw new IllegalArgumentException("Matrix size must be positive: " + size);
            }
            this.size = size;
            this.costs = new int[Math.multiplyExact(size, size)];
            Arrays.fill(costs, defaultCost);
        }

        public Builder set(int rightId, int leftId, int cost) {
            if (rightId < 0 || rightId >= size || leftId < 0 || leftId >= size) {
                throw new IllegalArgumentException("Context id out of range [0, " + size + "): right="
                        + rightId + ", left=" + leftId);
            }
            costs[rightId * size + leftId] = cost;
            return this;
        }

        public ConnectionCostMatrix build() {
            return new ConnectionCostMatrix(size, costs.clone());
        }
    }
}
