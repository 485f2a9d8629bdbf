package com.example.morphan.dictionary;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConnectionCostMatrixTest {

    @Test
    void unsetPairsUseTheDefaultCost() {
        ConnectionCostMatrix matrix = ConnectionCostMatrix.builder(3, 777)
                .set(2, 1, 100)
                .build();

        Assertions.assertEquals(100, matrix.cost(2, 1));
        Assertions.assertEquals(777, matrix.cost(1, 2));
        Assertions.assertEquals(3, matrix.size());
    }

    @Test
    void indexedByRightIdOfPredecessorThenLeftIdOfSuccessor() {
        ConnectionCostMatrix matrix = ConnectionCostMatrix.builder(2, 0)
                .set(0, 1, -5)
                .set(1, 0, 5)
                .build();

        Assertions.assertEquals(-5, matrix.cost(0, 1));
        Assertions.assertEquals(5, matrix.cost(1, 0));
    }

    @Test
    void idsOutsideTheTableAreRejected() {
        ConnectionCostMatrix matrix = ConnectionCostMatrix.builder(2, 0).build();

        Assertions.assertThrows(IllegalArgumentException.class, () -> matrix.cost(2, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> matrix.cost(0, -1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionCostMatrix.builder(0, 0));
    }

    @Test
    void builtMatrixIsNotAffectedByLaterBuilderChanges() {
        ConnectionCostMatrix.Builder builder = ConnectionCostMatrix.builder(2, 1);
        ConnectionCostMatrix first = builder.build();
        builder.set(0, 0, 42);

        Assertions.assertEquals(1, first.cost(0, 0));
        Assertions.assertEquals(42, builder.build().cost(0, 0));
    }
}
