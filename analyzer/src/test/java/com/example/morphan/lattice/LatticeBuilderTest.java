package com.example.morphan.lattice;

import com.example.morphan.DisconnectedLatticeException;
import com.example.morphan.TestDictionaries;
import com.example.morphan.dictionary.DictionaryEntry;
import com.example.morphan.dictionary.SystemDictionary;
import com.example.morphan.unknown.CharCategory;
import com.example.morphan.unknown.UnknownWordFallback;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

class LatticeBuilderTest {

    private final SystemDictionary toy = TestDictionaries.toy();

    private Lattice build(SystemDictionary dictionary, String text, int greedyThreshold) {
        LatticeBuilder builder = new LatticeBuilder(dictionary, dictionary.unknownWordFallback(24), greedyThreshold);
        Lattice lattice = new Lattice();
        builder.build(lattice, text);
        return lattice;
    }

    @Test
    void placesSentinelsAtBothEnds() {
        Lattice lattice = build(toy, "ab", 0);

        Assertions.assertEquals(1, lattice.endNodes(0).size());
        Assertions.assertEquals(Lattice.BOS, lattice.endNodes(0).get(0));
        Assertions.assertEquals(NodeKind.BOS, lattice.kind(Lattice.BOS));
        Assertions.assertEquals(1, lattice.beginNodes(2).size());
        Assertions.assertEquals(Lattice.EOS, lattice.beginNodes(2).get(0));
        Assertions.assertEquals(NodeKind.EOS, lattice.kind(Lattice.EOS));
        Assertions.assertEquals(0, lattice.leftId(Lattice.EOS));
        Assertions.assertEquals(0, lattice.rightId(Lattice.BOS));
    }

    @Test
    void everyNodeIsListedAtItsBeginAndEnd() {
        Lattice lattice = build(toy, "ab", 0);

        Assertions.assertEquals(5, lattice.nodeCount());
        for (int node = 2; node < lattice.nodeCount(); node++) {
            Assertions.assertTrue(contains(lattice.beginNodes(lattice.begin(node)), node));
            Assertions.assertTrue(contains(lattice.endNodes(lattice.end(node)), node));
            Assertions.assertEquals(NodeKind.NORMAL, lattice.kind(node));
        }
        Assertions.assertEquals(List.of("a", "ab"),
                List.of(lattice.surface(lattice.beginNodes(0).get(0)), lattice.surface(lattice.beginNodes(0).get(1))));
    }

    @Test
    void unknownCharacterFallsBackToSingleCandidate() {
        Lattice lattice = build(toy, "z", 0);

        IntList nodes = lattice.beginNodes(0);
        Assertions.assertEquals(1, nodes.size());
        int node = nodes.get(0);
        Assertions.assertEquals(NodeKind.UNKNOWN, lattice.kind(node));
        Assertions.assertEquals("UNK", lattice.feature(node));
        Assertions.assertEquals(1000, lattice.cost(node));
    }

    @Test
    void greedyThresholdAddsUnknownsNextToShortMatches() {
        Lattice plain = build(toy, "ab", 0);
        Lattice greedy = build(toy, "ab", 3);

        Assertions.assertEquals(2, plain.beginNodes(0).size());
        IntList atZero = greedy.beginNodes(0);
        Assertions.assertEquals(3, atZero.size());
        int grouped = atZero.get(2);
        Assertions.assertEquals(NodeKind.UNKNOWN, greedy.kind(grouped));
        Assertions.assertEquals(2, greedy.nodeLength(grouped));
        Assertions.assertEquals(2, greedy.beginNodes(1).size());
    }

    @Test
    void unknownSharingAFeatureWithALexiconEntryIsKept() {
        SystemDictionary dictionary = SystemDictionary.builder(2, 0)
                .entry("q", 1, 1, 500, "N")
                .category("DEFAULT", true, true, 1)
                .unknown("DEFAULT", 1, 1, 1, "N")
                .build();

        Lattice lattice = build(dictionary, "q", 0);

        IntList nodes = lattice.beginNodes(0);
        Assertions.assertEquals(2, nodes.size());
        Assertions.assertEquals(lattice.featureRef(nodes.get(0)), lattice.featureRef(nodes.get(1)));
        Assertions.assertNotEquals(lattice.morphemeRef(nodes.get(0)), lattice.morphemeRef(nodes.get(1)));
        Assertions.assertEquals(NodeKind.UNKNOWN, lattice.kind(nodes.get(1)));
        Assertions.assertEquals(1, lattice.cost(nodes.get(1)));
    }

    @Test
    void noPositionHoldsTheSameMorphemeTwice() {
        SystemDictionary dictionary = SystemDictionary.builder(3, 0)
                .entry("p", 1, 1, 5, "N")
                .entry("p", 2, 2, 7, "N")
                .entry("q", 1, 1, 5, "same")
                .category("DEFAULT", true, true, 1)
                .unknown("DEFAULT", 1, 1, 500, "same")
                .unknown("DEFAULT", 1, 1, 700, "other")
                .build();

        Lattice lattice = build(dictionary, "qqp", 0);

        Set<String> triples = new HashSet<>();
        for (int position = 0; position < lattice.length(); position++) {
            IntList nodes = lattice.beginNodes(position);
            for (int i = 0; i < nodes.size(); i++) {
                int node = nodes.get(i);
                Assertions.assertTrue(triples.add(lattice.begin(node) + ":" + lattice.nodeLength(node) + ":"
                        + lattice.morphemeRef(node)));
            }
        }
        // lexicon q, then the grouped run and the single "q" once per template
        Assertions.assertEquals(5, lattice.beginNodes(0).size());
        // both homographs of p plus one unknown per template
        Assertions.assertEquals(4, lattice.beginNodes(2).size());
    }

    @Test
    void emptyFallbackOnUncoveredPositionDisconnectsTheLattice() {
        CharCategory category = new CharCategory(0, CharCategory.DEFAULT, false, false, 0);
        UnknownWordFallback silent = new UnknownWordFallback() {
            @Override
            public List<DictionaryEntry> synthesize(CharSequence text, int position, CharCategory c) {
                return List.of();
            }

            @Override
            public CharCategory categoryAt(CharSequence text, int position) {
                return category;
            }
        };
        LatticeBuilder builder = new LatticeBuilder(toy, silent, 0);

        DisconnectedLatticeException e = Assertions.assertThrows(DisconnectedLatticeException.class,
                () -> builder.build(new Lattice(), "az"));
        Assertions.assertEquals(1, e.position());
    }

    @Test
    void rebuildingResetsThePreviousContent() {
        LatticeBuilder builder = new LatticeBuilder(toy, toy.unknownWordFallback(24), 0);
        Lattice lattice = new Lattice();
        builder.build(lattice, "ab".repeat(40));
        int generation = lattice.generation();
        int capacity = lattice.arenaCapacity();

        builder.build(lattice, "b");

        Assertions.assertEquals(generation + 1, lattice.generation());
        Assertions.assertEquals(1, lattice.length());
        Assertions.assertEquals(3, lattice.nodeCount());
        Assertions.assertEquals("b", lattice.text().toString());
        Assertions.assertEquals(capacity, lattice.arenaCapacity());
        Assertions.assertArrayEquals(new int[] {Lattice.EOS}, lattice.beginNodes(1).toArray());
    }

    private static boolean contains(IntList list, int value) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == value) {
                return true;
            }
        }
        return false;
    }
}
