package com.example.morphan.lattice;

import com.example.morphan.DisconnectedLatticeException;
import com.example.morphan.dictionary.DictionaryEntry;
import com.example.morphan.dictionary.DictionaryService;
import com.example.morphan.unknown.CharCategory;
import com.example.morphan.unknown.UnknownWordFallback;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Populates a {@link Lattice} by scanning the input left to right. At every position some node ends
 * at, the lexicon is queried for all prefixes of the remaining text. The unknown-word fallback is
 * consulted when the lexicon has nothing, when the character category asks to always be invoked,
 * or when the longest lexicon match is shorter than the greedy threshold.
 *
 * <p>Unknown candidates that repeat the span and morpheme handle of a node already placed at the
 * same position are dropped, so no position holds two nodes with the same
 * {@code (begin, length, morphemeRef)}. Nodes sharing only a feature string are all kept.</p>
 */
public final class LatticeBuilder {

    private static final Logger log = Logger.getLogger(LatticeBuilder.class.getName());

    private final DictionaryService dictionary;
    private final UnknownWordFallback fallback;
    private final int greedyThreshold;

    /**
     * @param greedyThreshold the fallback also runs when the longest lexicon match is shorter than
     *                        this many code units; {@code 0} disables the rule
     */
    public LatticeBuilder(DictionaryService dictionary, UnknownWordFallback fallback, int greedyThreshold) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        if (greedyThreshold < 0) {
            throw new IllegalArgumentException("greedyThreshold must not be negative: " + greedyThreshold);
        }
        this.greedyThreshold = greedyThreshold;
    }

    /**
     * Resets {@code lattice} for {@code text} and fills it with candidates.
     *
     * @throws DisconnectedLatticeException when a reachable position ends up without candidates
     */
    public void build(Lattice lattice, CharSequence text) {
        lattice.reset(text, dictionary);
        int length = text.length();
        int unknownNodes = 0;
        for (int position = 0; position < length; position++) {
            if (lattice.endNodes(position).isEmpty()) {
                continue;
            }
            List<DictionaryEntry> matches = dictionary.lookup(text, position);
            int longest = 0;
            for (DictionaryEntry entry : matches) {
                lattice.addNode(position, entry, NodeKind.NORMAL);
                longest = Math.max(longest, entry.length());
            }

            CharCategory category = fallback.categoryAt(text, position);
            if (matches.isEmpty() || category.invoke() || longest < greedyThreshold) {
                for (DictionaryEntry candidate : fallback.synthesize(text, position, category)) {
                    if (position + candidate.length() > length || candidate.length() == 0) {
                        continue;
                    }
                    if (!isDuplicate(lattice, position, candidate)) {
                        lattice.addNode(position, candidate, NodeKind.UNKNOWN);
                        unknownNodes++;
                    }
                }
            }

            if (lattice.beginNodes(position).isEmpty()) {
                throw new DisconnectedLatticeException("No candidate morpheme at a reachable position", position);
            }
        }
        if (lattice.endNodes(length).isEmpty()) {
            throw new DisconnectedLatticeException("No candidate morpheme reaches the end of the input", length);
        }
        if (log.isLoggable(Level.FINE)) {
            int total = lattice.nodeCount() - 2;
            int unknown = unknownNodes;
            log.log(Level.FINE, () -> "Built lattice over " + length + " chars: " + total + " nodes, "
                    + unknown + " unknown");
        }
    }

    private static boolean isDuplicate(Lattice lattice, int position, DictionaryEntry candidate) {
        IntList placed = lattice.beginNodes(position);
        for (int i = 0; i < placed.size(); i++) {
            int node = placed.get(i);
            if (lattice.nodeLength(node) == candidate.length() && lattice.morphemeRef(node) == candidate.morphemeRef()) {
                return true;
            }
        }
        return false;
    }
}
