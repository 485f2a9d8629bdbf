package com.example.morphan.lattice;

import com.example.morphan.dictionary.ConnectionCosts;
import com.example.morphan.dictionary.DictionaryEntry;
import com.example.morphan.dictionary.DictionaryService;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Graph of candidate morphemes over one input. For every boundary position {@code 0..N} the lattice
 * keeps the nodes beginning there and the nodes ending there; an edge joins every node ending at
 * {@code p} with every node beginning at {@code p}, so the graph is acyclic and one sweep in either
 * direction visits predecessors before successors.
 *
 * <p>Node {@value #BOS} is the sentence start (an end-list entry at position 0) and node
 * {@value #EOS} the sentence end (a begin-list entry at position N). A lattice is reset and reused
 * by its {@link AnalysisContext}; node ids and anything read from it are only meaningful until then.
 * Not thread-safe.</p>
 */
public final class Lattice {

    public static final int BOS = 0;
    public static final int EOS = 1;
    public static final String BOUNDARY_FEATURE = "BOS/EOS,*,*,*,*,*,*,*,*";

    private final NodeArena arena;
    private IntList[] beginLists = new IntList[0];
    private IntList[] endLists = new IntList[0];
    private CharSequence text = "";
    private DictionaryService dictionary;
    private int length;
    private int generation;
    private boolean forwardDone;
    private boolean backwardDone;

    Lattice() {
        this.arena = new NodeArena(64);
    }

    /**
     * Clears the lattice for a new input and places the BOS and EOS sentinels.
     */
    void reset(CharSequence input, DictionaryService features) {
        this.text = Objects.requireNonNull(input, "input");
        this.dictionary = Objects.requireNonNull(features, "features");
        this.length = input.length();
        this.generation++;
        this.forwardDone = false;
        this.backwardDone = false;
        arena.clear();
        ensureBoundaries(length + 1);
        for (int i = 0; i <= length; i++) {
            beginLists[i].clear();
            endLists[i].clear();
        }
        int bos = arena.add(0, 0, ConnectionCosts.BOUNDARY_CONTEXT_ID, ConnectionCosts.BOUNDARY_CONTEXT_ID, 0,
                NodeArena.NO_NODE, NodeArena.NO_NODE, NodeKind.BOS);
        endLists[0].add(bos);
        int eos = arena.add(length, 0, ConnectionCosts.BOUNDARY_CONTEXT_ID, ConnectionCosts.BOUNDARY_CONTEXT_ID, 0,
                NodeArena.NO_NODE, NodeArena.NO_NODE, NodeKind.EOS);
        beginLists[length].add(eos);
    }

    /**
     * Inserts a candidate spanning {@code [begin, begin + entry.length())} into both adjacency views.
     */
    int addNode(int begin, DictionaryEntry entry, NodeKind kind) {
        if (kind == NodeKind.BOS || kind == NodeKind.EOS) {
            throw new IllegalArgumentException("Sentinels are placed by reset, not added: " + kind);
        }
        int end = begin + entry.length();
        if (begin < 0 || entry.length() == 0 || end > length) {
            throw new IllegalArgumentException("Span [" + begin + ", " + end + ") outside input of length " + length);
        }
        int id = arena.add(begin, entry.length(), entry.leftId(), entry.rightId(), entry.cost(),
                entry.featureRef(), entry.morphemeRef(), kind);
        beginLists[begin].add(id);
        endLists[end].add(id);
        return id;
    }

    public CharSequence text() {
        return text;
    }

    /**
     * @return input length N in UTF-16 code units
     */
    public int length() {
        return length;
    }

    public int nodeCount() {
        return arena.size();
    }

    /**
     * Increments on every reset. Lazy consumers use it to detect a lattice that was reused under them.
     */
    public int generation() {
        return generation;
    }

    public IntList beginNodes(int position) {
        checkPosition(position);
        return beginLists[position];
    }

    public IntList endNodes(int position) {
        checkPosition(position);
        return endLists[position];
    }

    public int begin(int node) {
        return arena.begin(node);
    }

    public int nodeLength(int node) {
        return arena.length(node);
    }

    public int end(int node) {
        return arena.begin(node) + arena.length(node);
    }

    public int leftId(int node) {
        return arena.leftId(node);
    }

    public int rightId(int node) {
        return arena.rightId(node);
    }

    public int cost(int node) {
        return arena.cost(node);
    }

    public int featureRef(int node) {
        return arena.featureRef(node);
    }

    /**
     * @return handle of the lexicon row or unknown-word template behind the node, {@code -1} for
     *         BOS and EOS
     */
    public int morphemeRef(int node) {
        return arena.morphemeRef(node);
    }

    public NodeKind kind(int node) {
        return arena.kind(node);
    }

    /**
     * @return minimum cost from BOS to this node inclusive, or {@link Long#MAX_VALUE} before decoding
     */
    public long forwardCost(int node) {
        return arena.forwardCost(node);
    }

    /**
     * @return minimum cost from this node (inclusive of its own emission cost) to EOS, or
     *         {@link Long#MAX_VALUE} when the backward pass has not run
     */
    public long backwardCost(int node) {
        return arena.backwardCost(node);
    }

    /**
     * @return node realising {@link #forwardCost(int)}, {@code -1} for BOS or before decoding
     */
    public int bestPredecessor(int node) {
        return arena.bestPredecessor(node);
    }

    public boolean isForwardDone() {
        return forwardDone;
    }

    public boolean isBackwardDone() {
        return backwardDone;
    }

    public String surface(int node) {
        int begin = arena.begin(node);
        return text.subSequence(begin, begin + arena.length(node)).toString();
    }

    public String feature(int node) {
        NodeKind kind = arena.kind(node);
        if (kind == NodeKind.BOS || kind == NodeKind.EOS) {
            return BOUNDARY_FEATURE;
        }
        return dictionary.feature(arena.featureRef(node));
    }

    /**
     * Copies a node out of the lattice.
     */
    public Morpheme morpheme(int node) {
        return new Morpheme(surface(node), feature(node), arena.begin(node), arena.length(node), arena.kind(node),
                arena.morphemeRef(node), arena.leftId(node), arena.rightId(node), arena.cost(node),
                arena.forwardCost(node));
    }

    /**
     * Materialises a path given as node ids. Sentinels are skipped.
     */
    public Segmentation segmentation(int[] path, long cost) {
        List<Morpheme> morphemes = new ArrayList<>(path.length);
        for (int node : path) {
            NodeKind kind = arena.kind(node);
            if (kind != NodeKind.BOS && kind != NodeKind.EOS) {
                morphemes.add(morpheme(node));
            }
        }
        return new Segmentation(morphemes, cost);
    }

    void markForwardDone() {
        forwardDone = true;
    }

    void markBackwardDone() {
        backwardDone = true;
    }

    void resetCosts() {
        arena.resetCosts();
        forwardDone = false;
        backwardDone = false;
    }

    void setForward(int node, long cost, int predecessor) {
        arena.setForward(node, cost, predecessor);
    }

    void setBackward(int node, long cost) {
        arena.setBackward(node, cost);
    }

    int arenaCapacity() {
        return arena.capacity();
    }

    private void ensureBoundaries(int required) {
        if (beginLists.length >= required) {
            return;
        }
        int capacity = Math.max(required, beginLists.length * 2);
        int old = beginLists.length;
        beginLists = Arrays.copyOf(beginLists, capacity);
        endLists = Arrays.copyOf(endLists, capacity);
        for (int i = old; i < capacity; i++) {
            beginLists[i] = new IntList();
            endLists[i] = new IntList();
        }
    }

    private void checkPosition(int position) {
        if (position < 0 || position > length) {
            throw new IndexOutOfBoundsException("Position " + position + " outside [0, " + length + "]");
        }
    }
}
