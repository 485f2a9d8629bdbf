package com.example.morphan.lattice;

import com.example.morphan.InvalidInputException;
import com.example.morphan.dictionary.ConnectionCosts;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds and decodes a lattice for one input. This is the entry point of the core: the builder and
 * decoder it wraps are immutable, so one analyzer serves any number of threads as long as each
 * passes its own {@link AnalysisContext}.
 */
public final class LatticeAnalyzer {

    private final LatticeBuilder builder;
    private final ViterbiDecoder decoder;
    private final ConnectionCosts connections;

    public LatticeAnalyzer(LatticeBuilder builder, ConnectionCosts connections) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.decoder = new ViterbiDecoder(connections);
    }

    /**
     * Analyses the first {@code length} code units of {@code text} into the lattice of
     * {@code context}.
     *
     * @throws InvalidInputException when {@code length} is not positive or exceeds the text
     */
    public Lattice analyze(CharSequence text, int length, AnalysisOptions options, AnalysisContext context) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(context, "context");
        if (length <= 0) {
            throw new InvalidInputException("Text to analyse must contain at least one character");
        }
        if (length > text.length()) {
            throw new InvalidInputException("Length " + length + " exceeds the text length " + text.length());
        }
        CharSequence input = length == text.length() ? text : text.subSequence(0, length);
        Lattice lattice = context.begin();
        builder.build(lattice, input);
        decoder.decode(lattice, options.needsBackwardPass());
        return lattice;
    }

    public Lattice analyze(CharSequence text, AnalysisOptions options, AnalysisContext context) {
        Objects.requireNonNull(text, "text");
        return analyze(text, text.length(), options, context);
    }

    public Segmentation bestSegmentation(Lattice lattice) {
        return decoder.bestSegmentation(lattice);
    }

    public NBestEnumerator nBest(Lattice lattice) {
        return new NBestEnumerator(lattice, connections);
    }

    /**
     * Every candidate of the lattice in begin-position order, then insertion order, annotated with
     * the cost of the best path through it.
     */
    public List<LatticeMorpheme> allMorphs(Lattice lattice) {
        int[] bestPath = decoder.bestPath(lattice);
        boolean[] onBest = new boolean[lattice.nodeCount()];
        for (int node : bestPath) {
            onBest[node] = true;
        }
        List<LatticeMorpheme> result = new ArrayList<>(lattice.nodeCount() - 2);
        for (int position = 0; position < lattice.length(); position++) {
            IntList nodes = lattice.beginNodes(position);
            for (int i = 0; i < nodes.size(); i++) {
                int node = nodes.get(i);
                result.add(new LatticeMorpheme(lattice.morpheme(node), decoder.bestCostThrough(lattice, node),
                        onBest[node]));
            }
        }
        return result;
    }

    public ViterbiDecoder decoder() {
        return decoder;
    }
}
