package com.example.morphan.tagger;

import com.example.morphan.AnalyzerSettings;
import com.example.morphan.InvalidInputException;
import com.example.morphan.dictionary.Dictionaries;
import com.example.morphan.dictionary.SystemDictionary;
import com.example.morphan.lattice.AnalysisContext;
import com.example.morphan.lattice.AnalysisOptions;
import com.example.morphan.lattice.Lattice;
import com.example.morphan.lattice.LatticeAnalyzer;
import com.example.morphan.lattice.LatticeBuilder;
import com.example.morphan.lattice.LatticeMorpheme;
import com.example.morphan.lattice.NBestEnumerator;
import com.example.morphan.lattice.Segmentation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Public entry point of the analyser.
 *
 * <p>The dictionary is shared and immutable. Methods that do not take an {@link AnalysisContext}
 * allocate a fresh one per call, so a single tagger can serve several threads. Callers that analyse
 * many short texts on one thread can keep a context and pass it to
 * {@link #parseToLattice(String, AnalysisOptions, AnalysisContext)}.</p>
 */
public final class MorphologicalTagger implements AutoCloseable {

    private final SystemDictionary dictionary;
    private final LatticeAnalyzer analyzer;
    private volatile boolean closed;

    private MorphologicalTagger(SystemDictionary dictionary, AnalyzerSettings settings) {
        this.dictionary = dictionary;
        LatticeBuilder builder = new LatticeBuilder(dictionary,
                dictionary.unknownWordFallback(settings.maxGroupingSize()),
                settings.greedyThreshold());
        this.analyzer = new LatticeAnalyzer(builder, dictionary.connections());
    }

    public static MorphologicalTagger create(SystemDictionary dictionary) {
        return create(dictionary, AnalyzerSettings.defaults());
    }

    public static MorphologicalTagger create(SystemDictionary dictionary, AnalyzerSettings settings) {
        Objects.requireNonNull(dictionary, "dictionary");
        Objects.requireNonNull(settings, "settings");
        return new MorphologicalTagger(dictionary, settings);
    }

    /**
     * Loads the dictionary named by {@code settings} (and its user dictionaries) and creates a tagger.
     */
    public static MorphologicalTagger load(AnalyzerSettings settings) {
        return create(Dictionaries.load(settings), settings);
    }

    /**
     * @return the best segmentation of {@code text}
     * @throws InvalidInputException when {@code text} is empty
     */
    public Segmentation parse(String text) {
        Lattice lattice = parseToLattice(text, AnalysisOptions.BEST, newContext(text));
        return analyzer.bestSegmentation(lattice);
    }

    /**
     * Segmentations of {@code text}, best first, computed as they are requested.
     */
    public Iterator<Segmentation> parseNBest(String text) {
        Lattice lattice = parseToLattice(text, AnalysisOptions.N_BEST, newContext(text));
        return analyzer.nBest(lattice);
    }

    /**
     * @return at most {@code n} segmentations of {@code text}, best first
     */
    public List<Segmentation> parseNBest(String text, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive: " + n);
        }
        Iterator<Segmentation> results = parseNBest(text);
        List<Segmentation> list = new ArrayList<>(Math.min(n, 16));
        while (list.size() < n && results.hasNext()) {
            list.add(results.next());
        }
        return list;
    }

    /**
     * @return every candidate morpheme of {@code text}, each with the cost of the best path through it
     */
    public List<LatticeMorpheme> parseAllMorphs(String text) {
        Lattice lattice = parseToLattice(text, AnalysisOptions.ALL_MORPHS, newContext(text));
        return analyzer.allMorphs(lattice);
    }

    /**
     * Analyses {@code text} into the lattice of {@code context}. The lattice stays valid until the
     * context is used again.
     */
    public Lattice parseToLattice(String text, AnalysisOptions options, AnalysisContext context) {
        ensureOpen();
        Objects.requireNonNull(text, "text");
        return analyzer.analyze(text, options, context);
    }

    /**
     * Enumerates segmentations of a lattice produced with {@link AnalysisOptions#nBest()}.
     */
    public NBestEnumerator nBest(Lattice lattice) {
        ensureOpen();
        return analyzer.nBest(lattice);
    }

    public SystemDictionary dictionary() {
        return dictionary;
    }

    @Override
    public void close() {
        closed = true;
    }

    private AnalysisContext newContext(String text) {
        ensureOpen();
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new InvalidInputException("Text to analyse must contain at least one character");
        }
        return new AnalysisContext();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Tagger has been closed");
        }
    }
}
