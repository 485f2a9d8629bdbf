package com.example.morphan;

import com.example.morphan.lattice.LatticeMorpheme;
import com.example.morphan.lattice.Morpheme;
import com.example.morphan.lattice.Segmentation;
import com.example.morphan.tagger.MorphologicalTagger;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.Closeable;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * JSON view of the tagger used by the command line and the HTTP facade. Best-path analyses are
 * cached per input text.
 */
public class MorphologyService implements Closeable {

    private static final String VERSION = "1.0.0";
    private static final int FORMAT = 1;

    private final MorphologicalTagger tagger;
    private final int nBestLimit;
    private final ConcurrentMap<String, JsonObject> textCache = new ConcurrentHashMap<>();

    public MorphologyService() {
        this(AnalyzerSettings.fromEnvironment());
    }

    public MorphologyService(AnalyzerSettings settings) {
        this(MorphologicalTagger.load(settings), settings.nBestLimit());
    }

    MorphologyService(MorphologicalTagger tagger, int nBestLimit) {
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.nBestLimit = nBestLimit;
    }

    public String getVersion() {
        return VERSION;
    }

    public int nBestLimit() {
        return nBestLimit;
    }

    public JsonObject analyzeText(String text) {
        String key = text == null ? "" : text;
        return textCache.computeIfAbsent(key, this::computeTextAnalysis).deepCopy();
    }

    /**
     * @param n requested number of segmentations, capped by the configured limit
     */
    public JsonObject analyzeNBest(String text, int n) {
        String input = text == null ? "" : text;
        if (n <= 0) {
            throw new InvalidInputException("Number of segmentations must be positive: " + n);
        }
        List<Segmentation> results = tagger.parseNBest(input, Math.min(n, nBestLimit));
        JsonObject payload = header(input);
        JsonArray array = new JsonArray();
        int rank = 1;
        for (Segmentation segmentation : results) {
            JsonObject result = new JsonObject();
            result.addProperty("rank", rank++);
            result.addProperty("cost", segmentation.cost());
            result.add("morphemes", morphemes(segmentation.morphemes()));
            array.add(result);
        }
        payload.add("results", array);
        return payload;
    }

    public JsonObject analyzeAllMorphs(String text) {
        String input = text == null ? "" : text;
        List<LatticeMorpheme> candidates = tagger.parseAllMorphs(input);
        JsonObject payload = header(input);
        JsonArray array = new JsonArray();
        for (LatticeMorpheme candidate : candidates) {
            JsonObject node = morpheme(candidate.morpheme());
            node.addProperty("best_cost_through", candidate.bestCostThrough());
            node.addProperty("best", candidate.onBestPath());
            array.add(node);
        }
        payload.add("morphemes", array);
        return payload;
    }

    /**
     * Best segmentation as {@code surface<TAB>feature} lines followed by {@code EOS}.
     */
    public String markup(String text) {
        Segmentation segmentation = tagger.parse(text == null ? "" : text);
        StringBuilder builder = new StringBuilder();
        for (Morpheme morpheme : segmentation.morphemes()) {
            builder.append(morpheme.surface()).append('\t').append(morpheme.feature()).append('\n');
        }
        builder.append("EOS\n");
        return builder.toString();
    }

    public MorphologicalTagger tagger() {
        return tagger;
    }

    private JsonObject computeTextAnalysis(String text) {
        Segmentation segmentation = tagger.parse(text);
        JsonObject payload = header(text);
        payload.addProperty("cost", segmentation.cost());
        payload.add("morphemes", morphemes(segmentation.morphemes()));
        return payload;
    }

    private JsonObject header(String text) {
        JsonObject payload = new JsonObject();
        payload.addProperty("text", text);
        payload.addProperty("morphan_version", VERSION);
        payload.addProperty("format", FORMAT);
        return payload;
    }

    private static JsonArray morphemes(List<Morpheme> morphemes) {
        JsonArray array = new JsonArray();
        for (Morpheme morpheme : morphemes) {
            array.add(morpheme(morpheme));
        }
        return array;
    }

    private static JsonObject morpheme(Morpheme morpheme) {
        JsonObject node = new JsonObject();
        node.addProperty("surface", morpheme.surface());
        node.addProperty("feature", morpheme.feature());
        node.addProperty("begin", morpheme.begin());
        node.addProperty("length", morpheme.length());
        node.addProperty("kind", morpheme.kind().name().toLowerCase(Locale.ROOT));
        node.addProperty("cost", morpheme.cost());
        return node;
    }

    @Override
    public void close() {
        tagger.close();
        textCache.clear();
    }
}
