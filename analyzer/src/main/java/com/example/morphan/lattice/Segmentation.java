package com.example.morphan.lattice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One complete path through a lattice: its morphemes in text order, without the sentinels, and the
 * total cost of the path (emission plus connection costs, BOS and EOS edges included).
 */
public record Segmentation(List<Morpheme> morphemes, long cost) {

    public Segmentation {
        morphemes = List.copyOf(morphemes);
    }

    public List<String> surfaces() {
        return morphemes.stream().map(Morpheme::surface).collect(Collectors.toList());
    }

    public int size() {
        return morphemes.size();
    }
}
