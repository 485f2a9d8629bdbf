package com.example.morphan;

import com.example.morphan.dictionary.SqliteDictionaryStore;
import com.example.morphan.lattice.LatticeMorpheme;
import com.example.morphan.lattice.Morpheme;
import com.example.morphan.lattice.Segmentation;
import com.example.morphan.tagger.MorphologicalTagger;
import com.sun.net.httpserver.HttpServer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command line entry point. Reads text from STDIN one line at a time and prints the best
 * segmentation of each line as {@code surface<TAB>feature} rows closed by {@code EOS}.
 *
 * <pre>
 *   --nbest N              print the N best segmentations of every line
 *   --all-morphs           print every candidate with the cost of the best path through it
 *   --serve [port]         start the HTTP facade instead of reading STDIN
 *   --export-sqlite FILE   write the configured dictionary to a SQLite database and exit
 * </pre>
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length > 0 && "--export-sqlite".equals(args[0])) {
            Path database = args.length > 1
                    ? Paths.get(args[1])
                    : Paths.get("data", "dictionary.db");
            try (MorphologyService service = new MorphologyService()) {
                int count = new SqliteDictionaryStore().write(database, service.tagger().dictionary());
                System.out.printf("Exported %d dictionary entries into %s%n", count, database.toAbsolutePath());
            }
            return;
        }

        if (args.length > 0 && "--serve".equals(args[0])) {
            MorphologyService service = new MorphologyService();
            int port = args.length > 1 ? Integer.parseInt(args[1]) : 8080;
            WebMorphologyApplication application = new WebMorphologyApplication(service);
            HttpServer server = application.start(port);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(0);
                service.close();
            }));
            System.out.printf("Server started on port %d%n", server.getAddress().getPort());
            System.out.flush();
            return;
        }

        int nBest = 0;
        boolean allMorphs = false;
        for (int i = 0; i < args.length; i++) {
            if ("--nbest".equals(args[i]) && i + 1 < args.length) {
                nBest = Integer.parseInt(args[++i]);
            } else if ("--all-morphs".equals(args[i])) {
                allMorphs = true;
            } else {
                System.err.println("Unknown option: " + args[i]);
                System.err.println("Usage: [--nbest N | --all-morphs] < text, --serve [port], --export-sqlite FILE");
                return;
            }
        }

        try (MorphologyService service = new MorphologyService()) {
            List<String> lines = readLines(System.in);
            if (lines.isEmpty()) {
                System.err.println("Provide text via STDIN or run with --serve [port].");
                return;
            }
            PrintStream out = System.out;
            MorphologicalTagger tagger = service.tagger();
            for (String line : lines) {
                if (line.isEmpty()) {
                    continue;
                }
                if (allMorphs) {
                    printAllMorphs(out, tagger.parseAllMorphs(line));
                } else if (nBest > 0) {
                    for (Segmentation segmentation : tagger.parseNBest(line, Math.min(nBest, service.nBestLimit()))) {
                        printSegmentation(out, segmentation);
                    }
                } else {
                    out.print(service.markup(line));
                }
            }
            out.flush();
        } catch (MorphologyException ex) {
            System.err.println("Morphology analysis failed: " + ex.getMessage());
            if (ex.getCause() != null) {
                ex.getCause().printStackTrace(System.err);
            }
            System.exit(1);
        }
    }

    private static void printSegmentation(PrintStream out, Segmentation segmentation) {
        for (Morpheme morpheme : segmentation.morphemes()) {
            out.print(morpheme.surface() + "\t" + morpheme.feature() + "\n");
        }
        out.print("EOS\n");
    }

    private static void printAllMorphs(PrintStream out, List<LatticeMorpheme> candidates) {
        for (LatticeMorpheme candidate : candidates) {
            Morpheme morpheme = candidate.morpheme();
            out.print(morpheme.begin() + "\t" + morpheme.surface() + "\t" + morpheme.feature() + "\t"
                    + candidate.bestCostThrough() + (candidate.onBestPath() ? "\t*" : "") + "\n");
        }
        out.print("EOS\n");
    }

    private static List<String> readLines(InputStream stream) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.toList());
        }
    }
}
