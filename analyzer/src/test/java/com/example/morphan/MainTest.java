package com.example.morphan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.morphan.dictionary.SqliteDictionaryStore;
import com.example.morphan.dictionary.SystemDictionary;

class MainTest {

    @Test
    void mainPrintsMarkupForEveryLine() throws Exception {
        String output = run("私は学生です\n\nテスト\n");

        assertEquals("私\t名詞,代名詞,一般,*,*,*,私,ワタシ,ワタシ\n"
                + "は\t助詞,係助詞,*,*,*,*,は,ハ,ワ\n"
                + "学生\t名詞,一般,*,*,*,*,学生,ガクセイ,ガクセイ\n"
                + "です\t助動詞,*,*,*,特殊・デス,基本形,です,デス,デス\n"
                + "EOS\n"
                + "テスト\t名詞,一般,*,*,*,*,*\n"
                + "EOS\n", output);
    }

    @Test
    void nBestOptionPrintsOneBlockPerSegmentation() throws Exception {
        String output = run("テスト\n", "--nbest", "2");

        assertEquals("テスト\t名詞,一般,*,*,*,*,*\n"
                + "EOS\n"
                + "テ\t名詞,一般,*,*,*,*,*\n"
                + "スト\t名詞,一般,*,*,*,*,*\n"
                + "EOS\n", output);
    }

    @Test
    void allMorphsOptionMarksTheBestPath() throws Exception {
        String output = run("私は\n", "--all-morphs");

        assertEquals("0\t私\t名詞,代名詞,一般,*,*,*,私,ワタシ,ワタシ\t2450\t*\n"
                + "1\tは\t助詞,係助詞,*,*,*,*,は,ハ,ワ\t2450\t*\n"
                + "EOS\n", output);
    }

    @Test
    void exportWritesALoadableDatabase(@TempDir Path directory) throws Exception {
        Path database = directory.resolve("export.db");

        String output = run("", "--export-sqlite", database.toString());

        assertTrue(output.startsWith("Exported 23 dictionary entries"));
        SystemDictionary dictionary = new SqliteDictionaryStore().read(database);
        assertEquals(23, dictionary.lexicon().size());
    }

    private static String run(String input, String... args) throws Exception {
        PrintStream originalOut = System.out;
        InputStream originalIn = System.in;
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        try (ByteArrayInputStream stdin = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
             PrintStream replacement = new PrintStream(capture, true, StandardCharsets.UTF_8.name())) {
            System.setIn(stdin);
            System.setOut(replacement);
            Main.main(args);
        } finally {
            System.setOut(originalOut);
            System.setIn(originalIn);
        }
        return capture.toString(StandardCharsets.UTF_8.name());
    }
}
