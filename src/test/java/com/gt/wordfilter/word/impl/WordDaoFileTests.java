package com.gt.wordfilter.word.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WordDaoFileTests {

    @TempDir
    Path tempDir;

    private Path wordsFile;
    private WordDaoFile wordDaoFile;

    @BeforeEach
    public void setup() {
        wordsFile = tempDir.resolve("data").resolve("words.txt");
        wordDaoFile = new WordDaoFile(wordsFile);
    }

    @Test
    public void testLoadAllWords_MissingFile() {
        assertEquals(List.of(), wordDaoFile.loadAllWords());
    }

    @Test
    public void testAddAndRemoveWords() throws Exception {
        wordDaoFile.addWords(List.of("dog", "cat"));
        wordDaoFile.addWords(List.of("owl", "cat"));

        assertEquals("cat\ndog\nowl", Files.readString(wordsFile, StandardCharsets.UTF_8));

        wordDaoFile.removeWords(List.of("dog", "yak"));

        assertEquals(List.of("cat", "owl"), wordDaoFile.loadAllWords());
    }

    @Test
    public void testAddWords_KeepsWordsWrittenByOthers() throws Exception {
        Files.createDirectories(wordsFile.getParent());
        Files.writeString(wordsFile, "emu\nant\n", StandardCharsets.UTF_8);

        wordDaoFile.addWords(List.of("bee"));

        assertEquals(List.of("ant", "bee", "emu"), wordDaoFile.loadAllWords());
    }

    @Test
    public void testDescribe() {
        assertTrue(wordDaoFile.describe().startsWith("file:"));
        assertTrue(wordDaoFile.describe().endsWith("words.txt"));
    }
}
