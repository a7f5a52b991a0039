package com.gt.wordfilter.word.impl;

import com.gt.wordfilter.exception.PersistenceException;
import com.gt.wordfilter.exception.StorageUnavailableException;
import com.gt.wordfilter.word.WordDao;
import com.gt.wordfilter.word.WordListFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.function.Consumer;

// Local newline-delimited file, for development and single-instance deployments
public class WordDaoFile implements WordDao {

    private static final Logger log = LoggerFactory.getLogger(WordDaoFile.class);

    private final Path wordsFile;

    public WordDaoFile(Path wordsFile) {
        this.wordsFile = wordsFile;
    }

    @Override
    public List<String> loadAllWords() {
        if (Files.notExists(wordsFile)) {
            log.warn("Words file {} not found. Treating it as empty.", wordsFile);
            return List.of();
        }

        try {
            return WordListFormat.parse(Files.readString(wordsFile, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            String errMsg = "Error reading words file " + wordsFile;

            log.error(errMsg, ex);
            throw new StorageUnavailableException(errMsg, ex);
        }
    }

    @Override
    public void addWords(Collection<String> words) {
        mergeAndSave(storedWords -> storedWords.addAll(words));
    }

    @Override
    public void removeWords(Collection<String> words) {
        mergeAndSave(storedWords -> storedWords.removeAll(new HashSet<>(words)));
    }

    @Override
    public String describe() {
        return "file:" + wordsFile;
    }

    private void mergeAndSave(Consumer<Set<String>> mutation) {
        Set<String> storedWords;
        try {
            storedWords = new TreeSet<>(loadAllWords());
        } catch (StorageUnavailableException ex) {
            throw new PersistenceException("Unable to read current words before writing to " + describe(), ex);
        }

        mutation.accept(storedWords);

        try {
            Path parent = wordsFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);

            Path tempFile = Files.createTempFile(parent, "words", ".tmp");
            Files.writeString(tempFile, WordListFormat.format(storedWords), StandardCharsets.UTF_8);
            Files.move(tempFile, wordsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            log.info("Saved {} words to {}", storedWords.size(), wordsFile);
        } catch (IOException ex) {
            String errMsg = "Error writing words file " + wordsFile;

            log.error(errMsg, ex);
            throw new PersistenceException(errMsg, ex);
        }
    }
}
