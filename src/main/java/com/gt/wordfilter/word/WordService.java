package com.gt.wordfilter.word;

import com.gt.wordfilter.exception.InvalidWordException;
import com.gt.wordfilter.model.*;
import com.gt.wordfilter.util.WordUtil;
import com.gt.wordfilter.validation.AcceptanceVerdict;
import com.gt.wordfilter.validation.ValidationCache;
import com.gt.wordfilter.validation.WordAcceptancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Component
public class WordService {

    private static final Logger log = LoggerFactory.getLogger(WordService.class);

    static final int MAX_LISTED_INVALID_WORDS = 5;

    private final WordStore wordStore;
    private final ValidationCache validationCache;
    private final WordAcceptancePolicy acceptancePolicy;

    @Autowired
    public WordService(WordStore wordStore,
                       ValidationCache validationCache,
                       WordAcceptancePolicy acceptancePolicy) {
        this.wordStore = wordStore;
        this.validationCache = validationCache;
        this.acceptancePolicy = acceptancePolicy;
    }

    // Membership only. Malformed words are reported as absent rather than rejected.
    public WordCheckResult check(String word) {
        String normalizedWord = WordUtil.normalize(word);
        if (normalizedWord.isEmpty()) {
            throw new InvalidWordException("Word must not be empty");
        }

        return new WordCheckResult(normalizedWord, wordStore.contains(normalizedWord), wordStore.size());
    }

    public ValidationRecord validate(String word) {
        return validationCache.validate(word);
    }

    /**
     * Adds a word to the collection. Unless {@code skipValidation} is set the word must first be
     * accepted by the dictionary. A word already in the collection is reported as a success
     * without consulting the dictionary.
     */
    public AddWordResult addWord(String word, boolean skipValidation) {
        String normalizedWord = wordStore.normalizeForInsert(word);

        if (wordStore.contains(normalizedWord)) {
            return new AddWordResult(true, normalizedWord, false, null,
                    "Word '" + normalizedWord + "' already exists in collection", wordStore.size());
        }

        if (skipValidation) {
            boolean wasNew = wordStore.add(normalizedWord);
            return new AddWordResult(true, normalizedWord, wasNew, null,
                    wasNew ? "Word '" + normalizedWord + "' added" : "Word '" + normalizedWord + "' already exists in collection",
                    wordStore.size());
        }

        ValidationRecord record = validationCache.validate(normalizedWord);
        AcceptanceVerdict verdict = acceptancePolicy.evaluate(record);

        if (verdict == AcceptanceVerdict.UNVERIFIED) {
            log.warn("Could not verify '{}', not adding it: {}", normalizedWord, record.reason());
            return new AddWordResult(false, normalizedWord, false, record,
                    "Word '" + normalizedWord + "' could not be verified: " + record.reason(), wordStore.size());
        }
        if (verdict == AcceptanceVerdict.REJECTED) {
            return new AddWordResult(false, normalizedWord, false, record,
                    "Word '" + normalizedWord + "' rejected: " + acceptancePolicy.rejectionReason(record), wordStore.size());
        }

        boolean wasNew = wordStore.add(normalizedWord);
        return new AddWordResult(true, normalizedWord, wasNew, record,
                "Word '" + normalizedWord + "' validated and added", wordStore.size());
    }

    /**
     * Adds a batch of words without dictionary validation.
     *
     * @throws InvalidWordException if any word fails the format checks. Nothing is added in that case.
     */
    public AddWordsResult addWords(Collection<String> words) {
        List<String> invalidWords = new ArrayList<>();
        for (String word : words) {
            try {
                wordStore.normalizeForInsert(word);
            } catch (InvalidWordException ex) {
                invalidWords.add(word);
            }
        }

        if (!invalidWords.isEmpty()) {
            String listed = String.join(", ", invalidWords.subList(0, Math.min(MAX_LISTED_INVALID_WORDS, invalidWords.size())));
            throw new InvalidWordException("Invalid words found: " + listed
                    + (invalidWords.size() > MAX_LISTED_INVALID_WORDS ? " and " + (invalidWords.size() - MAX_LISTED_INVALID_WORDS) + " more" : ""));
        }

        List<String> addedWords = wordStore.addBatch(words);
        return new AddWordsResult(addedWords.size(), words.size(), words.size() - addedWords.size(), addedWords, wordStore.size());
    }

    public RemoveWordsResult removeWord(String word) {
        return wordStore.removeBatch(Collections.singletonList(word));
    }

    public RemoveWordsResult removeWords(Collection<String> words) {
        return wordStore.removeBatch(words);
    }

    /**
     * @throws com.gt.wordfilter.exception.StorageUnavailableException if storage cannot be read
     */
    public StoreStatus reload() {
        wordStore.load();
        return wordStore.status();
    }

    public StoreStatus status() {
        return wordStore.status();
    }
}
