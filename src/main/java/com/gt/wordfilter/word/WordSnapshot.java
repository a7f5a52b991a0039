package com.gt.wordfilter.word;

import com.gt.wordfilter.model.WordStats;
import com.gt.wordfilter.util.WordUtil;

import java.time.Instant;
import java.util.*;

// Immutable view of the word collection. A new snapshot is built for every committed change and
// swapped in atomically, so readers never lock.
public class WordSnapshot {

    public static final WordSnapshot EMPTY = new WordSnapshot(0, Instant.EPOCH, List.of());

    private final long version;
    private final Instant createInstant;
    private final List<String> words;
    private final Set<String> wordSet;
    private final Map<Integer, List<String>> wordsByLength;

    private WordSnapshot(long version, Instant createInstant, List<String> orderedUniqueWords) {
        this.version = version;
        this.createInstant = createInstant;
        this.words = Collections.unmodifiableList(orderedUniqueWords);
        this.wordSet = Collections.unmodifiableSet(new HashSet<>(orderedUniqueWords));

        Map<Integer, List<String>> byLength = new HashMap<>();
        for (String word : orderedUniqueWords) {
            byLength.computeIfAbsent(word.length(), unused -> new ArrayList<>()).add(word);
        }
        byLength.replaceAll((length, group) -> Collections.unmodifiableList(group));
        this.wordsByLength = Collections.unmodifiableMap(byLength);
    }

    // Keeps first-seen order and drops duplicates. Input is expected to be normalized.
    public static WordSnapshot of(long version, Collection<String> words) {
        return new WordSnapshot(version, Instant.now(), new ArrayList<>(new LinkedHashSet<>(words)));
    }

    public WordSnapshot withAdded(long newVersion, Collection<String> addedWords) {
        List<String> newWords = new ArrayList<>(words.size() + addedWords.size());
        newWords.addAll(words);
        for (String word : new LinkedHashSet<>(addedWords)) {
            if (!wordSet.contains(word)) {
                newWords.add(word);
            }
        }

        return new WordSnapshot(newVersion, Instant.now(), newWords);
    }

    public WordSnapshot withRemoved(long newVersion, Collection<String> removedWords) {
        Set<String> toRemove = new HashSet<>(removedWords);
        List<String> newWords = new ArrayList<>(words.size());
        for (String word : words) {
            if (!toRemove.contains(word)) {
                newWords.add(word);
            }
        }

        return new WordSnapshot(newVersion, Instant.now(), newWords);
    }

    public boolean contains(String normalizedWord) {
        return wordSet.contains(normalizedWord);
    }

    public List<String> words() {
        return words;
    }

    public List<String> wordsOfLength(int length) {
        return wordsByLength.getOrDefault(length, List.of());
    }

    public int size() {
        return words.size();
    }

    public long version() {
        return version;
    }

    public Instant createInstant() {
        return createInstant;
    }

    public WordStats stats() {
        if (words.isEmpty()) {
            return WordStats.EMPTY_STATS;
        }

        int min = Integer.MAX_VALUE;
        int max = 0;
        long totalLength = 0;
        for (String word : words) {
            min = Math.min(min, word.length());
            max = Math.max(max, word.length());
            totalLength += word.length();
        }

        return new WordStats(words.size(), min, max, WordUtil.roundTwoDecimals((double) totalLength / words.size()));
    }
}
