package com.gt.wordfilter.word;

import com.gt.wordfilter.exception.InvalidWordException;
import com.gt.wordfilter.exception.PersistenceException;
import com.gt.wordfilter.exception.StorageUnavailableException;
import com.gt.wordfilter.model.RemovalOutcome;
import com.gt.wordfilter.model.RemoveWordsResult;
import com.gt.wordfilter.model.StoreStatus;
import com.gt.wordfilter.model.WordStats;
import com.gt.wordfilter.util.WordUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the in-memory mirror of the word collection and mediates every read and write against the
 * durable {@link WordDao}.
 *
 * <p>Reads go against the current {@link WordSnapshot} without locking. Loads and mutations are
 * serialized by a single writer lock: the change is written to durable storage first and the new
 * snapshot is published only once the write is confirmed, so the mirror never holds an
 * uncommitted word. Other instances sharing the same storage converge on their next {@link #load()}.
 */
@Component
public class WordStore {

    private static final Logger log = LoggerFactory.getLogger(WordStore.class);

    private final WordDao wordDao;
    private final int minWordLength;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong versionSequence = new AtomicLong();

    private volatile WordSnapshot snapshot = WordSnapshot.EMPTY;
    private volatile boolean degraded = false;
    private volatile Instant lastLoaded = null;
    private volatile String lastFailure = null;

    @Autowired
    public WordStore(WordDao wordDao,
                     @Value("${wordfilter.words.minLength:2}") int minWordLength) {
        this.wordDao = wordDao;
        this.minWordLength = Math.max(1, minWordLength);
    }

    /**
     * Replaces the mirror with the full durable contents.
     *
     * @return the number of words loaded
     * @throws StorageUnavailableException if storage cannot be read. The previous snapshot stays
     *                                     in place and the store reports itself as degraded.
     */
    public int load() {
        writeLock.lock();
        try {
            List<String> storedWords;
            try {
                storedWords = wordDao.loadAllWords();
            } catch (RuntimeException ex) {
                degraded = true;
                lastFailure = ex.getMessage();
                log.warn("Unable to load words from {}. Continuing with {} words from snapshot version {}.",
                        wordDao.describe(), snapshot.size(), snapshot.version());

                throw ex instanceof StorageUnavailableException ? (StorageUnavailableException) ex
                        : new StorageUnavailableException("Failed to load words from " + wordDao.describe(), ex);
            }

            List<String> acceptedWords = new ArrayList<>(storedWords.size());
            int skipped = 0;
            for (String storedWord : storedWords) {
                String word = WordUtil.normalize(storedWord);
                if (WordUtil.isAlphabetic(word)) {
                    acceptedWords.add(word);
                } else {
                    skipped++;
                }
            }
            if (skipped > 0) {
                log.warn("Skipped {} stored entries that are not alphabetic words.", skipped);
            }

            snapshot = WordSnapshot.of(versionSequence.incrementAndGet(), acceptedWords);
            degraded = false;
            lastFailure = null;
            lastLoaded = Instant.now();

            log.info("Loaded {} words from {} (snapshot version {}).", snapshot.size(), wordDao.describe(), snapshot.version());
            return snapshot.size();
        } finally {
            writeLock.unlock();
        }
    }

    public boolean contains(String word) {
        return snapshot.contains(WordUtil.normalize(word));
    }

    /**
     * Adds a single word.
     *
     * @return true if the word was newly inserted, false if it was already present
     * @throws InvalidWordException if the word is not alphabetic or is too short
     * @throws PersistenceException if the durable write fails. Nothing is changed in that case.
     */
    public boolean add(String word) {
        String normalizedWord = normalizeForInsert(word);

        if (snapshot.contains(normalizedWord)) {
            return false;
        }

        writeLock.lock();
        try {
            WordSnapshot current = snapshot;
            if (current.contains(normalizedWord)) {
                return false;
            }

            persist(() -> wordDao.addWords(List.of(normalizedWord)), "add word " + normalizedWord);
            snapshot = current.withAdded(versionSequence.incrementAndGet(), List.of(normalizedWord));

            log.info("Added word {}. Collection now holds {} words.", normalizedWord, snapshot.size());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Adds every word that is not already present with a single durable write.
     *
     * @return the words that were newly inserted, in submission order
     * @throws InvalidWordException if any word fails the format checks. Nothing is written.
     */
    public List<String> addBatch(Collection<String> words) {
        List<String> normalizedWords = new ArrayList<>(words.size());
        for (String word : words) {
            normalizedWords.add(normalizeForInsert(word));
        }

        writeLock.lock();
        try {
            WordSnapshot current = snapshot;
            List<String> newWords = normalizedWords.stream()
                    .distinct()
                    .filter(word -> !current.contains(word))
                    .toList();

            if (newWords.isEmpty()) {
                return List.of();
            }

            persist(() -> wordDao.addWords(newWords), "add " + newWords.size() + " words");
            snapshot = current.withAdded(versionSequence.incrementAndGet(), newWords);

            log.info("Added {} new words out of {} submitted.", newWords.size(), words.size());
            return newWords;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return true if the word was removed, false if it was not in the collection
     * @throws PersistenceException if the durable write fails. Nothing is changed in that case.
     */
    public boolean remove(String word) {
        return removeBatch(List.of(word)).outcomeFor(WordUtil.normalize(word)) == RemovalOutcome.REMOVED;
    }

    /**
     * Removes every listed word that is present with a single durable write. Words that are not
     * present are reported as {@link RemovalOutcome#NOT_FOUND} and do not fail the batch.
     *
     * @throws PersistenceException if the durable write fails. Nothing is changed in that case.
     */
    public RemoveWordsResult removeBatch(Collection<String> words) {
        writeLock.lock();
        try {
            WordSnapshot current = snapshot;
            Map<String, RemovalOutcome> outcomes = new LinkedHashMap<>();
            List<String> toRemove = new ArrayList<>();

            for (String word : words) {
                String normalizedWord = WordUtil.normalize(word);
                if (outcomes.containsKey(normalizedWord)) {
                    continue;
                }

                if (current.contains(normalizedWord)) {
                    outcomes.put(normalizedWord, RemovalOutcome.REMOVED);
                    toRemove.add(normalizedWord);
                } else {
                    outcomes.put(normalizedWord, RemovalOutcome.NOT_FOUND);
                }
            }

            if (!toRemove.isEmpty()) {
                persist(() -> wordDao.removeWords(toRemove), "remove " + toRemove.size() + " words");
                snapshot = current.withRemoved(versionSequence.incrementAndGet(), toRemove);
                log.info("Removed {} words out of {} submitted.", toRemove.size(), words.size());
            }

            return new RemoveWordsResult(outcomes, toRemove.size(), outcomes.size() - toRemove.size(), snapshot.size());
        } finally {
            writeLock.unlock();
        }
    }

    public WordStats stats() {
        return snapshot.stats();
    }

    public List<String> words() {
        return snapshot.words();
    }

    public WordSnapshot snapshot() {
        return snapshot;
    }

    public int size() {
        return snapshot.size();
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int getMinWordLength() {
        return minWordLength;
    }

    public StoreStatus status() {
        WordSnapshot current = snapshot;
        return new StoreStatus(degraded, current.size(), current.version(), lastLoaded, lastFailure, wordDao.describe());
    }

    public String normalizeForInsert(String word) {
        String normalizedWord = WordUtil.normalize(word);

        if (!WordUtil.isAlphabetic(normalizedWord)) {
            throw new InvalidWordException("Invalid word format '" + word + "' (must contain only letters)");
        }
        if (normalizedWord.length() < minWordLength) {
            throw new InvalidWordException("Word '" + normalizedWord + "' is shorter than " + minWordLength + " letters");
        }

        return normalizedWord;
    }

    private void persist(Runnable write, String description) {
        try {
            write.run();
        } catch (PersistenceException ex) {
            log.error("Failed to {}. Snapshot left at version {}.", description, snapshot.version());
            throw ex;
        } catch (RuntimeException ex) {
            String errMsg = "Failed to " + description + " in " + wordDao.describe();

            log.error(errMsg, ex);
            throw new PersistenceException(errMsg, ex);
        }
    }
}
