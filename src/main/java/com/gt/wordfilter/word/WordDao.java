package com.gt.wordfilter.word;

import java.util.Collection;
import java.util.List;

// Durable word storage. Mutations are expressed as deltas so a backend can merge them with the
// current durable state rather than overwrite it with a possibly stale in-memory copy.
public interface WordDao {

    // throws StorageUnavailableException when the backend cannot be read
    List<String> loadAllWords();

    // throws PersistenceException when the write is not confirmed
    void addWords(Collection<String> words);

    // throws PersistenceException when the write is not confirmed
    void removeWords(Collection<String> words);

    String describe();
}
