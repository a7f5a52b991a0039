package com.gt.wordfilter.filter;

import com.gt.wordfilter.exception.InvalidFilterException;
import com.gt.wordfilter.model.WordFilterCriteria;
import com.gt.wordfilter.word.WordSnapshot;
import com.gt.wordfilter.word.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

@Component
public class WordFilterService {

    private static final Logger log = LoggerFactory.getLogger(WordFilterService.class);

    static final int MAX_WORD_LENGTH = 50;

    private final WordStore wordStore;

    @Autowired
    public WordFilterService(WordStore wordStore) {
        this.wordStore = wordStore;
    }

    /**
     * Returns the words that satisfy every criterion that is set, in store order. The limit only
     * truncates the returned list; an empty result is not an error.
     */
    public List<String> filter(WordFilterCriteria criteria) {
        WordFilterCriteria filterCriteria = criteria == null ? WordFilterCriteria.EMPTY_CRITERIA : criteria;
        verifyCriteria(filterCriteria);

        Predicate<String> predicate = buildPredicate(filterCriteria);
        WordSnapshot snapshot = wordStore.snapshot();

        List<String> matches = new ArrayList<>();
        for (String word : snapshot.words()) {
            if (predicate.test(word)) {
                matches.add(word);
            }
        }

        log.debug("Filter {} matched {} of {} words", filterCriteria, matches.size(), snapshot.size());

        if (filterCriteria.limit() != null && matches.size() > filterCriteria.limit()) {
            return List.copyOf(matches.subList(0, filterCriteria.limit()));
        }
        return List.copyOf(matches);
    }

    public List<String> wordsByLength(int length) {
        if (length < 1 || length > MAX_WORD_LENGTH) {
            throw new InvalidFilterException("Length must be between 1 and " + MAX_WORD_LENGTH);
        }

        return wordStore.snapshot().wordsOfLength(length);
    }

    private Predicate<String> buildPredicate(WordFilterCriteria criteria) {
        Predicate<String> predicate = word -> true;

        if (isSet(criteria.contains())) {
            String contains = criteria.contains().strip().toLowerCase(Locale.ROOT);
            predicate = predicate.and(word -> word.contains(contains));
        }
        if (isSet(criteria.startsWith())) {
            String prefix = criteria.startsWith().strip().toLowerCase(Locale.ROOT);
            predicate = predicate.and(word -> word.startsWith(prefix));
        }
        if (isSet(criteria.endsWith())) {
            String suffix = criteria.endsWith().strip().toLowerCase(Locale.ROOT);
            predicate = predicate.and(word -> word.endsWith(suffix));
        }
        if (criteria.exactLength() != null) {
            int exactLength = criteria.exactLength();
            predicate = predicate.and(word -> word.length() == exactLength);
        }
        if (criteria.minLength() != null) {
            int minLength = criteria.minLength();
            predicate = predicate.and(word -> word.length() >= minLength);
        }
        if (criteria.maxLength() != null) {
            int maxLength = criteria.maxLength();
            predicate = predicate.and(word -> word.length() <= maxLength);
        }

        return predicate;
    }

    private void verifyCriteria(WordFilterCriteria criteria) {
        verifyPositive("exactLength", criteria.exactLength());
        verifyPositive("minLength", criteria.minLength());
        verifyPositive("maxLength", criteria.maxLength());
        verifyPositive("limit", criteria.limit());
    }

    private static void verifyPositive(String name, Integer value) {
        if (value != null && value < 1) {
            throw new InvalidFilterException(name + " must be at least 1, was " + value);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
