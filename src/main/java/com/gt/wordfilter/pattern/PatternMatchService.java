package com.gt.wordfilter.pattern;

import com.gt.wordfilter.exception.InvalidPatternException;
import com.gt.wordfilter.word.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

// Fixed-length wildcard search for puzzle solving, e.g. length 5 and pattern "?pp?e"
@Component
public class PatternMatchService {

    private static final Logger log = LoggerFactory.getLogger(PatternMatchService.class);

    public static final char WILDCARD = '?';

    private final WordStore wordStore;

    @Autowired
    public PatternMatchService(WordStore wordStore) {
        this.wordStore = wordStore;
    }

    public List<String> match(int length, String pattern) {
        return match(length, pattern, null);
    }

    /**
     * @param limit maximum number of words to return, or null for all matches
     * @throws InvalidPatternException if the pattern is malformed or its length differs from {@code length}
     */
    public List<String> match(int length, String pattern, Integer limit) {
        char[] patternChars = parsePattern(length, pattern);
        if (limit != null && limit < 1) {
            throw new InvalidPatternException("limit must be at least 1, was " + limit);
        }

        List<String> candidates = wordStore.snapshot().wordsOfLength(length);
        List<String> matches = new ArrayList<>();

        for (String word : candidates) {
            if (matches(patternChars, word)) {
                matches.add(word);
                if (limit != null && matches.size() >= limit) {
                    break;
                }
            }
        }

        log.debug("Pattern {} matched {} of {} words of length {}", pattern, matches.size(), candidates.size(), length);
        return matches;
    }

    private static char[] parsePattern(int length, String pattern) {
        if (length < 1) {
            throw new InvalidPatternException("Length must be at least 1, was " + length);
        }
        if (pattern == null || pattern.length() != length) {
            throw new InvalidPatternException("Pattern '" + pattern + "' does not have the declared length " + length);
        }

        char[] patternChars = pattern.toLowerCase(Locale.ROOT).toCharArray();
        for (char c : patternChars) {
            if (c != WILDCARD && (c < 'a' || c > 'z')) {
                throw new InvalidPatternException("Pattern '" + pattern + "' may only contain letters and '" + WILDCARD + "'");
            }
        }

        return patternChars;
    }

    private static boolean matches(char[] patternChars, String word) {
        for (int idx = 0; idx < patternChars.length; idx++) {
            if (patternChars[idx] != WILDCARD && patternChars[idx] != word.charAt(idx)) {
                return false;
            }
        }

        return true;
    }
}
