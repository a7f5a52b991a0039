package com.gt.wordfilter.word;

import com.gt.wordfilter.util.WordUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

// Flat newline-delimited document used by the object store and file backends
public class WordListFormat {

    private WordListFormat() { }

    public static List<String> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }

        Set<String> words = new LinkedHashSet<>();
        for (String line : content.split("\\R")) {
            String word = WordUtil.normalize(line);
            if (!word.isEmpty()) {
                words.add(word);
            }
        }

        return new ArrayList<>(words);
    }

    public static String format(Collection<String> words) {
        return words.stream()
                .sorted()
                .collect(Collectors.joining("\n"));
    }
}
