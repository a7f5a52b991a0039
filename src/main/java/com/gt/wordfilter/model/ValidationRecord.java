package com.gt.wordfilter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ValidationRecord(String word,
                               ValidationStatus status,
                               boolean valid,
                               List<String> definitions,
                               List<String> wordForms,
                               List<Pronunciation> pronunciations,
                               List<String> examples,
                               String reason) {

    public static final String SERVICE_UNAVAILABLE_REASON = "service unavailable";

    public ValidationRecord {
        valid = status == ValidationStatus.VALID;
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
        wordForms = wordForms == null ? List.of() : List.copyOf(wordForms);
        pronunciations = pronunciations == null ? List.of() : List.copyOf(pronunciations);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public static ValidationRecord found(String word, List<String> definitions, List<String> wordForms,
                                         List<Pronunciation> pronunciations, List<String> examples, String reason) {
        return new ValidationRecord(word, ValidationStatus.VALID, true, definitions, wordForms, pronunciations, examples, reason);
    }

    public static ValidationRecord invalid(String word, String reason) {
        return new ValidationRecord(word, ValidationStatus.INVALID, false, List.of(), List.of(), List.of(), List.of(), reason);
    }

    public static ValidationRecord unavailable(String word, String detail) {
        String reason = detail == null || detail.isBlank() ? SERVICE_UNAVAILABLE_REASON : SERVICE_UNAVAILABLE_REASON + ": " + detail;
        return new ValidationRecord(word, ValidationStatus.UNAVAILABLE, false, List.of(), List.of(), List.of(), List.of(), reason);
    }

    @JsonIgnore
    public boolean isUnavailable() {
        return status == ValidationStatus.UNAVAILABLE;
    }
}
