package com.gt.wordfilter.validation;

import com.gt.wordfilter.model.ValidationRecord;
import com.gt.wordfilter.util.WordUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

// Decides whether a dictionary result is good enough to keep a word in the puzzle collection.
// Short words are rejected even when they are real words.
@Component
public class WordAcceptancePolicy {

    private final int minAcceptedLength;

    @Autowired
    public WordAcceptancePolicy(@Value("${wordfilter.validation.minAcceptedLength:3}") int minAcceptedLength) {
        this.minAcceptedLength = minAcceptedLength;
    }

    public AcceptanceVerdict evaluate(ValidationRecord record) {
        if (record.isUnavailable()) {
            return AcceptanceVerdict.UNVERIFIED;
        }

        return rejectionReason(record) == null ? AcceptanceVerdict.ACCEPTED : AcceptanceVerdict.REJECTED;
    }

    public boolean accepts(ValidationRecord record) {
        return evaluate(record) == AcceptanceVerdict.ACCEPTED;
    }

    // Null when the record is acceptable
    public String rejectionReason(ValidationRecord record) {
        if (record.isUnavailable() || !record.valid()) {
            return record.reason();
        }
        if (record.definitions().isEmpty()) {
            return "No definitions found";
        }
        if (!WordUtil.isAlphabetic(record.word())) {
            return "Invalid word format (must contain only letters)";
        }
        if (record.word().length() < minAcceptedLength) {
            return "Word is shorter than " + minAcceptedLength + " letters";
        }

        return null;
    }

    public int getMinAcceptedLength() {
        return minAcceptedLength;
    }
}
