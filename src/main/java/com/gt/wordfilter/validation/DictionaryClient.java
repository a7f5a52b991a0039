package com.gt.wordfilter.validation;

import com.gt.wordfilter.model.ValidationRecord;

public interface DictionaryClient {

    /**
     * Looks a normalized word up in the external dictionary.
     *
     * @return a VALID record with the entry details, or an INVALID record when the dictionary
     *         answered that it does not know the word
     * @throws com.gt.wordfilter.exception.ExternalServiceUnavailableException when the dictionary
     *         could not be asked (timeout, transport error, unexpected response)
     */
    ValidationRecord lookup(String word);
}
