package com.gt.wordfilter.word.impl;

import com.gt.wordfilter.exception.PersistenceException;
import com.gt.wordfilter.exception.StorageUnavailableException;
import com.gt.wordfilter.word.WordDao;
import com.gt.wordfilter.word.WordListFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;

// Stores the whole collection as one newline-delimited object. Works against AWS S3 and
// S3-compatible object stores.
public class WordDaoS3 implements WordDao {

    private static final Logger log = LoggerFactory.getLogger(WordDaoS3.class);

    private static final String CONTENT_TYPE = "text/plain; charset=utf-8";
    private static final int PRECONDITION_FAILED = 412;
    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final S3Client s3Client;
    private final String bucketName;
    private final String wordsKey;

    public WordDaoS3(S3Client s3Client, String bucketName, String wordsKey) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.wordsKey = wordsKey;
    }

    @Override
    public List<String> loadAllWords() {
        return readObject().words();
    }

    @Override
    public void addWords(Collection<String> words) {
        mergeAndSave(storedWords -> storedWords.addAll(words));
    }

    @Override
    public void removeWords(Collection<String> words) {
        mergeAndSave(storedWords -> storedWords.removeAll(new HashSet<>(words)));
    }

    @Override
    public String describe() {
        return "s3://" + bucketName + "/" + wordsKey;
    }

    private StoredObject readObject() {
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucketName)
                    .key(wordsKey)
                    .build());

            List<String> words = WordListFormat.parse(response.asUtf8String());
            log.debug("Read {} words from s3://{}/{}", words.size(), bucketName, wordsKey);

            return new StoredObject(words, true);
        } catch (NoSuchKeyException ex) {
            log.warn("Words object s3://{}/{} does not exist yet. Treating it as empty.", bucketName, wordsKey);
            return new StoredObject(List.of(), false);
        } catch (SdkException ex) {
            String errMsg = "Error reading words from s3://" + bucketName + "/" + wordsKey;

            log.error(errMsg, ex);
            throw new StorageUnavailableException(errMsg, ex);
        }
    }

    // Reads the current object so that words written by other instances since our last load are kept.
    // Creating the object is conditional on it still being absent. Overwriting an existing object is not
    // conditional, so two instances writing at the same moment can lose one of the two changes.
    private void mergeAndSave(Consumer<Set<String>> mutation) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            StoredObject current;
            try {
                current = readObject();
            } catch (StorageUnavailableException ex) {
                throw new PersistenceException("Unable to read current words before writing to " + describe(), ex);
            }

            Set<String> storedWords = new TreeSet<>(current.words());
            mutation.accept(storedWords);

            if (saveWords(storedWords, !current.exists())) {
                return;
            }
            log.warn("Words object {} was created by another writer, retrying merge (attempt {} of {})",
                    describe(), attempt, MAX_WRITE_ATTEMPTS);
        }

        String errMsg = "Gave up writing to " + describe() + " after " + MAX_WRITE_ATTEMPTS + " conflicting attempts";

        log.error(errMsg);
        throw new PersistenceException(errMsg);
    }

    // Returns false if the object had to be absent and another writer created it first
    private boolean saveWords(Collection<String> words, boolean createOnly) {
        PutObjectRequest.Builder request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(wordsKey)
                .contentType(CONTENT_TYPE)
                .metadata(Map.of("word-count", String.valueOf(words.size()),
                                 "last-updated", Instant.now().toString()));
        if (createOnly) {
            request.ifNoneMatch("*");
        }

        try {
            s3Client.putObject(request.build(), RequestBody.fromString(WordListFormat.format(words), StandardCharsets.UTF_8));

            log.info("Saved {} words to {}", words.size(), describe());
            return true;
        } catch (SdkException ex) {
            if (createOnly && ex instanceof SdkServiceException && ((SdkServiceException) ex).statusCode() == PRECONDITION_FAILED) {
                return false;
            }

            String errMsg = "Error saving words to " + describe();

            log.error(errMsg, ex);
            throw new PersistenceException(errMsg, ex);
        }
    }

    private record StoredObject(List<String> words, boolean exists) { }
}
