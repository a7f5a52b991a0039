package com.gt.wordfilter.word.impl;

import com.gt.wordfilter.exception.PersistenceException;
import com.gt.wordfilter.exception.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class WordDaoS3Tests {

    private static final String TEST_BUCKET = "test-bucket";
    private static final String TEST_KEY = "words/words.txt";

    @Mock private S3Client s3Client;

    private WordDaoS3 wordDaoS3;

    @BeforeEach
    public void setup() {
        wordDaoS3 = new WordDaoS3(s3Client, TEST_BUCKET, TEST_KEY);
    }

    @Test
    public void testLoadAllWords() {
        mockStoredContent("dog\nCat\n\ncat\n");

        assertEquals(List.of("dog", "cat"), wordDaoS3.loadAllWords());

        ArgumentCaptor<GetObjectRequest> requestCaptor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(requestCaptor.capture());
        assertEquals(TEST_BUCKET, requestCaptor.getValue().bucket());
        assertEquals(TEST_KEY, requestCaptor.getValue().key());
    }

    @Test
    public void testLoadAllWords_MissingObject() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertEquals(List.of(), wordDaoS3.loadAllWords());
    }

    @Test
    public void testLoadAllWords_Unreachable() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("connection refused"));

        assertThrows(StorageUnavailableException.class, () -> wordDaoS3.loadAllWords());
    }

    @Test
    public void testAddWords_MergesWithCurrentObject() throws Exception {
        mockStoredContent("emu\ncat\n");

        wordDaoS3.addWords(List.of("ant", "cat"));

        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(requestCaptor.capture(), bodyCaptor.capture());

        assertEquals(TEST_BUCKET, requestCaptor.getValue().bucket());
        assertEquals(TEST_KEY, requestCaptor.getValue().key());
        assertEquals("3", requestCaptor.getValue().metadata().get("word-count"));
        assertNull(requestCaptor.getValue().ifNoneMatch());
        assertEquals("ant\ncat\nemu", readBody(bodyCaptor.getValue()));
    }

    @Test
    public void testAddWords_CreatesMissingObjectConditionally() throws Exception {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        wordDaoS3.addWords(List.of("owl"));

        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(requestCaptor.capture(), bodyCaptor.capture());

        assertEquals("*", requestCaptor.getValue().ifNoneMatch());
        assertEquals("owl", readBody(bodyCaptor.getValue()));
    }

    @Test
    public void testAddWords_ConcurrentCreateIsMerged() throws Exception {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build())
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), "emu\n".getBytes(StandardCharsets.UTF_8)));
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(412).message("precondition failed").build())
                .thenReturn(PutObjectResponse.builder().build());

        wordDaoS3.addWords(List.of("owl"));

        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client, times(2)).putObject(requestCaptor.capture(), bodyCaptor.capture());

        assertEquals("*", requestCaptor.getAllValues().get(0).ifNoneMatch());
        assertNull(requestCaptor.getAllValues().get(1).ifNoneMatch());
        assertEquals("emu\nowl", readBody(bodyCaptor.getAllValues().get(1)));
    }

    @Test
    public void testAddWords_GivesUpAfterRepeatedConflicts() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(412).message("precondition failed").build());

        assertThrows(PersistenceException.class, () -> wordDaoS3.addWords(List.of("owl")));
        verify(s3Client, times(3)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    public void testRemoveWords() throws Exception {
        mockStoredContent("emu\ncat\nant\n");

        wordDaoS3.removeWords(List.of("cat"));

        ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(any(PutObjectRequest.class), bodyCaptor.capture());
        assertEquals("ant\nemu", readBody(bodyCaptor.getValue()));
    }

    @Test
    public void testAddWords_ReadFailureIsPersistenceFailure() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("timeout"));

        assertThrows(PersistenceException.class, () -> wordDaoS3.addWords(List.of("owl")));
        verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    public void testAddWords_WriteFailure() {
        mockStoredContent("cat");
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("access denied"));

        assertThrows(PersistenceException.class, () -> wordDaoS3.addWords(List.of("owl")));
    }

    private void mockStoredContent(String content) {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content.getBytes(StandardCharsets.UTF_8)));
    }

    private static String readBody(RequestBody requestBody) throws Exception {
        try (InputStream inputStream = requestBody.contentStreamProvider().newStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
