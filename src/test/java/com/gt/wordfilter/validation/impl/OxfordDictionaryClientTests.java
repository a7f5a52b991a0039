package com.gt.wordfilter.validation.impl;

import com.gt.wordfilter.exception.ExternalServiceUnavailableException;
import com.gt.wordfilter.model.Pronunciation;
import com.gt.wordfilter.model.ValidationRecord;
import com.gt.wordfilter.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

public class OxfordDictionaryClientTests {

    private static final String TEST_BASE_URL = "https://dictionary.example.test/definition/english";

    private MockRestServiceServer server;
    private OxfordDictionaryClient oxfordDictionaryClient;

    @BeforeEach
    public void setup() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        oxfordDictionaryClient = new OxfordDictionaryClient(restTemplate, TEST_BASE_URL);
    }

    @Test
    public void testLookup() throws IOException {
        server.expect(requestTo(TEST_BASE_URL + "/owl"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(loadFixture("owl.html"), new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8)));

        ValidationRecord record = oxfordDictionaryClient.lookup("owl");

        server.verify();
        assertEquals(ValidationStatus.VALID, record.status());
        assertEquals("owl", record.word());
        assertEquals(List.of("a bird of prey with large round eyes, that hunts at night", "a person who is thought to be wise"), record.definitions());
        assertEquals(List.of("noun"), record.wordForms());
        assertEquals(List.of("Owls hooted in the woods.", "An owl swooped down on the mouse."), record.examples());
        assertEquals(List.of(
                new Pronunciation("BrE", "/aʊl/", "https://example.test/media/english/uk_pron/o/owl/owl__/owl__gb_1.mp3"),
                new Pronunciation("NAmE", "/aʊl/", "https://example.test/media/english/us_pron/o/owl/owl__/owl__us_1.mp3")),
                record.pronunciations());
        assertEquals("Found in Oxford Dictionary with 2 definition(s)", record.reason());
    }

    @Test
    public void testLookup_NotFound() {
        server.expect(requestTo(TEST_BASE_URL + "/xqzt"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        ValidationRecord record = oxfordDictionaryClient.lookup("xqzt");

        assertEquals(ValidationStatus.INVALID, record.status());
        assertEquals(OxfordDictionaryClient.NOT_FOUND_REASON, record.reason());
    }

    @Test
    public void testLookup_ServerError() {
        server.expect(requestTo(TEST_BASE_URL + "/owl"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        ExternalServiceUnavailableException ex = assertThrows(ExternalServiceUnavailableException.class,
                () -> oxfordDictionaryClient.lookup("owl"));
        assertEquals("HTTP 503", ex.getMessage());
    }

    @Test
    public void testLookup_TooManyRequests() {
        server.expect(requestTo(TEST_BASE_URL + "/owl"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThrows(ExternalServiceUnavailableException.class, () -> oxfordDictionaryClient.lookup("owl"));
    }

    @Test
    public void testLookup_Timeout() {
        server.expect(requestTo(TEST_BASE_URL + "/owl"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThrows(ExternalServiceUnavailableException.class, () -> oxfordDictionaryClient.lookup("owl"));
    }

    @Test
    public void testParse_LimitsDefinitionsAndExamples() throws IOException {
        ValidationRecord record = OxfordDictionaryClient.parse("run", loadFixture("many-definitions.html"));

        assertEquals(ValidationStatus.VALID, record.status());
        assertEquals(5, record.definitions().size());
        assertEquals("definition five", record.definitions().get(4));
        assertEquals(5, record.examples().size());
        assertEquals(List.of("verb", "noun"), record.wordForms());
        assertEquals(List.of(), record.pronunciations());
        assertEquals("Found in Oxford Dictionary with 5 definition(s)", record.reason());
    }

    @Test
    public void testParse_NoEntry() throws IOException {
        ValidationRecord record = OxfordDictionaryClient.parse("xqzt", loadFixture("no-entry.html"));

        assertEquals(ValidationStatus.INVALID, record.status());
        assertEquals(OxfordDictionaryClient.NO_ENTRY_REASON, record.reason());
    }

    @Test
    public void testParse_NoDefinitions() throws IOException {
        ValidationRecord record = OxfordDictionaryClient.parse("xqzt", loadFixture("no-definitions.html"));

        assertEquals(ValidationStatus.INVALID, record.status());
        assertEquals(OxfordDictionaryClient.NO_DEFINITIONS_REASON, record.reason());
        assertEquals(List.of(), record.definitions());
    }

    @Test
    public void testParse_EmptyBody() {
        assertEquals(ValidationStatus.INVALID, OxfordDictionaryClient.parse("owl", "").status());
    }

    private static String loadFixture(String name) throws IOException {
        return new ClassPathResource("oxford/" + name).getContentAsString(StandardCharsets.UTF_8);
    }
}
