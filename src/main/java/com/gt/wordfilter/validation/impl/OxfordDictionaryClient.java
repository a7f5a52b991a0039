package com.gt.wordfilter.validation.impl;

import com.gt.wordfilter.exception.ExternalServiceUnavailableException;
import com.gt.wordfilter.model.Pronunciation;
import com.gt.wordfilter.model.ValidationRecord;
import com.gt.wordfilter.validation.DictionaryClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

public class OxfordDictionaryClient implements DictionaryClient {

    private static final Logger log = LoggerFactory.getLogger(OxfordDictionaryClient.class);

    static final String NOT_FOUND_REASON = "Not found in Oxford Dictionary";
    static final String NO_ENTRY_REASON = "No definition section found";
    static final String NO_DEFINITIONS_REASON = "No definitions found";

    private static final int MAX_DEFINITIONS = 5;
    private static final int MAX_EXAMPLES = 5;

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public OxfordDictionaryClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    @Override
    public ValidationRecord lookup(String word) {
        log.info("Fetching word from Oxford: {}", word);

        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(baseUrl + "{word}", String.class, word);
        } catch (HttpStatusCodeException ex) {
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return ValidationRecord.invalid(word, NOT_FOUND_REASON);
            }

            log.warn("Unexpected status code {} for word: {}", ex.getStatusCode().value(), word);
            throw new ExternalServiceUnavailableException("HTTP " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            String errMsg = "Request failed for word '" + word + "'";

            log.error(errMsg, ex);
            throw new ExternalServiceUnavailableException(ex.getMessage(), ex);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            log.warn("Unexpected status code {} for word: {}", response.getStatusCode().value(), word);
            throw new ExternalServiceUnavailableException("HTTP " + response.getStatusCode().value());
        }

        return parse(word, response.getBody() == null ? "" : response.getBody());
    }

    static ValidationRecord parse(String word, String html) {
        Document document = Jsoup.parse(html);

        if (document.selectFirst("div.entry") == null) {
            return ValidationRecord.invalid(word, NO_ENTRY_REASON);
        }

        List<String> definitions = collectText(document.select("span.def"), MAX_DEFINITIONS, false);
        List<String> wordForms = collectText(document.select("span.pos"), Integer.MAX_VALUE, true);
        List<String> examples = collectText(document.select("span.x"), MAX_EXAMPLES, false);

        List<Pronunciation> pronunciations = new ArrayList<>();
        addPronunciation(pronunciations, document.selectFirst("div.phons_br"), "BrE");
        addPronunciation(pronunciations, document.selectFirst("div.phons_n_am"), "NAmE");

        if (definitions.isEmpty()) {
            return ValidationRecord.invalid(word, NO_DEFINITIONS_REASON);
        }

        return ValidationRecord.found(word, definitions, wordForms, pronunciations, examples,
                "Found in Oxford Dictionary with " + definitions.size() + " definition(s)");
    }

    private static List<String> collectText(List<Element> elements, int max, boolean distinct) {
        List<String> values = new ArrayList<>();

        for (Element element : elements) {
            if (values.size() >= max) {
                break;
            }

            String text = element.text().strip();
            if (!text.isEmpty() && !(distinct && values.contains(text))) {
                values.add(text);
            }
        }

        return values;
    }

    private static void addPronunciation(List<Pronunciation> pronunciations, Element phons, String prefix) {
        if (phons == null) {
            return;
        }

        Element phon = phons.selectFirst("span.phon");
        Element sound = phons.selectFirst("div.sound[data-src-mp3]");

        String ipa = phon == null ? "" : phon.text().strip();
        String audioUrl = sound == null ? "" : sound.attr("data-src-mp3");

        if (!ipa.isEmpty() || !audioUrl.isEmpty()) {
            pronunciations.add(new Pronunciation(prefix, ipa, audioUrl));
        }
    }
}
