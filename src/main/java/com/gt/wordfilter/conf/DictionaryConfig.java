package com.gt.wordfilter.conf;

import com.gt.wordfilter.validation.DictionaryClient;
import com.gt.wordfilter.validation.RequestRateLimiter;
import com.gt.wordfilter.validation.impl.OxfordDictionaryClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class DictionaryConfig {

    @Bean(name = "dictionaryRestTemplate")
    public RestTemplate getDictionaryRestTemplate(@Value("${wordfilter.dictionary.connectTimeoutMs:10000}") int connectTimeoutMs,
                                                  @Value("${wordfilter.dictionary.readTimeoutMs:10000}") int readTimeoutMs,
                                                  @Value("${wordfilter.dictionary.userAgent:Mozilla/5.0 (compatible; wordfilter-server)}") String userAgent) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().set(HttpHeaders.USER_AGENT, userAgent);
            return execution.execute(request, body);
        });

        return restTemplate;
    }

    @Bean
    public DictionaryClient getDictionaryClient(RestTemplate dictionaryRestTemplate,
                                                @Value("${wordfilter.dictionary.baseUrl:https://www.oxfordlearnersdictionaries.com/definition/english/}") String baseUrl) {
        return new OxfordDictionaryClient(dictionaryRestTemplate, baseUrl);
    }

    @Bean
    public RequestRateLimiter getRequestRateLimiter(@Value("${wordfilter.dictionary.minRequestIntervalMs:1000}") long minRequestIntervalMs,
                                                    @Value("${wordfilter.dictionary.maxQueueWaitMs:30000}") long maxQueueWaitMs) {
        return new RequestRateLimiter(Duration.ofMillis(minRequestIntervalMs), Duration.ofMillis(maxQueueWaitMs));
    }
}
