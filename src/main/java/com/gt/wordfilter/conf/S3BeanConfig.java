package com.gt.wordfilter.conf;

import com.gt.wordfilter.word.WordDao;
import com.gt.wordfilter.word.impl.WordDaoS3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
@ConditionalOnProperty(name = "wordfilter.storage.type", havingValue = "s3")
public class S3BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(S3BeanConfig.class);

    @Bean
    public S3Client getS3Client(@Value("${wordfilter.storage.s3.region:us-east-1}") String region,
                                @Value("${wordfilter.storage.s3.endpoint:}") String endpoint,
                                @Value("${wordfilter.storage.s3.pathStyleAccess:false}") boolean pathStyleAccess) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .forcePathStyle(pathStyleAccess);

        // Non-AWS object stores
        if (endpoint != null && !endpoint.isBlank()) {
            log.info("Using S3 endpoint override {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }

    @Bean
    public WordDao getWordDao(S3Client s3Client,
                              @Value("${wordfilter.storage.s3.bucket}") String bucketName,
                              @Value("${wordfilter.storage.s3.key:words/words.txt}") String wordsKey) {
        return new WordDaoS3(s3Client, bucketName, wordsKey);
    }
}
