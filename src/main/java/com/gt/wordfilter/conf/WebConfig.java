package com.gt.wordfilter.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final String[] allowedOrigins;

    @Autowired
    public WebConfig(@Value("${server.cors.allowedOrigins:}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (allowedOrigins != null && allowedOrigins.length > 0 && !allowedOrigins[0].isBlank()) {
            log.info("Setting allowed origins: {}", String.join(", ", allowedOrigins));
            registry.addMapping("/rest/**")
                    .allowedOrigins(allowedOrigins)
                    .allowedMethods("GET", "POST");
        }
    }
}
