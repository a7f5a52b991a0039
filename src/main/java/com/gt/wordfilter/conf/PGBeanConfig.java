package com.gt.wordfilter.conf;

import com.gt.wordfilter.word.WordDao;
import com.gt.wordfilter.word.impl.WordDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
@ConditionalOnProperty(name = "wordfilter.storage.type", havingValue = "postgres")
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${wordfilter.datasource.postgres.url}") String url,
                                    @Value("${wordfilter.datasource.postgres.username}") String username,
                                    @Value("${wordfilter.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public WordDao getWordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new WordDaoPG(namedParameterJdbcTemplate);
    }
}
