package com.gt.wordfilter.conf;

import com.gt.wordfilter.word.WordDao;
import com.gt.wordfilter.word.impl.WordDaoFile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@ConditionalOnProperty(name = "wordfilter.storage.type", havingValue = "file", matchIfMissing = true)
public class FileBeanConfig {

    @Bean
    public WordDao getWordDao(@Value("${wordfilter.storage.file.path:data/words.txt}") String wordsFile) {
        return new WordDaoFile(Path.of(wordsFile));
    }
}
