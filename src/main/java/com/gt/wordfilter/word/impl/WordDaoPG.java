package com.gt.wordfilter.word.impl;

import com.gt.wordfilter.exception.PersistenceException;
import com.gt.wordfilter.exception.StorageUnavailableException;
import com.gt.wordfilter.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.*;

// Expects: CREATE TABLE words (word TEXT PRIMARY KEY, create_seq_num BIGSERIAL, create_instant TIMESTAMPTZ DEFAULT now())
public class WordDaoPG implements WordDao {

    private static final Logger log = LoggerFactory.getLogger(WordDaoPG.class);

    private static final int WRITE_BATCH_SIZE = 1000;

    private static final String LOAD_ALL_WORDS_SQL =
            "SELECT word FROM words ORDER BY create_seq_num";

    private static final String INSERT_WORD_SQL =
            "INSERT INTO words (word) VALUES (:word) " +
                    "ON CONFLICT DO NOTHING";

    private static final String DELETE_WORDS_SQL =
            "DELETE FROM words WHERE word IN (:words)";

    private final NamedParameterJdbcTemplate template;

    public WordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<String> loadAllWords() {
        try {
            return template.queryForList(LOAD_ALL_WORDS_SQL, Map.of(), String.class);
        } catch (DataAccessException ex) {
            String errMsg = "Error reading words from database";

            log.error(errMsg, ex);
            throw new StorageUnavailableException(errMsg, ex);
        }
    }

    @Override
    public void addWords(Collection<String> words) {
        List<String> wordList = new ArrayList<>(words);

        try {
            for (int idx = 0; idx < wordList.size(); idx += WRITE_BATCH_SIZE) {
                SqlParameterSource[] batchParams = wordList.subList(idx, Math.min(idx + WRITE_BATCH_SIZE, wordList.size()))
                        .stream()
                        .map(word -> new MapSqlParameterSource("word", word))
                        .toArray(SqlParameterSource[]::new);

                template.batchUpdate(INSERT_WORD_SQL, batchParams);
            }
        } catch (DataAccessException ex) {
            String errMsg = "Error inserting " + wordList.size() + " words";

            log.error(errMsg, ex);
            throw new PersistenceException(errMsg, ex);
        }
    }

    @Override
    public void removeWords(Collection<String> words) {
        List<String> wordList = new ArrayList<>(words);

        try {
            int rowsDeleted = 0;
            for (int idx = 0; idx < wordList.size(); idx += WRITE_BATCH_SIZE) {
                rowsDeleted += template.update(DELETE_WORDS_SQL,
                        new MapSqlParameterSource("words", wordList.subList(idx, Math.min(idx + WRITE_BATCH_SIZE, wordList.size()))));
            }

            log.info("Deleted {} word rows.", rowsDeleted);
        } catch (DataAccessException ex) {
            String errMsg = "Error deleting " + wordList.size() + " words";

            log.error(errMsg, ex);
            throw new PersistenceException(errMsg, ex);
        }
    }

    @Override
    public String describe() {
        return "postgres:words";
    }
}
