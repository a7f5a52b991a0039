package com.gt.wordfilter.task;

import com.gt.wordfilter.exception.StorageUnavailableException;
import com.gt.wordfilter.word.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

// Keeps the in-memory word set in step with storage that other instances also write to.
@Component
public class WordStoreRefreshTask {

    private static final Logger log = LoggerFactory.getLogger(WordStoreRefreshTask.class);

    private final WordStore wordStore;

    @Autowired
    public WordStoreRefreshTask(WordStore wordStore) {
        this.wordStore = wordStore;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        refresh();
    }

    @Scheduled(fixedDelayString = "${wordfilter.storage.refreshIntervalMs:300000}",
               initialDelayString = "${wordfilter.storage.refreshIntervalMs:300000}")
    public void refresh() {
        try {
            wordStore.load();
        } catch (StorageUnavailableException ex) {
            log.error("Word refresh failed, serving {} cached words", wordStore.size(), ex);
        }
    }
}
