package com.gt.wordfilter.word;

import com.gt.wordfilter.exception.InvalidFilterException;
import com.gt.wordfilter.filter.WordFilterService;
import com.gt.wordfilter.maintenance.CollectionMaintenanceService;
import com.gt.wordfilter.maintenance.MaintenanceJob;
import com.gt.wordfilter.model.*;
import com.gt.wordfilter.pattern.PatternMatchService;
import com.gt.wordfilter.validation.ValidationCache;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/words")
public class WordController {

    private static final Logger log = LoggerFactory.getLogger(WordController.class);

    static final int DEFAULT_FILTER_LIMIT = 100;
    static final int MAX_FILTER_LIMIT = 1000;
    static final int DEFAULT_INTERACTIVE_LIMIT = 500;

    private final WordService wordService;
    private final WordStore wordStore;
    private final WordFilterService wordFilterService;
    private final PatternMatchService patternMatchService;
    private final ValidationCache validationCache;
    private final CollectionMaintenanceService collectionMaintenanceService;

    @Autowired
    public WordController(WordService wordService,
                          WordStore wordStore,
                          WordFilterService wordFilterService,
                          PatternMatchService patternMatchService,
                          ValidationCache validationCache,
                          CollectionMaintenanceService collectionMaintenanceService) {
        this.wordService = wordService;
        this.wordStore = wordStore;
        this.wordFilterService = wordFilterService;
        this.patternMatchService = patternMatchService;
        this.validationCache = validationCache;
        this.collectionMaintenanceService = collectionMaintenanceService;
    }

    @GetMapping(value = "", produces = "application/json")
    public FilterResponse filterWords(@RequestParam(value = "contains", required = false) String contains,
                                      @RequestParam(value = "startsWith", required = false) String startsWith,
                                      @RequestParam(value = "endsWith", required = false) String endsWith,
                                      @RequestParam(value = "minLength", required = false) Integer minLength,
                                      @RequestParam(value = "maxLength", required = false) Integer maxLength,
                                      @RequestParam(value = "exactLength", required = false) Integer exactLength,
                                      @RequestParam(value = "limit", defaultValue = "" + DEFAULT_FILTER_LIMIT) int limit) {
        if (limit > MAX_FILTER_LIMIT) {
            throw new InvalidFilterException("limit must be at most " + MAX_FILTER_LIMIT);
        }

        WordFilterCriteria criteria = new WordFilterCriteria(contains, startsWith, endsWith, exactLength, minLength, maxLength, limit);
        List<String> words = wordFilterService.filter(criteria);

        return new FilterResponse(words, words.size(), criteria);
    }

    @GetMapping(value = "/stats", produces = "application/json")
    public WordStats getStats() {
        return wordStore.stats();
    }

    @GetMapping(value = "/byLength/{length}", produces = "application/json")
    public WordListResponse getWordsByLength(@PathVariable("length") int length) {
        List<String> words = wordFilterService.wordsByLength(length);

        return new WordListResponse(words, words.size());
    }

    @GetMapping(value = "/all", produces = "application/json")
    public WordListResponse getAllWords(@RequestParam(value = "limit", required = false) Integer limit) {
        if (limit != null && limit < 1) {
            throw new InvalidFilterException("limit must be a positive number");
        }

        List<String> words = wordStore.words();
        if (limit != null && limit < words.size()) {
            words = words.subList(0, limit);
        }

        return new WordListResponse(words, wordStore.size());
    }

    @GetMapping(value = "/interactive", produces = "application/json")
    public InteractiveResponse interactiveSearch(@RequestParam(value = "length") int length,
                                                 @RequestParam(value = "pattern") String pattern,
                                                 @RequestParam(value = "limit", defaultValue = "" + DEFAULT_INTERACTIVE_LIMIT) int limit) {
        List<String> words = patternMatchService.match(length, pattern, limit);

        return new InteractiveResponse(words, words.size(), length, pattern);
    }

    @PostMapping(value = "/check", consumes = "application/json", produces = "application/json")
    public WordCheckResult checkWord(@RequestBody WordRequest wordRequest) {
        return wordService.check(wordRequest.word());
    }

    @PostMapping(value = "/validate", consumes = "application/json", produces = "application/json")
    public ValidationRecord validateWord(@RequestBody WordRequest wordRequest) {
        return wordService.validate(wordRequest.word());
    }

    @PostMapping(value = "/add", consumes = "application/json", produces = "application/json")
    public AddWordResult addWord(@RequestBody WordRequest wordRequest) {
        return wordService.addWord(wordRequest.word(), true);
    }

    @PostMapping(value = "/addValidated", consumes = "application/json", produces = "application/json")
    public AddWordResult addValidatedWord(@RequestBody ValidatedWordRequest validatedWordRequest) {
        return wordService.addWord(validatedWordRequest.word(), validatedWordRequest.skipValidation());
    }

    @PostMapping(value = "/addBatch", consumes = "application/json", produces = "application/json")
    public AddWordsResult addWords(@RequestBody WordsRequest wordsRequest) {
        return wordService.addWords(wordsRequest.words());
    }

    @PostMapping(value = "/remove", consumes = "application/json", produces = "application/json")
    public RemoveWordsResult removeWord(@RequestBody WordRequest wordRequest, HttpServletResponse response) {
        RemoveWordsResult result = wordService.removeWord(wordRequest.word());
        if (result.removedCount() == 0) {
            response.setStatus(HttpServletResponse.SC_NOT_FOUND);
        }

        return result;
    }

    @PostMapping(value = "/removeBatch", consumes = "application/json", produces = "application/json")
    public RemoveWordsResult removeWords(@RequestBody WordsRequest wordsRequest) {
        return wordService.removeWords(wordsRequest.words());
    }

    @PostMapping(value = "/validateCollection", produces = "application/json")
    public CollectionValidationSummary validateCollection() {
        return collectionMaintenanceService.validateCollection();
    }

    @PostMapping(value = "/cleanup", produces = "application/json")
    public CleanupResult cleanup(@RequestBody(required = false) CleanupRequest cleanupRequest) {
        return collectionMaintenanceService.cleanup(cleanupRequest != null && cleanupRequest.autoRemove());
    }

    @PostMapping(value = "/jobs/validate", produces = "application/json")
    public MaintenanceJob startValidationJob(HttpServletResponse response) {
        response.setStatus(HttpServletResponse.SC_ACCEPTED);
        return collectionMaintenanceService.startValidationJob();
    }

    @PostMapping(value = "/jobs/cleanup", produces = "application/json")
    public MaintenanceJob startCleanupJob(@RequestBody(required = false) CleanupRequest cleanupRequest,
                                          HttpServletResponse response) {
        response.setStatus(HttpServletResponse.SC_ACCEPTED);
        return collectionMaintenanceService.startCleanupJob(cleanupRequest != null && cleanupRequest.autoRemove());
    }

    @GetMapping(value = "/jobs/{id}", produces = "application/json")
    public MaintenanceJob getJob(@PathVariable("id") String jobId, HttpServletResponse response) {
        MaintenanceJob job = collectionMaintenanceService.getJob(jobId);
        if (job == null) {
            response.setStatus(HttpServletResponse.SC_NOT_FOUND);
        }

        return job;
    }

    @PostMapping(value = "/jobs/{id}/cancel", produces = "application/json")
    public MaintenanceJob cancelJob(@PathVariable("id") String jobId, HttpServletResponse response) {
        if (!collectionMaintenanceService.cancelJob(jobId)) {
            log.info("Job {} not found or already finished", jobId);
            response.setStatus(HttpServletResponse.SC_CONFLICT);
        }

        return collectionMaintenanceService.getJob(jobId);
    }

    @PostMapping(value = "/reload", produces = "application/json")
    public StoreStatus reload() {
        return wordService.reload();
    }

    @GetMapping(value = "/health", produces = "application/json")
    public StoreStatus health(HttpServletResponse response) {
        StoreStatus status = wordService.status();
        if (status.degraded()) {
            response.setStatus(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
        }

        return status;
    }

    @GetMapping(value = "/validationCacheStats", produces = "application/json")
    public CacheStats getValidationCacheStats() {
        return validationCache.stats();
    }

    private record WordRequest(String word) { }
    private record ValidatedWordRequest(String word, boolean skipValidation) { }
    private record WordsRequest(List<String> words) {
        WordsRequest {
            words = words == null ? List.of() : words;
        }
    }
    private record CleanupRequest(boolean autoRemove) { }

    record FilterResponse(List<String> words, int count, WordFilterCriteria filtersApplied) { }
    record WordListResponse(List<String> words, int count) { }
    record InteractiveResponse(List<String> words, int count, int length, String pattern) { }
}
