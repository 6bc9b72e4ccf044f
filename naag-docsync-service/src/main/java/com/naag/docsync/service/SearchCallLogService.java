package com.naag.docsync.service;

import com.naag.docsync.entity.SearchCallLog;
import com.naag.docsync.repository.SearchCallLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-search diagnostic log. Writing a log entry never fails the search it describes.
 */
@Service
@Slf4j
public class SearchCallLogService {

    private final SearchCallLogRepository repository;
    private final Clock clock;
    private final int retentionDays;

    public SearchCallLogService(SearchCallLogRepository repository, Clock clock,
                                @Value("${naag.docsync.retrieval.log-retention-days:90}") int retentionDays) {
        this.repository = repository;
        this.clock = clock;
        this.retentionDays = retentionDays;
    }

    public void record(String query, List<String> collections, int resultCount, Double topScore,
                       boolean confident, int attempts, long latencyMs, String errorMessage) {
        try {
            repository.save(SearchCallLog.builder()
                    .queryText(truncate(query, 2000))
                    .collections(truncate(String.join(",", collections), 500))
                    .resultCount(resultCount)
                    .topScore(topScore)
                    .confident(confident)
                    .attempts(attempts)
                    .latencyMs(latencyMs)
                    .errorMessage(truncate(errorMessage, 2000))
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to write search log: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${naag.docsync.retrieval.log-purge-cron:0 30 3 * * *}")
    @Transactional
    public void purgeOnSchedule() {
        purgeExpired();
    }

    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = repository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} search log entries older than {} days", deleted, retentionDays);
        }
        return deleted;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
