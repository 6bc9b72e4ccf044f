package com.naag.docsync.config;

import com.naag.docsync.embed.HybridEmbedder;
import com.naag.docsync.metrics.IngestionMetrics;
import com.naag.docsync.search.KeywordQueryExpansion;
import com.naag.docsync.search.RetrievalQueryEngine;
import com.naag.docsync.service.SearchCallLogService;
import com.naag.docsync.store.HybridVectorStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RetrievalConfig {

    @Bean
    public RetrievalQueryEngine retrievalQueryEngine(HybridEmbedder hybridEmbedder, HybridVectorStore hybridVectorStore,
                                                     SearchCallLogService searchCallLogService,
                                                     IngestionMetrics ingestionMetrics,
                                                     DocSyncProperties properties, Clock clock) {
        DocSyncProperties.RetrievalConfig retrieval = properties.getRetrieval();
        return new RetrievalQueryEngine(hybridEmbedder, hybridVectorStore,
                new KeywordQueryExpansion(retrieval.getExpansionTerms()), searchCallLogService, ingestionMetrics,
                clock, retrieval.getConfidenceThreshold(), retrieval.getMaxWideningAttempts(),
                retrieval.getDefaultLimit());
    }
}
