package com.naag.docsync.config;

import com.naag.docsync.pipeline.PipelineOrchestrator;
import com.naag.docsync.pipeline.PipelineRegistry;
import com.naag.docsync.store.HybridVectorStore;
import com.naag.docsync.store.InMemoryHybridStore;
import com.naag.docsync.store.QdrantHybridStore;
import com.naag.docsync.store.RankFusion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Configuration
public class VectorStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreConfig.class);

    private final ApplicationContext applicationContext;

    public VectorStoreConfig(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Bean
    public RankFusion rankFusion() {
        return new RankFusion();
    }

    @Bean
    public HybridVectorStore hybridVectorStore(DocSyncProperties properties, RankFusion rankFusion) {
        DocSyncProperties.QdrantConfig qdrant = properties.getQdrant();
        if (properties.getStore().getProvider() == DocSyncProperties.StoreProvider.MEMORY) {
            log.warn("Using in-memory vector store; indexed records will not survive a restart");
            return new InMemoryHybridStore(rankFusion);
        }
        return new QdrantHybridStore(qdrant.getBaseUrl(), qdrant.getApiKey(), qdrant.getVectorSize(), qdrant.getDistance(),
                rankFusion);
    }

    /**
     * Creates each pipeline's collection on startup so searches work before the first run.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeCollections() {
        HybridVectorStore store = applicationContext.getBean(HybridVectorStore.class);
        PipelineRegistry registry = applicationContext.getBean(PipelineRegistry.class);
        int dimension = applicationContext.getBean(DocSyncProperties.class).getQdrant().getVectorSize();

        for (PipelineOrchestrator pipeline : registry.all()) {
            String collection = pipeline.definition().collection();
            try {
                store.ensureCollection(collection, dimension);
                log.info("Collection {} ready for pipeline {}", collection, pipeline.name());
            } catch (Exception e) {
                log.warn("Failed to initialize collection {} (store may not be available): {}", collection, e.getMessage());
            }
        }
    }
}
