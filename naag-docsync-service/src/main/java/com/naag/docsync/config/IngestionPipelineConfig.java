package com.naag.docsync.config;

import com.naag.docsync.domain.CaseRecordMapper;
import com.naag.docsync.domain.ContentDomain;
import com.naag.docsync.domain.DocumentPageRecordMapper;
import com.naag.docsync.domain.DomainDefinition;
import com.naag.docsync.domain.ProcedureFieldParser;
import com.naag.docsync.domain.ProcedureRecordMapper;
import com.naag.docsync.domain.RecordMapper;
import com.naag.docsync.domain.RegulationRecordMapper;
import com.naag.docsync.embed.HybridEmbedder;
import com.naag.docsync.embed.SparseVectorizer;
import com.naag.docsync.llm.EmbeddingsClient;
import com.naag.docsync.llm.GenerativeClient;
import com.naag.docsync.pipeline.PipelineOrchestrator;
import com.naag.docsync.pipeline.PipelineRegistry;
import com.naag.docsync.source.RemoteSourceClient;
import com.naag.docsync.store.HybridVectorStore;
import com.naag.docsync.sync.ChangeDetector;
import com.naag.docsync.sync.SyncEngine;
import com.naag.docsync.transform.ContentTransformer;
import com.naag.docsync.transform.OcrService;
import com.naag.docsync.transform.PdfExtractor;
import com.naag.docsync.transform.SlideDeckConverter;
import com.naag.docsync.transform.SlideDeckExtractor;
import com.naag.docsync.transform.SpreadsheetExtractor;
import com.naag.docsync.transform.StructuredRecordExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wires the ingestion components and builds one orchestrator per configured pipeline.
 */
@Slf4j
@Configuration
public class IngestionPipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SparseVectorizer sparseVectorizer(DocSyncProperties properties) {
        return new SparseVectorizer(properties.getEmbedding().getSparseModulus());
    }

    @Bean
    public HybridEmbedder hybridEmbedder(EmbeddingsClient embeddingsClient, SparseVectorizer sparseVectorizer,
                                         DocSyncProperties properties) {
        return new HybridEmbedder(embeddingsClient, sparseVectorizer, properties.getQdrant().getVectorSize());
    }

    @Bean
    public OcrService ocrService(GenerativeClient generativeClient, DocSyncProperties properties) {
        return new OcrService(generativeClient, properties.getGemini().getOcrModel());
    }

    @Bean
    public ProcedureFieldParser procedureFieldParser(GenerativeClient generativeClient, DocSyncProperties properties) {
        return new ProcedureFieldParser(generativeClient, properties.getGemini().getParseModel());
    }

    @Bean
    public ContentTransformer contentTransformer(OcrService ocrService, DocSyncProperties properties) {
        PdfExtractor pdfExtractor = new PdfExtractor(ocrService);
        SlideDeckConverter converter = new SlideDeckConverter(
                properties.getConverter().getSofficeBinary(), properties.getConverter().getTimeout());
        return new ContentTransformer(List.of(
                new StructuredRecordExtractor(),
                pdfExtractor,
                new SlideDeckExtractor(converter, pdfExtractor),
                new SpreadsheetExtractor()));
    }

    @Bean
    public ChangeDetector changeDetector() {
        return new ChangeDetector();
    }

    @Bean
    public SyncEngine syncEngine(RemoteSourceClient remoteSourceClient, HybridVectorStore hybridVectorStore,
                                 ChangeDetector changeDetector, DocSyncProperties properties, Clock clock) {
        return new SyncEngine(remoteSourceClient, hybridVectorStore, changeDetector,
                ZoneId.of(properties.getTimezone()), clock);
    }

    @Bean
    public PipelineRegistry pipelineRegistry(DocSyncProperties properties, ProcedureFieldParser procedureFieldParser,
                                             SyncEngine syncEngine, RemoteSourceClient remoteSourceClient,
                                             ContentTransformer contentTransformer, HybridEmbedder hybridEmbedder,
                                             HybridVectorStore hybridVectorStore, Clock clock) {
        Map<ContentDomain, RecordMapper> mappers = new EnumMap<>(ContentDomain.class);
        mappers.put(ContentDomain.PROCEDURE, new ProcedureRecordMapper(procedureFieldParser));
        mappers.put(ContentDomain.REGULATION, new RegulationRecordMapper());
        mappers.put(ContentDomain.CASE, new CaseRecordMapper());
        mappers.put(ContentDomain.DOCUMENT_PAGE, new DocumentPageRecordMapper());

        List<PipelineOrchestrator> orchestrators = new ArrayList<>();
        for (DocSyncProperties.PipelineConfig pipeline : properties.getPipelines()) {
            DomainDefinition definition = toDefinition(pipeline);
            orchestrators.add(new PipelineOrchestrator(definition, mappers.get(definition.domain()), syncEngine,
                    remoteSourceClient, contentTransformer, hybridEmbedder, hybridVectorStore, clock));
            log.info("Configured pipeline {}: {} -> {} ({}, extensions={})", definition.name(),
                    definition.folderPath(), definition.collection(), definition.domain(), definition.extensions());
        }
        if (orchestrators.isEmpty()) {
            log.warn("No pipelines configured under naag.docsync.pipelines");
        }
        return new PipelineRegistry(orchestrators);
    }

    static DomainDefinition toDefinition(DocSyncProperties.PipelineConfig pipeline) {
        if (pipeline.getDomain() == null) {
            throw new IllegalArgumentException("domain is required for pipeline " + pipeline.getName());
        }
        Set<String> extensions = new LinkedHashSet<>(pipeline.getExtensions());
        if (extensions.isEmpty()) {
            extensions.addAll(pipeline.getDomain().defaultExtensions());
        }
        return new DomainDefinition(
                pipeline.getName(),
                pipeline.getDomain(),
                pipeline.getFolderPath(),
                pipeline.getCollection(),
                extensions,
                pipeline.getBatchSize(),
                pipeline.getLookback(),
                pipeline.getOcrPolicy(),
                pipeline.getWorkers(),
                pipeline.getFileTimeout());
    }
}
