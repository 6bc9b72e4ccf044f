package com.naag.docsync.config;

import com.naag.docsync.metrics.IngestionMetrics;
import com.naag.docsync.pipeline.PipelineRegistry;
import com.naag.docsync.scheduler.IngestionScheduler;
import com.naag.docsync.service.RunHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class IngestionSchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestionSchedulerConfig.class);

    private final ApplicationContext applicationContext;

    public IngestionSchedulerConfig(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Bean
    public ThreadPoolTaskScheduler ingestionTaskScheduler(PipelineRegistry pipelineRegistry) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // one thread per pipeline so a long run never delays another pipeline's tick
        scheduler.setPoolSize(Math.max(1, pipelineRegistry.names().size()));
        scheduler.setThreadNamePrefix("docsync-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor manualRunExecutor(PipelineRegistry pipelineRegistry) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int pipelines = Math.max(1, pipelineRegistry.names().size());
        executor.setCorePoolSize(pipelines);
        executor.setMaxPoolSize(pipelines * 2);
        // locks already cap one run per pipeline
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("docsync-manual-");
        return executor;
    }

    @Bean(destroyMethod = "stop")
    public IngestionScheduler ingestionScheduler(PipelineRegistry pipelineRegistry,
                                                 ThreadPoolTaskScheduler ingestionTaskScheduler,
                                                 ThreadPoolTaskExecutor manualRunExecutor,
                                                 RunHistoryService runHistoryService,
                                                 IngestionMetrics ingestionMetrics,
                                                 DocSyncProperties properties, Clock clock) {
        DocSyncProperties.SchedulerConfig scheduler = properties.getScheduler();
        return new IngestionScheduler(pipelineRegistry, ingestionTaskScheduler, manualRunExecutor,
                runHistoryService, ingestionMetrics, clock, scheduler.getInterval(), scheduler.getStagger());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startScheduler() {
        DocSyncProperties properties = applicationContext.getBean(DocSyncProperties.class);
        if (!properties.getScheduler().isEnabled()) {
            log.info("Ingestion scheduler disabled; pipelines run only on manual trigger");
            return;
        }
        applicationContext.getBean(IngestionScheduler.class).start();
    }
}
