package com.shoplens.backend.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final AnalysisProperties analysisProperties;

    /**
     * Task executor running one analysis job per task. Sized by
     * {@code analysis.worker-pool-size} so the retrieval layer is not flooded.
     */
    @Bean
    public ThreadPoolTaskExecutor pipelineTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysisProperties.getWorkerPoolSize());
        executor.setMaxPoolSize(analysisProperties.getWorkerPoolSize());
        executor.setQueueCapacity(analysisProperties.getQueueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Pipeline-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Task executor for collaborator calls made inside a stage, so the job
     * task can wait on them with its remaining time budget
     */
    @Bean
    public ThreadPoolTaskExecutor stageTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysisProperties.getWorkerPoolSize());
        executor.setMaxPoolSize(analysisProperties.getWorkerPoolSize() * 2);
        executor.setQueueCapacity(analysisProperties.getQueueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Stage-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Task executor for general background tasks
     */
    @Bean
    public Executor generalTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("General-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.initialize();
        return executor;
    }
}
