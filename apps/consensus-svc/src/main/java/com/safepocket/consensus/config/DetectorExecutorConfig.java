package com.safepocket.consensus.config;

import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.execution.ExecutionHarness;
import com.safepocket.consensus.normalize.ResultNormalizer;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class DetectorExecutorConfig {

    /**
     * Worker pool shared by all detector runs. Rejected submissions surface as failed results, never caller-runs.
     */
    @Bean
    public ThreadPoolTaskExecutor detectorTaskExecutor(ConsensusProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.parallelism());
        executor.setMaxPoolSize(properties.parallelism());
        executor.setQueueCapacity(100);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("detector-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setTaskDecorator(DetectorExecutorConfig::withCallerMdc);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Cancels detectors on their own deadline while the harness waits on other detectors.
     */
    @Bean
    public ThreadPoolTaskScheduler detectorWatchdog() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("detector-watchdog-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    static Runnable withCallerMdc(Runnable task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }

    @Bean
    public ExecutionHarness executionHarness(
            @Qualifier("detectorTaskExecutor") ThreadPoolTaskExecutor detectorTaskExecutor,
            @Qualifier("detectorWatchdog") ThreadPoolTaskScheduler detectorWatchdog,
            DependencyProbe dependencyProbe,
            ResultNormalizer resultNormalizer,
            ConsensusProperties properties
    ) {
        return new ExecutionHarness(detectorTaskExecutor, detectorWatchdog, dependencyProbe, resultNormalizer, properties.runTimeout());
    }
}
