package com.trippy.server.config;

import com.trippy.common.properties.RecommendProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 三路打分并行执行使用的线程池。
 *
 * 说明：
 * - 队列打满时由调用线程自己执行，排序请求不会因为线程池饱和而失败；
 * - 通过 TaskDecorator 透传 MDC，打分线程的日志同样带 traceId。
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RecommendExecutorConfig {

    private final RecommendProperties recommendProperties;

    @Bean(name = "recommendScoringExecutor")
    public ThreadPoolTaskExecutor recommendScoringExecutor() {
        int threads = Math.max(1, recommendProperties.getScoringThreads());
        log.info("创建推荐打分线程池: threads={}", threads);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 50);
        executor.setThreadNamePrefix("recommend-score-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    private TaskDecorator mdcTaskDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
