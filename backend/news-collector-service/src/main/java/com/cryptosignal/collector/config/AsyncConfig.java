package com.cryptosignal.collector.config;

import com.cryptosignal.collector.service.fetch.FetchWorkerPool;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 피드 수집 전용 실행자. 동시 실행 수는 FetchWorkerPool 의 게이트가 제한한다.
     * 거부 정책은 기본값(AbortPolicy)이며, 거부된 작업은 FetchWorkerPool 이 실패 결과로 바꾼다.
     */
    @Bean(name = "feedFetchExecutor")
    public ThreadPoolTaskExecutor feedFetchExecutor(FetcherProperties fetcherProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetcherProperties.getWorkers());
        executor.setMaxPoolSize(fetcherProperties.getWorkers());
        executor.setThreadNamePrefix("feed-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public FetchWorkerPool fetchWorkerPool(@Qualifier("feedFetchExecutor") ThreadPoolTaskExecutor feedFetchExecutor,
                                           FetcherProperties fetcherProperties) {
        return new FetchWorkerPool(feedFetchExecutor,
                fetcherProperties.getWorkers(),
                fetcherProperties.getMaxRetries(),
                fetcherProperties.getRetryBackoff());
    }
}
