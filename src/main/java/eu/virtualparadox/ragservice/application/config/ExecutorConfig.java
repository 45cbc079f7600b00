package eu.virtualparadox.ragservice.application.config;

import eu.virtualparadox.ragservice.application.executor.IndexPollScheduler;
import eu.virtualparadox.ragservice.application.executor.QueryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    @Bean
    public IndexPollScheduler indexPollScheduler() {
        IndexPollScheduler scheduler = new IndexPollScheduler();
        scheduler.setPoolSize(1);           // ticks never overlap
        scheduler.setThreadNamePrefix("index-poll-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public QueryExecutor queryExecutor(final ApplicationConfig config) {
        QueryExecutor executor = new QueryExecutor();
        executor.setCorePoolSize(config.getQuery().getThreads());
        executor.setMaxPoolSize(config.getQuery().getThreads());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
