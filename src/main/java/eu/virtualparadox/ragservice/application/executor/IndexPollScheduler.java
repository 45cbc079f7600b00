package eu.virtualparadox.ragservice.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single background thread driving the index poll loop.
 */
public class IndexPollScheduler extends ThreadPoolTaskScheduler {
}
