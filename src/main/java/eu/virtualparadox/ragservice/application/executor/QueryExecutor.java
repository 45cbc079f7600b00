package eu.virtualparadox.ragservice.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs the embed-and-search part of a query so callers can wait on it with a timeout.
 */
public class QueryExecutor extends ThreadPoolTaskExecutor {
}
