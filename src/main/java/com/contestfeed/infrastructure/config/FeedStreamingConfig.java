package com.contestfeed.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Async request handling for the event feed.
 *
 * <p>Every feed session keeps one thread for as long as the client stays connected, so the
 * pool hands out a new thread per session instead of queueing sessions behind open ones.
 */
@Configuration
public class FeedStreamingConfig implements WebMvcConfigurer, DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(FeedStreamingConfig.class);

    private final ThreadPoolTaskExecutor streamExecutor;

    public FeedStreamingConfig(
            @Value("${feed.core-sessions:8}") int coreSessions,
            @Value("${feed.max-sessions:1000}") int maxSessions) {
        this.streamExecutor = createStreamExecutor(coreSessions, maxSessions);
        logger.info("Event feed executor ready: up to {} concurrent sessions", maxSessions);
    }

    static ThreadPoolTaskExecutor createStreamExecutor(int coreSessions, int maxSessions) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("feed-stream-");
        executor.setCorePoolSize(Math.min(coreSessions, maxSessions));
        executor.setMaxPoolSize(maxSessions);
        // Zero capacity: a session beyond the core size gets a fresh thread, or is rejected at the limit
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    ThreadPoolTaskExecutor getStreamExecutor() {
        return streamExecutor;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamExecutor);
    }

    @Override
    public void destroy() {
        streamExecutor.shutdown();
    }
}
