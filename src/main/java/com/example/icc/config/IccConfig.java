package com.example.icc.config;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.concurrent.CancellableCall;
import com.example.icc.service.ApplauseService;
import com.example.icc.service.ApplauseSettings;
import com.example.icc.service.NotifyService;
import com.example.icc.store.IccStore;
import com.example.icc.store.StoreReadiness;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class IccConfig {

    private static final Logger logger = LoggerFactory.getLogger(IccConfig.class);

    /**
     * Workers for long-poll receives and the blocking store calls behind them. Unbounded,
     * since a cancelled receive keeps its store call running for up to one read slice.
     */
    @Bean(name = "iccExecutor", destroyMethod = "shutdownNow")
    public ExecutorService iccExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "icc-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Template for the icc stream: string keys and field names, payloads kept as raw bytes.
     */
    @Bean(name = "iccStreamTemplate")
    @ConditionalOnProperty(name = "icc.store", havingValue = "redis", matchIfMissing = true)
    public RedisTemplate<String, byte[]> iccStreamTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setHashKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashValueSerializer(RedisSerializer.byteArray());
        return template;
    }

    @Bean
    public CancellableCall cancellableCall(ExecutorService iccExecutor) {
        return new CancellableCall(iccExecutor);
    }

    @Bean
    public ApplauseSettings applauseSettings(Environment environment) {
        return new PropertyApplauseSettings(environment);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NotifyService notifyService(IccStore store, CancellableCall cancellableCall, ObjectMapper objectMapper) {
        CancelSignal shutdown = new CancelSignal();
        Thread hook = new Thread(shutdown::cancel, "icc-store-wait-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            if (!new StoreReadiness(store, Duration.ofMillis(500)).waitForReady(shutdown)) {
                throw new IllegalStateException("store did not become ready");
            }
        } finally {
            removeHook(hook);
        }
        return new NotifyService(store, cancellableCall, objectMapper);
    }

    @Bean
    public ApplauseService applauseService(IccStore store,
                                           ApplauseSettings applauseSettings,
                                           @Value("${icc.applause.retention:PT5M}") Duration retention,
                                           Clock clock,
                                           ObjectMapper objectMapper) {
        Duration interval = applauseSettings.applauseInterval();
        if (retention.compareTo(interval) < 0) {
            logger.warn("Applause retention {} is shorter than the interval {}; pruning uses the interval", retention, interval);
        }
        return new ApplauseService(store, applauseSettings, retention, clock, objectMapper);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // the JVM is already shutting down
            logger.debug("Shutdown in progress, keeping store wait hook");
        }
    }
}
