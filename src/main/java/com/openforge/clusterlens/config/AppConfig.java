package com.openforge.clusterlens.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - investigationExecutor   → runs investigation loops and push-feed readers off the HTTP threads
 *  - phaseThrottleScheduler  → single timer thread shared by every PhaseThrottler
 *  - Java HttpClient         → the only HTTP engine for both the model endpoint and the agent feed
 *  - Jackson ObjectMapper    → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - KubernetesClient        → fabric8 client resolved from the local kubeconfig / in-cluster config
 */
@Configuration
public class AppConfig {

    /**
     * Unbounded cached pool: each investigation turn and each open push feed
     * holds one thread for its whole lifetime, mostly parked on I/O.
     * Primary because the throttle scheduler is an ExecutorService as well.
     */
    @Primary
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService investigationExecutor() {
        return Executors.newCachedThreadPool(namedThreads("investigation-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService phaseThrottleScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("phase-throttle-"));
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout so an unreachable model endpoint fails fast;
     * per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(ExecutorService investigationExecutor) {
        return HttpClient.newBuilder()
                .executor(investigationExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON and the agent feed:
     *  - snake_case property names (max_tokens, final_response …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        return new KubernetesClientBuilder().build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
