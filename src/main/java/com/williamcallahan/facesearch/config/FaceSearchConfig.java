package com.williamcallahan.facesearch.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.facesearch.service.BatchPause;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the HTTP client, executors and time sources used by the face search pipeline.
 */
@Configuration
public class FaceSearchConfig {

    /**
     * RestTemplate shared by the recognition backends and the image loader.
     *
     * @param restTemplateBuilder Boot-configured builder
     * @param appProperties application configuration providing connect and read timeouts
     * @return RestTemplate with bounded timeouts
     */
    @Bean
    public RestTemplate faceProviderRestTemplate(RestTemplateBuilder restTemplateBuilder, AppProperties appProperties) {
        AppProperties.Http http = appProperties.getHttp();
        return restTemplateBuilder
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .build();
    }

    /**
     * Bounded pool for per-candidate search work.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService faceSearchExecutor(AppProperties appProperties) {
        return Executors.newFixedThreadPool(
                appProperties.getSearch().getConcurrency(),
                new ThreadFactoryBuilder().setNameFormat("face-search-%d").setDaemon(true).build());
    }

    /**
     * Pool sized to one regeneration batch.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService faceRegenerationExecutor(AppProperties appProperties) {
        return Executors.newFixedThreadPool(
                appProperties.getRegeneration().getBatchSize(),
                new ThreadFactoryBuilder().setNameFormat("face-regeneration-%d").setDaemon(true).build());
    }

    @Bean
    public BatchPause regenerationBatchPause() {
        return delay -> Thread.sleep(delay.toMillis());
    }

    @Bean
    public Clock faceSearchClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Ticker providerCacheTicker() {
        return Ticker.systemTicker();
    }
}
