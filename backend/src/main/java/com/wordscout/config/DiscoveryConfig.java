package com.wordscout.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wordscout.discovery.nlp.GeoTokenCleaner;
import com.wordscout.discovery.nlp.PhraseNormalizer;
import com.wordscout.discovery.ratelimit.RateLimiter;
import com.wordscout.discovery.ratelimit.RateLimiterSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DiscoveryConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DiscoveryProperties properties) {
        int size = Math.max(4, properties.getScheduler().getWorkerCount() * 2);
        return Executors.newFixedThreadPool(size);
    }

    /**
     * One thread drives the active run, the other pumps its progress events.
     */
    @Bean(name = "discoveryRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService discoveryRunExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PhraseNormalizer phraseNormalizer(DiscoveryProperties properties) {
        return new PhraseNormalizer(properties.getNlp().getExtraStopWords());
    }

    @Bean
    public GeoTokenCleaner geoTokenCleaner(PhraseNormalizer normalizer, DiscoveryProperties properties) {
        return new GeoTokenCleaner(normalizer, properties.getNlp().getGeoKeywords());
    }

    @Bean
    public RateLimiter rateLimiter(DiscoveryProperties properties, Clock clock) {
        return new RateLimiter(RateLimiterSettings.from(properties.getRateLimit()), clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
