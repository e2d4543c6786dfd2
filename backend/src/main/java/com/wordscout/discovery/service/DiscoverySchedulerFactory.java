package com.wordscout.discovery.service;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.discovery.cache.ResponseCache;
import com.wordscout.discovery.client.SuggestionClient;
import com.wordscout.discovery.filter.KeywordFilter;
import com.wordscout.discovery.filter.KeywordFilterSettings;
import com.wordscout.discovery.model.DiscoveryRunRequest;
import com.wordscout.discovery.nlp.GeoTokenCleaner;
import com.wordscout.discovery.nlp.PhraseNormalizer;
import com.wordscout.discovery.ratelimit.RateLimiter;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds a configured {@link DiscoveryScheduler} per run from the application defaults and the
 * request's overrides. The rate limiter is shared so quotas hold across runs.
 */
@Component
public class DiscoverySchedulerFactory {
    private final SuggestionClient client;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final PhraseNormalizer normalizer;
    private final GeoTokenCleaner geoCleaner;
    private final DiscoveryProperties properties;
    private final Clock clock;

    public DiscoverySchedulerFactory(
        SuggestionClient client,
        ResponseCache cache,
        RateLimiter rateLimiter,
        PhraseNormalizer normalizer,
        GeoTokenCleaner geoCleaner,
        DiscoveryProperties properties,
        Clock clock
    ) {
        this.client = client;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.normalizer = normalizer;
        this.geoCleaner = geoCleaner;
        this.properties = properties;
        this.clock = clock;
    }

    public DiscoveryScheduler create(DiscoveryRunRequest request) {
        DiscoveryRunRequest safeRequest = request == null ? DiscoveryRunRequest.defaults() : request;
        SchedulerSettings settings = SchedulerSettings.from(properties);
        if (safeRequest.cacheMode() != null) {
            settings = settings.withCacheMode(safeRequest.cacheMode());
        }
        KeywordFilter filter = new KeywordFilter(normalizer, filterSettings(safeRequest));
        DiscoveryScheduler scheduler = new DiscoveryScheduler(
            client,
            cache,
            rateLimiter,
            normalizer,
            filter,
            geoCleaner,
            settings,
            Sleeper.system(),
            clock
        );
        scheduler.configure(parameters(safeRequest));
        return scheduler;
    }

    DiscoveryParameters parameters(DiscoveryRunRequest request) {
        DiscoveryParameters defaults = DiscoveryParameters.from(properties.getScheduler());
        return new DiscoveryParameters(
            request.maxDepth() == null ? defaults.maxDepth() : request.maxDepth(),
            request.topN() == null ? defaults.topN() : request.topN(),
            request.phrasesPerCall() == null ? defaults.phrasesPerCall() : request.phrasesPerCall(),
            request.device() == null ? defaults.device() : request.device(),
            request.regions() == null ? defaults.regions() : request.regions(),
            request.geoMode() == null ? defaults.geoMode() : request.geoMode(),
            request.expandFilteredPhrases() == null ? defaults.expandFilteredPhrases() : request.expandFilteredPhrases()
        );
    }

    KeywordFilterSettings filterSettings(DiscoveryRunRequest request) {
        KeywordFilterSettings defaults = KeywordFilterSettings.from(properties.getFilter());
        KeywordFilterSettings.Builder builder = defaults.toBuilder();
        if (request.minCount() != null) {
            builder.minCount(request.minCount());
        }
        if (request.minWords() != null || request.maxWords() != null) {
            builder.wordRange(
                request.minWords() == null ? defaults.minWords() : request.minWords(),
                request.maxWords() == null ? defaults.maxWords() : request.maxWords()
            );
        }
        if (request.includePattern() != null) {
            builder.includePattern(request.includePattern());
        }
        if (request.excludePattern() != null) {
            builder.excludePattern(request.excludePattern());
        }
        if (request.excludeSubstrings() != null) {
            builder.excludedSubstrings(KeywordFilterSettings.splitList(request.excludeSubstrings()));
        }
        if (request.minusWords() != null) {
            builder.minusPhrases(KeywordFilterSettings.splitList(request.minusWords()));
        }
        if (request.minusWordMode() != null) {
            builder.minusWordMode(request.minusWordMode());
        }
        return builder.build();
    }
}
