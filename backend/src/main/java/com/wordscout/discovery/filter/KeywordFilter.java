package com.wordscout.discovery.filter;

import com.wordscout.discovery.nlp.PhraseNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Ordered keyword filter. Checks run from cheapest to most expensive and the first failing check
 * decides the rejection.
 *
 * <p>Immutable once built; safe to share between threads.
 */
public class KeywordFilter {
    private static final Logger log = LoggerFactory.getLogger(KeywordFilter.class);

    private final PhraseNormalizer normalizer;
    private final KeywordFilterSettings settings;
    private final List<MinusPhrase> minusPhrases;

    public KeywordFilter(PhraseNormalizer normalizer, KeywordFilterSettings settings) {
        this.normalizer = normalizer;
        this.settings = settings == null ? KeywordFilterSettings.defaults() : settings;
        List<MinusPhrase> resolved = new ArrayList<>();
        for (String raw : this.settings.minusPhrases()) {
            Set<String> forms = normalizer.baseFormSet(raw);
            if (!forms.isEmpty()) {
                resolved.add(new MinusPhrase(normalizer.normalize(raw), forms));
            }
        }
        this.minusPhrases = Collections.unmodifiableList(resolved);
        log.debug(
            "Keyword filter ready: minCount={} words={}..{} substrings={} minusPhrases={} mode={}",
            this.settings.minCount(),
            this.settings.minWords(),
            this.settings.maxWords(),
            this.settings.excludedSubstrings().size(),
            minusPhrases.size(),
            this.settings.minusWordMode()
        );
    }

    public KeywordFilterSettings settings() {
        return settings;
    }

    public FilterDecision apply(String phrase) {
        return apply(phrase, null);
    }

    /**
     * @param count search volume of the phrase, or {@code null} to skip the count checks
     */
    public FilterDecision apply(String phrase, Long count) {
        String normalized = normalizer.normalize(phrase);
        if (normalized.isEmpty()) {
            return FilterDecision.reject(FilterRejection.EMPTY_PHRASE, "phrase is empty after normalization");
        }

        if (count != null) {
            if (count < 0) {
                return FilterDecision.reject(FilterRejection.INVALID_COUNT, "count " + count + " is negative");
            }
            if (count < settings.minCount()) {
                return FilterDecision.reject(
                    FilterRejection.BELOW_MIN_COUNT,
                    "count " + count + " < minCount " + settings.minCount()
                );
            }
        }

        int words = normalized.split(" ").length;
        if (words < settings.minWords() || words > settings.maxWords()) {
            return FilterDecision.reject(
                FilterRejection.WORD_COUNT_OUT_OF_RANGE,
                words + " words, expected " + settings.minWords() + ".." + settings.maxWords()
            );
        }

        if (settings.includePattern() != null && !settings.includePattern().matcher(normalized).find()) {
            return FilterDecision.reject(
                FilterRejection.INCLUDE_PATTERN_MISMATCH,
                "does not match " + settings.includePattern().pattern()
            );
        }

        if (settings.excludePattern() != null && settings.excludePattern().matcher(normalized).find()) {
            return FilterDecision.reject(
                FilterRejection.EXCLUDE_PATTERN_MATCH,
                "matches " + settings.excludePattern().pattern()
            );
        }

        for (String substring : settings.excludedSubstrings()) {
            if (normalized.contains(substring)) {
                return FilterDecision.reject(FilterRejection.EXCLUDED_SUBSTRING, "contains '" + substring + "'");
            }
        }

        if (!minusPhrases.isEmpty()) {
            String hit = matchMinusPhrase(normalized);
            if (hit != null) {
                return FilterDecision.reject(FilterRejection.MINUS_WORD, "matches minus phrase '" + hit + "'");
            }
        }
        return FilterDecision.accept();
    }

    private String matchMinusPhrase(String normalized) {
        Set<String> phraseForms = normalizer.baseFormSet(normalized);
        if (phraseForms.isEmpty()) {
            return null;
        }
        for (MinusPhrase minus : minusPhrases) {
            boolean hit = settings.minusWordMode() == MinusWordMode.ALL
                ? phraseForms.containsAll(minus.forms())
                : !Collections.disjoint(phraseForms, minus.forms());
            if (hit) {
                return minus.text();
            }
        }
        return null;
    }

    private record MinusPhrase(String text, Set<String> forms) {
    }
}
