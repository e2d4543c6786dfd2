package com.wordscout.discovery.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects geographic words (cities, regions) inside normalized phrases and applies a
 * {@link GeoMode} to them.
 */
public class GeoTokenCleaner {
    private static final Logger log = LoggerFactory.getLogger(GeoTokenCleaner.class);

    public static final List<String> DEFAULT_GEO_KEYWORDS = List.of(
        "москва", "спб", "санкт-петербург", "казань", "екатеринбург",
        "новосибирск", "воронеж", "пермь", "краснодар", "ростов",
        "самара", "уфа", "челябинск", "омск", "волгоград",
        "нижний новгород", "тверь", "ярославль", "рязань", "белгород",
        "тула", "липецк", "смоленск", "брянск", "курск",
        "россия", "российский", "российской", "российское", "российском",
        "регион", "область", "край", "округ", "район"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PhraseNormalizer normalizer;
    private final Map<String, Pattern> patterns;

    public GeoTokenCleaner(PhraseNormalizer normalizer, Collection<String> geoKeywords) {
        this.normalizer = normalizer;
        Collection<String> source = geoKeywords == null || geoKeywords.isEmpty() ? DEFAULT_GEO_KEYWORDS : geoKeywords;
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (String keyword : source) {
            String normalized = normalizer.normalize(keyword);
            if (normalized.isEmpty() || compiled.containsKey(normalized)) {
                continue;
            }
            // Word boundaries: letters, digits, underscore and hyphen belong to a word.
            compiled.put(
                normalized,
                Pattern.compile("(?<![\\p{L}\\p{Nd}_-])" + Pattern.quote(normalized) + "(?![\\p{L}\\p{Nd}_-])")
            );
        }
        this.patterns = Map.copyOf(compiled);
        log.info("Geo vocabulary loaded ({} keywords)", compiled.size());
    }

    public int vocabularySize() {
        return patterns.size();
    }

    public List<String> detect(String phrase) {
        String normalized = normalizer.normalize(phrase);
        List<String> found = new ArrayList<>();
        if (normalized.isEmpty()) {
            return found;
        }
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(normalized).find()) {
                found.add(entry.getKey());
            }
        }
        found.sort(null);
        return found;
    }

    public boolean hasGeo(String phrase) {
        return !detect(phrase).isEmpty();
    }

    public GeoResult apply(String phrase, GeoMode mode) {
        String normalized = normalizer.normalize(phrase);
        if (mode == null || mode == GeoMode.OFF) {
            return new GeoResult(normalized, List.of());
        }
        List<String> found = detect(normalized);
        if (mode == GeoMode.EXTRACT) {
            if (found.isEmpty()) {
                log.debug("No geo tokens in '{}', dropped", normalized);
                return new GeoResult(null, List.of());
            }
            return new GeoResult(normalized, found);
        }

        String stripped = normalized;
        for (String token : found) {
            Matcher matcher = patterns.get(token).matcher(stripped);
            stripped = matcher.replaceAll(" ");
        }
        stripped = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        if (stripped.isEmpty()) {
            log.debug("Phrase '{}' consisted only of geo tokens, dropped", normalized);
            return new GeoResult(null, found);
        }
        return new GeoResult(stripped, found);
    }
}
