package com.wordscout.discovery.nlp;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.ru.RussianAnalyzer;
import org.apache.lucene.analysis.ru.RussianLightStemFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical text form for phrases. Every comparison, deduplication key and cache key in the
 * discovery engine goes through {@link #normalize(String)}.
 *
 * <p>Thread-safe. The stemming analyzer is built on first use and shared afterwards.
 */
public class PhraseNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PhraseNormalizer.class);

    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{Nd}_\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    static final List<String> RUSSIAN_FUNCTION_WORDS = List.of(
        "и", "в", "на", "с", "по", "за", "к", "от", "до", "для",
        "как", "что", "который", "где", "когда", "почему", "зачем",
        "а", "но", "или", "ни", "если", "то", "чтобы", "так",
        "не", "нет", "да", "это", "быть", "иметь",
        "мы", "вы", "они", "вас", "нас", "них", "ему", "ей",
        "его", "её", "их", "мне", "тебе", "себе", "нему",
        "которой", "которым", "которых",
        "при", "между", "среди", "перед", "после", "через",
        "без", "вне", "вокруг", "вдоль", "вверх", "вниз",
        "т", "е", "б", "пр", "др"
    );

    private final CharArraySet stopWords;
    private volatile Analyzer analyzer;

    public PhraseNormalizer() {
        this(List.of());
    }

    public PhraseNormalizer(Collection<String> extraStopWords) {
        CharArraySet words = new CharArraySet(256, false);
        words.addAll(RUSSIAN_FUNCTION_WORDS);
        words.addAll(RussianAnalyzer.getDefaultStopSet());
        words.addAll(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
        if (extraStopWords != null) {
            for (String extra : extraStopWords) {
                String normalized = normalize(extra);
                if (!normalized.isEmpty()) {
                    words.add(normalized);
                }
            }
        }
        this.stopWords = CharArraySet.unmodifiableSet(words);
    }

    /**
     * Lower-cases, drops every character that is not a letter, digit, underscore, whitespace or
     * hyphen, collapses whitespace and trims. Never fails; {@code null} yields an empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String cleaned = DISALLOWED.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    public int wordCount(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return 0;
        }
        return normalized.split(" ").length;
    }

    public List<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }

    /**
     * Base forms of the content words of {@code text}: function words are removed and each
     * remaining token is stemmed. A token the analyzer cannot handle is kept as-is.
     */
    public Set<String> baseFormSet(String text) {
        Set<String> forms = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (stopWords.contains(token)) {
                continue;
            }
            forms.add(baseForm(token));
        }
        return forms;
    }

    public boolean isStopWord(String token) {
        return token != null && stopWords.contains(normalize(token));
    }

    String baseForm(String token) {
        try (TokenStream stream = analyzer().tokenStream("phrase", token)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            String stemmed = stream.incrementToken() ? term.toString() : token;
            stream.end();
            return stemmed.isEmpty() ? token : stemmed;
        } catch (IOException | RuntimeException e) {
            log.debug("Stemming failed for token '{}': {}", token, e.toString());
            return token;
        }
    }

    private Analyzer analyzer() {
        Analyzer current = analyzer;
        if (current == null) {
            synchronized (this) {
                current = analyzer;
                if (current == null) {
                    current = new StemmingAnalyzer();
                    analyzer = current;
                    log.debug("Stemming analyzer initialized ({} stop words)", stopWords.size());
                }
            }
        }
        return current;
    }

    private static final class StemmingAnalyzer extends Analyzer {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            Tokenizer source = new WhitespaceTokenizer();
            TokenStream result = new RussianLightStemFilter(source);
            result = new PorterStemFilter(result);
            return new TokenStreamComponents(source, result);
        }
    }
}
