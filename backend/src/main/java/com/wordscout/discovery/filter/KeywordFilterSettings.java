package com.wordscout.discovery.filter;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.config.InvalidConfigException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validated filter configuration. Built through {@link Builder}, which rejects bad values at the
 * moment they are set.
 */
public final class KeywordFilterSettings {
    private static final int REGEX_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final int minCount;
    private final int minWords;
    private final int maxWords;
    private final Pattern includePattern;
    private final Pattern excludePattern;
    private final List<String> excludedSubstrings;
    private final List<String> minusPhrases;
    private final MinusWordMode minusWordMode;

    private KeywordFilterSettings(Builder builder) {
        this.minCount = builder.minCount;
        this.minWords = builder.minWords;
        this.maxWords = builder.maxWords;
        this.includePattern = builder.includePattern;
        this.excludePattern = builder.excludePattern;
        this.excludedSubstrings = List.copyOf(builder.excludedSubstrings);
        this.minusPhrases = List.copyOf(builder.minusPhrases);
        this.minusWordMode = builder.minusWordMode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static KeywordFilterSettings defaults() {
        return builder().build();
    }

    public static KeywordFilterSettings from(DiscoveryProperties.Filter properties) {
        return builder()
            .minCount(properties.getMinCount())
            .wordRange(properties.getMinWords(), properties.getMaxWords())
            .includePattern(properties.getIncludePattern())
            .excludePattern(properties.getExcludePattern())
            .excludedSubstrings(splitList(properties.getExcludeSubstrings()))
            .minusPhrases(splitList(properties.getMinusWords()))
            .minusWordMode(properties.getMinusWordMode())
            .build();
    }

    /**
     * Splits user-entered list text on commas and newlines, trimming entries and dropping blanks.
     */
    public static List<String> splitList(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return values;
        }
        for (String part : raw.split("[,\\r\\n]+")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    public int minCount() {
        return minCount;
    }

    public int minWords() {
        return minWords;
    }

    public int maxWords() {
        return maxWords;
    }

    public Pattern includePattern() {
        return includePattern;
    }

    public Pattern excludePattern() {
        return excludePattern;
    }

    public List<String> excludedSubstrings() {
        return excludedSubstrings;
    }

    public List<String> minusPhrases() {
        return minusPhrases;
    }

    public MinusWordMode minusWordMode() {
        return minusWordMode;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.minCount = minCount;
        builder.minWords = minWords;
        builder.maxWords = maxWords;
        builder.includePattern = includePattern;
        builder.excludePattern = excludePattern;
        builder.excludedSubstrings.addAll(excludedSubstrings);
        builder.minusPhrases.addAll(minusPhrases);
        builder.minusWordMode = minusWordMode;
        return builder;
    }

    public static final class Builder {
        private int minCount = 1;
        private int minWords = 1;
        private int maxWords = 10;
        private Pattern includePattern;
        private Pattern excludePattern;
        private final Set<String> excludedSubstrings = new LinkedHashSet<>();
        private final Set<String> minusPhrases = new LinkedHashSet<>();
        private MinusWordMode minusWordMode = MinusWordMode.ANY;

        private Builder() {
        }

        public Builder minCount(int value) {
            if (value < 1) {
                throw new InvalidConfigException("minCount must be >= 1: " + value);
            }
            this.minCount = value;
            return this;
        }

        public Builder wordRange(int min, int max) {
            if (min < 1 || max < min) {
                throw new InvalidConfigException("word range must satisfy 1 <= min <= max: " + min + ".." + max);
            }
            this.minWords = min;
            this.maxWords = max;
            return this;
        }

        public Builder includePattern(String regex) {
            this.includePattern = compile("include", regex);
            return this;
        }

        public Builder excludePattern(String regex) {
            this.excludePattern = compile("exclude", regex);
            return this;
        }

        public Builder excludedSubstrings(Collection<String> values) {
            excludedSubstrings.clear();
            if (values != null) {
                for (String value : values) {
                    if (value != null && !value.isBlank()) {
                        excludedSubstrings.add(value.trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
            return this;
        }

        public Builder minusPhrases(Collection<String> values) {
            minusPhrases.clear();
            if (values != null) {
                for (String value : values) {
                    if (value != null && !value.isBlank()) {
                        minusPhrases.add(value.trim());
                    }
                }
            }
            return this;
        }

        public Builder minusWordMode(MinusWordMode mode) {
            this.minusWordMode = mode == null ? MinusWordMode.ANY : mode;
            return this;
        }

        public KeywordFilterSettings build() {
            return new KeywordFilterSettings(this);
        }

        private static Pattern compile(String label, String regex) {
            if (regex == null || regex.isBlank()) {
                return null;
            }
            try {
                return Pattern.compile(regex.trim(), REGEX_FLAGS);
            } catch (PatternSyntaxException e) {
                throw new InvalidConfigException("invalid " + label + " pattern '" + regex + "': " + e.getDescription(), e);
            }
        }
    }
}
