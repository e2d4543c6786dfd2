package com.wordscout.discovery.filter;

public enum FilterRejection {
    EMPTY_PHRASE,
    INVALID_COUNT,
    BELOW_MIN_COUNT,
    WORD_COUNT_OUT_OF_RANGE,
    INCLUDE_PATTERN_MISMATCH,
    EXCLUDE_PATTERN_MATCH,
    EXCLUDED_SUBSTRING,
    MINUS_WORD
}
