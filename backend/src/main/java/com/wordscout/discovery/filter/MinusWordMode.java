package com.wordscout.discovery.filter;

public enum MinusWordMode {
    /** Reject when the phrase shares any base form with a minus phrase. */
    ANY,
    /** Reject only when the phrase contains every base form of a minus phrase. */
    ALL
}
