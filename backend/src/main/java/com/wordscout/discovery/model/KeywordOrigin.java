package com.wordscout.discovery.model;

public enum KeywordOrigin {
    API,
    CACHE
}
