package com.wordscout.discovery.model;

public enum FailureKind {
    QUOTA_EXCEEDED,
    RETRIES_EXHAUSTED,
    CLIENT_ERROR,
    FATAL,
    UNEXPECTED
}
