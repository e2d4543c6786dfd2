package com.wordscout.discovery.model;

import java.time.Instant;

public record ProgressEvent(Type type, ProgressSnapshot snapshot, Instant emittedAt) {
    public enum Type {
        SNAPSHOT,
        AUTOSAVE,
        FINISHED
    }
}
