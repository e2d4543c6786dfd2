package com.wordscout.discovery.model;

public record DiscoveryRunResponse(String status, int queuedTasks, String statusUrl) {
}
