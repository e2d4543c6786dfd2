package com.wordscout.discovery.client;

import com.wordscout.discovery.model.SuggestionResponse;

/**
 * Result of one suggestion API call: either a response or an error kind, never both.
 */
public record FetchOutcome(
    SuggestionResponse response,
    FetchErrorKind errorKind,
    int statusCode,
    String message
) {
    public static FetchOutcome success(SuggestionResponse response) {
        return new FetchOutcome(response, null, response.statusCode(), null);
    }

    public static FetchOutcome failure(FetchErrorKind errorKind, int statusCode, String message) {
        return new FetchOutcome(null, errorKind, statusCode, message);
    }

    public boolean isSuccess() {
        return errorKind == null && response != null;
    }

    public String describe() {
        if (isSuccess()) {
            return "ok";
        }
        String base = "[" + errorKind.code() + "]";
        if (statusCode > 0) {
            base += " HTTP " + statusCode;
        }
        return message == null || message.isBlank() ? base : base + ": " + message;
    }
}
