package com.wordscout.discovery.filter;

public record FilterDecision(boolean accepted, FilterRejection rejection, String detail) {
    private static final FilterDecision ACCEPTED = new FilterDecision(true, null, null);

    public static FilterDecision accept() {
        return ACCEPTED;
    }

    public static FilterDecision reject(FilterRejection rejection, String detail) {
        return new FilterDecision(false, rejection, detail);
    }

    public String describe() {
        return accepted ? "accepted" : rejection + ": " + detail;
    }
}
