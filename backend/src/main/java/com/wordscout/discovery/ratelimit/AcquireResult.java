package com.wordscout.discovery.ratelimit;

/**
 * Answer of the rate limiter. When {@code granted} is false, {@code rejectedBy} names the window
 * that refused the last attempt.
 */
public record AcquireResult(boolean granted, QuotaWindow rejectedBy, String reason, boolean timedOut) {
    private static final AcquireResult GRANTED = new AcquireResult(true, null, "ok", false);

    public static AcquireResult grant() {
        return GRANTED;
    }

    public static AcquireResult rejected(QuotaWindow window, String reason) {
        return new AcquireResult(false, window, reason, false);
    }

    public static AcquireResult timedOut(AcquireResult lastRejection) {
        String last = lastRejection == null ? "no attempt" : lastRejection.reason();
        QuotaWindow window = lastRejection == null ? null : lastRejection.rejectedBy();
        return new AcquireResult(false, window, "acquire timeout; last rejection: " + last, true);
    }
}
