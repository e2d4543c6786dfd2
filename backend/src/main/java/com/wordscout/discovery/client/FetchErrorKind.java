package com.wordscout.discovery.client;

import java.util.Locale;

/**
 * Classification of a failed suggestion API call. The disposition drives the scheduler's retry
 * policy.
 */
public enum FetchErrorKind {
    TIMEOUT(Disposition.RETRY),
    AUTH_ERROR(Disposition.FATAL),
    RATE_LIMITED(Disposition.RETRY),
    SERVER_ERROR(Disposition.RETRY),
    CLIENT_ERROR(Disposition.SKIP),
    NETWORK_ERROR(Disposition.FATAL),
    UNKNOWN(Disposition.RETRY);

    public enum Disposition {
        RETRY,
        SKIP,
        FATAL
    }

    private final Disposition disposition;

    FetchErrorKind(Disposition disposition) {
        this.disposition = disposition;
    }

    public Disposition disposition() {
        return disposition;
    }

    public static FetchErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTH_ERROR;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 408 || status == 504) {
            return TIMEOUT;
        }
        if (status >= 500 && status < 600) {
            return SERVER_ERROR;
        }
        if (status >= 400 && status < 500) {
            return CLIENT_ERROR;
        }
        return UNKNOWN;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
