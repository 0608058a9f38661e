package de.conciso.torrentbridge.api;

/**
 * Classified failure of a call against the cloud store, the library manager or the local disk.
 */
public record ApiError(Kind kind, String message) {

    public enum Kind {
        /** Token invalid or expired and refresh failed, re-login required. */
        UNAUTHENTICATED,
        RATE_LIMITED,
        /** Stale identifier, e.g. transfer deleted cloud-side out of band. */
        NOT_FOUND,
        /** Network failure, timeout or 5xx. Worth retrying. */
        TRANSIENT,
        /** 4xx other than auth, or a response that does not match the expected schema. */
        PERMANENT,
        /** Disk full, permission denied and the like. */
        LOCAL_IO,
        CANCELLED
    }

    public static ApiError of(Kind kind, String message) {
        return new ApiError(kind, message);
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT || kind == Kind.RATE_LIMITED;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
