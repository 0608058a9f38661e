package de.conciso.torrentbridge.cloud;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 credential for the cloud store.
 *
 * @param expiresAt absolute expiry of the access token
 */
public record Credential(String accessToken, String refreshToken, Instant expiresAt) {

    /** True iff the access token stays valid for longer than {@code margin} after {@code now}. */
    public boolean isValidAt(Instant now, Duration margin) {
        return accessToken != null && expiresAt != null && expiresAt.isAfter(now.plus(margin));
    }

    public boolean canRefresh() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "Credential[expiresAt=" + expiresAt + ", refreshable=" + canRefresh() + "]";
    }
}
