package de.conciso.torrentbridge.auth;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

import de.conciso.torrentbridge.api.ApiError;
import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.cloud.CloudClient;
import de.conciso.torrentbridge.cloud.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands out a usable access token, refreshing it when it is about to expire.
 *
 * <p>At most one refresh is in flight; callers arriving during a refresh wait for it and
 * then reuse its outcome.
 */
@Component
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private final TokenStore tokenStore;
    private final CloudClient cloudClient;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile Credential credential;
    private volatile boolean loaded;

    public TokenManager(TokenStore tokenStore, CloudClient cloudClient, Clock clock) {
        this.tokenStore = tokenStore;
        this.cloudClient = cloudClient;
        this.clock = clock;
    }

    public ApiResult<Credential> currentCredential() {
        Credential current = cached();
        if (current == null) {
            return ApiResult.failure(ApiError.Kind.UNAUTHENTICATED, "Not logged in to cloud store");
        }
        if (tokenStore.isValid(current, clock.instant())) {
            return ApiResult.ok(current);
        }

        refreshLock.lock();
        try {
            // another thread may have refreshed while we waited
            current = credential;
            if (current == null) {
                return ApiResult.failure(ApiError.Kind.UNAUTHENTICATED, "Not logged in to cloud store");
            }
            if (tokenStore.isValid(current, clock.instant())) {
                return ApiResult.ok(current);
            }
            return refresh(current);
        } finally {
            refreshLock.unlock();
        }
    }

    private ApiResult<Credential> refresh(Credential expiring) {
        log.info("Cloud access token expires at {}, refreshing", expiring.expiresAt());
        ApiResult<Credential> result = cloudClient.refresh(expiring);
        if (result.isOk()) {
            credential = result.value();
            try {
                tokenStore.save(result.value());
            } catch (IOException e) {
                // the server may have rotated the refresh token, so the new one stays in memory
                log.error("Refreshed cloud credential could not be saved, it is lost on restart: {}", e.getMessage());
            }
            return result;
        }
        if (result.hasError(ApiError.Kind.UNAUTHENTICATED)) {
            log.warn("Refresh token rejected, login required: {}", result.error().message());
            credential = null;
            tokenStore.clear();
            return result;
        }
        // the old token may still be usable inside the safety margin
        if (expiring.isValidAt(clock.instant(), Duration.ZERO)) {
            log.warn("Token refresh failed ({}), using current token until it expires", result.error());
            return ApiResult.ok(expiring);
        }
        log.error("Token refresh failed: {}", result.error());
        return result;
    }

    /**
     * Saves the credential of a device-flow login and makes it current. Nothing changes when
     * the save fails.
     *
     * @throws IOException if the credentials file cannot be written
     */
    public void store(Credential newCredential) throws IOException {
        refreshLock.lock();
        try {
            tokenStore.save(newCredential);
            credential = newCredential;
            loaded = true;
        } finally {
            refreshLock.unlock();
        }
    }

    public boolean isAuthenticated() {
        Credential current = cached();
        return current != null && (tokenStore.isValid(current, clock.instant()) || current.canRefresh());
    }

    public void logout() {
        refreshLock.lock();
        try {
            credential = null;
            loaded = true;
            tokenStore.clear();
            log.info("Logged out of cloud store");
        } finally {
            refreshLock.unlock();
        }
    }

    private Credential cached() {
        if (!loaded) {
            refreshLock.lock();
            try {
                if (!loaded) {
                    credential = tokenStore.load().orElse(null);
                    loaded = true;
                }
            } finally {
                refreshLock.unlock();
            }
        }
        return credential;
    }
}
