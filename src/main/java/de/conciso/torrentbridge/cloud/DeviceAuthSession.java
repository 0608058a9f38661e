package de.conciso.torrentbridge.cloud;

import java.time.Duration;
import java.time.Instant;

/**
 * One running OAuth2 device-flow login. Lives in memory only.
 */
public record DeviceAuthSession(
        String deviceCode,
        String userCode,
        String verificationUri,
        Duration interval,
        Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public DeviceAuthSession withInterval(Duration newInterval) {
        return new DeviceAuthSession(deviceCode, userCode, verificationUri, newInterval, expiresAt);
    }
}
