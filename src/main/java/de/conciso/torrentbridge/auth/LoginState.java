package de.conciso.torrentbridge.auth;

import java.util.Locale;

/** State of the device-flow login as reported to the dashboard. */
public enum LoginState {
    IDLE,
    PENDING,
    AUTHENTICATED,
    EXPIRED,
    DENIED,
    FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
