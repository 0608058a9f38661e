package de.conciso.torrentbridge.cloud;

/**
 * Answer to a single device-flow poll.
 *
 * @param credential only set when {@code state} is {@link State#APPROVED}
 */
public record DeviceAuthPoll(State state, Credential credential) {

    public enum State { PENDING, SLOW_DOWN, APPROVED, EXPIRED, DENIED }

    public static DeviceAuthPoll approved(Credential credential) {
        return new DeviceAuthPoll(State.APPROVED, credential);
    }

    public static DeviceAuthPoll of(State state) {
        return new DeviceAuthPoll(state, null);
    }
}
