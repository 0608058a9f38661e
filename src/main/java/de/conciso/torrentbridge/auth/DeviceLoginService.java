package de.conciso.torrentbridge.auth;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import de.conciso.torrentbridge.api.ApiError;
import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.cloud.CloudClient;
import de.conciso.torrentbridge.cloud.DeviceAuthPoll;
import de.conciso.torrentbridge.cloud.DeviceAuthSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs the OAuth2 device-flow login in the background.
 *
 * <p>{@link #start()} asks the cloud store for a user code and schedules polls on the shared
 * {@link TaskScheduler} until the user approves, denies, or the session times out. Only one
 * session exists at a time; starting a new one cancels the previous one.
 */
@Service
public class DeviceLoginService {

    private static final Logger log = LoggerFactory.getLogger(DeviceLoginService.class);
    private static final Duration MAX_INTERVAL = Duration.ofSeconds(60);

    private final CloudClient cloudClient;
    private final TokenManager tokenManager;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration defaultInterval;
    private final Duration pollTimeout;

    private DeviceAuthSession session;
    private Instant deadline;
    private ScheduledFuture<?> pollTask;
    private LoginState state = LoginState.IDLE;
    private String lastError;
    /** Bumped by every start and cancel; answers for an older generation are dropped. */
    private long generation;

    public DeviceLoginService(
            CloudClient cloudClient,
            TokenManager tokenManager,
            TaskScheduler taskScheduler,
            Clock clock,
            @Value("${torrentbridge.auth.poll-interval-seconds:5}") long pollIntervalSeconds,
            @Value("${torrentbridge.auth.poll-timeout-seconds:300}") long pollTimeoutSeconds) {
        this.cloudClient = cloudClient;
        this.tokenManager = tokenManager;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.defaultInterval = Duration.ofSeconds(pollIntervalSeconds);
        this.pollTimeout = Duration.ofSeconds(pollTimeoutSeconds);
    }

    public ApiResult<DeviceAuthSession> start() {
        long attempt;
        synchronized (this) {
            cancel();
            attempt = ++generation;
        }
        ApiResult<DeviceAuthSession> result = cloudClient.startDeviceAuth();

        synchronized (this) {
            if (attempt != generation) {
                log.info("Device login start superseded by a newer request");
                return ApiResult.failure(ApiError.Kind.CANCELLED, "Login was cancelled or restarted");
            }
            if (!result.isOk()) {
                state = LoginState.FAILED;
                lastError = result.error().message();
                log.error("Device login could not be started: {}", result.error());
                return result;
            }

            DeviceAuthSession started = result.value();
            if (started.interval().compareTo(defaultInterval) < 0) {
                started = started.withInterval(defaultInterval);
            }
            Instant timeout = clock.instant().plus(pollTimeout);
            deadline = started.expiresAt().isBefore(timeout) ? started.expiresAt() : timeout;
            session = started;
            state = LoginState.PENDING;
            lastError = null;
            scheduleNextPoll();
            log.info("Device login pending, polling every {}s until {}", started.interval().toSeconds(), deadline);
            return ApiResult.ok(started);
        }
    }

    /**
     * Polls once for the current session. Runs on the scheduler, exposed for tests. The
     * monitor is released while the cloud store answers; an answer for a session that was
     * cancelled or replaced meanwhile is dropped.
     */
    LoginState pollOnce() {
        DeviceAuthSession polled;
        long attempt;
        synchronized (this) {
            if (session == null) {
                return state;
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Device login timed out");
                finish(LoginState.EXPIRED);
                return state;
            }
            polled = session;
            attempt = generation;
        }

        ApiResult<DeviceAuthPoll> result = cloudClient.pollDeviceAuth(polled);

        synchronized (this) {
            if (attempt != generation || session == null) {
                log.debug("Dropping device login answer for an abandoned session");
                return state;
            }
            apply(result);
            return state;
        }
    }

    private void apply(ApiResult<DeviceAuthPoll> result) {
        if (!result.isOk()) {
            if (result.error().isRetryable()) {
                log.warn("Device login poll failed, retrying: {}", result.error());
                scheduleNextPoll();
            } else {
                lastError = result.error().message();
                log.error("Device login failed: {}", result.error());
                finish(LoginState.FAILED);
            }
            return;
        }

        DeviceAuthPoll poll = result.value();
        switch (poll.state()) {
            case PENDING -> scheduleNextPoll();
            case SLOW_DOWN -> {
                Duration doubled = session.interval().multipliedBy(2);
                session = session.withInterval(doubled.compareTo(MAX_INTERVAL) > 0 ? MAX_INTERVAL : doubled);
                log.debug("Cloud store asked to slow down, poll interval now {}s", session.interval().toSeconds());
                scheduleNextPoll();
            }
            case APPROVED -> {
                try {
                    tokenManager.store(poll.credential());
                } catch (IOException e) {
                    lastError = "Login approved but the credential could not be saved: " + e.getMessage();
                    log.error("Device login approved, saving the credential failed: {}", e.getMessage());
                    finish(LoginState.FAILED);
                    return;
                }
                log.info("Device login approved");
                finish(LoginState.AUTHENTICATED);
            }
            case EXPIRED -> {
                log.warn("Device code expired before approval");
                finish(LoginState.EXPIRED);
            }
            case DENIED -> {
                log.warn("Device login denied by user");
                finish(LoginState.DENIED);
            }
        }
    }

    public synchronized void cancel() {
        generation++;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (session != null) {
            log.info("Cancelled device login session {}", session.userCode());
            session = null;
            state = LoginState.IDLE;
        }
    }

    public synchronized LoginState state() {
        if (session != null && !clock.instant().isBefore(deadline)) {
            finish(LoginState.EXPIRED);
        }
        return state;
    }

    public synchronized String lastError() {
        return lastError;
    }

    public synchronized DeviceAuthSession session() {
        return session;
    }

    private void finish(LoginState finalState) {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        session = null;
        deadline = null;
        state = finalState;
    }

    private void scheduleNextPoll() {
        long scheduledFor = generation;
        pollTask = taskScheduler.schedule(() -> {
            synchronized (this) {
                if (session == null || scheduledFor != generation) {
                    return;
                }
            }
            pollOnce();
        }, clock.instant().plus(session.interval()));
    }
}
