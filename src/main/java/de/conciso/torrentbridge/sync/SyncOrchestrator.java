package de.conciso.torrentbridge.sync;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

import de.conciso.torrentbridge.ActivityLogWriter;
import de.conciso.torrentbridge.api.ActionResult;
import de.conciso.torrentbridge.api.ActionResult.Outcome;
import de.conciso.torrentbridge.api.ApiError;
import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.auth.TokenManager;
import de.conciso.torrentbridge.cloud.CloudClient;
import de.conciso.torrentbridge.cloud.CloudFile;
import de.conciso.torrentbridge.cloud.CloudTransfer;
import de.conciso.torrentbridge.cloud.Credential;
import de.conciso.torrentbridge.library.ImportResult;
import de.conciso.torrentbridge.library.LibraryClient;
import de.conciso.torrentbridge.watcher.DescriptorDispatcher;
import de.conciso.torrentbridge.watcher.TorrentDescriptor;
import de.conciso.torrentbridge.watcher.WatcherSettingsStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Drives transfers from submission to library import.
 *
 * <p>A reconciliation loop pulls the cloud store's transfer list, diffs it into the
 * {@link TransferTracker} and starts a fetch job for every completed transfer. A fetch job
 * downloads all files of the transfer into {@code <download dir>/<title>/}, asks the library
 * manager to import them and archives the transfer.
 *
 * <p>Failed fetches are retried on the next cycles up to {@code max-fetch-retries}; disk
 * failures put the transfer into error immediately.
 */
@Service
public class SyncOrchestrator implements DescriptorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");

    private final CloudClient cloudClient;
    private final LibraryClient libraryClient;
    private final TokenManager tokenManager;
    private final TransferTracker tracker;
    private final WatcherSettingsStore watcherSettings;
    private final ActivityLogWriter activityLog;
    private final TaskScheduler taskScheduler;
    private final Executor fetchExecutor;
    private final Duration reconcileInterval;
    private final int maxFetchRetries;

    /** transfer id → running fetch */
    private final Map<String, FetchJob> fetchJobs = new ConcurrentHashMap<>();
    private ScheduledFuture<?> reconcileTask;

    private record FetchJob(AtomicBoolean cancelled) {
        FetchJob() { this(new AtomicBoolean()); }
    }

    public SyncOrchestrator(
            CloudClient cloudClient,
            LibraryClient libraryClient,
            TokenManager tokenManager,
            TransferTracker tracker,
            WatcherSettingsStore watcherSettings,
            ActivityLogWriter activityLog,
            TaskScheduler taskScheduler,
            @Qualifier("fetchExecutor") Executor fetchExecutor,
            @Value("${torrentbridge.sync.reconcile-interval-seconds:15}") long reconcileIntervalSeconds,
            @Value("${torrentbridge.sync.max-fetch-retries:5}") int maxFetchRetries) {
        this.cloudClient = cloudClient;
        this.libraryClient = libraryClient;
        this.tokenManager = tokenManager;
        this.tracker = tracker;
        this.watcherSettings = watcherSettings;
        this.activityLog = activityLog;
        this.taskScheduler = taskScheduler;
        this.fetchExecutor = fetchExecutor;
        this.reconcileInterval = Duration.ofSeconds(reconcileIntervalSeconds);
        this.maxFetchRetries = maxFetchRetries;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (reconcileTask == null) {
            reconcileTask = taskScheduler.scheduleWithFixedDelay(this::reconcileSafely, reconcileInterval);
            log.info("Reconciling transfers every {}s", reconcileInterval.toSeconds());
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (reconcileTask != null) {
            reconcileTask.cancel(false);
            reconcileTask = null;
        }
        fetchJobs.values().forEach(job -> job.cancelled().set(true));
    }

    // ── Submission ──────────────────────────────────────────────────────

    @Override
    public ActionResult dispatch(TorrentDescriptor descriptor) {
        return submit(descriptor);
    }

    public ActionResult submit(TorrentDescriptor descriptor) {
        return submit(descriptor.title(), null, credential -> cloudClient.submit(descriptor, credential));
    }

    /** Submits a magnet link or torrent URL entered on the dashboard. */
    public ActionResult submitUrl(String title, String url, Long seriesId) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (title.indexOf('/') >= 0) {
            // titles address transfers in /downloads/{title}
            throw new IllegalArgumentException("title must not contain '/'");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("download_url is required");
        }
        return submit(title.trim(), seriesId, credential -> cloudClient.submitUrl(title.trim(), url.trim(), credential));
    }

    private interface Submission {
        ApiResult<String> send(Credential credential);
    }

    private ActionResult submit(String title, Long seriesId, Submission submission) {
        ApiResult<Credential> credential = tokenManager.currentCredential();
        if (!credential.isOk()) {
            return ActionResult.fromError(credential.error());
        }
        if (!tracker.reserve(title)) {
            log.warn("Rejecting duplicate submission of {}", title);
            return ActionResult.of(Outcome.DUPLICATE, "A transfer named '" + title + "' is already tracked");
        }
        try {
            ApiResult<String> result = submission.send(credential.value());
            if (!result.isOk()) {
                activityLog.record("SUBMIT_FAILED", title, result.error().toString());
                return ActionResult.fromError(result.error());
            }
            Transfer transfer = tracker.register(title, result.value(), seriesId);
            activityLog.record("UPLOAD", title, "cloud_id=" + transfer.cloudId());
            return ActionResult.ok("Submitted " + title);
        } finally {
            tracker.release(title);
        }
    }

    // ── Reconciliation ──────────────────────────────────────────────────

    private void reconcileSafely() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            log.error("Reconciliation cycle failed", e);
        }
    }

    /** One reconciliation cycle. */
    public void reconcile() {
        if (tracker.hasReconcilable()) {
            ApiResult<Credential> credential = tokenManager.currentCredential();
            if (!credential.isOk()) {
                log.debug("Skipping reconciliation: {}", credential.error());
                return;
            }
            ApiResult<List<CloudTransfer>> snapshot = cloudClient.listTransfers(credential.value());
            if (!snapshot.isOk()) {
                log.warn("Could not list cloud transfers: {}", snapshot.error());
                return;
            }
            for (Transfer changed : tracker.applySnapshot(snapshot.value())) {
                if (changed.status() == TransferStatus.COMPLETED) {
                    activityLog.record("COMPLETED", changed.title(), null);
                } else if (changed.status() == TransferStatus.ERROR) {
                    activityLog.record("ERROR", changed.title(), changed.error());
                }
            }
        }

        for (Transfer transfer : tracker.list()) {
            if (transfer.status() == TransferStatus.COMPLETED) {
                startFetch(transfer);
            }
        }
    }

    // ── Fetch ───────────────────────────────────────────────────────────

    private boolean startFetch(Transfer transfer) {
        var job = new FetchJob();
        if (fetchJobs.putIfAbsent(transfer.id(), job) != null) {
            return false;
        }
        log.info("Fetching {}", transfer.title());
        CompletableFuture.runAsync(() -> {
            try {
                runFetch(transfer, job);
            } catch (RuntimeException e) {
                log.error("Fetch of {} failed unexpectedly", transfer.title(), e);
            } finally {
                fetchJobs.remove(transfer.id(), job);
            }
        }, fetchExecutor);
        return true;
    }

    private void runFetch(Transfer transfer, FetchJob job) {
        ApiResult<Credential> credential = tokenManager.currentCredential();
        if (!credential.isOk()) {
            log.warn("Cannot fetch {}: {}", transfer.title(), credential.error());
            return;
        }

        ApiResult<List<CloudFile>> files = cloudClient.listFiles(transfer.cloudId(), credential.value());
        if (!files.isOk()) {
            handleFetchError(transfer, files.error());
            return;
        }

        Path directory = downloadDirectory(transfer.title());
        for (CloudFile file : files.value()) {
            if (job.cancelled().get()) {
                return;
            }
            Path destination = directory.resolve(sanitize(Path.of(file.name()).getFileName().toString()));
            ApiResult<Path> fetched = cloudClient.fetch(file.downloadUrl(), destination, credential.value(),
                    job.cancelled()::get);
            if (!fetched.isOk()) {
                handleFetchError(transfer, fetched.error());
                return;
            }
        }
        if (job.cancelled().get()) {
            return;
        }

        activityLog.record("FETCHED", transfer.title(), files.value().size() + " file(s) to " + directory);
        notifyLibrary(transfer.title(), directory);
        tracker.markImported(transfer.id())
                .ifPresent(t -> activityLog.record("IMPORTED", t.title(), null));
    }

    private void handleFetchError(Transfer transfer, ApiError error) {
        switch (error.kind()) {
            case CANCELLED -> log.info("Fetch of {} cancelled", transfer.title());
            case UNAUTHENTICATED -> log.warn("Fetch of {} deferred until login: {}", transfer.title(), error.message());
            case LOCAL_IO, NOT_FOUND -> {
                log.error("Fetch of {} failed: {}", transfer.title(), error);
                tracker.fail(transfer.id(), error.message())
                        .ifPresent(t -> activityLog.record("ERROR", t.title(), t.error()));
            }
            default -> {
                Optional<Transfer> updated = tracker.recordFetchFailure(transfer.id(), maxFetchRetries);
                updated.ifPresent(t -> {
                    if (t.status() == TransferStatus.ERROR) {
                        log.error("Fetch of {} failed {} times, giving up: {}", t.title(), t.retryCount(), error);
                        activityLog.record("ERROR", t.title(), t.error() + ": " + error.message());
                    } else {
                        log.warn("Fetch of {} failed (attempt {}/{}): {}", t.title(), t.retryCount(), maxFetchRetries, error);
                    }
                });
            }
        }
    }

    private ApiResult<ImportResult> notifyLibrary(String title, Path directory) {
        ApiResult<ImportResult> result = libraryClient.triggerImport(directory, title);
        if (!result.isOk()) {
            activityLog.record("IMPORT_FAILED", title, result.error().message());
        } else if (!result.value().skipped()) {
            activityLog.record("IMPORT", title, "command=" + result.value().commandId());
        }
        return result;
    }

    // ── User actions ────────────────────────────────────────────────────

    public List<Transfer> transfers() {
        return tracker.list();
    }

    public List<Transfer> archivedTransfers() {
        return tracker.archived();
    }

    public ActionResult pause(String title) {
        return control(title, TransferStatus.DOWNLOADING, TransferStatus.PAUSED, cloudClient::pause);
    }

    public ActionResult resume(String title) {
        return control(title, TransferStatus.PAUSED, TransferStatus.DOWNLOADING, cloudClient::resume);
    }

    private interface CloudAction {
        ApiResult<Void> apply(String cloudId, Credential credential);
    }

    private ActionResult control(String title, TransferStatus required, TransferStatus next, CloudAction action) {
        Optional<Transfer> found = tracker.findByTitle(title);
        if (found.isEmpty()) {
            return notFound(title);
        }
        Transfer transfer = found.get();
        if (transfer.status() != required) {
            return invalidState(transfer);
        }
        ApiResult<Credential> credential = tokenManager.currentCredential();
        if (!credential.isOk()) {
            return ActionResult.fromError(credential.error());
        }
        ApiResult<Void> result = action.apply(transfer.cloudId(), credential.value());
        if (!result.isOk()) {
            return ActionResult.fromError(result.error());
        }
        if (tracker.transition(transfer.id(), next).isEmpty()) {
            return ActionResult.of(Outcome.INVALID_STATE, "Transfer '" + title + "' changed state meanwhile");
        }
        activityLog.record(next == TransferStatus.PAUSED ? "PAUSE" : "RESUME", title, null);
        return ActionResult.ok(title + " is " + next.label());
    }

    /**
     * Removes a transfer locally and from the cloud store. A running fetch is cancelled and
     * its partial file removed. A transfer the cloud store no longer knows counts as deleted.
     */
    public ActionResult delete(String title) {
        Optional<Transfer> found = tracker.findByTitle(title);
        if (found.isEmpty()) {
            return notFound(title);
        }
        Transfer transfer = found.get();
        FetchJob job = fetchJobs.get(transfer.id());
        if (job != null) {
            job.cancelled().set(true);
            log.info("Cancelled running fetch of {}", title);
        }

        if (transfer.cloudId() != null && transfer.status() != TransferStatus.IMPORTED) {
            ApiResult<Credential> credential = tokenManager.currentCredential();
            if (!credential.isOk()) {
                return ActionResult.fromError(credential.error());
            }
            ApiResult<Void> result = cloudClient.delete(transfer.cloudId(), credential.value());
            if (!result.isOk() && !result.hasError(ApiError.Kind.NOT_FOUND)) {
                return ActionResult.fromError(result.error());
            }
        }
        tracker.remove(transfer.id());
        activityLog.record("DELETE", title, null);
        return ActionResult.ok("Deleted " + title);
    }

    /** Starts the fetch pipeline for a completed or imported transfer right away. */
    public ActionResult manualDownload(String title) {
        Optional<Transfer> found = tracker.findByTitle(title);
        if (found.isEmpty()) {
            return notFound(title);
        }
        Transfer transfer = found.get();
        if (transfer.status() != TransferStatus.COMPLETED && transfer.status() != TransferStatus.IMPORTED) {
            return invalidState(transfer);
        }
        if (!startFetch(transfer)) {
            return ActionResult.of(Outcome.INVALID_STATE, "Fetch of '" + title + "' is already running");
        }
        return ActionResult.ok("Download of " + title + " started");
    }

    public ActionResult notify(String title) {
        Optional<Transfer> found = tracker.findByTitle(title);
        if (found.isEmpty()) {
            return notFound(title);
        }
        Transfer transfer = found.get();
        if (transfer.status() != TransferStatus.COMPLETED && transfer.status() != TransferStatus.IMPORTED) {
            return invalidState(transfer);
        }
        ApiResult<ImportResult> result = notifyLibrary(title, downloadDirectory(title));
        if (!result.isOk()) {
            return ActionResult.fromError(result.error());
        }
        return ActionResult.ok(result.value().skipped()
                ? "No library manager configured"
                : "Library import of " + title + " triggered");
    }

    public ActionResult retry(String title) {
        Optional<Transfer> found = tracker.findByTitle(title);
        if (found.isEmpty()) {
            return notFound(title);
        }
        Transfer transfer = found.get();
        if (transfer.status() != TransferStatus.ERROR) {
            return invalidState(transfer);
        }
        if (tracker.retry(transfer.id()).isEmpty()) {
            return invalidState(transfer);
        }
        activityLog.record("RETRY", title, null);
        return ActionResult.ok(title + " queued again");
    }

    boolean isFetching(String transferId) {
        return fetchJobs.containsKey(transferId);
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    Path downloadDirectory(String title) {
        return Path.of(watcherSettings.current().downloadDir()).resolve(sanitize(title));
    }

    /** Makes {@code name} safe as a single path segment. */
    static String sanitize(String name) {
        String cleaned = UNSAFE_CHARS.matcher(name).replaceAll("_").trim();
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        return cleaned.isBlank() ? "download" : cleaned;
    }

    private static ActionResult notFound(String title) {
        return ActionResult.of(Outcome.NOT_FOUND, "No transfer named '" + title + "'");
    }

    private static ActionResult invalidState(Transfer transfer) {
        return ActionResult.of(Outcome.INVALID_STATE,
                "Transfer '" + transfer.title() + "' is " + transfer.status().label());
    }
}
