package de.conciso.torrentbridge.watcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Stream;

import de.conciso.torrentbridge.ActivityLogWriter;
import de.conciso.torrentbridge.api.ActionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Polls the torrent directory for {@code .torrent} and {@code .magnet} files and hands each
 * new file to the {@link DescriptorDispatcher} once its size and modification time were
 * unchanged across two consecutive scans.
 *
 * <p>Dispatched files are moved to {@code processed/} on success and to {@code error/} on
 * failure, and their names are recorded in {@code processed/.processed-files}.
 */
@Service
public class FolderWatcher {

    private static final Logger log = LoggerFactory.getLogger(FolderWatcher.class);

    static final String PROCESSED_DIR = "processed";
    static final String ERROR_DIR = "error";
    static final String PROCESSED_LIST = ".processed-files";

    private final WatcherSettingsStore settingsStore;
    private final DescriptorDispatcher dispatcher;
    private final ActivityLogWriter activityLog;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private ScheduledFuture<?> scanTask;
    private Path torrentDir;
    private ProcessedFileStore processed;
    private Map<String, FileSnapshot> previousScan = new HashMap<>();
    /** Names handed to the dispatcher and not archived yet. */
    private final Set<String> inFlight = new HashSet<>();
    private Instant lastScan;
    private int dispatchedCount;

    public record WatcherStatus(boolean running, String torrentDir, String downloadDir, long intervalSeconds,
                                Instant lastScan, int dispatched) {}

    private record FileSnapshot(long size, long lastModified) {}

    public FolderWatcher(
            WatcherSettingsStore settingsStore,
            DescriptorDispatcher dispatcher,
            ActivityLogWriter activityLog,
            TaskScheduler taskScheduler,
            Clock clock) {
        this.settingsStore = settingsStore;
        this.dispatcher = dispatcher;
        this.activityLog = activityLog;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        WatcherSettings settings = settingsStore.current();
        if (settings.autoStart() && settings.hasTorrentDir()) {
            log.info("Auto-starting folder watcher on {}", settings.torrentDir());
            try {
                start(settings.torrentDir(), settings.downloadDir());
            } catch (IllegalArgumentException e) {
                log.error("Folder watcher auto-start failed: {}", e.getMessage());
            }
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Starts watching {@code torrentDirectory}, creating it when missing. A running watcher is
     * restarted with the new directories.
     *
     * @throws IllegalArgumentException if a directory is blank or cannot be created
     */
    public synchronized void start(String torrentDirectory, String downloadDirectory) {
        if (torrentDirectory == null || torrentDirectory.isBlank()) {
            throw new IllegalArgumentException("torrent_dir is required");
        }
        String downloads = downloadDirectory == null || downloadDirectory.isBlank()
                ? settingsStore.current().downloadDir() : downloadDirectory;
        Path dir = Path.of(torrentDirectory).toAbsolutePath();
        try {
            Files.createDirectories(dir);
            Files.createDirectories(dir.resolve(PROCESSED_DIR));
            Files.createDirectories(dir.resolve(ERROR_DIR));
            Files.createDirectories(Path.of(downloads));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot prepare watcher directories: " + e.getMessage(), e);
        }

        stopTask();
        WatcherSettings settings = settingsStore.current().withDirectories(torrentDirectory, downloads);
        try {
            settingsStore.save(settings);
        } catch (IOException e) {
            log.warn("Failed to persist watcher configuration: {}", e.getMessage());
        }

        torrentDir = dir;
        processed = new ProcessedFileStore(dir.resolve(PROCESSED_DIR).resolve(PROCESSED_LIST));
        previousScan = new HashMap<>();
        Duration interval = Duration.ofSeconds(Math.max(1, settings.intervalSeconds()));
        scanTask = taskScheduler.scheduleWithFixedDelay(this::poll, interval);
        log.info("Watching {} every {}s, downloads go to {}", dir, interval.toSeconds(), downloads);
        activityLog.record("WATCHER_START", null, dir.toString());
    }

    public synchronized void stop() {
        if (scanTask == null) {
            return;
        }
        stopTask();
        log.info("Stopped watching {}", torrentDir);
        activityLog.record("WATCHER_STOP", null, String.valueOf(torrentDir));
    }

    private void stopTask() {
        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
        }
    }

    public synchronized boolean isRunning() {
        return scanTask != null;
    }

    public synchronized WatcherStatus status() {
        WatcherSettings settings = settingsStore.current();
        return new WatcherStatus(isRunning(), settings.torrentDir(), settings.downloadDir(),
                settings.intervalSeconds(), lastScan, dispatchedCount);
    }

    // ── Polling ─────────────────────────────────────────────────────────

    /**
     * One scan cycle. Runs on the scheduler. Stable files are picked under the monitor and
     * dispatched after releasing it, so status and listing calls never wait on the cloud store.
     */
    public void poll() {
        List<Path> stable = new ArrayList<>();
        Path dir;
        ProcessedFileStore store;
        synchronized (this) {
            if (torrentDir == null) {
                return;
            }
            dir = torrentDir;
            store = processed;
            log.debug("Scanning {}", dir);
            Map<String, FileSnapshot> current = new HashMap<>();
            for (Path file : listCandidates()) {
                String name = file.getFileName().toString();
                try {
                    FileSnapshot snapshot = new FileSnapshot(Files.size(file), Files.getLastModifiedTime(file).toMillis());
                    if (snapshot.equals(previousScan.get(name))) {
                        inFlight.add(name);
                        stable.add(file);
                    } else {
                        log.debug("Waiting for {} to become stable", name);
                        current.put(name, snapshot);
                    }
                } catch (IOException e) {
                    log.error("Failed to inspect {}: {}", name, e.getMessage());
                }
            }
            previousScan = current;
            lastScan = clock.instant();
        }

        for (Path file : stable) {
            try {
                dispatchAndArchive(file, dir, store);
            } catch (RuntimeException e) {
                log.error("Failed to process {}: {}", file.getFileName(), e.getMessage());
            }
        }
    }

    /** Descriptor files that are present but not dispatched yet. */
    public synchronized List<WatchedFile> scan() {
        List<WatchedFile> result = new ArrayList<>();
        if (torrentDir == null) {
            return result;
        }
        for (Path file : listCandidates()) {
            try {
                result.add(new WatchedFile(file.getFileName().toString(), file.toString(),
                        Files.size(file), Files.getLastModifiedTime(file).toInstant()));
            } catch (IOException e) {
                log.warn("Could not stat {}: {}", file, e.getMessage());
            }
        }
        return result;
    }

    /** Dispatches one file immediately, skipping the stability check. */
    public ActionResult upload(String path) {
        Path file;
        Path dir;
        ProcessedFileStore store;
        synchronized (this) {
            ActionResult rejected = checkInWatchedDir(path);
            if (rejected != null) {
                return rejected;
            }
            file = Path.of(path).toAbsolutePath().normalize();
            String name = file.getFileName().toString();
            if (TorrentDescriptor.Kind.of(name) == null) {
                return ActionResult.of(ActionResult.Outcome.INVALID_STATE, "Not a .torrent or .magnet file: " + name);
            }
            if (!inFlight.add(name)) {
                return ActionResult.of(ActionResult.Outcome.INVALID_STATE, name + " is already being submitted");
            }
            previousScan.remove(name);
            dir = torrentDir;
            store = processed;
        }
        return dispatchAndArchive(file, dir, store);
    }

    public synchronized ActionResult deleteFile(String path) {
        ActionResult rejected = checkInWatchedDir(path);
        if (rejected != null) {
            return rejected;
        }
        Path file = Path.of(path).toAbsolutePath().normalize();
        if (inFlight.contains(file.getFileName().toString())) {
            return ActionResult.of(ActionResult.Outcome.INVALID_STATE, file.getFileName() + " is being submitted");
        }
        try {
            Files.delete(file);
        } catch (IOException e) {
            return ActionResult.of(ActionResult.Outcome.FAILED, "Cannot delete " + file.getFileName() + ": " + e.getMessage());
        }
        previousScan.remove(file.getFileName().toString());
        log.info("DELETE: {}", file);
        activityLog.record("DELETE_FILE", file.getFileName().toString(), null);
        return ActionResult.ok("Deleted " + file.getFileName());
    }

    private ActionResult checkInWatchedDir(String path) {
        if (torrentDir == null) {
            return ActionResult.of(ActionResult.Outcome.INVALID_STATE, "Watcher has no torrent directory");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        Path file = Path.of(path).toAbsolutePath().normalize();
        if (!torrentDir.equals(file.getParent())) {
            return ActionResult.of(ActionResult.Outcome.INVALID_STATE, file + " is not inside " + torrentDir);
        }
        if (!Files.isRegularFile(file)) {
            return ActionResult.of(ActionResult.Outcome.NOT_FOUND, "No such file: " + file.getFileName());
        }
        return null;
    }

    /** Submits outside the monitor, then archives and records the outcome under it. */
    private ActionResult dispatchAndArchive(Path file, Path dir, ProcessedFileStore store) {
        String name = file.getFileName().toString();
        ActionResult result;
        try {
            result = dispatcher.dispatch(TorrentDescriptor.of(file, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Dispatch of {} failed unexpectedly", name, e);
            result = ActionResult.of(ActionResult.Outcome.FAILED, e.getMessage());
        }

        synchronized (this) {
            try {
                String targetDir = result.isOk() ? PROCESSED_DIR : ERROR_DIR;
                try {
                    Path target = archive(file, dir.resolve(targetDir));
                    log.info("{}: {} -> {}", result.isOk() ? "UPLOAD" : "FAILED", name, target);
                } catch (IOException e) {
                    log.error("Could not move {} to {}/: {}", name, targetDir, e.getMessage());
                }
                store.add(name);
                if (result.isOk()) {
                    dispatchedCount++;
                } else {
                    activityLog.record("UPLOAD_FAILED", name, result.message());
                }
            } finally {
                inFlight.remove(name);
            }
        }
        return result;
    }

    /** Moves {@code file} into {@code dir}, appending {@code -1}, {@code -2}, ... to the base name on collision. */
    static Path archive(Path file, Path dir) throws IOException {
        Files.createDirectories(dir);
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        Path target = dir.resolve(name);
        for (int i = 1; Files.exists(target); i++) {
            target = dir.resolve(base + "-" + i + extension);
        }
        return Files.move(file, target, StandardCopyOption.ATOMIC_MOVE);
    }

    private List<Path> listCandidates() {
        try (Stream<Path> files = Files.list(torrentDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> TorrentDescriptor.Kind.of(p.getFileName().toString()) != null)
                    .filter(p -> !processed.contains(p.getFileName().toString()))
                    .filter(p -> !inFlight.contains(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.error("Listing failed for {}: {}", torrentDir, e.getMessage());
            return List.of();
        }
    }
}
