package de.conciso.torrentbridge.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.conciso.torrentbridge.cloud.CloudTransfer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Registry of known transfers, persisted to a JSON state file after every change.
 *
 * <p>All methods are synchronized and never perform network calls. Callers fetch data from
 * the cloud store first and then apply it here.
 *
 * <p>Imported transfers leave the active registry and are kept in a bounded archive history
 * for display.
 *
 * <p>State file format (JSON):
 * <pre>
 * {
 *   "transfers": [ { "id": "...", "title": "...", "status": "downloading", ... } ],
 *   "archive":   [ ... ]
 * }
 * </pre>
 */
@Component
public class TransferTracker {

    private static final Logger log = LoggerFactory.getLogger(TransferTracker.class);
    static final String MISSING_IN_CLOUD = "transfer no longer exists in cloud store";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Path stateFile;
    private final TitleMatching titleMatching;
    private final int archiveSize;
    private final Clock clock;

    private final Map<String, Transfer> transfers = new LinkedHashMap<>();
    private final Deque<Transfer> archive = new ArrayDeque<>();
    private final Set<String> reservedTitles = new HashSet<>();

    record PersistedState(List<Transfer> transfers, List<Transfer> archive) {}

    public TransferTracker(
            @Value("${torrentbridge.sync.state-file:data/transfers.json}") String stateFile,
            @Value("${torrentbridge.sync.title-matching:exact}") String titleMatching,
            @Value("${torrentbridge.sync.archive-size:50}") int archiveSize,
            Clock clock) {
        this.stateFile = Path.of(stateFile);
        this.titleMatching = TitleMatching.fromProperty(titleMatching);
        this.archiveSize = archiveSize;
        this.clock = clock;
        load();
    }

    private void load() {
        if (!Files.exists(stateFile)) {
            log.info("No transfer state file found at {}", stateFile);
            return;
        }
        try {
            PersistedState state = objectMapper.readValue(stateFile.toFile(), PersistedState.class);
            if (state.transfers() != null) {
                state.transfers().forEach(t -> transfers.put(t.id(), t));
            }
            if (state.archive() != null) {
                archive.addAll(state.archive());
            }
            log.info("Loaded {} transfer(s) and {} archived from {}", transfers.size(), archive.size(), stateFile);
        } catch (IOException e) {
            log.warn("Failed to load transfer state file: {}", e.getMessage());
        }
    }

    private void save() {
        try {
            Path parent = stateFile.getParent();
            if (parent != null) Files.createDirectories(parent);
            var state = new PersistedState(new ArrayList<>(transfers.values()), new ArrayList<>(archive));
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(stateFile.toFile(), state);
        } catch (IOException e) {
            log.warn("Failed to save transfer state file: {}", e.getMessage());
        }
    }

    // ── Registration ────────────────────────────────────────────────────

    /**
     * Claims {@code title} for a submission in progress. Returns {@code false} when a transfer
     * with that title is tracked or another submission holds the claim.
     */
    public synchronized boolean reserve(String title) {
        String key = titleMatching.key(title);
        if (findActive(title).isPresent() || reservedTitles.contains(key)) {
            return false;
        }
        reservedTitles.add(key);
        return true;
    }

    public synchronized void release(String title) {
        reservedTitles.remove(titleMatching.key(title));
    }

    /** Registers a freshly submitted transfer as queued and releases the title claim. */
    public synchronized Transfer register(String title, String cloudId, Long seriesId) {
        Instant now = clock.instant();
        var transfer = new Transfer(UUID.randomUUID().toString(), title, now, cloudId, TransferStatus.QUEUED,
                0, null, seriesId, null, 0, now);
        transfers.put(transfer.id(), transfer);
        reservedTitles.remove(titleMatching.key(title));
        save();
        return transfer;
    }

    // ── Queries ─────────────────────────────────────────────────────────

    public synchronized List<Transfer> list() {
        return List.copyOf(transfers.values());
    }

    /** Archived transfers, most recent first. */
    public synchronized List<Transfer> archived() {
        return List.copyOf(archive);
    }

    public synchronized Optional<Transfer> get(String id) {
        return Optional.ofNullable(transfers.get(id));
    }

    /** Looks up an active transfer first, then the archive. */
    public synchronized Optional<Transfer> findByTitle(String title) {
        Optional<Transfer> active = findActive(title);
        if (active.isPresent()) {
            return active;
        }
        String key = titleMatching.key(title);
        return archive.stream().filter(t -> titleMatching.key(t.title()).equals(key)).findFirst();
    }

    private Optional<Transfer> findActive(String title) {
        String key = titleMatching.key(title);
        return transfers.values().stream().filter(t -> titleMatching.key(t.title()).equals(key)).findFirst();
    }

    public synchronized boolean hasReconcilable() {
        return transfers.values().stream().anyMatch(t -> t.status().isReconciled());
    }

    // ── Mutations ───────────────────────────────────────────────────────

    /**
     * Diffs the cloud store's transfer list into the registry.
     *
     * @return transfers whose status changed
     */
    public synchronized List<Transfer> applySnapshot(List<CloudTransfer> snapshot) {
        Map<String, CloudTransfer> byCloudId = new LinkedHashMap<>();
        snapshot.forEach(c -> byCloudId.put(c.id(), c));
        Instant now = clock.instant();
        List<Transfer> changed = new ArrayList<>();
        boolean dirty = false;

        for (Transfer transfer : List.copyOf(transfers.values())) {
            if (!transfer.status().isReconciled() || transfer.cloudId() == null) {
                continue;
            }
            CloudTransfer cloud = byCloudId.get(transfer.cloudId());
            Transfer updated = cloud == null
                    ? transfer.withError(MISSING_IN_CLOUD, now)
                    : merge(transfer, cloud, now);
            if (updated.equals(transfer)) {
                continue;
            }
            transfers.put(updated.id(), updated);
            dirty = true;
            if (updated.status() != transfer.status()) {
                log.info("Transfer {}: {} -> {}", transfer.title(), transfer.status().label(), updated.status().label());
                changed.add(updated);
            }
        }
        if (dirty) {
            save();
        }
        return changed;
    }

    private Transfer merge(Transfer transfer, CloudTransfer cloud, Instant now) {
        TransferStatus next = cloud.status();
        if (next == TransferStatus.ERROR) {
            return transfer.withError(cloud.message() != null ? cloud.message() : "cloud store reported an error", now);
        }
        Transfer result = transfer;
        if (next != null && next != transfer.status()) {
            if (transfer.status().canTransitionTo(next)) {
                result = result.withStatus(next, now);
            } else {
                log.debug("Ignoring cloud status {} for {} in state {}", next.label(), transfer.title(), transfer.status().label());
            }
        }
        double progress = result.status() == TransferStatus.COMPLETED
                ? 1.0
                : Math.max(transfer.progress(), cloud.progress());
        if (progress != result.progress() || (cloud.size() != null && !cloud.size().equals(result.size()))) {
            result = result.withProgress(progress, cloud.size(), now);
        }
        return result;
    }

    /**
     * Moves a transfer to {@code next} if the lifecycle permits it.
     *
     * @return the updated transfer, or empty when the transfer is unknown or the transition is not allowed
     */
    public synchronized Optional<Transfer> transition(String id, TransferStatus next) {
        Transfer transfer = transfers.get(id);
        if (transfer == null || !transfer.status().canTransitionTo(next)) {
            return Optional.empty();
        }
        Transfer updated = transfer.withStatus(next, clock.instant());
        transfers.put(id, updated);
        save();
        return Optional.of(updated);
    }

    public synchronized Optional<Transfer> fail(String id, String reason) {
        Transfer transfer = transfers.get(id);
        if (transfer == null || !transfer.status().canTransitionTo(TransferStatus.ERROR)) {
            return Optional.empty();
        }
        Transfer updated = transfer.withError(reason, clock.instant());
        transfers.put(id, updated);
        save();
        return Optional.of(updated);
    }

    /**
     * Counts one failed fetch attempt. Once {@code maxRetries} attempts failed the transfer
     * moves to error with reason {@code fetch failed}.
     */
    public synchronized Optional<Transfer> recordFetchFailure(String id, int maxRetries) {
        Transfer transfer = transfers.get(id);
        if (transfer == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Transfer updated = transfer.withRetryCount(transfer.retryCount() + 1, now);
        if (updated.retryCount() >= maxRetries && updated.status().canTransitionTo(TransferStatus.ERROR)) {
            updated = updated.withError("fetch failed", now);
        }
        transfers.put(id, updated);
        save();
        return Optional.of(updated);
    }

    /** Puts an errored transfer back to queued with a reset retry count. */
    public synchronized Optional<Transfer> retry(String id) {
        Transfer transfer = transfers.get(id);
        if (transfer == null || transfer.status() != TransferStatus.ERROR) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Transfer updated = transfer.withStatus(TransferStatus.QUEUED, now).withRetryCount(0, now);
        transfers.put(id, updated);
        save();
        return Optional.of(updated);
    }

    /**
     * Marks a completed transfer imported and moves it into the archive. For a transfer that
     * is already archived only its timestamp is refreshed.
     */
    public synchronized Optional<Transfer> markImported(String id) {
        Instant now = clock.instant();
        Transfer transfer = transfers.get(id);
        if (transfer == null) {
            Optional<Transfer> archived = archive.stream().filter(t -> t.id().equals(id)).findFirst();
            archived.ifPresent(t -> {
                archive.remove(t);
                archive.addFirst(t.withStatus(TransferStatus.IMPORTED, now));
                save();
            });
            return archived;
        }
        if (!transfer.status().canTransitionTo(TransferStatus.IMPORTED)) {
            return Optional.empty();
        }
        Transfer imported = transfer.withStatus(TransferStatus.IMPORTED, now).withProgress(1.0, null, now);
        transfers.remove(id);
        archive.addFirst(imported);
        while (archive.size() > archiveSize) {
            archive.removeLast();
        }
        save();
        return Optional.of(imported);
    }

    /** Removes a transfer from the registry, or from the archive if it was already imported. */
    public synchronized Optional<Transfer> remove(String id) {
        Transfer removed = transfers.remove(id);
        if (removed == null) {
            Optional<Transfer> archived = archive.stream().filter(t -> t.id().equals(id)).findFirst();
            archived.ifPresent(archive::remove);
            removed = archived.orElse(null);
        }
        if (removed == null) {
            return Optional.empty();
        }
        save();
        return Optional.of(removed.withStatus(TransferStatus.DELETED, clock.instant()));
    }
}
