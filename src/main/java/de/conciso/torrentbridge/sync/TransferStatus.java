package de.conciso.torrentbridge.sync;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a {@link Transfer}.
 *
 * <pre>
 * queued -> downloading -> completed -> imported
 * downloading <-> paused
 * queued | downloading | paused -> error -> queued (manual retry)
 * any -> deleted
 * </pre>
 * Snapshots may skip intermediate states, so {@code queued -> completed} and
 * {@code paused -> completed} are accepted as well.
 */
public enum TransferStatus {
    QUEUED,
    DOWNLOADING,
    PAUSED,
    COMPLETED,
    IMPORTED,
    ERROR,
    DELETED;

    public boolean canTransitionTo(TransferStatus next) {
        if (next == this) {
            return true;
        }
        if (next == DELETED) {
            return this != DELETED;
        }
        return successors().contains(next);
    }

    private Set<TransferStatus> successors() {
        return switch (this) {
            case QUEUED -> EnumSet.of(DOWNLOADING, COMPLETED, ERROR);
            case DOWNLOADING -> EnumSet.of(PAUSED, COMPLETED, ERROR);
            case PAUSED -> EnumSet.of(DOWNLOADING, COMPLETED, ERROR);
            case COMPLETED -> EnumSet.of(IMPORTED, ERROR);
            case ERROR -> EnumSet.of(QUEUED);
            case IMPORTED, DELETED -> EnumSet.noneOf(TransferStatus.class);
        };
    }

    /** States the reconciliation loop still compares against the cloud transfer list. */
    public boolean isReconciled() {
        return this == QUEUED || this == DOWNLOADING || this == PAUSED;
    }

    /**
     * Maps a status string reported by the cloud store, or {@code null} for strings this
     * client does not know.
     */
    public static TransferStatus fromCloud(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "queued", "pending", "wishlist", "waiting" -> QUEUED;
            case "downloading", "active", "fetching", "running" -> DOWNLOADING;
            case "paused", "stopped" -> PAUSED;
            case "completed", "complete", "finished", "done", "seeding" -> COMPLETED;
            case "error", "failed" -> ERROR;
            default -> null;
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
