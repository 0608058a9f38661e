package de.conciso.torrentbridge.library;

/**
 * Outcome of a manual-import trigger.
 *
 * @param skipped   {@code true} when no library manager is configured
 * @param commandId id of the queued library manager command, {@code null} when skipped
 */
public record ImportResult(boolean skipped, Long commandId) {

    public static ImportResult skippedImport() {
        return new ImportResult(true, null);
    }

    public static ImportResult queued(Long commandId) {
        return new ImportResult(false, commandId);
    }
}
