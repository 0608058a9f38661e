package de.conciso.torrentbridge.watcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted watcher configuration.
 *
 * @param torrentDir directory scanned for descriptor files, {@code null} until configured
 * @param downloadDir directory fetched content is written to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WatcherSettings(
        @JsonProperty("torrent_dir") String torrentDir,
        @JsonProperty("download_dir") String downloadDir,
        @JsonProperty("interval_seconds") long intervalSeconds,
        @JsonProperty("auto_start") boolean autoStart) {

    public boolean hasTorrentDir() {
        return torrentDir != null && !torrentDir.isBlank();
    }

    public WatcherSettings withDirectories(String newTorrentDir, String newDownloadDir) {
        return new WatcherSettings(newTorrentDir, newDownloadDir, intervalSeconds, autoStart);
    }
}
