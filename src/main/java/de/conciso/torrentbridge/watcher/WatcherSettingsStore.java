package de.conciso.torrentbridge.watcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the current {@link WatcherSettings} and persists them as JSON.
 *
 * <p>When no settings file exists yet the settings are seeded from application properties.
 */
@Component
public class WatcherSettingsStore {

    private static final Logger log = LoggerFactory.getLogger(WatcherSettingsStore.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path configFile;
    private volatile WatcherSettings current;

    public WatcherSettingsStore(
            @Value("${torrentbridge.watcher.config-file:config/watcher_config.json}") String configFile,
            @Value("${torrentbridge.watcher.torrent-dir:}") String torrentDir,
            @Value("${torrentbridge.watcher.download-dir:downloads}") String downloadDir,
            @Value("${torrentbridge.watcher.interval-seconds:30}") long intervalSeconds,
            @Value("${torrentbridge.watcher.auto-start:true}") boolean autoStart) {
        this.configFile = Path.of(configFile);
        WatcherSettings defaults = new WatcherSettings(
                torrentDir.isBlank() ? null : torrentDir, downloadDir, intervalSeconds, autoStart);
        this.current = load(defaults);
    }

    private WatcherSettings load(WatcherSettings defaults) {
        if (!Files.exists(configFile)) {
            log.info("No watcher configuration at {}, using defaults", configFile);
            return defaults;
        }
        try {
            WatcherSettings loaded = objectMapper.readValue(configFile.toFile(), WatcherSettings.class);
            long interval = loaded.intervalSeconds() > 0 ? loaded.intervalSeconds() : defaults.intervalSeconds();
            String downloadDir = loaded.downloadDir() != null ? loaded.downloadDir() : defaults.downloadDir();
            log.info("Loaded watcher configuration from {}", configFile);
            return new WatcherSettings(loaded.torrentDir(), downloadDir, interval, loaded.autoStart());
        } catch (IOException e) {
            log.warn("Failed to load watcher configuration {}: {}", configFile, e.getMessage());
            return defaults;
        }
    }

    public WatcherSettings current() {
        return current;
    }

    public void save(WatcherSettings settings) throws IOException {
        current = settings;
        Path parent = configFile.getParent();
        if (parent != null) Files.createDirectories(parent);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), settings);
        log.debug("Saved watcher configuration to {}", configFile);
    }
}
