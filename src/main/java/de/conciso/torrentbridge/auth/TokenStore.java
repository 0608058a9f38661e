package de.conciso.torrentbridge.auth;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.conciso.torrentbridge.cloud.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Persists the cloud store credential in a JSON file.
 *
 * <p>Writes go to a temporary file in the same directory which is then renamed over the
 * existing file, so a crash never leaves a half-written credential behind. Where the file
 * system supports POSIX attributes the file is readable by the owner only.
 */
@Component
public class TokenStore {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Path tokenFile;
    private final Duration expiryMargin;

    public TokenStore(
            @Value("${torrentbridge.auth.token-file:data/token.json}") String tokenFile,
            @Value("${torrentbridge.auth.expiry-margin-seconds:60}") long expiryMarginSeconds) {
        this.tokenFile = Path.of(tokenFile);
        this.expiryMargin = Duration.ofSeconds(expiryMarginSeconds);
    }

    public Optional<Credential> load() {
        if (!Files.exists(tokenFile)) {
            return Optional.empty();
        }
        try {
            Credential credential = objectMapper.readValue(tokenFile.toFile(), Credential.class);
            if (credential.accessToken() == null) {
                log.warn("Ignoring token file {} without access token", tokenFile);
                return Optional.empty();
            }
            log.info("Loaded cloud credential from {} (expires {})", tokenFile, credential.expiresAt());
            return Optional.of(credential);
        } catch (IOException e) {
            log.warn("Failed to read token file {}: {}", tokenFile, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(Credential credential) throws IOException {
        Path parent = tokenFile.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, ".token", ".tmp");
        try {
            restrictToOwner(temp);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), credential);
            try {
                Files.move(temp, tokenFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, tokenFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Saved cloud credential to {}", tokenFile);
    }

    public void clear() {
        try {
            if (Files.deleteIfExists(tokenFile)) {
                log.info("Removed stored cloud credential {}", tokenFile);
            }
        } catch (IOException e) {
            log.error("Failed to remove token file {}: {}", tokenFile, e.getMessage());
        }
    }

    public boolean isValid(Credential credential, Instant now) {
        return credential != null && credential.isValidAt(now, expiryMargin);
    }

    Path tokenFile() {
        return tokenFile;
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
