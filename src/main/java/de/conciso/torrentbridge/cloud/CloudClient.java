package de.conciso.torrentbridge.cloud;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.torrentbridge.api.ApiCalls;
import de.conciso.torrentbridge.api.ApiError;
import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.sync.TransferStatus;
import de.conciso.torrentbridge.watcher.TorrentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * REST client for the cloud torrent store (Seedr API v0.1).
 *
 * <p>No method throws for remote or local failures; each returns an {@link ApiResult}.
 */
@Component
public class CloudClient {

    private static final Logger log = LoggerFactory.getLogger(CloudClient.class);

    static final String API = "/api/v0.1/p";
    static final String DEVICE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";
    private static final String WISHLIST_REASON = "not_enough_space_added_to_wishlist";
    private static final long DEFAULT_TOKEN_LIFETIME_SECONDS = 3600;
    private static final int DEFAULT_POLL_INTERVAL_SECONDS = 5;
    private static final int BUFFER_SIZE = 64 * 1024;

    private final RestClient restClient;
    private final String baseUrl;
    private final String clientId;
    private final String scope;
    private final int transientRetries;
    private final Duration retryBackoff;
    private final Clock clock;

    @Autowired
    public CloudClient(
            @Value("${torrentbridge.cloud.base-url:https://v2.seedr.cc}") String baseUrl,
            @Value("${torrentbridge.cloud.client-id}") String clientId,
            @Value("${torrentbridge.cloud.scope:files.read profile files.write files.delete files.list tasks.write tasks.read}") String scope,
            @Value("${torrentbridge.cloud.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${torrentbridge.cloud.read-timeout-ms:30000}") int readTimeoutMs,
            @Value("${torrentbridge.cloud.transient-retries:2}") int transientRetries,
            @Value("${torrentbridge.cloud.retry-backoff-ms:500}") long retryBackoffMs,
            Clock clock) {
        this(RestClient.builder().requestFactory(timeouts(connectTimeoutMs, readTimeoutMs)),
                baseUrl, clientId, scope, transientRetries, Duration.ofMillis(retryBackoffMs), clock);
    }

    CloudClient(RestClient.Builder builder, String baseUrl, String clientId, String scope,
                int transientRetries, Duration retryBackoff, Clock clock) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.restClient = builder.baseUrl(this.baseUrl).build();
        this.clientId = clientId;
        this.scope = scope;
        this.transientRetries = transientRetries;
        this.retryBackoff = retryBackoff;
        this.clock = clock;
        log.info("Cloud store client configured for {}", this.baseUrl);
    }

    // ── Device flow ─────────────────────────────────────────────────────

    public ApiResult<DeviceAuthSession> startDeviceAuth() {
        if (clientId == null || clientId.isBlank()) {
            return ApiResult.failure(ApiError.Kind.PERMANENT, "No cloud client id configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", clientId);
        form.add("scope", scope);

        ApiResult<DeviceCodeResponse> result = ApiCalls.execute("Device auth start", () -> restClient.post()
                .uri(API + "/oauth/device/code")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(DeviceCodeResponse.class));
        if (!result.isOk()) {
            return result.propagate();
        }

        DeviceCodeResponse response = result.value();
        if (response == null || response.device_code() == null || response.user_code() == null) {
            return ApiResult.failure(ApiError.Kind.PERMANENT, "Device auth start: response lacks device or user code");
        }
        int interval = response.interval() != null && response.interval() > 0
                ? response.interval() : DEFAULT_POLL_INTERVAL_SECONDS;
        Instant expiresAt = response.expires_in() != null
                ? clock.instant().plusSeconds(response.expires_in())
                : clock.instant().plus(Duration.ofMinutes(15));

        var session = new DeviceAuthSession(response.device_code(), response.user_code(),
                verificationUri(response), Duration.ofSeconds(interval), expiresAt);
        log.info("Device auth started, user code {} at {}", session.userCode(), session.verificationUri());
        return ApiResult.ok(session);
    }

    /** One poll attempt; the caller owns the loop and its timeout. */
    public ApiResult<DeviceAuthPoll> pollDeviceAuth(DeviceAuthSession session) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", DEVICE_GRANT);
        form.add("device_code", session.deviceCode());
        form.add("client_id", clientId);

        ApiResult<TokenResponse> result = requestToken("Device auth poll", form);
        if (!result.isOk()) {
            return result.propagate();
        }
        TokenResponse response = result.value();
        if (response.access_token() != null) {
            return ApiResult.ok(DeviceAuthPoll.approved(toCredential(response, null)));
        }
        String error = response.error() != null ? response.error() : "";
        return switch (error) {
            case "authorization_pending" -> ApiResult.ok(DeviceAuthPoll.of(DeviceAuthPoll.State.PENDING));
            case "slow_down" -> ApiResult.ok(DeviceAuthPoll.of(DeviceAuthPoll.State.SLOW_DOWN));
            case "expired_token" -> ApiResult.ok(DeviceAuthPoll.of(DeviceAuthPoll.State.EXPIRED));
            case "access_denied" -> ApiResult.ok(DeviceAuthPoll.of(DeviceAuthPoll.State.DENIED));
            default -> ApiResult.failure(ApiError.Kind.PERMANENT,
                    "Device auth poll: unexpected answer '" + error + "'");
        };
    }

    public ApiResult<Credential> refresh(Credential credential) {
        if (!credential.canRefresh()) {
            return ApiResult.failure(ApiError.Kind.UNAUTHENTICATED, "No refresh token available");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", credential.refreshToken());
        form.add("client_id", clientId);

        ApiResult<TokenResponse> result = requestToken("Token refresh", form);
        if (!result.isOk()) {
            return result.propagate();
        }
        TokenResponse response = result.value();
        if (response.access_token() == null) {
            String reason = response.error() != null ? response.error() : "no access token in response";
            return ApiResult.failure(ApiError.Kind.UNAUTHENTICATED, "Token refresh rejected: " + reason);
        }
        log.info("Cloud access token refreshed");
        return ApiResult.ok(toCredential(response, credential.refreshToken()));
    }

    private ApiResult<TokenResponse> requestToken(String operation, MultiValueMap<String, String> form) {
        ApiResult<TokenResponse> result = ApiCalls.execute(operation, () -> restClient.post()
                .uri(API + "/oauth/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                // OAuth error answers come as 400/401 with a JSON body
                .onStatus(status -> status.value() == 400 || status.value() == 401, (request, response) -> { })
                .body(TokenResponse.class));
        if (result.isOk() && result.value() == null) {
            return ApiResult.failure(ApiError.Kind.PERMANENT, operation + ": empty response");
        }
        return result;
    }

    private Credential toCredential(TokenResponse response, String previousRefreshToken) {
        long lifetime = response.expires_in() != null ? response.expires_in() : DEFAULT_TOKEN_LIFETIME_SECONDS;
        String refreshToken = response.refresh_token() != null ? response.refresh_token() : previousRefreshToken;
        return new Credential(response.access_token(), refreshToken, clock.instant().plusSeconds(lifetime));
    }

    private String verificationUri(DeviceCodeResponse response) {
        String uri = response.verification_uri() != null ? response.verification_uri() : response.verification_url();
        if (uri == null || uri.isBlank()) {
            return origin() + API + "/oauth/device/verify";
        }
        return uri.startsWith("/") ? origin() + uri : uri;
    }

    // ── Transfers ───────────────────────────────────────────────────────

    public ApiResult<String> submit(TorrentDescriptor descriptor, Credential credential) {
        if (!Files.isReadable(descriptor.path())) {
            return ApiResult.failure(ApiError.Kind.LOCAL_IO, "Cannot read " + descriptor.path());
        }
        if (descriptor.kind() == TorrentDescriptor.Kind.MAGNET) {
            String magnet;
            try {
                magnet = Files.readString(descriptor.path()).trim();
            } catch (IOException e) {
                return ApiResult.failure(ApiError.Kind.LOCAL_IO, "Cannot read " + descriptor.path() + ": " + e.getMessage());
            }
            if (!magnet.startsWith("magnet:")) {
                return ApiResult.failure(ApiError.Kind.PERMANENT, descriptor.path().getFileName() + " holds no magnet link");
            }
            return submitJson(descriptor.title(), Map.of("magnet", magnet), credential);
        }

        var body = new MultipartBodyBuilder();
        body.part("torrent_file", new FileSystemResource(descriptor.path()));
        ApiResult<SubmitResponse> result = ApiCalls.execute("Submit " + descriptor.title(), () -> restClient.post()
                .uri(API + "/tasks")
                .headers(h -> h.setBearerAuth(credential.accessToken()))
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(body.build())
                .retrieve()
                .onStatus(status -> status.value() == 413, (request, response) -> { })
                .body(SubmitResponse.class));
        return toTransferId(descriptor.title(), result);
    }

    /** Submits a magnet link or a URL pointing at a torrent file. */
    public ApiResult<String> submitUrl(String title, String url, Credential credential) {
        Map<String, String> payload = url.startsWith("magnet:") ? Map.of("magnet", url) : Map.of("url", url);
        return submitJson(title, payload, credential);
    }

    private ApiResult<String> submitJson(String title, Map<String, String> payload, Credential credential) {
        ApiResult<SubmitResponse> result = ApiCalls.execute("Submit " + title, () -> restClient.post()
                .uri(API + "/tasks")
                .headers(h -> h.setBearerAuth(credential.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .onStatus(status -> status.value() == 413, (request, response) -> { })
                .body(SubmitResponse.class));
        return toTransferId(title, result);
    }

    private ApiResult<String> toTransferId(String title, ApiResult<SubmitResponse> result) {
        if (!result.isOk()) {
            log.warn("Submit of {} failed: {}", title, result.error());
            return result.propagate();
        }
        SubmitResponse response = result.value();
        if (response == null) {
            return ApiResult.failure(ApiError.Kind.PERMANENT, "Submit " + title + ": empty response");
        }
        if (WISHLIST_REASON.equals(response.reason_phrase()) && response.wt() != null && response.wt().id() != null) {
            log.warn("Cloud store is out of space, {} was added to the wishlist (id={})", title, response.wt().id());
            return ApiResult.ok(response.wt().id());
        }
        String id = firstNonBlank(response.task_id(), response.id(), response.user_torrent_id(), response.torrent_hash());
        if (id == null) {
            String reason = firstNonBlank(response.message(), response.error(), response.reason_phrase());
            return ApiResult.failure(ApiError.Kind.PERMANENT,
                    "Submit " + title + " rejected" + (reason != null ? ": " + reason : " without transfer id"));
        }
        log.info("Submitted {} to cloud store (id={})", title, id);
        return ApiResult.ok(id);
    }

    public ApiResult<List<CloudTransfer>> listTransfers(Credential credential) {
        ApiResult<TaskResponse[]> result = ApiCalls.executeWithRetry("List transfers", transientRetries, retryBackoff,
                () -> restClient.get()
                        .uri(API + "/tasks")
                        .headers(h -> h.setBearerAuth(credential.accessToken()))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(TaskResponse[].class));
        if (!result.isOk()) {
            return result.propagate();
        }
        List<CloudTransfer> transfers = new ArrayList<>();
        if (result.value() != null) {
            for (TaskResponse task : result.value()) {
                if (task == null || task.id() == null) {
                    log.warn("Ignoring cloud transfer entry without id: {}", task);
                    continue;
                }
                transfers.add(new CloudTransfer(task.id(), task.name(), TransferStatus.fromCloud(task.status()),
                        normalizeProgress(task.progress()), task.size(), task.message()));
            }
        }
        log.debug("Cloud store reports {} transfer(s)", transfers.size());
        return ApiResult.ok(transfers);
    }

    public ApiResult<List<CloudFile>> listFiles(String transferId, Credential credential) {
        ApiResult<ContentResponse[]> result = ApiCalls.executeWithRetry("List files of " + transferId,
                transientRetries, retryBackoff, () -> restClient.get()
                        .uri(API + "/tasks/{id}/contents", transferId)
                        .headers(h -> h.setBearerAuth(credential.accessToken()))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(ContentResponse[].class));
        if (!result.isOk()) {
            return result.propagate();
        }

        List<CloudFile> files = new ArrayList<>();
        for (ContentResponse entry : result.value() != null ? result.value() : new ContentResponse[0]) {
            if ("folder".equalsIgnoreCase(entry.type())) {
                log.warn("Skipping folder entry {} of transfer {}", entry.name(), transferId);
                continue;
            }
            if (entry.name() == null) {
                return ApiResult.failure(ApiError.Kind.PERMANENT, "File entry of " + transferId + " has no name");
            }
            String url = entry.url();
            if (url == null || url.isBlank()) {
                ApiResult<String> resolved = resolveDownloadUrl(entry.id(), credential);
                if (!resolved.isOk()) {
                    return resolved.propagate();
                }
                url = resolved.value();
            }
            files.add(new CloudFile(entry.name(), entry.size() != null ? entry.size() : -1, url));
        }
        return ApiResult.ok(files);
    }

    private ApiResult<String> resolveDownloadUrl(String fileId, Credential credential) {
        if (fileId == null) {
            return ApiResult.failure(ApiError.Kind.PERMANENT, "File entry has neither url nor id");
        }
        ApiResult<FileUrlResponse> result = ApiCalls.executeWithRetry("Resolve file " + fileId,
                transientRetries, retryBackoff, () -> restClient.get()
                        .uri(API + "/file/{id}", fileId)
                        .headers(h -> h.setBearerAuth(credential.accessToken()))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(FileUrlResponse.class));
        if (!result.isOk()) {
            return result.propagate();
        }
        if (result.value() == null || result.value().url() == null) {
            return ApiResult.failure(ApiError.Kind.PERMANENT, "No download URL for file " + fileId);
        }
        return ApiResult.ok(result.value().url());
    }

    /**
     * Streams {@code downloadUrl} to {@code destination}, overwriting an existing file.
     * Content is written to a {@code .part} sibling first and renamed when complete; the
     * partial file is deleted on cancellation and on failure.
     */
    public ApiResult<Path> fetch(String downloadUrl, Path destination, Credential credential, BooleanSupplier cancelled) {
        Path partial = destination.resolveSibling(destination.getFileName() + ".part");
        try {
            Path parent = destination.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            return ApiResult.failure(ApiError.Kind.LOCAL_IO, "Cannot create " + destination.getParent() + ": " + e.getMessage());
        }

        String operation = "Fetch " + destination.getFileName();
        try {
            ApiResult<Path> result = restClient.get()
                    .uri(URI.create(downloadUrl))
                    .headers(h -> {
                        if (isApiOrigin(downloadUrl)) h.setBearerAuth(credential.accessToken());
                    })
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            return ApiResult.failure(ApiCalls.classifyStatus(operation, response.getStatusCode().value()));
                        }
                        return copy(response.getBody(), partial, destination, cancelled);
                    });
            if (result.isOk()) {
                log.info("Fetched {}", destination);
            }
            return result;
        } catch (RestClientException | IllegalArgumentException e) {
            return ApiResult.failure(ApiCalls.classify(operation, e));
        } finally {
            deleteQuietly(partial);
        }
    }

    private ApiResult<Path> copy(InputStream in, Path partial, Path destination, BooleanSupplier cancelled) throws IOException {
        OutputStream out;
        try {
            out = Files.newOutputStream(partial);
        } catch (IOException e) {
            return ApiResult.failure(ApiError.Kind.LOCAL_IO, "Cannot write " + partial + ": " + e.getMessage());
        }
        try (out) {
            byte[] buffer = new byte[BUFFER_SIZE];
            while (true) {
                if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                    log.info("Fetch of {} cancelled", destination.getFileName());
                    return ApiResult.failure(ApiError.Kind.CANCELLED, "Fetch of " + destination.getFileName() + " cancelled");
                }
                int read = in.read(buffer);
                if (read == -1) break;
                try {
                    out.write(buffer, 0, read);
                } catch (IOException e) {
                    return ApiResult.failure(ApiError.Kind.LOCAL_IO, "Cannot write " + partial + ": " + e.getMessage());
                }
            }
        }
        try {
            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            return ApiResult.failure(ApiError.Kind.LOCAL_IO, "Cannot move " + partial + " to " + destination + ": " + e.getMessage());
        }
        return ApiResult.ok(destination);
    }

    public ApiResult<Void> pause(String transferId, Credential credential) {
        return control("Pause " + transferId, transferId, "/pause", credential);
    }

    public ApiResult<Void> resume(String transferId, Credential credential) {
        return control("Resume " + transferId, transferId, "/resume", credential);
    }

    /** Irreversible on the cloud side. */
    public ApiResult<Void> delete(String transferId, Credential credential) {
        ApiResult<Void> result = ApiCalls.execute("Delete " + transferId, () -> restClient.delete()
                .uri(API + "/tasks/{id}", transferId)
                .headers(h -> h.setBearerAuth(credential.accessToken()))
                .retrieve()
                .toBodilessEntity())
                .map(entity -> null);
        if (result.isOk()) {
            log.info("Deleted cloud transfer {}", transferId);
        }
        return result;
    }

    private ApiResult<Void> control(String operation, String transferId, String action, Credential credential) {
        ApiResult<Void> result = ApiCalls.execute(operation, () -> restClient.post()
                .uri(API + "/tasks/{id}" + action, transferId)
                .headers(h -> h.setBearerAuth(credential.accessToken()))
                .retrieve()
                .toBodilessEntity())
                .map(entity -> null);
        if (result.isOk()) {
            log.info("{} succeeded", operation);
        }
        return result;
    }

    public ApiResult<AccountInfo> accountInfo(Credential credential) {
        return ApiCalls.executeWithRetry("Account info", transientRetries, retryBackoff, () -> restClient.get()
                .uri(API + "/user")
                .headers(h -> h.setBearerAuth(credential.accessToken()))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(AccountInfo.class));
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private String origin() {
        URI uri = URI.create(baseUrl);
        return uri.getScheme() + "://" + uri.getAuthority();
    }

    /** True iff {@code url} has the scheme, host and port of the API base URL and no user info. */
    boolean isApiOrigin(String url) {
        URI api = URI.create(baseUrl);
        URI target;
        try {
            target = URI.create(url);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return target.getRawUserInfo() == null
                && api.getScheme().equalsIgnoreCase(String.valueOf(target.getScheme()))
                && api.getHost().equalsIgnoreCase(String.valueOf(target.getHost()))
                && effectivePort(api) == effectivePort(target);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "http".equalsIgnoreCase(uri.getScheme()) ? 80 : 443;
    }

    /** The cloud store reports progress in percent; returns it as a fraction in [0,1]. */
    static double normalizeProgress(Double percent) {
        if (percent == null || percent.isNaN() || percent <= 0) {
            return 0;
        }
        return Math.min(percent / 100.0, 1.0);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static SimpleClientHttpRequestFactory timeouts(int connectTimeoutMs, int readTimeoutMs) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove partial file {}: {}", file, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DeviceCodeResponse(String device_code, String user_code, String verification_uri,
                              String verification_url, Integer interval, Long expires_in) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(String access_token, String refresh_token, Long expires_in,
                         String error, String error_description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubmitResponse(String task_id, String id, String user_torrent_id, String torrent_hash,
                          String reason_phrase, WishlistItem wt, String message, String error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WishlistItem(String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskResponse(String id, String name, String status, Double progress, Long size, String message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentResponse(String id, String name, Long size, String url, String type) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileUrlResponse(String url) {}
}
