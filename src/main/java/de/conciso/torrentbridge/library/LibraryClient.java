package de.conciso.torrentbridge.library;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.torrentbridge.api.ApiCalls;
import de.conciso.torrentbridge.api.ApiResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Client for the library manager (Sonarr API v3).
 *
 * <p>When no host is configured every call succeeds without contacting anything: list calls
 * return empty lists and {@link #triggerImport} reports a skipped import.
 */
@Component
public class LibraryClient {

    private static final Logger log = LoggerFactory.getLogger(LibraryClient.class);

    static final String API = "/api/v3";
    private static final int PAGE_SIZE = 100;

    private final RestClient restClient;
    private final int transientRetries;
    private final Duration retryBackoff;

    @Autowired
    public LibraryClient(
            @Value("${torrentbridge.library.host:}") String host,
            @Value("${torrentbridge.library.api-key:}") String apiKey,
            @Value("${torrentbridge.library.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${torrentbridge.library.read-timeout-ms:30000}") int readTimeoutMs,
            @Value("${torrentbridge.cloud.transient-retries:2}") int transientRetries,
            @Value("${torrentbridge.cloud.retry-backoff-ms:500}") long retryBackoffMs) {
        this(RestClient.builder().requestFactory(timeouts(connectTimeoutMs, readTimeoutMs)),
                host, apiKey, transientRetries, Duration.ofMillis(retryBackoffMs));
    }

    LibraryClient(RestClient.Builder builder, String host, String apiKey, int transientRetries, Duration retryBackoff) {
        this.transientRetries = transientRetries;
        this.retryBackoff = retryBackoff;
        if (host == null || host.isBlank()) {
            this.restClient = null;
            log.info("No library manager host configured, imports are skipped");
            return;
        }
        builder.baseUrl(host.endsWith("/") ? host.substring(0, host.length() - 1) : host);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("X-Api-Key", apiKey);
            log.info("Library manager API key configured");
        }
        this.restClient = builder.build();
    }

    public boolean isConfigured() {
        return restClient != null;
    }

    public ApiResult<List<Series>> listSeries() {
        if (!isConfigured()) {
            return ApiResult.ok(List.of());
        }
        return ApiCalls.executeWithRetry("List series", transientRetries, retryBackoff, () -> restClient.get()
                        .uri(API + "/series")
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(Series[].class))
                .map(LibraryClient::asList);
    }

    /**
     * Asks the library manager to scan {@code path} for downloaded episodes.
     *
     * @param titleHint only used for logging
     */
    public ApiResult<ImportResult> triggerImport(Path path, String titleHint) {
        if (!isConfigured()) {
            log.info("Skipping library import of {}, no library manager configured", titleHint);
            return ApiResult.ok(ImportResult.skippedImport());
        }
        var command = new CommandRequest("DownloadedEpisodesScan", path.toAbsolutePath().toString());
        ApiResult<CommandResponse> result = ApiCalls.execute("Import " + titleHint, () -> restClient.post()
                .uri(API + "/command")
                .contentType(MediaType.APPLICATION_JSON)
                .body(command)
                .retrieve()
                .body(CommandResponse.class));
        if (!result.isOk()) {
            log.warn("Library import of {} failed: {}", titleHint, result.error());
            return result.propagate();
        }
        Long commandId = result.value() != null ? result.value().id() : null;
        log.info("IMPORT: {} queued in library manager (command={})", titleHint, commandId);
        return ApiResult.ok(ImportResult.queued(commandId));
    }

    public ApiResult<List<RootFolder>> listRootFolders() {
        if (!isConfigured()) {
            return ApiResult.ok(List.of());
        }
        return ApiCalls.executeWithRetry("List root folders", transientRetries, retryBackoff, () -> restClient.get()
                        .uri(API + "/rootfolder")
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(RootFolder[].class))
                .map(LibraryClient::asList);
    }

    /**
     * Fetches all missing episodes via {@code GET /wanted/missing}, following pages until done.
     */
    public ApiResult<List<MissingEpisode>> listMissingEpisodes() {
        if (!isConfigured()) {
            return ApiResult.ok(List.of());
        }
        List<MissingEpisode> all = new ArrayList<>();
        int page = 1;
        boolean hasNext = true;
        while (hasNext) {
            int current = page;
            ApiResult<MissingPage> result = ApiCalls.executeWithRetry("List missing episodes",
                    transientRetries, retryBackoff, () -> restClient.get()
                            .uri(uri -> uri.path(API + "/wanted/missing")
                                    .queryParam("page", current)
                                    .queryParam("pageSize", PAGE_SIZE)
                                    .queryParam("includeSeries", true)
                                    .build())
                            .accept(MediaType.APPLICATION_JSON)
                            .retrieve()
                            .body(MissingPage.class));
            if (!result.isOk()) {
                return result.propagate();
            }
            MissingPage response = result.value();
            if (response == null || response.records() == null || response.records().isEmpty()) break;
            all.addAll(response.records());
            int totalPages = response.totalRecords() > 0
                    ? (int) Math.ceil(response.totalRecords() / (double) Math.max(1, response.pageSize()))
                    : 0;
            hasNext = page < totalPages;
            page++;
        }
        log.debug("Library manager reports {} missing episode(s)", all.size());
        return ApiResult.ok(all);
    }

    private static <T> List<T> asList(T[] values) {
        return values != null ? List.copyOf(Arrays.asList(values)) : List.of();
    }

    private static SimpleClientHttpRequestFactory timeouts(int connectTimeoutMs, int readTimeoutMs) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }

    record CommandRequest(String name, String path) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommandResponse(Long id, String name, String status) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MissingPage(int page, int pageSize, long totalRecords, List<MissingEpisode> records) {}
}
