package de.conciso.torrentbridge.cloud;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import de.conciso.torrentbridge.api.ApiError;
import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.sync.TransferStatus;
import de.conciso.torrentbridge.watcher.TorrentDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CloudClientTest {

    private static final String BASE = "https://cloud.example";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Credential credential = new Credential("tok", "ref", NOW.plusSeconds(3600));

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private CloudClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new CloudClient(builder, BASE + "/", "client-1", "tasks.read", 2, Duration.ZERO, clock);
    }

    // ── Device flow ─────────────────────────────────────────────────────

    @Test
    void startDeviceAuthResolvesRelativeVerificationUri() {
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/device/code"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("client_id=client-1")))
                .andRespond(withSuccess("""
                        {"device_code":"dc","user_code":"ABCD-1234","verification_uri":"/devices",
                         "interval":5,"expires_in":600}""", MediaType.APPLICATION_JSON));

        ApiResult<DeviceAuthSession> result = client.startDeviceAuth();

        assertThat(result.isOk()).isTrue();
        DeviceAuthSession session = result.value();
        assertThat(session.userCode()).isEqualTo("ABCD-1234");
        assertThat(session.verificationUri()).isEqualTo(BASE + "/devices");
        assertThat(session.interval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(session.expiresAt()).isEqualTo(NOW.plusSeconds(600));
        server.verify();
    }

    @Test
    void pollReportsPendingAuthorization() {
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/token"))
                .andExpect(content().string(containsString("device_code=dc")))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"authorization_pending\"}"));

        ApiResult<DeviceAuthPoll> result = client.pollDeviceAuth(session());

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().state()).isEqualTo(DeviceAuthPoll.State.PENDING);
    }

    @Test
    void pollMapsSlowDownAndDenied() {
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/token"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"slow_down\"}"));
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/token"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"access_denied\"}"));

        assertThat(client.pollDeviceAuth(session()).value().state()).isEqualTo(DeviceAuthPoll.State.SLOW_DOWN);
        assertThat(client.pollDeviceAuth(session()).value().state()).isEqualTo(DeviceAuthPoll.State.DENIED);
    }

    @Test
    void approvedPollDefaultsLifetimeWhenExpiresInIsMissing() {
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/token"))
                .andRespond(withSuccess("{\"access_token\":\"a1\",\"refresh_token\":\"r1\"}", MediaType.APPLICATION_JSON));

        ApiResult<DeviceAuthPoll> result = client.pollDeviceAuth(session());

        assertThat(result.value().state()).isEqualTo(DeviceAuthPoll.State.APPROVED);
        Credential approved = result.value().credential();
        assertThat(approved.accessToken()).isEqualTo("a1");
        assertThat(approved.refreshToken()).isEqualTo("r1");
        assertThat(approved.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
    }

    @Test
    void refreshKeepsRefreshTokenWhenServerOmitsIt() {
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/token"))
                .andExpect(content().string(containsString("grant_type=refresh_token")))
                .andRespond(withSuccess("{\"access_token\":\"new\",\"expires_in\":120}", MediaType.APPLICATION_JSON));

        ApiResult<Credential> result = client.refresh(credential);

        assertThat(result.value().accessToken()).isEqualTo("new");
        assertThat(result.value().refreshToken()).isEqualTo("ref");
        assertThat(result.value().expiresAt()).isEqualTo(NOW.plusSeconds(120));
    }

    @Test
    void rejectedRefreshIsUnauthenticated() {
        server.expect(requestTo(BASE + "/api/v0.1/p/oauth/token"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\"}"));

        ApiResult<Credential> result = client.refresh(credential);

        assertThat(result.hasError(ApiError.Kind.UNAUTHENTICATED)).isTrue();
    }

    // ── Transfers ───────────────────────────────────────────────────────

    @Test
    void submitsMagnetAsJson() throws Exception {
        Path magnet = Files.writeString(tempDir.resolve("ShowX.S01E01.magnet"), "  magnet:?xt=urn:btih:abc\n");
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tok"))
                .andExpect(jsonPath("$.magnet").value("magnet:?xt=urn:btih:abc"))
                .andRespond(withSuccess("{\"task_id\":\"42\"}", MediaType.APPLICATION_JSON));

        ApiResult<String> result = client.submit(TorrentDescriptor.of(magnet, NOW), credential);

        assertThat(result.value()).isEqualTo("42");
        server.verify();
    }

    @Test
    void submitsTorrentFileAsMultipart() throws Exception {
        Path torrent = Files.write(tempDir.resolve("Movie.torrent"), new byte[]{'d', '4', ':', 'i'});
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(containsString("name=\"torrent_file\"")))
                .andRespond(withSuccess("{\"user_torrent_id\":7}", MediaType.APPLICATION_JSON));

        ApiResult<String> result = client.submit(TorrentDescriptor.of(torrent, NOW), credential);

        assertThat(result.value()).isEqualTo("7");
    }

    @Test
    void wishlistAnswerCountsAsSubmitted() throws Exception {
        Path magnet = Files.writeString(tempDir.resolve("Big.magnet"), "magnet:?xt=urn:btih:big");
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks"))
                .andRespond(withStatus(HttpStatus.PAYLOAD_TOO_LARGE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"reason_phrase\":\"not_enough_space_added_to_wishlist\",\"wt\":{\"id\":99}}"));

        ApiResult<String> result = client.submit(TorrentDescriptor.of(magnet, NOW), credential);

        assertThat(result.value()).isEqualTo("99");
    }

    @Test
    void submitWithoutIdInResponseIsPermanent() {
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks"))
                .andExpect(jsonPath("$.url").value("https://example.org/a.torrent"))
                .andRespond(withSuccess("{\"result\":true}", MediaType.APPLICATION_JSON));

        ApiResult<String> result = client.submitUrl("A", "https://example.org/a.torrent", credential);

        assertThat(result.hasError(ApiError.Kind.PERMANENT)).isTrue();
    }

    @Test
    void magnetFileWithoutLinkIsRejectedLocally() throws Exception {
        Path magnet = Files.writeString(tempDir.resolve("Broken.magnet"), "not a link");

        ApiResult<String> result = client.submit(TorrentDescriptor.of(magnet, NOW), credential);

        assertThat(result.hasError(ApiError.Kind.PERMANENT)).isTrue();
        server.verify();
    }

    @Test
    void listTransfersRetriesServerErrorAndNormalizesProgress() {
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks")).andRespond(withServerError());
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks"))
                .andRespond(withSuccess("""
                        [{"id":"42","name":"ShowX.S01E01","status":"downloading","progress":55,"size":1000},
                         {"id":"43","name":"Other","status":"something-new","progress":0.2}]""",
                        MediaType.APPLICATION_JSON));

        ApiResult<List<CloudTransfer>> result = client.listTransfers(credential);

        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).hasSize(2);
        CloudTransfer first = result.value().get(0);
        assertThat(first.status()).isEqualTo(TransferStatus.DOWNLOADING);
        assertThat(first.progress()).isEqualTo(0.55);
        assertThat(first.size()).isEqualTo(1000L);
        assertThat(result.value().get(1).status()).isNull();
        server.verify();
    }

    @Test
    void listTransfersWithExpiredTokenIsUnauthenticated() {
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        ApiResult<List<CloudTransfer>> result = client.listTransfers(credential);

        assertThat(result.hasError(ApiError.Kind.UNAUTHENTICATED)).isTrue();
    }

    @Test
    void listFilesResolvesMissingUrlsAndSkipsFolders() {
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks/42/contents"))
                .andRespond(withSuccess("""
                        [{"id":"f1","name":"ep.mkv","size":3,"url":"https://cdn.example/ep.mkv"},
                         {"id":"d1","name":"Extras","type":"folder"},
                         {"id":"f2","name":"ep.srt","size":1}]""", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v0.1/p/file/f2"))
                .andRespond(withSuccess("{\"url\":\"https://cdn.example/ep.srt\"}", MediaType.APPLICATION_JSON));

        ApiResult<List<CloudFile>> result = client.listFiles("42", credential);

        assertThat(result.value()).containsExactly(
                new CloudFile("ep.mkv", 3, "https://cdn.example/ep.mkv"),
                new CloudFile("ep.srt", 1, "https://cdn.example/ep.srt"));
    }

    @Test
    void fetchStreamsToDestinationWithoutBearerForForeignHost() throws Exception {
        Path destination = tempDir.resolve("ShowX").resolve("ep.mkv");
        server.expect(requestTo("https://cdn.example/ep.mkv"))
                .andExpect(headerDoesNotExist("Authorization"))
                .andRespond(withSuccess("abc".getBytes(StandardCharsets.UTF_8), MediaType.APPLICATION_OCTET_STREAM));

        ApiResult<Path> result = client.fetch("https://cdn.example/ep.mkv", destination, credential, () -> false);

        assertThat(result.isOk()).isTrue();
        assertThat(destination).hasContent("abc");
        assertThat(tempDir.resolve("ShowX").resolve("ep.mkv.part")).doesNotExist();
    }

    @Test
    void fetchFromApiOriginSendsBearer() {
        Path destination = tempDir.resolve("ep.mkv");
        server.expect(requestTo(BASE + "/api/v0.1/p/download/1"))
                .andExpect(header("Authorization", "Bearer tok"))
                .andRespond(withSuccess("x", MediaType.APPLICATION_OCTET_STREAM));

        assertThat(client.fetch(BASE + "/api/v0.1/p/download/1", destination, credential, () -> false).isOk()).isTrue();
    }

    @Test
    void fetchFromLookalikeHostSendsNoBearer() {
        Path destination = tempDir.resolve("ep.mkv");
        server.expect(requestTo("https://cloud.example.attacker.net/x"))
                .andExpect(headerDoesNotExist("Authorization"))
                .andRespond(withSuccess("x", MediaType.APPLICATION_OCTET_STREAM));

        assertThat(client.fetch("https://cloud.example.attacker.net/x", destination, credential, () -> false).isOk())
                .isTrue();
        server.verify();
    }

    @Test
    void bearerOnlyForExactApiOrigin() {
        assertThat(client.isApiOrigin(BASE + "/api/v0.1/p/download/1")).isTrue();
        assertThat(client.isApiOrigin("https://CLOUD.example:443/file")).isTrue();
        assertThat(client.isApiOrigin("https://cloud.example.attacker.net/x")).isFalse();
        assertThat(client.isApiOrigin("https://cloud.example@evil.net/x")).isFalse();
        assertThat(client.isApiOrigin("http://cloud.example/x")).isFalse();
        assertThat(client.isApiOrigin("https://cloud.example:8443/x")).isFalse();
        assertThat(client.isApiOrigin("not a url")).isFalse();
    }

    @Test
    void cancelledFetchLeavesNoFiles() {
        Path destination = tempDir.resolve("ep.mkv");
        server.expect(requestTo("https://cdn.example/ep.mkv"))
                .andRespond(withSuccess("abc", MediaType.APPLICATION_OCTET_STREAM));

        ApiResult<Path> result = client.fetch("https://cdn.example/ep.mkv", destination, credential, () -> true);

        assertThat(result.hasError(ApiError.Kind.CANCELLED)).isTrue();
        assertThat(destination).doesNotExist();
        assertThat(tempDir.resolve("ep.mkv.part")).doesNotExist();
    }

    @Test
    void fetchOfMissingFileIsNotFound() {
        server.expect(requestTo("https://cdn.example/gone.mkv")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        ApiResult<Path> result = client.fetch("https://cdn.example/gone.mkv", tempDir.resolve("gone.mkv"), credential, () -> false);

        assertThat(result.hasError(ApiError.Kind.NOT_FOUND)).isTrue();
    }

    @Test
    void deleteOfUnknownTransferIsNotFound() {
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks/42"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.delete("42", credential).hasError(ApiError.Kind.NOT_FOUND)).isTrue();
    }

    @Test
    void pausePostsToTransfer() {
        server.expect(requestTo(BASE + "/api/v0.1/p/tasks/42/pause"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());

        assertThat(client.pause("42", credential).isOk()).isTrue();
        server.verify();
    }

    @Test
    void accountInfoReadsQuota() {
        server.expect(requestTo(BASE + "/api/v0.1/p/user"))
                .andExpect(header("Authorization", "Bearer " + credential.accessToken()))
                .andRespond(withSuccess("""
                        {"username": "jo", "email": "jo@example.com", "space_used": 10, "space_max": 100, "premium": 1}
                        """, MediaType.APPLICATION_JSON));

        ApiResult<AccountInfo> result = client.accountInfo(credential);

        assertThat(result.value().username()).isEqualTo("jo");
        assertThat(result.value().spaceMax()).isEqualTo(100L);
        server.verify();
    }

    @Test
    void progressIsClampedToFraction() {
        assertThat(CloudClient.normalizeProgress(null)).isZero();
        assertThat(CloudClient.normalizeProgress(1.0)).isEqualTo(0.01);
        assertThat(CloudClient.normalizeProgress(0.5)).isEqualTo(0.005);
        assertThat(CloudClient.normalizeProgress(55.0)).isEqualTo(0.55);
        assertThat(CloudClient.normalizeProgress(100.0)).isEqualTo(1.0);
        assertThat(CloudClient.normalizeProgress(130.0)).isEqualTo(1.0);
        assertThat(CloudClient.normalizeProgress(-3.0)).isZero();
    }

    private DeviceAuthSession session() {
        return new DeviceAuthSession("dc", "ABCD-1234", BASE + "/devices", Duration.ofSeconds(5), NOW.plusSeconds(600));
    }
}
