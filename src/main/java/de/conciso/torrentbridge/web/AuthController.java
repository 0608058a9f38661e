package de.conciso.torrentbridge.web;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.auth.DeviceLoginService;
import de.conciso.torrentbridge.auth.LoginState;
import de.conciso.torrentbridge.auth.TokenManager;
import de.conciso.torrentbridge.cloud.AccountInfo;
import de.conciso.torrentbridge.cloud.CloudClient;
import de.conciso.torrentbridge.cloud.Credential;
import de.conciso.torrentbridge.cloud.DeviceAuthSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final DeviceLoginService deviceLoginService;
    private final TokenManager tokenManager;
    private final CloudClient cloudClient;
    private final Clock clock;

    public AuthController(DeviceLoginService deviceLoginService, TokenManager tokenManager,
                          CloudClient cloudClient, Clock clock) {
        this.deviceLoginService = deviceLoginService;
        this.tokenManager = tokenManager;
        this.cloudClient = cloudClient;
        this.clock = clock;
    }

    @PostMapping("/auth/login")
    public ResponseEntity<Map<String, Object>> login() {
        ApiResult<DeviceAuthSession> result = deviceLoginService.start();
        if (!result.isOk()) {
            return ActionResponses.of(result.error());
        }
        DeviceAuthSession session = result.value();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("user_code", session.userCode());
        body.put("verification_uri", session.verificationUri());
        body.put("expires_in", Math.max(0, Duration.between(clock.instant(), session.expiresAt()).toSeconds()));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/auth/status")
    public Map<String, Object> status() {
        return Map.of("authenticated", tokenManager.isAuthenticated());
    }

    @GetMapping("/auth/poll")
    public Map<String, Object> poll() {
        LoginState state = deviceLoginService.state();
        if (state == LoginState.IDLE && tokenManager.isAuthenticated()) {
            state = LoginState.AUTHENTICATED;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", state != LoginState.FAILED && state != LoginState.DENIED && state != LoginState.EXPIRED);
        body.put("state", state.label());
        if (state == LoginState.AUTHENTICATED) {
            body.put("redirect", "/");
        }
        if (state == LoginState.FAILED && deviceLoginService.lastError() != null) {
            body.put("message", deviceLoginService.lastError());
        }
        return body;
    }

    @PostMapping("/auth/logout")
    public Map<String, Object> logout() {
        deviceLoginService.cancel();
        tokenManager.logout();
        return Map.of("success", true);
    }

    @GetMapping("/account")
    public ResponseEntity<?> account() {
        ApiResult<Credential> credential = tokenManager.currentCredential();
        if (!credential.isOk()) {
            return ActionResponses.of(credential.error());
        }
        ApiResult<AccountInfo> info = cloudClient.accountInfo(credential.value());
        if (!info.isOk()) {
            return ActionResponses.of(info.error());
        }
        return ResponseEntity.ok(info.value());
    }
}
