package com.bko.glucosesync.sync.web;

import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.integrations.dexcom.AuthorizationFlow;
import com.bko.glucosesync.integrations.dexcom.DexcomOAuthAuthenticator;
import com.bko.glucosesync.integrations.share.ShareSessionAuthenticator;
import com.bko.glucosesync.sync.app.DexcomConnectService;
import com.bko.glucosesync.sync.app.SyncCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

@RestController
public class ConnectionController {
    private final DexcomConnectService dexcomConnectService;
    private final DexcomOAuthAuthenticator dexcomAuthenticator;
    private final ShareSessionAuthenticator shareAuthenticator;
    private final SyncCoordinator coordinator;

    public ConnectionController(DexcomConnectService dexcomConnectService,
                                DexcomOAuthAuthenticator dexcomAuthenticator,
                                ShareSessionAuthenticator shareAuthenticator,
                                SyncCoordinator coordinator) {
        this.dexcomConnectService = dexcomConnectService;
        this.dexcomAuthenticator = dexcomAuthenticator;
        this.shareAuthenticator = shareAuthenticator;
        this.coordinator = coordinator;
    }

    @GetMapping("/connections")
    public Map<String, Object> connections() {
        return Map.of(
                "dexcom", dexcomAuthenticator.connectionStatus(),
                "share", shareAuthenticator.connectionStatus()
        );
    }

    @GetMapping("/oauth/dexcom/authorize")
    public Map<String, Object> authorize() throws IOException {
        AuthorizationFlow flow = dexcomConnectService.startConnect();
        return Map.of(
                "authorizationUri", flow.authorizationUri().toString(),
                "state", flow.state()
        );
    }

    @GetMapping("/oauth/dexcom/callback")
    public ResponseEntity<Map<String, Object>> callback(@RequestParam(value = "state", required = false) String state,
                                                        @RequestParam(value = "code", required = false) String code,
                                                        @RequestParam(value = "error", required = false) String error) {
        boolean accepted = dexcomConnectService.handleCallback(state, code, error);
        if (!accepted) {
            return ResponseEntity.badRequest().body(Map.of(
                    "accepted", false,
                    "message", "No pending authorization matches this callback."));
        }
        return ResponseEntity.ok(Map.of("accepted", true));
    }

    @PostMapping("/dexcom/disconnect")
    public ResponseEntity<Void> disconnectDexcom() throws IOException {
        dexcomConnectService.disconnect();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/share/credentials")
    public ResponseEntity<Map<String, Object>> saveShareCredentials(@RequestBody ShareCredentialsRequest request)
            throws IOException {
        if (request == null || isBlank(request.username()) || isBlank(request.password())) {
            return ResponseEntity.badRequest().body(Map.of("message", "Username and password are required."));
        }
        shareAuthenticator.testCredentials(request.username(), request.password());
        coordinator.sourceReconnected(ReadingSource.SHARE);
        coordinator.requestSync();
        return ResponseEntity.ok(Map.of("connected", true));
    }

    @DeleteMapping("/share/credentials")
    public ResponseEntity<Void> deleteShareCredentials() throws IOException {
        shareAuthenticator.deleteCredentials();
        return ResponseEntity.noContent().build();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ShareCredentialsRequest(String username, String password) {
    }
}
