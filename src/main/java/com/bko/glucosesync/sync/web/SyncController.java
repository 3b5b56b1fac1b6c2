package com.bko.glucosesync.sync.web;

import com.bko.glucosesync.integrations.dexcom.DexcomClientPort;
import com.bko.glucosesync.integrations.share.ShareClientPort;
import com.bko.glucosesync.shared.AppSettings;
import com.bko.glucosesync.shared.ConfigStatus;
import com.bko.glucosesync.sync.SyncControlUseCase;
import com.bko.glucosesync.sync.SyncState;
import com.bko.glucosesync.sync.app.SyncReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/sync")
public class SyncController {
    private final SyncControlUseCase syncControl;
    private final DexcomClientPort dexcomClient;
    private final ShareClientPort shareClient;
    private final AppSettings settings;

    public SyncController(SyncControlUseCase syncControl,
                          DexcomClientPort dexcomClient,
                          ShareClientPort shareClient,
                          AppSettings settings) {
        this.syncControl = syncControl;
        this.dexcomClient = dexcomClient;
        this.shareClient = shareClient;
        this.settings = settings;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        SyncState state = syncControl.state();
        return Map.of(
                "state", state,
                "dexcom", dexcomClient.connectionStatus(),
                "share", shareClient.connectionStatus(),
                "config", ConfigStatus.from(settings)
        );
    }

    @PostMapping("/activate")
    public SyncState activate() {
        syncControl.activate();
        return syncControl.state();
    }

    @PostMapping("/deactivate")
    public SyncState deactivate() {
        syncControl.deactivate();
        return syncControl.state();
    }

    /**
     * Debounced: a burst of triggers results in one cycle.
     */
    @PostMapping("/trigger")
    public ResponseEntity<Void> trigger() {
        syncControl.requestSync();
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PostMapping("/run")
    public SyncReport run() {
        return syncControl.runSyncCycle();
    }
}
