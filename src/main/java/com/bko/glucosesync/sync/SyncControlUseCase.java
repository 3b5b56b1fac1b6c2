package com.bko.glucosesync.sync;

import com.bko.glucosesync.sync.app.SyncReport;

public interface SyncControlUseCase {
    void activate();

    void deactivate();

    boolean isActive();

    SyncState state();

    SyncReport runSyncCycle();

    void requestSync();
}
