package com.bko.glucosesync.shared;

public record AppSettings(
        DexcomSettings dexcom,
        ShareSettings share,
        SyncSettings sync,
        SecretSettings secrets,
        GoogleSettings google
) {
    public boolean isDexcomConfigured() {
        return dexcom != null && dexcom.isConfigured();
    }

    public boolean isShareConfigured() {
        return share != null && share.hasCredentials();
    }

    public boolean isSecretFileConfigured() {
        return secrets != null && secrets.isConfigured();
    }

    public boolean isGoogleConfigured() {
        return google != null && google.isConfigured();
    }
}
