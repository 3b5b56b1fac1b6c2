package com.bko.glucosesync.shared;

public record ConfigStatus(
        boolean dexcomConfigured,
        boolean shareConfigured,
        boolean secretFileConfigured,
        boolean googleConfigured
) {
    public static ConfigStatus from(AppSettings settings) {
        return new ConfigStatus(
                settings.isDexcomConfigured(),
                settings.isShareConfigured(),
                settings.isSecretFileConfigured(),
                settings.isGoogleConfigured()
        );
    }
}
