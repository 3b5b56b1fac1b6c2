package com.bko.glucosesync.shared;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettingsConfiguration {

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        DexcomSettings dexcom = new DexcomSettings(
                envConfig.get("dexcom.client_id"),
                envConfig.get("dexcom.client_secret"),
                envConfig.get("dexcom.redirect_uri"),
                envConfig.get("dexcom.environment", "production"),
                envConfig.getSeconds("dexcom.data_delay_seconds", DexcomSettings.DEFAULT_DATA_DELAY),
                envConfig.getSeconds("dexcom.safety_buffer_seconds", DexcomSettings.DEFAULT_SAFETY_BUFFER),
                DexcomSettings.DEFAULT_MAX_WINDOW
        );
        ShareSettings share = new ShareSettings(
                envConfig.get("share.username"),
                envConfig.get("share.password"),
                envConfig.get("share.server", "us"),
                envConfig.get("share.application_id", ShareSettings.DEFAULT_APPLICATION_ID),
                envConfig.getSeconds("share.session_lifetime_seconds", ShareSettings.DEFAULT_SESSION_LIFETIME)
        );
        SyncSettings defaults = SyncSettings.defaults();
        SyncSettings sync = new SyncSettings(
                envConfig.getSeconds("sync.base_interval_seconds", defaults.baseInterval()),
                envConfig.getInt("sync.max_backoff_multiplier", defaults.maxBackoffMultiplier()),
                envConfig.getInt("sync.max_consecutive_errors", defaults.maxConsecutiveErrors()),
                envConfig.getSeconds("sync.max_active_seconds", defaults.maxActiveDuration()),
                envConfig.getSeconds("sync.debounce_seconds", defaults.debounceQuietPeriod()),
                defaults.officialLookback(),
                defaults.shareLookback(),
                envConfig.get("sync.connectivity_probe_host", defaults.connectivityProbeHost())
        );
        SecretSettings secrets = new SecretSettings(envConfig.get("secrets.file"));
        GoogleSettings google = new GoogleSettings(
                envConfig.get("google.spreadsheet_id"),
                envConfig.get("google.service_account_key_path")
        );
        return new AppSettings(dexcom, share, sync, secrets, google);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
