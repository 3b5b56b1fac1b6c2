package com.bko.glucosesync.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnvConfigTest {

    @Test
    void readsDotenvWithUpperCaseKeys() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("GLUCOSE_TEST_CLIENT_ID")).thenReturn("  client  ");
        EnvConfig config = new EnvConfig(dotenv);

        assertEquals("client", config.get("glucose_test.client_id"));
        assertNull(config.get("glucose_test.missing_key"));
        assertEquals("fallback", config.get("glucose_test.missing_key", "fallback"));
    }

    @Test
    void numericValuesFallBackWhenInvalid() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("GLUCOSE_TEST_INTERVAL")).thenReturn("120");
        when(dotenv.get("GLUCOSE_TEST_BROKEN")).thenReturn("soon");
        EnvConfig config = new EnvConfig(dotenv);

        assertEquals(Duration.ofSeconds(120), config.getSeconds("glucose_test.interval", Duration.ZERO));
        assertEquals(7, config.getInt("glucose_test.broken", 7));
    }

    @Test
    void settingsConfigurationAppliesDefaults() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("DEXCOM_CLIENT_ID")).thenReturn("id");
        when(dotenv.get("DEXCOM_CLIENT_SECRET")).thenReturn("secret");
        when(dotenv.get("DEXCOM_REDIRECT_URI")).thenReturn("http://localhost:8080/oauth/dexcom/callback");
        when(dotenv.get("SYNC_BASE_INTERVAL_SECONDS")).thenReturn("60");

        AppSettings settings = new SettingsConfiguration().appSettings(new EnvConfig(dotenv));

        assertTrue(settings.isDexcomConfigured());
        assertEquals("https://api.dexcom.eu", settings.dexcom().baseUrl());
        assertEquals(Duration.ofHours(3), settings.dexcom().dataDelay());
        assertEquals(Duration.ofSeconds(60), settings.sync().baseInterval());
        assertEquals(4, settings.sync().maxBackoffMultiplier());
        assertEquals(ShareSettings.DEFAULT_APPLICATION_ID, settings.share().applicationId());
        assertEquals("https://share2.dexcom.com", settings.share().baseUrl());
        assertFalse(ConfigStatus.from(settings).googleConfigured());
    }
}
