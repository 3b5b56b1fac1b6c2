package com.bko.glucosesync.integrations.sheets;

import com.bko.glucosesync.glucose.GlucoseReadingStore;
import com.bko.glucosesync.glucose.InMemoryGlucoseReadingStore;
import com.bko.glucosesync.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReadingStoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ReadingStoreConfiguration.class);

    @Bean
    public GlucoseReadingStore glucoseReadingStore(AppSettings settings, SpreadsheetPort spreadsheetPort) {
        if (settings.isGoogleConfigured()) {
            logger.info("Storing glucose readings in Google Sheets.");
            return new SheetsGlucoseReadingStore(spreadsheetPort);
        }
        logger.info("Google Sheets not configured, storing glucose readings in memory.");
        return new InMemoryGlucoseReadingStore();
    }
}
