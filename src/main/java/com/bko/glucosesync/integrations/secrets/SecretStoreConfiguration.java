package com.bko.glucosesync.integrations.secrets;

import com.bko.glucosesync.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
public class SecretStoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SecretStoreConfiguration.class);

    @Bean
    public SecretStorePort secretStore(AppSettings settings) {
        if (settings.isSecretFileConfigured()) {
            logger.info("Persisting secrets to {}", settings.secrets().filePath());
            return new EnvFileSecretStore(Paths.get(settings.secrets().filePath()));
        }
        logger.info("No secrets file configured, tokens and sessions are kept in memory only.");
        return new InMemorySecretStore();
    }
}
