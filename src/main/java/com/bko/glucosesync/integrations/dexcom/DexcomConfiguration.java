package com.bko.glucosesync.integrations.dexcom;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DexcomConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationPresenter authorizationPresenter() {
        return new LoggingAuthorizationPresenter();
    }
}
