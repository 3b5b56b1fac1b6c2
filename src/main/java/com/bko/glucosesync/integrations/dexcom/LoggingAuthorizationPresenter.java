package com.bko.glucosesync.integrations.dexcom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

public class LoggingAuthorizationPresenter implements AuthorizationPresenter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingAuthorizationPresenter.class);

    @Override
    public void present(URI authorizationUri) {
        logger.info("Open this URL in your browser to authorize Dexcom access: {}", authorizationUri);
    }
}
