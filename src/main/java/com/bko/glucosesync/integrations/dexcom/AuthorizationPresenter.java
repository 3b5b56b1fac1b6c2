package com.bko.glucosesync.integrations.dexcom;

import java.net.URI;

/**
 * Shows the Dexcom login page to the user. The code comes back through the redirect callback.
 */
public interface AuthorizationPresenter {
    void present(URI authorizationUri);
}
