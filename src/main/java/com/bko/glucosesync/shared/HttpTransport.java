package com.bko.glucosesync.shared;

import java.io.IOException;

/**
 * Executes a single HTTP exchange. Non-2xx responses are returned, not thrown; connection failures surface as
 * {@link ErrorKind#TRANSPORT_FAILURE}.
 */
public interface HttpTransport {
    HttpResult execute(HttpCall call) throws IOException;
}
