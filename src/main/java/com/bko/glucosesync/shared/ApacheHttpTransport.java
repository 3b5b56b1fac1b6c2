package com.bko.glucosesync.shared;

import org.apache.hc.client5.http.fluent.Executor;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
public class ApacheHttpTransport implements HttpTransport {
    private static final Logger logger = LoggerFactory.getLogger(ApacheHttpTransport.class);
    private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(30);
    private static final Timeout RESPONSE_TIMEOUT = Timeout.ofSeconds(60);

    private final Executor executor;

    public ApacheHttpTransport() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .useSystemProperties()
                .build();
        this.executor = Executor.newInstance(httpClient);
    }

    @Override
    public HttpResult execute(HttpCall call) throws IOException {
        Request request = toRequest(call);
        logger.debug("{} {}://{}{}", call.method(), call.uri().getScheme(), call.uri().getHost(), call.uri().getPath());
        try {
            return executor.execute(request).handleResponse(response -> {
                HttpEntity entity = response.getEntity();
                String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
                return new HttpResult(response.getCode(), body);
            });
        } catch (IOException e) {
            throw new GlucoseApiException(ErrorKind.TRANSPORT_FAILURE,
                    call.method() + " " + call.uri().getHost() + " failed: " + e.getMessage(), e);
        }
    }

    private Request toRequest(HttpCall call) {
        Request request;
        switch (call.method()) {
            case "GET":
                request = Request.get(call.uri());
                break;
            case "POST":
                request = Request.post(call.uri());
                break;
            case "DELETE":
                request = Request.delete(call.uri());
                break;
            default:
                throw new IllegalArgumentException("Unsupported HTTP method: " + call.method());
        }
        call.headers().forEach(request::addHeader);
        if (call.body() != null) {
            request.bodyString(call.body(), ContentType.create(call.contentType(), StandardCharsets.UTF_8));
        }
        return request.connectTimeout(CONNECT_TIMEOUT)
                .responseTimeout(RESPONSE_TIMEOUT);
    }
}
