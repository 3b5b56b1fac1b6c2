package com.bko.glucosesync.shared;

public record HttpResult(int statusCode, String body) {
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
