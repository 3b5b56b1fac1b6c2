package com.bko.glucosesync.integrations.share;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ShareErrorResponse {
    @JsonProperty("Code")
    private String code;
    @JsonProperty("Message")
    private String message;

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    boolean isCredentialError() {
        return code != null && (code.contains("Password") || code.contains("AccountNotFound"));
    }
}
