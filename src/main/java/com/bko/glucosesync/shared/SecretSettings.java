package com.bko.glucosesync.shared;

public record SecretSettings(String filePath) {
    public boolean isConfigured() {
        return filePath != null && !filePath.isBlank();
    }
}
