package com.bko.glucosesync.integrations.share;

public record ShareCredentials(String username, String password) {
    @Override
    public String toString() {
        return "ShareCredentials[username=" + username + ", password=***]";
    }
}
