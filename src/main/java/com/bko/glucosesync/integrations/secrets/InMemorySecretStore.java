package com.bko.glucosesync.integrations.secrets;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySecretStore implements SecretStorePort {
    private final Map<String, String> secrets = new ConcurrentHashMap<>();

    @Override
    public Optional<String> read(String key) {
        return Optional.ofNullable(secrets.get(key));
    }

    @Override
    public void write(String key, String value) {
        secrets.put(key, value);
    }

    @Override
    public void delete(String key) {
        secrets.remove(key);
    }
}
