package com.bko.glucosesync.integrations.secrets;

import java.io.IOException;
import java.util.Optional;

public interface SecretStorePort {
    Optional<String> read(String key) throws IOException;
    void write(String key, String value) throws IOException;
    void delete(String key) throws IOException;
}
