package com.bko.glucosesync.integrations.secrets;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps secrets in a dotenv-format file. Keys like {@code share.session_id} are stored as {@code SHARE_SESSION_ID}.
 */
public class EnvFileSecretStore implements SecretStorePort {
    private static final Logger logger = LoggerFactory.getLogger(EnvFileSecretStore.class);

    private final Path path;
    private Map<String, String> cache;

    public EnvFileSecretStore(Path path) {
        this.path = path.toAbsolutePath();
    }

    @Override
    public synchronized Optional<String> read(String key) {
        return Optional.ofNullable(entries().get(toEnvKey(key)));
    }

    @Override
    public synchronized void write(String key, String value) throws IOException {
        String envKey = toEnvKey(key);
        String entry = envKey + "=" + encodeValue(envKey, value);
        List<String> lines = readLines();
        List<String> newLines = new ArrayList<>();
        boolean found = false;
        for (String line : lines) {
            if (line.trim().startsWith(envKey + "=")) {
                newLines.add(entry);
                found = true;
            } else {
                newLines.add(line);
            }
        }
        if (!found) {
            newLines.add(entry);
        }
        writeLines(newLines);
        logger.debug("Stored {} in {}", envKey, path.getFileName());
    }

    @Override
    public synchronized void delete(String key) throws IOException {
        String envKey = toEnvKey(key);
        List<String> lines = readLines();
        List<String> newLines = new ArrayList<>();
        for (String line : lines) {
            if (!line.trim().startsWith(envKey + "=")) {
                newLines.add(line);
            }
        }
        if (newLines.size() != lines.size()) {
            writeLines(newLines);
            logger.debug("Removed {} from {}", envKey, path.getFileName());
        }
    }

    private Map<String, String> entries() {
        if (cache == null) {
            Map<String, String> loaded = new HashMap<>();
            if (Files.exists(path)) {
                Dotenv dotenv = Dotenv.configure()
                        .directory(path.getParent().toString())
                        .filename(path.getFileName().toString())
                        .ignoreIfMissing()
                        .load();
                for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
                    loaded.put(entry.getKey(), entry.getValue());
                }
            }
            cache = loaded;
        }
        return cache;
    }

    private List<String> readLines() throws IOException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    private void writeLines(List<String> lines) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, lines, StandardCharsets.UTF_8);
        cache = null;
    }

    /**
     * Quotes {@code value} so dotenv reads it back unchanged. Dotenv has no escape sequences: a quoted value ends at
     * the next matching quote and an unquoted one at the first {@code #}, with surrounding blanks trimmed.
     */
    static String encodeValue(String envKey, String value) throws IOException {
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IOException("Value for " + envKey + " spans several lines and cannot be stored in a .env file");
        }
        if (value.indexOf('"') < 0) {
            return "\"" + value + "\"";
        }
        if (value.indexOf('\'') < 0) {
            return "'" + value + "'";
        }
        boolean bare = value.indexOf('#') < 0
                && value.equals(value.trim())
                && !(value.startsWith("\"") && value.endsWith("\""))
                && !(value.startsWith("'") && value.endsWith("'"));
        if (!bare) {
            throw new IOException("Value for " + envKey + " mixes both quote characters with '#' or outer blanks "
                    + "and cannot be stored in a .env file");
        }
        return value;
    }

    static String toEnvKey(String key) {
        return key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
    }
}
