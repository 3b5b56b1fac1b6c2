package com.bko.glucosesync.integrations.secrets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvFileSecretStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void writeAddsOrReplacesKeyAndKeepsOtherLines() throws Exception {
        Path file = tempDir.resolve("secrets.env");
        Files.write(file, List.of("# tokens", "DEXCOM_ACCESS_TOKEN=old", "OTHER=value"), StandardCharsets.UTF_8);
        EnvFileSecretStore store = new EnvFileSecretStore(file);

        store.write("dexcom.access_token", "new");
        store.write("dexcom.refresh_token", "refresh");

        assertEquals(List.of("# tokens", "DEXCOM_ACCESS_TOKEN=\"new\"", "OTHER=value", "DEXCOM_REFRESH_TOKEN=\"refresh\""),
                Files.readAllLines(file, StandardCharsets.UTF_8));
        assertEquals(Optional.of("new"), store.read("dexcom.access_token"));
        assertEquals(Optional.of("value"), store.read("other"));
    }

    @Test
    void deleteRemovesKey() throws Exception {
        Path file = tempDir.resolve("secrets.env");
        EnvFileSecretStore store = new EnvFileSecretStore(file);
        store.write("share.session_id", "abc");

        store.delete("share.session_id");

        assertEquals(Optional.empty(), store.read("share.session_id"));
        assertTrue(Files.readAllLines(file, StandardCharsets.UTF_8).isEmpty());
    }

    @Test
    void missingFileReadsEmptyAndIsCreatedOnWrite() throws Exception {
        Path file = tempDir.resolve("nested").resolve("secrets.env");
        EnvFileSecretStore store = new EnvFileSecretStore(file);

        assertEquals(Optional.empty(), store.read("share.username"));
        store.write("share.username", "user@example.com");

        assertTrue(Files.exists(file));
        assertEquals(Optional.of("user@example.com"), new EnvFileSecretStore(file).read("share.username"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"pa ss#word", "abc #x", "\"quoted\"", "  padded  ", "it's", "it's \"both\"", "a=b", ""})
    void valuesSurviveAFreshRead(String password) throws Exception {
        Path file = tempDir.resolve("secrets.env");
        new EnvFileSecretStore(file).write("share.password", password);

        assertEquals(Optional.of(password), new EnvFileSecretStore(file).read("share.password"));
    }

    @Test
    void unrepresentableValueIsRejectedAndFileUntouched() throws Exception {
        Path file = tempDir.resolve("secrets.env");
        EnvFileSecretStore store = new EnvFileSecretStore(file);
        store.write("share.password", "old");

        assertThrows(IOException.class, () -> store.write("share.password", "it's \"both\" #1"));
        assertThrows(IOException.class, () -> store.write("share.password", "two\nlines"));

        assertEquals(Optional.of("old"), new EnvFileSecretStore(file).read("share.password"));
    }

    @Test
    void inMemoryStoreRoundTrips() {
        InMemorySecretStore store = new InMemorySecretStore();
        store.write("a", "1");
        assertEquals(Optional.of("1"), store.read("a"));
        store.delete("a");
        assertEquals(Optional.empty(), store.read("a"));
    }
}
