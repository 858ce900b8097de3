package com.busylight.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.busylight.testing.Conditions.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileConfigManagerTest {

    @TempDir
    Path tempDir;

    private final FileConfigManager manager = new FileConfigManager();

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void shouldWriteDefaultsWhenFileIsMissing() throws Exception {
        Path file = tempDir.resolve("nested").resolve("config.json");

        AppConfig config = manager.load(file);

        assertTrue(Files.exists(file));
        assertEquals(Duration.ofSeconds(1), config.tickInterval());
        assertTrue(config.sources().isEmpty());
        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(written.contains("\"PT1S\""), written);
        assertEquals(config, manager.load(file));
    }

    @Test
    void shouldReadSourcesAndFillDefaults() throws Exception {
        Path file = write("""
                {
                  "tickInterval": "PT0.5S",
                  "sources": [
                    { "id": "Gradle", "requiresProcess": " java ",
                      "probe": { "type": "COMMAND_PATTERN", "command": ["gradle", "--status"], "patterns": ["BUSY"] } },
                    { "id": "export", "enabled": false, "activateAfter": 2, "deactivateAfter": 4,
                      "probe": { "type": "WINDOW_TITLE", "keywords": ["Exporting"] } },
                    { "id": "cpu", "idleThrottle": 5, "timeout": "PT3S", "verbose": true, "unknown": 1,
                      "probe": { "type": "COMMAND_THRESHOLD", "command": ["cpu"], "valuePattern": "(\\\\d+)", "high": 50 } }
                  ]
                }
                """);

        AppConfig config = manager.load(file);

        assertEquals(Duration.ofMillis(500), config.tickInterval());
        assertEquals(List.of("gradle", "cpu"), config.enabledSources().stream().map(SourceConfig::id).toList());

        SourceConfig gradle = config.sources().get(0);
        assertEquals(1, gradle.activateAfter());
        assertEquals(3, gradle.deactivateAfter());
        assertEquals(Duration.ofSeconds(2), gradle.timeout());
        assertEquals("java", gradle.requiresProcess());
        assertEquals(20, gradle.probe().lineCount());

        SourceConfig export = config.sources().get(1);
        assertFalse(export.enabled());
        assertNull(export.timeout());
        assertEquals(4, export.debounce().requiredConsecutiveToDeactivate());

        SourceConfig cpu = config.sources().get(2);
        assertEquals(5, cpu.idleThrottle());
        assertTrue(cpu.verbose());
        assertEquals(Duration.ofSeconds(3), cpu.timeout());
        assertEquals(Double.valueOf(50.0), cpu.probe().low());
        assertEquals("INFO", config.logging().level());
    }

    @Test
    void shouldRejectInvalidSources() throws Exception {
        Path duplicate = write("""
                { "sources": [
                    { "id": "a", "probe": { "type": "WINDOW_TITLE", "keywords": ["x"] } },
                    { "id": "A", "probe": { "type": "WINDOW_TITLE", "keywords": ["y"] } } ] }
                """);
        assertThrows(IOException.class, () -> manager.load(duplicate));

        Path zeroThreshold = write("""
                { "sources": [ { "id": "a", "activateAfter": 0,
                    "probe": { "type": "WINDOW_TITLE", "keywords": ["x"] } } ] }
                """);
        assertThrows(IOException.class, () -> manager.load(zeroThreshold));

        Path missingCommand = write("""
                { "sources": [ { "id": "a", "probe": { "type": "COMMAND_PATTERN", "patterns": ["x"] } } ] }
                """);
        assertThrows(IOException.class, () -> manager.load(missingCommand));
    }

    @Test
    void shouldSaveAndReloadConfiguration() throws Exception {
        Path file = tempDir.resolve("config.json");
        SourceConfig source = SourceConfig.create("studio", true, 1, 5, null, 2, false, null,
                ProbeConfig.commandThreshold(List.of("top"), "(\\d+)%", 10, 70, true));
        AppConfig config = AppConfig.create(Duration.ofSeconds(2), LoggingConfig.create("debug", null, null, null),
                List.of(source));

        manager.save(file, config);

        assertEquals(config, manager.load(file));
    }

    @Test
    void shouldNotifyListenersWhenFileChanges() throws Exception {
        Path file = write("{ \"tickInterval\": \"PT1S\" }");
        AtomicReference<AppConfig> reloaded = new AtomicReference<>();
        manager.registerListener(reloaded::set);
        manager.startWatching(file);

        Files.writeString(file, "{ \"tickInterval\": \"PT3S\" }", StandardCharsets.UTF_8);

        await("reload", () -> reloaded.get() != null
                && reloaded.get().tickInterval().equals(Duration.ofSeconds(3)), Duration.ofSeconds(30));
    }
}
