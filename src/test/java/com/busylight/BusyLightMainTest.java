package com.busylight;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusyLightMainTest {

    @Test
    void shouldDefaultToConfigDirectoryInWorkingDirectory() {
        Path expected = Path.of("config", "config.json").toAbsolutePath().normalize();

        assertEquals(expected, BusyLightMain.resolveConfigPath(new String[0]));
        assertEquals(expected, BusyLightMain.resolveConfigPath(new String[]{"  "}));
    }

    @Test
    void shouldResolveConfigPathArgument() {
        Path resolved = BusyLightMain.resolveConfigPath(new String[]{"target/../busylight.json"});

        assertTrue(resolved.isAbsolute());
        assertEquals("busylight.json", resolved.getFileName().toString());
    }

    @Test
    void shouldAnnounceVersionAndConfiguration() {
        Path config = Path.of("config.json").toAbsolutePath();

        assertEquals("BusyLight 1.2.0 watching sources from " + config, BusyLightMain.banner("1.2.0", config));
        assertEquals("dev", BusyLightMain.version());
    }
}
