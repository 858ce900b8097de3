package com.busylight.probe;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowTitleProbeTest {

    private static WindowTitleProbe probe(List<String> keywords, List<String> titles) {
        return new WindowTitleProbe(keywords) {
            @Override
            protected List<String> visibleWindowTitles() {
                return titles;
            }
        };
    }

    @Test
    void shouldBeActiveWhenTitleContainsKeywordIgnoringCase() throws Exception {
        WindowTitleProbe probe = probe(List.of("exporting"), List.of("Inbox", "Exporting project.mov"));

        Reading reading = probe.sample(Duration.ofSeconds(1));

        assertEquals(Activity.ACTIVE, reading.activity());
        assertTrue(reading.progress().isEmpty());
    }

    @Test
    void shouldReportPercentageInTitleAsProgress() throws Exception {
        WindowTitleProbe probe = probe(List.of("Rendering"), List.of("Rendering - 37 %"));

        Reading reading = probe.sample(Duration.ofSeconds(1));

        assertEquals(0.37, reading.progress().getAsDouble(), 1e-9);
    }

    @Test
    void shouldBeInactiveWithoutMatchingWindow() throws Exception {
        WindowTitleProbe probe = probe(List.of("Rendering"), List.of("Editor", "Terminal"));

        assertEquals(Activity.INACTIVE, probe.sample(Duration.ofSeconds(1)).activity());
    }

    @Test
    void shouldIgnoreImplausiblePercentages() {
        assertTrue(WindowTitleProbe.percentage("Copying 250% faster").isEmpty());
        assertTrue(WindowTitleProbe.percentage("no number").isEmpty());
    }

    @Test
    void shouldRequireKeyword() {
        assertThrows(IllegalArgumentException.class, () -> probe(List.of(" "), List.of()));
    }
}
