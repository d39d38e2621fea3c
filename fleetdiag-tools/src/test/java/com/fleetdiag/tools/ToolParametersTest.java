package com.fleetdiag.tools;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ToolParametersTest {

    @Test
    void parse_shouldAcceptBothSeparatorsAndIgnoreKeyCase() {
        ToolParameters parameters = ToolParameters.parse("Duration=30; mode = cpu & flag");

        assertEquals(2, parameters.size());
        assertEquals("30", parameters.get("duration").orElseThrow());
        assertEquals("cpu", parameters.get("MODE").orElseThrow());
        assertTrue(parameters.get("flag").isEmpty());
    }

    @Test
    void parse_shouldTreatNullAndBlankAsEmpty() {
        assertEquals(0, ToolParameters.parse(null).size());
        assertEquals(0, ToolParameters.parse("  ").size());
    }

    @Test
    void getDuration_shouldAcceptSecondsSuffixesAndIso() {
        Duration fallback = Duration.ofSeconds(60);

        assertEquals(Duration.ofSeconds(45), ToolParameters.parse("duration=45").getDuration("duration", fallback));
        assertEquals(Duration.ofSeconds(20), ToolParameters.parse("duration=20s").getDuration("duration", fallback));
        assertEquals(Duration.ofMinutes(2), ToolParameters.parse("duration=2m").getDuration("duration", fallback));
        assertEquals(Duration.ofMillis(1500), ToolParameters.parse("duration=1500ms").getDuration("duration", fallback));
        assertEquals(Duration.ofSeconds(90), ToolParameters.parse("duration=PT90S").getDuration("duration", fallback));
        assertEquals(fallback, ToolParameters.parse("").getDuration("duration", fallback));
    }

    @Test
    void getDuration_shouldRejectMalformedValues() {
        assertThrows(IllegalArgumentException.class,
            () -> ToolParameters.parse("duration=soon").getDuration("duration", Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ToolParameters.parse("duration=-5").getDuration("duration", Duration.ZERO));
    }
}
