package com.fleetdiag.api.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstanceIdentityTest {

    private static final Map<String, String> PLATFORM_ENV = Map.of(InstanceIdentity.INSTANCE_ID_ENV, "rd0003ff");

    @Test
    void configuredIdWins() {
        assertEquals("web-1", InstanceIdentity.resolve(" web-1 ", PLATFORM_ENV::get, () -> "host"));
    }

    @Test
    void fallsBackToPlatformVariable() {
        assertEquals("rd0003ff", InstanceIdentity.resolve(null, PLATFORM_ENV::get, () -> "host"));
        assertEquals("rd0003ff", InstanceIdentity.resolve("  ", PLATFORM_ENV::get, () -> "host"));
    }

    @Test
    void fallsBackToHostName() {
        Map<String, String> empty = Map.of();
        assertEquals("host", InstanceIdentity.resolve(null, empty::get, () -> "host"));
        assertEquals("host", InstanceIdentity.resolve(null, Map.of(InstanceIdentity.INSTANCE_ID_ENV, "")::get,
            () -> "host"));
    }

    @Test
    void resolvesSomethingOnThisMachine() {
        String id = InstanceIdentity.resolve(null);
        assertNotNull(id);
        assertFalse(id.isBlank());
    }
}
