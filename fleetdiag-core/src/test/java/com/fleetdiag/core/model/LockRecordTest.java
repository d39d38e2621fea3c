package com.fleetdiag.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LockRecordTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void create_shouldStampCurrentProcessAndExpiry() {
        LockRecord record = LockRecord.create("instance-a", "deploy", NOW, LockRecord.DEFAULT_TIMEOUT);
        
        assertEquals(ProcessHandle.current().pid(), record.ownerProcessId());
        assertEquals("instance-a", record.ownerWorkerId());
        assertEquals("deploy", record.operationName());
        assertEquals(NOW.plus(Duration.ofMinutes(20)), record.expiresAt());
    }

    @Test
    void isValidAt_shouldReturnFalseAtAndAfterExpiry() {
        LockRecord record = LockRecord.create("instance-a", "deploy", NOW, Duration.ofMinutes(1));
        
        assertTrue(record.isValidAt(NOW.plusSeconds(59)));
        assertFalse(record.isValidAt(NOW.plusSeconds(60)));
        assertFalse(record.isValidAt(NOW.plusSeconds(61)));
    }

    @Test
    void isValidAt_shouldTreatMissingExpiryAsInvalid() {
        LockRecord record = new LockRecord(1L, 1L, "instance-a", "deploy", null);
        
        assertFalse(record.isValidAt(NOW));
        assertEquals(Duration.ZERO, record.remainingTime(NOW));
    }

    @Test
    void remainingTime_shouldReturnZeroIfExpired() {
        LockRecord record = LockRecord.create("instance-a", "deploy", NOW, Duration.ofMinutes(1));
        
        assertEquals(Duration.ofSeconds(30), record.remainingTime(NOW.plusSeconds(30)));
        assertEquals(Duration.ZERO, record.remainingTime(NOW.plusSeconds(300)));
    }

    @Test
    void isOwnedBy_shouldRequireSameProcessAndWorker() {
        LockRecord record = new LockRecord(42L, 7L, "instance-a", "deploy", NOW);
        
        assertTrue(record.isOwnedBy(42L, "instance-a"));
        assertFalse(record.isOwnedBy(42L, "instance-b"));
        assertFalse(record.isOwnedBy(43L, "instance-a"));
    }
}
