package com.gradeledger.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.time.Instant;
import static org.junit.jupiter.api.Assertions.*;

class TestSettingsTest {

    private static final Instant NOON = Instant.parse("2024-03-04T12:00:00Z");

    @Test
    void attemptExpiry_scheduledUsesDuration() {
        TestSettings settings = TestSettings.scheduled(2, 45, NOON.minusSeconds(3600), NOON.plusSeconds(3600));
        
        assertEquals(NOON.plus(Duration.ofMinutes(45)), settings.attemptExpiry(NOON));
    }

    @Test
    void attemptExpiry_practiceLastsSevenDays() {
        TestSettings settings = TestSettings.practice(3);
        
        assertEquals(NOON.plus(Duration.ofDays(7)), settings.attemptExpiry(NOON));
    }

    @Test
    void isWindowOpen_shouldIncludeBoundaries() {
        Instant start = NOON;
        Instant end = NOON.plusSeconds(7200);
        TestSettings settings = TestSettings.scheduled(1, 60, start, end);
        
        assertTrue(settings.isWindowOpen(start));
        assertTrue(settings.isWindowOpen(end));
        assertFalse(settings.isWindowOpen(start.minusSeconds(1)));
        assertFalse(settings.isWindowOpen(end.plusSeconds(1)));
    }

    @Test
    void isWindowOpen_practiceIsAlwaysOpen() {
        assertTrue(TestSettings.practice(1).isWindowOpen(Instant.EPOCH));
    }

    @Test
    void gradeId_shouldBeDeterministic() {
        assertEquals("test_t1_u_student_b", GradeRecord.idFor(SourceType.TEST, "t1", "u_student_b"));
        assertEquals("u_student_b__2", TestAttempt.idFor("u_student_b", 2));
    }
}
