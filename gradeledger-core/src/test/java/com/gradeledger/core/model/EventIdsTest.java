package com.gradeledger.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class EventIdsTest {

    @Test
    void fromIdempotencyKey_shouldBeSha256Hex() {
        // sha256("abc")
        assertEquals(
            "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            EventIds.fromIdempotencyKey("abc"));
    }

    @Test
    void fromIdempotencyKey_shouldBeStableAcrossCalls() {
        String key = "grade.mutated:assignment:course_cs101:a1:u_student_a:r1";
        
        assertEquals(EventIds.fromIdempotencyKey(key), EventIds.fromIdempotencyKey(key));
        assertEquals(64, EventIds.fromIdempotencyKey(key).length());
    }

    @Test
    void fromIdempotencyKey_shouldDifferPerRevision() {
        assertNotEquals(
            EventIds.fromIdempotencyKey("grade.mutated:assignment:c:a:s:r1"),
            EventIds.fromIdempotencyKey("grade.mutated:assignment:c:a:s:r2"));
    }

    @Test
    void fromIdempotencyKey_shouldRejectBlankKey() {
        assertThrows(IllegalArgumentException.class, () -> EventIds.fromIdempotencyKey(""));
        assertThrows(IllegalArgumentException.class, () -> EventIds.fromIdempotencyKey("   "));
        assertThrows(IllegalArgumentException.class, () -> EventIds.fromIdempotencyKey(null));
    }
}
