package com.example.harmonicmixer.skill;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CamelotWheelTest {

    @Test
    @DisplayName("compatible keys are self, both neighbours and the relative key")
    void compatibleKeysForWellFormedKey() {
        assertEquals(List.of("8A", "7A", "9A", "8B"), CamelotWheel.compatibleKeys("8A"));
    }

    @Test
    @DisplayName("wheel wraps around between 12 and 1")
    void compatibleKeysWrapAround() {
        assertEquals(List.of("12B", "11B", "1B", "12A"), CamelotWheel.compatibleKeys("12B"));
        assertEquals(List.of("1A", "12A", "2A", "1B"), CamelotWheel.compatibleKeys("1A"));
    }

    @Test
    @DisplayName("malformed keys have no compatible keys")
    void malformedKeys() {
        assertTrue(CamelotWheel.compatibleKeys("13A").isEmpty());
        assertTrue(CamelotWheel.compatibleKeys("8C").isEmpty());
        assertTrue(CamelotWheel.compatibleKeys("").isEmpty());
        assertTrue(CamelotWheel.compatibleKeys(null).isEmpty());
        assertFalse(CamelotWheel.isValid("0A"));
    }

    @Test
    void distanceIsShortestWayRoundTheWheel() {
        assertEquals(0, CamelotWheel.distance("8A", "8B"));
        assertEquals(6, CamelotWheel.distance("8A", "2A"));
        assertEquals(1, CamelotWheel.distance("12A", "1A"));
        assertThrows(IllegalArgumentException.class, () -> CamelotWheel.distance("X", "1A"));
    }
}
