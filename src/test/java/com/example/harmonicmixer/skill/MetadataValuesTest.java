package com.example.harmonicmixer.skill;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataValuesTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("percentage normalization")
    class Percentages {

        @Test
        void fractionsAreKept() {
            assertEquals(0.6, MetadataValues.normalizePercentage(0.6), EPS);
            assertEquals(0.6, MetadataValues.normalizePercentage("0.6"), EPS);
        }

        @Test
        @DisplayName("numbers above 1 are on the 0-100 scale, with or without quotes")
        void hundredScale() {
            assertEquals(0.85, MetadataValues.normalizePercentage(85), EPS);
            assertEquals(0.85, MetadataValues.normalizePercentage("85"), EPS);
            assertEquals(0.85, MetadataValues.normalizePercentage(" 85 "), EPS);
            assertEquals(0.85, MetadataValues.normalizePercentage("85%"), EPS);
        }

        @Test
        void resultIsClampedToUnitInterval() {
            assertEquals(1.0, MetadataValues.normalizePercentage("150%"), EPS);
            assertEquals(1.0, MetadataValues.normalizePercentage(250), EPS);
            assertEquals(0.0, MetadataValues.normalizePercentage(-0.4), EPS);
        }

        @Test
        void missingValues() {
            assertNull(MetadataValues.normalizePercentage(null));
            assertNull(MetadataValues.normalizePercentage("-"));
            assertNull(MetadataValues.normalizePercentage(""));
            assertNull(MetadataValues.normalizePercentage(0));
            assertNull(MetadataValues.normalizePercentage("0"));
            assertNull(MetadataValues.normalizePercentage("lots"));
            assertNull(MetadataValues.normalizePercentage(true));
        }
    }

    @Test
    void stringsAreTrimmedAndLowerCased() {
        assertEquals("salsa dura", MetadataValues.string(Map.of("subgenre", " Salsa Dura "), "subgenre"));
        assertNull(MetadataValues.string(Map.of("subgenre", "-"), "subgenre"));
        assertNull(MetadataValues.string(null, "subgenre"));
    }
}
