package com.example.harmonicmixer.service;

import com.example.harmonicmixer.dto.ContextType;
import com.example.harmonicmixer.dto.ContextualCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextualCurveServiceTest {

    private static final double EPS = 1e-9;

    private final ContextualCurveService service = new ContextualCurveService();

    @Test
    void catalogCoversEveryContextType() {
        Map<ContextType, List<String>> curves = service.availableCurves();
        assertEquals(List.of("morning", "afternoon", "evening", "night", "late_night"), curves.get(ContextType.TIME));
        assertEquals(5, curves.get(ContextType.ACTIVITY).size());
        assertEquals(List.of("warm_up", "peak_time", "cool_down"), curves.get(ContextType.ENERGY));
        assertEquals(2, curves.get(ContextType.MOOD).size());
        assertEquals(2, curves.get(ContextType.SEASON).size());
    }

    @Nested
    @DisplayName("curve selection")
    class Selection {

        @Test
        void defaultsToEvening() {
            assertEquals("Evening Prime Time", service.selectCurve(null, null, null, null, null, null).getName());
        }

        @Test
        void activityCurveWins() {
            ContextualCurve curve = service.selectCurve("morning", "party", null, null, "summer", null);
            assertEquals(ContextType.ACTIVITY, curve.getContextType());
            assertEquals("party", curve.getContextValue());
        }

        @Test
        void firstCandidateWithoutActivity() {
            assertEquals("Morning Warm-up", service.selectCurve("Morning", null, null, "romantic", null, null).getName());
        }

        @Test
        void moodMatchesByValue() {
            assertEquals("Romantic Journey", service.selectCurve(null, null, null, "romantic", null, null).getName());
            assertEquals("Energy Blast", service.selectCurve(null, null, null, "energy_blast", null, null).getName());
        }

        @Test
        void energyPreferenceIsConsidered() {
            assertEquals("Cool Down", service.selectCurve(null, null, "cool_down", null, null, null).getName());
        }

        @Test
        @DisplayName("duration override returns a copy and leaves the catalog untouched")
        void durationOverride() {
            ContextualCurve curve = service.selectCurve("night", null, null, null, null, 30);
            assertEquals(30, curve.getDurationMinutes());
            assertEquals(120, service.getCurve(ContextType.TIME, "night").getDurationMinutes());
        }
    }

    @Nested
    @DisplayName("energy progression")
    class Progression {

        @Test
        void ascendingCurveIsLinear() {
            List<Double> progression = service.energyProgression(service.getCurve(ContextType.TIME, "morning"), 5);
            double[] expected = {0.3, 0.4, 0.5, 0.6, 0.7};
            assertEquals(5, progression.size());
            for (int i = 0; i < expected.length; i++) {
                assertEquals(expected[i], progression.get(i), 1e-9);
            }
        }

        @Test
        void flatCurveIsTheRangeMean() {
            service.energyProgression(service.getCurve(ContextType.TIME, "afternoon"), 6)
                .forEach(e -> assertEquals(0.7, e, EPS));
        }

        @Test
        void descendingCurveStaysInsideItsRange() {
            List<Double> progression = service.energyProgression(service.getCurve(ContextType.ENERGY, "cool_down"), 8);
            assertEquals(0.7, progression.get(0), EPS);
            assertEquals(0.3, progression.get(7), EPS);
            progression.forEach(e -> assertTrue(e >= 0.3 - EPS && e <= 0.7 + EPS));
        }

        @Test
        void everyShapeStaysInsideItsRange() {
            service.availableCurves().forEach((type, keys) -> keys.forEach(key -> {
                ContextualCurve curve = service.getCurve(type, key);
                service.energyProgression(curve, 12).forEach(e ->
                    assertTrue(e >= curve.getMinEnergy() - EPS && e <= curve.getMaxEnergy() + EPS, curve.getName()));
            }));
        }

        @Test
        void singlePositionIsTheMidpoint() {
            List<Double> progression = service.energyProgression(service.getCurve(ContextType.TIME, "morning"), 1);
            assertEquals(1, progression.size());
            assertEquals(0.5, progression.get(0), EPS);
        }
    }

    @Nested
    @DisplayName("context score")
    class ContextScore {

        private final ContextualCurve morning = service.getCurve(ContextType.TIME, "morning");

        @Test
        void neutralWithoutMetadata() {
            assertEquals(0.5, service.contextScore(Map.of(), morning, 0.5), EPS);
        }

        @Test
        void timeOfDayMatching() {
            assertEquals(1.0, service.contextScore(Map.of("time_of_day", "morning"), morning, 0.5), EPS);
            assertEquals(0.7, service.contextScore(Map.of("time_of_day", "afternoon"), morning, 0.5), EPS);
            assertEquals(0.2, service.contextScore(Map.of("time_of_day", "night"), morning, 0.5), EPS);
        }

        @Test
        void danceabilityIsComparedWithTargetEnergy() {
            assertEquals(0.8, service.contextScore(Map.of("danceability", "60%"), morning, 0.4), EPS);
        }

        @Test
        @DisplayName("bare numeric percentage strings are read on the 0-100 scale")
        void crowdAppealAsPlainNumberString() {
            assertEquals(0.85, service.contextScore(Map.of("crowd_appeal", "85"), morning, 0.5), EPS);
            assertEquals(1.0, service.contextScore(Map.of("crowd_appeal", 150), morning, 0.5), EPS);
        }

        @Test
        void moodPreferences() {
            assertEquals(1.0, service.contextScore(Map.of("mood", "Uplifting"), morning, 0.5), EPS);
            assertEquals(0.3, service.contextScore(Map.of("mood", "melancholic"), morning, 0.5), EPS);
        }
    }
}
