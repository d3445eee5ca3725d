package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.Track;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HarmonicScorerTest {

    private static final double EPS = 1e-9;

    private HarmonicScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new HarmonicScorer(new MixerProperties());
    }

    private static Track track(String id, String key, Double bpm, Double energy) {
        return Track.builder().id(id).key(key).bpm(bpm).energy(energy).build();
    }

    @Nested
    @DisplayName("key score")
    class KeyScore {

        @Test
        void identicalKeysScoreOne() {
            assertEquals(1.0, scorer.keyScore("8A", "8A"), EPS);
        }

        @Test
        void neighboursAndRelativeScoreZeroPointEight() {
            assertEquals(0.8, scorer.keyScore("8A", "9A"), EPS);
            assertEquals(0.8, scorer.keyScore("8A", "7A"), EPS);
            assertEquals(0.8, scorer.keyScore("8A", "8B"), EPS);
        }

        @Test
        void distantKeysDecayWithDistance() {
            assertEquals(0.3, scorer.keyScore("8A", "10A"), EPS);
            assertEquals(0.0, scorer.keyScore("8A", "2A"), EPS);
        }
    }

    @Nested
    @DisplayName("bpm score")
    class BpmScore {

        @Test
        void withinTwoBpmIsPerfect() {
            assertEquals(1.0, scorer.bpmScore(120, 122), EPS);
        }

        @Test
        void withinToleranceDecaysLinearly() {
            assertEquals(0.75, scorer.bpmScore(120, 123), EPS);
            assertEquals(0.5, scorer.bpmScore(120, 126), EPS);
        }

        @Test
        void halfAndDoubleTimeScoreZeroPointSix() {
            assertEquals(0.6, scorer.bpmScore(60, 120), EPS);
            assertEquals(0.6, scorer.bpmScore(128, 65), EPS);
        }

        @Test
        void farApartBpmBottomsOutAtZero() {
            assertEquals(0.0, scorer.bpmScore(100, 130), EPS);
        }

        @Test
        void scoreNeverIncreasesWithDistanceInsideTolerance() {
            double previous = 1.0;
            for (double other = 120; other <= 126; other += 0.5) {
                double score = scorer.bpmScore(120, other);
                assertTrue(score <= previous + EPS);
                previous = score;
            }
        }
    }

    @Test
    void energyAndEmotionalScores() {
        assertEquals(1.0, scorer.energyScore(5, 6), EPS);
        assertEquals(0.8, scorer.energyScore(5, 7), EPS);
        assertEquals(0.1, scorer.energyScore(2, 8), EPS);
        assertEquals(0.5, scorer.emotionalScore(2, 7), EPS);
    }

    @Nested
    @DisplayName("weighted compatibility")
    class Compatibility {

        @Test
        @DisplayName("identical key/bpm/energy without emotion scores 0.9 in intelligent mode")
        void missingEmotionIsNotRenormalized() {
            Track a = track("a", "8A", 125.0, 5.0);
            Track b = track("b", "8A", 125.0, 5.0);
            assertEquals(0.9, scorer.compatibility(a, b, MixMode.INTELLIGENT), EPS);
        }

        @Test
        void classicModeIsKeyDominated() {
            Track a = track("a", "8A", 125.0, 5.0);
            Track b = track("b", "9A", 125.0, 9.0);
            assertEquals(0.82, scorer.compatibility(a, b, MixMode.CLASSIC), EPS);
        }

        @Test
        @DisplayName("zero and malformed values count as missing")
        void zeroAndMalformedValuesAreMissing() {
            Track a = track("a", "H1", 0.0, 5.0);
            Track b = track("b", "8A", 125.0, 5.0);
            assertEquals(0.2, scorer.compatibility(a, b, MixMode.INTELLIGENT), EPS);
        }

        @Test
        void tracksWithoutDataScoreZero() {
            assertEquals(0.0, scorer.compatibility(track("a", null, null, null), track("b", null, null, null)), EPS);
        }

        @Test
        void defaultModeComesFromConfiguration() {
            MixerProperties properties = new MixerProperties();
            properties.getHarmonic().setDefaultMode(MixMode.CLASSIC);
            HarmonicScorer classic = new HarmonicScorer(properties);

            Track a = track("a", "8A", 125.0, 5.0);
            Track b = track("b", "9A", 125.0, 9.0);
            assertEquals(MixMode.CLASSIC, classic.getDefaultMode());
            assertEquals(0.82, classic.compatibility(a, b), EPS);
        }
    }

    @Test
    void compatibilityMatrixHasZeroDiagonal() {
        List<Track> tracks = List.of(
            track("a", "8A", 125.0, 5.0),
            track("b", "9A", 126.0, 6.0),
            track("c", "2B", 90.0, 2.0));

        double[][] matrix = scorer.compatibilityMatrix(tracks, MixMode.INTELLIGENT);

        assertEquals(3, matrix.length);
        for (int i = 0; i < 3; i++) {
            assertEquals(0.0, matrix[i][i], EPS);
        }
        assertEquals(scorer.compatibility(tracks.get(0), tracks.get(1), MixMode.INTELLIGENT), matrix[0][1], EPS);
        assertTrue(matrix[0][1] > matrix[0][2]);
    }
}
