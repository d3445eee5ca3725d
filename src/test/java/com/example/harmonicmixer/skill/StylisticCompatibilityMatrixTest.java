package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.dto.BridgeCandidate;
import com.example.harmonicmixer.dto.StyleProfile;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.dto.TrackWithMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StylisticCompatibilityMatrixTest {

    private static final double EPS = 1e-9;

    private static StylisticCompatibilityMatrix matrix;

    @BeforeAll
    static void loadTables() {
        matrix = new StylisticCompatibilityMatrix(new ObjectMapper());
    }

    @Nested
    @DisplayName("profile extraction")
    class Extraction {

        @Test
        void stringsAreLowerCasedAndTrimmed() {
            StyleProfile profile = matrix.extractProfile(Map.of("subgenre", " Salsa Dura ", "mood", "-"));
            assertEquals("salsa dura", profile.getSubgenre());
            assertNull(profile.getMood());
        }

        @Test
        void percentagesAreNormalized() {
            StyleProfile profile = matrix.extractProfile(Map.of(
                "danceability", "80%",
                "crowd_appeal", 75,
                "mix_friendly", "0.6"));
            assertEquals(0.8, profile.getDanceability(), EPS);
            assertEquals(0.75, profile.getCrowdAppeal(), EPS);
            assertEquals(0.6, profile.getMixFriendly(), EPS);
        }

        @Test
        void zeroAndUnparsablePercentagesAreMissing() {
            StyleProfile profile = matrix.extractProfile(Map.of("danceability", 0, "crowd_appeal", "lots"));
            assertNull(profile.getDanceability());
            assertNull(profile.getCrowdAppeal());
        }
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void directEntry() {
            assertEquals(0.9, matrix.lookup(StyleDimension.MOOD, "energetic", "uplifting"), EPS);
        }

        @Test
        void reverseEntryIsUsedWhenDirectIsMissing() {
            assertEquals(0.3, matrix.lookup(StyleDimension.ERA, "2010s", "70s"), EPS);
        }

        @Test
        void unknownPairDefaultsToFair() {
            assertEquals(0.5, matrix.lookup(StyleDimension.SUBGENRE, "polka", "grindcore"), EPS);
        }
    }

    @Nested
    @DisplayName("compatibility")
    class Compatibility {

        @Test
        void weightedByUsedDimensionsOnly() {
            Map<String, Object> a = Map.of("subgenre", "Salsa Dura", "mood", "energetic");
            Map<String, Object> b = Map.of("subgenre", "salsa romantica", "mood", "romantic");
            // (0.7*0.25 + 0.5*0.2) / 0.45
            assertEquals(0.275 / 0.45, matrix.compatibility(a, b), EPS);
        }

        @Test
        void danceabilityOnly() {
            assertEquals(0.8, matrix.compatibility(Map.of("danceability", "80%"), Map.of("danceability", 0.6)), EPS);
        }

        @Test
        void noComparableDimensionIsNeutral() {
            assertEquals(0.5, matrix.compatibility(Map.of(), Map.of("mood", "happy")), EPS);
        }

        @Test
        void breakdownSkipsSeasonAndMissingDimensions() {
            StyleProfile p1 = matrix.extractProfile(Map.of("mood", "energetic", "season", "summer", "era", "80s"));
            StyleProfile p2 = matrix.extractProfile(Map.of("mood", "happy", "season", "winter"));

            Map<String, Double> breakdown = matrix.breakdown(p1, p2);

            assertEquals(Map.of("mood", 0.9), breakdown);
        }
    }

    @Nested
    @DisplayName("bridge tracks")
    class Bridges {

        @Test
        void bridgeScoreIsHarmonicMean() {
            assertEquals(2 * 0.8 * 0.6 / 1.4, matrix.bridgeScore(0.8, 0.6), EPS);
        }

        @Test
        void bridgeScoreBonusIsCapped() {
            assertEquals(1.0, matrix.bridgeScore(0.8, 0.9), EPS);
        }

        @Test
        void bridgesAreSortedAndLimitedToTen() {
            StyleProfile from = matrix.extractProfile(Map.of("mood", "energetic"));
            StyleProfile to = matrix.extractProfile(Map.of("mood", "romantic"));

            List<TrackWithMetadata> candidates = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                candidates.add(new TrackWithMetadata(Track.builder().id("t" + i).build(), Map.of("mood", "chill")));
            }
            candidates.add(new TrackWithMetadata(Track.builder().id("bridge").build(), Map.of("mood", "passionate")));

            List<BridgeCandidate> bridges = matrix.bridgeTracks(from, to, candidates);

            assertEquals(10, bridges.size());
            assertEquals("bridge", bridges.get(0).getTrack().getId());
            for (int i = 1; i < bridges.size(); i++) {
                assertTrue(bridges.get(i - 1).getScore() >= bridges.get(i).getScore());
            }
        }
    }
}
