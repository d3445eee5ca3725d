package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.CompatibilityExplanation;
import com.example.harmonicmixer.dto.MixTransition;
import com.example.harmonicmixer.dto.StructuralAnalysis;
import com.example.harmonicmixer.dto.StructuralElement;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.dto.TransitionPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnhancedCompatibilityEngineTest {

    private static final double EPS = 1e-9;

    private EnhancedCompatibilityEngine engine;

    private final Track a = Track.builder().id("a").key("8A").bpm(125.0).energy(5.0).build();
    private final Track b = Track.builder().id("b").key("8A").bpm(125.0).energy(5.0).build();

    @BeforeEach
    void setUp() {
        HarmonicScorer harmonic = new HarmonicScorer(new MixerProperties());
        engine = new EnhancedCompatibilityEngine(harmonic,
            new StylisticCompatibilityMatrix(new ObjectMapper()),
            new StructuralCompatibilityScorer(harmonic));
    }

    @Test
    @DisplayName("missing metadata and analyses fall back to neutral components")
    void neutralComponentsWithoutData() {
        // 0.25 * 0.9 + 0.75 * 0.5
        assertEquals(0.6, engine.compatibility(a, b, null, null, null, null), EPS);
    }

    @Test
    @DisplayName("metadata on one side only keeps stylistic neutral")
    void oneSidedMetadataIsIgnored() {
        double score = engine.compatibility(a, b, null, null, Map.of("mood", "melancholic"), Map.of());
        assertEquals(0.6, score, EPS);
    }

    @Test
    void stylisticComponentUsesMetadata() {
        double score = engine.compatibility(a, b, null, null, Map.of("mood", "energetic"), Map.of("mood", "energetic"));
        // 0.25 * 0.9 + 0.25 * 1.0 + 0.5 * 0.5
        assertEquals(0.725, score, EPS);
    }

    @Test
    void optimalTransitionIsEmptyWithoutPoints() {
        StructuralAnalysis empty = StructuralAnalysis.builder().duration(200).build();
        assertTrue(engine.findOptimalTransition(a, b, empty, empty).isEmpty());
    }

    @Test
    void optimalTransitionPicksBestPair() {
        StructuralAnalysis out = StructuralAnalysis.builder().duration(200).transitionPoints(List.of(
            TransitionPoint.builder().timeSeconds(170).elementType(StructuralElement.OUTRO)
                .mixSuitability(0.9).energyLevel(0.6).beatStrength(0.8).build(),
            TransitionPoint.builder().timeSeconds(20).elementType(StructuralElement.INTRO)
                .mixSuitability(0.3).energyLevel(0.2).beatStrength(0.2).build())).build();
        StructuralAnalysis in = StructuralAnalysis.builder().duration(200).transitionPoints(List.of(
            TransitionPoint.builder().timeSeconds(16).elementType(StructuralElement.INTRO)
                .mixSuitability(0.8).energyLevel(0.6).beatStrength(0.9).build())).build();

        Optional<MixTransition> transition = engine.findOptimalTransition(a, b, out, in);

        assertTrue(transition.isPresent());
        assertEquals(170.0, transition.get().getMixOutPoint().getTimeSeconds(), EPS);
        assertEquals(12.0, transition.get().getEstimatedMixDuration(), EPS);
        assertTrue(transition.get().getTransitionQuality() > 0.9);
    }

    @Test
    void explanationFormatsHarmonicDetails() {
        Track noKey = Track.builder().id("c").bpm(126.0).build();

        CompatibilityExplanation explanation = engine.explain(a, noKey, null, null);

        assertEquals("No key data", explanation.getHarmonic().getKeyMatch());
        assertEquals("125.0 → 126.0 BPM", explanation.getHarmonic().getBpmMatch());
        assertEquals("No energy data", explanation.getHarmonic().getEnergyMatch());
        assertNull(explanation.getStylistic());
        assertTrue(explanation.getRecommendations().isEmpty());
    }

    @Test
    void explanationRecommendsBridgeForClashingMoods() {
        CompatibilityExplanation explanation = engine.explain(a, b,
            Map.of("mood", "energetic"), Map.of("mood", "melancholic"));

        assertEquals("8A → 8A", explanation.getHarmonic().getKeyMatch());
        assertEquals(0.3, explanation.getStylistic().getScore(), EPS);
        // 风格差异、情绪不匹配，以及缺少年代数据
        assertEquals(3, explanation.getRecommendations().size());
        assertTrue(explanation.getRecommendations().stream().anyMatch(r -> r.startsWith("年代")));
    }

    @Test
    @DisplayName("a dimension missing on either side counts as a mismatch")
    void missingDimensionStillRecommends() {
        CompatibilityExplanation explanation = engine.explain(a, b,
            Map.of("mood", "energetic"), Map.of("mood", "energetic"));

        assertEquals(List.of("年代不匹配，可能造成时代割裂感"), explanation.getRecommendations());
    }

    @Test
    void matchingMoodAndEraNeedNoAdvice() {
        CompatibilityExplanation explanation = engine.explain(a, b,
            Map.of("mood", "energetic", "era", "80s"), Map.of("mood", "energetic", "era", "80s"));

        assertTrue(explanation.getRecommendations().isEmpty());
    }
}
