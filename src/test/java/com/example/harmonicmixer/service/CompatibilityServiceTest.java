package com.example.harmonicmixer.service;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.CompatibilityExplanation;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.policy.BuiltinPolicies;
import com.example.harmonicmixer.policy.PolicyApplicationResult;
import com.example.harmonicmixer.policy.PolicyConfigurationException;
import com.example.harmonicmixer.skill.EnhancedCompatibilityEngine;
import com.example.harmonicmixer.skill.HarmonicScorer;
import com.example.harmonicmixer.skill.StylisticCompatibilityMatrix;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CompatibilityService}; collaborators are mocked.
 */
class CompatibilityServiceTest {

    private static final double EPS = 1e-9;

    private HarmonicScorer harmonicScorer;
    private EnhancedCompatibilityEngine engine;
    private MixingPolicyService policyService;
    private PolicyRuleEngine ruleEngine;
    private MixerProperties properties;

    private final Track a = Track.builder().id("a").key("8A").build();
    private final Track b = Track.builder().id("b").key("9A").build();

    @BeforeEach
    void setUp() {
        harmonicScorer = mock(HarmonicScorer.class);
        engine = mock(EnhancedCompatibilityEngine.class);
        policyService = mock(MixingPolicyService.class);
        ruleEngine = mock(PolicyRuleEngine.class);
        properties = new MixerProperties();
    }

    private CompatibilityService service(Optional<EnhancedCompatibilityEngine> enhanced) {
        return new CompatibilityService(harmonicScorer, mock(StylisticCompatibilityMatrix.class),
            enhanced, policyService, ruleEngine, properties);
    }

    @Test
    @DisplayName("enhanced scoring falls back to harmonic scoring when the engine is disabled")
    void fallsBackToHarmonic() {
        when(harmonicScorer.compatibility(a, b)).thenReturn(0.42);

        double score = service(Optional.empty()).scoreEnhanced(a, b, null, null, null, null);

        assertEquals(0.42, score, EPS);
    }

    @Test
    void usesEngineWhenPresent() {
        when(engine.compatibility(a, b, null, null, null, null)).thenReturn(0.77);

        assertEquals(0.77, service(Optional.of(engine)).scoreEnhanced(a, b, null, null, null, null), EPS);
        verifyNoInteractions(harmonicScorer);
    }

    @Test
    void explainWithoutEngineReportsHarmonicScoreOnly() {
        when(harmonicScorer.compatibility(a, b)).thenReturn(0.8);

        CompatibilityExplanation explanation = service(Optional.empty()).explain(a, b, null, null);

        assertEquals(0.8, explanation.getOverallScore(), EPS);
        assertEquals(0.8, explanation.getHarmonic().getScore(), EPS);
        assertTrue(explanation.getRecommendations().isEmpty());
    }

    @Test
    @DisplayName("policy score is blended in with the configured weight")
    void blendsPolicyScore() {
        properties.getPolicy().setBlendWeight(0.2);
        when(engine.compatibility(any(), any(), any(), any(), any(), any())).thenReturn(0.5);
        when(policyService.getPolicy("classic_dj")).thenReturn(Optional.of(BuiltinPolicies.CLASSIC_DJ));
        when(ruleEngine.apply(eq(BuiltinPolicies.CLASSIC_DJ), eq(b), any(), any()))
            .thenReturn(PolicyApplicationResult.builder().totalScore(1.0).build());

        double score = service(Optional.of(engine))
            .scoreWithPolicy(a, b, null, null, Map.of(), Map.of(), "classic_dj", Map.of());

        assertEquals(0.6, score, EPS);
    }

    @Test
    void unknownPolicyIsAConfigurationError() {
        when(policyService.getPolicy("nope")).thenReturn(Optional.empty());

        assertThrows(PolicyConfigurationException.class, () -> service(Optional.of(engine))
            .scoreWithPolicy(a, b, null, null, null, null, "nope", null));
    }

    @Test
    void optimalTransitionNeedsEngine() {
        assertTrue(service(Optional.empty()).findOptimalTransition(a, b, null, null).isEmpty());
    }

    @Test
    void styleBreakdownDelegatesToTheMatrix() {
        CompatibilityService service = new CompatibilityService(harmonicScorer,
            new StylisticCompatibilityMatrix(new ObjectMapper()), Optional.empty(), policyService, ruleEngine, properties);

        Map<String, Double> breakdown = service.styleBreakdown(
            Map.of("mood", "energetic", "era", "80s"), Map.of("mood", "happy"));

        assertEquals(Map.of("mood", 0.9), breakdown);
    }
}
