package com.example.harmonicmixer.service;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.policy.BuiltinPolicies;
import com.example.harmonicmixer.policy.MixingPolicy;
import com.example.harmonicmixer.policy.OperatorType;
import com.example.harmonicmixer.policy.PolicyApplicationResult;
import com.example.harmonicmixer.policy.PolicyConfigurationException;
import com.example.harmonicmixer.policy.PolicyRule;
import com.example.harmonicmixer.policy.PolicyRuleSet;
import com.example.harmonicmixer.policy.PolicyType;
import com.example.harmonicmixer.policy.RulePriority;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MixingPolicyServiceTest {

    private static final double EPS = 1e-9;

    @TempDir
    Path tempDir;

    private MixerProperties properties;
    private ObjectMapper objectMapper;
    private MixingPolicyService service;

    @BeforeEach
    void setUp() {
        properties = new MixerProperties();
        properties.getPolicy().setConfigDir(tempDir.resolve("policies").toString());
        objectMapper = new ObjectMapper();
        service = newService();
    }

    private MixingPolicyService newService() {
        return new MixingPolicyService(new PolicyRuleEngine(), objectMapper, properties);
    }

    private static MixingPolicy latinNight() {
        PolicyRule rule = PolicyRule.builder()
            .id("danceable")
            .name("Danceable")
            .policyType(PolicyType.QUALITY)
            .field("danceability")
            .operator(OperatorType.GREATER_EQUAL)
            .value(0.6)
            .priority(RulePriority.HIGH)
            .tags(List.of("party"))
            .build();
        return MixingPolicy.builder()
            .id("latin_night")
            .name("Latin Night")
            .ruleSets(List.of(PolicyRuleSet.builder().id("latin_rules").rules(List.of(rule)).build()))
            .globalWeights(Map.of(PolicyType.QUALITY, 0.7))
            .build();
    }

    @Test
    @DisplayName("built-in policies and rule sets are available at start-up")
    void builtinsAreLoaded() {
        assertEquals(List.of("classic_dj", "cultural_journey", "modern_ai"),
            service.listPolicies().stream().map(MixingPolicy::getId).toList());
        assertEquals(3, service.listRuleSets().size());
        assertTrue(service.getRuleSet("ai_stylistic").isPresent());
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        void oneResultPerTrackInOrder() {
            List<Track> tracks = List.of(
                Track.builder().id("a").key("8A").bpm(125.0).build(),
                Track.builder().id("b").key("9A").build());

            List<PolicyApplicationResult> results = service.applyPolicy("modern_ai", tracks,
                Map.of("a", Map.of("danceability", "90%")), null);

            assertEquals(2, results.size());
            assertTrue(results.stream().allMatch(r -> "modern_ai".equals(r.getPolicyId())));
        }

        @Test
        void unknownPolicyThrows() {
            assertThrows(PolicyConfigurationException.class,
                () -> service.applyPolicy("missing", List.of(), Map.of(), null));
        }
    }

    @Nested
    @DisplayName("CRUD")
    class Crud {

        @Test
        void createStampsUserAndPersists() {
            String id = service.createPolicy(latinNight());

            MixingPolicy created = service.getPolicy(id).orElseThrow();
            assertEquals(MixingPolicy.USER, created.getCreatedBy());
            assertFalse(created.getCreatedAt().isEmpty());
            assertTrue(Files.exists(tempDir.resolve("policies").resolve(MixingPolicyService.POLICIES_FILE)));

            MixingPolicy reloaded = newService().getPolicy(id).orElseThrow();
            assertEquals(0.7, reloaded.globalWeight(PolicyType.QUALITY), EPS);
            assertEquals(OperatorType.GREATER_EQUAL, reloaded.getRuleSets().get(0).getRules().get(0).getOperator());
        }

        @Test
        @DisplayName("stored policies are detached from the caller's collections")
        void storedPolicyIsImmutable() {
            List<PolicyRuleSet> ruleSets = new ArrayList<>(latinNight().getRuleSets());
            MixingPolicy policy = latinNight().toBuilder().ruleSets(ruleSets).build();
            String id = service.createPolicy(policy);

            ruleSets.clear();
            MixingPolicy stored = service.getPolicy(id).orElseThrow();

            assertEquals(1, stored.getRuleSets().size());
            assertThrows(UnsupportedOperationException.class, () -> stored.getRuleSets().clear());
            assertThrows(UnsupportedOperationException.class,
                () -> stored.getGlobalWeights().put(PolicyType.ENERGY, 2.0));
            assertThrows(UnsupportedOperationException.class,
                () -> stored.getRuleSets().get(0).getRules().clear());
        }

        @Test
        void duplicateIdIsRejected() {
            service.createPolicy(latinNight());
            assertThrows(PolicyConfigurationException.class, () -> service.createPolicy(latinNight()));
            assertThrows(PolicyConfigurationException.class, () -> service.createPolicy(BuiltinPolicies.CLASSIC_DJ));
        }

        @Test
        void updateReplacesInstance() {
            service.createPolicy(latinNight());
            MixingPolicy before = service.getPolicy("latin_night").orElseThrow();

            assertTrue(service.updatePolicy("latin_night", p -> p.toBuilder().name("Latin Night v2").build()));
            assertFalse(service.updatePolicy("missing", p -> p));

            MixingPolicy after = service.getPolicy("latin_night").orElseThrow();
            assertEquals("Latin Night v2", after.getName());
            assertEquals("Latin Night", before.getName());
        }

        @Test
        void onlyUserPoliciesCanBeDeleted() {
            service.createPolicy(latinNight());

            assertFalse(service.deletePolicy("classic_dj"));
            assertTrue(service.deletePolicy("latin_night"));
            assertTrue(service.getPolicy("latin_night").isEmpty());
            assertTrue(newService().getPolicy("latin_night").isEmpty());
        }

        @Test
        void builtinsAreNotPersisted() throws IOException {
            service.createRuleSet(PolicyRuleSet.builder().id("my_rules").build());

            String json = Files.readString(tempDir.resolve("policies").resolve(MixingPolicyService.POLICIES_FILE));
            assertTrue(json.contains("my_rules"));
            assertFalse(json.contains("classic_dj"));
        }
    }

    @Nested
    @DisplayName("export / import")
    class ExportImport {

        @Test
        @DisplayName("exported policy imports under a fresh id")
        void roundTrip() {
            Path file = tempDir.resolve("classic.json");
            assertTrue(service.exportPolicy("classic_dj", file));

            Optional<String> first = service.importPolicy(file);
            Optional<String> second = service.importPolicy(file);

            assertEquals(Optional.of("classic_dj_1"), first);
            assertEquals(Optional.of("classic_dj_2"), second);

            MixingPolicy imported = service.getPolicy("classic_dj_1").orElseThrow();
            assertEquals(MixingPolicy.USER, imported.getCreatedBy());
            assertEquals(0.6, imported.globalWeight(PolicyType.HARMONIC), EPS);
            PolicyRule bpmRule = imported.getRuleSets().get(0).getRules().get(1);
            assertEquals(OperatorType.WITHIN_RANGE, bpmRule.getOperator());
            assertEquals(List.of(0.9, 1.1), bpmRule.getValue());
            assertEquals(RulePriority.MEDIUM, bpmRule.getPriority());
        }

        @Test
        void exportedJsonUsesSnakeCaseAndEnumValues() throws IOException {
            Path file = tempDir.resolve("modern.json");
            service.exportPolicy("modern_ai", file);

            String json = Files.readString(file);
            assertTrue(json.contains("\"rule_sets\""));
            assertTrue(json.contains("\"global_weights\""));
            assertTrue(json.contains("\"harmonic\""));
            assertTrue(json.contains("\"compatible_with\""));
            assertFalse(json.contains("user_defined"));
        }

        @Test
        void importedPolicyCannotBeModifiedThroughGetters() {
            Path file = tempDir.resolve("classic.json");
            service.exportPolicy("classic_dj", file);
            String id = service.importPolicy(file).orElseThrow();

            MixingPolicy imported = service.getPolicy(id).orElseThrow();

            assertThrows(UnsupportedOperationException.class, () -> imported.getRuleSets().clear());
            assertEquals(1, service.getPolicy(id).orElseThrow().getRuleSets().size());
        }

        @Test
        @DisplayName("rules imported without a policy type still apply")
        void importedRuleWithoutPolicyType() throws IOException {
            Path file = tempDir.resolve("untyped.json");
            Files.writeString(file, "{\"id\": \"untyped\", \"rule_sets\": [{\"id\": \"rs\", \"rules\": ["
                + "{\"id\": \"bpm_floor\", \"field\": \"bpm\", \"operator\": \"greater_equal\", \"value\": 120}]}]}");

            String id = service.importPolicy(file).orElseThrow();
            List<PolicyApplicationResult> results = service.applyPolicy(id,
                List.of(Track.builder().id("a").bpm(125.0).build()), Map.of(), null);

            assertEquals(PolicyType.CUSTOM,
                service.getPolicy(id).orElseThrow().getRuleSets().get(0).getRules().get(0).getPolicyType());
            assertEquals(1.0, results.get(0).getTotalScore(), EPS);
        }

        @Test
        void unknownPolicyIsNotExported() {
            assertFalse(service.exportPolicy("missing", tempDir.resolve("x.json")));
        }

        @Test
        void unreadableFileImportsNothing() throws IOException {
            Path file = tempDir.resolve("broken.json");
            Files.writeString(file, "{ not json");

            assertTrue(service.importPolicy(file).isEmpty());
        }
    }
}
