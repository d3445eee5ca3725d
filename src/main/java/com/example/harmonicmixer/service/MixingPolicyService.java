package com.example.harmonicmixer.service;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.policy.BuiltinPolicies;
import com.example.harmonicmixer.policy.MixingPolicy;
import com.example.harmonicmixer.policy.PolicyApplicationResult;
import com.example.harmonicmixer.policy.PolicyConfigurationException;
import com.example.harmonicmixer.policy.PolicyDocument;
import com.example.harmonicmixer.policy.PolicyRuleSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * 混音策略管理服务
 *
 * 功能：
 * 1. 内置策略与规则集（classic_dj / modern_ai / cultural_journey）
 * 2. 用户策略的增删改查，持久化到 policies.json
 * 3. 策略的导入导出
 * 4. 将策略应用到一组曲目
 */
@Slf4j
@Service
public class MixingPolicyService {

    public static final String POLICIES_FILE = "policies.json";

    private final PolicyRuleEngine ruleEngine;
    private final ObjectMapper objectMapper;
    private final Path configDir;

    /**
     * 策略存储
     * Key: policyId
     */
    private final Map<String, MixingPolicy> policies = new ConcurrentHashMap<>();

    /**
     * 规则集存储
     * Key: ruleSetId
     */
    private final Map<String, PolicyRuleSet> ruleSets = new ConcurrentHashMap<>();

    public MixingPolicyService(PolicyRuleEngine ruleEngine, ObjectMapper objectMapper, MixerProperties properties) {
        this.ruleEngine = ruleEngine;
        this.objectMapper = objectMapper;
        this.configDir = Paths.get(properties.getPolicy().getConfigDir());

        BuiltinPolicies.policies().forEach(p -> policies.put(p.getId(), p));
        BuiltinPolicies.ruleSets().forEach(rs -> ruleSets.put(rs.getId(), rs));
        loadUserPolicies();
    }

    // ==================== 应用 ====================

    /**
     * 将策略应用到每首曲目，结果与输入顺序一致
     *
     * @param metadata 曲目 ID -> LLM 元数据
     * @param context  可选上下文（time_of_day / activity），用于自适应规则
     */
    public List<PolicyApplicationResult> applyPolicy(String policyId, List<Track> tracks,
                                                     Map<String, Map<String, Object>> metadata,
                                                     Map<String, Object> context) {
        MixingPolicy policy = policies.get(policyId);
        if (policy == null) {
            throw new PolicyConfigurationException("策略 '" + policyId + "' 不存在");
        }
        List<PolicyApplicationResult> results = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            Map<String, Object> trackMetadata = metadata == null ? Map.of() : metadata.getOrDefault(track.getId(), Map.of());
            results.add(ruleEngine.apply(policy, track, trackMetadata, context));
        }
        log.info("[PolicyService] 策略 {} 已应用到 {} 首曲目", policyId, tracks.size());
        return results;
    }

    // ==================== CRUD ====================

    public synchronized String createPolicy(MixingPolicy policy) {
        if (policies.containsKey(policy.getId())) {
            throw new PolicyConfigurationException("策略 '" + policy.getId() + "' 已存在");
        }
        String now = LocalDateTime.now().toString();
        MixingPolicy created = policy.toBuilder()
            .createdBy(MixingPolicy.USER)
            .createdAt(now)
            .lastModified(now)
            .build();
        policies.put(created.getId(), created);
        saveUserPolicies();
        log.info("[PolicyService] 创建策略: {}", created.getId());
        return created.getId();
    }

    /**
     * 以新实例替换策略；ID 保持不变
     *
     * @return 策略不存在时返回 false
     */
    public synchronized boolean updatePolicy(String policyId, UnaryOperator<MixingPolicy> update) {
        MixingPolicy existing = policies.get(policyId);
        if (existing == null) {
            return false;
        }
        MixingPolicy updated = update.apply(existing).toBuilder()
            .id(policyId)
            .lastModified(LocalDateTime.now().toString())
            .build();
        policies.put(policyId, updated);
        saveUserPolicies();
        log.info("[PolicyService] 更新策略: {}", policyId);
        return true;
    }

    /**
     * 只允许删除用户策略
     */
    public synchronized boolean deletePolicy(String policyId) {
        MixingPolicy existing = policies.get(policyId);
        if (existing == null || !MixingPolicy.USER.equals(existing.getCreatedBy())) {
            return false;
        }
        policies.remove(policyId);
        saveUserPolicies();
        log.info("[PolicyService] 删除策略: {}", policyId);
        return true;
    }

    public Optional<MixingPolicy> getPolicy(String policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    public List<MixingPolicy> listPolicies() {
        return policies.values().stream()
            .sorted(Comparator.comparing(MixingPolicy::getId))
            .collect(Collectors.toList());
    }

    public synchronized String createRuleSet(PolicyRuleSet ruleSet) {
        if (ruleSets.containsKey(ruleSet.getId())) {
            throw new PolicyConfigurationException("规则集 '" + ruleSet.getId() + "' 已存在");
        }
        PolicyRuleSet created = ruleSet.toBuilder().createdBy(MixingPolicy.USER).build();
        ruleSets.put(created.getId(), created);
        saveUserPolicies();
        return created.getId();
    }

    public Optional<PolicyRuleSet> getRuleSet(String ruleSetId) {
        return Optional.ofNullable(ruleSets.get(ruleSetId));
    }

    public List<PolicyRuleSet> listRuleSets() {
        return ruleSets.values().stream()
            .sorted(Comparator.comparing(PolicyRuleSet::getId))
            .collect(Collectors.toList());
    }

    // ==================== 导入导出 ====================

    public boolean exportPolicy(String policyId, Path file) {
        MixingPolicy policy = policies.get(policyId);
        if (policy == null) {
            return false;
        }
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), policy);
            log.info("[PolicyService] 导出策略 {} -> {}", policyId, file);
            return true;
        } catch (IOException e) {
            log.error("[PolicyService] 导出策略失败: {}", policyId, e);
            return false;
        }
    }

    /**
     * 导入策略；ID 冲突时依次追加 _1、_2 ...
     */
    public synchronized Optional<String> importPolicy(Path file) {
        MixingPolicy imported;
        try {
            imported = objectMapper.readValue(file.toFile(), MixingPolicy.class);
        } catch (IOException | IllegalArgumentException e) {
            log.error("[PolicyService] 导入策略失败: {}", file, e);
            return Optional.empty();
        }
        if (imported.getId() == null) {
            log.error("[PolicyService] 导入策略失败，缺少 id: {}", file);
            return Optional.empty();
        }

        String id = imported.getId();
        int counter = 1;
        while (policies.containsKey(id)) {
            id = imported.getId() + "_" + counter++;
        }
        MixingPolicy policy = imported.toBuilder().id(id).createdBy(MixingPolicy.USER).build();
        policies.put(id, policy);
        saveUserPolicies();
        log.info("[PolicyService] 导入策略 {} <- {}", id, file);
        return Optional.of(id);
    }

    // ==================== 持久化 ====================

    private void loadUserPolicies() {
        Path file = configDir.resolve(POLICIES_FILE);
        if (!Files.exists(file)) {
            return;
        }
        try {
            PolicyDocument document = objectMapper.readValue(file.toFile(), PolicyDocument.class);
            document.getPolicies().forEach(p -> policies.put(p.getId(), p));
            document.getRuleSets().forEach(rs -> ruleSets.put(rs.getId(), rs));
            log.info("[PolicyService] 加载用户策略 {} 个、规则集 {} 个",
                document.getPolicies().size(), document.getRuleSets().size());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[PolicyService] 无法加载用户策略: {}", e.getMessage());
        }
    }

    /**
     * 只保存非内置（createdBy != system）的策略与规则集
     */
    private void saveUserPolicies() {
        PolicyDocument document = new PolicyDocument(
            policies.values().stream().filter(MixingPolicy::isUserDefined)
                .sorted(Comparator.comparing(MixingPolicy::getId)).collect(Collectors.toList()),
            ruleSets.values().stream().filter(rs -> !MixingPolicy.SYSTEM.equals(rs.getCreatedBy()))
                .sorted(Comparator.comparing(PolicyRuleSet::getId)).collect(Collectors.toList()));
        try {
            Files.createDirectories(configDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(configDir.resolve(POLICIES_FILE).toFile(), document);
        } catch (IOException e) {
            log.error("[PolicyService] 保存用户策略失败: {}", configDir, e);
        }
    }
}
