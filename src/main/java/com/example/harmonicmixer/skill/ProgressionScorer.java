package com.example.harmonicmixer.skill;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 歌单走向评分：能量递进与多样性
 */
@Slf4j
@Component
public class ProgressionScorer {

    private static final double DEFAULT_DANCEABILITY = 0.5;
    private static final double MAX_ENERGY_STEP = 0.3;

    // ==================== 多样性惩罚 ====================
    private static final double SAME_SUBGENRE_PENALTY = 0.2;
    private static final double SAME_MOOD_PENALTY = 0.1;
    private static final double SAME_ERA_PENALTY = 0.1;

    /**
     * 以可舞性作为能量代理：0.7 * 贴近目标能量 + 0.3 * 与当前曲目的平滑过渡。
     * 缺少 danceability 字段按 0.5 计，字段存在但无法解析时返回 0.5
     */
    public double energyProgressionScore(Map<String, Object> current, Map<String, Object> candidate,
                                         double targetEnergy) {
        Double currentEnergy = danceability(current);
        Double candidateEnergy = danceability(candidate);
        if (currentEnergy == null || candidateEnergy == null) {
            return 0.5;
        }
        double targetMatch = 1.0 - Math.abs(candidateEnergy - targetEnergy);
        double transition = 1.0 - Math.min(Math.abs(candidateEnergy - currentEnergy), MAX_ENERGY_STEP) / MAX_ENERGY_STEP;
        return targetMatch * 0.7 + transition * 0.3;
    }

    /**
     * 相同子流派 -0.2、相同情绪 -0.1、相同年代 -0.1，下限 0
     */
    public double varietyScore(Map<String, Object> current, Map<String, Object> candidate) {
        double score = 1.0;
        if (sameValue(current, candidate, "subgenre")) {
            score -= SAME_SUBGENRE_PENALTY;
        }
        if (sameValue(current, candidate, "mood")) {
            score -= SAME_MOOD_PENALTY;
        }
        if (sameValue(current, candidate, "era")) {
            score -= SAME_ERA_PENALTY;
        }
        return Math.max(0.0, score);
    }

    private static Double danceability(Map<String, Object> metadata) {
        if (metadata == null || !metadata.containsKey("danceability")) {
            return DEFAULT_DANCEABILITY;
        }
        return MetadataValues.normalizePercentage(metadata.get("danceability"));
    }

    private static boolean sameValue(Map<String, Object> current, Map<String, Object> candidate, String field) {
        String a = rawString(current, field);
        String b = rawString(candidate, field);
        return !a.isEmpty() && a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }

    private static String rawString(Map<String, Object> metadata, String field) {
        Object value = metadata == null ? null : metadata.get(field);
        return value instanceof String ? (String) value : "";
    }
}
