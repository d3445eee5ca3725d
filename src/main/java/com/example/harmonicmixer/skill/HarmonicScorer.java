package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.Track;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 调性 / 速度 / 能量 / 情绪 兼容性评分器
 *
 * 只在两首曲目都有值的维度上累加 权重×分数，缺失维度不贡献分数，
 * 总分不按实际使用的权重归一化（缺数据即被惩罚），最后截断到 1.0。
 * 值为 null 或 0 视为缺失，非法调性同样视为缺失。
 */
@Slf4j
@Component
public class HarmonicScorer {

    private final double bpmTolerance;
    private final double energyTolerance;
    private final MixMode defaultMode;

    public HarmonicScorer(MixerProperties properties) {
        this.bpmTolerance = properties.getHarmonic().getBpmTolerance();
        this.energyTolerance = properties.getHarmonic().getEnergyTolerance();
        this.defaultMode = properties.getHarmonic().getDefaultMode();
    }

    public MixMode getDefaultMode() {
        return defaultMode;
    }

    public double compatibility(Track a, Track b) {
        return compatibility(a, b, defaultMode);
    }

    public double compatibility(Track a, Track b, MixMode mode) {
        return compatibility(a, b, HarmonicWeights.of(mode != null ? mode : defaultMode));
    }

    public double compatibility(Track a, Track b, HarmonicWeights weights) {
        double score = 0.0;

        if (CamelotWheel.isValid(a.getKey()) && CamelotWheel.isValid(b.getKey())) {
            score += weights.getKey() * keyScore(a.getKey(), b.getKey());
        }
        if (present(a.getBpm()) && present(b.getBpm())) {
            score += weights.getBpm() * bpmScore(a.getBpm(), b.getBpm());
        }
        if (present(a.getEnergy()) && present(b.getEnergy())) {
            score += weights.getEnergy() * energyScore(a.getEnergy(), b.getEnergy());
        }
        if (present(a.getEmotionalIntensity()) && present(b.getEmotionalIntensity())) {
            score += weights.getEmotional() * emotionalScore(a.getEmotionalIntensity(), b.getEmotionalIntensity());
        }

        return Math.min(score, 1.0);
    }

    /**
     * 调性分数（两个调性都必须合法）
     */
    public double keyScore(String key1, String key2) {
        if (key1.equals(key2)) {
            return 1.0;
        }
        if (CamelotWheel.compatibleKeys(key1).contains(key2)) {
            return 0.8;
        }
        // 关系大小调已包含在兼容调中，此分支不会命中
        if (CamelotWheel.number(key1) == CamelotWheel.number(key2)
            && CamelotWheel.letter(key1) != CamelotWheel.letter(key2)) {
            return 0.7;
        }
        int distance = CamelotWheel.distance(key1, key2);
        return Math.max(0.0, 0.5 - distance * 0.1);
    }

    public double bpmScore(double bpm1, double bpm2) {
        double diff = Math.abs(bpm1 - bpm2);
        if (diff <= 2) {
            return 1.0;
        }
        if (diff <= bpmTolerance) {
            return 1.0 - (diff / bpmTolerance) * 0.5;
        }
        // 半速 / 倍速
        if (Math.abs(bpm1 * 2 - bpm2) <= 4 || Math.abs(bpm1 - bpm2 * 2) <= 4) {
            return 0.6;
        }
        return Math.max(0.0, 0.3 - (diff - bpmTolerance) * 0.02);
    }

    public double energyScore(double energy1, double energy2) {
        double diff = Math.abs(energy1 - energy2);
        if (diff <= 1) {
            return 1.0;
        }
        if (diff <= energyTolerance) {
            return 0.8;
        }
        return Math.max(0.0, 0.5 - (diff - energyTolerance) * 0.1);
    }

    public double emotionalScore(double emotion1, double emotion2) {
        return Math.max(0.0, 1.0 - Math.abs(emotion1 - emotion2) / 10.0);
    }

    /**
     * 两两兼容性矩阵，对角线为 0
     */
    public double[][] compatibilityMatrix(List<Track> tracks, MixMode mode) {
        int n = tracks.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    matrix[i][j] = compatibility(tracks.get(i), tracks.get(j), mode);
                }
            }
        }
        log.debug("[HarmonicScorer] 构建 {}x{} 兼容性矩阵, mode={}", n, n, mode);
        return matrix;
    }

    private static boolean present(Double value) {
        return value != null && value != 0.0;
    }
}
