package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.dto.EnergySample;
import com.example.harmonicmixer.dto.StructuralAnalysis;
import com.example.harmonicmixer.dto.StructuralElement;
import com.example.harmonicmixer.dto.TransitionPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 结构兼容性评分器
 *
 * 消费外部音频分析产出的 StructuralAnalysis，评估时长、节拍、能量衔接、
 * 过渡点质量与时序可行性。缺少所需数据的子项一律返回中性分 0.5。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralCompatibilityScorer {

    private static final double NEUTRAL = 0.5;

    // ==================== 1. 结构分权重 ====================
    private static final double DURATION_WEIGHT = 0.3;
    private static final double BEAT_WEIGHT = 0.4;
    private static final double ENERGY_WEIGHT = 0.3;

    // ==================== 2. 时序分权重 ====================
    private static final double TEMPO_STABILITY_WEIGHT = 0.4;
    private static final double ELEMENT_MATCH_WEIGHT = 0.3;
    private static final double TIMING_WEIGHT = 0.3;

    // ==================== 3. 混音窗口（秒） ====================
    private static final double ENERGY_WINDOW = 30.0;
    private static final double MIN_OUT_REMAINING = 15.0;
    private static final double MAX_OUT_REMAINING = 45.0;
    private static final double IDEAL_OUT_REMAINING = 30.0;
    private static final double MIN_INTRO = 10.0;

    // ==================== 4. 最优过渡搜索 ====================
    private static final int TOP_POINTS = 5;
    private static final double BASE_MIX_DURATION = 16.0;
    private static final double MIN_MIX_DURATION = 8.0;
    private static final double MAX_MIX_DURATION = 32.0;

    // ==================== 5. 混入/混出点筛选 ====================
    private static final double MIX_OUT_SUITABILITY = 0.6;
    private static final double MIX_OUT_WINDOW = 30.0;
    private static final double MIX_IN_SUITABILITY = 0.5;
    private static final double MIX_IN_OUTRO_MARGIN = 30.0;

    private static final Map<StructuralElement, Map<StructuralElement, Double>> ELEMENT_COMPATIBILITY =
        new EnumMap<>(StructuralElement.class);

    static {
        Map<StructuralElement, Double> fromOutro = new EnumMap<>(StructuralElement.class);
        fromOutro.put(StructuralElement.INTRO, 1.0);
        fromOutro.put(StructuralElement.VERSE, 0.8);
        fromOutro.put(StructuralElement.BREAK, 0.9);
        ELEMENT_COMPATIBILITY.put(StructuralElement.OUTRO, fromOutro);

        Map<StructuralElement, Double> fromBreak = new EnumMap<>(StructuralElement.class);
        fromBreak.put(StructuralElement.VERSE, 0.9);
        fromBreak.put(StructuralElement.CHORUS, 0.7);
        fromBreak.put(StructuralElement.BUILDUP, 0.8);
        ELEMENT_COMPATIBILITY.put(StructuralElement.BREAK, fromBreak);

        Map<StructuralElement, Double> fromVerse = new EnumMap<>(StructuralElement.class);
        fromVerse.put(StructuralElement.VERSE, 0.8);
        fromVerse.put(StructuralElement.CHORUS, 0.6);
        fromVerse.put(StructuralElement.INTRO, 0.7);
        ELEMENT_COMPATIBILITY.put(StructuralElement.VERSE, fromVerse);
    }

    private final HarmonicScorer harmonicScorer;

    /**
     * 结构分 = 0.3*时长比 + 0.4*节拍 + 0.3*能量衔接
     */
    public double structuralScore(StructuralAnalysis out, StructuralAnalysis in) {
        return durationRatio(out, in) * DURATION_WEIGHT
            + beatScore(out, in) * BEAT_WEIGHT
            + energyContinuity(out, in) * ENERGY_WEIGHT;
    }

    public double durationRatio(StructuralAnalysis out, StructuralAnalysis in) {
        double longer = Math.max(out.getDuration(), in.getDuration());
        if (longer <= 0) {
            return NEUTRAL;
        }
        return Math.min(out.getDuration(), in.getDuration()) / longer;
    }

    /**
     * 由节拍网格的平均间隔推算 BPM，再复用和声评分器的 BPM 公式
     */
    public double beatScore(StructuralAnalysis out, StructuralAnalysis in) {
        double interval1 = meanBeatInterval(out.getBeatGrid());
        double interval2 = meanBeatInterval(in.getBeatGrid());
        if (interval1 <= 0 || interval2 <= 0) {
            return NEUTRAL;
        }
        return harmonicScorer.bpmScore(60.0 / interval1, 60.0 / interval2);
    }

    /**
     * 混出曲最后 30 秒的平均能量 vs 混入曲最初 30 秒的平均能量
     */
    public double energyContinuity(StructuralAnalysis out, StructuralAnalysis in) {
        if (isEmpty(out.getEnergyCurve()) || isEmpty(in.getEnergyCurve())) {
            return NEUTRAL;
        }
        double outroEnergy = meanEnergy(out.getEnergyCurve(),
            Math.max(0, out.getDuration() - ENERGY_WINDOW), out.getDuration());
        double introEnergy = meanEnergy(in.getEnergyCurve(),
            0, Math.min(ENERGY_WINDOW, in.getDuration()));
        return Math.max(0.0, 1.0 - Math.abs(outroEnergy - introEnergy));
    }

    /**
     * 过渡质量 = 双方最佳过渡点适合度的平均
     */
    public double transitionQuality(StructuralAnalysis out, StructuralAnalysis in) {
        Optional<TransitionPoint> bestOut = best(out.getTransitionPoints());
        Optional<TransitionPoint> bestIn = best(in.getTransitionPoints());
        if (bestOut.isEmpty() || bestIn.isEmpty()) {
            return NEUTRAL;
        }
        return (bestOut.get().getMixSuitability() + bestIn.get().getMixSuitability()) / 2;
    }

    /**
     * 时序分 = 0.4*速度稳定性 + 0.3*段落匹配 + 0.3*时机可行性
     */
    public double temporalScore(StructuralAnalysis out, StructuralAnalysis in) {
        return tempoStability(out, in) * TEMPO_STABILITY_WEIGHT
            + elementMatching(out, in) * ELEMENT_MATCH_WEIGHT
            + timingFeasibility(out, in) * TIMING_WEIGHT;
    }

    public double tempoStability(StructuralAnalysis out, StructuralAnalysis in) {
        return (stability(out) + stability(in)) / 2;
    }

    /**
     * 在所有 混出段落 × 混入段落 组合中取最高兼容度，未列出的组合为 0.5
     */
    public double elementMatching(StructuralAnalysis out, StructuralAnalysis in) {
        if (isEmpty(out.getTransitionPoints()) || isEmpty(in.getTransitionPoints())) {
            return NEUTRAL;
        }
        double bestCompatibility = 0.0;
        for (TransitionPoint outPoint : out.getTransitionPoints()) {
            for (TransitionPoint inPoint : in.getTransitionPoints()) {
                bestCompatibility = Math.max(bestCompatibility,
                    elementCompatibility(outPoint.getElementType(), inPoint.getElementType()));
            }
        }
        return bestCompatibility;
    }

    public double elementCompatibility(StructuralElement out, StructuralElement in) {
        if (out == null || in == null) {
            return NEUTRAL;
        }
        return ELEMENT_COMPATIBILITY.getOrDefault(out, Map.of()).getOrDefault(in, NEUTRAL);
    }

    public double timingFeasibility(StructuralAnalysis out, StructuralAnalysis in) {
        Optional<TransitionPoint> bestOut = best(out.getTransitionPoints());
        Optional<TransitionPoint> bestIn = best(in.getTransitionPoints());
        if (bestOut.isEmpty() || bestIn.isEmpty()) {
            return NEUTRAL;
        }
        double outScore = outTiming(out.getDuration() - bestOut.get().getTimeSeconds());
        double introTime = bestIn.get().getTimeSeconds();
        double inScore = introTime >= MIN_INTRO ? 1.0 : introTime / MIN_INTRO;
        return (outScore + inScore) / 2;
    }

    // ==================== 过渡点对 ====================

    /**
     * 单个过渡点对的质量：0.4*平均适合度 + 0.3*时机 + 0.2*能量匹配 + 0.1*较弱的节拍强度
     */
    public double evaluatePair(TransitionPoint outPoint, TransitionPoint inPoint, StructuralAnalysis out) {
        double pointQuality = (outPoint.getMixSuitability() + inPoint.getMixSuitability()) / 2;
        double timing = outTiming(out.getDuration() - outPoint.getTimeSeconds());
        double energy = Math.max(0.0, 1.0 - Math.abs(outPoint.getEnergyLevel() - inPoint.getEnergyLevel()));
        double beat = Math.min(outPoint.getBeatStrength(), inPoint.getBeatStrength());
        return pointQuality * 0.4 + timing * 0.3 + energy * 0.2 + beat * 0.1;
    }

    /**
     * 预估混音时长（秒）：能量落差大或节拍弱时延长，节拍强时缩短
     */
    public double estimateMixDuration(TransitionPoint outPoint, TransitionPoint inPoint) {
        double duration = BASE_MIX_DURATION;
        if (Math.abs(outPoint.getEnergyLevel() - inPoint.getEnergyLevel()) > 0.3) {
            duration += 8.0;
        }
        double minBeat = Math.min(outPoint.getBeatStrength(), inPoint.getBeatStrength());
        if (minBeat > 0.7) {
            duration -= 4.0;
        } else if (minBeat < 0.3) {
            duration += 8.0;
        }
        return Math.max(MIN_MIX_DURATION, Math.min(MAX_MIX_DURATION, duration));
    }

    /**
     * 参与最优过渡搜索的候选点（排名前 5）
     */
    public List<TransitionPoint> topPoints(StructuralAnalysis analysis) {
        List<TransitionPoint> points = analysis.getTransitionPoints();
        if (isEmpty(points)) {
            return List.of();
        }
        return points.subList(0, Math.min(TOP_POINTS, points.size()));
    }

    // ==================== 混入/混出点 ====================

    /**
     * 最佳混出点：给定目标时间时，优先取 30 秒内、适合度 > 0.6 且离目标最近的点，
     * 否则取适合度最高的点
     */
    public Optional<TransitionPoint> bestMixOutPoint(StructuralAnalysis analysis, Double targetTime) {
        if (isEmpty(analysis.getTransitionPoints())) {
            return Optional.empty();
        }
        if (targetTime != null) {
            Optional<TransitionPoint> closest = analysis.getTransitionPoints().stream()
                .filter(tp -> tp.getMixSuitability() > MIX_OUT_SUITABILITY
                    && Math.abs(tp.getTimeSeconds() - targetTime) < MIX_OUT_WINDOW)
                .min(Comparator.comparingDouble(tp -> Math.abs(tp.getTimeSeconds() - targetTime)));
            if (closest.isPresent()) {
                return closest;
            }
        }
        return best(analysis.getTransitionPoints());
    }

    /**
     * 最佳混入点：前奏之后、尾奏前 30 秒之前、适合度 > 0.5 的点中适合度最高者
     */
    public Optional<TransitionPoint> bestMixInPoint(StructuralAnalysis analysis) {
        if (isEmpty(analysis.getTransitionPoints())) {
            return Optional.empty();
        }
        double introEnd = analysis.getIntroEnd() != null ? analysis.getIntroEnd() : 0.0;
        double outroStart = analysis.getOutroStart() != null ? analysis.getOutroStart() : analysis.getDuration();

        Optional<TransitionPoint> suitable = analysis.getTransitionPoints().stream()
            .filter(tp -> tp.getTimeSeconds() > introEnd
                && tp.getTimeSeconds() < outroStart - MIX_IN_OUTRO_MARGIN
                && tp.getMixSuitability() > MIX_IN_SUITABILITY)
            .max(Comparator.comparingDouble(TransitionPoint::getMixSuitability));
        return suitable.isPresent() ? suitable : best(analysis.getTransitionPoints());
    }

    // ==================== 内部工具 ====================

    private double outTiming(double remaining) {
        if (remaining >= MIN_OUT_REMAINING && remaining <= MAX_OUT_REMAINING) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(remaining - IDEAL_OUT_REMAINING) / IDEAL_OUT_REMAINING);
    }

    private double stability(StructuralAnalysis analysis) {
        if (analysis.getDuration() <= 0) {
            return NEUTRAL;
        }
        int changes = analysis.getTempoChanges() == null ? 0 : analysis.getTempoChanges().size();
        return 1.0 - Math.min(changes / (analysis.getDuration() / 60.0), 1.0);
    }

    private static double meanBeatInterval(List<Double> beats) {
        if (beats == null || beats.size() < 2) {
            return 0;
        }
        return (beats.get(beats.size() - 1) - beats.get(0)) / (beats.size() - 1);
    }

    private static double meanEnergy(List<EnergySample> curve, double start, double end) {
        double sum = 0.0;
        int count = 0;
        for (EnergySample sample : curve) {
            if (sample.getTimeSeconds() >= start && sample.getTimeSeconds() <= end) {
                sum += sample.getEnergy();
                count++;
            }
        }
        return count > 0 ? sum / count : NEUTRAL;
    }

    private static Optional<TransitionPoint> best(List<TransitionPoint> points) {
        if (isEmpty(points)) {
            return Optional.empty();
        }
        return points.stream().max(Comparator.comparingDouble(TransitionPoint::getMixSuitability));
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
