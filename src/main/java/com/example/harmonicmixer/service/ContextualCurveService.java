package com.example.harmonicmixer.service;

import com.example.harmonicmixer.dto.ContextType;
import com.example.harmonicmixer.dto.ContextualCurve;
import com.example.harmonicmixer.dto.CurveShape;
import com.example.harmonicmixer.skill.MetadataValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 情境能量曲线服务
 *
 * 功能：
 * 1. 维护时段/活动/能量/情绪/季节五类曲线目录
 * 2. 根据请求上下文选择曲线
 * 3. 将曲线展开为每个位置的目标能量
 * 4. 计算曲目与曲线上下文的契合度
 */
@Slf4j
@Service
public class ContextualCurveService {

    public static final String DEFAULT_TIME_CURVE = "evening";

    // ==================== 上下文评分权重 ====================
    private static final double TIME_WEIGHT = 0.3;
    private static final double ACTIVITY_WEIGHT = 0.25;
    private static final double ENERGY_WEIGHT = 0.2;
    private static final double MOOD_WEIGHT = 0.15;
    private static final double CROWD_WEIGHT = 0.1;

    // ==================== 曲线形状参数 ====================
    private static final double VALLEY_POSITION = 0.4;
    private static final double BUILD_POSITION = 0.7;
    private static final double DROP_WINDOW = 0.1;
    private static final double SMOOTHING_THRESHOLD = 0.5;

    private static final Map<String, List<String>> COMPATIBLE_TIMES = Map.of(
        "morning", List.of("afternoon"),
        "afternoon", List.of("morning", "evening"),
        "evening", List.of("afternoon", "night"),
        "night", List.of("evening", "late_night"),
        "late_night", List.of("night")
    );

    private static final Map<String, List<String>> COMPATIBLE_ACTIVITIES = Map.of(
        "party", List.of("dance", "celebration", "social dancing"),
        "workout", List.of("fitness", "energy", "motivation"),
        "chill", List.of("relax", "background", "lounge"),
        "dance", List.of("party", "social dancing", "celebration"),
        "focus", List.of("work", "study", "background")
    );

    private static final Map<String, List<String>> COMPATIBLE_MOODS = Map.of(
        "energetic", List.of("uplifting", "festive", "powerful"),
        "romantic", List.of("passionate", "sensual", "emotional"),
        "uplifting", List.of("happy", "positive", "energetic"),
        "chill", List.of("relaxed", "calm", "smooth"),
        "passionate", List.of("romantic", "intense", "emotional")
    );

    /**
     * 曲线目录
     * Key: 上下文类型 -> (曲线键 -> 曲线)
     */
    private final Map<ContextType, Map<String, ContextualCurve>> catalog = new EnumMap<>(ContextType.class);

    public ContextualCurveService() {
        catalog.put(ContextType.TIME, timeCurves());
        catalog.put(ContextType.ACTIVITY, activityCurves());
        catalog.put(ContextType.ENERGY, energyCurves());
        catalog.put(ContextType.MOOD, moodCurves());
        catalog.put(ContextType.SEASON, seasonCurves());
    }

    // ==================== 曲线目录 ====================

    private static Map<String, ContextualCurve> timeCurves() {
        Map<String, ContextualCurve> curves = new LinkedHashMap<>();
        curves.put("morning", ContextualCurve.builder()
            .name("Morning Warm-up").contextType(ContextType.TIME).contextValue("morning")
            .shape(CurveShape.ASCENDING).energyFrom(0.3).energyTo(0.7).durationMinutes(45)
            .peakPosition(0.8)
            .moodPreference("uplifting").moodPreference("energetic").moodPreference("positive")
            .build());
        curves.put("afternoon", ContextualCurve.builder()
            .name("Afternoon Energy").contextType(ContextType.TIME).contextValue("afternoon")
            .shape(CurveShape.FLAT).energyFrom(0.6).energyTo(0.8).durationMinutes(60)
            .moodPreference("energetic").moodPreference("uplifting").moodPreference("happy")
            .build());
        curves.put("evening", ContextualCurve.builder()
            .name("Evening Prime Time").contextType(ContextType.TIME).contextValue("evening")
            .shape(CurveShape.BUILD_DROP).energyFrom(0.7).energyTo(0.95).durationMinutes(90)
            .peakPosition(0.6)
            .moodPreference("energetic").moodPreference("passionate").moodPreference("festive")
            .build());
        curves.put("night", ContextualCurve.builder()
            .name("Night Peak Experience").contextType(ContextType.TIME).contextValue("night")
            .shape(CurveShape.PEAK).energyFrom(0.8).energyTo(1.0).durationMinutes(120)
            .peakPosition(0.5)
            .moodPreference("energetic").moodPreference("passionate").moodPreference("intense")
            .build());
        curves.put("late_night", ContextualCurve.builder()
            .name("Late Night Wind Down").contextType(ContextType.TIME).contextValue("late_night")
            .shape(CurveShape.DESCENDING).energyFrom(0.6).energyTo(0.3).durationMinutes(60)
            .moodPreference("romantic").moodPreference("passionate").moodPreference("chill")
            .build());
        return curves;
    }

    private static Map<String, ContextualCurve> activityCurves() {
        Map<String, ContextualCurve> curves = new LinkedHashMap<>();
        curves.put("party", ContextualCurve.builder()
            .name("Party Energy").contextType(ContextType.ACTIVITY).contextValue("party")
            .shape(CurveShape.WAVE).energyFrom(0.7).energyTo(0.95).durationMinutes(90)
            .moodPreference("energetic").moodPreference("festive").moodPreference("uplifting")
            .activityPreference("party").activityPreference("dance").activityPreference("celebration")
            .build());
        curves.put("workout", ContextualCurve.builder()
            .name("Workout Motivation").contextType(ContextType.ACTIVITY).contextValue("workout")
            .shape(CurveShape.FLAT).energyFrom(0.8).energyTo(0.95).durationMinutes(45)
            .moodPreference("energetic").moodPreference("motivational").moodPreference("intense")
            .activityPreference("workout").activityPreference("fitness").activityPreference("energy")
            .build());
        curves.put("chill", ContextualCurve.builder()
            .name("Chill Vibes").contextType(ContextType.ACTIVITY).contextValue("chill")
            .shape(CurveShape.FLAT).energyFrom(0.3).energyTo(0.6).durationMinutes(60)
            .moodPreference("chill").moodPreference("relaxed").moodPreference("smooth")
            .activityPreference("chill").activityPreference("relax").activityPreference("background")
            .build());
        curves.put("social_dancing", ContextualCurve.builder()
            .name("Social Dance Flow").contextType(ContextType.ACTIVITY).contextValue("social_dancing")
            .shape(CurveShape.WAVE).energyFrom(0.6).energyTo(0.85).durationMinutes(120)
            .moodPreference("passionate").moodPreference("romantic").moodPreference("energetic")
            .activityPreference("social dancing").activityPreference("dance").activityPreference("party")
            .build());
        curves.put("focus", ContextualCurve.builder()
            .name("Focus Background").contextType(ContextType.ACTIVITY).contextValue("focus")
            .shape(CurveShape.FLAT).energyFrom(0.2).energyTo(0.4).durationMinutes(90)
            .moodPreference("calm").moodPreference("focused").moodPreference("instrumental")
            .activityPreference("focus").activityPreference("work").activityPreference("background")
            .build());
        return curves;
    }

    private static Map<String, ContextualCurve> energyCurves() {
        Map<String, ContextualCurve> curves = new LinkedHashMap<>();
        curves.put("warm_up", ContextualCurve.builder()
            .name("Warm Up").contextType(ContextType.ENERGY).contextValue("warm_up")
            .shape(CurveShape.ASCENDING).energyFrom(0.3).energyTo(0.7).durationMinutes(30)
            .build());
        curves.put("peak_time", ContextualCurve.builder()
            .name("Peak Time").contextType(ContextType.ENERGY).contextValue("peak_time")
            .shape(CurveShape.FLAT).energyFrom(0.8).energyTo(0.95).durationMinutes(60)
            .build());
        curves.put("cool_down", ContextualCurve.builder()
            .name("Cool Down").contextType(ContextType.ENERGY).contextValue("cool_down")
            .shape(CurveShape.DESCENDING).energyFrom(0.7).energyTo(0.3).durationMinutes(30)
            .build());
        return curves;
    }

    private static Map<String, ContextualCurve> moodCurves() {
        Map<String, ContextualCurve> curves = new LinkedHashMap<>();
        curves.put("romantic_journey", ContextualCurve.builder()
            .name("Romantic Journey").contextType(ContextType.MOOD).contextValue("romantic")
            .shape(CurveShape.WAVE).energyFrom(0.4).energyTo(0.8).durationMinutes(75)
            .moodPreference("romantic").moodPreference("passionate").moodPreference("sensual")
            .build());
        curves.put("energy_blast", ContextualCurve.builder()
            .name("Energy Blast").contextType(ContextType.MOOD).contextValue("energetic")
            .shape(CurveShape.ASCENDING).energyFrom(0.6).energyTo(1.0).durationMinutes(45)
            .moodPreference("energetic").moodPreference("intense").moodPreference("powerful")
            .build());
        return curves;
    }

    private static Map<String, ContextualCurve> seasonCurves() {
        Map<String, ContextualCurve> curves = new LinkedHashMap<>();
        curves.put("summer", ContextualCurve.builder()
            .name("Summer Vibes").contextType(ContextType.SEASON).contextValue("summer")
            .shape(CurveShape.WAVE).energyFrom(0.6).energyTo(0.9).durationMinutes(90)
            .moodPreference("uplifting").moodPreference("festive").moodPreference("energetic")
            .build());
        curves.put("winter", ContextualCurve.builder()
            .name("Winter Warmth").contextType(ContextType.SEASON).contextValue("winter")
            .shape(CurveShape.ASCENDING).energyFrom(0.4).energyTo(0.8).durationMinutes(75)
            .moodPreference("warm").moodPreference("cozy").moodPreference("romantic")
            .build());
        return curves;
    }

    public Map<ContextType, List<String>> availableCurves() {
        Map<ContextType, List<String>> result = new EnumMap<>(ContextType.class);
        catalog.forEach((type, curves) -> result.put(type, List.copyOf(curves.keySet())));
        return result;
    }

    public ContextualCurve getCurve(ContextType type, String key) {
        return catalog.get(type).get(key);
    }

    // ==================== 曲线选择 ====================

    /**
     * 按 时段、活动、能量、情绪、季节 的顺序收集候选；活动曲线优先，
     * 否则取第一个候选，没有候选时使用傍晚曲线。指定时长时返回副本。
     */
    public ContextualCurve selectCurve(String timeOfDay, String activity, String energyPreference,
                                       String moodPreference, String season, Integer durationMinutes) {
        List<ContextualCurve> candidates = new ArrayList<>();
        addCandidate(candidates, ContextType.TIME, timeOfDay);
        addCandidate(candidates, ContextType.ACTIVITY, activity);
        addCandidate(candidates, ContextType.ENERGY, energyPreference);
        addCandidate(candidates, ContextType.MOOD, moodPreference);
        addCandidate(candidates, ContextType.SEASON, season);

        ContextualCurve selected = candidates.stream()
            .filter(c -> c.getContextType() == ContextType.ACTIVITY)
            .findFirst()
            .orElse(candidates.isEmpty() ? getCurve(ContextType.TIME, DEFAULT_TIME_CURVE) : candidates.get(0));

        if (durationMinutes != null && durationMinutes > 0) {
            selected = selected.withDurationMinutes(durationMinutes);
        }
        log.debug("[CurveService] 候选曲线 {} 个, 选中: {}", candidates.size(), selected.getName());
        return selected;
    }

    /**
     * 情绪曲线既可按曲线键（romantic_journey）也可按情绪值（romantic）匹配
     */
    private void addCandidate(List<ContextualCurve> candidates, ContextType type, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String key = value.toLowerCase(Locale.ROOT);
        Map<String, ContextualCurve> curves = catalog.get(type);
        ContextualCurve curve = curves.get(key);
        if (curve == null && type == ContextType.MOOD) {
            curve = curves.values().stream()
                .filter(c -> key.equals(c.getContextValue()))
                .findFirst()
                .orElse(null);
        }
        if (curve != null) {
            candidates.add(curve);
        }
    }

    // ==================== 能量走向 ====================

    /**
     * 将曲线展开为 n 个位置的目标能量（0-1）
     */
    public List<Double> energyProgression(ContextualCurve curve, int n) {
        double min = curve.getMinEnergy();
        double max = curve.getMaxEnergy();
        double range = max - min;
        if (n <= 1) {
            return Collections.singletonList((min + max) / 2);
        }

        double[] progression = new double[n];
        for (int i = 0; i < n; i++) {
            double pos = (double) i / (n - 1);
            double energy;
            switch (curve.getShape()) {
                case ASCENDING:
                    energy = min + range * pos;
                    break;
                case DESCENDING:
                    energy = max - range * pos;
                    break;
                case PEAK: {
                    double peak = curve.getPeakPosition();
                    energy = pos <= peak
                        ? min + range * (pos / peak)
                        : max - range * ((pos - peak) / (1 - peak)) * 0.5;
                    break;
                }
                case VALLEY:
                    energy = pos <= VALLEY_POSITION
                        ? max - range * (pos / VALLEY_POSITION) * 0.6
                        : min + range * ((pos - VALLEY_POSITION) / (1 - VALLEY_POSITION));
                    break;
                case WAVE:
                    energy = min + range * (Math.sin(pos * Math.PI * 2.5) * 0.3 + 0.5);
                    break;
                case BUILD_DROP:
                    if (pos <= BUILD_POSITION) {
                        energy = min + range * (pos / BUILD_POSITION);
                    } else if (pos <= BUILD_POSITION + DROP_WINDOW) {
                        energy = max * 0.6;
                    } else {
                        energy = max * 0.7;
                    }
                    break;
                case FLAT:
                default:
                    energy = (min + max) / 2;
                    break;
            }
            progression[i] = Math.max(min, Math.min(max, energy));
        }

        double smoothness = curve.getTransitionSmoothness();
        List<Double> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (smoothness > SMOOTHING_THRESHOLD && n > 2 && i > 0 && i < n - 1) {
                double neighbors = (progression[i - 1] + progression[i + 1]) / 2;
                result.add(progression[i] * (1 - smoothness) + neighbors * smoothness);
            } else {
                result.add(progression[i]);
            }
        }
        return result;
    }

    // ==================== 上下文契合度 ====================

    /**
     * 曲目元数据与曲线上下文的契合度（0-1），按实际参与的维度归一化；无可用维度时为 0.5
     */
    public double contextScore(Map<String, Object> metadata, ContextualCurve curve, double targetEnergy) {
        double score = 0.0;
        double totalWeight = 0.0;

        String trackTime = MetadataValues.string(metadata, "time_of_day");
        if (trackTime != null && curve.getContextType() == ContextType.TIME) {
            if (trackTime.equals(curve.getContextValue())) {
                score += TIME_WEIGHT;
            } else if (COMPATIBLE_TIMES.getOrDefault(curve.getContextValue(), List.of()).contains(trackTime)) {
                score += TIME_WEIGHT * 0.7;
            } else {
                score += TIME_WEIGHT * 0.2;
            }
            totalWeight += TIME_WEIGHT;
        }

        String trackActivity = MetadataValues.string(metadata, "activity");
        if (trackActivity != null && !curve.getActivityPreferences().isEmpty()) {
            if (containsIgnoreCase(curve.getActivityPreferences(), trackActivity)) {
                score += ACTIVITY_WEIGHT;
            } else if (compatibleWithAny(COMPATIBLE_ACTIVITIES, curve.getActivityPreferences(), trackActivity)) {
                score += ACTIVITY_WEIGHT * 0.6;
            } else {
                score += ACTIVITY_WEIGHT * 0.1;
            }
            totalWeight += ACTIVITY_WEIGHT;
        }

        Double danceability = MetadataValues.percentage(metadata, "danceability");
        if (danceability != null) {
            score += ENERGY_WEIGHT * Math.max(0.0, 1.0 - Math.abs(danceability - targetEnergy));
            totalWeight += ENERGY_WEIGHT;
        }

        String trackMood = MetadataValues.string(metadata, "mood");
        if (trackMood != null && !curve.getMoodPreferences().isEmpty()) {
            if (containsIgnoreCase(curve.getMoodPreferences(), trackMood)) {
                score += MOOD_WEIGHT;
            } else if (compatibleWithAny(COMPATIBLE_MOODS, curve.getMoodPreferences(), trackMood)) {
                score += MOOD_WEIGHT * 0.6;
            } else {
                score += MOOD_WEIGHT * 0.3;
            }
            totalWeight += MOOD_WEIGHT;
        }

        Double crowdAppeal = MetadataValues.percentage(metadata, "crowd_appeal");
        if (crowdAppeal != null) {
            score += CROWD_WEIGHT * crowdAppeal;
            totalWeight += CROWD_WEIGHT;
        }

        return totalWeight > 0 ? Math.max(0.0, Math.min(1.0, score / totalWeight)) : 0.5;
    }

    private static boolean containsIgnoreCase(List<String> values, String target) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(target));
    }

    private static boolean compatibleWithAny(Map<String, List<String>> table, List<String> preferences, String value) {
        for (String preference : preferences) {
            if (table.getOrDefault(preference.toLowerCase(Locale.ROOT), List.of()).contains(value)) {
                return true;
            }
        }
        return false;
    }
}
