package com.example.harmonicmixer.service;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.context.ExecutionControl;
import com.example.harmonicmixer.dto.ContextualCurve;
import com.example.harmonicmixer.dto.GenerationExplanation;
import com.example.harmonicmixer.dto.GenerationInfo;
import com.example.harmonicmixer.dto.PlaylistRequest;
import com.example.harmonicmixer.dto.PlaylistResult;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.PlaylistSequencer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * 歌单生成服务
 *
 * 对外入口：单次生成、多候选生成、经典贪心生成以及生成结果说明
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class PlaylistGenerationService {

    private static final double MIN_RELAXED_THRESHOLD = 0.2;
    private static final double THRESHOLD_STEP = 0.1;

    private final PlaylistSequencer sequencer;
    private final MixerProperties properties;
    private final Random playlistShuffleRandom;

    public PlaylistResult generate(@Valid @NotNull PlaylistRequest request) {
        return generate(request, new ExecutionControl());
    }

    /**
     * 生成歌单；control 可由其他线程取消，取消后返回已生成的部分
     */
    public PlaylistResult generate(@Valid @NotNull PlaylistRequest request, @NotNull ExecutionControl control) {
        return sequencer.execute(request, control);
    }

    public List<PlaylistResult> generateMultiple(@Valid @NotNull PlaylistRequest request) {
        return generateMultiple(request, properties.getPlaylist().getCandidateCount());
    }

    /**
     * 多候选生成：第 i 次运行的阈值放宽为 max(0.2, base - 0.1*i)，i > 0 时打乱候选顺序且不指定起始曲目；
     * 只保留非空结果，按平均分降序
     */
    public List<PlaylistResult> generateMultiple(@Valid @NotNull PlaylistRequest request, @Positive int count) {
        double baseThreshold = request.getMinCompatibility() != null
            ? request.getMinCompatibility()
            : properties.getPlaylist().getDefaultMinCompatibility();

        List<PlaylistResult> results = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            List<Track> tracks = new ArrayList<>(request.getTracks());
            if (i > 0) {
                Collections.shuffle(tracks, playlistShuffleRandom);
            }
            PlaylistRequest variant = request.toBuilder()
                .tracks(tracks)
                .startTrack(null)
                .minCompatibility(Math.max(MIN_RELAXED_THRESHOLD, baseThreshold - THRESHOLD_STEP * i))
                .build();

            PlaylistResult result = sequencer.execute(variant, new ExecutionControl());
            if (!result.isEmpty()) {
                results.add(result);
            }
        }

        results.sort(Comparator.comparingDouble(PlaylistResult::getTotalScore).reversed());
        log.info("[PlaylistGeneration] 多候选生成完成: {}/{} 个非空结果", results.size(), count);
        return results;
    }

    /**
     * 经典贪心生成：只考虑和声转换分
     *
     * @param progressionCurve neutral / ascending / descending
     */
    public List<Track> generateClassic(@NotNull List<Track> tracks, Track startTrack,
                                       @Positive int length, String progressionCurve) {
        PlaylistRequest request = PlaylistRequest.builder()
            .tracks(tracks)
            .startTrack(startTrack)
            .targetLength(length)
            .mode(PlaylistRequest.MODE_CLASSIC)
            .progressionCurve(progressionCurve != null ? progressionCurve : "neutral")
            .build();
        return sequencer.execute(request, new ExecutionControl()).getPlaylist();
    }

    // ==================== 生成说明 ====================

    public GenerationExplanation explain(@NotNull PlaylistResult result) {
        GenerationInfo info = result.getGenerationInfo() != null ? result.getGenerationInfo() : new GenerationInfo();
        GenerationExplanation.GenerationExplanationBuilder builder = GenerationExplanation.builder()
            .stats(info)
            .energyProgression(result.getEnergyProgression())
            .trackScores(result.getTrackScores())
            .averageScore(result.getTotalScore())
            .recommendations(recommendations(result, info));

        ContextualCurve curve = result.getCurve();
        if (curve != null) {
            builder.curveName(curve.getName())
                .curveType(curve.getContextType())
                .curveShape(curve.getShape())
                .minEnergy(curve.getMinEnergy())
                .maxEnergy(curve.getMaxEnergy())
                .durationMinutes(curve.getDurationMinutes());
        }
        return builder.build();
    }

    private List<String> recommendations(PlaylistResult result, GenerationInfo info) {
        List<String> recommendations = new ArrayList<>();
        int iterations = info.getIterations();
        if (iterations > 0 && (double) info.getContextMismatches() / iterations > 0.3) {
            recommendations.add("较多曲目与情境不匹配，建议补充更贴合当前情境的曲目");
        }
        if (info.getFallbackRate() > 0.2) {
            recommendations.add("兜底选择比例较高，建议降低最低兼容分或扩充曲库");
        }
        if (!result.isEmpty() && result.getTotalScore() < 0.6) {
            recommendations.add("整体兼容分偏低，建议补充调性与 BPM 更接近的曲目");
        }
        return recommendations;
    }
}
