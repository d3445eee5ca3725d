package com.example.harmonicmixer.sequence;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.context.ExecutionControl;
import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.PlaylistRequest;
import com.example.harmonicmixer.dto.PlaylistResult;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.graph.SequenceGraph;
import com.example.harmonicmixer.sequence.graph.SequenceGraphBuilder;
import com.example.harmonicmixer.sequence.graph.SequenceStrategy;
import com.example.harmonicmixer.sequence.graph.SequenceStrategySelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 歌单编排器 - 基于状态图的贪心选曲
 *
 * - State = PlaylistContext（单次生成的全部状态）
 * - 贪心选曲的 if/for/break 映射为条件边与循环边
 * - 每个位置之间检查 ExecutionControl 的取消标志
 *
 * 执行流程（情境模式）：
 * Select Curve → Select Start ─[无起始曲目]→ END
 *     ↓
 * Score Candidates ─[达到阈值?]─Yes→ Accept / No→ Fallback
 *     ↓
 * Loop Control ─[继续?]─Yes→ Score Candidates（循环）
 *     ↓ No
 * Finalize → END
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaylistSequencer {

    private final SequenceGraphBuilder graphBuilder;
    private final SequenceStrategySelector strategySelector;
    private final MixerProperties properties;

    public PlaylistResult execute(PlaylistRequest request, ExecutionControl control) {
        PlaylistContext context = initContext(request, control);
        log.info("[PlaylistSequencer] 开始生成: mode={}, tracks={}, targetLength={}, limit={}",
            request.getMode(), request.getTracks().size(), context.getTargetLength(), context.getLimit());

        SequenceStrategy strategy = strategySelector.selectStrategy(request);
        SequenceGraph graph = graphBuilder.build(strategy, context.getLimit());
        graph.execute(context);

        PlaylistResult result = buildResult(context);
        log.info("[PlaylistSequencer] 生成完成: 长度 {}, 平均分 {}", result.getPlaylist().size(), result.getTotalScore());
        return result;
    }

    /**
     * 初始化 Context：未指定的参数取 mixer.* 配置的默认值
     */
    private PlaylistContext initContext(PlaylistRequest request, ExecutionControl control) {
        MixerProperties.Playlist defaults = properties.getPlaylist();
        PlaylistContext context = new PlaylistContext();
        context.setRequest(request);
        context.setHarmonicMode(request.getHarmonicMode() != null
            ? request.getHarmonicMode()
            : properties.getHarmonic().getDefaultMode());
        context.setTargetLength(request.getTargetLength() != null
            ? request.getTargetLength()
            : defaults.getDefaultTargetLength());
        context.setMinCompatibility(request.getMinCompatibility() != null
            ? request.getMinCompatibility()
            : defaults.getDefaultMinCompatibility());

        // 当前不可用的曲目不进入候选池
        List<Track> tracks = request.getTracks() != null ? request.getTracks() : List.of();
        context.setCandidates(tracks.stream().filter(Track::isAvailable).collect(Collectors.toCollection(ArrayList::new)));

        boolean classic = PlaylistRequest.MODE_CLASSIC.equalsIgnoreCase(
            request.getMode() != null ? request.getMode().trim() : null);
        if (classic || request.isAllowRepeats()) {
            context.setLimit(context.getTargetLength());
        } else {
            context.setLimit(Math.min(context.getTargetLength(), context.getCandidates().size()));
        }

        control.setPosition(1);
        control.setShouldContinue(true);
        context.setControl(control);
        context.setCurrentStage(PlaylistContext.Stage.INIT);
        return context;
    }

    private PlaylistResult buildResult(PlaylistContext context) {
        List<Double> scores = context.getTrackScores();
        double total = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return PlaylistResult.builder()
            .playlist(new ArrayList<>(context.getPlaylist()))
            .curve(context.getCurve())
            .energyProgression(new ArrayList<>(context.getEnergyProgression()))
            .trackScores(new ArrayList<>(scores))
            .generationInfo(context.getGenerationInfo())
            .totalScore(total)
            .build();
    }
}
