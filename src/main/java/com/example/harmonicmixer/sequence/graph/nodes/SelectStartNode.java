package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.ContextType;
import com.example.harmonicmixer.dto.ContextualCurve;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.CandidateScorer;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import com.example.harmonicmixer.skill.MetadataValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 起始曲目节点
 *
 * - 指定的起始曲目在候选池中（即存在且可用）时直接使用
 * - 否则按上下文契合度挑选；早晨/傍晚的时段曲线给易混音（mix_friendly > 0.7）的曲目加 0.1
 * - 没有任何曲目得分 > 0 时失败（歌单为空）
 */
@Slf4j
@RequiredArgsConstructor
public class SelectStartNode implements SequenceNode {

    private static final double INTRO_BONUS = 0.1;
    private static final double MIX_FRIENDLY_THRESHOLD = 0.7;

    private final CandidateScorer candidateScorer;

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.START_SELECTION);
        ContextualCurve curve = state.getCurve();
        double targetEnergy = state.getEnergyProgression().get(0);

        Track start = state.getRequest().getStartTrack();
        if (start == null || !state.getCandidates().contains(start)) {
            start = bestStartingTrack(state, curve, targetEnergy);
        }
        if (start == null) {
            log.warn("[SelectStart] 没有可用的起始曲目");
            return NodeResult.failure("没有可用的起始曲目");
        }

        double startScore = candidateScorer.contextScore(state.metadataFor(start), curve, targetEnergy);
        state.append(start, startScore);
        log.info("[SelectStart] 起始曲目: {} (score={})", start.getId(), startScore);
        return NodeResult.success();
    }

    private Track bestStartingTrack(PlaylistContext state, ContextualCurve curve, double targetEnergy) {
        boolean introCurve = curve.getContextType() == ContextType.TIME
            && ("morning".equals(curve.getContextValue()) || "evening".equals(curve.getContextValue()));

        Track best = null;
        double bestScore = 0.0;
        for (Track track : state.getCandidates()) {
            Map<String, Object> metadata = state.metadataFor(track);
            double score = candidateScorer.contextScore(metadata, curve, targetEnergy);
            if (introCurve) {
                Double mixFriendly = MetadataValues.percentage(metadata, "mix_friendly");
                if (mixFriendly != null && mixFriendly > MIX_FRIENDLY_THRESHOLD) {
                    score += INTRO_BONUS;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = track;
            }
        }
        return best;
    }
}
