package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.ContextualCurve;
import com.example.harmonicmixer.dto.PlaylistRequest;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import com.example.harmonicmixer.service.ContextualCurveService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 曲线选择节点：选出情境曲线并展开为每个位置的目标能量
 */
@Slf4j
@RequiredArgsConstructor
public class SelectCurveNode implements SequenceNode {

    public static final String ALGORITHM = "contextual_multi_factor";

    private final ContextualCurveService curveService;

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.CURVE_SELECTION);
        PlaylistRequest request = state.getRequest();

        ContextualCurve curve = curveService.selectCurve(
            request.getTimeOfDay(),
            request.getActivity(),
            request.getEnergyPreference(),
            request.getMoodPreference(),
            request.getSeason(),
            request.getDurationMinutes());

        state.setCurve(curve);
        state.setEnergyProgression(curveService.energyProgression(curve, state.getTargetLength()));
        state.getGenerationInfo().setAlgorithm(ALGORITHM);
        state.getGenerationInfo().setCurveUsed(curve.getName());

        log.info("[SelectCurve] 使用曲线: {} ({}, {})", curve.getName(), curve.getContextType(), curve.getShape());
        return NodeResult.success();
    }
}
