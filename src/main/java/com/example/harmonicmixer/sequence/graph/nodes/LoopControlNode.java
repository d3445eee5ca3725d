package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.ExecutionControl;
import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 循环控制节点
 *
 * 职责：
 * - 检查外部取消
 * - 根据位置与 limit 设置 shouldContinue
 * - 每进入一个新位置计一次迭代，候选池为空时停止
 */
@Slf4j
public class LoopControlNode implements SequenceNode {

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.LOOP_CONTROL);
        ExecutionControl control = state.getControl();

        if (control.isCancelled()) {
            state.getGenerationInfo().setCancelled(true);
            control.stop();
            log.info("[LoopControl] 生成已取消，当前长度 {}", state.getPlaylist().size());
            return NodeResult.success();
        }
        if (!control.isShouldContinue()) {
            return NodeResult.success();
        }
        if (control.getPosition() >= state.getLimit()) {
            control.stop();
            return NodeResult.success();
        }

        state.getGenerationInfo().setIterations(state.getGenerationInfo().getIterations() + 1);
        boolean exhausted = state.getCandidates().stream().allMatch(t -> t.equals(state.getCurrentTrack()));
        if (exhausted) {
            control.stop();
        }

        log.debug("[LoopControl] position={}, limit={}, candidates={}, shouldContinue={}",
            control.getPosition(), state.getLimit(), state.getCandidates().size(), control.isShouldContinue());
        return NodeResult.success(); // 下一个节点由 ContinueSequenceEdge 决定
    }
}
