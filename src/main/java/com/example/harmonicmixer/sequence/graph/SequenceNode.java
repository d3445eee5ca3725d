package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.context.PlaylistContext;

/**
 * 选曲状态图节点：读写 PlaylistContext，下一步由出边决定
 */
@FunctionalInterface
public interface SequenceNode {

    NodeResult execute(PlaylistContext state);

    /**
     * 节点执行结果，供条件边判断
     */
    final class NodeResult {

        private static final NodeResult SUCCESS = new NodeResult(true, null);

        private final boolean success;
        private final String reason;

        private NodeResult(boolean success, String reason) {
            this.success = success;
            this.reason = reason;
        }

        public static NodeResult success() {
            return SUCCESS;
        }

        /**
         * @param reason 失败原因（仅用于日志）
         */
        public static NodeResult failure(String reason) {
            return new NodeResult(false, reason);
        }

        public boolean isSuccess() {
            return success;
        }

        public String getReason() {
            return reason;
        }
    }
}
