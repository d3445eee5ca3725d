package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.dto.PlaylistRequest;

/**
 * 根据请求参数选择具体的 SequenceStrategy。
 */
public interface SequenceStrategySelector {

    /**
     * @param request 歌单请求，允许为 null（使用情境模式）
     * @return 选中的策略实现
     */
    SequenceStrategy selectStrategy(PlaylistRequest request);
}
