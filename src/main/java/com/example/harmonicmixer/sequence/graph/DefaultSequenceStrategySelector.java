package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.dto.PlaylistRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 默认的策略选择器：mode=classic 时使用经典贪心策略，其余情况使用情境策略。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultSequenceStrategySelector implements SequenceStrategySelector {

    private final ContextualSequenceStrategy contextualStrategy;
    private final ClassicSequenceStrategy classicStrategy;

    @Override
    public SequenceStrategy selectStrategy(PlaylistRequest request) {
        String mode = request != null ? request.getMode() : null;
        String normalizedMode = mode != null ? mode.trim().toLowerCase(Locale.ROOT) : PlaylistRequest.MODE_CONTEXTUAL;

        SequenceStrategy strategy = PlaylistRequest.MODE_CLASSIC.equals(normalizedMode)
            ? classicStrategy
            : contextualStrategy;

        log.debug("[StrategySelector] 选择策略: rawMode={}, strategy={}", mode, strategy.getClass().getSimpleName());
        return strategy;
    }
}
