package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.dto.PlaylistRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSequenceStrategySelectorTest {

    private final ContextualSequenceStrategy contextual = new ContextualSequenceStrategy();
    private final ClassicSequenceStrategy classic = new ClassicSequenceStrategy();
    private final DefaultSequenceStrategySelector selector = new DefaultSequenceStrategySelector(contextual, classic);

    private final Locale defaultLocale = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(defaultLocale);
    }

    private SequenceStrategy select(String mode) {
        return selector.selectStrategy(PlaylistRequest.builder().mode(mode).build());
    }

    @Test
    void classicModeIsCaseAndWhitespaceInsensitive() {
        assertSame(classic, select("classic"));
        assertSame(classic, select(" CLASSIC "));
    }

    @Test
    void everythingElseIsContextual() {
        assertSame(contextual, select(null));
        assertSame(contextual, select("contextual"));
        assertSame(contextual, select("unknown"));
    }

    @Test
    void modeMatchingIgnoresTheDefaultLocale() {
        // 土耳其语环境下 "I".toLowerCase() 为无点 i
        Locale.setDefault(new Locale("tr", "TR"));
        assertSame(classic, select("CLASSIC"));
    }
}
