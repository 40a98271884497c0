package com.mtg.forgescript.compiler;

import java.util.List;
import java.util.Optional;

/**
 * Phases a periodic ability can trigger in, with their Forge names.
 */
public enum Phase {
    UPKEEP("Upkeep", List.of("upkeep")),
    BEGIN_COMBAT("BeginCombat", List.of("combat")),
    END_OF_TURN("EndOfTurn", List.of("end step", "end of turn"));

    private final String scriptName;
    private final List<String> phrases;

    Phase(String scriptName, List<String> phrases) {
        this.scriptName = scriptName;
        this.phrases = phrases;
    }

    public String getScriptName() {
        return scriptName;
    }

    /**
     * Look up the phase named by timing text such as "your upkeep" or "each end step".
     * Phases are tried in declaration order.
     */
    public static Optional<Phase> fromTiming(String timing) {
        String lower = timing.toLowerCase();
        for (Phase phase : values()) {
            if (phase.phrases.stream().anyMatch(lower::contains)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}
