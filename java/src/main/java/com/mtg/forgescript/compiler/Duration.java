package com.mtg.forgescript.compiler;

/**
 * How long a continuous effect lasts.
 */
public enum Duration {
    END_OF_TURN("EndOfTurn"),
    PERMANENT("Permanent");

    private final String scriptName;

    Duration(String scriptName) {
        this.scriptName = scriptName;
    }

    public String getScriptName() {
        return scriptName;
    }

    public static Duration fromText(String text) {
        return text.toLowerCase().contains("until end of turn") ? END_OF_TURN : PERMANENT;
    }
}
