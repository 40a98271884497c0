package com.mtg.forgescript.compiler;

/**
 * Effect kinds with the Forge API name they compile to.
 */
public enum EffectKind {
    GAIN_LIFE("GainLife"),
    LOSE_LIFE("LoseLife"),
    DRAW("Draw"),
    DEAL_DAMAGE("DealDamage"),
    CREATE_TOKEN("Token"),
    DISCARD("Discard"),
    MILL("Mill"),
    COUNTER("Counter"),
    TAP("Tap"),
    UNTAP("Untap"),
    SCRY("Scry"),
    SURVEIL("Surveil"),
    PUT_COUNTER("PutCounter"),
    SACRIFICE("Sacrifice"),
    SEARCH_LIBRARY("ChangeZone"),
    RETURN_FROM_GRAVEYARD("ChangeZone"),
    /** No rule matched. Never rendered. */
    UNKNOWN(null);

    private final String apiName;

    EffectKind(String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }
}
