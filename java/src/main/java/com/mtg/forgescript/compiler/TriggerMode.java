package com.mtg.forgescript.compiler;

/**
 * Trigger modes understood by the Forge rules engine.
 */
public enum TriggerMode {
    ATTACKS("Attacks"),
    DAMAGE_DONE("DamageDone"),
    CHANGES_ZONE("ChangesZone"),
    DISCARD("Discard"),
    SPELL_CAST("SpellCast"),
    TAPS("Taps"),
    PHASE("Phase");

    private final String scriptName;

    TriggerMode(String scriptName) {
        this.scriptName = scriptName;
    }

    public String getScriptName() {
        return scriptName;
    }
}
