package com.mtg.forgescript.compiler;

/**
 * What kind of ability a block of rules text describes.
 */
public enum AbilityCategory {
    TRIGGERED,
    /** Triggers at the beginning of a phase. */
    PERIODIC,
    UPKEEP_COST,
    ACTIVATED,
    MODAL,
    STATIC,
    SPELL_EFFECT,
    /** Nothing could be compiled; the block produces no output. */
    UNRECOGNIZED
}
