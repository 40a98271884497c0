package com.mtg.forgescript.compiler;

import java.util.List;

/**
 * Compiled abilities of one card with the support variables they reference.
 *
 * @param abilities        in the order their blocks appear in the rules text
 * @param supportVariables in allocation order
 */
public record AbilityScript(List<Ability> abilities, List<SupportVariable> supportVariables) {

    public AbilityScript {
        abilities = List.copyOf(abilities);
        supportVariables = List.copyOf(supportVariables);
    }

    public boolean isEmpty() {
        return abilities.isEmpty();
    }
}
