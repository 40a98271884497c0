package com.mtg.forgescript.compiler;

import com.mtg.forgescript.card.CardText;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders the lines of a card script. No reordering or deduplication happens here.
 */
public class Assembler {

    /**
     * Header lines, then ability lines, then support variables in allocation order,
     * then the escaped rules text.
     */
    public CompiledCard assemble(List<String> headerLines, AbilityScript script, String rulesText) {
        List<String> lines = new ArrayList<>(headerLines);
        for (Ability ability : script.abilities()) {
            lines.add(ability.render());
        }
        for (SupportVariable variable : script.supportVariables()) {
            lines.add(variable.render());
        }
        lines.add("Oracle:" + CardText.escapeOracle(rulesText));
        return new CompiledCard(lines);
    }
}
