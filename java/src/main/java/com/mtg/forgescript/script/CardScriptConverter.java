package com.mtg.forgescript.script;

import com.mtg.forgescript.card.CardRecord;
import com.mtg.forgescript.card.CardText;
import com.mtg.forgescript.card.ManaCost;
import com.mtg.forgescript.card.TypeLine;
import com.mtg.forgescript.compiler.AbilityCompiler;
import com.mtg.forgescript.compiler.AbilityScript;
import com.mtg.forgescript.compiler.Assembler;
import com.mtg.forgescript.compiler.CompiledCard;
import com.mtg.forgescript.compiler.SupportVariableAllocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts one card record into a Forge card script.
 */
public class CardScriptConverter {
    static final String NO_COST = "no cost";

    private final AbilityCompiler compiler;
    private final Assembler assembler;

    public CardScriptConverter() {
        this(new AbilityCompiler(), new Assembler());
    }

    public CardScriptConverter(AbilityCompiler compiler, Assembler assembler) {
        this.compiler = compiler;
        this.assembler = assembler;
    }

    /**
     * Convert a card. Returns empty for a record without a name.
     */
    public Optional<CompiledCard> convert(CardRecord card) {
        if (!card.hasName()) {
            return Optional.empty();
        }
        String rulesText = CardText.decodeEntities(card.getText()).strip();
        AbilityScript script = compiler.compile(rulesText, new SupportVariableAllocator());
        return Optional.of(assembler.assemble(headerLines(card), script, rulesText));
    }

    static List<String> headerLines(CardRecord card) {
        List<String> lines = new ArrayList<>();
        lines.add("Name:" + card.getName());

        ManaCost cost = ManaCost.parse(card.getManaCost());
        lines.add("ManaCost:" + (cost.isEmpty() ? NO_COST : cost.toString()));

        String type = TypeLine.format(card.getType());
        if (!type.isEmpty()) {
            lines.add("Types:" + type);
        }
        if (!card.getPowerToughness().isEmpty()) {
            lines.add("PT:" + card.getPowerToughness());
        }
        if (!card.getLoyalty().isEmpty()) {
            lines.add("Loyalty:" + card.getLoyalty());
        }
        return lines;
    }
}
