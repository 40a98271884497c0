package com.mtg.forgescript.card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mana cost as an ordered list of Forge mana symbols.
 * Parses Cockatrice cost strings like "2U/B", "1BB" or "{3}{G}{G}".
 */
public class ManaCost {
    private static final String COLORS = "WUBRG";
    private static final String SYMBOLS = COLORS + "CX";

    private final List<String> symbols;

    private ManaCost(List<String> symbols) {
        this.symbols = symbols;
    }

    /**
     * Parse a mana cost string. Braces, whitespace and unknown characters are skipped.
     */
    public static ManaCost parse(String costString) {
        if (costString == null || costString.isEmpty()) {
            return new ManaCost(List.of());
        }

        String cost = costString.toUpperCase();
        List<String> symbols = new ArrayList<>();
        int i = 0;
        while (i < cost.length()) {
            char c = cost.charAt(i);
            if (Character.isDigit(c)) {
                int end = i;
                while (end < cost.length() && Character.isDigit(cost.charAt(end))) {
                    end++;
                }
                symbols.add(cost.substring(i, end));
                i = end;
            } else if (isHybrid(cost, i)) {
                symbols.add(cost.substring(i, i + 3));
                i += 3;
            } else if (SYMBOLS.indexOf(c) >= 0) {
                symbols.add(String.valueOf(c));
                i++;
            } else {
                i++;
            }
        }
        return new ManaCost(symbols);
    }

    // W/U, U/B, G/P ...
    private static boolean isHybrid(String cost, int i) {
        return i + 2 < cost.length()
                && COLORS.indexOf(cost.charAt(i)) >= 0
                && cost.charAt(i + 1) == '/'
                && (COLORS.indexOf(cost.charAt(i + 2)) >= 0 || cost.charAt(i + 2) == 'P');
    }

    public List<String> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /**
     * Forge spelling: symbols separated by single spaces.
     */
    @Override
    public String toString() {
        return String.join(" ", symbols);
    }
}
