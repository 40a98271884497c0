package com.mtg.forgescript.compiler;

import java.util.regex.Pattern;

/**
 * Counter types, looked up by the phrase naming them in rules text.
 */
public enum CounterType {
    P1P1("+1/+1"),
    M1M1("-1/-1"),
    DRUNKEN("drunken"),
    STUN("stun"),
    OBSESSION("obsession"),
    CHARGE("charge"),
    LOYALTY("loyalty"),
    HAZE("haze"),
    LOST_FAMILY("lost family"),
    TIME("time"),
    LORE("lore"),
    GENERIC(null);

    private final Pattern phrase;

    CounterType(String phrase) {
        // "<name> counter": "lore" must not match "explore", "time" must not match "each time"
        this.phrase = phrase != null
                ? Pattern.compile("(?<![\\w/])" + Pattern.quote(phrase) + "\\s+counter")
                : null;
    }

    /**
     * First counter type named directly before the word "counter", or {@link #GENERIC}.
     */
    public static CounterType fromText(String text) {
        String lower = text.toLowerCase();
        for (CounterType type : values()) {
            if (type.phrase != null && type.phrase.matcher(lower).find()) {
                return type;
            }
        }
        return GENERIC;
    }
}
