package com.mtg.forgescript.card;

import java.util.regex.Pattern;

/**
 * Type line reformatting. Forge separates main types and subtypes with a plain
 * space where Cockatrice uses a dash.
 */
public final class TypeLine {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DASH = Pattern.compile(" [-—] ");

    private TypeLine() {}

    /**
     * Convert "Creature - Human Warrior" to "Creature Human Warrior".
     */
    public static String format(String typeString) {
        if (typeString == null || typeString.isBlank()) {
            return "";
        }
        String type = WHITESPACE.matcher(typeString.trim()).replaceAll(" ");
        String[] parts = DASH.split(type);
        if (parts.length == 1) {
            return type;
        }
        StringBuilder sb = new StringBuilder(parts[0].trim());
        for (int i = 1; i < parts.length; i++) {
            String subtypes = parts[i].trim();
            if (!subtypes.isEmpty()) {
                sb.append(' ').append(subtypes);
            }
        }
        return sb.toString();
    }
}
