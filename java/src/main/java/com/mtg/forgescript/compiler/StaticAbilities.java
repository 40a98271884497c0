package com.mtg.forgescript.compiler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heuristics for continuous effects: stat pumps, keyword grants and restrictions.
 */
public class StaticAbilities {
    private static final Pattern PUMP = Pattern.compile("\\bgets?\\s+([+\\-]\\d+)/([+\\-]\\d+)");
    private static final Pattern GETS = Pattern.compile("\\bgets?\\s");
    private static final Pattern RESTRICTION = Pattern.compile("\\bcan['’]t\\b|\\bcannot\\b");
    private static final Pattern GRANTS = Pattern.compile("\\b(?:has|have)\\s");

    private static final List<String> KEYWORDS = List.of(
            "Vigilance", "Flying", "Trample", "Haste", "First Strike", "Double Strike",
            "Indestructible", "Hexproof", "Shroud", "Reach", "Lifelink", "Menace");

    /**
     * Compile a block classified as static, or nothing when a pump has no numbers or a
     * keyword grant names no known keyword.
     */
    public Optional<Ability> resolve(String text) {
        if (GETS.matcher(text).find()) {
            return pump(text);
        }
        if (RESTRICTION.matcher(text).find()) {
            return Optional.of(continuous(text, new LinkedHashMap<>()));
        }
        if (GRANTS.matcher(text).find()) {
            return keywords(text);
        }
        return Optional.of(continuous(text, new LinkedHashMap<>()));
    }

    private Optional<Ability> pump(String text) {
        Matcher pump = PUMP.matcher(text);
        if (!pump.find()) {
            return Optional.empty();
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("Affected", affected(text));
        parameters.put("AddPower", pump.group(1));
        parameters.put("AddToughness", pump.group(2));
        parameters.put("Duration", Duration.fromText(text).getScriptName());
        return Optional.of(continuous(text, parameters));
    }

    private Optional<Ability> keywords(String text) {
        String lower = text.toLowerCase();
        List<String> found = KEYWORDS.stream()
                .filter(keyword -> lower.contains(keyword.toLowerCase()))
                .collect(Collectors.toList());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("Affected", affected(text));
        parameters.put("AddKeyword", String.join(" & ", found));
        parameters.put("Duration", Duration.fromText(text).getScriptName());
        return Optional.of(continuous(text, parameters));
    }

    private static Ability continuous(String text, Map<String, String> parameters) {
        Map<String, String> line = new LinkedHashMap<>();
        line.put("Mode", "Continuous");
        line.putAll(parameters);
        line.put("Description", Ability.describe(text, Integer.MAX_VALUE));
        return new Ability.Static(line);
    }

    static String affected(String text) {
        String lower = text.toLowerCase();
        if (lower.contains("creatures you control")
                || (lower.contains("creature") && lower.contains("you control"))) {
            return "Creature.YouCtrl";
        }
        if (lower.contains("enchanted creature")) {
            return "Creature.EnchantedBy";
        }
        if (lower.contains("equipped creature")) {
            return "Creature.EquippedBy";
        }
        return "Card.Self";
    }
}
