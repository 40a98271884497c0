package com.mtg.forgescript.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One {@code <card>} element of a Cockatrice database.
 * Every accessor returns a trimmed string, never null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CardRecord {
    @JsonProperty("name")
    private String name;

    @JsonProperty("text")
    private String text;

    @JsonProperty("prop")
    private Properties prop;

    @JsonProperty("loyalty")
    private String loyalty;

    @JsonProperty("token")
    private String token;

    public CardRecord() {
        // Default constructor for Jackson
    }

    public CardRecord(String name, String manaCost, String type, String powerToughness,
                      String loyalty, String text) {
        this.name = name;
        this.text = text;
        this.prop = new Properties();
        this.prop.manaCost = manaCost;
        this.prop.type = type;
        this.prop.powerToughness = powerToughness;
        this.prop.loyalty = loyalty;
    }

    public String getName() {
        return clean(name);
    }

    public String getManaCost() {
        return prop != null ? clean(prop.manaCost) : "";
    }

    public String getType() {
        return prop != null ? clean(prop.type) : "";
    }

    public String getPowerToughness() {
        return prop != null ? clean(prop.powerToughness) : "";
    }

    /**
     * Loyalty from the card properties, falling back to a card-level element.
     */
    public String getLoyalty() {
        String fromProp = prop != null ? clean(prop.loyalty) : "";
        return fromProp.isEmpty() ? clean(loyalty) : fromProp;
    }

    public String getText() {
        return clean(text);
    }

    public boolean isToken() {
        return token != null && !"0".equals(token.trim());
    }

    public boolean hasName() {
        return !getName().isEmpty();
    }

    private static String clean(String value) {
        return value != null ? value.trim() : "";
    }

    /**
     * The {@code <prop>} child holding the printed characteristics.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {
        @JsonProperty("manacost")
        private String manaCost;

        @JsonProperty("type")
        private String type;

        @JsonProperty("pt")
        private String powerToughness;

        @JsonProperty("loyalty")
        private String loyalty;
    }
}
