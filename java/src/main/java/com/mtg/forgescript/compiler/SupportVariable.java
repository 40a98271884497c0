package com.mtg.forgescript.compiler;

/**
 * A named definition referenced from ability lines.
 */
public record SupportVariable(String name, String definition) {

    public String render() {
        return "SVar:" + name + ":" + definition;
    }
}
