package com.mtg.forgescript.compiler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A card script: header lines, ability lines, support variables and the Oracle line.
 */
public record CompiledCard(List<String> lines) {

    public CompiledCard {
        lines = List.copyOf(lines);
    }

    /**
     * Lines starting with {@code prefix}, e.g. "SVar:".
     */
    public List<String> linesStartingWith(String prefix) {
        return lines.stream().filter(line -> line.startsWith(prefix)).collect(Collectors.toList());
    }

    /**
     * The script file content.
     */
    public String render() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return render();
    }
}
