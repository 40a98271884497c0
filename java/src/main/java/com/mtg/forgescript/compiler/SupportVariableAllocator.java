package com.mtg.forgescript.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues support-variable names for one card and collects their definitions.
 *
 * <p>Names are the base name followed by a counter that starts at 1 and only grows, so a
 * name is never issued twice. Use a new allocator for every card; nothing carries over.
 */
public class SupportVariableAllocator {
    private final Map<String, String> definitions = new LinkedHashMap<>();
    private int counter;

    /**
     * Issue the next name for {@code baseName}, e.g. "Effect1". The name must be
     * {@link #define defined} before {@link #variables()} is called.
     */
    public String allocate(String baseName) {
        counter++;
        String name = baseName + counter;
        if (definitions.containsKey(name)) {
            throw new IllegalStateException("Support variable name already issued: " + name);
        }
        definitions.put(name, null);
        return name;
    }

    /**
     * Bind the definition of a name issued by {@link #allocate}.
     */
    public void define(String name, String definition) {
        if (!definitions.containsKey(name)) {
            throw new IllegalArgumentException("Support variable was never allocated: " + name);
        }
        if (definitions.get(name) != null) {
            throw new IllegalStateException("Support variable already defined: " + name);
        }
        definitions.put(name, definition);
    }

    /**
     * Allocate a name and define it in one step.
     */
    public String declare(String baseName, String definition) {
        String name = allocate(baseName);
        define(name, definition);
        return name;
    }

    /**
     * All variables in allocation order.
     *
     * @throws IllegalStateException if a name was allocated but never defined
     */
    public List<SupportVariable> variables() {
        List<SupportVariable> variables = new ArrayList<>();
        definitions.forEach((name, definition) -> {
            if (definition == null) {
                throw new IllegalStateException("Support variable allocated but never defined: " + name);
            }
            variables.add(new SupportVariable(name, definition));
        });
        return variables;
    }

    public int allocatedCount() {
        return counter;
    }
}
