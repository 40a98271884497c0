package com.mtg.forgescript.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured "when X happens" condition.
 *
 * @param mode       trigger mode
 * @param attributes condition attributes in output order (ValidCard, Destination, Phase, ...)
 */
public record TriggerDescriptor(TriggerMode mode, Map<String, String> attributes) {

    public TriggerDescriptor {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Render as the leading part of a {@code T:} line, e.g. "Mode$ Attacks | ValidCard$ Card.Self".
     */
    public String render() {
        StringBuilder sb = new StringBuilder("Mode$ ").append(mode.getScriptName());
        attributes.forEach((key, value) -> sb.append(" | ").append(key).append("$ ").append(value));
        return sb.toString();
    }

    /**
     * Builder keeping attribute insertion order.
     */
    static Builder of(TriggerMode mode) {
        return new Builder(mode);
    }

    static final class Builder {
        private final TriggerMode mode;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(TriggerMode mode) {
            this.mode = mode;
        }

        Builder with(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        TriggerDescriptor build() {
            return new TriggerDescriptor(mode, attributes);
        }
    }
}
