package com.mtg.forgescript.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resolved game action with its extracted parameters.
 *
 * @param kind       effect kind
 * @param parameters Forge parameters in output order (Defined, NumCards, ValidTgts, ...)
 */
public record EffectToken(EffectKind kind, Map<String, String> parameters) {

    private static final EffectToken UNKNOWN = new EffectToken(EffectKind.UNKNOWN, Map.of());

    public EffectToken {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static EffectToken unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return kind != EffectKind.UNKNOWN;
    }

    /**
     * Render as "Draw | Defined$ You | NumCards$ 1".
     *
     * @throws IllegalStateException for the unknown token
     */
    public String render() {
        if (!isKnown()) {
            throw new IllegalStateException("Unknown effect cannot be rendered");
        }
        StringBuilder sb = new StringBuilder(kind.getApiName());
        parameters.forEach((key, value) -> sb.append(" | ").append(key).append("$ ").append(value));
        return sb.toString();
    }

    static Builder of(EffectKind kind) {
        return new Builder(kind);
    }

    static final class Builder {
        private final EffectKind kind;
        private final Map<String, String> parameters = new LinkedHashMap<>();

        private Builder(EffectKind kind) {
            this.kind = kind;
        }

        Builder with(String key, Object value) {
            parameters.put(key, String.valueOf(value));
            return this;
        }

        EffectToken build() {
            return new EffectToken(kind, parameters);
        }
    }
}
