package com.bko.gateway.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Agent backend variants. {@code claude-code} and {@code codex} are accepted as aliases.
 */
public enum AgentKind {
    SDK("sdk", "claude-code"),
    CLI("cli", "codex");

    private final String id;
    private final String alias;

    AgentKind(String id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static AgentKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SDK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentKind kind : values()) {
            if (kind.id.equals(normalized) || kind.alias.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown agent: " + value);
    }
}
