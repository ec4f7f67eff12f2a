package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;

/**
 * Text returned by a tool, flagged as an error when the operation failed.
 */
public class ToolResult {

    private final String text;
    private final boolean error;
    private final CombatException.Kind errorKind;

    private ToolResult(String text, boolean error, CombatException.Kind errorKind) {
        this.text = text;
        this.error = error;
        this.errorKind = errorKind;
    }

    public static ToolResult ok(String text) {
        return new ToolResult(text, false, null);
    }

    public static ToolResult error(CombatException e) {
        return new ToolResult("Error [" + e.getKind() + "]: " + e.getMessage(), true, e.getKind());
    }

    /**
     * An error with no typed kind (unexpected failure).
     */
    public static ToolResult failure(String message) {
        return new ToolResult("Error: " + message, true, null);
    }

    public String getText() { return text; }

    public boolean isError() { return error; }

    /** The failure kind, or null for successes and unexpected failures. */
    public CombatException.Kind getErrorKind() { return errorKind; }

    @Override
    public String toString() {
        return text;
    }
}
