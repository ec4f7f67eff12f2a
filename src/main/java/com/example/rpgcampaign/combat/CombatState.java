package com.example.rpgcampaign.combat;

/**
 * Lifecycle of a combat session. ACTIVE is the only starting state and ENDED is terminal.
 */
public enum CombatState {

    /** Combatants may attack and be removed */
    ACTIVE("active"),

    /** Some team has no active combatants left */
    ENDED("ended");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static CombatState fromString(String s) {
        if (s == null) return null;
        for (CombatState state : values()) {
            if (state.name().equalsIgnoreCase(s.trim()) || state.displayName.equalsIgnoreCase(s.trim())) return state;
        }
        return null;
    }
}
