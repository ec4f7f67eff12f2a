package com.example.rpgcampaign.model;

/**
 * Where a combat participant's record comes from.
 */
public enum SourceKind {
    NPC("npc"),
    BESTIARY("bestiary"),
    PLAYER("player");

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Parse a source kind (case-insensitive). Returns null if not recognized.
     */
    public static SourceKind fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String lower = s.trim().toLowerCase();
        for (SourceKind kind : values()) {
            if (kind.wireName.equals(lower)) return kind;
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
