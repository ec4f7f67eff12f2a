package com.example.rpgcampaign.model;

/**
 * Coarse severity classification for a creature or NPC.
 * Declared in order of severity, so {@link #ordinal()} is the severity rank.
 */
public enum ThreatLevel {
    NONE("none"),                   // a fly
    NEGLIGIBLE("negligible"),       // a stray dog
    LOW("low"),                     // a wolf
    MODERATE("moderate"),           // a bandit
    HIGH("high"),                   // a mercenary
    DEADLY("deadly"),               // a dragon
    CERTAIN_DEATH("certain_death"); // an eldritch horror

    private final String wireName;

    ThreatLevel(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in tool arguments and stored records (e.g. "certain_death").
     */
    public String getWireName() {
        return wireName;
    }

    public boolean isMoreSevereThan(ThreatLevel other) {
        return this.ordinal() > other.ordinal();
    }

    /**
     * Parse a threat level from a string (case-insensitive).
     * Accepts "certain_death", "certain-death" and "certain death".
     * Returns null if the text does not name a level.
     */
    public static ThreatLevel fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String normalized = s.trim().toLowerCase().replace('-', '_').replace(' ', '_');
        for (ThreatLevel level : values()) {
            if (level.wireName.equals(normalized)) return level;
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
