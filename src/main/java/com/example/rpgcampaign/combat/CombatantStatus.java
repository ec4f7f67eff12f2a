package com.example.rpgcampaign.combat;

/**
 * Status of a combatant within one fight. Every status other than ACTIVE is terminal.
 */
public enum CombatantStatus {
    ACTIVE("active"),
    DEAD("dead"),
    FLED("fled"),
    SURRENDERED("surrendered"),
    REMOVED("removed");

    private final String wireName;

    CombatantStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    public static CombatantStatus fromString(String s) {
        if (s == null) return null;
        String lower = s.trim().toLowerCase();
        for (CombatantStatus status : values()) {
            if (status.wireName.equals(lower)) return status;
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
