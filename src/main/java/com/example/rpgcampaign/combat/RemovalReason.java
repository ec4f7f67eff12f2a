package com.example.rpgcampaign.combat;

/**
 * Why a combatant leaves a fight, and the status that implies.
 */
public enum RemovalReason {
    DEATH("death", CombatantStatus.DEAD, "%s has been slain!"),
    FLEE("flee", CombatantStatus.FLED, "%s flees from combat!"),
    SURRENDER("surrender", CombatantStatus.SURRENDERED, "%s surrenders!");

    private final String wireName;
    private final CombatantStatus resultingStatus;
    private final String messageFormat;

    RemovalReason(String wireName, CombatantStatus resultingStatus, String messageFormat) {
        this.wireName = wireName;
        this.resultingStatus = resultingStatus;
        this.messageFormat = messageFormat;
    }

    public String getWireName() {
        return wireName;
    }

    public CombatantStatus getResultingStatus() {
        return resultingStatus;
    }

    public String describe(String name) {
        return String.format(messageFormat, name);
    }

    /**
     * Parse a reason. A missing reason means death.
     * @throws CombatException INVALID_ARGUMENT for anything else that is not a reason
     */
    public static RemovalReason parse(String s) {
        if (s == null || s.isBlank()) return DEATH;
        String lower = s.trim().toLowerCase();
        for (RemovalReason reason : values()) {
            if (reason.wireName.equals(lower)) return reason;
        }
        throw CombatException.invalidArgument("Unknown removal reason '" + s + "'. Expected death, flee or surrender.");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
