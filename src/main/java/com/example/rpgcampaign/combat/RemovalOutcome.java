package com.example.rpgcampaign.combat;

import java.util.List;

/**
 * Result of removing a combatant: its new status and whether the fight ended because of it.
 */
public record RemovalOutcome(
    String combatantId,
    String name,
    RemovalReason reason,
    CombatantStatus status,
    boolean combatEnded,
    List<String> teamsStillFighting
) {
    public String describe() {
        String text = reason.describe(name);
        if (combatEnded) {
            text += "\nCombat has ended!";
        }
        return text;
    }
}
