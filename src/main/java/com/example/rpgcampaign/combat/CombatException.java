package com.example.rpgcampaign.combat;

/**
 * A typed, caller-facing failure of a campaign or combat operation.
 * Each failure is scoped to the single request that raised it; none are retried.
 */
public class CombatException extends RuntimeException {

    public enum Category {
        /** The caller supplied malformed request data. */
        INPUT_VALIDATION,
        /** A referenced entity does not exist in the current state. */
        NOT_FOUND,
        /** The request is well-formed but violates a state invariant. */
        STATE_CONFLICT
    }

    public enum Kind {
        INVALID_THREAT_LEVEL(Category.INPUT_VALIDATION),
        INVALID_COMBAT_SETUP(Category.INPUT_VALIDATION),
        INVALID_ARGUMENT(Category.INPUT_VALIDATION),
        CAMPAIGN_NOT_FOUND(Category.NOT_FOUND),
        NO_ACTIVE_COMBAT(Category.NOT_FOUND),
        PARTICIPANT_NOT_FOUND(Category.NOT_FOUND),
        NOT_FOUND(Category.NOT_FOUND),
        PARTICIPANT_INACTIVE(Category.STATE_CONFLICT),
        DUPLICATE_COMBAT(Category.STATE_CONFLICT),
        ALREADY_EXISTS(Category.STATE_CONFLICT),
        INSUFFICIENT_FUNDS(Category.STATE_CONFLICT);

        private final Category category;

        Kind(Category category) {
            this.category = category;
        }

        public Category getCategory() {
            return category;
        }
    }

    private final Kind kind;

    public CombatException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public Category getCategory() {
        return kind.getCategory();
    }

    // Factories for the common cases

    public static CombatException invalidThreatLevel(String level) {
        return new CombatException(Kind.INVALID_THREAT_LEVEL,
            "Unknown threat level '" + level + "'. Expected one of: none, negligible, low, moderate, high, deadly, certain_death");
    }

    public static CombatException invalidSetup(String message) {
        return new CombatException(Kind.INVALID_COMBAT_SETUP, message);
    }

    public static CombatException invalidArgument(String message) {
        return new CombatException(Kind.INVALID_ARGUMENT, message);
    }

    public static CombatException campaignNotFound(String campaignId) {
        return new CombatException(Kind.CAMPAIGN_NOT_FOUND, "Campaign not found: " + campaignId);
    }

    public static CombatException noActiveCombat(String campaignId) {
        return new CombatException(Kind.NO_ACTIVE_COMBAT, "No active combat in campaign " + campaignId);
    }

    public static CombatException participantNotFound(String name) {
        return new CombatException(Kind.PARTICIPANT_NOT_FOUND, name + " is not in combat.");
    }

    public static CombatException participantInactive(Combatant combatant) {
        return new CombatException(Kind.PARTICIPANT_INACTIVE,
            combatant.getName() + " is " + combatant.getStatus().getWireName() + " and can no longer take part in combat.");
    }

    public static CombatException notFound(String what, String name) {
        return new CombatException(Kind.NOT_FOUND, what + " '" + name + "' not found.");
    }

    public static CombatException alreadyExists(String what, String name) {
        return new CombatException(Kind.ALREADY_EXISTS, what + " '" + name + "' already exists.");
    }
}
