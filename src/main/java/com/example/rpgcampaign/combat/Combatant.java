package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.model.SourceKind;

/**
 * A participant's state within one combat session.
 *
 * The hit chance is resolved once, when the combatant joins, and never changes afterwards.
 * The source key is only a lookup key into the NPC/bestiary/player records.
 */
public class Combatant {

    /** Identifier unique within the session (slug of the display name) */
    private final String id;

    /** Display name, e.g. "Goblin 2" */
    private final String name;

    /** Team label - combatants sharing a team are allies */
    private final String team;

    private final SourceKind sourceKind;

    /** Lookup key of the backing record */
    private final String sourceKey;

    /** Probability in [0,1] that this combatant's attacks land */
    private final double hitChance;

    private CombatantStatus status;

    public Combatant(String id, String name, String team, SourceKind sourceKind, String sourceKey,
                     double hitChance, CombatantStatus status) {
        this.id = id;
        this.name = name;
        this.team = team;
        this.sourceKind = sourceKind;
        this.sourceKey = sourceKey;
        this.hitChance = hitChance;
        this.status = status;
    }

    public Combatant(String id, String name, String team, SourceKind sourceKind, String sourceKey, double hitChance) {
        this(id, name, team, sourceKind, sourceKey, hitChance, CombatantStatus.ACTIVE);
    }

    // Identification

    public String getId() { return id; }

    public String getName() { return name; }

    public String getTeam() { return team; }

    public SourceKind getSourceKind() { return sourceKind; }

    public String getSourceKey() { return sourceKey; }

    public double getHitChance() { return hitChance; }

    // Status

    public CombatantStatus getStatus() { return status; }

    public boolean isActive() { return status.isActive(); }

    /**
     * Move this combatant out of the fight.
     * @throws CombatException PARTICIPANT_INACTIVE if the combatant already left
     */
    void leave(CombatantStatus newStatus) {
        if (!isActive()) {
            throw CombatException.participantInactive(this);
        }
        if (newStatus == CombatantStatus.ACTIVE) {
            throw new IllegalArgumentException("A combatant cannot re-enter combat");
        }
        this.status = newStatus;
    }

    public Combatant copy() {
        return new Combatant(id, name, team, sourceKind, sourceKey, hitChance, status);
    }

    @Override
    public String toString() {
        return String.format("Combatant[%s (%s) team=%s hit=%.2f %s]", name, id, team, hitChance, status);
    }
}
