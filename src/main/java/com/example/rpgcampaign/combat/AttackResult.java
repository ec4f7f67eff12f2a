package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.util.HitRoller;

/**
 * Outcome of a single attack. Also serves as the session's audit log entry.
 */
public class AttackResult {

    private final String attackerId;
    private final String attackerName;
    private final String targetId;
    private final String targetName;

    /** The attacker's hit chance used for the check */
    private final double hitChance;

    /** The uniform draw in [0,1) that decided the attack */
    private final double roll;

    private final boolean hit;

    /** The target's status after the attack */
    private final CombatantStatus targetStatus;

    private final long timestamp;

    public AttackResult(String attackerId, String attackerName, String targetId, String targetName,
                        double hitChance, double roll, boolean hit, CombatantStatus targetStatus, long timestamp) {
        this.attackerId = attackerId;
        this.attackerName = attackerName;
        this.targetId = targetId;
        this.targetName = targetName;
        this.hitChance = hitChance;
        this.roll = roll;
        this.hit = hit;
        this.targetStatus = targetStatus;
        this.timestamp = timestamp;
    }

    public static AttackResult resolve(Combatant attacker, Combatant target, double roll) {
        double chance = attacker.getHitChance();
        return new AttackResult(attacker.getId(), attacker.getName(), target.getId(), target.getName(),
            chance, roll, HitRoller.isHit(roll, chance), target.getStatus(), System.currentTimeMillis());
    }

    public String getAttackerId() { return attackerId; }
    public String getAttackerName() { return attackerName; }
    public String getTargetId() { return targetId; }
    public String getTargetName() { return targetName; }
    public double getHitChance() { return hitChance; }
    public double getRoll() { return roll; }
    public boolean isHit() { return hit; }
    public boolean isMiss() { return !hit; }
    public CombatantStatus getTargetStatus() { return targetStatus; }
    public long getTimestamp() { return timestamp; }

    /**
     * One-line narrative, e.g. "Hero attacks Goblin and hits."
     */
    public String describe() {
        if (hit) {
            return attackerName + " attacks " + targetName + " and hits.";
        }
        return attackerName + " attacks " + targetName + ". " + targetName + " dodges the attack.";
    }

    @Override
    public String toString() {
        return String.format("AttackResult[%s -> %s, chance=%.2f, roll=%.3f, %s, target %s]",
            attackerId, targetId, hitChance, roll, hit ? "HIT" : "MISS", targetStatus);
    }
}
