package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.model.ThreatLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed mapping from threat level to the chance that an attack by such a creature lands.
 */
public final class ThreatLevelTable {

    /** Hit chance used for NPCs and players whose record names neither a chance nor a level. */
    public static final double DEFAULT_HIT_CHANCE = 0.50;

    private static final Map<ThreatLevel, Double> HIT_CHANCES;

    static {
        Map<ThreatLevel, Double> table = new EnumMap<>(ThreatLevel.class);
        table.put(ThreatLevel.NONE, 0.10);
        table.put(ThreatLevel.NEGLIGIBLE, 0.25);
        table.put(ThreatLevel.LOW, 0.35);
        table.put(ThreatLevel.MODERATE, 0.50);
        table.put(ThreatLevel.HIGH, 0.65);
        table.put(ThreatLevel.DEADLY, 0.80);
        table.put(ThreatLevel.CERTAIN_DEATH, 0.95);
        HIT_CHANCES = Collections.unmodifiableMap(table);
    }

    private ThreatLevelTable() { }

    public static double hitChanceFor(ThreatLevel level) {
        if (level == null) {
            throw CombatException.invalidThreatLevel("null");
        }
        return HIT_CHANCES.get(level);
    }

    /**
     * Look up by wire name, e.g. "certain_death".
     * @throws CombatException INVALID_THREAT_LEVEL if the name is not a defined level
     */
    public static double hitChanceFor(String level) {
        return hitChanceFor(parse(level));
    }

    /**
     * Parse a threat level, failing with INVALID_THREAT_LEVEL instead of returning null.
     */
    public static ThreatLevel parse(String level) {
        ThreatLevel parsed = ThreatLevel.fromString(level);
        if (parsed == null) {
            throw CombatException.invalidThreatLevel(level);
        }
        return parsed;
    }

    /**
     * True for a chance in [0, 1]. NaN is never valid.
     */
    public static boolean isValidHitChance(double chance) {
        return chance >= 0.0 && chance <= 1.0;
    }

    public static Map<ThreatLevel, Double> asMap() {
        return HIT_CHANCES;
    }
}
