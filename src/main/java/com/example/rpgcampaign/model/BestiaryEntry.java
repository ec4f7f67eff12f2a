package com.example.rpgcampaign.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A creature template in a campaign's bestiary.
 * Entries are keyed by their lower-cased name.
 */
public class BestiaryEntry {

    private final String name;
    private final ThreatLevel threatLevel;
    private final String hp;
    private final Map<String, String> weapons;
    private final String description;

    public BestiaryEntry(String name, ThreatLevel threatLevel, String hp, Map<String, String> weapons, String description) {
        this.name = name;
        this.threatLevel = threatLevel;
        this.hp = hp;
        this.weapons = weapons == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(weapons));
        this.description = description == null ? "" : description;
    }

    public static String keyFor(String name) {
        return name == null ? "" : name.trim().toLowerCase();
    }

    public String getKey() { return keyFor(name); }
    public String getName() { return name; }
    public ThreatLevel getThreatLevel() { return threatLevel; }

    /** HP formula in dice notation (e.g. "2d6+3") or a plain number. */
    public String getHp() { return hp; }

    /** Attack name to damage formula, in declaration order. */
    public Map<String, String> getWeapons() { return weapons; }

    public String getDescription() { return description; }

    @Override
    public String toString() {
        return "BestiaryEntry[" + name + ", threat=" + threatLevel + ", hp=" + hp + "]";
    }
}
