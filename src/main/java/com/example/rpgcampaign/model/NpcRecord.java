package com.example.rpgcampaign.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named non-player character (or the campaign's player character).
 * Combat only reads the threat level and the optional hit chance override.
 */
public class NpcRecord {

    private final String slug;
    private final String name;
    private final List<String> keywords;
    private final String arc;
    private final ThreatLevel threatLevel;
    private final Double hitChance;
    private final boolean player;

    public NpcRecord(String slug, String name, List<String> keywords, String arc,
                     ThreatLevel threatLevel, Double hitChance, boolean player) {
        this.slug = slug;
        this.name = name;
        this.keywords = keywords == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(keywords));
        this.arc = arc == null ? "" : arc;
        this.threatLevel = threatLevel;
        this.hitChance = hitChance;
        this.player = player;
    }

    public String getSlug() { return slug; }
    public String getName() { return name; }
    public List<String> getKeywords() { return keywords; }
    public String getArc() { return arc; }

    /** May be null when the record only carries an explicit hit chance, or nothing at all. */
    public ThreatLevel getThreatLevel() { return threatLevel; }

    /** Explicit hit chance, or null. */
    public Double getHitChance() { return hitChance; }

    public boolean isPlayer() { return player; }

    /**
     * Check whether the given text names this NPC by slug, name or keyword (case-insensitive).
     */
    public boolean matches(String text) {
        if (text == null) return false;
        String lower = text.trim().toLowerCase();
        if (lower.equals(slug) || lower.equals(name.toLowerCase())) return true;
        for (String keyword : keywords) {
            if (keyword.toLowerCase().equals(lower)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "NpcRecord[" + name + " (" + slug + "), threat=" + threatLevel + ", hitChance=" + hitChance + "]";
    }
}
