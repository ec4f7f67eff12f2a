package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.model.SourceKind;

import java.util.ArrayList;
import java.util.List;

/**
 * A request to bring one participant into combat.
 *
 * Compact text form: {@code kind:key@team[=hitChance]}, for example
 * {@code player:hero@players} or {@code bestiary:goblin@monsters=0.3}.
 */
public class ParticipantSpec {

    private final SourceKind kind;
    private final String key;
    private final String team;
    private final String displayName;
    private final Double hitChanceOverride;

    public ParticipantSpec(SourceKind kind, String key, String team, String displayName, Double hitChanceOverride) {
        this.kind = kind;
        this.key = key;
        this.team = team;
        this.displayName = displayName;
        this.hitChanceOverride = hitChanceOverride;
    }

    public static ParticipantSpec of(SourceKind kind, String key, String team) {
        return new ParticipantSpec(kind, key, team, null, null);
    }

    public ParticipantSpec withHitChance(double hitChance) {
        return new ParticipantSpec(kind, key, team, displayName, hitChance);
    }

    public SourceKind getKind() { return kind; }

    /** Lookup key of the source record (NPC name/slug, bestiary name, or player name). */
    public String getKey() { return key; }

    /** Team label; may be null for a join that takes an ally's team. */
    public String getTeam() { return team; }

    /** Optional display name; the source record's name is used when null. */
    public String getDisplayName() { return displayName; }

    /** Optional explicit hit chance, or null. */
    public Double getHitChanceOverride() { return hitChanceOverride; }

    /**
     * Parse a single participant. The team part may be omitted (for joins that name an ally).
     * @throws CombatException INVALID_COMBAT_SETUP on malformed text
     */
    public static ParticipantSpec parse(String text) {
        if (text == null || text.isBlank()) {
            throw CombatException.invalidSetup("Empty participant");
        }
        String rest = text.trim();

        Double override = null;
        int eq = rest.lastIndexOf('=');
        if (eq >= 0) {
            String chance = rest.substring(eq + 1).trim();
            try {
                override = Double.parseDouble(chance);
            } catch (NumberFormatException e) {
                throw CombatException.invalidSetup("Hit chance '" + chance + "' is not a number in '" + text + "'");
            }
            rest = rest.substring(0, eq).trim();
        }

        String team = null;
        int at = rest.lastIndexOf('@');
        if (at >= 0) {
            team = rest.substring(at + 1).trim();
            rest = rest.substring(0, at).trim();
        }

        int colon = rest.indexOf(':');
        if (colon < 0) {
            throw CombatException.invalidSetup("Participant '" + text + "' must look like kind:key@team");
        }
        SourceKind kind = SourceKind.fromString(rest.substring(0, colon));
        if (kind == null) {
            throw CombatException.invalidSetup("Unknown participant kind '" + rest.substring(0, colon)
                + "' in '" + text + "'. Expected npc, bestiary or player.");
        }
        String key = rest.substring(colon + 1).trim();
        // "player:" stands for the campaign's own player character
        if (key.isEmpty() && kind != SourceKind.PLAYER) {
            throw CombatException.invalidSetup("Participant '" + text + "' has no name");
        }
        return new ParticipantSpec(kind, key, team, null, override);
    }

    /**
     * Parse a list separated by ';' (or ',' when no ';' is present).
     */
    public static List<ParticipantSpec> parseList(String text) {
        List<ParticipantSpec> specs = new ArrayList<>();
        if (text == null || text.isBlank()) return specs;
        String separator = text.contains(";") ? ";" : ",";
        for (String part : text.split(separator)) {
            if (part.isBlank()) continue;
            specs.add(parse(part));
        }
        return specs;
    }

    @Override
    public String toString() {
        return kind + ":" + key + (team != null ? "@" + team : "") + (hitChanceOverride != null ? "=" + hitChanceOverride : "");
    }
}
