package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.model.SourceKind;
import com.example.rpgcampaign.util.Slugs;

import java.util.*;
import java.util.stream.Collectors;

/**
 * One fight within one campaign.
 * Owns its combatants (in insertion order) and the audit log of attacks.
 * There is no turn order: any active combatant may attack any active combatant.
 */
public class CombatSession {

    /** Unique identifier for this session */
    private final String sessionId;

    /** Campaign this fight belongs to */
    private final String campaignId;

    /** Current state of the combat */
    private CombatState state;

    /** All combatants keyed by id, in the order they joined */
    private final Map<String, Combatant> combatants = new LinkedHashMap<>();

    /** Every attack resolved in this session, oldest first */
    private final List<AttackResult> attackLog = new ArrayList<>();

    /** Timestamp when combat started */
    private final long startedAt;

    /** Timestamp when combat ended (0 if still active) */
    private long endedAt;

    public CombatSession(String campaignId) {
        this(UUID.randomUUID().toString(), campaignId, CombatState.ACTIVE, System.currentTimeMillis(), 0);
    }

    /**
     * Rebuild a session from storage.
     */
    public CombatSession(String sessionId, String campaignId, CombatState state, long startedAt, long endedAt) {
        this.sessionId = sessionId;
        this.campaignId = campaignId;
        this.state = state;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
    }

    // Identification

    public String getSessionId() { return sessionId; }

    public String getCampaignId() { return campaignId; }

    public CombatState getState() { return state; }

    public boolean isActive() { return state == CombatState.ACTIVE; }

    public boolean hasEnded() { return state == CombatState.ENDED; }

    public long getStartedAt() { return startedAt; }

    public long getEndedAt() { return endedAt; }

    // Combatant Management

    /**
     * Add a new combatant. The id is the slug of the display name, made unique
     * by a numeric suffix ("goblin", "goblin-2", ...); the display name gets the same number.
     * @return the added combatant
     */
    public Combatant addCombatant(String baseName, String team, SourceKind sourceKind, String sourceKey, double hitChance) {
        String baseId = Slugs.slugify(baseName);
        if (baseId.isEmpty()) {
            baseId = sourceKind.getWireName();
        }
        String id = baseId;
        String name = baseName;
        int n = 2;
        while (combatants.containsKey(id)) {
            id = baseId + "-" + n;
            name = baseName + " " + n;
            n++;
        }
        Combatant combatant = new Combatant(id, name, team, sourceKind, sourceKey, hitChance);
        combatants.put(id, combatant);
        return combatant;
    }

    /**
     * Put a combatant loaded from storage back in place, keeping its id and status.
     */
    public void restoreCombatant(Combatant combatant) {
        combatants.put(combatant.getId(), combatant);
    }

    /**
     * All combatants in join order.
     */
    public List<Combatant> getCombatants() {
        return Collections.unmodifiableList(new ArrayList<>(combatants.values()));
    }

    public List<Combatant> getActiveCombatants() {
        return combatants.values().stream()
            .filter(Combatant::isActive)
            .collect(Collectors.toList());
    }

    /**
     * Find a combatant by id, falling back to the slug of a display name and then
     * to a case-insensitive name match.
     */
    public Optional<Combatant> find(String idOrName) {
        if (idOrName == null || idOrName.isBlank()) return Optional.empty();
        Combatant byId = combatants.get(idOrName);
        if (byId != null) return Optional.of(byId);
        Combatant bySlug = combatants.get(Slugs.slugify(idOrName));
        if (bySlug != null) return Optional.of(bySlug);
        String trimmed = idOrName.trim();
        return combatants.values().stream()
            .filter(c -> c.getName().equalsIgnoreCase(trimmed))
            .findFirst();
    }

    /**
     * Team labels in the order they first appeared.
     */
    public List<String> getTeams() {
        return combatants.values().stream()
            .map(Combatant::getTeam)
            .distinct()
            .collect(Collectors.toList());
    }

    /**
     * Teams that still have at least one active combatant.
     */
    public List<String> getTeamsStillFighting() {
        return combatants.values().stream()
            .filter(Combatant::isActive)
            .map(Combatant::getTeam)
            .distinct()
            .collect(Collectors.toList());
    }

    // Combat Resolution

    /**
     * Combat ends once every combatant of some team is out of the fight.
     */
    public boolean shouldEnd() {
        Set<String> fighting = new HashSet<>(getTeamsStillFighting());
        for (String team : getTeams()) {
            if (!fighting.contains(team)) return true;
        }
        return false;
    }

    /**
     * Take a combatant out of the fight and end the session if that leaves a team empty.
     * @return true if this removal ended the combat
     */
    public boolean remove(Combatant combatant, RemovalReason reason) {
        requireActive();
        combatant.leave(reason.getResultingStatus());
        if (shouldEnd()) {
            end();
            return true;
        }
        return false;
    }

    private void end() {
        state = CombatState.ENDED;
        endedAt = System.currentTimeMillis();
    }

    public void recordAttack(AttackResult result) {
        requireActive();
        attackLog.add(result);
    }

    /**
     * Add a log entry loaded from storage.
     */
    public void restoreAttack(AttackResult result) {
        attackLog.add(result);
    }

    public List<AttackResult> getAttackLog() {
        return Collections.unmodifiableList(attackLog);
    }

    private void requireActive() {
        if (state != CombatState.ACTIVE) {
            throw CombatException.noActiveCombat(campaignId);
        }
    }

    /**
     * Deep copy, so callers and stores never share mutable combatants.
     */
    public CombatSession copy() {
        CombatSession copy = new CombatSession(sessionId, campaignId, state, startedAt, endedAt);
        for (Combatant c : combatants.values()) {
            copy.combatants.put(c.getId(), c.copy());
        }
        copy.attackLog.addAll(attackLog);
        return copy;
    }

    /**
     * Get a summary of the combat state.
     */
    public String getSummary() {
        return String.format("Combat %s [%s] - %d/%d combatants active, teams: %s - Campaign %s",
            sessionId, state.getDisplayName(), getActiveCombatants().size(), combatants.size(),
            String.join(", ", getTeams()), campaignId);
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
