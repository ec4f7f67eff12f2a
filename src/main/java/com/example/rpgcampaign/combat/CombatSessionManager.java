package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.model.ParticipantSource;
import com.example.rpgcampaign.persistence.CombatRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Starts, extends and looks up combat sessions, one session per campaign.
 *
 * Every load-modify-save cycle on a campaign's session runs under that campaign's lock,
 * so two mutations of the same fight never interleave. Different campaigns do not contend.
 */
public class CombatSessionManager {

    private static final Logger logger = LoggerFactory.getLogger(CombatSessionManager.class);

    private final CombatRepository repository;

    /** One lock per campaign ID, created on first use and dropped when the campaign is deleted */
    private final Map<String, ReentrantLock> campaignLocks = new ConcurrentHashMap<>();

    public CombatSessionManager(CombatRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    public CombatRepository getRepository() {
        return repository;
    }

    /**
     * Run an action while holding the campaign's lock.
     */
    public <T> T withCampaignLock(String campaignId, Supplier<T> action) {
        ReentrantLock lock = campaignLocks.computeIfAbsent(campaignId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Delete a campaign while holding its lock, then drop the lock.
     * Mutations re-check the campaign once they hold the lock, so none of them can write after the delete.
     *
     * @return whatever the deletion returns, normally whether the campaign existed
     */
    public boolean deleteCampaign(String campaignId, Supplier<Boolean> deletion) {
        boolean deleted = withCampaignLock(campaignId, deletion);
        campaignLocks.remove(campaignId);
        logger.debug("Released combat lock for campaign {}, {} campaign locks remain", campaignId, lockCount());
        return deleted;
    }

    /** Number of campaigns that currently hold a lock entry. */
    public int lockCount() {
        return campaignLocks.size();
    }

    // ==================== BEGIN ====================

    /**
     * Start a new fight in a campaign.
     *
     * @throws CombatException CAMPAIGN_NOT_FOUND, INVALID_COMBAT_SETUP, DUPLICATE_COMBAT
     *                         or PARTICIPANT_NOT_FOUND
     */
    public CombatSession begin(String campaignId, List<ParticipantSpec> participants) {
        requireCampaign(campaignId);
        validateSetup(participants);

        return withCampaignLock(campaignId, () -> {
            requireCampaign(campaignId);
            Optional<CombatSession> existing = repository.loadSession(campaignId);
            if (existing.isPresent() && existing.get().isActive()) {
                throw new CombatException(CombatException.Kind.DUPLICATE_COMBAT,
                    "Combat is already in progress in campaign " + campaignId
                        + ". End it before starting a new one.");
            }

            CombatSession session = new CombatSession(campaignId);
            for (ParticipantSpec spec : participants) {
                addParticipant(session, campaignId, spec, spec.getTeam().trim());
            }
            repository.saveSession(session);

            if (existing.isPresent()) {
                logger.debug("Replaced ended session {} in campaign {}", existing.get().getSessionId(), campaignId);
            }
            logger.info("Combat {} started in campaign {} with {} combatants on teams {}",
                session.getSessionId(), campaignId, session.getCombatants().size(), session.getTeams());
            return session;
        });
    }

    private void validateSetup(List<ParticipantSpec> participants) {
        if (participants == null || participants.isEmpty()) {
            throw CombatException.invalidSetup("Combat needs at least one participant.");
        }
        Set<String> teams = new LinkedHashSet<>();
        for (ParticipantSpec spec : participants) {
            if (spec.getTeam() == null || spec.getTeam().isBlank()) {
                throw CombatException.invalidSetup("Participant " + spec + " has no team.");
            }
            validateOverride(spec);
            teams.add(spec.getTeam().trim());
        }
        if (teams.size() < 2) {
            throw CombatException.invalidSetup("Combat needs at least two opposing teams, got: "
                + String.join(", ", teams));
        }
    }

    private static void validateOverride(ParticipantSpec spec) {
        Double override = spec.getHitChanceOverride();
        if (override != null && !ThreatLevelTable.isValidHitChance(override)) {
            throw CombatException.invalidSetup("Hit chance for " + spec.getKey() + " must be between 0 and 1, got "
                + override);
        }
    }

    // ==================== JOIN ====================

    /**
     * Add one combatant to the active fight.
     *
     * @param alliedWith id or name of a combatant whose team the newcomer joins; may be null
     * @throws CombatException NO_ACTIVE_COMBAT, PARTICIPANT_NOT_FOUND or INVALID_COMBAT_SETUP
     */
    public Combatant join(String campaignId, ParticipantSpec spec, String alliedWith) {
        requireCampaign(campaignId);
        validateOverride(spec);

        return withCampaignLock(campaignId, () -> {
            requireCampaign(campaignId);
            CombatSession session = loadActive(campaignId);

            String team;
            if (alliedWith != null && !alliedWith.isBlank()) {
                Combatant ally = session.find(alliedWith)
                    .orElseThrow(() -> CombatException.participantNotFound(alliedWith));
                team = ally.getTeam();
            } else if (spec.getTeam() != null && !spec.getTeam().isBlank()) {
                team = spec.getTeam().trim();
            } else {
                throw CombatException.invalidSetup("Joining " + spec.getKey() + " needs a team or an ally.");
            }

            Combatant added = addParticipant(session, campaignId, spec, team);
            repository.saveSession(session);
            logger.info("{} joined combat {} on team {}", added.getName(), session.getSessionId(), team);
            return added.copy();
        });
    }

    // ==================== LOOKUP ====================

    /**
     * Snapshot of the campaign's active fight.
     *
     * @throws CombatException CAMPAIGN_NOT_FOUND or NO_ACTIVE_COMBAT
     */
    public CombatSession getStatus(String campaignId) {
        requireCampaign(campaignId);
        return loadActive(campaignId);
    }

    /**
     * Load the campaign's session, failing unless it is still active.
     * The caller owns the returned copy.
     */
    public CombatSession loadActive(String campaignId) {
        return repository.loadSession(campaignId)
            .filter(CombatSession::isActive)
            .orElseThrow(() -> CombatException.noActiveCombat(campaignId));
    }

    /**
     * The latest session of the campaign whether or not it has ended.
     */
    public Optional<CombatSession> findLatest(String campaignId) {
        return repository.loadSession(campaignId);
    }

    void requireCampaign(String campaignId) {
        if (campaignId == null || !repository.campaignExists(campaignId)) {
            throw CombatException.campaignNotFound(campaignId);
        }
    }

    // ==================== HIT CHANCE ====================

    private Combatant addParticipant(CombatSession session, String campaignId, ParticipantSpec spec, String team) {
        ParticipantSource source = repository.loadParticipantSource(campaignId, spec.getKind(), spec.getKey())
            .orElseThrow(() -> new CombatException(CombatException.Kind.PARTICIPANT_NOT_FOUND,
                "No " + spec.getKind() + " named '" + spec.getKey() + "' in campaign " + campaignId + "."));

        double hitChance = resolveHitChance(spec, source);
        String name = spec.getDisplayName() != null && !spec.getDisplayName().isBlank()
            ? spec.getDisplayName().trim()
            : source.name();
        String key = spec.getKey() == null || spec.getKey().isBlank() ? source.name() : spec.getKey().trim();

        Combatant combatant = session.addCombatant(name, team, spec.getKind(), key, hitChance);
        logger.debug("Added {} ({}) to team {} with hit chance {}", combatant.getName(), combatant.getId(),
            team, hitChance);
        return combatant;
    }

    /**
     * Override first, then the record's explicit chance, then its threat level, then the default.
     */
    static double resolveHitChance(ParticipantSpec spec, ParticipantSource source) {
        if (spec.getHitChanceOverride() != null) {
            return spec.getHitChanceOverride();
        }
        if (source.hitChance() != null) {
            return source.hitChance();
        }
        if (source.threatLevel() != null) {
            return ThreatLevelTable.hitChanceFor(source.threatLevel());
        }
        return ThreatLevelTable.DEFAULT_HIT_CHANCE;
    }
}
