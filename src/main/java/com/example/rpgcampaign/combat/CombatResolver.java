package com.example.rpgcampaign.combat;

import com.example.rpgcampaign.persistence.CombatRepository;
import com.example.rpgcampaign.util.HitRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves attacks and removals against a campaign's active fight.
 * A hit is recorded but changes nothing else; taking a combatant out is always a separate removal.
 */
public class CombatResolver {

    private static final Logger logger = LoggerFactory.getLogger(CombatResolver.class);

    private final CombatSessionManager sessions;
    private final HitRoller roller;

    public CombatResolver(CombatSessionManager sessions, HitRoller roller) {
        this.sessions = sessions;
        this.roller = roller;
    }

    /**
     * Roll one attack. The attacker's hit chance decides; a roll strictly below it hits.
     *
     * @throws CombatException CAMPAIGN_NOT_FOUND, NO_ACTIVE_COMBAT, PARTICIPANT_NOT_FOUND
     *                         or PARTICIPANT_INACTIVE
     */
    public AttackResult attack(String campaignId, String attackerId, String targetId) {
        sessions.requireCampaign(campaignId);
        return sessions.withCampaignLock(campaignId, () -> {
            sessions.requireCampaign(campaignId);
            CombatSession session = sessions.loadActive(campaignId);

            Combatant target = session.find(targetId)
                .orElseThrow(() -> CombatException.participantNotFound(targetId));
            Combatant attacker = session.find(attackerId)
                .orElseThrow(() -> CombatException.participantNotFound(attackerId));

            // Target first: attacking the fallen is refused whoever swings
            if (!target.isActive()) {
                throw CombatException.participantInactive(target);
            }
            if (!attacker.isActive()) {
                throw CombatException.participantInactive(attacker);
            }

            double roll = roller.nextRoll();
            AttackResult result = AttackResult.resolve(attacker, target, roll);
            session.recordAttack(result);
            repository().saveSession(session);

            logger.debug("{} -> {}: chance={} roll={} {}", attacker.getId(), target.getId(),
                result.getHitChance(), roll, result.isHit() ? "HIT" : "MISS");
            return result;
        });
    }

    /**
     * Take a combatant out of the fight and end the fight if a team has nobody left standing.
     *
     * @throws CombatException NO_ACTIVE_COMBAT, PARTICIPANT_NOT_FOUND or PARTICIPANT_INACTIVE
     */
    public RemovalOutcome removeFromCombat(String campaignId, String participantId, RemovalReason reason) {
        sessions.requireCampaign(campaignId);
        RemovalReason why = reason == null ? RemovalReason.DEATH : reason;
        return sessions.withCampaignLock(campaignId, () -> {
            sessions.requireCampaign(campaignId);
            CombatSession session = sessions.loadActive(campaignId);
            Combatant combatant = session.find(participantId)
                .orElseThrow(() -> CombatException.participantNotFound(participantId));

            boolean ended = session.remove(combatant, why);
            repository().saveSession(session);

            logger.info("{} left combat {} ({})", combatant.getName(), session.getSessionId(), combatant.getStatus());
            if (ended) {
                logger.info("Combat {} in campaign {} ended, teams still fighting: {}",
                    session.getSessionId(), campaignId, session.getTeamsStillFighting());
            }
            return new RemovalOutcome(combatant.getId(), combatant.getName(), why, combatant.getStatus(),
                ended, session.getTeamsStillFighting());
        });
    }

    private CombatRepository repository() {
        return sessions.getRepository();
    }
}
