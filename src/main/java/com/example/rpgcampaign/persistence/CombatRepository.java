package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.model.ParticipantSource;
import com.example.rpgcampaign.model.SourceKind;

import java.util.Optional;

/**
 * Storage contract used by the combat engine.
 *
 * Implementations must hand out copies: a session returned by {@link #loadSession}
 * is never shared with the store or with another caller, and {@link #saveSession}
 * replaces the stored session as a whole.
 */
public interface CombatRepository {

    boolean campaignExists(String campaignId);

    /**
     * The most recent session of the campaign (active or ended), if any.
     */
    Optional<CombatSession> loadSession(String campaignId);

    void saveSession(CombatSession session);

    /**
     * Resolve the record behind a participant.
     *
     * @param kind npc, bestiary or player
     * @param key  NPC slug/name/keyword, bestiary name, or player name
     */
    Optional<ParticipantSource> loadParticipantSource(String campaignId, SourceKind kind, String key);
}
