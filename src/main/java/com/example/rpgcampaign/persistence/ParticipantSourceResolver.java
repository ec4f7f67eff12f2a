package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.ParticipantSource;
import com.example.rpgcampaign.model.SourceKind;

import java.util.Optional;

/**
 * Looks up the record behind a combat participant in campaign storage.
 * Shared by the repository implementations so both resolve sources the same way.
 */
public final class ParticipantSourceResolver {

    private ParticipantSourceResolver() { }

    public static Optional<ParticipantSource> resolve(CampaignRepository records, String campaignId,
                                                      SourceKind kind, String key) {
        if (kind == null) return Optional.empty();
        switch (kind) {
            case BESTIARY:
                return records.getBestiaryEntry(campaignId, key).map(ParticipantSource::of);
            case NPC:
                return records.findNpc(campaignId, key).map(ParticipantSource::of);
            case PLAYER:
                return resolvePlayer(records, campaignId, key).map(ParticipantSource::of);
            default:
                return Optional.empty();
        }
    }

    private static Optional<NpcRecord> resolvePlayer(CampaignRepository records, String campaignId, String key) {
        if (key != null && !key.isBlank()) {
            Optional<NpcRecord> byKey = records.findNpc(campaignId, key).filter(NpcRecord::isPlayer);
            if (byKey.isPresent()) return byKey;
        }
        // Fall back to the campaign's own player character when no key was given
        if (key == null || key.isBlank()) {
            return records.getCampaign(campaignId)
                .map(Campaign::getPlayerSlug)
                .flatMap(slug -> records.getNpc(campaignId, slug));
        }
        return Optional.empty();
    }
}
