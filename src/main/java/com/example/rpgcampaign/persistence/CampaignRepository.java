package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.Inventory;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.util.Slugs;

import java.util.List;
import java.util.Optional;

/**
 * Record storage for campaigns, NPCs and bestiary entries.
 */
public interface CampaignRepository {

    // ==================== CAMPAIGNS ====================

    void saveCampaign(Campaign campaign);

    Optional<Campaign> getCampaign(String campaignId);

    /** All campaigns, oldest first. */
    List<Campaign> listCampaigns();

    /**
     * Delete a campaign with its NPCs, bestiary and combat state.
     * @return false if the campaign did not exist
     */
    boolean deleteCampaign(String campaignId);

    // ==================== NPCS ====================

    void saveNpc(String campaignId, NpcRecord npc);

    Optional<NpcRecord> getNpc(String campaignId, String slug);

    /**
     * Resolve an NPC by slug first, then by name or keyword.
     */
    default Optional<NpcRecord> findNpc(String campaignId, String nameOrKeyword) {
        Optional<NpcRecord> direct = getNpc(campaignId, Slugs.slugify(nameOrKeyword));
        if (direct.isPresent()) return direct;
        return listNpcs(campaignId).stream()
            .filter(npc -> npc.matches(nameOrKeyword))
            .findFirst();
    }

    List<NpcRecord> listNpcs(String campaignId);

    // ==================== INVENTORY ====================

    /**
     * The NPC's money and items, or empty when nothing was ever given to it.
     * The returned inventory is the caller's copy.
     */
    Optional<Inventory> getInventory(String campaignId, String npcSlug);

    /** Replace the NPC's whole inventory. */
    void saveInventory(String campaignId, String npcSlug, Inventory inventory);

    // ==================== BESTIARY ====================

    void saveBestiaryEntry(String campaignId, BestiaryEntry entry);

    /** Lookup by name, case-insensitive. */
    Optional<BestiaryEntry> getBestiaryEntry(String campaignId, String name);

    List<BestiaryEntry> getBestiary(String campaignId);
}
