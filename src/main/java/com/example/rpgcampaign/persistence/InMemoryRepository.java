package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.Inventory;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.ParticipantSource;
import com.example.rpgcampaign.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local storage for all campaign data. Nothing survives a restart.
 * Sessions are copied on the way in and on the way out.
 */
public class InMemoryRepository implements CampaignRepository, CombatRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRepository.class);

    /** Campaigns by ID, in creation order */
    private final Map<String, Campaign> campaigns = new LinkedHashMap<>();

    /** campaign ID -> NPC slug -> NPC */
    private final Map<String, Map<String, NpcRecord>> npcs = new ConcurrentHashMap<>();

    /** campaign ID -> NPC slug -> inventory */
    private final Map<String, Map<String, Inventory>> inventories = new ConcurrentHashMap<>();

    /** campaign ID -> bestiary key -> entry */
    private final Map<String, Map<String, BestiaryEntry>> bestiaries = new ConcurrentHashMap<>();

    /** campaign ID -> latest combat session */
    private final Map<String, CombatSession> sessions = new ConcurrentHashMap<>();

    // ==================== CAMPAIGNS ====================

    @Override
    public synchronized void saveCampaign(Campaign campaign) {
        campaigns.put(campaign.getId(), campaign);
    }

    @Override
    public synchronized Optional<Campaign> getCampaign(String campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public synchronized List<Campaign> listCampaigns() {
        return new ArrayList<>(campaigns.values());
    }

    @Override
    public synchronized boolean deleteCampaign(String campaignId) {
        Campaign removed = campaigns.remove(campaignId);
        npcs.remove(campaignId);
        inventories.remove(campaignId);
        bestiaries.remove(campaignId);
        sessions.remove(campaignId);
        if (removed != null) {
            logger.debug("InMemoryRepository: deleted campaign {}", campaignId);
        }
        return removed != null;
    }

    // ==================== NPCS ====================

    @Override
    public void saveNpc(String campaignId, NpcRecord npc) {
        npcMap(campaignId).put(npc.getSlug(), npc);
    }

    @Override
    public Optional<NpcRecord> getNpc(String campaignId, String slug) {
        return Optional.ofNullable(npcMap(campaignId).get(slug));
    }

    @Override
    public List<NpcRecord> listNpcs(String campaignId) {
        synchronized (npcMap(campaignId)) {
            return new ArrayList<>(npcMap(campaignId).values());
        }
    }

    private Map<String, NpcRecord> npcMap(String campaignId) {
        return npcs.computeIfAbsent(campaignId, id -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    // ==================== INVENTORY ====================

    @Override
    public Optional<Inventory> getInventory(String campaignId, String npcSlug) {
        Inventory stored = inventoryMap(campaignId).get(npcSlug);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public void saveInventory(String campaignId, String npcSlug, Inventory inventory) {
        inventoryMap(campaignId).put(npcSlug, inventory.copy());
    }

    private Map<String, Inventory> inventoryMap(String campaignId) {
        return inventories.computeIfAbsent(campaignId, id -> new ConcurrentHashMap<>());
    }

    // ==================== BESTIARY ====================

    @Override
    public void saveBestiaryEntry(String campaignId, BestiaryEntry entry) {
        bestiaryMap(campaignId).put(entry.getKey(), entry);
    }

    @Override
    public Optional<BestiaryEntry> getBestiaryEntry(String campaignId, String name) {
        return Optional.ofNullable(bestiaryMap(campaignId).get(BestiaryEntry.keyFor(name)));
    }

    @Override
    public List<BestiaryEntry> getBestiary(String campaignId) {
        synchronized (bestiaryMap(campaignId)) {
            return new ArrayList<>(bestiaryMap(campaignId).values());
        }
    }

    private Map<String, BestiaryEntry> bestiaryMap(String campaignId) {
        return bestiaries.computeIfAbsent(campaignId, id -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    // ==================== COMBAT ====================

    @Override
    public boolean campaignExists(String campaignId) {
        return getCampaign(campaignId).isPresent();
    }

    @Override
    public Optional<CombatSession> loadSession(String campaignId) {
        // Stored sessions are never mutated after put, only replaced
        CombatSession stored = sessions.get(campaignId);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public void saveSession(CombatSession session) {
        sessions.put(session.getCampaignId(), session.copy());
    }

    @Override
    public Optional<ParticipantSource> loadParticipantSource(String campaignId, SourceKind kind, String key) {
        return ParticipantSourceResolver.resolve(this, campaignId, kind, key);
    }
}
