package com.example.rpgcampaign;

import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.Inventory;
import com.example.rpgcampaign.model.InventoryItem;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.SourceKind;
import com.example.rpgcampaign.model.ThreatLevel;
import com.example.rpgcampaign.persistence.CampaignDAO;
import com.example.rpgcampaign.persistence.CombatDAO;
import com.example.rpgcampaign.persistence.Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.example.rpgcampaign.CampaignFixtures.CAMPAIGN_ID;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CampaignDAO Tests")
class CampaignDAOTest {

    private Database database;
    private CampaignDAO dao;

    @BeforeEach
    void setUp() {
        database = new Database("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        dao = new CampaignDAO(database);
        CampaignFixtures.populate(dao);
    }

    @Test
    @DisplayName("Campaigns round-trip through the database")
    void campaignStored() {
        Campaign c = dao.getCampaign(CAMPAIGN_ID).orElseThrow();
        assertEquals("Shadows", c.getName());
        assertEquals("shadows", c.getSlug());
        assertEquals("Hero", c.getPlayerName());
        assertEquals("hero", c.getPlayerSlug());
        assertEquals(1000L, c.getCreatedAt());
        assertTrue(dao.getCampaign("missing").isEmpty());
    }

    @Test
    @DisplayName("listCampaigns orders by creation time")
    void listCampaignsOrdered() {
        dao.saveCampaign(new Campaign("camp-0", "Older", "older", "Ayla", "ayla", 500L));
        List<Campaign> campaigns = dao.listCampaigns();
        assertEquals(2, campaigns.size());
        assertEquals("camp-0", campaigns.get(0).getId());
        assertEquals(CAMPAIGN_ID, campaigns.get(1).getId());
    }

    @Test
    @DisplayName("NPC fields survive storage, including null threat and hit chance")
    void npcStored() {
        NpcRecord pete = dao.getNpc(CAMPAIGN_ID, "old-pete").orElseThrow();
        assertEquals("Old Pete", pete.getName());
        assertEquals(ThreatLevel.LOW, pete.getThreatLevel());
        assertEquals(0.40, pete.getHitChance(), 1e-9);
        assertEquals(List.of("pete"), pete.getKeywords());
        assertFalse(pete.isPlayer());

        NpcRecord stranger = dao.getNpc(CAMPAIGN_ID, "stranger").orElseThrow();
        assertNull(stranger.getThreatLevel());
        assertNull(stranger.getHitChance());

        assertTrue(dao.getNpc(CAMPAIGN_ID, "hero").orElseThrow().isPlayer());
    }

    @Test
    @DisplayName("findNpc resolves by name and keyword")
    void findNpcByKeyword() {
        assertEquals("captain-mara", dao.findNpc(CAMPAIGN_ID, "Captain Mara").orElseThrow().getSlug());
        assertEquals("captain-mara", dao.findNpc(CAMPAIGN_ID, "mara").orElseThrow().getSlug());
        assertEquals("hero", dao.findNpc(CAMPAIGN_ID, "you").orElseThrow().getSlug());
        assertTrue(dao.findNpc(CAMPAIGN_ID, "nobody").isEmpty());
        assertEquals(4, dao.listNpcs(CAMPAIGN_ID).size());
    }

    @Test
    @DisplayName("Bestiary entries keep weapons in order and are looked up case-insensitively")
    void bestiaryStored() {
        Map<String, String> weapons = new LinkedHashMap<>();
        weapons.put("claw", "1d4");
        weapons.put("bite", "1d6+1");
        dao.saveBestiaryEntry(CAMPAIGN_ID, new BestiaryEntry("Giant Rat", ThreatLevel.LOW, "1d6", weapons, "Squeaks."));

        BestiaryEntry rat = dao.getBestiaryEntry(CAMPAIGN_ID, "GIANT RAT").orElseThrow();
        assertEquals("Giant Rat", rat.getName());
        assertEquals(ThreatLevel.LOW, rat.getThreatLevel());
        assertEquals(List.of("claw", "bite"), List.copyOf(rat.getWeapons().keySet()));
        assertEquals("1d6+1", rat.getWeapons().get("bite"));
        assertEquals("Squeaks.", rat.getDescription());
        assertEquals(3, dao.getBestiary(CAMPAIGN_ID).size());
    }

    @Test
    @DisplayName("Records are scoped to their campaign")
    void recordsScoped() {
        dao.saveCampaign(new Campaign("camp-2", "Other", "other", "Ayla", "ayla", 2000L));
        assertTrue(dao.listNpcs("camp-2").isEmpty());
        assertTrue(dao.getBestiary("camp-2").isEmpty());
        assertTrue(dao.getBestiaryEntry("camp-2", "Goblin").isEmpty());
    }

    @Test
    @DisplayName("deleteCampaign removes the campaign, its records and its combat")
    void deleteCampaign() {
        CombatDAO combat = new CombatDAO(database, dao);
        CombatSession session = new CombatSession(CAMPAIGN_ID);
        session.addCombatant("Hero", "players", SourceKind.PLAYER, "hero", 0.5);
        session.addCombatant("Goblin", "monsters", SourceKind.BESTIARY, "goblin", 0.25);
        combat.saveSession(session);

        assertTrue(dao.deleteCampaign(CAMPAIGN_ID));
        assertTrue(dao.getCampaign(CAMPAIGN_ID).isEmpty());
        assertTrue(dao.listNpcs(CAMPAIGN_ID).isEmpty());
        assertTrue(dao.getBestiary(CAMPAIGN_ID).isEmpty());
        assertTrue(combat.loadSession(CAMPAIGN_ID).isEmpty());
        assertFalse(dao.deleteCampaign(CAMPAIGN_ID));
    }

    @Test
    @DisplayName("The campaign tables are created once per database")
    void schemaReady() {
        assertTrue(database.isSchemaReady(CampaignDAO.SCHEMA));
        assertFalse(database.isSchemaReady(CombatDAO.SCHEMA));
        new CampaignDAO(database);
        assertEquals("Shadows", dao.getCampaign(CAMPAIGN_ID).orElseThrow().getName());
    }

    @Test
    @DisplayName("Inventories round-trip in order with optional damage and container")
    void inventoryStored() {
        assertTrue(dao.getInventory(CAMPAIGN_ID, "old-pete").isEmpty());

        Inventory inventory = new Inventory(25, List.of(
            new InventoryItem("Sack", "Patched burlap", "market", false, null, null),
            new InventoryItem("Knife", "Rusty", "found", true, "1d4", "Sack"),
            new InventoryItem("Apple", "", "tree", false, null, null)));
        dao.saveInventory(CAMPAIGN_ID, "old-pete", inventory);

        Inventory loaded = dao.getInventory(CAMPAIGN_ID, "old-pete").orElseThrow();
        assertEquals(25, loaded.getMoney());
        List<InventoryItem> items = loaded.getItems();
        assertEquals(3, items.size());
        assertEquals("Sack", items.get(0).getName());
        assertNull(items.get(0).getDamage());
        assertNull(items.get(0).getContainer());
        assertTrue(items.get(1).isWeapon());
        assertEquals("1d4", items.get(1).getDamage());
        assertEquals("Sack", items.get(1).getContainer());
        assertEquals("Apple", items.get(2).getName());

        loaded.removeItem("sack");
        loaded.setMoney(3);
        dao.saveInventory(CAMPAIGN_ID, "old-pete", loaded);
        Inventory reloaded = dao.getInventory(CAMPAIGN_ID, "old-pete").orElseThrow();
        assertEquals(3, reloaded.getMoney());
        assertEquals(2, reloaded.getItems().size());
        assertNull(reloaded.getItem("Knife").orElseThrow().getContainer());
        assertTrue(dao.getInventory(CAMPAIGN_ID, "captain-mara").isEmpty());

        assertTrue(dao.deleteCampaign(CAMPAIGN_ID));
        assertTrue(dao.getInventory(CAMPAIGN_ID, "old-pete").isEmpty());
    }
}
