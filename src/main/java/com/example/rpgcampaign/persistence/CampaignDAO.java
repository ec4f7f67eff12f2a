package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.Inventory;
import com.example.rpgcampaign.model.InventoryItem;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.ThreatLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.sql.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data Access Object for campaigns, NPCs and bestiary entries.
 */
public class CampaignDAO implements CampaignRepository {
    private static final Logger logger = LoggerFactory.getLogger(CampaignDAO.class);

    public static final String SCHEMA = "campaign";

    private final Database database;

    public CampaignDAO(Database database) {
        this.database = database;
        database.ensureSchema(SCHEMA, CampaignDAO::createTables);
    }

    private static void createTables(Statement s) throws SQLException {
        s.execute("""
            CREATE TABLE IF NOT EXISTS campaign (
                id VARCHAR(64) PRIMARY KEY,
                name VARCHAR(200) NOT NULL,
                slug VARCHAR(200),
                player_name VARCHAR(200),
                player_slug VARCHAR(200),
                created_at BIGINT
            )
        """);

        s.execute("""
            CREATE TABLE IF NOT EXISTS npc (
                campaign_id VARCHAR(64) NOT NULL,
                slug VARCHAR(200) NOT NULL,
                name VARCHAR(200) NOT NULL,
                keywords VARCHAR(1024),
                arc CLOB,
                threat_level VARCHAR(32),
                hit_chance DOUBLE,
                is_player BOOLEAN DEFAULT FALSE,
                PRIMARY KEY (campaign_id, slug)
            )
        """);

        s.execute("""
            CREATE TABLE IF NOT EXISTS bestiary_entry (
                campaign_id VARCHAR(64) NOT NULL,
                entry_key VARCHAR(200) NOT NULL,
                name VARCHAR(200) NOT NULL,
                threat_level VARCHAR(32) NOT NULL,
                hp VARCHAR(64),
                weapons CLOB,
                description CLOB,
                created_at BIGINT,
                PRIMARY KEY (campaign_id, entry_key)
            )
        """);

        s.execute("""
            CREATE TABLE IF NOT EXISTS npc_inventory (
                campaign_id VARCHAR(64) NOT NULL,
                npc_slug VARCHAR(200) NOT NULL,
                money BIGINT DEFAULT 0,
                PRIMARY KEY (campaign_id, npc_slug)
            )
        """);

        // container holds the name of another item of the same NPC, or NULL
        s.execute("""
            CREATE TABLE IF NOT EXISTS inventory_item (
                campaign_id VARCHAR(64) NOT NULL,
                npc_slug VARCHAR(200) NOT NULL,
                item_key VARCHAR(200) NOT NULL,
                seq INT NOT NULL,
                name VARCHAR(200) NOT NULL,
                description CLOB,
                source VARCHAR(500),
                is_weapon BOOLEAN DEFAULT FALSE,
                damage VARCHAR(64),
                container VARCHAR(200),
                PRIMARY KEY (campaign_id, npc_slug, item_key)
            )
        """);
    }

    // ==================== CAMPAIGNS ====================

    @Override
    public void saveCampaign(Campaign campaign) {
        String sql = "MERGE INTO campaign (id, name, slug, player_name, player_slug, created_at) KEY(id) VALUES (?,?,?,?,?,?)";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaign.getId());
            ps.setString(2, campaign.getName());
            ps.setString(3, campaign.getSlug());
            ps.setString(4, campaign.getPlayerName());
            ps.setString(5, campaign.getPlayerSlug());
            ps.setLong(6, campaign.getCreatedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save campaign " + campaign.getId(), e);
        }
    }

    @Override
    public Optional<Campaign> getCampaign(String campaignId) {
        String sql = "SELECT id, name, slug, player_name, player_slug, created_at FROM campaign WHERE id = ?";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapCampaign(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load campaign " + campaignId, e);
        }
    }

    @Override
    public List<Campaign> listCampaigns() {
        String sql = "SELECT id, name, slug, player_name, player_slug, created_at FROM campaign ORDER BY created_at, name";
        List<Campaign> result = new ArrayList<>();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(mapCampaign(rs));
            }
            return result;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list campaigns", e);
        }
    }

    @Override
    public boolean deleteCampaign(String campaignId) {
        // Combat tables belong to CombatDAO; make sure they exist before deleting from them
        CombatDAO.ensureSchema(database);
        try (Connection c = database.getConnection()) {
            c.setAutoCommit(false);
            try {
                int deleted;
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM campaign WHERE id = ?")) {
                    ps.setString(1, campaignId);
                    deleted = ps.executeUpdate();
                }
                for (String table : Arrays.asList("npc", "npc_inventory", "inventory_item", "bestiary_entry",
                        "combatant", "attack_log", "combat_session")) {
                    try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE campaign_id = ?")) {
                        ps.setString(1, campaignId);
                        ps.executeUpdate();
                    }
                }
                c.commit();
                if (deleted > 0) {
                    logger.info("CampaignDAO: deleted campaign {} and its records", campaignId);
                }
                return deleted > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete campaign " + campaignId, e);
        }
    }

    private Campaign mapCampaign(ResultSet rs) throws SQLException {
        return new Campaign(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("slug"),
            rs.getString("player_name"),
            rs.getString("player_slug"),
            rs.getLong("created_at"));
    }

    // ==================== NPCS ====================

    @Override
    public void saveNpc(String campaignId, NpcRecord npc) {
        String sql = "MERGE INTO npc (campaign_id, slug, name, keywords, arc, threat_level, hit_chance, is_player) " +
            "KEY(campaign_id, slug) VALUES (?,?,?,?,?,?,?,?)";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, npc.getSlug());
            ps.setString(3, npc.getName());
            ps.setString(4, String.join(",", npc.getKeywords()));
            ps.setString(5, npc.getArc());
            if (npc.getThreatLevel() != null) {
                ps.setString(6, npc.getThreatLevel().getWireName());
            } else {
                ps.setNull(6, Types.VARCHAR);
            }
            if (npc.getHitChance() != null) {
                ps.setDouble(7, npc.getHitChance());
            } else {
                ps.setNull(7, Types.DOUBLE);
            }
            ps.setBoolean(8, npc.isPlayer());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save NPC " + npc.getSlug(), e);
        }
    }

    @Override
    public Optional<NpcRecord> getNpc(String campaignId, String slug) {
        String sql = "SELECT * FROM npc WHERE campaign_id = ? AND slug = ?";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, slug);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapNpc(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load NPC " + slug, e);
        }
    }

    @Override
    public List<NpcRecord> listNpcs(String campaignId) {
        String sql = "SELECT * FROM npc WHERE campaign_id = ? ORDER BY is_player DESC, name";
        List<NpcRecord> result = new ArrayList<>();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapNpc(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list NPCs for campaign " + campaignId, e);
        }
    }

    private NpcRecord mapNpc(ResultSet rs) throws SQLException {
        String keywords = rs.getString("keywords");
        List<String> keywordList = new ArrayList<>();
        if (keywords != null && !keywords.isBlank()) {
            for (String k : keywords.split(",")) {
                if (!k.isBlank()) keywordList.add(k.trim());
            }
        }
        double hitChance = rs.getDouble("hit_chance");
        Double hitChanceOrNull = rs.wasNull() ? null : hitChance;
        return new NpcRecord(
            rs.getString("slug"),
            rs.getString("name"),
            keywordList,
            rs.getString("arc"),
            ThreatLevel.fromString(rs.getString("threat_level")),
            hitChanceOrNull,
            rs.getBoolean("is_player"));
    }

    // ==================== INVENTORY ====================

    @Override
    public Optional<Inventory> getInventory(String campaignId, String npcSlug) {
        try (Connection c = database.getConnection()) {
            long money;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT money FROM npc_inventory WHERE campaign_id = ? AND npc_slug = ?")) {
                ps.setString(1, campaignId);
                ps.setString(2, npcSlug);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    money = rs.getLong("money");
                }
            }

            List<InventoryItem> items = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM inventory_item WHERE campaign_id = ? AND npc_slug = ? ORDER BY seq")) {
                ps.setString(1, campaignId);
                ps.setString(2, npcSlug);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        items.add(new InventoryItem(
                            rs.getString("name"),
                            rs.getString("description"),
                            rs.getString("source"),
                            rs.getBoolean("is_weapon"),
                            rs.getString("damage"),
                            rs.getString("container")));
                    }
                }
            }
            return Optional.of(new Inventory(money, items));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load inventory of " + npcSlug, e);
        }
    }

    @Override
    public void saveInventory(String campaignId, String npcSlug, Inventory inventory) {
        try (Connection c = database.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "MERGE INTO npc_inventory (campaign_id, npc_slug, money) KEY(campaign_id, npc_slug) VALUES (?,?,?)")) {
                    ps.setString(1, campaignId);
                    ps.setString(2, npcSlug);
                    ps.setLong(3, inventory.getMoney());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM inventory_item WHERE campaign_id = ? AND npc_slug = ?")) {
                    ps.setString(1, campaignId);
                    ps.setString(2, npcSlug);
                    ps.executeUpdate();
                }
                String insert = "INSERT INTO inventory_item (campaign_id, npc_slug, item_key, seq, name, description, " +
                    "source, is_weapon, damage, container) VALUES (?,?,?,?,?,?,?,?,?,?)";
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    int seq = 0;
                    for (InventoryItem item : inventory.getItems()) {
                        ps.setString(1, campaignId);
                        ps.setString(2, npcSlug);
                        ps.setString(3, item.getKey());
                        ps.setInt(4, seq++);
                        ps.setString(5, item.getName());
                        ps.setString(6, item.getDescription());
                        ps.setString(7, item.getSource());
                        ps.setBoolean(8, item.isWeapon());
                        if (item.getDamage() != null) ps.setString(9, item.getDamage()); else ps.setNull(9, Types.VARCHAR);
                        if (item.getContainer() != null) ps.setString(10, item.getContainer()); else ps.setNull(10, Types.VARCHAR);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                c.commit();
                logger.debug("CampaignDAO: saved inventory of {} in campaign {} ({} gold, {} items)",
                    npcSlug, campaignId, inventory.getMoney(), inventory.getItems().size());
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save inventory of " + npcSlug, e);
        }
    }

    // ==================== BESTIARY ====================

    @Override
    public void saveBestiaryEntry(String campaignId, BestiaryEntry entry) {
        String sql = "MERGE INTO bestiary_entry (campaign_id, entry_key, name, threat_level, hp, weapons, description, created_at) " +
            "KEY(campaign_id, entry_key) VALUES (?,?,?,?,?,?,?,?)";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, entry.getKey());
            ps.setString(3, entry.getName());
            ps.setString(4, entry.getThreatLevel().getWireName());
            ps.setString(5, entry.getHp());
            ps.setString(6, new Yaml().dump(new LinkedHashMap<>(entry.getWeapons())));
            ps.setString(7, entry.getDescription());
            ps.setLong(8, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save bestiary entry " + entry.getName(), e);
        }
    }

    @Override
    public Optional<BestiaryEntry> getBestiaryEntry(String campaignId, String name) {
        String sql = "SELECT * FROM bestiary_entry WHERE campaign_id = ? AND entry_key = ?";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, BestiaryEntry.keyFor(name));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapEntry(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load bestiary entry " + name, e);
        }
    }

    @Override
    public List<BestiaryEntry> getBestiary(String campaignId) {
        String sql = "SELECT * FROM bestiary_entry WHERE campaign_id = ? ORDER BY created_at, name";
        List<BestiaryEntry> result = new ArrayList<>();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapEntry(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load bestiary for campaign " + campaignId, e);
        }
    }

    @SuppressWarnings("unchecked")
    private BestiaryEntry mapEntry(ResultSet rs) throws SQLException {
        Map<String, String> weapons = new LinkedHashMap<>();
        String weaponsYaml = rs.getString("weapons");
        if (weaponsYaml != null && !weaponsYaml.isBlank()) {
            Object loaded = new Yaml().load(weaponsYaml);
            if (loaded instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    weapons.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
                }
            }
        }
        String threat = rs.getString("threat_level");
        ThreatLevel level = ThreatLevel.fromString(threat);
        if (level == null) {
            logger.warn("CampaignDAO: bestiary entry '{}' has unknown threat level '{}', treating as moderate",
                rs.getString("name"), threat);
            level = ThreatLevel.MODERATE;
        }
        return new BestiaryEntry(
            rs.getString("name"),
            level,
            rs.getString("hp"),
            weapons,
            rs.getString("description"));
    }
}
