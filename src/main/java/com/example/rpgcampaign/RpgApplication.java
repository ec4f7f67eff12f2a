package com.example.rpgcampaign;

import com.example.rpgcampaign.combat.CombatResolver;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.config.ServerConfig;
import com.example.rpgcampaign.persistence.BestiaryYamlLoader;
import com.example.rpgcampaign.persistence.CampaignDAO;
import com.example.rpgcampaign.persistence.CampaignRepository;
import com.example.rpgcampaign.persistence.CombatDAO;
import com.example.rpgcampaign.persistence.CombatRepository;
import com.example.rpgcampaign.persistence.Database;
import com.example.rpgcampaign.persistence.InMemoryRepository;
import com.example.rpgcampaign.tools.BestiaryToolHandler;
import com.example.rpgcampaign.tools.CampaignToolHandler;
import com.example.rpgcampaign.tools.CombatToolHandler;
import com.example.rpgcampaign.tools.InventoryToolHandler;
import com.example.rpgcampaign.tools.NpcToolHandler;
import com.example.rpgcampaign.tools.ResourceReader;
import com.example.rpgcampaign.tools.SystemToolHandler;
import com.example.rpgcampaign.tools.ToolDefinition.Category;
import com.example.rpgcampaign.tools.ToolDispatcher;
import com.example.rpgcampaign.tools.ToolRequest;
import com.example.rpgcampaign.tools.ToolResult;
import com.example.rpgcampaign.util.HitRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires storage, the combat engine and the tool handlers together.
 * Built once per process (or per test) from a {@link ServerConfig}.
 */
public class RpgApplication {

    private static final Logger logger = LoggerFactory.getLogger(RpgApplication.class);

    private final CampaignRepository records;
    private final CombatSessionManager sessions;
    private final CombatResolver resolver;
    private final ResourceReader resources;
    private final ToolDispatcher dispatcher = new ToolDispatcher();

    public RpgApplication(ServerConfig config) {
        this(config, createRoller(config));
    }

    public RpgApplication(ServerConfig config, HitRoller roller) {
        CombatRepository combatStore;
        if (config.getStorageBackend() == ServerConfig.StorageBackend.MEMORY) {
            InMemoryRepository memory = new InMemoryRepository();
            records = memory;
            combatStore = memory;
        } else {
            Database database = Database.fromConfig(config);
            CampaignDAO campaignDao = new CampaignDAO(database);
            records = campaignDao;
            combatStore = new CombatDAO(database, campaignDao);
        }

        sessions = new CombatSessionManager(combatStore);
        resolver = new CombatResolver(sessions, roller);
        resources = new ResourceReader(records, sessions);

        dispatcher.registerHandler(Category.CAMPAIGN,
            new CampaignToolHandler(records, sessions, new BestiaryYamlLoader(), config.getBestiarySeed()));
        dispatcher.registerHandler(Category.NPC, new NpcToolHandler(records));
        dispatcher.registerHandler(Category.INVENTORY, new InventoryToolHandler(records, sessions));
        dispatcher.registerHandler(Category.BESTIARY, new BestiaryToolHandler(records));
        dispatcher.registerHandler(Category.COMBAT, new CombatToolHandler(sessions, resolver));
        dispatcher.registerHandler(Category.SYSTEM, new SystemToolHandler(resources));

        logger.info("RpgApplication ready (storage={}, seeded rolls={})",
            config.getStorageBackend(), roller.isSeeded());
    }

    private static HitRoller createRoller(ServerConfig config) {
        Long seed = config.getCombatSeed();
        return seed == null ? new HitRoller() : new HitRoller(seed);
    }

    public ToolResult call(ToolRequest request) {
        return dispatcher.dispatch(request);
    }

    public ToolResult call(String tool, String... keyValues) {
        return call(ToolRequest.of(tool, keyValues));
    }

    public CampaignRepository getRecords() { return records; }
    public CombatSessionManager getSessions() { return sessions; }
    public CombatResolver getResolver() { return resolver; }
    public ResourceReader getResources() { return resources; }
    public ToolDispatcher getDispatcher() { return dispatcher; }
}
