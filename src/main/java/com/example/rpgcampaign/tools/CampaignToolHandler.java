package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.combat.ThreatLevelTable;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.ThreatLevel;
import com.example.rpgcampaign.persistence.BestiaryYamlLoader;
import com.example.rpgcampaign.persistence.CampaignRepository;
import com.example.rpgcampaign.tools.ToolDefinition.Category;
import com.example.rpgcampaign.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Handles campaign tools: begin_campaign, list_campaigns, get_campaign, delete_campaign.
 */
public class CampaignToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(CampaignToolHandler.class);

    private static final Set<String> SUPPORTED_TOOLS = ToolRegistry.getToolsByCategory(Category.CAMPAIGN).stream()
            .map(ToolDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final CampaignRepository records;
    private final CombatSessionManager sessions;
    private final BestiaryYamlLoader bestiaryLoader;

    /** Classpath resource copied into each new campaign's bestiary, or null */
    private final String bestiarySeed;

    public CampaignToolHandler(CampaignRepository records, CombatSessionManager sessions,
                               BestiaryYamlLoader bestiaryLoader, String bestiarySeed) {
        this.records = records;
        this.sessions = sessions;
        this.bestiaryLoader = bestiaryLoader;
        this.bestiarySeed = bestiarySeed;
    }

    @Override
    public boolean supports(String toolName) {
        return SUPPORTED_TOOLS.contains(toolName);
    }

    @Override
    public ToolResult handle(ToolRequest request) {
        switch (request.getName()) {
            case "begin_campaign":
                return handleBeginCampaign(request);
            case "list_campaigns":
                return handleListCampaigns();
            case "get_campaign":
                return handleGetCampaign(request);
            case "delete_campaign":
                return handleDeleteCampaign(request);
            default:
                throw CombatException.invalidArgument("Unsupported campaign tool: " + request.getName());
        }
    }

    private ToolResult handleBeginCampaign(ToolRequest request) {
        String name = request.require("name");
        String playerName = request.require("player_name");
        ThreatLevel playerThreat = request.has("player_threat_level")
            ? ThreatLevelTable.parse(request.get("player_threat_level"))
            : ThreatLevel.MODERATE;

        String playerSlug = Slugs.slugify(playerName);
        if (playerSlug.isEmpty()) {
            throw CombatException.invalidArgument("Player name '" + playerName + "' has no usable characters.");
        }

        Campaign campaign = new Campaign(UUID.randomUUID().toString(), name, Slugs.slugify(name),
            playerName, playerSlug, System.currentTimeMillis());
        records.saveCampaign(campaign);

        // The player character is an NPC record flagged as the player
        NpcRecord player = new NpcRecord(playerSlug, playerName,
            List.of(playerName.toLowerCase(), "player", "you", "user"),
            request.getOrDefault("player_description", ""), playerThreat, null, true);
        records.saveNpc(campaign.getId(), player);

        int seeded = 0;
        if (bestiarySeed != null) {
            seeded = bestiaryLoader.loadInto(records, campaign.getId(), bestiarySeed);
        }
        logger.info("Campaign '{}' created with id {} (player {})", name, campaign.getId(), playerName);

        StringBuilder sb = new StringBuilder();
        sb.append("Campaign '").append(name).append("' created.\n");
        sb.append("ID: ").append(campaign.getId()).append('\n');
        sb.append("Player: ").append(playerName).append(" (").append(playerSlug).append("), threat ")
            .append(playerThreat).append('\n');
        if (seeded > 0) {
            sb.append("Bestiary seeded with ").append(seeded).append(" creatures.\n");
        }
        return ToolResult.ok(sb.toString().trim());
    }

    private ToolResult handleListCampaigns() {
        List<Campaign> campaigns = records.listCampaigns();
        if (campaigns.isEmpty()) {
            return ToolResult.ok("No campaigns yet. Use begin_campaign to create one.");
        }
        StringBuilder sb = new StringBuilder("Campaigns:\n");
        for (Campaign c : campaigns) {
            sb.append("  - ").append(c.getName()).append(" [").append(c.getId()).append("] player: ")
                .append(c.getPlayerName()).append('\n');
        }
        return ToolResult.ok(sb.toString().trim());
    }

    private ToolResult handleGetCampaign(ToolRequest request) {
        Campaign c = ToolSupport.requireCampaign(records, request.require("campaign_id"));
        int npcs = records.listNpcs(c.getId()).size();
        int creatures = records.getBestiary(c.getId()).size();
        return ToolResult.ok("Campaign: " + c.getName() + "\n"
            + "ID: " + c.getId() + "\n"
            + "Slug: " + c.getSlug() + "\n"
            + "Player: " + c.getPlayerName() + " (" + c.getPlayerSlug() + ")\n"
            + "NPCs: " + npcs + "\n"
            + "Bestiary entries: " + creatures);
    }

    private ToolResult handleDeleteCampaign(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        Campaign c = ToolSupport.requireCampaign(records, campaignId);
        // Under the campaign lock so an in-flight fight cannot save after the rows are gone
        if (!sessions.deleteCampaign(campaignId, () -> records.deleteCampaign(campaignId))) {
            throw CombatException.campaignNotFound(campaignId);
        }
        logger.info("Campaign '{}' ({}) deleted", c.getName(), campaignId);
        return ToolResult.ok("Campaign '" + c.getName() + "' deleted.");
    }
}
