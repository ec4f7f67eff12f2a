package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.ThreatLevelTable;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.ThreatLevel;
import com.example.rpgcampaign.persistence.CampaignRepository;
import com.example.rpgcampaign.tools.ToolDefinition.Category;
import com.example.rpgcampaign.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles NPC tools: create_npc, get_npc, list_npcs.
 */
public class NpcToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(NpcToolHandler.class);

    private static final Set<String> SUPPORTED_TOOLS = ToolRegistry.getToolsByCategory(Category.NPC).stream()
            .map(ToolDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final CampaignRepository records;

    public NpcToolHandler(CampaignRepository records) {
        this.records = records;
    }

    @Override
    public boolean supports(String toolName) {
        return SUPPORTED_TOOLS.contains(toolName);
    }

    @Override
    public ToolResult handle(ToolRequest request) {
        switch (request.getName()) {
            case "create_npc":
                return handleCreateNpc(request);
            case "get_npc":
                return handleGetNpc(request);
            case "list_npcs":
                return handleListNpcs(request);
            default:
                throw CombatException.invalidArgument("Unsupported NPC tool: " + request.getName());
        }
    }

    private ToolResult handleCreateNpc(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        ToolSupport.requireCampaign(records, campaignId);

        String name = request.require("name");
        String slug = Slugs.slugify(name);
        if (slug.isEmpty()) {
            throw CombatException.invalidArgument("NPC name '" + name + "' has no usable characters.");
        }
        if (records.getNpc(campaignId, slug).isPresent()) {
            throw CombatException.alreadyExists("NPC", name);
        }

        ThreatLevel threat = request.has("threat_level")
            ? ThreatLevelTable.parse(request.get("threat_level"))
            : ThreatLevel.MODERATE;
        Double hitChance = request.getDouble("hit_chance");
        if (hitChance != null && !ThreatLevelTable.isValidHitChance(hitChance)) {
            throw CombatException.invalidArgument("hit_chance must be between 0 and 1, got " + hitChance);
        }

        List<String> keywords = new ArrayList<>();
        keywords.add(name.toLowerCase());
        for (String keyword : ToolSupport.splitList(request.get("keywords"))) {
            String lower = keyword.toLowerCase();
            if (!keywords.contains(lower)) {
                keywords.add(lower);
            }
        }

        NpcRecord npc = new NpcRecord(slug, name, keywords, request.getOrDefault("arc", ""), threat, hitChance, false);
        records.saveNpc(campaignId, npc);
        logger.info("NPC '{}' ({}) created in campaign {}", name, slug, campaignId);
        return ToolResult.ok("Created NPC: " + name + " (" + slug + ")\n" + describe(npc));
    }

    private ToolResult handleGetNpc(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        ToolSupport.requireCampaign(records, campaignId);
        String name = request.require("name");
        NpcRecord npc = records.findNpc(campaignId, name)
            .orElseThrow(() -> CombatException.notFound("NPC", name));
        return ToolResult.ok(npc.getName() + " (" + npc.getSlug() + ")\n" + describe(npc));
    }

    private ToolResult handleListNpcs(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        ToolSupport.requireCampaign(records, campaignId);
        List<NpcRecord> npcs = records.listNpcs(campaignId);
        if (npcs.isEmpty()) {
            return ToolResult.ok("No NPCs in this campaign.");
        }
        StringBuilder sb = new StringBuilder("NPCs:\n");
        for (NpcRecord npc : npcs) {
            sb.append("  - ").append(npc.getName()).append(" (").append(npc.getSlug()).append(")");
            if (npc.isPlayer()) sb.append(" [player]");
            if (npc.getThreatLevel() != null) sb.append(" threat: ").append(npc.getThreatLevel());
            sb.append('\n');
        }
        return ToolResult.ok(sb.toString().trim());
    }

    private static String describe(NpcRecord npc) {
        StringBuilder sb = new StringBuilder();
        sb.append("Threat level: ").append(npc.getThreatLevel() == null ? "unknown" : npc.getThreatLevel()).append('\n');
        if (npc.getHitChance() != null) {
            sb.append("Hit chance: ").append(ToolSupport.percent(npc.getHitChance())).append('\n');
        }
        if (!npc.getKeywords().isEmpty()) {
            sb.append("Keywords: ").append(String.join(", ", npc.getKeywords())).append('\n');
        }
        if (!npc.getArc().isEmpty()) {
            sb.append("Arc: ").append(npc.getArc()).append('\n');
        }
        return sb.toString().trim();
    }
}
