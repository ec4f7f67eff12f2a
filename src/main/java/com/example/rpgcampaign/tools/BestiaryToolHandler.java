package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.ThreatLevelTable;
import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.ThreatLevel;
import com.example.rpgcampaign.persistence.CampaignRepository;
import com.example.rpgcampaign.tools.ToolDefinition.Category;
import com.example.rpgcampaign.util.DiceFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles bestiary tools: create_bestiary_entry, get_bestiary.
 */
public class BestiaryToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(BestiaryToolHandler.class);

    private static final Set<String> SUPPORTED_TOOLS = ToolRegistry.getToolsByCategory(Category.BESTIARY).stream()
            .map(ToolDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final CampaignRepository records;

    public BestiaryToolHandler(CampaignRepository records) {
        this.records = records;
    }

    @Override
    public boolean supports(String toolName) {
        return SUPPORTED_TOOLS.contains(toolName);
    }

    @Override
    public ToolResult handle(ToolRequest request) {
        switch (request.getName()) {
            case "create_bestiary_entry":
                return handleCreateEntry(request);
            case "get_bestiary":
                return handleGetBestiary(request);
            default:
                throw CombatException.invalidArgument("Unsupported bestiary tool: " + request.getName());
        }
    }

    private ToolResult handleCreateEntry(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        ToolSupport.requireCampaign(records, campaignId);

        String name = request.require("name");
        if (records.getBestiaryEntry(campaignId, name).isPresent()) {
            throw CombatException.alreadyExists("Bestiary entry", name);
        }
        ThreatLevel threat = ThreatLevelTable.parse(request.require("threat_level"));
        String hp = request.require("hp");
        if (!DiceFormula.isValid(hp)) {
            throw CombatException.invalidArgument("HP '" + hp + "' is not a number or dice formula like 2d6+3.");
        }
        Map<String, String> weapons = parseWeapons(request.get("weapons"));

        BestiaryEntry entry = new BestiaryEntry(name, threat, hp, weapons, request.getOrDefault("description", ""));
        records.saveBestiaryEntry(campaignId, entry);
        logger.info("Bestiary entry '{}' ({}) added to campaign {}", name, threat, campaignId);
        return ToolResult.ok("Added to bestiary: " + describe(entry));
    }

    /**
     * Parse "claw:1d4, bite:1d6" into an ordered map, validating each formula.
     */
    static Map<String, String> parseWeapons(String text) {
        Map<String, String> weapons = new LinkedHashMap<>();
        for (String item : ToolSupport.splitList(text)) {
            int colon = item.indexOf(':');
            if (colon <= 0 || colon == item.length() - 1) {
                throw CombatException.invalidArgument("Weapon '" + item + "' must look like name:formula.");
            }
            String weapon = item.substring(0, colon).trim();
            String formula = item.substring(colon + 1).trim();
            if (!DiceFormula.isValid(formula)) {
                throw CombatException.invalidArgument("Weapon '" + weapon + "' has invalid damage formula '"
                    + formula + "'.");
            }
            weapons.put(weapon, formula);
        }
        return weapons;
    }

    private ToolResult handleGetBestiary(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        ToolSupport.requireCampaign(records, campaignId);
        List<BestiaryEntry> entries = records.getBestiary(campaignId);
        if (entries.isEmpty()) {
            return ToolResult.ok("The bestiary is empty.");
        }
        StringBuilder sb = new StringBuilder("Bestiary:\n");
        for (BestiaryEntry entry : entries) {
            sb.append("  - ").append(describe(entry)).append('\n');
            if (!entry.getDescription().isEmpty()) {
                sb.append("      ").append(entry.getDescription()).append('\n');
            }
        }
        return ToolResult.ok(sb.toString().trim());
    }

    private static String describe(BestiaryEntry entry) {
        StringBuilder sb = new StringBuilder();
        sb.append(entry.getName()).append(" [").append(entry.getThreatLevel()).append(", hit ")
            .append(ToolSupport.percent(ThreatLevelTable.hitChanceFor(entry.getThreatLevel())))
            .append("] HP ").append(entry.getHp()).append(" (max ").append(DiceFormula.maxValue(entry.getHp())).append(')');
        if (!entry.getWeapons().isEmpty()) {
            sb.append(" weapons: ");
            sb.append(entry.getWeapons().entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }
}
