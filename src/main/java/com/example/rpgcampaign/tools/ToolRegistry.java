package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.tools.ToolDefinition.Category;

import java.util.*;

/**
 * Central registry of all tools with their metadata.
 * This is the single source of truth for tool names, categories and arguments.
 */
public class ToolRegistry {

    private static final List<ToolDefinition> TOOLS = new ArrayList<>();
    private static final Map<String, ToolDefinition> BY_NAME = new HashMap<>();

    static {
        // ===== CAMPAIGNS =====
        register("begin_campaign", "Create a campaign together with its player character", Category.CAMPAIGN,
            List.of("name", "player_name"), List.of("player_description", "player_threat_level"));
        register("list_campaigns", "List all campaigns", Category.CAMPAIGN, List.of(), List.of());
        register("get_campaign", "Show one campaign", Category.CAMPAIGN, List.of("campaign_id"), List.of());
        register("delete_campaign", "Delete a campaign and everything in it", Category.CAMPAIGN,
            List.of("campaign_id"), List.of());

        // ===== NPCS =====
        register("create_npc", "Add a named NPC to a campaign", Category.NPC,
            List.of("campaign_id", "name"), List.of("keywords", "arc", "threat_level", "hit_chance"));
        register("get_npc", "Look up an NPC by name, slug or keyword", Category.NPC,
            List.of("campaign_id", "name"), List.of());
        register("list_npcs", "List a campaign's NPCs", Category.NPC, List.of("campaign_id"), List.of());

        // ===== INVENTORY =====
        register("add_item", "Give an NPC an item, optionally a weapon or inside one of its containers",
            Category.INVENTORY, List.of("campaign_id", "npc_name", "item_name", "description", "source"),
            List.of("weapon", "damage", "container"));
        register("remove_item", "Take an item from an NPC (discarded, destroyed or used up)", Category.INVENTORY,
            List.of("campaign_id", "npc_name", "item_name"), List.of("reason"));
        register("update_item", "Change an item's description, weapon status, damage or container",
            Category.INVENTORY, List.of("campaign_id", "npc_name", "item_name"),
            List.of("description", "weapon", "damage", "container"));
        register("get_inventory", "Show an NPC's money and items", Category.INVENTORY,
            List.of("campaign_id", "npc_name"), List.of());
        register("add_money", "Give an NPC gold", Category.INVENTORY,
            List.of("campaign_id", "npc_name", "amount"), List.of());
        register("remove_money", "Take gold from an NPC; fails if it has too little", Category.INVENTORY,
            List.of("campaign_id", "npc_name", "amount"), List.of());

        // ===== BESTIARY =====
        register("create_bestiary_entry", "Add a creature template to a campaign's bestiary", Category.BESTIARY,
            List.of("campaign_id", "name", "threat_level", "hp"), List.of("weapons", "description"));
        register("get_bestiary", "List a campaign's bestiary", Category.BESTIARY, List.of("campaign_id"), List.of());

        // ===== COMBAT =====
        register("start_combat", "Start a fight: participants as kind:key@team[=chance] separated by ';'",
            Category.COMBAT, List.of("campaign_id", "participants"), List.of());
        register("join_combat", "Bring another participant into the active fight", Category.COMBAT,
            List.of("campaign_id", "participant"), List.of("allied_with"));
        register("attack", "Roll one attack between two combatants", Category.COMBAT,
            List.of("campaign_id", "attacker", "target"), List.of());
        register("remove_from_combat", "Take a combatant out of the fight (death, flee or surrender)",
            Category.COMBAT, List.of("campaign_id", "name"), List.of("reason"));
        register("get_combat_status", "Show the active fight", Category.COMBAT, List.of("campaign_id"), List.of());

        // ===== SYSTEM =====
        register("help", "List tools, or show usage for one tool", Category.SYSTEM, List.of(), List.of("tool"));
        register("list_resources", "List readable resource URIs", Category.SYSTEM, List.of(), List.of());
        register("read_resource", "Read a resource such as campaign://list", Category.SYSTEM,
            List.of("uri"), List.of());
    }

    private static void register(String name, String description, Category category,
                                 List<String> requiredArgs, List<String> optionalArgs) {
        ToolDefinition def = new ToolDefinition(name, description, category, requiredArgs, optionalArgs);
        TOOLS.add(def);
        BY_NAME.put(name, def);
    }

    /**
     * All tools in registration order.
     */
    public static List<ToolDefinition> getAllTools() {
        return Collections.unmodifiableList(TOOLS);
    }

    /**
     * Look up a tool by name (case-insensitive). Returns null if unknown.
     */
    public static ToolDefinition getTool(String name) {
        if (name == null) return null;
        return BY_NAME.get(name.trim().toLowerCase());
    }

    public static List<ToolDefinition> getToolsByCategory(Category category) {
        List<ToolDefinition> result = new ArrayList<>();
        for (ToolDefinition def : TOOLS) {
            if (def.getCategory() == category) {
                result.add(def);
            }
        }
        return result;
    }
}
