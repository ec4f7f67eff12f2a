package com.example.rpgcampaign.tools;

import java.util.Collections;
import java.util.List;

/**
 * Defines metadata for a single tool exposed to clients.
 */
public class ToolDefinition {

    public enum Category {
        CAMPAIGN("Campaigns"),
        NPC("NPCs"),
        INVENTORY("Inventory"),
        BESTIARY("Bestiary"),
        COMBAT("Combat"),
        SYSTEM("System");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final String name;
    private final String description;
    private final Category category;
    private final List<String> requiredArgs;
    private final List<String> optionalArgs;

    public ToolDefinition(String name, String description, Category category,
                          List<String> requiredArgs, List<String> optionalArgs) {
        this.name = name;
        this.description = description;
        this.category = category;
        this.requiredArgs = requiredArgs == null ? Collections.emptyList() : Collections.unmodifiableList(requiredArgs);
        this.optionalArgs = optionalArgs == null ? Collections.emptyList() : Collections.unmodifiableList(optionalArgs);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public Category getCategory() { return category; }
    public List<String> getRequiredArgs() { return requiredArgs; }
    public List<String> getOptionalArgs() { return optionalArgs; }

    /**
     * Usage line for help listings, e.g. "attack campaign_id=.. attacker=.. target=..".
     */
    public String getUsage() {
        StringBuilder sb = new StringBuilder(name);
        for (String arg : requiredArgs) {
            sb.append(' ').append(arg).append("=..");
        }
        for (String arg : optionalArgs) {
            sb.append(" [").append(arg).append("=..]");
        }
        return sb.toString();
    }
}
