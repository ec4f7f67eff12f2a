package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.tools.ToolDefinition.Category;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles system tools: help, list_resources, read_resource.
 */
public class SystemToolHandler implements ToolHandler {

    private static final Set<String> SUPPORTED_TOOLS = ToolRegistry.getToolsByCategory(Category.SYSTEM).stream()
            .map(ToolDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final ResourceReader resources;

    public SystemToolHandler(ResourceReader resources) {
        this.resources = resources;
    }

    @Override
    public boolean supports(String toolName) {
        return SUPPORTED_TOOLS.contains(toolName);
    }

    @Override
    public ToolResult handle(ToolRequest request) {
        switch (request.getName()) {
            case "help":
                return handleHelp(request);
            case "list_resources":
                return ToolResult.ok(String.join("\n", resources.listResources()));
            case "read_resource":
                return ToolResult.ok(resources.read(request.require("uri")).trim());
            default:
                throw CombatException.invalidArgument("Unsupported system tool: " + request.getName());
        }
    }

    private ToolResult handleHelp(ToolRequest request) {
        String toolName = request.get("tool");
        if (toolName != null) {
            ToolDefinition def = ToolRegistry.getTool(toolName);
            if (def == null) {
                throw CombatException.invalidArgument("Unknown tool '" + toolName + "'.");
            }
            return ToolResult.ok(def.getUsage() + "\n  " + def.getDescription());
        }

        StringBuilder sb = new StringBuilder("Available tools:\n");
        for (Category category : Category.values()) {
            sb.append("\n").append(category.getDisplayName()).append(":\n");
            for (ToolDefinition def : ToolRegistry.getToolsByCategory(category)) {
                sb.append(String.format("  %-22s %s%n", def.getName(), def.getDescription()));
            }
        }
        return ToolResult.ok(sb.toString().trim());
    }
}
