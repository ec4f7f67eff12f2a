package com.example.rpgcampaign.tools;

/**
 * Interface for tool handlers. Each handler processes the tools of one category.
 */
public interface ToolHandler {

    /**
     * Execute the tool.
     *
     * @param request the tool name and arguments; required arguments are already present
     * @return the tool's output
     * @throws com.example.rpgcampaign.combat.CombatException for any caller-facing failure
     */
    ToolResult handle(ToolRequest request);

    /**
     * Check if this handler can process the given tool name.
     */
    boolean supports(String toolName);
}
