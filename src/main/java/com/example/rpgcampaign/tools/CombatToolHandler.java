package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.AttackResult;
import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.CombatResolver;
import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.combat.Combatant;
import com.example.rpgcampaign.combat.ParticipantSpec;
import com.example.rpgcampaign.combat.RemovalOutcome;
import com.example.rpgcampaign.combat.RemovalReason;
import com.example.rpgcampaign.tools.ToolDefinition.Category;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles combat tools: start_combat, join_combat, attack, remove_from_combat, get_combat_status.
 */
public class CombatToolHandler implements ToolHandler {

    private static final Set<String> SUPPORTED_TOOLS = ToolRegistry.getToolsByCategory(Category.COMBAT).stream()
            .map(ToolDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final CombatSessionManager sessions;
    private final CombatResolver resolver;

    public CombatToolHandler(CombatSessionManager sessions, CombatResolver resolver) {
        this.sessions = sessions;
        this.resolver = resolver;
    }

    @Override
    public boolean supports(String toolName) {
        return SUPPORTED_TOOLS.contains(toolName);
    }

    @Override
    public ToolResult handle(ToolRequest request) {
        switch (request.getName()) {
            case "start_combat":
                return handleStartCombat(request);
            case "join_combat":
                return handleJoinCombat(request);
            case "attack":
                return handleAttack(request);
            case "remove_from_combat":
                return handleRemove(request);
            case "get_combat_status":
                return handleStatus(request);
            default:
                throw CombatException.invalidArgument("Unsupported combat tool: " + request.getName());
        }
    }

    private ToolResult handleStartCombat(ToolRequest request) {
        List<ParticipantSpec> specs = ParticipantSpec.parseList(request.require("participants"));
        CombatSession session = sessions.begin(request.require("campaign_id"), specs);
        return ToolResult.ok("Combat started!\n" + CombatFormatter.formatSession(session));
    }

    private ToolResult handleJoinCombat(ToolRequest request) {
        ParticipantSpec spec = ParticipantSpec.parse(request.require("participant"));
        Combatant joined = sessions.join(request.require("campaign_id"), spec, request.get("allied_with"));
        return ToolResult.ok(joined.getName() + " joins the fight on team " + joined.getTeam() + ".\n"
            + CombatFormatter.formatCombatant(joined));
    }

    private ToolResult handleAttack(ToolRequest request) {
        AttackResult result = resolver.attack(request.require("campaign_id"),
            request.require("attacker"), request.require("target"));
        return ToolResult.ok(result.describe() + String.format(Locale.ROOT, " (rolled %.2f against %s)",
            result.getRoll(), ToolSupport.percent(result.getHitChance())));
    }

    private ToolResult handleRemove(ToolRequest request) {
        RemovalReason reason = RemovalReason.parse(request.get("reason"));
        RemovalOutcome outcome = resolver.removeFromCombat(request.require("campaign_id"),
            request.require("name"), reason);
        String text = outcome.describe();
        if (!outcome.combatEnded()) {
            text += "\nTeams still fighting: " + String.join(", ", outcome.teamsStillFighting());
        }
        return ToolResult.ok(text);
    }

    private ToolResult handleStatus(ToolRequest request) {
        CombatSession session = sessions.getStatus(request.require("campaign_id"));
        return ToolResult.ok(CombatFormatter.formatSession(session));
    }
}
