package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.AttackResult;
import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.combat.Combatant;

import java.util.List;

/**
 * Renders combat sessions as text grouped by team.
 */
public final class CombatFormatter {

    /** How many recent attacks a status view shows */
    static final int RECENT_ATTACKS = 5;

    private CombatFormatter() { }

    public static String formatSession(CombatSession session) {
        StringBuilder sb = new StringBuilder();
        sb.append("Combat ").append(session.getSessionId()).append(" [").append(session.getState().getDisplayName())
            .append("]\n");
        for (String team : session.getTeams()) {
            sb.append("Team ").append(team).append(":\n");
            for (Combatant c : session.getCombatants()) {
                if (!c.getTeam().equals(team)) continue;
                sb.append("  - ").append(formatCombatant(c)).append('\n');
            }
        }

        List<AttackResult> log = session.getAttackLog();
        sb.append("Attacks so far: ").append(log.size());
        if (!log.isEmpty()) {
            sb.append("\nRecent:");
            for (AttackResult result : log.subList(Math.max(0, log.size() - RECENT_ATTACKS), log.size())) {
                sb.append("\n  ").append(result.describe());
            }
        }
        return sb.toString();
    }

    public static String formatCombatant(Combatant c) {
        return c.getName() + " (" + c.getId() + ") hit " + ToolSupport.percent(c.getHitChance())
            + (c.isActive() ? "" : " [" + c.getStatus().getWireName() + "]");
    }
}
