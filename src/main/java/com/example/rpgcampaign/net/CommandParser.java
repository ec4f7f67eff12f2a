package com.example.rpgcampaign.net;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.tools.ToolRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small command parser that splits a console line into a tool name and {@code key=value} arguments.
 * Double quotes group words: {@code begin_campaign name="Shadows of Umbar" player_name=Ayla}.
 */
public class CommandParser {

    /**
     * Parse one line.
     * @return the request, or null for a blank line
     * @throws CombatException INVALID_ARGUMENT for unbalanced quotes or arguments without '='
     */
    public static ToolRequest parse(String line) {
        if (line == null || line.isBlank()) return null;

        List<String> tokens = tokenize(line.trim());
        String name = tokens.get(0);
        Map<String, String> args = new LinkedHashMap<>();
        for (String token : tokens.subList(1, tokens.size())) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                throw CombatException.invalidArgument("Expected key=value but got '" + token + "'.");
            }
            args.put(token.substring(0, eq).trim().toLowerCase(), token.substring(eq + 1));
        }
        return new ToolRequest(name, args);
    }

    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean hasToken = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '\\' && inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                current.append('"');
                i++;
            } else if (ch == '"') {
                inQuotes = !inQuotes;
                hasToken = true;
            } else if (Character.isWhitespace(ch) && !inQuotes) {
                if (hasToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    hasToken = false;
                }
            } else {
                current.append(ch);
                hasToken = true;
            }
        }
        if (inQuotes) {
            throw CombatException.invalidArgument("Unbalanced quotes in: " + line);
        }
        if (hasToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
