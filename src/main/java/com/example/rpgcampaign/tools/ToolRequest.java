package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation: the tool name and its named string arguments.
 */
public class ToolRequest {

    private final String name;
    private final Map<String, String> args;

    public ToolRequest(String name, Map<String, String> args) {
        this.name = name == null ? "" : name.trim().toLowerCase();
        this.args = args == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static ToolRequest of(String name, String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Arguments must come in key/value pairs");
        }
        Map<String, String> args = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            args.put(keyValues[i], keyValues[i + 1]);
        }
        return new ToolRequest(name, args);
    }

    public String getName() { return name; }

    public Map<String, String> getArgs() { return args; }

    public boolean has(String key) {
        String value = args.get(key);
        return value != null && !value.isBlank();
    }

    /**
     * Optional argument, trimmed; null when absent or blank.
     */
    public String get(String key) {
        return has(key) ? args.get(key).trim() : null;
    }

    public String getOrDefault(String key, String fallback) {
        return has(key) ? args.get(key).trim() : fallback;
    }

    /**
     * @throws CombatException INVALID_ARGUMENT when the argument is absent or blank
     */
    public String require(String key) {
        if (!has(key)) {
            throw CombatException.invalidArgument("Missing required argument '" + key + "' for " + name + ".");
        }
        return args.get(key).trim();
    }

    /**
     * Optional numeric argument.
     * @throws CombatException INVALID_ARGUMENT when present but not a number
     */
    public Double getDouble(String key) {
        String value = get(key);
        if (value == null) return null;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw CombatException.invalidArgument("Argument '" + key + "' must be a number, got '" + value + "'.");
        }
    }

    /**
     * Optional yes/no argument: true/false, yes/no or 1/0.
     * @throws CombatException INVALID_ARGUMENT for anything else
     */
    public Boolean getBoolean(String key) {
        String value = get(key);
        if (value == null) return null;
        switch (value.toLowerCase()) {
            case "true":
            case "yes":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "0":
                return Boolean.FALSE;
            default:
                throw CombatException.invalidArgument("Argument '" + key + "' must be true or false, got '" + value + "'.");
        }
    }

    /**
     * Required whole-number argument.
     * @throws CombatException INVALID_ARGUMENT when absent or not an integer
     */
    public long requireLong(String key) {
        String value = require(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw CombatException.invalidArgument("Argument '" + key + "' must be a whole number, got '" + value + "'.");
        }
    }

    @Override
    public String toString() {
        return name + " " + args;
    }
}
