package com.example.rpgcampaign.util;

import java.util.regex.Pattern;

/**
 * Converts display names into lower-case, URL-safe identifiers.
 * "Marcus the Bold!" becomes "marcus-the-bold".
 */
public final class Slugs {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private Slugs() { }

    public static String slugify(String text) {
        if (text == null) return "";
        String s = text.toLowerCase().trim();
        s = DISALLOWED.matcher(s).replaceAll("");
        s = SEPARATORS.matcher(s).replaceAll("-");
        return EDGE_DASHES.matcher(s).replaceAll("");
    }
}
