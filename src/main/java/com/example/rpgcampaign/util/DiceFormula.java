package com.example.rpgcampaign.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validation and bounds for dice notation such as "1d6", "2d4+5", "d20" or a plain "20".
 */
public final class DiceFormula {

    private static final Pattern DICE = Pattern.compile("^(\\d+)?d(\\d+)([+-]\\d+)?$");
    private static final Pattern NUMBER = Pattern.compile("^\\d+$");

    private DiceFormula() { }

    public static boolean isValid(String formula) {
        if (formula == null) return false;
        String f = formula.trim().toLowerCase();
        if (NUMBER.matcher(f).matches()) return true;
        Matcher m = DICE.matcher(f);
        return m.matches() && Integer.parseInt(m.group(2)) > 0;
    }

    /**
     * Highest value the formula can produce, or -1 if the formula is not valid.
     */
    public static int maxValue(String formula) {
        if (!isValid(formula)) return -1;
        String f = formula.trim().toLowerCase();
        if (NUMBER.matcher(f).matches()) return Integer.parseInt(f);
        Matcher m = DICE.matcher(f);
        m.matches();
        int count = m.group(1) == null ? 1 : Integer.parseInt(m.group(1));
        int sides = Integer.parseInt(m.group(2));
        int modifier = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        return count * sides + modifier;
    }
}
