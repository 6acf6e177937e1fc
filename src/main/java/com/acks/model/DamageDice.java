package com.acks.model;

import com.acks.exception.ValidationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A damage roll in dice notation, e.g. {@code 1d8+1}.
 *
 * @param count    number of dice
 * @param sides    sides per die
 * @param modifier flat modifier added to the dice total
 */
public record DamageDice(int count, int sides, int modifier) {

    private static final Pattern NOTATION = Pattern.compile("^(\\d+)d(\\d+)([+-]\\d+)?$");

    public static final DamageDice UNARMED = new DamageDice(1, 2, 0);

    public DamageDice {
        if (count < 1 || sides < 1) {
            throw new ValidationException("Dice must have at least one die of at least one side");
        }
    }

    public static DamageDice parse(String notation) {
        if (notation == null || notation.isBlank()) {
            return UNARMED;
        }
        Matcher m = NOTATION.matcher(notation.trim().toLowerCase());
        if (!m.matches()) {
            throw new ValidationException("Invalid dice notation: " + notation);
        }
        int modifier = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        return new DamageDice(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), modifier);
    }

    /** Lowest raw dice total, before the modifier. */
    public int minRoll() {
        return count;
    }

    /** Highest raw dice total, before the modifier. */
    public int maxRoll() {
        return count * sides;
    }

    public boolean accepts(int rawRoll) {
        return rawRoll >= minRoll() && rawRoll <= maxRoll();
    }

    public String toNotation() {
        if (modifier == 0) {
            return count + "d" + sides;
        }
        return count + "d" + sides + (modifier > 0 ? "+" : "") + modifier;
    }
}
