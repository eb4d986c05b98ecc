package org.cfgconv.frontend.parser.features.literal;

import java.util.regex.Pattern;

/**
 * Parsing of integer literal text into 64-bit values.
 * Accepts hexadecimal literals with a 0x/0X prefix and optionally signed decimal literals.
 */
public final class IntegerLiterals {

    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?[0-9]+");

    private IntegerLiterals() {}

    /**
     * Checks whether the text has the shape of an integer literal, regardless of its magnitude.
     * @param text The literal text.
     * @return true for hexadecimal or decimal literal text.
     */
    public static boolean isIntegerLiteral(String text) {
        return HEX.matcher(text).matches() || DECIMAL.matcher(text).matches();
    }

    /**
     * Parses integer literal text.
     * @param text The literal text, see {@link #isIntegerLiteral(String)}.
     * @return The value.
     * @throws NumberFormatException if the text is not a literal or does not fit into a long.
     */
    public static long parse(String text) {
        if (HEX.matcher(text).matches()) {
            return Long.parseLong(text.substring(2), 16);
        }
        if (DECIMAL.matcher(text).matches()) {
            return Long.parseLong(text);
        }
        throw new NumberFormatException("Not an integer literal: " + text);
    }
}
