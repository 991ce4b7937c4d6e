package com.celldeps.analyzer.syntax;

import java.util.regex.Pattern;

/**
 * Python 3 numeric literal forms. Underscores may only separate digits.
 */
final class NumberLiterals {

    private static final String DIGITS = "[0-9](?:_?[0-9])*";
    private static final String EXPONENT = "[eE][+-]?" + DIGITS;
    private static final String POINT_FLOAT = "(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")";
    private static final String FLOAT = "(?:" + POINT_FLOAT + "(?:" + EXPONENT + ")?|" + DIGITS + EXPONENT + ")";

    private static final Pattern INTEGER = Pattern.compile(
        "0(?:_?0)*|[1-9](?:_?[0-9])*"
        + "|0[xX](?:_?[0-9a-fA-F])+"
        + "|0[oO](?:_?[0-7])+"
        + "|0[bB](?:_?[01])+");

    private static final Pattern FLOAT_LITERAL = Pattern.compile(FLOAT);

    private static final Pattern IMAGINARY = Pattern.compile("(?:" + FLOAT + "|" + DIGITS + ")[jJ]");

    private static final Pattern LEADING_ZEROS = Pattern.compile("0[0-9_]*[1-9][0-9_]*");

    private NumberLiterals() {}

    static boolean isInteger(String literal) {
        return INTEGER.matcher(literal).matches();
    }

    static boolean isFloat(String literal) {
        return FLOAT_LITERAL.matcher(literal).matches();
    }

    static boolean isImaginary(String literal) {
        return IMAGINARY.matcher(literal).matches();
    }

    /** CPython's message for a literal none of the forms accept. */
    static String errorFor(String literal) {
        if (LEADING_ZEROS.matcher(literal).matches()) {
            return "leading zeros in decimal integer literals are not permitted; use an 0o prefix for octal integers";
        }
        if (literal.length() > 1 && literal.charAt(0) == '0') {
            switch (Character.toLowerCase(literal.charAt(1))) {
                case 'x':
                    return "invalid hexadecimal literal";
                case 'o':
                    return "invalid octal literal";
                case 'b':
                    return "invalid binary literal";
                default:
                    break;
            }
        }
        return "invalid decimal literal";
    }
}
