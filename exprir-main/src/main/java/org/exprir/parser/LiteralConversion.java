package org.exprir.parser;

/**
 * How the text of a numeric literal becomes the value of a
 * {@link org.exprir.ast.NumberLiteral}.
 */
public enum LiteralConversion {

    /**
     * Full decimal value: {@code 1.5} stays 1.5.
     */
    EXACT {
        @Override
        double convert(String text) {
            double value = Double.parseDouble(text);
            if (Double.isInfinite(value)) {
                throw new NumberFormatException("numeric literal out of range: " + text);
            }
            return value;
        }
    },

    /**
     * Integer part only, within the 32-bit signed range, widened to double:
     * {@code 1.5} becomes 1.0. Kept for output compatibility with older IR listings.
     */
    TRUNCATE_TO_INT {
        @Override
        double convert(String text) {
            int dot = text.indexOf('.');
            String integral = dot < 0 ? text : text.substring(0, dot);
            try {
                return Integer.parseInt(integral);
            } catch (NumberFormatException e) {
                throw new NumberFormatException("numeric literal out of range: " + text);
            }
        }
    };

    /**
     * @throws NumberFormatException if the text is not a literal this mode can represent
     */
    abstract double convert(String text);
}
