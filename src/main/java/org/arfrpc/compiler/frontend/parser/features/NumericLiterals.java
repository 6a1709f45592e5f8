package org.arfrpc.compiler.frontend.parser.features;

import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

/**
 * Reads the integer literals used for field indices and enum option values.
 */
public final class NumericLiterals {

    private NumericLiterals() {
        // Utility class
    }

    /**
     * Consumes a number literal that must fit a 32-bit signed integer.
     *
     * @param context The parsing context.
     * @param what    What the number denotes, for messages (e.g. "field index").
     * @return The value, or {@code null} after reporting an error. A literal the lexer
     *         already rejected yields {@code null} without a second report.
     */
    public static Integer int32(ParsingContext context, String what) {
        Token number = context.consume(TokenType.NUMBER,
                "Expected a numeric " + what + " but found '" + context.peek().text() + "'");
        if (number == null || number.value() == null) {
            return null;
        }
        long value = (Long) number.value();
        if (value > Integer.MAX_VALUE) {
            context.error(number, "The " + what + " " + number.text() + " does not fit in a 32-bit signed integer");
            return null;
        }
        return (int) value;
    }
}
