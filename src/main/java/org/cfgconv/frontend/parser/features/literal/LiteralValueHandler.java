package org.cfgconv.frontend.parser.features.literal;

import org.cfgconv.api.SyntaxErrorCode;
import org.cfgconv.api.SyntaxException;
import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.model.Value;

/**
 * Handler for scalar literals: decimal and hexadecimal integers, quoted strings and booleans.
 */
public class LiteralValueHandler implements IValueHandler {

    @Override
    public Value parse(ParsingContext context) throws SyntaxException {
        Token token = context.advance();
        return switch (token.type()) {
            case NUMBER, HEX_NUMBER -> integer(token, context);
            case STRING -> new Value.Text(unquote(token.text()));
            case TRUE -> new Value.Bool(true);
            case FALSE -> new Value.Bool(false);
            default -> throw context.error(SyntaxErrorCode.UNEXPECTED_VALUE, "Unexpected value: " + token.type(), token, "literal");
        };
    }

    private Value integer(Token token, ParsingContext context) throws SyntaxException {
        try {
            return new Value.Int64(IntegerLiterals.parse(token.text()));
        } catch (NumberFormatException e) {
            throw context.error(SyntaxErrorCode.NUMBER_OUT_OF_RANGE,
                    "Integer literal out of 64-bit range: " + token.text(), token, "64-bit integer");
        }
    }

    /**
     * Strips the surrounding quotes and unescapes escaped quotes. No other escape
     * sequences are processed, a backslash before any other character is kept as is.
     * @param text The string token text including its quotes.
     * @return The string content.
     */
    static String unquote(String text) {
        return text.substring(1, text.length() - 1)
                .replace("\\\"", "\"")
                .replace("\\'", "'");
    }
}
