package org.cfgconv.frontend.parser.features.chr;

import org.cfgconv.api.SyntaxException;
import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.lexer.TokenType;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.model.Value;

/**
 * Handler for character conversions.
 * The syntax is <code>chr(&lt;value&gt;)</code>. An integer argument becomes the one-character
 * text with that code point; any other argument yields the placeholder text "?".
 */
public class ChrValueHandler implements IValueHandler {

    static final String PLACEHOLDER = "?";

    @Override
    public Value parse(ParsingContext context) throws SyntaxException {
        Token start = context.advance(); // consume chr(
        Value argument = context.parseValue();
        context.consume(TokenType.RPAREN, "Expected ')' after the chr argument.");

        if (argument instanceof Value.Int64 codePoint
                && codePoint.value() >= 0 && codePoint.value() <= Character.MAX_CODE_POINT) {
            return new Value.Text(new String(Character.toChars((int) codePoint.value())));
        }
        context.getDiagnostics().reportWarning("chr argument is not a code point, using '" + PLACEHOLDER + "'.",
                start.fileName(), start.line(), start.column());
        return new Value.Text(PLACEHOLDER);
    }
}
