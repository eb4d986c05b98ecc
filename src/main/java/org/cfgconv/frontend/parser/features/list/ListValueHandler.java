package org.cfgconv.frontend.parser.features.list;

import org.cfgconv.api.SyntaxException;
import org.cfgconv.frontend.lexer.TokenType;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for list literals.
 * The syntax is <code>(list &lt;value&gt;, &lt;value&gt;, ...)</code>; separating commas
 * are optional and a trailing comma before the closing parenthesis is accepted.
 */
public class ListValueHandler implements IValueHandler {

    @Override
    public Value parse(ParsingContext context) throws SyntaxException {
        context.advance(); // consume (list

        List<Value> elements = new ArrayList<>();
        while (!context.check(TokenType.RPAREN) && !context.isAtEnd()) {
            elements.add(context.parseValue());
            context.match(TokenType.COMMA);
        }
        context.consume(TokenType.RPAREN, "Expected ')' to close the list.");
        return new Value.ListVal(elements);
    }
}
