package org.cfgconv.frontend.parser.features.constant;

import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.model.Value;

/**
 * Handler for a name in value position. A defined constant is replaced by its bound value;
 * an undefined name becomes an {@link Value.Identifier} holding the name itself.
 */
public class ConstantReferenceHandler implements IValueHandler {

    @Override
    public Value parse(ParsingContext context) {
        Token name = context.advance();
        return context.getConstants().lookup(name.text())
                .orElseGet(() -> new Value.Identifier(name.text()));
    }
}
