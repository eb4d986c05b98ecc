package org.cfgconv.frontend.value;

import org.cfgconv.api.SyntaxException;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.model.Value;

/**
 * The base interface for all value handlers.
 * Each handler is responsible for the value forms introduced by specific token types
 * (e.g. a list literal introduced by "(list").
 */
public interface IValueHandler {

    /**
     * Parses one value. The current token of the context is the token the handler was
     * registered for; the handler consumes it together with everything belonging to the value.
     *
     * @param context The context that provides access to the token stream and the
     *                state of the current parse session.
     * @return The fully resolved value.
     * @throws SyntaxException if the tokens do not form a valid value.
     */
    Value parse(ParsingContext context) throws SyntaxException;
}
