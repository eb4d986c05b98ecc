package org.cfgconv.frontend.value;

import org.cfgconv.frontend.lexer.TokenType;
import org.cfgconv.frontend.parser.features.chr.ChrValueHandler;
import org.cfgconv.frontend.parser.features.constant.ConstantReferenceHandler;
import org.cfgconv.frontend.parser.features.expr.BracketExpressionHandler;
import org.cfgconv.frontend.parser.features.list.ListValueHandler;
import org.cfgconv.frontend.parser.features.literal.LiteralValueHandler;
import org.cfgconv.frontend.parser.features.struct.StructValueHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for value handlers. This class holds a map of the token types that can
 * start a value to their corresponding handlers.
 */
public class ValueHandlerRegistry {
    private final Map<TokenType, IValueHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new value handler.
     * @param type The token type that starts the value.
     * @param handler The handler for the value.
     */
    public void register(TokenType type, IValueHandler handler) {
        handlers.put(type, handler);
    }

    /**
     * Gets the handler for a given token type.
     * @param type The type of the current token.
     * @return An {@link Optional} containing the handler if the token can start a value, otherwise empty.
     */
    public Optional<IValueHandler> get(TokenType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link ValueHandlerRegistry} with all handlers registered.
     */
    public static ValueHandlerRegistry initialize() {
        ValueHandlerRegistry registry = new ValueHandlerRegistry();
        LiteralValueHandler literalHandler = new LiteralValueHandler();
        registry.register(TokenType.NUMBER, literalHandler);
        registry.register(TokenType.HEX_NUMBER, literalHandler);
        registry.register(TokenType.STRING, literalHandler);
        registry.register(TokenType.TRUE, literalHandler);
        registry.register(TokenType.FALSE, literalHandler);
        registry.register(TokenType.IDENTIFIER, new ConstantReferenceHandler());
        registry.register(TokenType.LIST_START, new ListValueHandler());
        registry.register(TokenType.STRUCT_START, new StructValueHandler());
        registry.register(TokenType.CHR_START, new ChrValueHandler());
        registry.register(TokenType.EXPRESSION, new BracketExpressionHandler());
        return registry;
    }
}
