package org.cfgconv.frontend.parser.features.struct;

import org.cfgconv.api.SyntaxException;
import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.lexer.TokenType;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.model.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler for struct literals.
 * The syntax is <code>struct{ &lt;name&gt; = &lt;value&gt;, ... }</code>.
 * <p>
 * Tokens that cannot start a field are skipped and reported as warnings. A field name
 * that is not followed by '=' is an error. Repeated field names keep the last value.
 */
public class StructValueHandler implements IValueHandler {

    @Override
    public Value parse(ParsingContext context) throws SyntaxException {
        context.advance(); // consume struct{

        Map<String, Value> fields = new LinkedHashMap<>();
        while (!context.isAtEnd() && !context.check(TokenType.STRUCT_END)) {
            if (!context.check(TokenType.IDENTIFIER)) {
                Token skipped = context.advance();
                context.getDiagnostics().reportWarning("Skipped " + skipped.type() + " '" + skipped.text() + "' where a field name was expected.",
                        skipped.fileName(), skipped.line(), skipped.column());
                continue;
            }

            Token name = context.advance();
            context.consume(TokenType.ASSIGN, "Expected '=' after field name '" + name.text() + "'.");
            fields.put(name.text(), context.parseValue());
            context.match(TokenType.COMMA);
        }
        context.consume(TokenType.STRUCT_END, "Expected '}' to close the struct.");
        return new Value.Struct(fields);
    }
}
