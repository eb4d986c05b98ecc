package org.cfgconv.frontend.parser;

import org.cfgconv.api.SourceInfo;
import org.cfgconv.api.SyntaxErrorCode;
import org.cfgconv.api.SyntaxException;
import org.cfgconv.diagnostics.DiagnosticsEngine;
import org.cfgconv.frontend.lexer.Lexer;
import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.lexer.TokenType;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.frontend.value.ValueHandlerRegistry;
import org.cfgconv.model.Document;
import org.cfgconv.model.Value;

/**
 * The recursive-descent parser for the configuration language. It pulls tokens one at a
 * time from the {@link Lexer} and produces a {@link Document}. Values are built by the
 * handlers of a {@link ValueHandlerRegistry}, which call back into this parser through
 * {@link ParsingContext} for nested values.
 * <p>
 * A parser instance serves exactly one parse session.
 */
public class Parser implements ParsingContext {

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final ConstantTable constants;
    private final ValueHandlerRegistry valueHandlers;
    private Token current;

    /**
     * Constructs a new Parser with an empty constant table.
     * @param lexer The lexer providing the token stream.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this(lexer, diagnostics, new ConstantTable());
    }

    /**
     * Constructs a new Parser.
     * @param lexer The lexer providing the token stream.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param constants The constant table of this parse session.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics, ConstantTable constants) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.constants = constants;
        this.valueHandlers = ValueHandlerRegistry.initialize();
        this.current = lexer.nextToken();
    }

    /**
     * Parses the entire token stream.
     * @return The document with all top-level entries.
     * @throws SyntaxException on the first structural error; no partial document is returned.
     */
    public Document parse() throws SyntaxException {
        Document document = new Document();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            if (check(TokenType.IDENTIFIER)) {
                statement(document);
            } else {
                document.put(Document.BARE_VALUE_KEY, parseValue());
            }
        }
        return document;
    }

    private void statement(Document document) throws SyntaxException {
        String name = advance().text();

        if (match(TokenType.DEFINE)) {
            Value value = parseValue();
            constants.define(name, value);
            match(TokenType.SEMICOLON);
            document.put(name, value);
        } else if (match(TokenType.ASSIGN)) {
            Value value = parseValue();
            match(TokenType.SEMICOLON);
            document.put(name, value);
        } else if (check(TokenType.STRUCT_START)) {
            document.put(name, parseValue());
        } else {
            // A bare name stands for itself.
            document.put(name, new Value.Identifier(name));
        }
    }

    @Override
    public Value parseValue() throws SyntaxException {
        Token token = peek();
        IValueHandler handler = valueHandlers.get(token.type())
                .orElseThrow(() -> error(SyntaxErrorCode.UNEXPECTED_VALUE, "Unexpected value: " + token.type(), token, "value"));
        return handler.parse(this);
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return current.type() == type;
    }

    @Override
    public Token advance() {
        Token consumed = current;
        if (!isAtEnd()) {
            current = lexer.nextToken();
        }
        return consumed;
    }

    @Override
    public boolean isAtEnd() {
        return current.type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return current;
    }

    @Override
    public Token consume(TokenType type, String errorMessage) throws SyntaxException {
        if (check(type)) return advance();
        throw error(SyntaxErrorCode.UNEXPECTED_TOKEN, errorMessage, peek(), type.name());
    }

    @Override
    public SyntaxException error(SyntaxErrorCode code, String message, Token at, String expected) {
        diagnostics.reportError(message, at.fileName(), at.line(), at.column());
        return new SyntaxException(code, message, new SourceInfo(at.fileName(), at.line(), at.column()), expected, at.type().name());
    }

    @Override
    public ConstantTable getConstants() {
        return constants;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
