package org.cfgconv.frontend.parser.features.expr;

import org.cfgconv.api.SyntaxErrorCode;
import org.cfgconv.api.SyntaxException;
import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.parser.ParsingContext;
import org.cfgconv.frontend.parser.features.literal.IntegerLiterals;
import org.cfgconv.frontend.value.IValueHandler;
import org.cfgconv.model.Value;

import java.util.Optional;

/**
 * Handler for bracket expressions of the form <code>[op arg1 arg2]</code>.
 * <p>
 * Each argument is a constant name or an integer literal. With a single argument the
 * expression evaluates to that argument and the operator is ignored. Parts after the
 * second argument are ignored. Division by zero yields 0.
 */
public class BracketExpressionHandler implements IValueHandler {

    @Override
    public Value parse(ParsingContext context) throws SyntaxException {
        Token token = context.advance();
        String text = token.text();
        String[] parts = text.substring(1, text.length() - 1).trim().split("\\s+");

        if (parts.length < 2) {
            throw context.error(SyntaxErrorCode.MALFORMED_EXPRESSION, "Malformed expression: " + text, token, "operator and operands");
        }
        Optional<ArithmeticOperator> operator = ArithmeticOperator.fromSymbol(parts[0]);
        if (operator.isEmpty()) {
            throw context.error(SyntaxErrorCode.UNKNOWN_OPERATOR, "Unknown operator: " + parts[0], token, "+, -, * or /");
        }

        Value first = resolveArgument(parts[1], token, context);
        if (parts.length == 2) {
            return first;
        }
        Value second = resolveArgument(parts[2], token, context);

        if (!(first instanceof Value.Int64 left) || !(second instanceof Value.Int64 right)) {
            throw context.error(SyntaxErrorCode.NON_NUMERIC_ARGUMENT, "Arguments must be numeric: " + text, token, "integer arguments");
        }
        if (operator.get() == ArithmeticOperator.DIVIDE && right.value() == 0) {
            context.getDiagnostics().reportWarning("Division by zero in " + text + ", using 0.",
                    token.fileName(), token.line(), token.column());
            return new Value.Int64(0);
        }
        try {
            return new Value.Int64(operator.get().apply(left.value(), right.value()));
        } catch (ArithmeticException e) {
            throw context.error(SyntaxErrorCode.ARITHMETIC_OVERFLOW, "Arithmetic overflow in " + text, token, "64-bit result");
        }
    }

    private Value resolveArgument(String argument, Token token, ParsingContext context) throws SyntaxException {
        Optional<Value> constant = context.getConstants().lookup(argument);
        if (constant.isPresent()) {
            return constant.get();
        }
        if (!IntegerLiterals.isIntegerLiteral(argument)) {
            throw context.error(SyntaxErrorCode.NON_NUMERIC_ARGUMENT, "Arguments must be numeric: " + argument, token, "integer or constant name");
        }
        try {
            return new Value.Int64(IntegerLiterals.parse(argument));
        } catch (NumberFormatException e) {
            throw context.error(SyntaxErrorCode.NUMBER_OUT_OF_RANGE, "Integer literal out of 64-bit range: " + argument, token, "64-bit integer");
        }
    }
}
