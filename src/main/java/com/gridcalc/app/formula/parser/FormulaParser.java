package com.gridcalc.app.formula.parser;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.RangeResolver;
import com.gridcalc.app.formula.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for cell formulas.
 *
 * <pre>
 * comparison     := additive ( compareOp additive )*
 * additive       := multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative := unary ( ( "*" | "/" ) unary )*
 * unary          := ( "+" | "-" ) unary | primary
 * primary        := NUMBER | STRING | "(" comparison ")"
 *                 | IDENT "(" [ comparison ( "," comparison )* ] ")"
 *                 | IDENT ":" IDENT
 *                 | IDENT
 * </pre>
 *
 * Cell formulas only accept "==" as compareOp. Criteria expressions
 * (see {@link #parseCriteria(String)}) accept the full set
 * {@code == = != <> < <= > >=}.
 */
public final class FormulaParser {

    private final List<Token> tokens;
    private final boolean criteriaMode;
    private int current = 0;

    private FormulaParser(List<Token> tokens, boolean criteriaMode) {
        this.tokens = tokens;
        this.criteriaMode = criteriaMode;
    }

    /**
     * Parses a cell formula. A leading "=" is optional.
     *
     * @throws FormulaException PARSE_FAILURE on malformed input
     */
    public static Expr parse(String formula) {
        if (formula == null) {
            throw new FormulaException(FormulaErrorKind.PARSE_FAILURE, "Formula is null");
        }
        String body = formula.startsWith("=") ? formula.substring(1) : formula;
        return new FormulaParser(FormulaLexer.tokenize(body), false).parseAll();
    }

    /**
     * Parses an expression that may use every comparison operator.
     *
     * @throws FormulaException PARSE_FAILURE on malformed input
     */
    public static Expr parseCriteria(String expression) {
        return new FormulaParser(FormulaLexer.tokenize(expression), true).parseAll();
    }

    private Expr parseAll() {
        if (check(TokenType.EOF)) {
            throw error(peek(), "Empty formula");
        }
        Expr expr = comparison();
        if (!check(TokenType.EOF)) {
            throw error(peek(), "Unexpected token '" + peek().getText() + "'");
        }
        return expr;
    }

    private Expr comparison() {
        Expr expr = additive();
        while (isComparisonToken(peek().getType())) {
            Token token = advance();
            Operator operator = comparisonOperator(token);
            Expr right = additive();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr additive() {
        Expr expr = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator operator = advance().getType() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
            Expr right = multiplicative();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr multiplicative() {
        Expr expr = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Operator operator = advance().getType() == TokenType.STAR ? Operator.MULTIPLY : Operator.DIVIDE;
            Expr right = unary();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr unary() {
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator operator = advance().getType() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
            return new UnaryExpr(operator, unary());
        }
        return primary();
    }

    private Expr primary() {
        Token token = advance();
        switch (token.getType()) {
            case NUMBER:
                return new NumberLiteral(token.getText());
            case STRING:
                return new StringLiteral(token.getText());
            case LEFT_PAREN: {
                Expr inner = comparison();
                consume(TokenType.RIGHT_PAREN, "Expected ')'");
                return new GroupingExpr(inner);
            }
            case IDENTIFIER:
                return identifier(token);
            case EOF:
                throw error(token, "Unexpected end of formula");
            default:
                throw error(token, "Unexpected token '" + token.getText() + "'");
        }
    }

    private Expr identifier(Token name) {
        if (check(TokenType.LEFT_PAREN)) {
            advance();
            List<Expr> arguments = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(comparison());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments of " + name.getText());
            return new CallExpr(name.getText(), arguments);
        }
        if (match(TokenType.COLON)) {
            Token end = consume(TokenType.IDENTIFIER, "Expected cell after ':'");
            return new RangeExpr(name.getText(), end.getText());
        }
        if (RangeResolver.isRange(name.getText())) {
            return RangeResolver.parseRange(name.getText());
        }
        return new ReferenceExpr(name.getText());
    }

    private Operator comparisonOperator(Token token) {
        if (token.getType() == TokenType.EQUAL_EQUAL) {
            return Operator.EQUAL;
        }
        if (!criteriaMode) {
            throw error(token, "Comparison '" + token.getText() + "' is only allowed in criteria");
        }
        switch (token.getType()) {
            case EQUAL:
                return Operator.EQUAL;
            case BANG_EQUAL:
                return Operator.NOT_EQUAL;
            case LESS:
                return Operator.LESS;
            case LESS_EQUAL:
                return Operator.LESS_EQUAL;
            case GREATER:
                return Operator.GREATER;
            case GREATER_EQUAL:
                return Operator.GREATER_EQUAL;
            default:
                throw error(token, "Unexpected token '" + token.getText() + "'");
        }
    }

    private static boolean isComparisonToken(TokenType type) {
        switch (type) {
            case EQUAL:
            case EQUAL_EQUAL:
            case BANG_EQUAL:
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                return true;
            default:
                return false;
        }
    }

    // ------------------------
    // Token stream helpers
    // ------------------------

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private Token advance() {
        Token token = peek();
        if (token.getType() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private static FormulaException error(Token token, String message) {
        return new FormulaException(FormulaErrorKind.PARSE_FAILURE,
                message + " at position " + token.getPosition());
    }
}
