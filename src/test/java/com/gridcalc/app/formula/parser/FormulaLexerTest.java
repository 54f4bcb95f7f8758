package com.gridcalc.app.formula.parser;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FormulaLexerTest {

    private static List<TokenType> types(String source) {
        return FormulaLexer.tokenize(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    void testArithmetic() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.NUMBER, TokenType.STAR,
                TokenType.LEFT_PAREN, TokenType.NUMBER, TokenType.MINUS, TokenType.IDENTIFIER,
                TokenType.RIGHT_PAREN, TokenType.SLASH, TokenType.NUMBER, TokenType.EOF),
                types("A1 + 2 * (3.5 - B2) / 4"));
    }

    @Test
    void testRangeAndCall() {
        List<Token> tokens = FormulaLexer.tokenize("COUNTIF(A1:B2, \">10\")");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.COLON,
                TokenType.IDENTIFIER, TokenType.COMMA, TokenType.STRING, TokenType.RIGHT_PAREN, TokenType.EOF),
                tokens.stream().map(Token::getType).collect(Collectors.toList()));
        assertEquals(">10", tokens.get(6).getText());
    }

    @Test
    void testComparisonOperators() {
        assertEquals(List.of(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL,
                TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.GREATER, TokenType.EQUAL, TokenType.EOF),
                types("== != <> <= >= < > ="));
    }

    @Test
    void testNumberForms() {
        List<Token> tokens = FormulaLexer.tokenize("12 3.25 .5");
        assertEquals("12", tokens.get(0).getText());
        assertEquals("3.25", tokens.get(1).getText());
        assertEquals(".5", tokens.get(2).getText());
    }

    @Test
    void testErrors() {
        FormulaException unterminated = assertThrows(FormulaException.class, () -> FormulaLexer.tokenize("\"abc"));
        assertEquals(FormulaErrorKind.PARSE_FAILURE, unterminated.getKind());

        assertThrows(FormulaException.class, () -> FormulaLexer.tokenize("A1 $ 2"));
        assertThrows(FormulaException.class, () -> FormulaLexer.tokenize("!A1"));
        assertThrows(FormulaException.class, () -> FormulaLexer.tokenize("12AB"));
    }
}
