package com.gridcalc.app.formula.parser;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula body (without the leading "=") into tokens.
 * Whitespace separates tokens and is otherwise ignored.
 */
public final class FormulaLexer {

    private FormulaLexer() {
    }

    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = source.length();

        while (i < length) {
            char c = source.charAt(i);
            int start = i;

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (isIdentifierStart(c)) {
                while (i < length && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, i), start));
                continue;
            }

            if (isDigit(c) || (c == '.' && i + 1 < length && isDigit(source.charAt(i + 1)))) {
                while (i < length && isDigit(source.charAt(i))) {
                    i++;
                }
                if (i < length && source.charAt(i) == '.') {
                    i++;
                    while (i < length && isDigit(source.charAt(i))) {
                        i++;
                    }
                }
                if (i < length && isIdentifierStart(source.charAt(i))) {
                    throw parseFailure("Malformed number '" + source.substring(start, i + 1) + "'", start);
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
                continue;
            }

            if (c == '"') {
                int close = source.indexOf('"', i + 1);
                if (close < 0) {
                    throw parseFailure("Unterminated string literal", start);
                }
                tokens.add(new Token(TokenType.STRING, source.substring(i + 1, close), start));
                i = close + 1;
                continue;
            }

            char next = i + 1 < length ? source.charAt(i + 1) : '\0';
            switch (c) {
                case '+':
                    tokens.add(new Token(TokenType.PLUS, "+", start));
                    break;
                case '-':
                    tokens.add(new Token(TokenType.MINUS, "-", start));
                    break;
                case '*':
                    tokens.add(new Token(TokenType.STAR, "*", start));
                    break;
                case '/':
                    tokens.add(new Token(TokenType.SLASH, "/", start));
                    break;
                case '(':
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", start));
                    break;
                case ')':
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", start));
                    break;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ",", start));
                    break;
                case ':':
                    tokens.add(new Token(TokenType.COLON, ":", start));
                    break;
                case '=':
                    if (next == '=') {
                        tokens.add(new Token(TokenType.EQUAL_EQUAL, "==", start));
                        i++;
                    } else {
                        tokens.add(new Token(TokenType.EQUAL, "=", start));
                    }
                    break;
                case '!':
                    if (next != '=') {
                        throw parseFailure("Unexpected character '!'", start);
                    }
                    tokens.add(new Token(TokenType.BANG_EQUAL, "!=", start));
                    i++;
                    break;
                case '<':
                    if (next == '=') {
                        tokens.add(new Token(TokenType.LESS_EQUAL, "<=", start));
                        i++;
                    } else if (next == '>') {
                        tokens.add(new Token(TokenType.BANG_EQUAL, "<>", start));
                        i++;
                    } else {
                        tokens.add(new Token(TokenType.LESS, "<", start));
                    }
                    break;
                case '>':
                    if (next == '=') {
                        tokens.add(new Token(TokenType.GREATER_EQUAL, ">=", start));
                        i++;
                    } else {
                        tokens.add(new Token(TokenType.GREATER, ">", start));
                    }
                    break;
                default:
                    throw parseFailure("Unexpected character '" + c + "'", start);
            }
            i++;
        }

        tokens.add(new Token(TokenType.EOF, "", length));
        return tokens;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static FormulaException parseFailure(String message, int position) {
        return new FormulaException(FormulaErrorKind.PARSE_FAILURE, message + " at position " + position);
    }
}
