package org.carball.docsim.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits query text into tokens. Anything that is not whitespace, punctuation
 * or a quoted string becomes a WORD; keywords are recognised by the parser.
 */
public final class QueryLexer {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String PUNCTUATION = ".,=()*;'";

    private QueryLexer() {
        // Utility class - prevent instantiation
    }

    public static List<Token> tokenize(String query) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = query.length();

        while (i < length) {
            char c = query.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            switch (c) {
                case '.' -> tokens.add(new Token(TokenType.DOT, ".", i, ++i));
                case ',' -> tokens.add(new Token(TokenType.COMMA, ",", i, ++i));
                case '=' -> tokens.add(new Token(TokenType.EQUALS, "=", i, ++i));
                case '(' -> tokens.add(new Token(TokenType.LEFT_PAREN, "(", i, ++i));
                case ')' -> tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i, ++i));
                case '*' -> tokens.add(new Token(TokenType.STAR, "*", i, ++i));
                case ';' -> tokens.add(new Token(TokenType.SEMICOLON, ";", i, ++i));
                case '\'' -> {
                    int close = query.indexOf('\'', i + 1);
                    if (close < 0) {
                        throw new QueryParseException("Unterminated string literal at position " + i + ": " + query);
                    }
                    tokens.add(new Token(TokenType.STRING, query.substring(i + 1, close), i, close + 1));
                    i = close + 1;
                }
                default -> {
                    int start = i;
                    while (i < length && !Character.isWhitespace(query.charAt(i))
                            && PUNCTUATION.indexOf(query.charAt(i)) < 0) {
                        i++;
                    }
                    tokens.add(new Token(TokenType.WORD, query.substring(start, i), start, i));
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", length, length));
        return tokens;
    }
}
