package org.carball.docsim.parser;

/**
 * A lexical token. {@code start} and {@code end} are offsets into the query
 * text so a literal spanning several tokens can be recovered verbatim.
 */
public record Token(TokenType type, String text, int start, int end) {

    public boolean isKeyword(String keyword) {
        return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isIdentifier() {
        return type == TokenType.WORD && QueryLexer.IDENTIFIER.matcher(text).matches();
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of query" : "'" + text + "'";
    }
}
