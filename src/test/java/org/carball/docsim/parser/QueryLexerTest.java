package org.carball.docsim.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryLexerTest {

    @Test
    void shouldSplitPunctuationAndWords() {
        // When
        List<Token> tokens = QueryLexer.tokenize("SELECT ol.quantity, p.price FROM OrderLine ol;");

        // Then
        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList())).containsExactly(
                TokenType.WORD, TokenType.WORD, TokenType.DOT, TokenType.WORD, TokenType.COMMA,
                TokenType.WORD, TokenType.DOT, TokenType.WORD, TokenType.WORD, TokenType.WORD,
                TokenType.WORD, TokenType.SEMICOLON, TokenType.EOF);
        assertThat(tokens.get(0).isKeyword("select")).isTrue();
    }

    @Test
    void shouldKeepQuotedStringsVerbatim() {
        // When
        List<Token> tokens = QueryLexer.tokenize("brand = 'apple, inc.'");

        // Then
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).text()).isEqualTo("apple, inc.");
        assertThat(tokens.get(2).start()).isEqualTo(8);
        assertThat(tokens.get(2).end()).isEqualTo(21);
    }

    @Test
    void shouldTreatNumbersAsNonIdentifierWords() {
        // When
        List<Token> tokens = QueryLexer.tokenize("IDC = 125");

        // Then
        assertThat(tokens.get(0).isIdentifier()).isTrue();
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.WORD);
        assertThat(tokens.get(2).isIdentifier()).isFalse();
    }

    @Test
    void shouldRejectUnterminatedString() {
        // When/Then
        assertThatThrownBy(() -> QueryLexer.tokenize("WHERE brand = 'apple"))
                .isInstanceOf(QueryParseException.class)
                .hasMessageContaining("Unterminated string literal");
    }
}
