package com.erdforge.core.dsl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Lexer}.
 */
class LexerTest {

    private static List<TokenType> types(String input) {
        return new Lexer(input).tokenize().stream().map(Token::type).toList();
    }

    @Test
    void tokenize_emptyInput_returnsOnlyEof() {
        List<Token> tokens = new Lexer("").tokenize();

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.EOF);
        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(0).column()).isEqualTo(1);
    }

    @Test
    void tokenize_entityHeader_recognisesKeywordIdentifierAndColon() {
        assertThat(types("Entity Store:"))
            .containsExactly(TokenType.ENTITY, TokenType.IDENTIFIER, TokenType.COLON, TokenType.EOF);
    }

    @Test
    void tokenize_keywordsAreCaseSensitive() {
        assertThat(types("entity Total m pk"))
            .containsExactly(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void tokenize_numbers_onlyOneIsCardinality() {
        assertThat(types("1 12 0 M"))
            .containsExactly(TokenType.ONE, TokenType.NUMBER, TokenType.NUMBER, TokenType.MANY, TokenType.EOF);
    }

    @Test
    void tokenize_dashForms_areEquivalent() {
        assertThat(types("(1) — (M)")).containsExactly(
            TokenType.LPAREN, TokenType.ONE, TokenType.RPAREN, TokenType.DASH,
            TokenType.LPAREN, TokenType.MANY, TokenType.RPAREN, TokenType.EOF);
        assertThat(types("(1) -- (M)")).isEqualTo(types("(1) — (M)"));
    }

    @Test
    void tokenize_arrowAndLoneDash() {
        assertThat(types("a FK -> B.b")).containsExactly(
            TokenType.IDENTIFIER, TokenType.FK, TokenType.ARROW,
            TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(types("a - b")).containsExactly(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void tokenize_commentsAndUnknownCharactersAreSkipped() {
        assertThat(types("# heading\nEntity A: @ $ % # trailing comment\n"))
            .containsExactly(TokenType.ENTITY, TokenType.IDENTIFIER, TokenType.COLON, TokenType.EOF);
    }

    @Test
    void tokenize_tracksLineAndColumn() {
        List<Token> tokens = new Lexer("Entity A:\n  id PK").tokenize();

        Token id = tokens.get(3);
        assertThat(id.text()).isEqualTo("id");
        assertThat(id.line()).isEqualTo(2);
        assertThat(id.column()).isEqualTo(3);

        Token pk = tokens.get(4);
        assertThat(pk.type()).isEqualTo(TokenType.PK);
        assertThat(pk.column()).isEqualTo(6);
    }

    @Test
    void tokenize_identifiersMayContainDigitsAndUnderscores() {
        List<Token> tokens = new Lexer("_order_2 x9").tokenize();

        assertThat(tokens.get(0).text()).isEqualTo("_order_2");
        assertThat(tokens.get(1).text()).isEqualTo("x9");
    }

    @Test
    void constructor_withNullInput_throwsException() {
        assertThatThrownBy(() -> new Lexer(null)).isInstanceOf(NullPointerException.class);
    }
}
