package splc.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    @Test
    void lex_all_symbols() {
        assertEquals(List.of(
                TokenType.LPAREN, TokenType.RPAREN,
                TokenType.LBRACE, TokenType.RBRACE,
                TokenType.SEMICOLON, TokenType.ASSIGN, TokenType.GT
        ), typesNoEof("(){};=>"));
    }

    @Test
    void lex_section_and_statement_keywords() {
        var ts = typesNoEof("glob proc func main var local halt print while do until if else return");
        assertEquals(List.of(
                TokenType.GLOB, TokenType.PROC, TokenType.FUNC, TokenType.MAIN, TokenType.VAR,
                TokenType.LOCAL, TokenType.HALT, TokenType.PRINT, TokenType.WHILE, TokenType.DO,
                TokenType.UNTIL, TokenType.IF, TokenType.ELSE, TokenType.RETURN
        ), ts);
    }

    @Test
    void lex_word_operators() {
        assertEquals(List.of(
                TokenType.EQ, TokenType.OR, TokenType.AND, TokenType.PLUS, TokenType.MINUS,
                TokenType.MULT, TokenType.DIV, TokenType.NEG, TokenType.NOT
        ), typesNoEof("eq or and plus minus mult div neg not"));
    }

    @Test
    void lex_name_vs_keyword() {
        // "do" is a keyword, "double" and "do1" are names
        assertEquals(List.of(TokenType.DO, TokenType.NAME, TokenType.NAME), typesNoEof("do double do1"));
    }

    @Test
    void lex_name_digits_only_at_the_end() {
        var toks = lex("abc12x");
        assertEquals("abc12", toks.get(0).lexeme());
        assertEquals(TokenType.NAME, toks.get(1).type());
        assertEquals("x", toks.get(1).lexeme());
    }

    @Test
    void lex_numbers_leading_zero_is_its_own_token() {
        var toks = lex("0 42 012");
        assertEquals(List.of("0", "42", "0", "12"),
                toks.stream().filter(t -> t.type() == TokenType.NUMBER).map(Token::lexeme).toList());
    }

    @Test
    void lex_string_literal() {
        var toks = lex("\"Hello42\"");
        assertEquals(TokenType.STRING_LITERAL, toks.get(0).type());
        assertEquals("Hello42", toks.get(0).lexeme());
    }

    @Test
    void lex_string_of_fifteen_characters_is_accepted() {
        assertEquals("abcdefghijklmno", lex("\"abcdefghijklmno\"").get(0).lexeme());
    }

    @Test
    void lex_comment_skipped() {
        assertEquals(List.of(TokenType.NAME, TokenType.NAME), typesNoEof("x // note\ny"));
    }

    @Test
    void lex_whitespace_and_positions() {
        var toks = lex("a\n  b");
        assertEquals("NAME('a')@1:1", toks.get(0).toString());
        assertEquals("NAME('b')@2:3", toks.get(1).toString());
    }

    @Test
    void lex_ends_with_eof() {
        var toks = lex("halt");
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type());
    }

    @ParameterizedTest
    @ValueSource(strings = {"@", "X", "+", "/x", "\"abc", "\"ab\ncd\"", "\"a b\"", "\"abcdefghijklmnop\""})
    void lex_errors(String input) {
        assertThrows(LexerException.class, () -> lex(input));
    }

    @Test
    void lex_error_carries_position() {
        var e = assertThrows(LexerException.class, () -> lex("x\n  @"));
        assertTrue(e.getMessage().startsWith("[2:"), e.getMessage());
    }
}
