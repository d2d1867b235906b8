package splc.lexer;

import java.util.*;

public class Lexer {

    private static final int MAX_STRING_LENGTH = 15;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("glob", TokenType.GLOB),
            Map.entry("proc", TokenType.PROC),
            Map.entry("func", TokenType.FUNC),
            Map.entry("main", TokenType.MAIN),
            Map.entry("var", TokenType.VAR),
            Map.entry("local", TokenType.LOCAL),
            Map.entry("halt", TokenType.HALT),
            Map.entry("print", TokenType.PRINT),
            Map.entry("while", TokenType.WHILE),
            Map.entry("do", TokenType.DO),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("eq", TokenType.EQ),
            Map.entry("or", TokenType.OR),
            Map.entry("and", TokenType.AND),
            Map.entry("plus", TokenType.PLUS),
            Map.entry("minus", TokenType.MINUS),
            Map.entry("mult", TokenType.MULT),
            Map.entry("div", TokenType.DIV),
            Map.entry("neg", TokenType.NEG),
            Map.entry("not", TokenType.NOT)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case '=' -> add(TokenType.ASSIGN, "=", startLine, startCol);
                case '>' -> add(TokenType.GT, ">", startLine, startCol);

                case '/' -> {
                    if (match('/')) skipComment();
                    else error("Unexpected '/'");
                }

                case '"' -> stringLiteral(startLine, startCol);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isLower(c)) name(c, startLine, startCol);
                    else error("Unexpected character: " + c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        // 0 is a number on its own: "01" lexes as 0 followed by 1
        if (first != '0') {
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        add(TokenType.NUMBER, sb.toString(), line, col);
    }

    private void name(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        // [a-z]+[0-9]*
        while (!isAtEnd() && isLower(peek())) {
            sb.append(advance());
        }
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.NAME);

        add(type, text, line, col);
    }

    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') error("Unterminated string");
            if (!isDigit(c) && !isLower(c) && !(c >= 'A' && c <= 'Z')) {
                error("Strings may only contain letters and digits, got: " + c);
            }
            sb.append(c);
        }

        if (isAtEnd()) error("Unterminated string");
        if (sb.length() > MAX_STRING_LENGTH) {
            error("String longer than " + MAX_STRING_LENGTH + " characters");
        }

        advance(); // closing "
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String message) {
        throw new LexerException("[" + line + ":" + col + "] " + message);
    }
}
