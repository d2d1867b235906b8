package splc.lexer;

public enum TokenType {

    // literals
    NAME,
    NUMBER,
    STRING_LITERAL,

    // section keywords
    GLOB,
    PROC,
    FUNC,
    MAIN,
    VAR,
    LOCAL,

    // instructions
    HALT,
    PRINT,
    WHILE,
    DO,
    UNTIL,
    IF,
    ELSE,
    RETURN,

    // operators (word form, except '>')
    EQ, GT,
    OR, AND,
    PLUS, MINUS, MULT, DIV,
    NEG, NOT,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    SEMICOLON, ASSIGN,

    EOF
}
