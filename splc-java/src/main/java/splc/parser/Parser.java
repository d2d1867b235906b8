package splc.parser;

import splc.ast.Program;
import splc.ast.decl.CallableDecl;
import splc.ast.decl.MainDecl;
import splc.ast.expr.*;
import splc.ast.stmt.AssignStmt;
import splc.ast.stmt.BlockStmt;
import splc.ast.stmt.CallStmt;
import splc.ast.stmt.DoUntilStmt;
import splc.ast.stmt.HaltStmt;
import splc.ast.stmt.IfStmt;
import splc.ast.stmt.PrintStmt;
import splc.ast.stmt.Stmt;
import splc.ast.stmt.WhileStmt;
import splc.lexer.Token;
import splc.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

public final class Parser {
    private static final int MAX_THREE = 3;

    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        consume(TokenType.GLOB, "Expected 'glob' section");
        consume(TokenType.LBRACE, "Expected '{' after 'glob'");
        List<String> globals = parseVariables();
        consume(TokenType.RBRACE, "Expected '}' after global variables");

        consume(TokenType.PROC, "Expected 'proc' section");
        consume(TokenType.LBRACE, "Expected '{' after 'proc'");
        List<CallableDecl> procedures = new ArrayList<>();
        while (check(TokenType.NAME)) procedures.add(parseProcedure());
        consume(TokenType.RBRACE, "Expected '}' after procedure definitions");

        consume(TokenType.FUNC, "Expected 'func' section");
        consume(TokenType.LBRACE, "Expected '{' after 'func'");
        List<CallableDecl> functions = new ArrayList<>();
        while (check(TokenType.NAME)) functions.add(parseFunction());
        consume(TokenType.RBRACE, "Expected '}' after function definitions");

        consume(TokenType.MAIN, "Expected 'main' section");
        consume(TokenType.LBRACE, "Expected '{' after 'main'");
        MainDecl main = parseMain();
        consume(TokenType.RBRACE, "Expected '}' after main program");

        consume(TokenType.EOF, "Expected EOF");
        return new Program(globals, procedures, functions, main);
    }

    // ---------- declarations ----------
    private List<String> parseVariables() {
        List<String> names = new ArrayList<>();
        while (check(TokenType.NAME)) names.add(advance().lexeme());
        return names;
    }

    private List<String> parseMaxThree(String what) {
        List<String> names = new ArrayList<>();
        while (check(TokenType.NAME)) {
            if (names.size() == MAX_THREE) throw error(peek(), "At most three " + what + " allowed");
            names.add(advance().lexeme());
        }
        return names;
    }

    private CallableDecl parseProcedure() {
        Token name = consume(TokenType.NAME, "Expected procedure name");
        List<String> params = parseParams();

        consume(TokenType.LBRACE, "Expected '{' before procedure body");
        List<String> locals = parseLocals();
        BlockStmt body = check(TokenType.RBRACE) ? BlockStmt.empty() : parseAlgo();
        consume(TokenType.RBRACE, "Expected '}' after procedure body");

        return new CallableDecl(name.lexeme(), CallableDecl.Kind.PROCEDURE, params, locals, body, null);
    }

    private CallableDecl parseFunction() {
        Token name = consume(TokenType.NAME, "Expected function name");
        List<String> params = parseParams();

        consume(TokenType.LBRACE, "Expected '{' before function body");
        List<String> locals = parseLocals();
        match(TokenType.SEMICOLON);

        BlockStmt body = BlockStmt.empty();
        if (!check(TokenType.RETURN)) {
            body = parseAlgo();
            if (previous().type() != TokenType.SEMICOLON) {
                throw error(peek(), "Expected ';' before 'return'");
            }
        }
        consume(TokenType.RETURN, "Expected 'return' at the end of function body");
        Expr returnValue = parseTerm();
        consume(TokenType.RBRACE, "Expected '}' after function body");

        return new CallableDecl(name.lexeme(), CallableDecl.Kind.FUNCTION, params, locals, body, returnValue);
    }

    private List<String> parseParams() {
        consume(TokenType.LPAREN, "Expected '(' before parameters");
        List<String> params = parseMaxThree("parameters");
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        return params;
    }

    private List<String> parseLocals() {
        consume(TokenType.LOCAL, "Expected 'local' declarations");
        consume(TokenType.LBRACE, "Expected '{' after 'local'");
        List<String> locals = parseMaxThree("local variables");
        consume(TokenType.RBRACE, "Expected '}' after local variables");
        return locals;
    }

    private MainDecl parseMain() {
        consume(TokenType.VAR, "Expected 'var' declarations in main");
        consume(TokenType.LBRACE, "Expected '{' after 'var'");
        List<String> variables = parseVariables();
        consume(TokenType.RBRACE, "Expected '}' after main variables");

        BlockStmt body = check(TokenType.RBRACE) ? BlockStmt.empty() : parseAlgo();
        return new MainDecl(variables, body);
    }

    // ---------- algorithms / instructions ----------

    // INSTR (; INSTR)*, a trailing ';' before '}' or 'return' is consumed
    private BlockStmt parseAlgo() {
        List<Stmt> stmts = new ArrayList<>();
        stmts.add(parseInstr());
        while (match(TokenType.SEMICOLON)) {
            if (check(TokenType.RBRACE) || check(TokenType.RETURN)) break;
            stmts.add(parseInstr());
        }
        return new BlockStmt(stmts);
    }

    private BlockStmt parseBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
        BlockStmt block = parseAlgo();
        consume(TokenType.RBRACE, "Expected '}'");
        return block;
    }

    private Stmt parseInstr() {
        if (match(TokenType.HALT)) return new HaltStmt();

        if (match(TokenType.PRINT)) {
            if (match(TokenType.STRING_LITERAL)) return new PrintStmt(new StringLiteral(previous().lexeme()));
            return new PrintStmt(parseAtom());
        }

        if (match(TokenType.WHILE)) {
            Expr cond = parseTerm();
            return new WhileStmt(cond, parseBlock());
        }

        if (match(TokenType.DO)) {
            BlockStmt body = parseBlock();
            consume(TokenType.UNTIL, "Expected 'until' after do-block");
            return new DoUntilStmt(body, parseTerm());
        }

        if (match(TokenType.IF)) {
            Expr cond = parseTerm();
            BlockStmt thenB = parseBlock();
            BlockStmt elseB = null;
            if (match(TokenType.ELSE)) elseB = parseBlock();
            return new IfStmt(cond, thenB, elseB);
        }

        if (check(TokenType.NAME) && checkNext(TokenType.LPAREN)) {
            return new CallStmt(parseCall());
        }

        if (check(TokenType.NAME) && checkNext(TokenType.ASSIGN)) {
            Token target = advance();
            advance(); // '='
            return new AssignStmt(target.lexeme(), parseTerm(), target.line());
        }

        throw error(peek(), "Expected instruction");
    }

    // ---------- terms ----------
    private Expr parseTerm() {
        if (match(TokenType.LPAREN)) {
            if (match(TokenType.NEG, TokenType.NOT)) {
                UnaryExpr.Operator op = previous().type() == TokenType.NEG
                        ? UnaryExpr.Operator.NEG
                        : UnaryExpr.Operator.NOT;
                Expr operand = parseTerm();
                consume(TokenType.RPAREN, "Expected ')' after unary term");
                return new UnaryExpr(op, operand);
            }

            Expr left = parseTerm();
            BinaryExpr.Operator op = toBinOp(peek());
            advance();
            Expr right = parseTerm();
            consume(TokenType.RPAREN, "Expected ')' after binary term");
            return new BinaryExpr(left, op, right);
        }

        if (check(TokenType.NAME) && checkNext(TokenType.LPAREN)) return parseCall();

        return parseAtom();
    }

    private CallExpr parseCall() {
        Token name = consume(TokenType.NAME, "Expected procedure or function name");
        consume(TokenType.LPAREN, "Expected '(' after " + name.lexeme());

        List<Expr> args = new ArrayList<>();
        while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
            if (args.size() == MAX_THREE) throw error(peek(), "At most three arguments allowed");
            args.add(parseTerm());
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return new CallExpr(name.lexeme(), args, name.line());
    }

    private Expr parseAtom() {
        if (match(TokenType.NUMBER)) {
            Token num = previous();
            try {
                return new NumberLiteral(Integer.parseInt(num.lexeme()));
            } catch (NumberFormatException e) {
                throw error(num, "Number out of range");
            }
        }
        if (match(TokenType.NAME)) return new VarExpr(previous().lexeme(), previous().line());
        throw error(peek(), "Expected variable or number");
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParseException error(Token at, String msg) {
        return new ParseException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
    }

    private BinaryExpr.Operator toBinOp(Token t) {
        return switch (t.type()) {
            case EQ    -> BinaryExpr.Operator.EQ;
            case GT    -> BinaryExpr.Operator.GT;
            case OR    -> BinaryExpr.Operator.OR;
            case AND   -> BinaryExpr.Operator.AND;
            case PLUS  -> BinaryExpr.Operator.ADD;
            case MINUS -> BinaryExpr.Operator.SUB;
            case MULT  -> BinaryExpr.Operator.MUL;
            case DIV   -> BinaryExpr.Operator.DIV;

            default -> throw error(t, "Expected binary operator");
        };
    }

}
