package splc.ast;

import splc.ast.decl.*;

import java.util.List;

public record Program(
        List<String> globals,
        List<CallableDecl> procedures,
        List<CallableDecl> functions,
        MainDecl main
) {}
