package splc.ast.decl;

import splc.ast.stmt.BlockStmt;

import java.util.List;

public record MainDecl(
        List<String> variables,
        BlockStmt body
) {}
