package com.luaparser.ast;

public sealed interface Statement extends SyntaxNode permits
    SemicolonStatement,
    FunctionCallStatement,
    ReturnStatement,
    BreakStatement,
    GotoStatement,
    DoStatement,
    WhileStatement,
    RepeatStatement,
    GlobalFunctionStatement,
    LocalAssignmentStatement,
    LocalFunctionStatement,
    NumericForStatement,
    GenericForStatement,
    LabelStatement,
    AssignmentStatement,
    IfStatement {
}
