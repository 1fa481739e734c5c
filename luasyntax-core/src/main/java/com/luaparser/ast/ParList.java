package com.luaparser.ast;

public sealed interface ParList extends SyntaxNode permits VarArgParList, NameListParList {
}
