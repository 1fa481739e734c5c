package com.luaparser.ast;

public class MissingRequiredFieldException extends SyntaxConstructionException {

    private final String fieldName;

    public MissingRequiredFieldException(String fieldName, SyntaxKind kind) {
        super("Missing required field '" + fieldName + "' for " + kind, kind);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
