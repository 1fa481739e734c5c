package com.luaparser.ast;

/**
 * Thrown when only one member of an optional field pair was supplied, e.g. a
 * method-call colon without the method name.
 */
public class UnpairedOptionalFieldException extends SyntaxConstructionException {

    private final String firstField;
    private final String secondField;

    public UnpairedOptionalFieldException(String firstField, String secondField, SyntaxKind kind) {
        super("Optional fields '" + firstField + "' and '" + secondField
                + "' of " + kind + " must be supplied together", kind);
        this.firstField = firstField;
        this.secondField = secondField;
    }

    public String firstField() {
        return firstField;
    }

    public String secondField() {
        return secondField;
    }
}
