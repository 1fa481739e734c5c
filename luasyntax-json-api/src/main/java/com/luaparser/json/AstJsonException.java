package com.luaparser.json;

/**
 * Thrown when a syntax tree cannot be written to or read from JSON. Validation
 * failures of the rebuilt nodes, such as a missing required field, are found
 * in the cause chain.
 */
public class AstJsonException extends RuntimeException {

    private final String elementType;

    /**
     * @param elementType simple name of the type being written or read, or null if unknown
     */
    public AstJsonException(String message, String elementType, Throwable cause) {
        super(message, cause);
        this.elementType = elementType;
    }

    /**
     * Simple name of the element type being serialized, or of the requested
     * type when deserializing. Can be null.
     */
    public String elementType() {
        return elementType;
    }
}
