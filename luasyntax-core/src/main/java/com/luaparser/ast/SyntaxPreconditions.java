package com.luaparser.ast;

import java.util.List;

/**
 * Field checks shared by the node constructors.
 */
final class SyntaxPreconditions {

    private SyntaxPreconditions() {
        // Utility class
    }

    static void checkSpan(int start, int length, SyntaxKind kind) {
        if (start < 0) {
            throw new IllegalArgumentException(kind + " start must be non-negative: " + start);
        }
        if (length < 0) {
            throw new IllegalArgumentException(kind + " length must be non-negative: " + length);
        }
    }

    static <T> T required(T value, String fieldName, SyntaxKind kind) {
        if (value == null) {
            throw new MissingRequiredFieldException(fieldName, kind);
        }
        return value;
    }

    /**
     * Null-checks the list and returns an unmodifiable copy. A list that is
     * already unmodifiable comes back as the same instance.
     */
    static <T> List<T> requiredList(List<T> value, String fieldName, SyntaxKind kind) {
        return List.copyOf(required(value, fieldName, kind));
    }

    static void paired(Object first, String firstName, Object second, String secondName, SyntaxKind kind) {
        if ((first == null) != (second == null)) {
            throw new UnpairedOptionalFieldException(firstName, secondName, kind);
        }
    }
}
