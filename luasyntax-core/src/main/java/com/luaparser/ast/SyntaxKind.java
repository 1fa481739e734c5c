package com.luaparser.ast;

/**
 * Discriminant for every grammar production and every token type.
 */
public enum SyntaxKind {
    // Nodes
    CHUNK(Category.NODE),
    BLOCK(Category.NODE),
    SEMICOLON_STATEMENT(Category.NODE),
    FUNCTION_CALL_STATEMENT(Category.NODE),
    RETURN_STATEMENT(Category.NODE),
    BREAK_STATEMENT(Category.NODE),
    GOTO_STATEMENT(Category.NODE),
    DO_STATEMENT(Category.NODE),
    WHILE_STATEMENT(Category.NODE),
    REPEAT_STATEMENT(Category.NODE),
    GLOBAL_FUNCTION_STATEMENT(Category.NODE),
    LOCAL_ASSIGNMENT_STATEMENT(Category.NODE),
    LOCAL_FUNCTION_STATEMENT(Category.NODE),
    NUMERIC_FOR_STATEMENT(Category.NODE),
    GENERIC_FOR_STATEMENT(Category.NODE),
    LABEL_STATEMENT(Category.NODE),
    ASSIGNMENT_STATEMENT(Category.NODE),
    IF_STATEMENT(Category.NODE),
    ELSE_IF_BLOCK(Category.NODE),
    ELSE_BLOCK(Category.NODE),
    SIMPLE_EXPRESSION(Category.NODE),
    BINARY_OPERATOR_EXPRESSION(Category.NODE),
    UNARY_OPERATOR_EXPRESSION(Category.NODE),
    TABLE_CONSTRUCTOR_EXPRESSION(Category.NODE),
    FUNCTION_DEFINITION(Category.NODE),
    BRACKET_FIELD(Category.NODE),
    ASSIGNMENT_FIELD(Category.NODE),
    EXPRESSION_FIELD(Category.NODE),
    NAME_VAR(Category.NODE),
    SQUARE_BRACKET_VAR(Category.NODE),
    DOT_VAR(Category.NODE),
    FUNCTION_CALL_PREFIX_EXPRESSION(Category.NODE),
    PAREN_PREFIX_EXPRESSION(Category.NODE),
    TABLE_CONSTRUCTOR_ARG(Category.NODE),
    PAREN_ARG(Category.NODE),
    STRING_ARG(Category.NODE),
    SEPARATED_LIST(Category.NODE),
    SEPARATED_LIST_ELEMENT(Category.NODE),
    VAR_ARG_PAR_LIST(Category.NODE),
    NAME_LIST_PAR_LIST(Category.NODE),
    TABLE_CONSTRUCTOR(Category.NODE),
    FUNCTION_BODY(Category.NODE),
    FUNCTION_NAME(Category.NODE),

    // Keywords
    AND_KEYWORD(Category.KEYWORD, "and"),
    BREAK_KEYWORD(Category.KEYWORD, "break"),
    DO_KEYWORD(Category.KEYWORD, "do"),
    ELSE_KEYWORD(Category.KEYWORD, "else"),
    ELSE_IF_KEYWORD(Category.KEYWORD, "elseif"),
    END_KEYWORD(Category.KEYWORD, "end"),
    FALSE_KEYWORD(Category.KEYWORD, "false"),
    FOR_KEYWORD(Category.KEYWORD, "for"),
    FUNCTION_KEYWORD(Category.KEYWORD, "function"),
    GOTO_KEYWORD(Category.KEYWORD, "goto"),
    IF_KEYWORD(Category.KEYWORD, "if"),
    IN_KEYWORD(Category.KEYWORD, "in"),
    LOCAL_KEYWORD(Category.KEYWORD, "local"),
    NIL_KEYWORD(Category.KEYWORD, "nil"),
    NOT_KEYWORD(Category.KEYWORD, "not"),
    OR_KEYWORD(Category.KEYWORD, "or"),
    REPEAT_KEYWORD(Category.KEYWORD, "repeat"),
    RETURN_KEYWORD(Category.KEYWORD, "return"),
    THEN_KEYWORD(Category.KEYWORD, "then"),
    TRUE_KEYWORD(Category.KEYWORD, "true"),
    UNTIL_KEYWORD(Category.KEYWORD, "until"),
    WHILE_KEYWORD(Category.KEYWORD, "while"),

    // Operators
    PLUS_OPERATOR(Category.OPERATOR, "+"),
    MINUS_OPERATOR(Category.OPERATOR, "-"),
    MULTIPLY_OPERATOR(Category.OPERATOR, "*"),
    DIVIDE_OPERATOR(Category.OPERATOR, "/"),
    FLOOR_DIVIDE_OPERATOR(Category.OPERATOR, "//"),
    MODULO_OPERATOR(Category.OPERATOR, "%"),
    EXPONENT_OPERATOR(Category.OPERATOR, "^"),
    LENGTH_OPERATOR(Category.OPERATOR, "#"),
    BITWISE_AND_OPERATOR(Category.OPERATOR, "&"),
    TILDE_OPERATOR(Category.OPERATOR, "~"),   // unary not or binary xor
    BITWISE_OR_OPERATOR(Category.OPERATOR, "|"),
    BITWISE_LEFT_OPERATOR(Category.OPERATOR, "<<"),
    BITWISE_RIGHT_OPERATOR(Category.OPERATOR, ">>"),
    EQUALITY_OPERATOR(Category.OPERATOR, "=="),
    NOT_EQUAL_OPERATOR(Category.OPERATOR, "~="),
    LESS_OR_EQUAL_OPERATOR(Category.OPERATOR, "<="),
    GREATER_OR_EQUAL_OPERATOR(Category.OPERATOR, ">="),
    LESS_THAN_OPERATOR(Category.OPERATOR, "<"),
    GREATER_THAN_OPERATOR(Category.OPERATOR, ">"),
    ASSIGNMENT_OPERATOR(Category.OPERATOR, "="),
    STRING_CONCAT_OPERATOR(Category.OPERATOR, ".."),
    VAR_ARG_OPERATOR(Category.OPERATOR, "..."),

    // Punctuation
    OPEN_PAREN(Category.PUNCTUATION, "("),
    CLOSE_PAREN(Category.PUNCTUATION, ")"),
    OPEN_CURLY_BRACE(Category.PUNCTUATION, "{"),
    CLOSE_CURLY_BRACE(Category.PUNCTUATION, "}"),
    OPEN_BRACKET(Category.PUNCTUATION, "["),
    CLOSE_BRACKET(Category.PUNCTUATION, "]"),
    DOUBLE_COLON(Category.PUNCTUATION, "::"),
    SEMICOLON(Category.PUNCTUATION, ";"),
    COLON(Category.PUNCTUATION, ":"),
    COMMA(Category.PUNCTUATION, ","),
    DOT(Category.PUNCTUATION, "."),

    // Variable spelling
    NUMBER(Category.LITERAL),
    STRING(Category.LITERAL),
    IDENTIFIER(Category.NAME),
    END_OF_FILE(Category.END_OF_FILE, "");

    public enum Category {
        NODE,
        KEYWORD,
        OPERATOR,
        PUNCTUATION,
        LITERAL,
        NAME,
        END_OF_FILE
    }

    private final Category category;
    private final String text;  // null unless the spelling is fixed

    SyntaxKind(Category category) {
        this(category, null);
    }

    SyntaxKind(Category category, String text) {
        this.category = category;
        this.text = text;
    }

    public Category category() {
        return category;
    }

    /**
     * Returns the fixed source spelling of this token kind, or null for nodes,
     * names and literals.
     */
    public String text() {
        return text;
    }

    public boolean isNode() {
        return category == Category.NODE;
    }

    public boolean isToken() {
        return category != Category.NODE;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }
}
