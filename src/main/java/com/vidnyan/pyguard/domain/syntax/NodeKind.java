package com.vidnyan.pyguard.domain.syntax;

/**
 * Closed set of syntax node variants.
 * Rules declare interest in kinds; the walker dispatches on them.
 */
public enum NodeKind {
    MODULE,

    // statements
    FUNCTION_DEF,
    ASYNC_FUNCTION_DEF,
    CLASS_DEF,
    DECORATOR,
    RETURN,
    DELETE,
    ASSIGN,
    AUG_ASSIGN,
    ANN_ASSIGN,
    FOR,
    ASYNC_FOR,
    WHILE,
    IF,
    WITH,
    ASYNC_WITH,
    WITH_ITEM,
    MATCH,
    MATCH_CASE,
    RAISE,
    TRY,
    EXCEPT_HANDLER,
    ASSERT,
    IMPORT,
    IMPORT_FROM,
    ALIAS,
    GLOBAL,
    NONLOCAL,
    EXPR,
    PASS,
    BREAK,
    CONTINUE,

    // expressions
    BOOL_OP,
    NAMED_EXPR,
    BIN_OP,
    UNARY_OP,
    LAMBDA,
    IF_EXP,
    DICT,
    SET,
    LIST,
    TUPLE,
    LIST_COMP,
    SET_COMP,
    DICT_COMP,
    GENERATOR_EXP,
    COMPREHENSION,
    AWAIT,
    YIELD,
    YIELD_FROM,
    COMPARE,
    CALL,
    KEYWORD,
    JOINED_STR,
    FORMATTED_VALUE,
    CONSTANT,
    ATTRIBUTE,
    SUBSCRIPT,
    STARRED,
    NAME,
    SLICE,

    // signatures
    ARGUMENTS,
    ARG;

    public boolean isFunction() {
        return this == FUNCTION_DEF || this == ASYNC_FUNCTION_DEF;
    }

    public boolean isLoop() {
        return this == FOR || this == ASYNC_FOR || this == WHILE;
    }

    public boolean isComprehension() {
        return this == LIST_COMP || this == SET_COMP || this == DICT_COMP || this == GENERATOR_EXP;
    }
}
