package org.pragmatica.pywrap.cst;

/// Statement and expression shapes of branch nodes.
///
/// Names follow the Python grammar symbols. A grammar rule that matched a single child is
/// collapsed into that child, so a kind only appears where the construct really has structure.
public enum NodeKind {
    FILE_INPUT,
    SUITE,
    SIMPLE_STMT,

    EXPR_STMT,
    ANNASSIGN,
    PRINT_STMT,
    RETURN_STMT,
    RAISE_STMT,
    DEL_STMT,
    ASSERT_STMT,
    GLOBAL_STMT,
    IMPORT_NAME,
    IMPORT_FROM,
    IMPORT_AS_NAME,
    IMPORT_AS_NAMES,
    DOTTED_AS_NAME,
    DOTTED_AS_NAMES,
    DOTTED_NAME,

    IF_STMT,
    WHILE_STMT,
    FOR_STMT,
    TRY_STMT,
    EXCEPT_CLAUSE,
    WITH_STMT,
    WITH_ITEM,
    FUNCDEF,
    PARAMETERS,
    TYPEDARGSLIST,
    VARARGSLIST,
    TNAME,
    CLASSDEF,
    DECORATOR,
    DECORATED,
    ASYNC_FUNCDEF,
    ASYNC_STMT,

    YIELD_EXPR,
    TESTLIST,
    TEST,
    LAMBDEF,
    NAMEDEXPR_TEST,
    OR_TEST,
    AND_TEST,
    NOT_TEST,
    COMPARISON,
    COMP_OP,
    STAR_EXPR,
    EXPR,
    XOR_EXPR,
    AND_EXPR,
    SHIFT_EXPR,
    ARITH_EXPR,
    TERM,
    FACTOR,
    POWER,
    ATOM,
    TRAILER,
    ARGLIST,
    ARGUMENT,
    SUBSCRIPTLIST,
    SUBSCRIPT,
    TESTLIST_GEXP,
    LISTMAKER,
    DICTSETMAKER,
    COMP_FOR,
    COMP_IF
}
