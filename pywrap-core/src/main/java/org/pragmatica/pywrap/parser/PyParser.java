package org.pragmatica.pywrap.parser;

import org.pragmatica.pywrap.cst.CstBranch;
import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.CstNode;
import org.pragmatica.pywrap.cst.CstTree;
import org.pragmatica.pywrap.cst.NodeKind;
import org.pragmatica.pywrap.cst.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for a Python 3 subset (plus the Python 2 print statement).
 *
 * The resulting tree has the shape of the reference grammar: a rule which matched a single child
 * is collapsed into that child, while statements, suites, trailers, bracketed atoms and
 * parameter lists always keep their own node. Covered: simple statements, imports, if/while/
 * for/try/with, function and class definitions, decorators, lambdas, comprehensions,
 * coroutines (async def/for/with, async comprehensions, await), slices, conditional and
 * assignment expressions. Anything else is reported as a parse error.
 */
public final class PyParser {
    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
            "try", "while", "with", "yield");

    private static final Set<String> CONSTANTS = Set.of("False", "None", "True");

    private static final Set<String> EXPRESSION_KEYWORDS = Set.of("False", "None", "True", "not", "lambda", "await");

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=", "@=");

    private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=", "<>");

    private final List<PyToken> tokens;
    private int index;

    private PyParser(List<PyToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse a whole module.
     *
     * @throws PyParseException on syntax outside the supported subset
     */
    public static CstTree parse(String source) {
        return CstTree.cstTree(new PyParser(PyTokenizer.tokenize(source)).fileInput());
    }

    private CstBranch fileInput() {
        var children = new ArrayList<CstNode>();
        while (!atKind(TokenKind.ENDMARKER)) {
            children.add(atKind(TokenKind.NEWLINE) ? take() : statement());
        }
        children.add(take());
        return CstBranch.branch(NodeKind.FILE_INPUT, children);
    }

    // Statements

    private CstNode statement() {
        if (at("@")) {
            return decorated();
        }
        if (atKeyword("async")) {
            return asyncStatement();
        }
        if (peek().is(TokenKind.NAME)) {
            switch (peek().value()) {
                case "if":
                    return ifStatement();
                case "while":
                    return whileStatement();
                case "for":
                    return forStatement();
                case "try":
                    return tryStatement();
                case "with":
                    return withStatement();
                case "def":
                    return funcdef();
                case "class":
                    return classdef();
                default:
                    break;
            }
        }
        return simpleStatement();
    }

    private CstNode simpleStatement() {
        var children = new ArrayList<CstNode>();
        children.add(smallStatement());
        while (at(";")) {
            children.add(take());
            if (atKind(TokenKind.NEWLINE)) {
                break;
            }
            children.add(smallStatement());
        }
        children.add(expectKind(TokenKind.NEWLINE));
        return CstBranch.branch(NodeKind.SIMPLE_STMT, children);
    }

    private CstNode smallStatement() {
        if (!peek().is(TokenKind.NAME)) {
            return expressionStatement();
        }
        switch (peek().value()) {
            case "pass":
            case "break":
            case "continue":
                return take();
            case "return":
                return keywordStatement(NodeKind.RETURN_STMT, () -> testlistStarExpr());
            case "del":
                return keywordStatement(NodeKind.DEL_STMT, () -> exprlist());
            case "raise":
                return raiseStatement();
            case "assert":
                return assertStatement();
            case "global":
            case "nonlocal":
                return globalStatement();
            case "yield":
                return yieldExpr();
            case "import":
                return node(NodeKind.IMPORT_NAME, List.of(take(), dottedAsNames()));
            case "from":
                return importFrom();
            case "print":
                return isPrintStatement() ? printStatement() : expressionStatement();
            default:
                return expressionStatement();
        }
    }

    private CstNode keywordStatement(NodeKind kind, Supplier<CstNode> operand) {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (!atEndOfSimpleStatement()) {
            children.add(operand.get());
        }
        return node(kind, children);
    }

    private CstNode raiseStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (!atEndOfSimpleStatement()) {
            children.add(test());
            if (atKeyword("from")) {
                children.add(take());
                children.add(test());
            }
        }
        return node(NodeKind.RAISE_STMT, children);
    }

    private CstNode assertStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(test());
        if (at(",")) {
            children.add(take());
            children.add(test());
        }
        return node(NodeKind.ASSERT_STMT, children);
    }

    private CstNode globalStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(expectKind(TokenKind.NAME));
        while (at(",")) {
            children.add(take());
            children.add(expectKind(TokenKind.NAME));
        }
        return node(NodeKind.GLOBAL_STMT, children);
    }

    private boolean isPrintStatement() {
        var following = peek(1);
        return switch (following.kind()) {
            case STRING, NUMBER -> true;
            case NAME -> !KEYWORDS.contains(following.value()) || CONSTANTS.contains(following.value());
            case OPERATOR -> following.value().equals(">>");
            default -> false;
        };
    }

    private CstNode printStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (at(">>")) {
            children.add(take());
            children.add(test());
            if (!at(",")) {
                return node(NodeKind.PRINT_STMT, children);
            }
            children.add(take());
        }
        children.add(test());
        while (at(",")) {
            children.add(take());
            if (atEndOfSimpleStatement()) {
                break;
            }
            children.add(test());
        }
        return node(NodeKind.PRINT_STMT, children);
    }

    private CstNode importFrom() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        while (at(".") || at("...")) {
            children.add(take());
        }
        if (!atKeyword("import")) {
            children.add(dottedName());
        }
        children.add(expectKeyword("import"));
        if (at("*")) {
            children.add(take());
        } else if (at("(")) {
            children.add(take());
            children.add(importAsNames());
            children.add(expect(")"));
        } else {
            children.add(importAsNames());
        }
        return node(NodeKind.IMPORT_FROM, children);
    }

    private CstNode importAsNames() {
        var children = new ArrayList<CstNode>();
        children.add(importAsName());
        while (at(",")) {
            children.add(take());
            if (!atKind(TokenKind.NAME)) {
                break;
            }
            children.add(importAsName());
        }
        return node(NodeKind.IMPORT_AS_NAMES, children);
    }

    private CstNode importAsName() {
        var name = expectKind(TokenKind.NAME);
        if (!atKeyword("as")) {
            return name;
        }
        return node(NodeKind.IMPORT_AS_NAME, List.of(name, take(), expectKind(TokenKind.NAME)));
    }

    private CstNode dottedAsNames() {
        var children = new ArrayList<CstNode>();
        children.add(dottedAsName());
        while (at(",")) {
            children.add(take());
            children.add(dottedAsName());
        }
        return node(NodeKind.DOTTED_AS_NAMES, children);
    }

    private CstNode dottedAsName() {
        var name = dottedName();
        if (!atKeyword("as")) {
            return name;
        }
        return node(NodeKind.DOTTED_AS_NAME, List.of(name, take(), expectKind(TokenKind.NAME)));
    }

    private CstNode dottedName() {
        var children = new ArrayList<CstNode>();
        children.add(expectKind(TokenKind.NAME));
        while (at(".")) {
            children.add(take());
            children.add(expectKind(TokenKind.NAME));
        }
        return node(NodeKind.DOTTED_NAME, children);
    }

    private CstNode expressionStatement() {
        var target = testlistStarExpr();

        if (at(":")) {
            var annotation = new ArrayList<CstNode>();
            annotation.add(take());
            annotation.add(test());
            if (at("=")) {
                annotation.add(take());
                annotation.add(yieldOrTestlist());
            }
            return CstBranch.branch(NodeKind.EXPR_STMT, List.of(target, CstBranch.branch(NodeKind.ANNASSIGN, annotation)));
        }
        if (AUGMENTED_ASSIGNMENTS.contains(peek().value()) && peek().is(TokenKind.OPERATOR)) {
            return CstBranch.branch(NodeKind.EXPR_STMT, List.of(target, take(), yieldOrTestlist()));
        }

        var children = new ArrayList<CstNode>();
        children.add(target);
        while (at("=")) {
            children.add(take());
            children.add(yieldOrTestlist());
        }
        return node(NodeKind.EXPR_STMT, children);
    }

    private CstNode yieldOrTestlist() {
        return atKeyword("yield") ? yieldExpr() : testlistStarExpr();
    }

    private CstNode yieldExpr() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (atKeyword("from")) {
            children.add(take());
            children.add(test());
        } else if (startsExpression()) {
            children.add(testlistStarExpr());
        }
        return node(NodeKind.YIELD_EXPR, children);
    }

    // Compound statements

    private CstNode ifStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(namedexprTest());
        children.add(expect(":"));
        children.add(suite());
        while (atKeyword("elif")) {
            children.add(take());
            children.add(namedexprTest());
            children.add(expect(":"));
            children.add(suite());
        }
        elseClause(children);
        return CstBranch.branch(NodeKind.IF_STMT, children);
    }

    private CstNode whileStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(namedexprTest());
        children.add(expect(":"));
        children.add(suite());
        elseClause(children);
        return CstBranch.branch(NodeKind.WHILE_STMT, children);
    }

    private CstNode forStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(exprlist());
        children.add(expectKeyword("in"));
        children.add(testlistStarExpr());
        children.add(expect(":"));
        children.add(suite());
        elseClause(children);
        return CstBranch.branch(NodeKind.FOR_STMT, children);
    }

    private void elseClause(List<CstNode> children) {
        if (atKeyword("else")) {
            children.add(take());
            children.add(expect(":"));
            children.add(suite());
        }
    }

    private CstNode tryStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(expect(":"));
        children.add(suite());
        while (atKeyword("except")) {
            children.add(exceptClause());
            children.add(expect(":"));
            children.add(suite());
        }
        elseClause(children);
        if (atKeyword("finally")) {
            children.add(take());
            children.add(expect(":"));
            children.add(suite());
        }
        return CstBranch.branch(NodeKind.TRY_STMT, children);
    }

    private CstNode exceptClause() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (!at(":")) {
            children.add(test());
            if (atKeyword("as")) {
                children.add(take());
                children.add(expectKind(TokenKind.NAME));
            }
        }
        return node(NodeKind.EXCEPT_CLAUSE, children);
    }

    private CstNode withStatement() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(withItem());
        while (at(",")) {
            children.add(take());
            children.add(withItem());
        }
        children.add(expect(":"));
        children.add(suite());
        return CstBranch.branch(NodeKind.WITH_STMT, children);
    }

    private CstNode withItem() {
        var item = test();
        if (!atKeyword("as")) {
            return item;
        }
        return node(NodeKind.WITH_ITEM, List.of(item, take(), expr()));
    }

    private CstNode funcdef() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(expectKind(TokenKind.NAME));
        children.add(parameters());
        if (at("->")) {
            children.add(take());
            children.add(test());
        }
        children.add(expect(":"));
        children.add(suite());
        return CstBranch.branch(NodeKind.FUNCDEF, children);
    }

    private CstNode parameters() {
        var children = new ArrayList<CstNode>();
        children.add(expect("("));
        if (!at(")")) {
            children.add(parameterList(NodeKind.TYPEDARGSLIST, ")", true));
        }
        children.add(expect(")"));
        return CstBranch.branch(NodeKind.PARAMETERS, children);
    }

    private CstNode parameterList(NodeKind kind, String closer, boolean annotated) {
        var children = new ArrayList<CstNode>();
        while (!at(closer)) {
            if (at("*") || at("**")) {
                children.add(take());
                if (atKind(TokenKind.NAME)) {
                    children.add(parameter(annotated));
                }
            } else if (at("/")) {
                children.add(take());
            } else {
                children.add(parameter(annotated));
                if (at("=")) {
                    children.add(take());
                    children.add(test());
                }
            }
            if (!at(",")) {
                break;
            }
            children.add(take());
        }
        return node(kind, children);
    }

    private CstNode parameter(boolean annotated) {
        var name = expectKind(TokenKind.NAME);
        if (!annotated || !at(":")) {
            return name;
        }
        return node(NodeKind.TNAME, List.of(name, take(), test()));
    }

    private CstNode classdef() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(expectKind(TokenKind.NAME));
        if (at("(")) {
            children.add(take());
            if (!at(")")) {
                children.add(arglist());
            }
            children.add(expect(")"));
        }
        children.add(expect(":"));
        children.add(suite());
        return CstBranch.branch(NodeKind.CLASSDEF, children);
    }

    private CstNode asyncStatement() {
        var keyword = take();
        if (atKeyword("def")) {
            return CstBranch.branch(NodeKind.ASYNC_FUNCDEF, List.of(keyword, funcdef()));
        }
        if (atKeyword("for")) {
            return CstBranch.branch(NodeKind.ASYNC_STMT, List.of(keyword, forStatement()));
        }
        if (atKeyword("with")) {
            return CstBranch.branch(NodeKind.ASYNC_STMT, List.of(keyword, withStatement()));
        }
        throw unexpected("expected 'def', 'for' or 'with' after 'async'");
    }

    private CstNode decorated() {
        var children = new ArrayList<CstNode>();
        while (at("@")) {
            children.add(CstBranch.branch(NodeKind.DECORATOR,
                                          List.of(take(), namedexprTest(), expectKind(TokenKind.NEWLINE))));
        }
        if (atKeyword("def")) {
            children.add(funcdef());
        } else if (atAsync("def")) {
            children.add(CstBranch.branch(NodeKind.ASYNC_FUNCDEF, List.of(take(), funcdef())));
        } else if (atKeyword("class")) {
            children.add(classdef());
        } else {
            throw unexpected();
        }
        return CstBranch.branch(NodeKind.DECORATED, children);
    }

    private CstNode suite() {
        if (!atKind(TokenKind.NEWLINE)) {
            return simpleStatement();
        }
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(expectKind(TokenKind.INDENT));
        while (!atKind(TokenKind.DEDENT)) {
            children.add(statement());
        }
        children.add(take());
        return CstBranch.branch(NodeKind.SUITE, children);
    }

    // Expressions

    private CstNode testlistStarExpr() {
        return commaSeparated(NodeKind.TESTLIST, () -> at("*") ? starExpr() : test());
    }

    private CstNode exprlist() {
        return commaSeparated(NodeKind.TESTLIST, () -> at("*") ? starExpr() : expr());
    }

    private CstNode commaSeparated(NodeKind kind, Supplier<CstNode> item) {
        var children = new ArrayList<CstNode>();
        children.add(item.get());
        while (at(",")) {
            children.add(take());
            if (!startsExpression()) {
                break;
            }
            children.add(item.get());
        }
        return node(kind, children);
    }

    private CstNode starExpr() {
        return CstBranch.branch(NodeKind.STAR_EXPR, List.of(take(), expr()));
    }

    private CstNode namedexprTest() {
        if (atKind(TokenKind.NAME) && peek(1).value().equals(":=")) {
            return CstBranch.branch(NodeKind.NAMEDEXPR_TEST, List.of(take(), take(), test()));
        }
        return test();
    }

    private CstNode test() {
        if (atKeyword("lambda")) {
            return lambdef();
        }
        var condition = orTest();
        if (!atKeyword("if")) {
            return condition;
        }
        return CstBranch.branch(NodeKind.TEST, List.of(condition, take(), orTest(), expectKeyword("else"), test()));
    }

    private CstNode lambdef() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (!at(":")) {
            children.add(parameterList(NodeKind.VARARGSLIST, ":", false));
        }
        children.add(expect(":"));
        children.add(test());
        return CstBranch.branch(NodeKind.LAMBDEF, children);
    }

    private CstNode orTest() {
        return binary(NodeKind.OR_TEST, this::andTest, token -> isKeyword(token, "or"));
    }

    private CstNode andTest() {
        return binary(NodeKind.AND_TEST, this::notTest, token -> isKeyword(token, "and"));
    }

    private CstNode notTest() {
        if (atKeyword("not")) {
            return CstBranch.branch(NodeKind.NOT_TEST, List.of(take(), notTest()));
        }
        return comparison();
    }

    private CstNode comparison() {
        var children = new ArrayList<CstNode>();
        children.add(expr());
        while (true) {
            if (at(COMPARISONS) || atKeyword("in")) {
                children.add(take());
            } else if (atKeyword("not") && isKeyword(peek(1), "in")) {
                children.add(CstBranch.branch(NodeKind.COMP_OP, List.of(take(), take())));
            } else if (atKeyword("is")) {
                children.add(isKeyword(peek(1), "not")
                             ? CstBranch.branch(NodeKind.COMP_OP, List.of(take(), take()))
                             : take());
            } else {
                break;
            }
            children.add(expr());
        }
        return node(NodeKind.COMPARISON, children);
    }

    private CstNode expr() {
        return binary(NodeKind.EXPR, this::xorExpr, token -> isOperator(token, "|"));
    }

    private CstNode xorExpr() {
        return binary(NodeKind.XOR_EXPR, this::andExpr, token -> isOperator(token, "^"));
    }

    private CstNode andExpr() {
        return binary(NodeKind.AND_EXPR, this::shiftExpr, token -> isOperator(token, "&"));
    }

    private CstNode shiftExpr() {
        return binary(NodeKind.SHIFT_EXPR, this::arithExpr, token -> isOperator(token, "<<", ">>"));
    }

    private CstNode arithExpr() {
        return binary(NodeKind.ARITH_EXPR, this::term, token -> isOperator(token, "+", "-"));
    }

    private CstNode term() {
        return binary(NodeKind.TERM, this::factor, token -> isOperator(token, "*", "/", "%", "//", "@"));
    }

    private CstNode binary(NodeKind kind, Supplier<CstNode> operand, Predicate<PyToken> isOperator) {
        var children = new ArrayList<CstNode>();
        children.add(operand.get());
        while (isOperator.test(peek())) {
            children.add(take());
            children.add(operand.get());
        }
        return node(kind, children);
    }

    private CstNode factor() {
        if (at("+") || at("-") || at("~")) {
            return CstBranch.branch(NodeKind.FACTOR, List.of(take(), factor()));
        }
        return power();
    }

    private CstNode power() {
        var children = new ArrayList<CstNode>();
        if (atKeyword("await")) {
            children.add(take());
        }
        children.add(atom());
        while (at("(") || at("[") || at(".")) {
            children.add(trailer());
        }
        if (at("**")) {
            children.add(take());
            children.add(factor());
        }
        return node(NodeKind.POWER, children);
    }

    private CstNode atom() {
        var token = peek();
        switch (token.kind()) {
            case LPAR:
                return bracketed(")", () -> atKeyword("yield") ? yieldExpr() : bracketContents(NodeKind.TESTLIST_GEXP, false));
            case LSQB:
                return bracketed("]", () -> bracketContents(NodeKind.LISTMAKER, false));
            case LBRACE:
                return bracketed("}", () -> bracketContents(NodeKind.DICTSETMAKER, true));
            case NUMBER:
                return take();
            case STRING:
                var strings = new ArrayList<CstNode>();
                while (atKind(TokenKind.STRING)) {
                    strings.add(take());
                }
                return node(NodeKind.ATOM, strings);
            case NAME:
                if (KEYWORDS.contains(token.value()) && !CONSTANTS.contains(token.value())) {
                    throw unexpected();
                }
                return take();
            case OPERATOR:
                if (token.value().equals("...")) {
                    return take();
                }
                throw unexpected();
            default:
                throw unexpected();
        }
    }

    private CstNode bracketed(String closer, Supplier<CstNode> contents) {
        var children = new ArrayList<CstNode>();
        children.add(take());
        if (!at(closer)) {
            children.add(contents.get());
        }
        children.add(expect(closer));
        return CstBranch.branch(NodeKind.ATOM, children);
    }

    private CstNode bracketContents(NodeKind kind, boolean dictionary) {
        var children = new ArrayList<CstNode>();
        bracketItem(children, dictionary);
        if (atCompFor()) {
            children.add(compFor());
            return node(kind, children);
        }
        while (at(",")) {
            children.add(take());
            if (at(")") || at("]") || at("}")) {
                break;
            }
            bracketItem(children, dictionary);
        }
        return node(kind, children);
    }

    private void bracketItem(List<CstNode> children, boolean dictionary) {
        if (dictionary && at("**")) {
            children.add(take());
            children.add(expr());
        } else if (at("*")) {
            children.add(starExpr());
        } else {
            children.add(namedexprTest());
            if (dictionary && at(":")) {
                children.add(take());
                children.add(test());
            }
        }
    }

    private CstNode compFor() {
        var children = new ArrayList<CstNode>();
        if (atKeyword("async")) {
            children.add(take());
        }
        children.add(expectKeyword("for"));
        children.add(exprlist());
        children.add(expectKeyword("in"));
        children.add(orTest());
        compIter(children);
        return CstBranch.branch(NodeKind.COMP_FOR, children);
    }

    private CstNode compIf() {
        var children = new ArrayList<CstNode>();
        children.add(take());
        children.add(orTest());
        compIter(children);
        return CstBranch.branch(NodeKind.COMP_IF, children);
    }

    private void compIter(List<CstNode> children) {
        if (atCompFor()) {
            children.add(compFor());
        } else if (atKeyword("if")) {
            children.add(compIf());
        }
    }

    private CstNode trailer() {
        var children = new ArrayList<CstNode>();
        if (at(".")) {
            children.add(take());
            children.add(expectKind(TokenKind.NAME));
        } else if (at("(")) {
            children.add(take());
            if (!at(")")) {
                children.add(arglist());
            }
            children.add(expect(")"));
        } else {
            children.add(take());
            children.add(subscriptlist());
            children.add(expect("]"));
        }
        return CstBranch.branch(NodeKind.TRAILER, children);
    }

    private CstNode arglist() {
        var children = new ArrayList<CstNode>();
        children.add(argument());
        while (at(",")) {
            children.add(take());
            if (at(")")) {
                break;
            }
            children.add(argument());
        }
        return node(NodeKind.ARGLIST, children);
    }

    private CstNode argument() {
        if (at("*") || at("**")) {
            return CstBranch.branch(NodeKind.ARGUMENT, List.of(take(), test()));
        }
        var value = namedexprTest();
        if (at("=")) {
            return CstBranch.branch(NodeKind.ARGUMENT, List.of(value, take(), test()));
        }
        if (atCompFor()) {
            return CstBranch.branch(NodeKind.ARGUMENT, List.of(value, compFor()));
        }
        return value;
    }

    private CstNode subscriptlist() {
        var children = new ArrayList<CstNode>();
        children.add(subscript());
        while (at(",")) {
            children.add(take());
            if (!startsExpression() && !at(":")) {
                break;
            }
            children.add(subscript());
        }
        return node(NodeKind.SUBSCRIPTLIST, children);
    }

    private CstNode subscript() {
        var children = new ArrayList<CstNode>();
        if (!at(":")) {
            children.add(test());
        }
        for (int colons = 0; colons < 2 && at(":"); colons++) {
            children.add(take());
            if (startsExpression()) {
                children.add(test());
            }
        }
        return node(NodeKind.SUBSCRIPT, children);
    }

    // Token helpers

    private static CstNode node(NodeKind kind, List<CstNode> children) {
        return children.size() == 1
               ? children.get(0)
               : CstBranch.branch(kind, children);
    }

    private PyToken peek() {
        return tokens.get(index);
    }

    private PyToken peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private CstLeaf take() {
        var token = peek();
        if (!token.is(TokenKind.ENDMARKER)) {
            index++;
        }
        return token.toLeaf();
    }

    private boolean atKind(TokenKind kind) {
        return peek().is(kind);
    }

    private boolean at(String value) {
        return isOperator(peek(), value);
    }

    private boolean at(Set<String> values) {
        var token = peek();
        return isPunctuation(token) && values.contains(token.value());
    }

    private boolean atKeyword(String keyword) {
        return isKeyword(peek(), keyword);
    }

    private boolean atAsync(String keyword) {
        return atKeyword("async") && isKeyword(peek(1), keyword);
    }

    private boolean atCompFor() {
        return atKeyword("for") || atAsync("for");
    }

    private boolean atEndOfSimpleStatement() {
        return atKind(TokenKind.NEWLINE) || at(";");
    }

    private boolean startsExpression() {
        var token = peek();
        return switch (token.kind()) {
            case NAME -> !KEYWORDS.contains(token.value()) || EXPRESSION_KEYWORDS.contains(token.value());
            case NUMBER, STRING, LPAR, LSQB, LBRACE -> true;
            case OPERATOR -> Set.of("-", "+", "~", "*", "**", "...").contains(token.value());
            default -> false;
        };
    }

    private static boolean isKeyword(PyToken token, String keyword) {
        return token.is(TokenKind.NAME) && token.value().equals(keyword);
    }

    private static boolean isOperator(PyToken token, String... values) {
        if (!isPunctuation(token)) {
            return false;
        }
        for (var value : values) {
            if (token.value().equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPunctuation(PyToken token) {
        return switch (token.kind()) {
            case NAME, NUMBER, STRING, NEWLINE, INDENT, DEDENT, ENDMARKER -> false;
            default -> true;
        };
    }

    private CstLeaf expect(String value) {
        if (!at(value)) {
            throw unexpected("expected '" + value + "'");
        }
        return take();
    }

    private CstLeaf expectKeyword(String keyword) {
        if (!atKeyword(keyword)) {
            throw unexpected("expected '" + keyword + "'");
        }
        return take();
    }

    private CstLeaf expectKind(TokenKind kind) {
        if (!atKind(kind)) {
            throw unexpected("expected " + kind);
        }
        return take();
    }

    private PyParseException unexpected() {
        return unexpected("unexpected token");
    }

    private PyParseException unexpected(String details) {
        var token = peek();
        var shown = token.is(TokenKind.ENDMARKER) ? "end of file" : describe(token);
        return new PyParseException(token.line(), token.column(), details + ", found " + shown);
    }

    private static String describe(PyToken token) {
        return switch (token.kind()) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            default -> "'" + token.value() + "'";
        };
    }
}
