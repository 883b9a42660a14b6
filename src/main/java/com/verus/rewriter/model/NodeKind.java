package com.verus.rewriter.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Syntactic categories a CST node can be tagged with.
 * Each constant carries the rule name used by the Verus grammar.
 */
public enum NodeKind {
    FILE("file"),
    MACRO_BLOCK_USE("verus_macro_use"),
    ITEM("item"),
    FN("fn"),
    NAME("name"),
    PARAM_LIST("param_list"),
    PARAM("param"),
    REQUIRES_CLAUSE("requires_clause"),
    ENSURES_CLAUSE("ensures_clause"),
    RECOMMENDS_CLAUSE("recommends_clause"),
    DECREASES_CLAUSE("decreases_clause"),
    COMMA_DELIMITED_EXPRS("comma_delimited_exprs"),
    FN_BLOCK_EXPR("fn_block_expr"),
    BLOCK_EXPR("block_expr"),
    STMT("stmt"),
    EXPR("expr"),
    EXPR_INNER("expr_inner"),
    PATH_EXPR_NO_GENERICS("path_expr_no_generics"),
    CALL_EXPR("call_expr"),
    ARG_LIST("arg_list"),
    CLOSURE_EXPR("closure_expr"),
    CLOSURE_PARAM_LIST("closure_param_list"),
    PAREN_EXPR("paren_expr"),
    BRACKET_EXPR("bracket_expr"),
    COMMA("comma"),
    TOKEN("token"),
    COMMENT("COMMENT"),
    OTHER("other");

    private static final Map<String, NodeKind> BY_RULE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeKind::getRuleName, Function.identity()));

    private final String ruleName;

    NodeKind(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }

    /**
     * Resolve a grammar rule name. Names outside the vocabulary map to {@link #OTHER}.
     */
    public static NodeKind fromRuleName(String ruleName) {
        if (ruleName == null) {
            return OTHER;
        }
        return BY_RULE_NAME.getOrDefault(ruleName, OTHER);
    }
}
