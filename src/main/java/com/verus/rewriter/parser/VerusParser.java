package com.verus.rewriter.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.model.CstNode;
import com.verus.rewriter.model.NodeKind;
import com.verus.rewriter.model.SyntaxNode;
import com.verus.rewriter.parser.VerusToken.TokenType;

/**
 * Recursive-descent parser for Verus source files.
 * Converts tokens into a concrete syntax tree whose node texts are exact
 * source slices.
 *
 * Separators and delimiters of the shapes the rewriter canonicalizes
 * (parameter lists, clause lists, argument-list parentheses, function body
 * braces, the {@code verus!} markers) are discarded structural text. Comments
 * sitting at those boundaries become {@link NodeKind#COMMENT} nodes; every
 * other comment stays in the text of the leaf that follows it.
 */
public class VerusParser {
    private static final Logger log = LoggerFactory.getLogger(VerusParser.class);

    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final String MACRO_NAME = "verus";

    private static final Set<String> FN_MODIFIERS = Set.of(
            "pub", "open", "closed", "spec", "proof", "exec", "const", "unsafe", "async",
            "extern", "default", "tracked", "ghost", "broadcast"
    );

    private static final Map<String, NodeKind> CLAUSE_KINDS = Map.of(
            "requires", NodeKind.REQUIRES_CLAUSE,
            "ensures", NodeKind.ENSURES_CLAUSE,
            "recommends", NodeKind.RECOMMENDS_CLAUSE,
            "decreases", NodeKind.DECREASES_CLAUSE
    );

    // header words that end a clause list without starting a new clause
    private static final Set<String> CLAUSE_STOPS = Set.of("when", "via", "opens_invariants", "no_unwind");

    private static final Set<String> KEYWORDS = Set.of(
            "as", "break", "const", "continue", "dyn", "else", "enum", "extern", "fn", "for", "if", "impl",
            "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref", "return", "static", "struct",
            "trait", "type", "unsafe", "use", "where", "while", "async", "await", "by", "via", "when",
            "requires", "ensures", "recommends", "decreases", "invariant", "forall", "exists", "choose",
            "spec", "proof", "exec", "open", "closed", "tracked", "ghost", "broadcast"
    );

    // tokens after a block that keep the enclosing statement going
    private static final Set<String> BLOCK_CONTINUATIONS = Set.of(
            "else", ".", "?", ";", "=", "as", "==", "!=", "<", ">", "<=", ">=", "+", "-", "*", "/", "%",
            "&&", "||", "==>", "<==>", "<==", "=>", "@", ".."
    );

    private static final Set<String> POSTFIX_OPERATORS = Set.of("?", "@");

    private final String source;
    private final String fileName;
    private final List<VerusToken> tokens;
    private final int maxDepth;
    private int pos = 0;
    private int depth = 0;
    // attribute arguments are token trees, never call sites
    private int attributeDepth = 0;

    public VerusParser(String source, String fileName) {
        this(source, fileName, DEFAULT_MAX_DEPTH);
    }

    public VerusParser(String source, String fileName, int maxDepth) {
        this.source = source;
        this.fileName = fileName;
        this.maxDepth = maxDepth;
        this.tokens = new VerusTokenizer(source, fileName).tokenize();
    }

    public CstNode parse() {
        List<CstNode> children = new ArrayList<>();
        while (!isAtEnd()) {
            parseItem(children, false);
        }
        detachComments(peek(), children);

        log.debug("Parsed {}: {} top-level nodes", fileName, children.size());
        return SyntaxNode.builder()
                .kind(NodeKind.FILE)
                .text(source)
                .children(children)
                .line(1)
                .column(1)
                .build();
    }

    // ---------------------------------------------------------------------
    // Items and statements
    // ---------------------------------------------------------------------

    private void parseItem(List<CstNode> out, boolean inBlock) {
        if (isMacroBlockStart()) {
            out.add(parseMacroBlock(out));
        } else if (isFnStart()) {
            out.add(parseFn());
        } else {
            out.add(parseStatement(inBlock ? NodeKind.STMT : NodeKind.ITEM));
        }
    }

    private CstNode parseMacroBlock(List<CstNode> parentOut) {
        enter();
        detachComments(peek(), parentOut);
        VerusToken first = advance();

        List<CstNode> children = new ArrayList<>();
        detachComments(peek(), children);
        expect("!");
        detachComments(peek(), children);
        expect("{");

        while (!check("}")) {
            if (isAtEnd()) {
                throw error("Unterminated " + MACRO_NAME + "! block", first);
            }
            parseItem(children, false);
        }
        detachComments(peek(), children);
        expect("}");
        exit();

        log.debug("Parsed {}! block at line {}", MACRO_NAME, first.getLine());
        return node(NodeKind.MACRO_BLOCK_USE, first.getStart(), first, children);
    }

    private CstNode parseFn() {
        enter();
        VerusToken first = peek();
        int start = first.getTriviaStart();
        List<CstNode> children = new ArrayList<>();

        while (!peek().isIdentifier("fn")) {
            if (isAttributeStart()) {
                parseAttribute(children);
            } else if (check("(")) {
                children.add(parseGroup("(", ")", NodeKind.PAREN_EXPR));
            } else {
                children.add(leaf(NodeKind.TOKEN, advance()));
            }
        }
        children.add(leaf(NodeKind.TOKEN, advance()));

        detachComments(peek(), children);
        if (peek().getType() != TokenType.IDENTIFIER) {
            throw error("Expected function name", peek());
        }
        VerusToken nameToken = advance();
        children.add(leaf(NodeKind.NAME, nameToken));

        if (check("<")) {
            parseGenerics(children);
        }

        detachComments(peek(), children);
        if (!check("(")) {
            throw error("Expected parameter list for function " + nameToken.getValue(), peek());
        }
        children.add(parseDelimitedParams(NodeKind.PARAM_LIST, "(", ")"));

        boolean lastWasOperand = false;
        while (!check("{") && !check(";")) {
            if (isAtEnd()) {
                throw error("Unterminated function signature for " + nameToken.getValue(), nameToken);
            }
            VerusToken t = peek();
            if (t.getType() == TokenType.IDENTIFIER && CLAUSE_KINDS.containsKey(t.getValue())) {
                children.add(parseClause());
                lastWasOperand = false;
            } else {
                lastWasOperand = parseUnit(children, this::isHeaderTerminator, lastWasOperand);
            }
        }

        if (check("{")) {
            children.add(parseFnBlock(children));
        } else {
            children.add(leaf(NodeKind.TOKEN, advance()));
        }
        exit();

        log.debug("Parsed fn {} at line {}", nameToken.getValue(), nameToken.getLine());
        return node(NodeKind.FN, start, first, children);
    }

    private void parseAttribute(List<CstNode> out) {
        out.add(leaf(NodeKind.TOKEN, advance()));
        if (check("!")) {
            out.add(leaf(NodeKind.TOKEN, advance()));
        }
        if (!check("[")) {
            throw error("Expected '[' after '#'", peek());
        }
        attributeDepth++;
        out.add(parseGroup("[", "]", NodeKind.BRACKET_EXPR));
        attributeDepth--;
    }

    private boolean isAttributeStart() {
        return check("#") && (peekAt(1).is("[") || (peekAt(1).is("!") && peekAt(2).is("[")));
    }

    private void parseGenerics(List<CstNode> out) {
        int angle = 0;
        do {
            if (isAtEnd()) {
                throw error("Unterminated generic parameter list", peek());
            }
            angle += angleDelta(peek());
            out.add(leaf(NodeKind.TOKEN, advance()));
        } while (angle > 0);
    }

    private CstNode parseClause() {
        enter();
        VerusToken keyword = peek();
        int start = keyword.getTriviaStart();
        NodeKind kind = CLAUSE_KINDS.get(keyword.getValue());
        List<CstNode> children = new ArrayList<>();
        children.add(leaf(NodeKind.TOKEN, advance()));

        List<CstNode> items = new ArrayList<>();
        VerusToken listFirst = peek();
        int listStart = listFirst.getTriviaStart();
        while (!isClauseEnd(peek())) {
            detachComments(peek(), items);
            items.add(parseExpr(this::isClauseItemTerminator));
            if (!check(",")) {
                break;
            }
            detachComments(peek(), items);
            advance();
        }
        String listText = items.isEmpty() ? "" : source.substring(listStart, previous().getEnd());
        children.add(SyntaxNode.builder()
                .kind(NodeKind.COMMA_DELIMITED_EXPRS)
                .text(listText)
                .children(items)
                .line(listFirst.getLine())
                .column(listFirst.getColumn())
                .build());
        exit();
        return node(kind, start, keyword, children);
    }

    private CstNode parseStatement(NodeKind kind) {
        enter();
        VerusToken first = peek();
        int start = first.getTriviaStart();
        List<CstNode> children = new ArrayList<>();
        boolean lastWasOperand = false;

        while (!isAtEnd() && !check("}")) {
            if (check(";")) {
                children.add(leaf(NodeKind.TOKEN, advance()));
                break;
            }
            boolean block = check("{");
            lastWasOperand = parseUnit(children, this::isStatementTerminator, lastWasOperand);
            if (block && !continuesAfterBlock(peek())) {
                break;
            }
        }
        exit();

        if (children.isEmpty()) {
            throw error("Unexpected '" + first.getValue() + "'", first);
        }
        return node(kind, start, first, children);
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    private CstNode parseExpr(Predicate<VerusToken> terminator) {
        enter();
        VerusToken first = peek();
        int start = first.getTriviaStart();
        List<CstNode> children = new ArrayList<>();
        boolean lastWasOperand = false;
        while (!isAtEnd() && !terminator.test(peek())) {
            lastWasOperand = parseUnit(children, terminator, lastWasOperand);
        }
        exit();

        if (children.isEmpty()) {
            throw error("Expected expression but found '" + first.getValue() + "'", first);
        }
        return node(NodeKind.EXPR, start, first, children);
    }

    /**
     * Parse one expression unit into {@code out}.
     *
     * @return whether the unit ends in operand position (so a following '|' is an operator)
     */
    private boolean parseUnit(List<CstNode> out, Predicate<VerusToken> terminator, boolean lastWasOperand) {
        VerusToken t = peek();

        switch (t.getType()) {
            case IDENTIFIER:
                if (KEYWORDS.contains(t.getValue())) {
                    out.add(leaf(NodeKind.TOKEN, advance()));
                    return false;
                }
                parsePathOrCall(out);
                return true;
            case NUMBER:
            case STRING_LITERAL:
            case CHAR_LITERAL:
            case LIFETIME:
                out.add(leaf(NodeKind.TOKEN, advance()));
                return true;
            case EOF:
                throw error("Unexpected end of file", t);
            default:
                break;
        }

        String value = t.getValue();
        if (isAttributeStart()) {
            parseAttribute(out);
            return false;
        }
        if ((value.equals("|") || value.equals("||")) && !lastWasOperand) {
            out.add(parseClosure(out, terminator));
            return true;
        }
        switch (value) {
            case "(":
                out.add(parseGroup("(", ")", NodeKind.PAREN_EXPR));
                return true;
            case "[":
                out.add(parseGroup("[", "]", NodeKind.BRACKET_EXPR));
                return true;
            case "{":
                out.add(parseBlock());
                return true;
            case ")":
            case "]":
            case "}":
                throw error("Unexpected '" + value + "'", t);
            default:
                out.add(leaf(NodeKind.TOKEN, advance()));
                return POSTFIX_OPERATORS.contains(value);
        }
    }

    /**
     * A bare dotted/identifier path, turned into a call expression when an
     * argument list follows directly.
     */
    private void parsePathOrCall(List<CstNode> out) {
        VerusToken first = peek();
        int start = first.getTriviaStart();
        advance();
        while ((check(".") || check("::"))
                && peekAt(1).getType() == TokenType.IDENTIFIER
                && !KEYWORDS.contains(peekAt(1).getValue())
                && !peekAt(1).hasLeadingComments()
                && !peek().hasLeadingComments()) {
            advance();
            advance();
        }

        if (check("(") && attributeDepth == 0) {
            enter();
            // the callee text must be the bare path, so leading comments become sibling leaves
            moveComments(first, out, NodeKind.TOKEN);
            CstNode callee = node(NodeKind.PATH_EXPR_NO_GENERICS, first.getStart(), first, List.of());
            List<CstNode> children = new ArrayList<>();
            children.add(node(NodeKind.EXPR_INNER, first.getStart(), first, List.of(callee)));
            detachComments(peek(), children);
            children.add(parseArgList());
            exit();
            out.add(node(NodeKind.CALL_EXPR, first.getStart(), first, children));
            return;
        }

        out.add(node(NodeKind.PATH_EXPR_NO_GENERICS, start, first, List.of()));
        if (check("!") && (peekAt(1).is("(") || peekAt(1).is("[") || peekAt(1).is("{"))) {
            out.add(leaf(NodeKind.TOKEN, advance()));
            parseUnit(out, token -> false, false);
        }
    }

    private CstNode parseArgList() {
        VerusToken open = expect("(");
        List<CstNode> children = new ArrayList<>();
        while (true) {
            detachComments(peek(), children);
            if (check(")")) {
                break;
            }
            children.add(parseExpr(this::isArgumentTerminator));
            if (!check(",")) {
                break;
            }
            detachComments(peek(), children);
            children.add(leaf(NodeKind.COMMA, advance()));
        }
        detachComments(peek(), children);
        expect(")");
        return node(NodeKind.ARG_LIST, open.getStart(), open, children);
    }

    private CstNode parseClosure(List<CstNode> parentOut, Predicate<VerusToken> terminator) {
        enter();
        detachComments(peek(), parentOut);
        VerusToken first = peek();
        List<CstNode> children = new ArrayList<>();

        if (check("||")) {
            advance();
            children.add(node(NodeKind.CLOSURE_PARAM_LIST, first.getStart(), first, List.of()));
        } else {
            children.add(parseDelimitedParams(NodeKind.CLOSURE_PARAM_LIST, "|", "|"));
        }

        if (check("{")) {
            children.add(parseFnBlock(children));
        } else {
            children.add(parseExpr(terminator));
        }
        exit();
        return node(NodeKind.CLOSURE_EXPR, first.getStart(), first, children);
    }

    /**
     * Parameters are kept as raw text spans; only the separators are structural.
     */
    private CstNode parseDelimitedParams(NodeKind kind, String open, String close) {
        enter();
        VerusToken openToken = expect(open);
        List<CstNode> params = new ArrayList<>();
        while (true) {
            detachComments(peek(), params);
            if (check(close)) {
                break;
            }
            params.add(parseRawParam(close));
            if (!check(",")) {
                break;
            }
            detachComments(peek(), params);
            advance();
        }
        detachComments(peek(), params);
        expect(close);
        exit();
        return node(kind, openToken.getStart(), openToken, params);
    }

    private CstNode parseRawParam(String close) {
        VerusToken first = peek();
        int nesting = 0;
        int angle = 0;
        while (true) {
            VerusToken t = peek();
            if (isAtEnd()) {
                throw error("Unterminated parameter list", first);
            }
            if (nesting == 0 && angle == 0 && (t.is(",") || t.is(close))) {
                break;
            }
            if (t.is("(") || t.is("[") || t.is("{")) {
                nesting++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                if (nesting == 0) {
                    throw error("Unexpected '" + t.getValue() + "' in parameter list", t);
                }
                nesting--;
            } else {
                angle = Math.max(0, angle + angleDelta(t));
            }
            advance();
        }
        if (previous() == null || previous().getEnd() <= first.getStart()) {
            throw error("Expected parameter", first);
        }
        return node(NodeKind.PARAM, first.getStart(), first, List.of());
    }

    private CstNode parseFnBlock(List<CstNode> parentOut) {
        enter();
        detachComments(peek(), parentOut);
        VerusToken open = expect("{");
        List<CstNode> children = new ArrayList<>();
        parseBlockContents(children, open);
        detachComments(peek(), children);
        expect("}");
        exit();
        return node(NodeKind.FN_BLOCK_EXPR, open.getStart(), open, children);
    }

    private CstNode parseBlock() {
        enter();
        VerusToken open = peek();
        int start = open.getTriviaStart();
        List<CstNode> children = new ArrayList<>();
        children.add(leaf(NodeKind.TOKEN, advance()));
        parseBlockContents(children, open);
        children.add(leaf(NodeKind.TOKEN, expect("}")));
        exit();
        return node(NodeKind.BLOCK_EXPR, start, open, children);
    }

    private void parseBlockContents(List<CstNode> out, VerusToken open) {
        while (!check("}")) {
            if (isAtEnd()) {
                throw error("Unterminated block", open);
            }
            parseItem(out, true);
        }
    }

    /**
     * Parenthesized or bracketed group; delimiters and separators are kept as leaves.
     */
    private CstNode parseGroup(String open, String close, NodeKind kind) {
        enter();
        VerusToken openToken = peek();
        int start = openToken.getTriviaStart();
        List<CstNode> children = new ArrayList<>();
        children.add(leaf(NodeKind.TOKEN, advance()));
        Predicate<VerusToken> terminator = t -> t.is(",") || t.is(";") || t.is(close);
        while (!check(close)) {
            if (isAtEnd()) {
                throw error("Unterminated '" + open + "'", openToken);
            }
            if (check(",")) {
                children.add(leaf(NodeKind.COMMA, advance()));
            } else if (check(";")) {
                children.add(leaf(NodeKind.TOKEN, advance()));
            } else {
                children.add(parseExpr(terminator));
            }
        }
        children.add(leaf(NodeKind.TOKEN, advance()));
        exit();
        return node(kind, start, openToken, children);
    }

    // ---------------------------------------------------------------------
    // Lookahead predicates
    // ---------------------------------------------------------------------

    private boolean isMacroBlockStart() {
        return peek().isIdentifier(MACRO_NAME) && peekAt(1).is("!") && peekAt(2).is("{");
    }

    private boolean isFnStart() {
        int i = pos;
        while (true) {
            VerusToken t = tokens.get(i);
            if (t.is("#")) {
                i = skipAttribute(i);
                if (i < 0) {
                    return false;
                }
            } else if (t.getType() == TokenType.IDENTIFIER && FN_MODIFIERS.contains(t.getValue())) {
                i++;
                if (tokens.get(i).is("(")) {
                    i = skipBalanced(i, "(", ")");
                    if (i < 0) {
                        return false;
                    }
                } else if (tokens.get(i).getType() == TokenType.STRING_LITERAL) {
                    i++;
                }
            } else {
                return t.isIdentifier("fn");
            }
        }
    }

    private int skipAttribute(int i) {
        int j = i + 1;
        if (tokens.get(j).is("!")) {
            j++;
        }
        if (!tokens.get(j).is("[")) {
            return -1;
        }
        return skipBalanced(j, "[", "]");
    }

    /** Index just past the delimiter matching the one at {@code i}, or -1. */
    private int skipBalanced(int i, String open, String close) {
        int nesting = 0;
        for (int j = i; j < tokens.size(); j++) {
            VerusToken t = tokens.get(j);
            if (t.is(open)) {
                nesting++;
            } else if (t.is(close)) {
                nesting--;
                if (nesting == 0) {
                    return j + 1;
                }
            } else if (t.getType() == TokenType.EOF) {
                return -1;
            }
        }
        return -1;
    }

    private boolean isHeaderTerminator(VerusToken t) {
        return t.is("{") || t.is(";") || isClauseKeyword(t);
    }

    private boolean isClauseEnd(VerusToken t) {
        return isAtEnd() || t.is("{") || t.is(";") || t.is("}") || isClauseKeyword(t)
                || (t.getType() == TokenType.IDENTIFIER && CLAUSE_STOPS.contains(t.getValue()));
    }

    private boolean isClauseItemTerminator(VerusToken t) {
        return t.is(",") || t.is(")") || t.is("]") || isClauseEnd(t);
    }

    private boolean isArgumentTerminator(VerusToken t) {
        return t.is(",") || t.is(")");
    }

    private boolean isStatementTerminator(VerusToken t) {
        return t.is(";") || t.is("}");
    }

    private static boolean isClauseKeyword(VerusToken t) {
        return t.getType() == TokenType.IDENTIFIER && CLAUSE_KINDS.containsKey(t.getValue());
    }

    private static boolean continuesAfterBlock(VerusToken t) {
        return t.getType() != TokenType.EOF && t.getType() != TokenType.COMMENT
                && BLOCK_CONTINUATIONS.contains(t.getValue());
    }

    private static int angleDelta(VerusToken t) {
        if (t.getType() != TokenType.PUNCT) {
            return 0;
        }
        switch (t.getValue()) {
            case "<":
                return 1;
            case "<<":
                return 2;
            case ">":
                return -1;
            case ">>":
                return -2;
            default:
                return 0;
        }
    }

    // ---------------------------------------------------------------------
    // Node construction
    // ---------------------------------------------------------------------

    /**
     * Leaf spanning the token and any comments still attached to it.
     */
    private CstNode leaf(NodeKind kind, VerusToken token) {
        int start = token.getTriviaStart();
        VerusToken locator = token.hasLeadingComments() ? token.getLeadingComments().get(0) : token;
        return SyntaxNode.builder()
                .kind(kind)
                .text(source.substring(start, token.getEnd()))
                .line(locator.getLine())
                .column(locator.getColumn())
                .build();
    }

    /**
     * Node from {@code start} to the end of the last consumed token.
     */
    private CstNode node(NodeKind kind, int start, VerusToken locator, List<CstNode> children) {
        int end = previous().getEnd();
        return SyntaxNode.builder()
                .kind(kind)
                .text(source.substring(start, Math.max(start, end)))
                .children(children)
                .line(locator.getLine())
                .column(locator.getColumn())
                .build();
    }

    private void detachComments(VerusToken token, List<CstNode> out) {
        moveComments(token, out, NodeKind.COMMENT);
    }

    /**
     * Move the comments in front of {@code token} into {@code out}. COMMENT nodes
     * hold the bare comment; any other kind is emitted as text, so it spans up to
     * the next comment or the token and keeps the line break that ends a
     * {@code //} comment.
     */
    private void moveComments(VerusToken token, List<CstNode> out, NodeKind kind) {
        List<VerusToken> comments = token.getLeadingComments();
        for (int i = 0; i < comments.size(); i++) {
            VerusToken comment = comments.get(i);
            String text = comment.getValue();
            if (kind != NodeKind.COMMENT) {
                int end = i + 1 < comments.size() ? comments.get(i + 1).getStart() : token.getStart();
                text = source.substring(comment.getStart(), end);
            }
            out.add(SyntaxNode.builder()
                    .kind(kind)
                    .text(text)
                    .line(comment.getLine())
                    .column(comment.getColumn())
                    .build());
        }
        comments.clear();
    }

    // ---------------------------------------------------------------------
    // Token cursor
    // ---------------------------------------------------------------------

    private void enter() {
        depth++;
        if (depth > maxDepth) {
            throw error("Nesting depth exceeds limit of " + maxDepth, peek());
        }
    }

    private void exit() {
        depth--;
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private VerusToken peek() {
        return tokens.get(pos);
    }

    private VerusToken peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private VerusToken previous() {
        return pos > 0 ? tokens.get(pos - 1) : null;
    }

    private VerusToken advance() {
        if (!isAtEnd()) {
            pos++;
        }
        return previous();
    }

    private boolean check(String value) {
        return !isAtEnd() && peek().is(value);
    }

    private VerusToken expect(String value) {
        if (!check(value)) {
            VerusToken t = peek();
            String found = t.getType() == TokenType.EOF ? "end of file" : "'" + t.getValue() + "'";
            throw error("Expected '" + value + "' but found " + found, t);
        }
        return advance();
    }

    private ParseException error(String message, VerusToken at) {
        return new ParseException(fileName + ": " + message, at.getLine(), at.getColumn());
    }
}
