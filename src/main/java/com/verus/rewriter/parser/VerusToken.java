package com.verus.rewriter.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the Verus tokenizer.
 *
 * Comments are not tokens of their own in the stream; they ride along as
 * leading trivia of the token that follows them.
 */
@Data
@AllArgsConstructor
public class VerusToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;
    private int start;
    private int end;
    private List<VerusToken> leadingComments;

    public enum TokenType {
        IDENTIFIER,
        NUMBER,
        STRING_LITERAL,
        CHAR_LITERAL,
        LIFETIME,
        PUNCT,
        COMMENT,
        EOF
    }

    public VerusToken(TokenType type, String value, int line, int column, int start, int end) {
        this(type, value, line, column, start, end, new ArrayList<>());
    }

    /**
     * Offset where this token's text begins, including leading comments still attached to it.
     */
    public int getTriviaStart() {
        return leadingComments.isEmpty() ? start : leadingComments.get(0).getStart();
    }

    public boolean hasLeadingComments() {
        return !leadingComments.isEmpty();
    }

    public boolean is(String text) {
        return type != TokenType.COMMENT && type != TokenType.STRING_LITERAL
                && type != TokenType.CHAR_LITERAL && value.equals(text);
    }

    public boolean isIdentifier(String text) {
        return type == TokenType.IDENTIFIER && value.equals(text);
    }
}
