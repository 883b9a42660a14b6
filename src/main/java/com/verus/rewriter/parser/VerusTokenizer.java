package com.verus.rewriter.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.parser.VerusToken.TokenType;

/**
 * Tokenizer for Verus source files.
 */
public class VerusTokenizer {
    private static final Logger log = LoggerFactory.getLogger(VerusTokenizer.class);

    // longest first; "<<" and ">>" stay whole, generic nesting is counted per character by the parser
    private static final List<String> OPERATORS = List.of(
            "<==>", "===", "!==", "==>", "<==", "&&&", "|||", "...", "..=",
            "::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||", "..",
            "+=", "-=", "*=", "/=", "%=", "<<", ">>"
    );

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private VerusToken lastToken;

    public VerusTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the whole source. The returned list always ends with an EOF token
     * that carries any trailing comments.
     */
    public List<VerusToken> tokenize() {
        List<VerusToken> tokens = new ArrayList<>();
        List<VerusToken> pendingComments = new ArrayList<>();

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            if (c == '/' && peekChar(1) == '/') {
                pendingComments.add(readLineComment());
                continue;
            }

            if (c == '/' && peekChar(1) == '*') {
                pendingComments.add(readBlockComment());
                continue;
            }

            VerusToken token = readToken();
            token.getLeadingComments().addAll(pendingComments);
            pendingComments.clear();
            tokens.add(token);
            lastToken = token;
        }

        VerusToken eof = new VerusToken(TokenType.EOF, "", line, column, pos, pos);
        eof.getLeadingComments().addAll(pendingComments);
        tokens.add(eof);

        log.debug("Tokenized {}: {} tokens", fileName, tokens.size());
        return tokens;
    }

    private VerusToken readToken() {
        char c = source.charAt(pos);

        if ((c == 'r' && isRawStringStart()) || (c == 'b' && peekChar(1) == 'r' && isRawStringStartAt(pos + 1))) {
            return readRawString();
        }
        if (c == 'b' && peekChar(1) == '"') {
            return readString(1);
        }
        if (c == 'b' && peekChar(1) == '\'') {
            return readCharLiteral(1);
        }
        if (isIdentifierStart(c)) {
            return readIdentifier();
        }
        if (Character.isDigit(c)) {
            return readNumber();
        }
        if (c == '"') {
            return readString(0);
        }
        if (c == '\'') {
            return readQuote();
        }
        return readPunct();
    }

    private VerusToken readLineComment() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        while (pos < source.length() && source.charAt(pos) != '\n') {
            advance();
        }
        return new VerusToken(TokenType.COMMENT, source.substring(start, pos), startLine, startColumn, start, pos);
    }

    private VerusToken readBlockComment() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        int nesting = 0;
        while (pos < source.length()) {
            if (source.startsWith("/*", pos)) {
                nesting++;
                advance();
                advance();
            } else if (source.startsWith("*/", pos)) {
                nesting--;
                advance();
                advance();
                if (nesting == 0) {
                    return new VerusToken(TokenType.COMMENT, source.substring(start, pos), startLine, startColumn,
                            start, pos);
                }
            } else {
                advance();
            }
        }
        throw new ParseException("Unterminated block comment", startLine, startColumn);
    }

    private VerusToken readIdentifier() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
        return new VerusToken(TokenType.IDENTIFIER, source.substring(start, pos), startLine, startColumn, start, pos);
    }

    private VerusToken readNumber() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        consumeAlphanumeric();

        // a tuple index such as t.0 never takes a fraction
        boolean afterDot = lastToken != null && lastToken.is(".");
        if (!afterDot && pos < source.length() && source.charAt(pos) == '.' && Character.isDigit(peekChar(1))) {
            advance();
            consumeAlphanumeric();
        }
        return new VerusToken(TokenType.NUMBER, source.substring(start, pos), startLine, startColumn, start, pos);
    }

    private VerusToken readString(int prefixLength) {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        for (int i = 0; i <= prefixLength; i++) {
            advance();
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < source.length()) {
                    advance();
                }
            } else if (c == '"') {
                advance();
                return new VerusToken(TokenType.STRING_LITERAL, source.substring(start, pos), startLine, startColumn,
                        start, pos);
            } else {
                advance();
            }
        }
        throw new ParseException("Unterminated string literal", startLine, startColumn);
    }

    private VerusToken readRawString() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        while (source.charAt(pos) != '#' && source.charAt(pos) != '"') {
            advance();
        }
        int hashes = 0;
        while (source.charAt(pos) == '#') {
            hashes++;
            advance();
        }
        advance();
        String terminator = "\"" + "#".repeat(hashes);
        int close = source.indexOf(terminator, pos);
        if (close < 0) {
            throw new ParseException("Unterminated raw string literal", startLine, startColumn);
        }
        while (pos < close + terminator.length()) {
            advance();
        }
        return new VerusToken(TokenType.STRING_LITERAL, source.substring(start, pos), startLine, startColumn, start,
                pos);
    }

    /**
     * A quote starts either a char literal ('a', '\n') or a lifetime ('static).
     */
    private VerusToken readQuote() {
        if (peekChar(1) == '\\' || (peekChar(2) == '\'' && peekChar(1) != '\'')) {
            return readCharLiteral(0);
        }
        if (isIdentifierStart(peekChar(1))) {
            int startLine = line;
            int startColumn = column;
            int start = pos;
            advance();
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                advance();
            }
            return new VerusToken(TokenType.LIFETIME, source.substring(start, pos), startLine, startColumn, start,
                    pos);
        }
        return readPunct();
    }

    private VerusToken readCharLiteral(int prefixLength) {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        for (int i = 0; i <= prefixLength; i++) {
            advance();
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < source.length()) {
                    advance();
                }
            } else if (c == '\'') {
                advance();
                return new VerusToken(TokenType.CHAR_LITERAL, source.substring(start, pos), startLine, startColumn,
                        start, pos);
            } else if (c == '\n') {
                break;
            } else {
                advance();
            }
        }
        throw new ParseException("Unterminated character literal", startLine, startColumn);
    }

    private VerusToken readPunct() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                return new VerusToken(TokenType.PUNCT, op, startLine, startColumn, start, pos);
            }
        }
        advance();
        return new VerusToken(TokenType.PUNCT, source.substring(start, pos), startLine, startColumn, start, pos);
    }

    private boolean isRawStringStart() {
        return isRawStringStartAt(pos);
    }

    private boolean isRawStringStartAt(int at) {
        int i = at + 1;
        while (i < source.length() && source.charAt(i) == '#') {
            i++;
        }
        return i < source.length() && source.charAt(i) == '"';
    }

    private void consumeAlphanumeric() {
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
    }

    private char peekChar(int offset) {
        int at = pos + offset;
        return at < source.length() ? source.charAt(at) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
