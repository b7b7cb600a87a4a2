package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.exception.DiagramSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits DOT text into tokens. Skips line comments, block comments and {@code #} lines.
 */
class DotLexer {

    private final String input;
    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean lineHasContent;

    DotLexer(String input) {
        this.input = input;
    }

    List<DotToken> tokenize() {
        List<DotToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                tokens.add(new DotToken(DotToken.Type.EOF, "", line, column));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private DotToken nextToken() {
        int startLine = line;
        int startColumn = column;
        char c = input.charAt(pos);
        lineHasContent = true;

        switch (c) {
            case '{':
                advance();
                return new DotToken(DotToken.Type.LBRACE, "{", startLine, startColumn);
            case '}':
                advance();
                return new DotToken(DotToken.Type.RBRACE, "}", startLine, startColumn);
            case '[':
                advance();
                return new DotToken(DotToken.Type.LBRACKET, "[", startLine, startColumn);
            case ']':
                advance();
                return new DotToken(DotToken.Type.RBRACKET, "]", startLine, startColumn);
            case '=':
                advance();
                return new DotToken(DotToken.Type.EQUALS, "=", startLine, startColumn);
            case ';':
                advance();
                return new DotToken(DotToken.Type.SEMICOLON, ";", startLine, startColumn);
            case ',':
                advance();
                return new DotToken(DotToken.Type.COMMA, ",", startLine, startColumn);
            case ':':
                advance();
                return new DotToken(DotToken.Type.COLON, ":", startLine, startColumn);
            case '"':
                return quoted(startLine, startColumn);
            case '-':
                return dash(startLine, startColumn);
            default:
                if (isIdentifierChar(c)) {
                    return identifier(startLine, startColumn);
                }
                throw new DiagramSyntaxException("Unexpected character '" + c + "'", startLine, startColumn);
        }
    }

    private DotToken dash(int startLine, int startColumn) {
        char next = peek(1);
        if (next == '>') {
            advance();
            advance();
            return new DotToken(DotToken.Type.ARROW, "->", startLine, startColumn);
        }
        if (next == '-') {
            advance();
            advance();
            return new DotToken(DotToken.Type.UNDIRECTED, "--", startLine, startColumn);
        }
        if (Character.isDigit(next) || next == '.') {
            advance();
            DotToken numeral = identifier(startLine, startColumn);
            return new DotToken(DotToken.Type.ID, "-" + numeral.getText(), startLine, startColumn);
        }
        throw new DiagramSyntaxException("Unknown edge operator starting with '-'", startLine, startColumn);
    }

    private DotToken identifier(int startLine, int startColumn) {
        int start = pos;
        while (pos < input.length() && isIdentifierChar(input.charAt(pos))) {
            advance();
        }
        return new DotToken(DotToken.Type.ID, input.substring(start, pos), startLine, startColumn);
    }

    private DotToken quoted(int startLine, int startColumn) {
        advance(); // opening quote
        StringBuilder text = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                advance();
                return new DotToken(DotToken.Type.QUOTED, text.toString(), startLine, startColumn);
            }
            if (c == '\\' && pos + 1 < input.length()) {
                char escaped = input.charAt(pos + 1);
                if (escaped == '"') {
                    text.append('"');
                    advance();
                    advance();
                    continue;
                }
                if (escaped == '\n') {
                    // line continuation
                    advance();
                    advance();
                    continue;
                }
            }
            text.append(c);
            advance();
        }
        throw new DiagramSyntaxException("Unterminated quoted string", startLine, startColumn);
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#' && !lineHasContent) {
                skipToEndOfLine();
            } else if (c == '/' && peek(1) == '/') {
                skipToEndOfLine();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startColumn = column;
        int end = input.indexOf("*/", pos + 2);
        if (end < 0) {
            throw new DiagramSyntaxException("Unterminated block comment", startLine, startColumn);
        }
        while (pos < end + 2) {
            advance();
        }
    }

    private void skipToEndOfLine() {
        while (pos < input.length() && input.charAt(pos) != '\n') {
            advance();
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
            lineHasContent = false;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
