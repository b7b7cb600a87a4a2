package com.architecture.dotspace.service.diagram.parser;

import lombok.Value;

import java.util.Locale;

/**
 * Lexical token of the DOT dialect.
 */
@Value
public class DotToken {

    public enum Type {
        ID,             // bare identifier or numeral
        QUOTED,         // double-quoted string, quotes removed and escapes resolved
        ARROW,          // ->
        UNDIRECTED,     // --
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        EQUALS,
        SEMICOLON,
        COMMA,
        COLON,
        EOF
    }

    Type type;
    String text;
    int line;
    int column;

    public boolean is(Type expected) {
        return type == expected;
    }

    /**
     * Keywords are case-insensitive and only recognised on bare identifiers, so {@code "node"} is a node name.
     */
    public boolean isKeyword(String keyword) {
        return type == Type.ID && text.toLowerCase(Locale.ROOT).equals(keyword);
    }

    public boolean isIdentifier() {
        return type == Type.ID || type == Type.QUOTED;
    }

    public boolean isEdgeOperator() {
        return type == Type.ARROW || type == Type.UNDIRECTED;
    }

    public String describe() {
        return type == Type.EOF ? "end of input" : "'" + text + "'";
    }
}
