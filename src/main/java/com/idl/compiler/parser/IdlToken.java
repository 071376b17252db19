package com.idl.compiler.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the IDL tokenizer.
 */
@Data
@AllArgsConstructor
public class IdlToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        INCLUDE,
        NAMESPACE,
        TYPEDEF,
        ENUM,
        CONST,
        STRUCT,
        UNION,
        EXCEPTION,
        SERVICE,
        EXTENDS,
        ONEWAY,
        VOID,
        THROWS,
        REQUIRED,
        OPTIONAL,
        MAP,
        LIST,
        SET,
        TRUE,
        FALSE,
        IDENTIFIER,
        INT_LITERAL,
        DOUBLE_LITERAL,
        STRING_LITERAL,
        LBRACE,
        RBRACE,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LANGLE,
        RANGLE,
        COMMA,
        SEMICOLON,
        COLON,
        EQUALS,
        EOF,
        UNKNOWN
    }

    public boolean isListSeparator() {
        return type == TokenType.COMMA || type == TokenType.SEMICOLON;
    }

    public boolean isDefinitionKeyword() {
        return type == TokenType.TYPEDEF || type == TokenType.ENUM ||
               type == TokenType.CONST || type == TokenType.STRUCT ||
               type == TokenType.UNION || type == TokenType.EXCEPTION ||
               type == TokenType.SERVICE;
    }
}
