package com.idl.compiler.parser;

import com.idl.compiler.parser.IdlToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for IDL source files.
 */
public class IdlTokenizer {
    private static final Logger log = LoggerFactory.getLogger(IdlTokenizer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("include", TokenType.INCLUDE),
        Map.entry("namespace", TokenType.NAMESPACE),
        Map.entry("typedef", TokenType.TYPEDEF),
        Map.entry("enum", TokenType.ENUM),
        Map.entry("const", TokenType.CONST),
        Map.entry("struct", TokenType.STRUCT),
        Map.entry("union", TokenType.UNION),
        Map.entry("exception", TokenType.EXCEPTION),
        Map.entry("service", TokenType.SERVICE),
        Map.entry("extends", TokenType.EXTENDS),
        Map.entry("oneway", TokenType.ONEWAY),
        Map.entry("void", TokenType.VOID),
        Map.entry("throws", TokenType.THROWS),
        Map.entry("required", TokenType.REQUIRED),
        Map.entry("optional", TokenType.OPTIONAL),
        Map.entry("map", TokenType.MAP),
        Map.entry("list", TokenType.LIST),
        Map.entry("set", TokenType.SET),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE)
    );

    private static final Map<Character, TokenType> PUNCTUATION = Map.ofEntries(
        Map.entry('{', TokenType.LBRACE),
        Map.entry('}', TokenType.RBRACE),
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry('<', TokenType.LANGLE),
        Map.entry('>', TokenType.RANGLE),
        Map.entry(',', TokenType.COMMA),
        Map.entry(';', TokenType.SEMICOLON),
        Map.entry(':', TokenType.COLON),
        Map.entry('=', TokenType.EQUALS)
    );

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public IdlTokenizer(String source, String fileName) {
        this.source = source.replace("\r\n", "\n");
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file.
     */
    public List<IdlToken> tokenize() {
        List<IdlToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                break;
            }

            tokens.add(nextToken());
        }

        tokens.add(new IdlToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {}: {} tokens", fileName, tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                column++;
                pos++;
            } else if (c == '#' || (c == '/' && peekChar(1) == '/')) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                    column++;
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startCol = column;
        pos += 2;
        column += 2;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '*' && peekChar(1) == '/') {
                pos += 2;
                column += 2;
                return;
            }
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }

        throw new ParseException("Unterminated comment in " + fileName, startLine, startCol);
    }

    private IdlToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        TokenType punctuation = PUNCTUATION.get(c);
        if (punctuation != null) {
            pos++;
            column++;
            return new IdlToken(punctuation, String.valueOf(c), startLine, startCol);
        }

        if (c == '\'' || c == '"') {
            return readStringLiteral(c, startLine, startCol);
        }

        if (Character.isDigit(c) || ((c == '-' || c == '+') && Character.isDigit(peekChar(1)))) {
            return readNumber(startLine, startCol);
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword(startLine, startCol);
        }

        // Unknown character; the parser reports it
        pos++;
        column++;
        return new IdlToken(TokenType.UNKNOWN, String.valueOf(c), startLine, startCol);
    }

    private IdlToken readStringLiteral(char quote, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote
        column++;

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == quote) {
                pos++;
                column++;
                return new IdlToken(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                sb.append(unescape(source.charAt(pos + 1)));
                pos += 2;
                column += 2;
            } else {
                sb.append(c);
                pos++;
                column++;
            }
        }

        throw new ParseException("Unterminated string literal", startLine, startCol);
    }

    private char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    private IdlToken readNumber(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean isDouble = false;

        if (source.charAt(pos) == '-' || source.charAt(pos) == '+') {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }

        if (source.charAt(pos) == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
            pos += 2;
            column += 2;
            StringBuilder hex = new StringBuilder();
            while (pos < source.length() && Character.digit(source.charAt(pos), 16) >= 0) {
                hex.append(source.charAt(pos));
                pos++;
                column++;
            }
            if (hex.length() == 0) {
                throw new ParseException("Malformed hexadecimal literal", startLine, startCol);
            }
            long value = Long.parseLong(hex.toString(), 16);
            String sign = sb.toString().equals("-") ? "-" : "";
            return new IdlToken(TokenType.INT_LITERAL, sign + value, startLine, startCol);
        }

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                sb.append(c);
            } else if (c == '.' && !isDouble && Character.isDigit(peekChar(1))) {
                sb.append(c);
                isDouble = true;
            } else if ((c == 'e' || c == 'E') && isExponentStart()) {
                sb.append(c);
                isDouble = true;
                if (peekChar(1) == '-' || peekChar(1) == '+') {
                    pos++;
                    column++;
                    sb.append(source.charAt(pos));
                }
            } else {
                break;
            }
            pos++;
            column++;
        }

        return new IdlToken(isDouble ? TokenType.DOUBLE_LITERAL : TokenType.INT_LITERAL,
                sb.toString(), startLine, startCol);
    }

    private boolean isExponentStart() {
        char next = peekChar(1);
        return Character.isDigit(next) || ((next == '-' || next == '+') && Character.isDigit(peekChar(2)));
    }

    private IdlToken readIdentifierOrKeyword(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                sb.append(c);
                pos++;
                column++;
            } else {
                break;
            }
        }

        String value = sb.toString();

        TokenType keywordType = KEYWORDS.get(value);
        if (keywordType != null) {
            return new IdlToken(keywordType, value, startLine, startCol);
        }

        return new IdlToken(TokenType.IDENTIFIER, value, startLine, startCol);
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }
}
