package com.idl.compiler.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.idl.compiler.model.BaseType;
import com.idl.compiler.model.BaseTypeNode;
import com.idl.compiler.model.ConstantDefinition;
import com.idl.compiler.model.ConstantList;
import com.idl.compiler.model.ConstantLiteral;
import com.idl.compiler.model.ConstantMap;
import com.idl.compiler.model.ConstantReference;
import com.idl.compiler.model.ConstantValue;
import com.idl.compiler.model.Definition;
import com.idl.compiler.model.EnumDefinition;
import com.idl.compiler.model.EnumItemNode;
import com.idl.compiler.model.FieldNode;
import com.idl.compiler.model.FunctionNode;
import com.idl.compiler.model.IncludeNode;
import com.idl.compiler.model.ListTypeNode;
import com.idl.compiler.model.MapTypeNode;
import com.idl.compiler.model.Program;
import com.idl.compiler.model.Requiredness;
import com.idl.compiler.model.ServiceDefinition;
import com.idl.compiler.model.SetTypeNode;
import com.idl.compiler.model.StructDefinition;
import com.idl.compiler.model.StructKind;
import com.idl.compiler.model.TypeNode;
import com.idl.compiler.model.TypeReferenceNode;
import com.idl.compiler.model.TypedefDefinition;
import com.idl.compiler.parser.IdlToken.TokenType;

/**
 * Recursive-descent parser for IDL files.
 * Converts tokens into a {@link Program} of definitions.
 *
 * Parsing only:
 * - Builds the syntax tree with source lines
 * - Collects include and namespace headers
 *
 * It does NOT check name uniqueness or resolve references; that is the compiler's job.
 * The first syntax error aborts parsing.
 */
public class IdlParser {
    private static final Logger log = LoggerFactory.getLogger(IdlParser.class);

    private final List<IdlToken> tokens;
    private final String fileName;
    private int pos = 0;

    public IdlParser(List<IdlToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    /**
     * Tokenize and parse source text in one step.
     */
    public static Program parse(String source, String fileName) {
        IdlTokenizer tokenizer = new IdlTokenizer(source, fileName);
        return new IdlParser(tokenizer.tokenize(), fileName).parse();
    }

    public Program parse() {
        Program program = Program.builder()
                .sourceFile(fileName)
                .build();

        while (!isAtEnd()) {
            IdlToken token = peek();

            if (token.getType() == TokenType.INCLUDE) {
                program.getIncludes().add(parseInclude());
            } else if (token.getType() == TokenType.NAMESPACE) {
                parseNamespace(program);
            } else if (token.isDefinitionKeyword()) {
                Definition definition = parseDefinition();
                program.getDefinitions().add(definition);
                log.debug("Parsed {} at line {}", definition.getName(), definition.getSourceLine());
            } else {
                throw error("Expected a definition but found '" + token.getValue() + "'");
            }
        }

        return program;
    }

    private IncludeNode parseInclude() {
        IdlToken keyword = expect(TokenType.INCLUDE);
        String path = expect(TokenType.STRING_LITERAL).getValue();
        skipSeparator();
        return new IncludeNode(path, keyword.getLine());
    }

    private void parseNamespace(Program program) {
        expect(TokenType.NAMESPACE);
        String scope = check(TokenType.UNKNOWN) && peek().getValue().equals("*")
                ? advance().getValue()
                : expectIdentifier();
        String name = expectIdentifier();
        program.getNamespaces().put(scope, name);
        skipSeparator();
    }

    private Definition parseDefinition() {
        IdlToken keyword = advance();
        int startLine = keyword.getLine();

        Definition definition = switch (keyword.getType()) {
            case TYPEDEF -> parseTypedef(startLine);
            case ENUM -> parseEnum(startLine);
            case CONST -> parseConstant(startLine);
            case STRUCT -> parseStruct(StructKind.STRUCT, startLine);
            case UNION -> parseStruct(StructKind.UNION, startLine);
            case EXCEPTION -> parseStruct(StructKind.EXCEPTION, startLine);
            case SERVICE -> parseService(startLine);
            default -> throw error("Unexpected '" + keyword.getValue() + "'");
        };

        skipSeparator();
        return definition;
    }

    private TypedefDefinition parseTypedef(int startLine) {
        TypeNode target = parseType();
        String name = expectIdentifier();

        return TypedefDefinition.builder()
                .name(name)
                .target(target)
                .sourceLine(startLine)
                .build();
    }

    private EnumDefinition parseEnum(int startLine) {
        String name = expectIdentifier();
        expect(TokenType.LBRACE);

        List<EnumItemNode> items = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            IdlToken itemToken = expect(TokenType.IDENTIFIER);
            Integer value = null;
            if (check(TokenType.EQUALS)) {
                advance();
                value = parseInt(expect(TokenType.INT_LITERAL));
            }
            items.add(EnumItemNode.builder()
                    .name(itemToken.getValue())
                    .value(value)
                    .sourceLine(itemToken.getLine())
                    .build());
            skipSeparator();
        }
        expect(TokenType.RBRACE);

        return EnumDefinition.builder()
                .name(name)
                .items(items)
                .sourceLine(startLine)
                .build();
    }

    private ConstantDefinition parseConstant(int startLine) {
        TypeNode type = parseType();
        String name = expectIdentifier();
        expect(TokenType.EQUALS);
        ConstantValue value = parseConstantValue();

        return ConstantDefinition.builder()
                .name(name)
                .type(type)
                .value(value)
                .sourceLine(startLine)
                .build();
    }

    private StructDefinition parseStruct(StructKind kind, int startLine) {
        String name = expectIdentifier();
        expect(TokenType.LBRACE);
        List<FieldNode> fields = parseFields(TokenType.RBRACE);
        expect(TokenType.RBRACE);

        return StructDefinition.builder()
                .name(name)
                .kind(kind)
                .fields(fields)
                .sourceLine(startLine)
                .build();
    }

    private ServiceDefinition parseService(int startLine) {
        String name = expectIdentifier();

        String parentName = null;
        int parentLine = 0;
        if (check(TokenType.EXTENDS)) {
            advance();
            IdlToken parent = expect(TokenType.IDENTIFIER);
            parentName = parent.getValue();
            parentLine = parent.getLine();
        }

        expect(TokenType.LBRACE);
        List<FunctionNode> functions = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            functions.add(parseFunction());
        }
        expect(TokenType.RBRACE);

        return ServiceDefinition.builder()
                .name(name)
                .parentName(parentName)
                .parentLine(parentLine)
                .functions(functions)
                .sourceLine(startLine)
                .build();
    }

    private FunctionNode parseFunction() {
        int startLine = peek().getLine();

        boolean oneWay = false;
        if (check(TokenType.ONEWAY)) {
            advance();
            oneWay = true;
        }

        TypeNode returnType = null;
        if (check(TokenType.VOID)) {
            advance();
        } else {
            returnType = parseType();
        }

        String name = expectIdentifier();

        expect(TokenType.LPAREN);
        List<FieldNode> arguments = parseFields(TokenType.RPAREN);
        expect(TokenType.RPAREN);

        List<FieldNode> exceptions = new ArrayList<>();
        if (check(TokenType.THROWS)) {
            advance();
            expect(TokenType.LPAREN);
            exceptions = parseFields(TokenType.RPAREN);
            expect(TokenType.RPAREN);
        }

        skipSeparator();

        return FunctionNode.builder()
                .name(name)
                .returnType(returnType)
                .arguments(arguments)
                .exceptions(exceptions)
                .oneWay(oneWay)
                .sourceLine(startLine)
                .build();
    }

    private List<FieldNode> parseFields(TokenType terminator) {
        List<FieldNode> fields = new ArrayList<>();
        while (!check(terminator)) {
            if (isAtEnd()) {
                throw error("Expected '" + terminator + "' but reached end of input");
            }
            fields.add(parseField());
        }
        return fields;
    }

    private FieldNode parseField() {
        int startLine = peek().getLine();

        Integer id = null;
        if (check(TokenType.INT_LITERAL) && peekNext().getType() == TokenType.COLON) {
            id = parseInt(advance());
            advance();
        }

        Requiredness requiredness = Requiredness.UNSPECIFIED;
        if (check(TokenType.REQUIRED)) {
            advance();
            requiredness = Requiredness.REQUIRED;
        } else if (check(TokenType.OPTIONAL)) {
            advance();
            requiredness = Requiredness.OPTIONAL;
        }

        TypeNode type = parseType();
        String name = expectIdentifier();

        ConstantValue defaultValue = null;
        if (check(TokenType.EQUALS)) {
            advance();
            defaultValue = parseConstantValue();
        }

        skipSeparator();

        return FieldNode.builder()
                .id(id)
                .name(name)
                .requiredness(requiredness)
                .type(type)
                .defaultValue(defaultValue)
                .sourceLine(startLine)
                .build();
    }

    private TypeNode parseType() {
        IdlToken token = peek();
        int line = token.getLine();

        switch (token.getType()) {
            case MAP -> {
                advance();
                expect(TokenType.LANGLE);
                TypeNode keyType = parseType();
                expect(TokenType.COMMA);
                TypeNode valueType = parseType();
                expect(TokenType.RANGLE);
                return new MapTypeNode(keyType, valueType, line);
            }
            case LIST -> {
                advance();
                expect(TokenType.LANGLE);
                TypeNode elementType = parseType();
                expect(TokenType.RANGLE);
                return new ListTypeNode(elementType, line);
            }
            case SET -> {
                advance();
                expect(TokenType.LANGLE);
                TypeNode elementType = parseType();
                expect(TokenType.RANGLE);
                return new SetTypeNode(elementType, line);
            }
            case IDENTIFIER -> {
                advance();
                return BaseType.fromKeyword(token.getValue())
                        .<TypeNode>map(baseType -> new BaseTypeNode(baseType, line))
                        .orElseGet(() -> new TypeReferenceNode(token.getValue(), line));
            }
            default -> throw error("Expected a type but found '" + token.getValue() + "'");
        }
    }

    private ConstantValue parseConstantValue() {
        IdlToken token = peek();
        int line = token.getLine();

        switch (token.getType()) {
            case INT_LITERAL -> {
                advance();
                try {
                    return new ConstantLiteral(Long.parseLong(token.getValue()), line);
                } catch (NumberFormatException e) {
                    throw new ParseException("Integer literal out of range: " + token.getValue(),
                            token.getLine(), token.getColumn());
                }
            }
            case DOUBLE_LITERAL -> {
                advance();
                return new ConstantLiteral(Double.parseDouble(token.getValue()), line);
            }
            case STRING_LITERAL -> {
                advance();
                return new ConstantLiteral(token.getValue(), line);
            }
            case TRUE, FALSE -> {
                advance();
                return new ConstantLiteral(token.getType() == TokenType.TRUE, line);
            }
            case IDENTIFIER -> {
                advance();
                return new ConstantReference(token.getValue(), line);
            }
            case LBRACKET -> {
                advance();
                List<ConstantValue> items = new ArrayList<>();
                while (!check(TokenType.RBRACKET)) {
                    items.add(parseConstantValue());
                    skipSeparator();
                }
                expect(TokenType.RBRACKET);
                return new ConstantList(items, line);
            }
            case LBRACE -> {
                advance();
                List<ConstantMap.Entry> entries = new ArrayList<>();
                while (!check(TokenType.RBRACE)) {
                    ConstantValue key = parseConstantValue();
                    expect(TokenType.COLON);
                    ConstantValue value = parseConstantValue();
                    entries.add(new ConstantMap.Entry(key, value));
                    skipSeparator();
                }
                expect(TokenType.RBRACE);
                return new ConstantMap(entries, line);
            }
            default -> throw error("Expected a constant value but found '" + token.getValue() + "'");
        }
    }

    private int parseInt(IdlToken token) {
        try {
            return Integer.parseInt(token.getValue());
        } catch (NumberFormatException e) {
            throw new ParseException("Integer out of range: " + token.getValue(), token.getLine(), token.getColumn());
        }
    }

    private void skipSeparator() {
        if (!isAtEnd() && peek().isListSeparator()) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private IdlToken peek() {
        return tokens.get(pos);
    }

    private IdlToken peekNext() {
        return pos + 1 < tokens.size() ? tokens.get(pos + 1) : tokens.get(tokens.size() - 1);
    }

    private IdlToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private IdlToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private IdlToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + type + " but found " + describe(peek()));
    }

    private String expectIdentifier() {
        return expect(TokenType.IDENTIFIER).getValue();
    }

    private String describe(IdlToken token) {
        return token.getType() == TokenType.EOF ? "end of input" : "'" + token.getValue() + "'";
    }

    private ParseException error(String message) {
        IdlToken token = peek();
        return new ParseException(message + " in " + fileName, token.getLine(), token.getColumn());
    }
}
