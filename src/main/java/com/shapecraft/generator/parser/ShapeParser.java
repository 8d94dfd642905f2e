package com.shapecraft.generator.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.model.BinaryNode;
import com.shapecraft.generator.model.BinaryOperator;
import com.shapecraft.generator.model.CaptureDeclaration;
import com.shapecraft.generator.model.CaptureNode;
import com.shapecraft.generator.model.CoalesceNode;
import com.shapecraft.generator.model.ConditionalNode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.IdentifierNode;
import com.shapecraft.generator.model.LambdaNode;
import com.shapecraft.generator.model.LiteralKind;
import com.shapecraft.generator.model.LiteralNode;
import com.shapecraft.generator.model.MemberAccessNode;
import com.shapecraft.generator.model.MethodCallNode;
import com.shapecraft.generator.model.ParameterNode;
import com.shapecraft.generator.model.ProjectionDeclaration;
import com.shapecraft.generator.model.ShapeEntry;
import com.shapecraft.generator.model.ShapeFile;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.model.SourcePosition;
import com.shapecraft.generator.model.TypeExpr;
import com.shapecraft.generator.model.UnaryNode;
import com.shapecraft.generator.model.UnaryOperator;
import com.shapecraft.generator.parser.ShapeToken.TokenType;
import com.shapecraft.generator.parser.exception.ParseException;

/**
 * Recursive-descent parser for shape files.
 *
 * Parsing only:
 * - Builds the expression tree of every projection
 * - Classifies identifiers as parameters, captures or plain identifiers
 * - Reports syntax errors and resumes at the next {@code projection}
 *
 * It does NOT resolve types or look at the schema.
 */
public class ShapeParser {
    private static final Logger log = LoggerFactory.getLogger(ShapeParser.class);

    private final List<ShapeToken> tokens;
    private final String fileName;
    private int pos = 0;

    private final Deque<String> parameters = new ArrayDeque<>();
    private Set<String> captures = Set.of();

    public ShapeParser(List<ShapeToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    /**
     * Tokenizes and parses a complete shape file. Errors are added to
     * {@code diagnostics}; whatever parsed cleanly is returned.
     */
    public static ShapeFile parseSource(String source, String fileName, ToolDiagnostics diagnostics) {
        List<ShapeToken> tokens;
        try {
            tokens = new ShapeTokenizer(source, fileName).tokenize();
        } catch (ParseException e) {
            diagnostics.error(DiagnosticCode.PARSE_ERROR, fileName, e.getMessage());
            return ShapeFile.builder().sourceFile(fileName).build();
        }
        return new ShapeParser(tokens, fileName).parse(diagnostics);
    }

    /**
     * Parses a standalone type expression such as {@code List<com.acme.Order>}.
     */
    public static TypeExpr parseTypeExpression(String text) {
        ShapeParser parser = new ShapeParser(new ShapeTokenizer(text, "<type>").tokenize(), "<type>");
        TypeExpr type = parser.parseType();
        parser.expect(TokenType.EOF, "end of type");
        return type;
    }

    /**
     * Parses a standalone expression in which {@code parameter} is the projection
     * parameter and {@code captureNames} are captured variables.
     */
    public static ExprNode parseExpression(String text, String parameter, Set<String> captureNames) {
        ShapeParser parser = new ShapeParser(new ShapeTokenizer(text, "<expression>").tokenize(), "<expression>");
        parser.captures = Set.copyOf(captureNames);
        parser.parameters.push(parameter);
        ExprNode node = parser.parseExpression();
        parser.expect(TokenType.EOF, "end of expression");
        return node;
    }

    public ShapeFile parse(ToolDiagnostics diagnostics) {
        ShapeFile.ShapeFileBuilder file = ShapeFile.builder().sourceFile(fileName);

        try {
            parseHeader(file);
        } catch (ParseException e) {
            diagnostics.error(DiagnosticCode.PARSE_ERROR, fileName, e.getMessage());
            skipToNextProjection();
        }

        while (!isAtEnd()) {
            try {
                if (!check(TokenType.PROJECTION)) {
                    throw error(peek(), "Expected 'projection'");
                }
                ProjectionDeclaration declaration = parseProjection();
                file.projection(declaration);
                log.debug("Parsed projection {} at {}:{}", declaration.getName(), fileName,
                        declaration.getPosition());
            } catch (ParseException e) {
                diagnostics.error(DiagnosticCode.PARSE_ERROR, fileName, e.getMessage());
                skipToNextProjection();
            }
        }

        return file.build();
    }

    private void parseHeader(ShapeFile.ShapeFileBuilder file) {
        if (match(TokenType.PACKAGE)) {
            file.packageName(parseQualifiedName());
            expect(TokenType.SEMICOLON, "';' after package declaration");
        }
        while (match(TokenType.IMPORT)) {
            String imported = parseQualifiedName();
            if (check(TokenType.DOT) && checkNext(TokenType.STAR)) {
                advance();
                advance();
                imported += ".*";
            }
            file.importEntry(imported);
            expect(TokenType.SEMICOLON, "';' after import");
        }
    }

    private ProjectionDeclaration parseProjection() {
        ShapeToken keyword = expect(TokenType.PROJECTION, "'projection'");
        ProjectionDeclaration.ProjectionDeclarationBuilder declaration = ProjectionDeclaration.builder()
                .position(position(keyword));

        if (check(TokenType.IDENTIFIER)) {
            declaration.name(advance().getValue());
        }

        Set<String> captureNames = new HashSet<>();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                do {
                    TypeExpr type = parseType();
                    ShapeToken name = expect(TokenType.IDENTIFIER, "capture name");
                    if (!captureNames.add(name.getValue())) {
                        throw error(name, "Duplicate capture '" + name.getValue() + "'");
                    }
                    declaration.capture(new CaptureDeclaration(type, name.getValue()));
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RPAREN, "')' after captures");
        }

        expect(TokenType.FROM, "'from'");
        declaration.sourceType(parseType());
        String parameter = expect(TokenType.IDENTIFIER, "parameter name").getValue();
        declaration.parameterName(parameter);
        expect(TokenType.ARROW, "'=>'");

        captures = captureNames;
        parameters.push(parameter);
        try {
            declaration.body(parseExpression());
        } finally {
            parameters.pop();
            captures = Set.of();
        }

        match(TokenType.SEMICOLON);
        return declaration.build();
    }

    TypeExpr parseType() {
        if (match(TokenType.LBRACE)) {
            Map<String, TypeExpr> fields = new LinkedHashMap<>();
            if (!check(TokenType.RBRACE)) {
                do {
                    ShapeToken name = expectName("field name");
                    expect(TokenType.COLON, "':' after field name");
                    fields.put(name.getValue(), parseType());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RBRACE, "'}' closing anonymous type");
            return TypeExpr.anonymous(fields, parseArrayDimensions());
        }

        String name = parseQualifiedName();
        List<TypeExpr> arguments = new ArrayList<>();
        if (match(TokenType.LESS)) {
            do {
                arguments.add(parseType());
            } while (match(TokenType.COMMA));
            expect(TokenType.GREATER, "'>' closing type arguments");
        }
        return TypeExpr.named(name, arguments, parseArrayDimensions());
    }

    private int parseArrayDimensions() {
        int dimensions = 0;
        while (check(TokenType.LBRACKET) && checkNext(TokenType.RBRACKET)) {
            advance();
            advance();
            dimensions++;
        }
        return dimensions;
    }

    private String parseQualifiedName() {
        StringBuilder name = new StringBuilder(expect(TokenType.IDENTIFIER, "name").getValue());
        while (check(TokenType.DOT) && checkNext(TokenType.IDENTIFIER)) {
            advance();
            name.append('.').append(advance().getValue());
        }
        return name.toString();
    }

    // ---- Expressions ----

    ExprNode parseExpression() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ARROW)) {
            ShapeToken parameter = advance();
            advance();
            parameters.push(parameter.getValue());
            try {
                return new LambdaNode(parameter.getValue(), parseExpression(), position(parameter));
            } finally {
                parameters.pop();
            }
        }
        return parseConditional();
    }

    private ExprNode parseConditional() {
        ExprNode condition = parseCoalesce();
        if (match(TokenType.QUESTION)) {
            ExprNode whenTrue = parseExpression();
            expect(TokenType.COLON, "':' in conditional expression");
            ExprNode whenFalse = parseExpression();
            return new ConditionalNode(condition, whenTrue, whenFalse, condition.getPosition());
        }
        return condition;
    }

    private ExprNode parseCoalesce() {
        ExprNode value = parseBinary(1);
        if (match(TokenType.COALESCE)) {
            return new CoalesceNode(value, parseCoalesce(), value.getPosition());
        }
        return value;
    }

    private ExprNode parseBinary(int minimumPrecedence) {
        ExprNode left = parseUnary();
        while (true) {
            BinaryOperator operator = binaryOperator(peek().getType());
            if (operator == null || operator.getPrecedence() < minimumPrecedence) {
                return left;
            }
            advance();
            ExprNode right = parseBinary(operator.getPrecedence() + 1);
            left = new BinaryNode(operator, left, right, left.getPosition());
        }
    }

    private ExprNode parseUnary() {
        if (check(TokenType.NOT)) {
            ShapeToken token = advance();
            return new UnaryNode(UnaryOperator.NOT, parseUnary(), position(token));
        }
        if (check(TokenType.MINUS)) {
            ShapeToken token = advance();
            return new UnaryNode(UnaryOperator.NEGATE, parseUnary(), position(token));
        }
        return parsePostfix();
    }

    private ExprNode parsePostfix() {
        ExprNode expr = parsePrimary();
        while (check(TokenType.DOT) || check(TokenType.SAFE_DOT)) {
            boolean nullSafe = advance().getType() == TokenType.SAFE_DOT;
            ShapeToken name = expectName("member name");
            if (match(TokenType.LPAREN)) {
                expr = new MethodCallNode(expr, name.getValue(), parseArguments(), nullSafe, position(name));
            } else {
                expr = new MemberAccessNode(expr, name.getValue(), nullSafe, position(name));
            }
        }
        return expr;
    }

    private List<ExprNode> parseArguments() {
        List<ExprNode> arguments = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return arguments;
        }
        do {
            arguments.add(parseExpression());
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN, "')' closing arguments");
        return arguments;
    }

    private ExprNode parsePrimary() {
        ShapeToken token = peek();

        if (token.isLiteral()) {
            advance();
            return new LiteralNode(literalKind(token.getType()), token.getValue(), position(token));
        }

        switch (token.getType()) {
            case IDENTIFIER -> {
                advance();
                String name = token.getValue();
                if (parameters.contains(name)) {
                    return new ParameterNode(name, position(token));
                }
                if (captures.contains(name)) {
                    return new CaptureNode(name, position(token));
                }
                return new IdentifierNode(name, position(token));
            }
            case LPAREN -> {
                advance();
                ExprNode inner = parseExpression();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case LBRACE -> {
                return parseShapeBody(null, token);
            }
            case NEW -> {
                advance();
                return parseShapeBody(parseQualifiedName(), token);
            }
            default -> throw error(token, "Expected an expression");
        }
    }

    private ShapeNode parseShapeBody(String typeName, ShapeToken start) {
        expect(TokenType.LBRACE, "'{' opening shape");
        List<ShapeEntry> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            entries.add(parseShapeEntry());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RBRACE, "'}' closing shape");
        return new ShapeNode(typeName, entries, position(start));
    }

    private ShapeEntry parseShapeEntry() {
        ShapeToken first = peek();
        if (isName(first.getType()) && checkNext(TokenType.COLON)) {
            advance();
            advance();
            return new ShapeEntry(first.getValue(), parseExpression(), position(first));
        }
        return new ShapeEntry(null, parseExpression(), position(first));
    }

    // ---- Token helpers ----

    private static BinaryOperator binaryOperator(TokenType type) {
        return switch (type) {
            case OR -> BinaryOperator.OR;
            case AND -> BinaryOperator.AND;
            case EQUAL -> BinaryOperator.EQUAL;
            case NOT_EQUAL -> BinaryOperator.NOT_EQUAL;
            case LESS -> BinaryOperator.LESS;
            case LESS_OR_EQUAL -> BinaryOperator.LESS_OR_EQUAL;
            case GREATER -> BinaryOperator.GREATER;
            case GREATER_OR_EQUAL -> BinaryOperator.GREATER_OR_EQUAL;
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUBTRACT;
            case STAR -> BinaryOperator.MULTIPLY;
            case SLASH -> BinaryOperator.DIVIDE;
            case PERCENT -> BinaryOperator.REMAINDER;
            default -> null;
        };
    }

    private static LiteralKind literalKind(TokenType type) {
        return switch (type) {
            case INT_LITERAL -> LiteralKind.INT;
            case LONG_LITERAL -> LiteralKind.LONG;
            case DOUBLE_LITERAL -> LiteralKind.DOUBLE;
            case STRING_LITERAL -> LiteralKind.STRING;
            case CHAR_LITERAL -> LiteralKind.CHAR;
            case TRUE, FALSE -> LiteralKind.BOOLEAN;
            default -> LiteralKind.NULL;
        };
    }

    /**
     * Member and field names may reuse the contextual keywords.
     */
    private static boolean isName(TokenType type) {
        return type == TokenType.IDENTIFIER || type == TokenType.FROM || type == TokenType.PROJECTION
                || type == TokenType.PACKAGE || type == TokenType.IMPORT;
    }

    private ShapeToken expectName(String what) {
        if (isName(peek().getType())) {
            return advance();
        }
        throw error(peek(), "Expected " + what);
    }

    private SourcePosition position(ShapeToken token) {
        return new SourcePosition(token.getLine(), token.getColumn());
    }

    private ShapeToken peek() {
        return tokens.get(pos);
    }

    private boolean checkNext(TokenType type) {
        return pos + 1 < tokens.size() && tokens.get(pos + 1).getType() == type;
    }

    private ShapeToken advance() {
        if (!isAtEnd()) {
            pos++;
        }
        return tokens.get(pos - 1);
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ShapeToken expect(TokenType type, String what) {
        if (check(type)) {
            return type == TokenType.EOF ? peek() : advance();
        }
        throw error(peek(), "Expected " + what);
    }

    private ParseException error(ShapeToken token, String message) {
        String found = token.getType() == TokenType.EOF ? "end of file" : "'" + token.getValue() + "'";
        return new ParseException(fileName, token.getLine(), token.getColumn(), message + " but found " + found);
    }

    private void skipToNextProjection() {
        if (!isAtEnd()) {
            advance();
        }
        while (!isAtEnd() && !check(TokenType.PROJECTION)) {
            advance();
        }
    }
}
