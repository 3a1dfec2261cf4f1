package org.newo.nsl.frontend.parser;

import org.newo.nsl.frontend.lexer.Lexer;
import org.newo.nsl.frontend.lexer.Token;
import org.newo.nsl.frontend.lexer.TokenType;
import org.newo.nsl.frontend.parser.ast.AttributeAccess;
import org.newo.nsl.frontend.parser.ast.BlockStatement;
import org.newo.nsl.frontend.parser.ast.BooleanLiteral;
import org.newo.nsl.frontend.parser.ast.ElseIfClause;
import org.newo.nsl.frontend.parser.ast.Expression;
import org.newo.nsl.frontend.parser.ast.ExpressionStatement;
import org.newo.nsl.frontend.parser.ast.FilterExpression;
import org.newo.nsl.frontend.parser.ast.ForStatement;
import org.newo.nsl.frontend.parser.ast.Identifier;
import org.newo.nsl.frontend.parser.ast.IfStatement;
import org.newo.nsl.frontend.parser.ast.InfixExpression;
import org.newo.nsl.frontend.parser.ast.IntegerLiteral;
import org.newo.nsl.frontend.parser.ast.OutputStatement;
import org.newo.nsl.frontend.parser.ast.PrefixExpression;
import org.newo.nsl.frontend.parser.ast.Program;
import org.newo.nsl.frontend.parser.ast.SetStatement;
import org.newo.nsl.frontend.parser.ast.Statement;
import org.newo.nsl.frontend.parser.ast.StringLiteral;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The parser for NSL templates. It pulls tokens from a {@link Lexer} and produces a {@link Program}.
 * <p>
 * Statements are parsed by recursive descent, expressions by precedence climbing over the
 * {@link Precedence} table. The parser never throws on malformed input: a grammar violation is
 * recorded in {@link #getErrors()}, the offending statement is dropped and the parser skips
 * ahead to the next tag boundary before continuing.
 * <p>
 * A parser instance is single-use and not thread-safe.
 */
public class Parser {

    /** The default limit for nested statements and expressions. */
    public static final int DEFAULT_MAX_DEPTH = 256;

    private final Lexer lexer;
    private final int maxDepth;
    private final List<String> errors = new ArrayList<>();

    private Token curToken;
    private Token peekToken;
    private int depth = 0;
    private boolean depthReported = false;
    // Height of the expression tree most recently produced by parseExpression or parsePrefix.
    private int lastHeight = 0;

    /**
     * Constructs a new Parser with the default nesting limit.
     * @param lexer The lexer supplying the tokens.
     */
    public Parser(Lexer lexer) {
        this(lexer, DEFAULT_MAX_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param lexer The lexer supplying the tokens.
     * @param maxDepth The maximum nesting depth of statements and expressions.
     */
    public Parser(Lexer lexer, int maxDepth) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        nextToken();
        nextToken();
    }

    /**
     * @return The syntax errors found so far, in the order they were found.
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Parses the whole token stream.
     * @return The program; statements that failed to parse are omitted.
     */
    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!curTokenIs(TokenType.EOF)) {
            depthReported = false;
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
            nextToken();
        }
        return new Program(statements);
    }

    private Statement parseStatement() {
        if (!enterNesting()) {
            synchronize();
            return null;
        }
        try {
            Statement statement;
            switch (curToken.type()) {
                case LPERCENT:
                    statement = parseTemplateStatement();
                    break;
                case LBRACE:
                    statement = parseOutputStatement();
                    break;
                default:
                    statement = parseExpressionStatement();
                    break;
            }
            if (statement == null) {
                synchronize();
            }
            return statement;
        } finally {
            depth--;
        }
    }

    private Statement parseTemplateStatement() {
        switch (peekToken.type()) {
            case SET:
                nextToken();
                return parseSetStatement();
            case IF:
                nextToken();
                return parseIfStatement();
            case FOR:
                nextToken();
                return parseForStatement();
            default:
                addError("unexpected template tag \"%s\"", peekToken.literal());
                return null;
        }
    }

    private SetStatement parseSetStatement() {
        Token setToken = curToken;
        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        Identifier name = new Identifier(curToken, curToken.literal());
        if (!expectPeek(TokenType.ASSIGN)) {
            return null;
        }
        nextToken();
        Expression value = parseExpression(Precedence.LOWEST);
        if (value == null || !expectPeek(TokenType.RPERCENT)) {
            return null;
        }
        return new SetStatement(setToken, name, value);
    }

    private IfStatement parseIfStatement() {
        Token ifToken = curToken;
        nextToken();
        Expression condition = parseExpression(Precedence.LOWEST);
        if (condition == null || !expectPeek(TokenType.RPERCENT)) {
            return null;
        }
        BlockStatement consequence = parseBlockStatement();

        // The block stops on the opening delimiter of its terminating tag.
        List<ElseIfClause> elseIfs = new ArrayList<>();
        while (curTokenIs(TokenType.LPERCENT) && peekTokenIs(TokenType.ELIF)) {
            nextToken();
            Token elifToken = curToken;
            nextToken();
            Expression elifCondition = parseExpression(Precedence.LOWEST);
            if (elifCondition == null || !expectPeek(TokenType.RPERCENT)) {
                return null;
            }
            BlockStatement elifBody = parseBlockStatement();
            elseIfs.add(new ElseIfClause(elifToken, elifCondition, elifBody));
        }

        BlockStatement alternative = null;
        if (curTokenIs(TokenType.LPERCENT) && peekTokenIs(TokenType.ELSE)) {
            nextToken();
            if (!expectPeek(TokenType.RPERCENT)) {
                return null;
            }
            alternative = parseBlockStatement();
        }

        if (!expectClosingTag(TokenType.ENDIF)) {
            return null;
        }
        return new IfStatement(ifToken, condition, consequence, elseIfs, alternative);
    }

    private ForStatement parseForStatement() {
        Token forToken = curToken;
        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        Identifier iterator = new Identifier(curToken, curToken.literal());
        if (!expectPeek(TokenType.IN)) {
            return null;
        }
        nextToken();
        Expression sequence = parseExpression(Precedence.LOWEST);
        if (sequence == null || !expectPeek(TokenType.RPERCENT)) {
            return null;
        }
        BlockStatement body = parseBlockStatement();
        if (!expectClosingTag(TokenType.ENDFOR)) {
            return null;
        }
        return new ForStatement(forToken, iterator, sequence, body);
    }

    /**
     * Consumes {@code {% <keyword> %}} where the current token is the opening delimiter.
     */
    private boolean expectClosingTag(TokenType keyword) {
        if (!curTokenIs(TokenType.LPERCENT)) {
            peekError(keyword);
            return false;
        }
        return expectPeek(keyword) && expectPeek(TokenType.RPERCENT);
    }

    /**
     * Parses statements up to the next {@code else/elif/endif/endfor/endblock} tag.
     * The current token is the {@code %}} that opened the block; on return the current token
     * is the {@code {%} of the terminating tag, or EOF.
     */
    private BlockStatement parseBlockStatement() {
        Token blockToken = curToken;
        List<Statement> statements = new ArrayList<>();
        nextToken();
        while (!isBlockEnd()) {
            if (curTokenIs(TokenType.EOF)) {
                // The enclosing statement then reports its missing end tag as well.
                addError("unexpected EOF while parsing block starting with \"%s\"", blockToken.literal());
                break;
            }
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
            nextToken();
        }
        return new BlockStatement(blockToken, statements);
    }

    private boolean isBlockEnd() {
        if (!curTokenIs(TokenType.LPERCENT)) {
            return false;
        }
        switch (peekToken.type()) {
            case ELSE:
            case ELIF:
            case ENDIF:
            case ENDFOR:
            case ENDBLOCK:
                return true;
            default:
                return false;
        }
    }

    private OutputStatement parseOutputStatement() {
        Token openToken = curToken;
        nextToken();
        Expression expression = parseExpression(Precedence.LOWEST);
        if (expression == null || !expectPeek(TokenType.RBRACE)) {
            return null;
        }
        return new OutputStatement(openToken, expression);
    }

    private ExpressionStatement parseExpressionStatement() {
        Token first = curToken;
        Expression expression = parseExpression(Precedence.LOWEST);
        if (expression == null) {
            return null;
        }
        return new ExpressionStatement(first, expression);
    }

    // --- Expressions ---

    private Expression parseExpression(Precedence precedence) {
        if (!enterNesting()) {
            return null;
        }
        try {
            Expression left = parsePrefix();
            int height = lastHeight;
            while (left != null
                    && !peekTokenIs(TokenType.RPERCENT)
                    && !peekTokenIs(TokenType.RBRACE)
                    && Precedence.isInfix(peekToken.type())
                    && precedence.compareTo(Precedence.of(peekToken.type())) < 0) {
                nextToken();
                left = parseInfix(left, height);
                height = lastHeight;
                // Left-associative chains grow the tree without recursing here.
                if (left != null && depth - 1 + height > maxDepth) {
                    reportDepthExceeded();
                    return null;
                }
            }
            lastHeight = height;
            return left;
        } finally {
            depth--;
        }
    }

    private Expression parsePrefix() {
        Token token = curToken;
        lastHeight = 1;
        switch (token.type()) {
            case IDENT:
            case NULL:
                return new Identifier(token, token.literal());
            case INT:
                return parseIntegerLiteral();
            case STRING:
                return new StringLiteral(token, token.literal());
            case TRUE:
            case FALSE:
                return new BooleanLiteral(token, token.type() == TokenType.TRUE);
            case BANG:
            case MINUS:
                nextToken();
                Expression operand = parseExpression(Precedence.PREFIX);
                lastHeight++;
                return operand == null ? null : new PrefixExpression(token, token.literal(), operand);
            default:
                addError("no prefix parse function for %s found", token.type().label());
                return null;
        }
    }

    private Expression parseInfix(Expression left, int leftHeight) {
        Token operator = curToken;
        lastHeight = leftHeight + 1;
        switch (operator.type()) {
            case DOT: {
                Identifier attribute = expectIdentifier();
                return attribute == null ? null : new AttributeAccess(operator, left, attribute);
            }
            case PIPE: {
                Identifier filter = expectIdentifier();
                return filter == null ? null : new FilterExpression(operator, left, filter);
            }
            default: {
                Precedence precedence = Precedence.of(operator.type());
                nextToken();
                Expression right = parseExpression(precedence);
                lastHeight = Math.max(leftHeight, lastHeight) + 1;
                return right == null ? null : new InfixExpression(operator, operator.literal(), left, right);
            }
        }
    }

    private Identifier expectIdentifier() {
        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        return new Identifier(curToken, curToken.literal());
    }

    private Expression parseIntegerLiteral() {
        try {
            return new IntegerLiteral(curToken, Long.parseLong(curToken.literal()));
        } catch (NumberFormatException e) {
            addError("could not parse \"%s\" as integer", curToken.literal());
            return null;
        }
    }

    // --- Helper methods ---

    private boolean enterNesting() {
        if (depth >= maxDepth) {
            reportDepthExceeded();
            return false;
        }
        depth++;
        return true;
    }

    private void reportDepthExceeded() {
        if (!depthReported) {
            addError("expression nesting exceeds %d levels", maxDepth);
            depthReported = true;
        }
    }

    /**
     * Skips tokens after a failed statement. Stops on a closing delimiter, or just before an
     * opening one, so that the caller's next advance lands on the next statement.
     */
    private void synchronize() {
        while (!curTokenIs(TokenType.EOF)) {
            if (curTokenIs(TokenType.RPERCENT) || curTokenIs(TokenType.RBRACE)) {
                return;
            }
            if (peekTokenIs(TokenType.LPERCENT) || peekTokenIs(TokenType.LBRACE)) {
                return;
            }
            nextToken();
        }
    }

    private void nextToken() {
        curToken = peekToken;
        peekToken = lexer.nextToken();
    }

    private boolean curTokenIs(TokenType type) {
        return curToken.type() == type;
    }

    private boolean peekTokenIs(TokenType type) {
        return peekToken.type() == type;
    }

    private boolean expectPeek(TokenType type) {
        if (peekTokenIs(type)) {
            nextToken();
            return true;
        }
        peekError(type);
        return false;
    }

    private void peekError(TokenType expected) {
        addError("expected next token to be %s, got %s instead", expected.label(), peekToken.type().label());
    }

    private void addError(String format, Object... args) {
        errors.add(String.format(format, args));
    }
}
