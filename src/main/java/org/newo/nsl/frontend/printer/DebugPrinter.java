package org.newo.nsl.frontend.printer;

import org.newo.nsl.frontend.parser.ast.AttributeAccess;
import org.newo.nsl.frontend.parser.ast.BlockStatement;
import org.newo.nsl.frontend.parser.ast.BooleanLiteral;
import org.newo.nsl.frontend.parser.ast.ElseIfClause;
import org.newo.nsl.frontend.parser.ast.Expression;
import org.newo.nsl.frontend.parser.ast.ExpressionStatement;
import org.newo.nsl.frontend.parser.ast.ExpressionVisitor;
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
import org.newo.nsl.frontend.parser.ast.StatementVisitor;
import org.newo.nsl.frontend.parser.ast.StringLiteral;

import java.util.stream.Collectors;

/**
 * Renders a compact, fully parenthesized form of an AST that makes operator grouping visible,
 * e.g. {@code a + b * c} becomes {@code (a + (b * c))}. Used in tests and log output.
 * Stateless and thread-safe.
 */
public final class DebugPrinter implements StatementVisitor<String>, ExpressionVisitor<String> {

    public static final DebugPrinter INSTANCE = new DebugPrinter();

    private DebugPrinter() {
    }

    public String print(Program program) {
        return program.statements().stream()
                .map(s -> s.accept(this))
                .collect(Collectors.joining());
    }

    public String print(Statement statement) {
        return statement.accept(this);
    }

    public String print(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public String visit(SetStatement node) {
        return "set " + node.name().accept(this) + " = " + node.value().accept(this);
    }

    @Override
    public String visit(IfStatement node) {
        StringBuilder sb = new StringBuilder("if ")
                .append(node.condition().accept(this)).append(' ')
                .append(node.consequence().accept(this));
        for (ElseIfClause clause : node.elseIfs()) {
            sb.append("elif ")
                    .append(clause.condition().accept(this)).append(' ')
                    .append(clause.consequence().accept(this));
        }
        if (node.alternative() != null) {
            sb.append("else ").append(node.alternative().accept(this));
        }
        return sb.toString();
    }

    @Override
    public String visit(ForStatement node) {
        return "for " + node.iterator().accept(this) + " in " + node.sequence().accept(this) + " "
                + node.body().accept(this);
    }

    @Override
    public String visit(OutputStatement node) {
        return "{{" + node.expression().accept(this) + "}}";
    }

    @Override
    public String visit(BlockStatement node) {
        return node.statements().stream()
                .map(s -> s.accept(this))
                .collect(Collectors.joining());
    }

    @Override
    public String visit(ExpressionStatement node) {
        return node.expression().accept(this);
    }

    @Override
    public String visit(Identifier node) {
        return node.name();
    }

    @Override
    public String visit(IntegerLiteral node) {
        return Long.toString(node.value());
    }

    @Override
    public String visit(StringLiteral node) {
        return node.value();
    }

    @Override
    public String visit(BooleanLiteral node) {
        return Boolean.toString(node.value());
    }

    @Override
    public String visit(PrefixExpression node) {
        return "(" + node.operator() + node.operand().accept(this) + ")";
    }

    @Override
    public String visit(InfixExpression node) {
        return "(" + node.left().accept(this) + " " + node.operator() + " " + node.right().accept(this) + ")";
    }

    @Override
    public String visit(AttributeAccess node) {
        return node.object().accept(this) + "." + node.attribute().accept(this);
    }

    @Override
    public String visit(FilterExpression node) {
        return node.input().accept(this) + " | " + node.filter().accept(this);
    }
}
