package org.newo.nsl.frontend.printer;

import org.newo.nsl.frontend.parser.ast.AttributeAccess;
import org.newo.nsl.frontend.parser.ast.BlockStatement;
import org.newo.nsl.frontend.parser.ast.BooleanLiteral;
import org.newo.nsl.frontend.parser.ast.ElseIfClause;
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

/**
 * Renders an AST back into canonical NSL source.
 * <p>
 * Every statement goes on its own line. The bodies of {@code if}, {@code elif}, {@code else}
 * and {@code for} are indented by four spaces per level while the tags themselves stay at the
 * enclosing level. Printing the result of parsing printed output yields the same text.
 * <p>
 * String literals are printed with double quotes whatever their original quoting. The one
 * exception is a value that itself contains {@code "}: NSL has no escape sequences, so such a
 * value is printed with single quotes to keep the output parseable.
 * <p>
 * An instance accumulates output and must not be shared between threads.
 */
public class AstPrinter implements StatementVisitor<Void> {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private final ExpressionRenderer expressions = new ExpressionRenderer();
    private int level = 0;

    /**
     * Prints a whole program.
     * @param program The program to print.
     * @return The canonical source text.
     */
    public String print(Program program) {
        out.setLength(0);
        level = 0;
        for (Statement statement : program.statements()) {
            printStatement(statement);
        }
        return out.toString();
    }

    private void printStatement(Statement statement) {
        if (!(statement instanceof BlockStatement)) {
            out.append(INDENT.repeat(level));
        }
        statement.accept(this);
        out.append('\n');
    }

    @Override
    public Void visit(SetStatement node) {
        out.append("{% set ")
                .append(node.name().accept(expressions))
                .append(" = ")
                .append(node.value().accept(expressions))
                .append(" %}");
        return null;
    }

    @Override
    public Void visit(IfStatement node) {
        out.append("{% if ").append(node.condition().accept(expressions)).append(" %}\n");
        printBody(node.consequence());
        for (ElseIfClause clause : node.elseIfs()) {
            out.append(INDENT.repeat(level))
                    .append("{% elif ")
                    .append(clause.condition().accept(expressions))
                    .append(" %}\n");
            printBody(clause.consequence());
        }
        if (node.alternative() != null) {
            out.append(INDENT.repeat(level)).append("{% else %}\n");
            printBody(node.alternative());
        }
        out.append(INDENT.repeat(level)).append("{% endif %}");
        return null;
    }

    @Override
    public Void visit(ForStatement node) {
        out.append("{% for ")
                .append(node.iterator().accept(expressions))
                .append(" in ")
                .append(node.sequence().accept(expressions))
                .append(" %}\n");
        printBody(node.body());
        out.append(INDENT.repeat(level)).append("{% endfor %}");
        return null;
    }

    @Override
    public Void visit(OutputStatement node) {
        out.append("{{ ").append(node.expression().accept(expressions)).append(" }}");
        return null;
    }

    @Override
    public Void visit(BlockStatement node) {
        // A bare block prints its children at the current level.
        for (Statement statement : node.statements()) {
            printStatement(statement);
        }
        return null;
    }

    @Override
    public Void visit(ExpressionStatement node) {
        out.append(node.expression().accept(expressions));
        return null;
    }

    private void printBody(BlockStatement body) {
        level++;
        for (Statement statement : body.statements()) {
            printStatement(statement);
        }
        level--;
    }

    /**
     * Renders expressions without parentheses; the grammar has no grouping, so operand order
     * and precedence already determine the tree.
     */
    private static final class ExpressionRenderer implements ExpressionVisitor<String> {

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
            String value = node.value();
            // No escape sequences exist, so a value containing " can only be quoted with '.
            char quote = value.indexOf('"') >= 0 ? '\'' : '"';
            return quote + value + quote;
        }

        @Override
        public String visit(BooleanLiteral node) {
            return Boolean.toString(node.value());
        }

        @Override
        public String visit(PrefixExpression node) {
            return node.operator() + node.operand().accept(this);
        }

        @Override
        public String visit(InfixExpression node) {
            return node.left().accept(this) + " " + node.operator() + " " + node.right().accept(this);
        }

        @Override
        public String visit(AttributeAccess node) {
            return node.object().accept(this) + "." + node.attribute().name();
        }

        @Override
        public String visit(FilterExpression node) {
            return node.input().accept(this) + " | " + node.filter().name();
        }
    }
}
