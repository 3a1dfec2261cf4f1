package org.newo.nsl.frontend.semantics;

import org.newo.nsl.diagnostics.DiagnosticsEngine;
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

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Checks that every variable a template reads is either a declared parameter, a built-in,
 * a variable assigned earlier with {@code set}, or the iterator of an enclosing {@code for}.
 * <p>
 * Each offending reference produces one error in the {@link DiagnosticsEngine}. Attribute
 * names and filter names are not variables and are never checked. An analyzer instance
 * is single-use and not thread-safe.
 */
public class SemanticAnalyzer implements StatementVisitor<Void>, ExpressionVisitor<Void> {

    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;

    /**
     * Constructs a new semantic analyzer.
     * @param fileName The file name used in diagnostics.
     * @param declaredNames The parameters declared for the template.
     * @param diagnostics The engine to report undefined variables to.
     */
    public SemanticAnalyzer(String fileName, Collection<String> declaredNames, DiagnosticsEngine diagnostics) {
        this.fileName = fileName;
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        Set<String> root = new HashSet<>(declaredNames);
        root.addAll(BuiltinGlobals.NAMES);
        this.symbolTable = new SymbolTable(root);
    }

    /**
     * Analyzes all statements of the program in source order.
     * @param program The parsed program.
     */
    public void analyze(Program program) {
        for (Statement statement : program.statements()) {
            statement.accept(this);
        }
    }

    @Override
    public Void visit(SetStatement node) {
        // The value is evaluated before the name exists.
        node.value().accept(this);
        symbolTable.define(node.name().name());
        return null;
    }

    @Override
    public Void visit(IfStatement node) {
        node.condition().accept(this);
        node.consequence().accept(this);
        for (ElseIfClause clause : node.elseIfs()) {
            clause.condition().accept(this);
            clause.consequence().accept(this);
        }
        if (node.alternative() != null) {
            node.alternative().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(ForStatement node) {
        node.sequence().accept(this);
        symbolTable.enterScope();
        try {
            symbolTable.define(node.iterator().name());
            node.body().accept(this);
        } finally {
            symbolTable.leaveScope();
        }
        return null;
    }

    @Override
    public Void visit(OutputStatement node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public Void visit(BlockStatement node) {
        for (Statement statement : node.statements()) {
            statement.accept(this);
        }
        return null;
    }

    @Override
    public Void visit(ExpressionStatement node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public Void visit(Identifier node) {
        if (!node.name().isEmpty() && !symbolTable.isDefined(node.name())) {
            diagnostics.reportError(
                    String.format("undefined variable: '%s' is used but not defined in parameters or in the skill", node.name()),
                    fileName, node.line());
        }
        return null;
    }

    @Override
    public Void visit(IntegerLiteral node) {
        return null;
    }

    @Override
    public Void visit(StringLiteral node) {
        return null;
    }

    @Override
    public Void visit(BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visit(PrefixExpression node) {
        node.operand().accept(this);
        return null;
    }

    @Override
    public Void visit(InfixExpression node) {
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public Void visit(AttributeAccess node) {
        node.object().accept(this);
        return null;
    }

    @Override
    public Void visit(FilterExpression node) {
        node.input().accept(this);
        return null;
    }
}
