package org.newo.nsl.frontend.parser.ast.json;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.newo.nsl.frontend.parser.ast.AstNode;
import org.newo.nsl.frontend.parser.ast.AttributeAccess;
import org.newo.nsl.frontend.parser.ast.BlockStatement;
import org.newo.nsl.frontend.parser.ast.BooleanLiteral;
import org.newo.nsl.frontend.parser.ast.ElseIfClause;
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
import org.newo.nsl.frontend.parser.ast.StringLiteral;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Converts ASTs to and from JSON. Every node object carries a {@code _type} property with the
 * simple name of its node class, so that polymorphic children can be restored.
 * Thread-safe once constructed.
 */
public class AstJsonCodec {

    private final ObjectMapper mapper;

    public AstJsonCodec() {
        this.mapper = new ObjectMapper()
                .addMixIn(AstNode.class, AstNodeMixin.class)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param program The program to encode.
     * @return The JSON text.
     */
    public String toJson(Program program) {
        try {
            return mapper.writeValueAsString(program);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode AST", e);
        }
    }

    /**
     * @param json JSON produced by {@link #toJson(Program)}.
     * @return The decoded program.
     * @throws IOException if the JSON is malformed, names an unknown {@code _type}, or lacks a required child.
     */
    public Program fromJson(String json) throws IOException {
        return mapper.readValue(json, Program.class);
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "_type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = SetStatement.class, name = "SetStatement"),
            @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
            @JsonSubTypes.Type(value = ElseIfClause.class, name = "ElseIfClause"),
            @JsonSubTypes.Type(value = ForStatement.class, name = "ForStatement"),
            @JsonSubTypes.Type(value = OutputStatement.class, name = "OutputStatement"),
            @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
            @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
            @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
            @JsonSubTypes.Type(value = IntegerLiteral.class, name = "IntegerLiteral"),
            @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
            @JsonSubTypes.Type(value = BooleanLiteral.class, name = "Boolean"),
            @JsonSubTypes.Type(value = PrefixExpression.class, name = "PrefixExpression"),
            @JsonSubTypes.Type(value = InfixExpression.class, name = "InfixExpression"),
            @JsonSubTypes.Type(value = AttributeAccess.class, name = "AttributeAccess"),
            @JsonSubTypes.Type(value = FilterExpression.class, name = "FilterExpression")
    })
    private abstract static class AstNodeMixin {
    }
}
