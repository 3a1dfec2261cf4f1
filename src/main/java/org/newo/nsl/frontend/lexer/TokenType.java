package org.newo.nsl.frontend.lexer;

import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Each type carries the label that parser messages use to name it.
 */
public enum TokenType {
    // Sentinels.
    /** An unknown or malformed piece of input. */
    ILLEGAL("ILLEGAL"),
    /** Represents the end of the source file. */
    EOF("EOF"),

    // Identifiers & literals.
    /** An identifier, such as a variable, attribute or filter name. */
    IDENT("IDENT"),
    /** An integer literal. */
    INT("INT"),
    /** A string literal, quoted with {@code "} or {@code '}. */
    STRING("STRING"),

    // Delimiters.
    /** Opens an output tag. */
    LBRACE("{{"),
    /** Closes an output tag. */
    RBRACE("}}"),
    /** Opens a statement tag. */
    LPERCENT("{%"),
    /** Closes a statement tag. */
    RPERCENT("%}"),

    // Operators.
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    BANG("!"),
    ASTERISK("*"),
    SLASH("/"),
    DOT("."),
    PIPE("|"),
    LT("<"),
    GT(">"),
    EQ("=="),
    NOT_EQ("!="),
    LTE("<="),
    GTE(">="),

    // Keywords.
    TRUE("TRUE"),
    FALSE("FALSE"),
    NULL("NULL"),
    IF("IF"),
    ELIF("ELIF"),
    ELSE("ELSE"),
    ENDIF("ENDIF"),
    FOR("FOR"),
    IN("IN"),
    ENDFOR("ENDFOR"),
    SET("SET"),
    BLOCK("BLOCK"),
    ENDBLOCK("ENDBLOCK");

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("true", TRUE),
            Map.entry("false", FALSE),
            Map.entry("null", NULL),
            Map.entry("if", IF),
            Map.entry("elif", ELIF),
            Map.entry("else", ELSE),
            Map.entry("endif", ENDIF),
            Map.entry("for", FOR),
            Map.entry("in", IN),
            Map.entry("endfor", ENDFOR),
            Map.entry("set", SET),
            Map.entry("block", BLOCK),
            Map.entry("endblock", ENDBLOCK)
    );

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    /**
     * @return The name used for this token type in diagnostics, e.g. {@code IDENT} or {@code %}}.
     */
    public String label() {
        return label;
    }

    /**
     * Checks the keyword table to see whether the given identifier is a keyword.
     * Keywords are case-sensitive.
     *
     * @param identifier The scanned identifier text.
     * @return The keyword type, or {@link #IDENT} if the text is not a keyword.
     */
    public static TokenType lookupIdent(String identifier) {
        return KEYWORDS.getOrDefault(identifier, IDENT);
    }
}
