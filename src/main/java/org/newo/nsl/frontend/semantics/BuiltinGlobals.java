package org.newo.nsl.frontend.semantics;

import java.util.Set;

/**
 * Names that are always in scope in an NSL template: literals, the functions of the
 * underlying template engine, and the words of its test and logic operators, which the
 * lexer hands over as plain identifiers.
 */
public final class BuiltinGlobals {

    /** The immutable set of built-in names. */
    public static final Set<String> NAMES = Set.of(
            "true", "false", "null", "None",
            "range", "dict", "lipsum", "cycler", "joiner", "namespace",
            "in", "is", "not", "and", "or",
            "defined", "undefined", "callable", "divisible", "by",
            "eq", "equalto", "even", "ne", "odd"
    );

    private BuiltinGlobals() {
        // Utility class
    }
}
