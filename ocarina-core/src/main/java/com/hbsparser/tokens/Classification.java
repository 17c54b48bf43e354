package com.hbsparser.tokens;

/**
 * Outcome of classifying a path: skipped, or a normalized invocation name.
 */
public sealed interface Classification permits Classification.Skip, Classification.Component, Classification.Invocable {

    Skip SKIP = new Skip();

    /** Argument, block-local, plain markup or otherwise not a global invocation. */
    record Skip() implements Classification {
    }

    /** Angle-bracket component with its dasherized, slash-joined name. */
    record Component(String normalizedPath) implements Classification {
    }

    /** Curly invocation (component, helper or modifier), name kept as written. */
    record Invocable(String normalizedPath) implements Classification {
    }
}
