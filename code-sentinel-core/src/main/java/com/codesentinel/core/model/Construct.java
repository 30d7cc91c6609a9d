package com.codesentinel.core.model;

/**
 * Syntactic tags attached to a {@link LineContext} by the structural extractor.
 *
 * <p>Tags are lexical facts, not parse results: a tag means "a recognizer fired on
 * this line", nothing more.
 *
 * @since 1.0.0
 */
public enum Construct {
    /** {@code name = value}, including annotated assignments. */
    ASSIGNMENT,
    /** {@code name += value} and the other augmented operators. */
    AUGMENTED_ASSIGNMENT,
    FUNCTION_DEF,
    CLASS_DEF,
    /** {@code @decorator} line. */
    DECORATOR,
    IMPORT,
    /** {@code if} or {@code elif} header. */
    CONDITIONAL,
    /** {@code for} or {@code while} header. */
    LOOP,
    /** Any line nested inside a loop header's block. */
    LOOP_BODY,
    /** {@code except} clause. */
    EXCEPTION_HANDLER,
    /** {@code except:} without an exception type. */
    BARE_EXCEPT,
    RETURN,
    /** {@code return}, {@code raise}, {@code break} or {@code continue}. */
    TERMINATOR,
    /** {@code global} or {@code nonlocal} declaration. */
    GLOBAL_DECL,
    /** At least one {@code and}/{@code or} operator outside strings and comments. */
    BOOLEAN_OPERATOR,
    LITERAL_STRING,
    COMMENT,
    /** Line lies inside a triple-quoted string opened on an earlier line. */
    DOCSTRING,
    /** {@code ;} outside strings and comments. */
    STATEMENT_SEPARATOR,
    /** Line starts a compound statement ({@code def}, {@code if}, {@code try}, ...). */
    BLOCK_HEADER,
    MISSING_COLON,
    /** Opening bracket never closed before end of input. */
    UNCLOSED_BRACKET,
    /** Closing bracket without a matching opener. */
    UNMATCHED_BRACKET,
    UNTERMINATED_STRING,
    MIXED_INDENTATION,
    /** Nested inside four or more control-flow blocks. */
    DEEP_NESTING,
    /** First statement following a terminator in the same block. */
    UNREACHABLE,
    /** Definition whose name is never referenced elsewhere in the unit. */
    UNUSED_DEFINITION
}
