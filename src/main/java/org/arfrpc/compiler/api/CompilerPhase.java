package org.arfrpc.compiler.api;

/**
 * The stages of a compilation, in execution order. A compilation stops after the first
 * stage that reports errors.
 */
public enum CompilerPhase {
    /** Reading, lexing and parsing the entry file and everything it imports. */
    LOADING,
    /** Local well-formedness: uniqueness, naming and signature shape. */
    DECLARATIONS,
    /** Binding every type reference to a struct or enum. */
    TYPE_RESOLUTION,
    /** Whole-program checks: reopened services and cyclic struct references. */
    CONSISTENCY
}
