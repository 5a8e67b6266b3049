package org.solsmt.core;

/**
 * Categories of fatal violations found while running a script.
 * Any of them stops the run at the command that raised it.
 */
public enum ErrorKind {

    MALFORMED_COMMAND,      // wrong shape or item count for a command
    MALFORMED_EXPRESSION,   // wrong shape inside an asserted term
    UNSUPPORTED_SORT,       // sort other than Real / Bool
    UNRESOLVED_VARIABLE,
    UNKNOWN_COMMAND,
    UNSUPPORTED_LITERAL,    // numeric text not of the form <digits>(.0)*
    UNSUPPORTED_OPERATOR,   // the solver backend has no encoding for it
    UNTERMINATED_LIST,      // only in strict mode
    NESTING_TOO_DEEP,
    MODEL_UNAVAILABLE,
    SOLVER_FAILURE          // the backend rejected a call
}
