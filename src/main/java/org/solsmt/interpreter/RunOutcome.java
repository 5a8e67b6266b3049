package org.solsmt.interpreter;

/**
 * How a script run ended. Both are successful terminations.
 */
public enum RunOutcome {
    /** An explicit (exit) command was reached. */
    EXITED,
    /** All commands were processed. */
    END_OF_INPUT
}
