package org.solsmt.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Raised on the first fatal violation in a script. It is not caught below the
 * entry point, so no further commands are processed once it is thrown.
 */
@Getter
public class SmtScriptException extends RuntimeException {

    private final ErrorKind kind;

    public SmtScriptException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "ErrorKind cannot be null");
    }

    public SmtScriptException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "ErrorKind cannot be null");
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
