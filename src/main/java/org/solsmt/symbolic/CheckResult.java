package org.solsmt.symbolic;

/**
 * Verdict of a satisfiability query.
 */
public enum CheckResult {

    SATISFIABLE("sat"),
    UNSATISFIABLE("unsat"),
    UNKNOWN("unknown");

    private final String response;

    CheckResult(String response) {
        this.response = response;
    }

    /**
     * @return the word printed for this verdict in answer to check-sat.
     */
    public String getResponse() {
        return response;
    }
}
