package org.solsmt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.SmtScriptException;
import org.solsmt.core.SolSmtConfig;
import org.solsmt.interpreter.CommandInterpreter;
import org.solsmt.interpreter.RunOutcome;
import org.solsmt.symbolic.ConstraintSolver;
import org.solsmt.symbolic.Z3Solver;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Command line entry point: {@code solsmt <smtlib2 file>}.
 * Prints one line per check-sat on standard output; diagnostics go to
 * standard error.
 */
public final class SolSmt {

    private static final Logger logger = LoggerFactory.getLogger(SolSmt.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private SolSmt() {
        throw new AssertionError();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Z3Solver::new));
    }

    /**
     * Runs the tool.
     * @param args command line arguments; exactly one file path is expected.
     * @param out receives solver responses.
     * @param err receives the usage line and the final error message.
     * @param solverFactory creates the solver backend for this run.
     * @return the process exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err,
                          Supplier<? extends ConstraintSolver> solverFactory) {
        if (args.length != 1) {
            err.println("Usage: solsmt <smtlib2 file>");
            return EXIT_USAGE;
        }
        Path file = Path.of(args[0]);
        String script;
        try {
            script = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Cannot read {}", file, e);
            err.println("error: cannot read " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        SolSmtConfig config = SolSmtConfig.fromSystemProperties();
        try (ConstraintSolver solver = solverFactory.get()) {
            RunOutcome outcome = new CommandInterpreter(solver, out, config).run(script);
            logger.debug("{} finished: {}", file, outcome);
            return EXIT_OK;
        } catch (SmtScriptException e) {
            logger.error("Aborting {}: {}", file, e.toString());
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
