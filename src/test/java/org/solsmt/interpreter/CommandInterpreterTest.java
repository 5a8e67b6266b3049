package org.solsmt.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.solsmt.core.ErrorKind;
import org.solsmt.core.SmtScriptException;
import org.solsmt.core.Sort;
import org.solsmt.symbolic.CheckResult;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandInterpreterTest {

    private static final String NL = System.lineSeparator();

    /** Interpreter wired to a recording solver and an in-memory output. */
    private static final class Harness {
        final RecordingSolver solver;
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final CommandInterpreter interpreter;

        Harness(RecordingSolver solver) {
            this.solver = solver;
            this.interpreter = new CommandInterpreter(solver, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        }

        Harness(CheckResult verdict) {
            this(new RecordingSolver(verdict));
        }

        RunOutcome run(String script) {
            return interpreter.run(script);
        }

        ErrorKind failureOf(String script) {
            return assertThrows(SmtScriptException.class, () -> interpreter.run(script)).getKind();
        }

        String output() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("check-sat")
    class CheckSatTests {

        @Test
        @DisplayName("A satisfiable problem prints exactly sat")
        void testSat() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            RunOutcome outcome = h.run("(declare-fun x () Real)(assert (> x 0.0))(check-sat)");

            assertAll(
                    () -> assertEquals("sat" + NL, h.output()),
                    () -> assertEquals(RunOutcome.END_OF_INPUT, outcome),
                    () -> assertEquals(Map.of("x", Sort.REAL), h.solver.declared),
                    () -> assertEquals(1, h.solver.assertions.size()),
                    () -> assertEquals("(> x 0)", h.solver.assertions.get(0).toString()),
                    () -> assertEquals(1, h.solver.checks.size()),
                    () -> assertTrue(h.solver.checks.get(0).isEmpty(), "check-sat passes no assumptions")
            );
        }

        @Test
        void testUnsatAndUnknown() {
            Harness unsat = new Harness(CheckResult.UNSATISFIABLE);
            unsat.run("(check-sat)");
            assertEquals("unsat" + NL, unsat.output());

            Harness unknown = new Harness(CheckResult.UNKNOWN);
            unknown.run("(check-sat)\n(check-sat)\n");
            assertEquals("unknown" + NL + "unknown" + NL, unknown.output());
        }

        @Test
        @DisplayName("Assertions accumulate across checks")
        void testAssertionsAccumulate() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            h.run("(declare-fun p () Bool)(assert p)(check-sat)(assert (not p))(check-sat)");

            assertEquals(2, h.solver.assertions.size());
            assertEquals("sat" + NL + "sat" + NL, h.output());
        }
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        void testDeclareBoth() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            h.run("(declare-fun x () Real)\n(declare-fun b () Bool)\n(declare-const c Real)");

            assertEquals(Map.of("x", Sort.REAL, "b", Sort.BOOL, "c", Sort.REAL), h.solver.declared);
            assertEquals(Sort.BOOL, h.interpreter.getDeclarations().lookup("b").orElseThrow());
        }

        @Test
        @DisplayName("A parameter list holding only whitespace counts as empty")
        void testSpacedEmptyParameterList() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            h.run("(declare-fun x ( ) Real)\n(declare-fun p (\n) Bool)");

            assertEquals(Map.of("x", Sort.REAL, "p", Sort.BOOL), h.solver.declared);
        }

        @Test
        @DisplayName("An unsupported sort aborts instead of defaulting")
        void testUnsupportedSort() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(ErrorKind.UNSUPPORTED_SORT, h.failureOf("(declare-fun x () Int)"));
            assertTrue(h.solver.declared.isEmpty());
            assertEquals(0, h.interpreter.getDeclarations().size());
        }

        @Test
        @DisplayName("Functions with parameters are rejected")
        void testNonEmptyParameterList() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(ErrorKind.MALFORMED_COMMAND, h.failureOf("(declare-fun x (Int) Real)"));
            assertTrue(h.solver.declared.isEmpty());
        }

        @Test
        void testWrongDeclarationShape() {
            assertAll(
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND,
                            new Harness(CheckResult.SATISFIABLE).failureOf("(declare-fun x Real)")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND,
                            new Harness(CheckResult.SATISFIABLE).failureOf("(declare-fun x Bool Real)")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND,
                            new Harness(CheckResult.SATISFIABLE).failureOf("(declare-fun (x) () Real)")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND,
                            new Harness(CheckResult.SATISFIABLE).failureOf("(declare-const x () Real)"))
            );
        }

        @Test
        @DisplayName("Quoted names can be declared and used")
        void testQuotedName() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            h.run("(declare-fun |two words| () Bool)(assert |two words|)");
            assertEquals(Map.of("two words", Sort.BOOL), h.solver.declared);
        }
    }

    @Nested
    @DisplayName("Termination and errors")
    class TerminationTests {

        @Test
        @DisplayName("A comment followed by exit ends successfully without output")
        void testCommentThenExit() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(RunOutcome.EXITED, h.run("; a comment\n(exit)"));
            assertEquals("", h.output());
        }

        @Test
        @DisplayName("Nothing after exit is processed")
        void testExitStopsProcessing() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(RunOutcome.EXITED, h.run("(check-sat)(exit)(frobnicate)(check-sat)"));
            assertEquals("sat" + NL, h.output());
        }

        @Test
        @DisplayName("An unknown command aborts the run")
        void testUnknownCommand() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(ErrorKind.UNKNOWN_COMMAND, h.failureOf("(frobnicate)"));
        }

        @Test
        @DisplayName("Processing stops at the first error")
        void testStopsAtFirstError() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(ErrorKind.UNRESOLVED_VARIABLE,
                    h.failureOf("(declare-fun x () Real)(check-sat)(assert (> y 0.0))(check-sat)"));
            assertAll(
                    () -> assertEquals("sat" + NL, h.output()),
                    () -> assertEquals(1, h.solver.checks.size()),
                    () -> assertTrue(h.solver.assertions.isEmpty())
            );
        }

        @Test
        void testMalformedCommands() {
            assertAll(
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND, new Harness(CheckResult.SATISFIABLE).failureOf("exit")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND, new Harness(CheckResult.SATISFIABLE).failureOf("()")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND, new Harness(CheckResult.SATISFIABLE).failureOf(")")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND, new Harness(CheckResult.SATISFIABLE).failureOf("((exit))")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND, new Harness(CheckResult.SATISFIABLE).failureOf("(assert)")),
                    () -> assertEquals(ErrorKind.MALFORMED_COMMAND,
                            new Harness(CheckResult.SATISFIABLE).failureOf("(assert true false)"))
            );
        }

        @Test
        @DisplayName("Ignored commands have no effect")
        void testIgnoredCommands() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            RunOutcome outcome = h.run("(set-info :status sat)\n(set-logic QF_LRA)\n(set-option :produce-models true)\n"
                    + "(define-fun f ((a Real)) Real (+ a 1.0))\n");
            assertAll(
                    () -> assertEquals(RunOutcome.END_OF_INPUT, outcome),
                    () -> assertEquals("", h.output()),
                    () -> assertTrue(h.solver.declared.isEmpty()),
                    () -> assertTrue(h.solver.assertions.isEmpty())
            );
        }

        @Test
        void testEmptyScript() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(RunOutcome.END_OF_INPUT, h.run("  \n ; nothing here\n"));
        }
    }

    @Nested
    @DisplayName("get-model")
    class ModelTests {

        @Test
        void testModelAfterSat() {
            Harness h = new Harness(new RecordingSolver(CheckResult.SATISFIABLE, Map.of("x", "1")));
            h.run("(declare-fun x () Real)(assert (> x 0.0))(check-sat)(get-model)");
            assertEquals("sat" + NL + "(model" + NL + "  (define-fun x () Real 1)" + NL + ")" + NL, h.output());
        }

        @Test
        @DisplayName("get-model without a sat answer fails")
        void testModelWithoutSat() {
            assertEquals(ErrorKind.MODEL_UNAVAILABLE, new Harness(CheckResult.SATISFIABLE).failureOf("(get-model)"));
            assertEquals(ErrorKind.MODEL_UNAVAILABLE,
                    new Harness(CheckResult.UNSATISFIABLE).failureOf("(check-sat)(get-model)"));
        }

        @Test
        @DisplayName("A new assertion invalidates the previous model")
        void testAssertionInvalidatesModel() {
            Harness h = new Harness(CheckResult.SATISFIABLE);
            assertEquals(ErrorKind.MODEL_UNAVAILABLE,
                    h.failureOf("(declare-fun p () Bool)(check-sat)(assert p)(get-model)"));
        }
    }
}
