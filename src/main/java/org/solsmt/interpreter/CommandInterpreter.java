package org.solsmt.interpreter;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.DeclarationTable;
import org.solsmt.core.ErrorKind;
import org.solsmt.core.SmtScriptException;
import org.solsmt.core.Sort;
import org.solsmt.core.SolSmtConfig;
import org.solsmt.expressions.ExpressionTranslator;
import org.solsmt.expressions.LogicalExpression;
import org.solsmt.parsing.CommentStripper;
import org.solsmt.parsing.ListReader;
import org.solsmt.parsing.Node;
import org.solsmt.symbolic.CheckResult;
import org.solsmt.symbolic.ConstraintSolver;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a script command by command against a {@link ConstraintSolver}.
 *
 * <p>Recognised commands: set-info, set-logic, set-option, declare-fun,
 * declare-const, define-fun (ignored), assert, check-sat, get-model and exit.
 * Anything else, and any malformed command, raises a
 * {@link SmtScriptException} and stops the run.</p>
 *
 * <p>Responses (sat / unsat / unknown, models) go to the output stream; all
 * diagnostics go through the logger.</p>
 */
public final class CommandInterpreter {

    private static final Logger logger = LoggerFactory.getLogger(CommandInterpreter.class);

    @Getter
    private final DeclarationTable declarations = new DeclarationTable();
    private final ConstraintSolver solver;
    private final PrintStream out;
    private final SolSmtConfig config;
    private final ExpressionTranslator translator;

    // Result of the latest check-sat, cleared by anything that changes the problem
    @Getter
    private Pair<CheckResult, Map<String, String>> lastCheck;

    public CommandInterpreter(ConstraintSolver solver, PrintStream out) {
        this(solver, out, SolSmtConfig.defaults());
    }

    public CommandInterpreter(ConstraintSolver solver, PrintStream out, SolSmtConfig config) {
        this.solver = Objects.requireNonNull(solver, "Solver cannot be null");
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.translator = new ExpressionTranslator(config);
    }

    /**
     * Strips comments from a script and executes its commands in order.
     * @param script script text.
     * @return how the run ended.
     * @throws SmtScriptException at the first fatal violation; earlier commands
     *     have already taken effect.
     */
    public RunOutcome run(String script) {
        ListReader reader = new ListReader(CommentStripper.strip(script), config);
        int count = 0;
        while (reader.hasRemaining()) {
            int start = reader.getPosition();
            Node command = reader.read();
            count++;
            logger.debug("got : {}", StringUtils.normalizeSpace(reader.slice(start, reader.getPosition())));
            logger.debug(" -> {}", command);
            if (!execute(command)) {
                logger.info("exit after {} command(s)", count);
                return RunOutcome.EXITED;
            }
        }
        logger.info("end of input after {} command(s)", count);
        return RunOutcome.END_OF_INPUT;
    }

    /**
     * Executes one top-level command.
     * @param command parsed command.
     * @return false if the command was (exit), true otherwise.
     */
    public boolean execute(Node command) {
        List<Node> items = command.match(
                atom -> {
                    throw fail(ErrorKind.MALFORMED_COMMAND, "Command must be a list, got '" + atom + "'");
                },
                Node.SList::getItems);
        if (items.isEmpty() || !items.get(0).isAtom()) {
            throw fail(ErrorKind.MALFORMED_COMMAND, "Command must start with a name: " + command);
        }
        String name = ((Node.Atom) items.get(0)).getText();
        switch (name) {
            case "set-info", "set-option" -> logger.debug("Ignoring {}", command);
            case "set-logic" -> logger.debug("Ignoring logic {}", items.size() > 1 ? items.get(1) : "");
            case "declare-fun" -> declareFun(items, command);
            case "declare-const" -> declareConst(items, command);
            case "define-fun" -> logger.info("Ignoring 'define-fun'");
            case "assert" -> assertTerm(items, command);
            case "check-sat" -> checkSat();
            case "get-model" -> printModel();
            case "exit" -> {
                return false;
            }
            default -> throw fail(ErrorKind.UNKNOWN_COMMAND, "Unknown instruction: " + name);
        }
        return true;
    }

    // (declare-fun name () Sort)
    private void declareFun(List<Node> items, Node command) {
        if (items.size() != 4) {
            throw fail(ErrorKind.MALFORMED_COMMAND, "declare-fun expects a name, () and a sort: " + command);
        }
        boolean noParameters = items.get(2).match(atom -> false, Node.SList::isEmpty);
        if (!noParameters) {
            throw fail(ErrorKind.MALFORMED_COMMAND,
                    "Only nullary declarations are supported, got parameters " + items.get(2));
        }
        declare(items.get(1), items.get(3), command);
    }

    // (declare-const name Sort)
    private void declareConst(List<Node> items, Node command) {
        if (items.size() != 3) {
            throw fail(ErrorKind.MALFORMED_COMMAND, "declare-const expects a name and a sort: " + command);
        }
        declare(items.get(1), items.get(2), command);
    }

    private void declare(Node nameNode, Node sortNode, Node command) {
        if (!nameNode.isAtom() || !sortNode.isAtom()) {
            throw fail(ErrorKind.MALFORMED_COMMAND, "Name and sort must be symbols: " + command);
        }
        String variable = ((Node.Atom) nameNode).getText();
        String sortName = ((Node.Atom) sortNode).getText();
        Sort sort = Sort.fromSmtName(sortName).orElseThrow(
                () -> fail(ErrorKind.UNSUPPORTED_SORT, "Unsupported sort " + sortName + " for " + variable));
        declarations.declare(variable, sort);
        solver.declareVariable(variable, sort);
        lastCheck = null;
        logger.info("Declared {} : {}", variable, sort);
    }

    private void assertTerm(List<Node> items, Node command) {
        if (items.size() != 2) {
            throw fail(ErrorKind.MALFORMED_COMMAND, "assert expects exactly one term: " + command);
        }
        LogicalExpression expression = translator.translate(items.get(1), declarations);
        logger.debug("Assertion: {}", expression);
        solver.addAssertion(expression);
        lastCheck = null;
    }

    private void checkSat() {
        lastCheck = solver.check(Set.of());
        CheckResult result = lastCheck.getLeft();
        logger.info("check-sat: {}", result);
        out.println(result.getResponse());
        out.flush();
    }

    private void printModel() {
        if (lastCheck == null || lastCheck.getLeft() != CheckResult.SATISFIABLE) {
            throw fail(ErrorKind.MODEL_UNAVAILABLE, "get-model needs a preceding sat answer");
        }
        out.println("(model");
        lastCheck.getRight().forEach((variable, value) -> {
            Sort sort = declarations.lookup(variable).orElse(Sort.REAL);
            out.println("  (define-fun " + variable + " () " + sort.getSmtName() + " " + value + ")");
        });
        out.println(")");
        out.flush();
    }

    private static SmtScriptException fail(ErrorKind kind, String message) {
        logger.error(message);
        return new SmtScriptException(kind, message);
    }
}
